package bbt.tao.conversation.service.client;

import bbt.tao.conversation.exception.UpstreamException;
import bbt.tao.conversation.exception.UpstreamException.Kind;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps transport and Spring AI failures onto {@link UpstreamException} kinds.
 */
public final class UpstreamErrors {

    // Spring AI reports HTTP failures as "<status> - <body>"
    private static final Pattern LEADING_STATUS = Pattern.compile("^\\s*(\\d{3})\\s+-");

    private UpstreamErrors() {
    }

    public static UpstreamException translate(Throwable error) {
        if (error instanceof UpstreamException upstream) {
            return upstream;
        }
        Kind kind = classify(error);
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new UpstreamException(kind, message, error);
    }

    static Kind classify(Throwable error) {
        if (error instanceof WebClientResponseException ex) {
            return fromStatus(ex.getStatusCode().value());
        }
        if (error instanceof RestClientResponseException ex) {
            return fromStatus(ex.getStatusCode().value());
        }
        if (error instanceof NonTransientAiException || error instanceof TransientAiException) {
            Matcher matcher = LEADING_STATUS.matcher(String.valueOf(error.getMessage()));
            if (matcher.find()) {
                return fromStatus(Integer.parseInt(matcher.group(1)));
            }
            return error instanceof TransientAiException ? Kind.SERVER : Kind.UNKNOWN;
        }
        if (error instanceof WebClientRequestException
                || error instanceof ResourceAccessException
                || error instanceof TimeoutException
                || hasCause(error, IOException.class)) {
            return Kind.NETWORK;
        }
        return Kind.UNKNOWN;
    }

    static Kind fromStatus(int status) {
        if (status == 401 || status == 403) {
            return Kind.AUTHENTICATION;
        }
        if (status == 429) {
            return Kind.RATE_LIMIT;
        }
        if (status >= 500) {
            return Kind.SERVER;
        }
        return Kind.UNKNOWN;
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
