package bbt.tao.conversation.service;

import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Asynchronous per-conversation mutual exclusion. Work submitted for the same conversation runs
 * one at a time in subscription order; work for different conversations never waits.
 * A holder releases on complete, error or cancel. A caller cancelled while still waiting
 * hands its turn over only after its predecessor has released.
 */
@Component
public class ConversationLocks {

    private final ConcurrentMap<UUID, Mono<Void>> tails = new ConcurrentHashMap<>();

    public <T> Mono<T> withLock(UUID conversationId, Supplier<Mono<T>> work) {
        return Mono.defer(() -> {
            Lease lease = acquire(conversationId);
            return lease.turn
                    .then(Mono.defer(work))
                    .doFinally(signal -> lease.release());
        });
    }

    public <T> Flux<T> streamWithLock(UUID conversationId, Supplier<Flux<T>> work) {
        return Flux.defer(() -> {
            Lease lease = acquire(conversationId);
            return lease.turn
                    .thenMany(Flux.defer(work))
                    .doFinally(signal -> lease.release());
        });
    }

    int activeConversations() {
        return tails.size();
    }

    private Lease acquire(UUID conversationId) {
        Sinks.Empty<Void> released = Sinks.empty();
        Mono<Void> tail = released.asMono();
        AtomicReference<Mono<Void>> previous = new AtomicReference<>(Mono.empty());
        tails.compute(conversationId, (id, current) -> {
            if (current != null) {
                previous.set(current);
            }
            return tail;
        });
        return new Lease(conversationId, previous.get(), released, tail);
    }

    private final class Lease {
        private final UUID conversationId;
        private final Mono<Void> turn;
        private final Sinks.Empty<Void> released;
        private final Mono<Void> tail;

        private Lease(UUID conversationId, Mono<Void> turn, Sinks.Empty<Void> released, Mono<Void> tail) {
            this.conversationId = conversationId;
            this.turn = turn;
            this.released = released;
            this.tail = tail;
        }

        private void release() {
            turn.doFinally(signal -> {
                        released.tryEmitEmpty();
                        tails.remove(conversationId, tail);
                    })
                    .subscribe();
        }
    }
}
