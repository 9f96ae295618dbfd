package bbt.tao.conversation.conf;

import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(ConversationProperties.class)
public class AppConfig {
    @Bean
    public Clock systemClock() {
        return Clock.system(ZoneId.systemDefault());
    }

    @Bean
    public Ticker cacheTicker() {
        return Ticker.systemTicker();
    }
}
