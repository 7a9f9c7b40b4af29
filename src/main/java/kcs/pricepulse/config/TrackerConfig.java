package kcs.pricepulse.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({ScraperProperties.class, TrackerProperties.class})
public class TrackerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
