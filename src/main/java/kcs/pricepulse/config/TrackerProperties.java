package kcs.pricepulse.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {

    private Jobs jobs = new Jobs();

    private Workers workers = new Workers();

    private Notification notification = new Notification();

    @Getter
    @Setter
    public static class Jobs {

        private Duration pricePeriod = Duration.ofHours(1);

        /** Comparison period = price period x this multiple. */
        private int comparisonMultiple = 6;

        private int retentionDays = 30;

        private String retentionCron = "0 0 0 * * *";

        private Duration livenessPeriod = Duration.ofMinutes(30);

        public Duration comparisonPeriod() {
            return pricePeriod.multipliedBy(comparisonMultiple);
        }
    }

    @Getter
    @Setter
    public static class Workers {

        private int corePoolSize = 2;

        private int maxPoolSize = 4;

        private int queueCapacity = 100;

        private int awaitTerminationSeconds = 30;
    }

    @Getter
    @Setter
    public static class Notification {

        /** Sender address; mail is skipped when blank. */
        private String from;

        private String currencySymbol = "₹";
    }
}
