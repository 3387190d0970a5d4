package com.bhavyahealth.fetcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "bhavya-fetcher")
@Data
public class HealthFetcherProperties {

    private Api api = new Api();
    private Fetch fetch = new Fetch();
    private Storage storage = new Storage();
    private Output output = new Output();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Api {
        private String baseUrl = "https://bipard.bhavyabiharhealth.in/api/bhavya";
        private String secretKey;
        private String clientKey;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration callTimeout = Duration.ofSeconds(10);   // per attempt
        private Duration hardCeiling = Duration.ofSeconds(30);   // per call, retries included
    }

    @Data
    public static class Fetch {
        private String zone = "Asia/Kolkata";
        private int endpointConcurrency = 8;
        private int dateConcurrency = 1;
        private int bufferSize = 64;
        private boolean recheckBeforeFetch = true;
        private int maxRangeDays = 366;
        private Duration sseTimeout = Duration.ofMinutes(30);
    }

    @Data
    public static class Storage {
        private String tableName = "bhavya_realtime_health__report_data";
        private boolean ensureSchemaOnStartup = true;
    }

    @Data
    public static class Output {
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private boolean enabled = false;
            private String outputDir = "/data/output";
            private boolean includeHeader = true;
        }
    }

    @Data
    public static class Scheduling {
        private boolean enabled = false;
        private String cron = "0 30 23 * * *";
        private boolean runOnStartup = false;
    }
}
