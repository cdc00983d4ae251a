package com.caredirectory.providers.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "provider-directory")
@Data
public class ProviderDirectoryProperties {

    /** Records per persistence transaction and per snapshot read page. */
    private int batchSize = 500;

    private Feed feed = new Feed();
    private Snapshot snapshot = new Snapshot();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Feed {
        private String url = "https://opendata.mzcr.cz/data/nrpzs/narodni-registr-poskytovatelu-zdravotnich-sluzeb.csv";
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration requestTimeout = Duration.ofMinutes(10);
    }

    @Data
    public static class Snapshot {
        private String directory = "./data/snapshots";
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 2 2 * ?";
        private String zone = "Europe/Prague";
        private boolean runOnStartup = false;
    }
}
