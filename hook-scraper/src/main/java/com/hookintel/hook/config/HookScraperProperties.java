package com.hookintel.hook.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "hook-scraper")
@Data
public class HookScraperProperties {

    private Storage storage = new Storage();
    private Filter filter = new Filter();
    private HookSettings hook = new HookSettings();
    private Scrape scrape = new Scrape();
    private Browser browser = new Browser();
    private Output output = new Output();

    @Data
    public static class Storage {
        private String dataDir = "scraped_data";
        private String registryFile = "profiles.json";
        private String runLogFile = "scrape_runs.jsonl";
    }

    @Data
    public static class Filter {
        private long minLikes = 1000;
        private long minViews = 5000;
    }

    @Data
    public static class HookSettings {
        private int maxLength = 200;
        private int minSegmentLength = 3;

        // Clarity sub-score
        private int idealMinLength = 20;
        private int idealMaxLength = 120;
        private double lengthPenaltyPerChar = 0.02;
        private double noWordsPenalty = 0.2;

        // Engagement sub-score
        private long engagementCeiling = 100_000;

        private double clarityWeight = 0.5;
        private double engagementWeight = 0.5;

        private int topOpeningWords = 10;
    }

    @Data
    public static class Scrape {
        private int workers = 2;
        private int postLimit = 50;
        private Duration minDelay = Duration.ofSeconds(3);
        private Duration maxDelay = Duration.ofSeconds(10);
        private int retryAttempts = 3;
        private Duration retryWait = Duration.ofSeconds(4);
    }

    @Data
    public static class Browser {
        private BrowserType type = BrowserType.CHROME;
        private boolean headless = true;
        private Duration timeout = Duration.ofSeconds(30);
        private int windowWidth = 1920;
        private int windowHeight = 1080;
        private int maxScrolls = 10;
        private String profileUrlTemplate = "https://www.tiktok.com/@%s";

        public enum BrowserType {
            CHROME, FIREFOX
        }
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.JSON;
        private String defaultFile = "training_dataset.json";
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private boolean includeHeader = true;
        }

        public enum OutputMode {
            JSON, CSV, BOTH
        }
    }
}
