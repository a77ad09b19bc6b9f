package com.delta.notifier.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notifier")
public class NotifierProperties {
    private static final String DEFAULT_USER_AGENT = "delta-listing-notifier/0.1 (+contact)";
    private static final String DEFAULT_SOURCE_URL =
        "https://raw.githubusercontent.com/SimplifyJobs/Summer2025-Internships/master/README.md";

    private Source source = new Source();
    private Defaults defaults = new Defaults();
    private Delivery delivery = new Delivery();
    private OnDemand onDemand = new OnDemand();
    private Scheduler scheduler = new Scheduler();

    public Source getSource() {
        return source;
    }

    public void setSource(Source source) {
        this.source = source;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public void setDelivery(Delivery delivery) {
        this.delivery = delivery;
    }

    public OnDemand getOnDemand() {
        return onDemand;
    }

    public void setOnDemand(OnDemand onDemand) {
        this.onDemand = onDemand;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Source {
        private String url = DEFAULT_SOURCE_URL;
        private String userAgent;
        private int requestTimeoutSeconds = 20;
        private int requestMaxRetries = 2;
        private int requestRetryBaseDelayMs = 500;
        private int requestRetryMaxDelayMs = 5000;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getRequestMaxRetries() {
            return Math.max(0, requestMaxRetries);
        }

        public void setRequestMaxRetries(int requestMaxRetries) {
            this.requestMaxRetries = Math.max(0, requestMaxRetries);
        }

        public int getRequestRetryBaseDelayMs() {
            return Math.max(0, requestRetryBaseDelayMs);
        }

        public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
            this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
        }

        public int getRequestRetryMaxDelayMs() {
            return Math.max(0, requestRetryMaxDelayMs);
        }

        public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
            this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
        }
    }

    public static class Defaults {
        private String notifyTime = "09:00";
        private int repeatIntervalHours = 24;

        public String getNotifyTime() {
            return notifyTime;
        }

        public void setNotifyTime(String notifyTime) {
            this.notifyTime = notifyTime;
        }

        public int getRepeatIntervalHours() {
            return Math.max(1, repeatIntervalHours);
        }

        public void setRepeatIntervalHours(int repeatIntervalHours) {
            this.repeatIntervalHours = Math.max(1, repeatIntervalHours);
        }
    }

    public static class Delivery {
        private int maxMessageChars = 4000;
        private int workerCount = 4;

        public int getMaxMessageChars() {
            return Math.max(1, maxMessageChars);
        }

        public void setMaxMessageChars(int maxMessageChars) {
            this.maxMessageChars = Math.max(1, maxMessageChars);
        }

        public int getWorkerCount() {
            return Math.max(1, workerCount);
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = Math.max(1, workerCount);
        }
    }

    public static class OnDemand {
        /** Upper bound for a single on-demand request; configuration can lower it but not raise it. */
        public static final int HARD_MAX_COUNT = 50;

        private int defaultCount = 5;
        private int maxCount = HARD_MAX_COUNT;

        public int getDefaultCount() {
            return Math.min(getMaxCount(), Math.max(1, defaultCount));
        }

        public void setDefaultCount(int defaultCount) {
            this.defaultCount = Math.max(1, defaultCount);
        }

        public int getMaxCount() {
            return clampMaxCount(maxCount);
        }

        public void setMaxCount(int maxCount) {
            this.maxCount = clampMaxCount(maxCount);
        }

        private static int clampMaxCount(int value) {
            return Math.min(HARD_MAX_COUNT, Math.max(1, value));
        }
    }

    public static class Scheduler {
        private boolean restoreOnStartup = true;
        private int poolSize = 2;

        public boolean isRestoreOnStartup() {
            return restoreOnStartup;
        }

        public void setRestoreOnStartup(boolean restoreOnStartup) {
            this.restoreOnStartup = restoreOnStartup;
        }

        public int getPoolSize() {
            return Math.max(1, poolSize);
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = Math.max(1, poolSize);
        }
    }
}
