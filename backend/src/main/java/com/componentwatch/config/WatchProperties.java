package com.componentwatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "watch")
public class WatchProperties {
    private static final String DEFAULT_CONFIG_PATH = "config_components.json";

    private String configPath;
    private Crawl crawl = new Crawl();
    private Render render = new Render();
    private Digest digest = new Digest();
    private Api api = new Api();
    private Cli cli = new Cli();

    public String getConfigPath() {
        return normalizeConfigPath(configPath);
    }

    public void setConfigPath(String configPath) {
        this.configPath = normalizeConfigPath(configPath);
    }

    public Crawl getCrawl() {
        return crawl;
    }

    public void setCrawl(Crawl crawl) {
        this.crawl = crawl;
    }

    public Render getRender() {
        return render;
    }

    public void setRender(Render render) {
        this.render = render;
    }

    public Digest getDigest() {
        return digest;
    }

    public void setDigest(Digest digest) {
        this.digest = digest;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeConfigPath(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_CONFIG_PATH;
        }
        return candidate.trim();
    }

    public static class Crawl {
        private int maxWorkers = 0;
        private boolean alertOnRenderError = false;

        /**
         * Worker pool size for a run. Zero or less means one worker per configured target.
         */
        public int getMaxWorkers() {
            return Math.max(0, maxWorkers);
        }

        public void setMaxWorkers(int maxWorkers) {
            this.maxWorkers = Math.max(0, maxWorkers);
        }

        public int resolveWorkerCount(int targetCount) {
            int configured = getMaxWorkers();
            if (configured > 0) {
                return configured;
            }
            return Math.max(1, targetCount);
        }

        public boolean isAlertOnRenderError() {
            return alertOnRenderError;
        }

        public void setAlertOnRenderError(boolean alertOnRenderError) {
            this.alertOnRenderError = alertOnRenderError;
        }
    }

    public static class Render {
        private boolean headless = true;
        private int timeoutMs = 30000;
        private int setupTimeoutMs = 5000;
        private int addToCartTimeoutMs = 6000;
        private int scrollStepPx = 100;
        private int scrollIntervalMs = 60;
        private int settleMs = 1000;

        public boolean isHeadless() {
            return headless;
        }

        public void setHeadless(boolean headless) {
            this.headless = headless;
        }

        public int getTimeoutMs() {
            return Math.max(1000, timeoutMs);
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = Math.max(1000, timeoutMs);
        }

        public int getSetupTimeoutMs() {
            return Math.max(1000, setupTimeoutMs);
        }

        public void setSetupTimeoutMs(int setupTimeoutMs) {
            this.setupTimeoutMs = Math.max(1000, setupTimeoutMs);
        }

        public int getAddToCartTimeoutMs() {
            return Math.max(1000, addToCartTimeoutMs);
        }

        public void setAddToCartTimeoutMs(int addToCartTimeoutMs) {
            this.addToCartTimeoutMs = Math.max(1000, addToCartTimeoutMs);
        }

        public int getScrollStepPx() {
            return Math.max(1, scrollStepPx);
        }

        public void setScrollStepPx(int scrollStepPx) {
            this.scrollStepPx = Math.max(1, scrollStepPx);
        }

        public int getScrollIntervalMs() {
            return Math.max(1, scrollIntervalMs);
        }

        public void setScrollIntervalMs(int scrollIntervalMs) {
            this.scrollIntervalMs = Math.max(1, scrollIntervalMs);
        }

        public int getSettleMs() {
            return Math.max(0, settleMs);
        }

        public void setSettleMs(int settleMs) {
            this.settleMs = Math.max(0, settleMs);
        }
    }

    public static class Digest {
        private int windowHours = 24;
        private String webhookUrl;
        private int webhookTimeoutSeconds = 10;

        public int getWindowHours() {
            return Math.max(1, windowHours);
        }

        public void setWindowHours(int windowHours) {
            this.windowHours = Math.max(1, windowHours);
        }

        public String getWebhookUrl() {
            return webhookUrl == null || webhookUrl.isBlank() ? null : webhookUrl.trim();
        }

        public void setWebhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
        }

        public int getWebhookTimeoutSeconds() {
            return Math.max(1, webhookTimeoutSeconds);
        }

        public void setWebhookTimeoutSeconds(int webhookTimeoutSeconds) {
            this.webhookTimeoutSeconds = Math.max(1, webhookTimeoutSeconds);
        }
    }

    public static class Api {
        private int defaultAlertLimit = 50;
        private int maxAlertLimit = 500;

        public int getDefaultAlertLimit() {
            return Math.max(1, defaultAlertLimit);
        }

        public void setDefaultAlertLimit(int defaultAlertLimit) {
            this.defaultAlertLimit = Math.max(1, defaultAlertLimit);
        }

        public int getMaxAlertLimit() {
            return Math.max(1, maxAlertLimit);
        }

        public void setMaxAlertLimit(int maxAlertLimit) {
            this.maxAlertLimit = Math.max(1, maxAlertLimit);
        }
    }

    public static class Cli {
        private boolean run;
        private boolean sendDigest = false;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isSendDigest() {
            return sendDigest;
        }

        public void setSendDigest(boolean sendDigest) {
            this.sendDigest = sendDigest;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
