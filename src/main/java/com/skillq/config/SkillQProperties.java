package com.skillq.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "skillq")
public class SkillQProperties {

    private final Database database = new Database();
    private final Jobs jobs = new Jobs();
    private final Worker worker = new Worker();
    private final Reaper reaper = new Reaper();
    private final Skills skills = new Skills();
    private final Alerts alerts = new Alerts();
    private final Api api = new Api();

    public Database getDatabase() {
        return database;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public Worker getWorker() {
        return worker;
    }

    public Reaper getReaper() {
        return reaper;
    }

    public Skills getSkills() {
        return skills;
    }

    public Alerts getAlerts() {
        return alerts;
    }

    public Api getApi() {
        return api;
    }

    public static class Database {
        private boolean skipCreate = false;
        private boolean failOnMigrationError = true;

        public boolean isSkipCreate() {
            return skipCreate;
        }

        public void setSkipCreate(boolean skipCreate) {
            this.skipCreate = skipCreate;
        }

        public boolean isFailOnMigrationError() {
            return failOnMigrationError;
        }

        public void setFailOnMigrationError(boolean failOnMigrationError) {
            this.failOnMigrationError = failOnMigrationError;
        }
    }

    public static class Jobs {
        private int defaultMaxRetries = 3;
        private Duration retryBaseDelay = Duration.ofMinutes(1);
        private Duration retryMaxDelay = Duration.ofMinutes(30);

        public int getDefaultMaxRetries() {
            return defaultMaxRetries;
        }

        public void setDefaultMaxRetries(int defaultMaxRetries) {
            this.defaultMaxRetries = defaultMaxRetries;
        }

        public Duration getRetryBaseDelay() {
            return retryBaseDelay;
        }

        public void setRetryBaseDelay(Duration retryBaseDelay) {
            this.retryBaseDelay = retryBaseDelay;
        }

        public Duration getRetryMaxDelay() {
            return retryMaxDelay;
        }

        public void setRetryMaxDelay(Duration retryMaxDelay) {
            this.retryMaxDelay = retryMaxDelay;
        }
    }

    public static class Worker {
        private boolean enabled = true;
        private int workerCount = Math.max(2, Runtime.getRuntime().availableProcessors());
        private long pollIntervalInSeconds = 5;
        private String deleteSucceededJobsAfter = "36h";
        private String deleteFailedJobsAfter = "72h";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public long getPollIntervalInSeconds() {
            return pollIntervalInSeconds;
        }

        public void setPollIntervalInSeconds(long pollIntervalInSeconds) {
            this.pollIntervalInSeconds = pollIntervalInSeconds;
        }

        public String getDeleteSucceededJobsAfter() {
            return deleteSucceededJobsAfter;
        }

        public void setDeleteSucceededJobsAfter(String deleteSucceededJobsAfter) {
            this.deleteSucceededJobsAfter = deleteSucceededJobsAfter;
        }

        public String getDeleteFailedJobsAfter() {
            return deleteFailedJobsAfter;
        }

        public void setDeleteFailedJobsAfter(String deleteFailedJobsAfter) {
            this.deleteFailedJobsAfter = deleteFailedJobsAfter;
        }
    }

    public static class Reaper {
        private boolean enabled = true;
        private Duration stuckThreshold = Duration.ofMinutes(30);
        private int batchSize = 50;
        private long intervalInSeconds = 60;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getStuckThreshold() {
            return stuckThreshold;
        }

        public void setStuckThreshold(Duration stuckThreshold) {
            this.stuckThreshold = stuckThreshold;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getIntervalInSeconds() {
            return intervalInSeconds;
        }

        public void setIntervalInSeconds(long intervalInSeconds) {
            this.intervalInSeconds = intervalInSeconds;
        }
    }

    public static class Skills {
        private Duration configCacheTtl = Duration.ofMinutes(5);

        public Duration getConfigCacheTtl() {
            return configCacheTtl;
        }

        public void setConfigCacheTtl(Duration configCacheTtl) {
            this.configCacheTtl = configCacheTtl;
        }
    }

    public static class Alerts {
        private boolean enabled = true;
        private double errorRateThreshold = 10.0;
        private long checkIntervalInSeconds = 300;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getErrorRateThreshold() {
            return errorRateThreshold;
        }

        public void setErrorRateThreshold(double errorRateThreshold) {
            this.errorRateThreshold = errorRateThreshold;
        }

        public long getCheckIntervalInSeconds() {
            return checkIntervalInSeconds;
        }

        public void setCheckIntervalInSeconds(long checkIntervalInSeconds) {
            this.checkIntervalInSeconds = checkIntervalInSeconds;
        }
    }

    public static class Api {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
