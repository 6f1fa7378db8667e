package com.ijp.lifecycle.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "lifecycle")
public class LifecycleProperties {
    private static final String DEFAULT_LOCK_NAME = "expiry-sweep";

    private Policy policy = new Policy();
    private Reactivation reactivation = new Reactivation();
    private Sweeper sweeper = new Sweeper();
    private Preview preview = new Preview();

    public Policy getPolicy() {
        return policy;
    }

    public void setPolicy(Policy policy) {
        this.policy = policy;
    }

    public Reactivation getReactivation() {
        return reactivation;
    }

    public void setReactivation(Reactivation reactivation) {
        this.reactivation = reactivation;
    }

    public Sweeper getSweeper() {
        return sweeper;
    }

    public void setSweeper(Sweeper sweeper) {
        this.sweeper = sweeper;
    }

    public Preview getPreview() {
        return preview;
    }

    public void setPreview(Preview preview) {
        this.preview = preview;
    }

    public static String normalizeLockName(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_LOCK_NAME;
        }
        return candidate.trim();
    }

    public static class Policy {
        private int defaultMaxJobDeadlineDays = 90;
        private int defaultArchiveDeletionDays = 90;
        private boolean defaultAutoArchiveExpired = true;
        private int minDays = 1;
        private int maxDays = 365;

        public int getDefaultMaxJobDeadlineDays() {
            return clampDays(defaultMaxJobDeadlineDays);
        }

        public void setDefaultMaxJobDeadlineDays(int defaultMaxJobDeadlineDays) {
            this.defaultMaxJobDeadlineDays = defaultMaxJobDeadlineDays;
        }

        public int getDefaultArchiveDeletionDays() {
            return clampDays(defaultArchiveDeletionDays);
        }

        public void setDefaultArchiveDeletionDays(int defaultArchiveDeletionDays) {
            this.defaultArchiveDeletionDays = defaultArchiveDeletionDays;
        }

        public boolean isDefaultAutoArchiveExpired() {
            return defaultAutoArchiveExpired;
        }

        public void setDefaultAutoArchiveExpired(boolean defaultAutoArchiveExpired) {
            this.defaultAutoArchiveExpired = defaultAutoArchiveExpired;
        }

        public int getMinDays() {
            return Math.max(1, minDays);
        }

        public void setMinDays(int minDays) {
            this.minDays = Math.max(1, minDays);
        }

        public int getMaxDays() {
            return Math.max(getMinDays(), maxDays);
        }

        public void setMaxDays(int maxDays) {
            this.maxDays = maxDays;
        }

        public boolean isWithinBounds(int days) {
            return days >= getMinDays() && days <= getMaxDays();
        }

        private int clampDays(int days) {
            return Math.min(getMaxDays(), Math.max(getMinDays(), days));
        }
    }

    public static class Reactivation {
        private int windowDays = 30;

        public int getWindowDays() {
            return Math.max(1, windowDays);
        }

        public void setWindowDays(int windowDays) {
            this.windowDays = Math.max(1, windowDays);
        }
    }

    public static class Sweeper {
        private boolean enabled = true;
        private boolean runOnStartup = true;
        private long intervalMs = 300_000L;
        private long initialDelayMs = 60_000L;
        private int batchSize = 200;
        private String lockName = DEFAULT_LOCK_NAME;
        private long lockTtlSeconds = 900L;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isRunOnStartup() {
            return runOnStartup;
        }

        public void setRunOnStartup(boolean runOnStartup) {
            this.runOnStartup = runOnStartup;
        }

        public long getIntervalMs() {
            return Math.max(1_000L, intervalMs);
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public long getInitialDelayMs() {
            return Math.max(0L, initialDelayMs);
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public String getLockName() {
            return normalizeLockName(lockName);
        }

        public void setLockName(String lockName) {
            this.lockName = normalizeLockName(lockName);
        }

        public long getLockTtlSeconds() {
            return Math.max(1L, lockTtlSeconds);
        }

        public void setLockTtlSeconds(long lockTtlSeconds) {
            this.lockTtlSeconds = Math.max(1L, lockTtlSeconds);
        }
    }

    public static class Preview {
        private int sampleLimit = 20;

        public int getSampleLimit() {
            return Math.max(1, sampleLimit);
        }

        public void setSampleLimit(int sampleLimit) {
            this.sampleLimit = Math.max(1, sampleLimit);
        }
    }
}
