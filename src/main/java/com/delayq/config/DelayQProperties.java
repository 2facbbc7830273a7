package com.delayq.config;

import com.delayq.PriorityBounds;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;

@ConfigurationProperties(prefix = "delayq")
public class DelayQProperties {

    private final Database database = new Database();
    private final Worker worker = new Worker();

    public Database getDatabase() {
        return database;
    }

    public Worker getWorker() {
        return worker;
    }

    public static class Database {
        private String tablePrefix = "";
        private boolean skipCreate = false;
        private boolean failOnMigrationError = true;
        // Zone of the storage clock; also the zone "at" times of day are read in.
        private String timeZone = "UTC";

        public String getTablePrefix() {
            return tablePrefix;
        }

        public void setTablePrefix(String tablePrefix) {
            this.tablePrefix = tablePrefix;
        }

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

        public String getTimeZone() {
            return timeZone;
        }

        public void setTimeZone(String timeZone) {
            this.timeZone = timeZone;
        }
    }

    public static class Worker {
        private boolean enabled = true;
        private String name = defaultWorkerName();
        private Duration maxRunTime = Duration.ofHours(4);
        private Integer minPriority;
        private Integer maxPriority;
        private int readAhead = 5;
        private int maxAttempts = 25;
        private int maxJobsPerPoll = 100;
        private long pollIntervalInSeconds = 5;
        private String deleteFailedJobsAfter = "";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public Duration getMaxRunTime() {
            return maxRunTime;
        }

        public void setMaxRunTime(Duration maxRunTime) {
            this.maxRunTime = maxRunTime;
        }

        public Integer getMinPriority() {
            return minPriority;
        }

        public void setMinPriority(Integer minPriority) {
            this.minPriority = minPriority;
        }

        public Integer getMaxPriority() {
            return maxPriority;
        }

        public void setMaxPriority(Integer maxPriority) {
            this.maxPriority = maxPriority;
        }

        public PriorityBounds getPriorityBounds() {
            return new PriorityBounds(minPriority, maxPriority);
        }

        public int getReadAhead() {
            return readAhead;
        }

        public void setReadAhead(int readAhead) {
            this.readAhead = readAhead;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public int getMaxJobsPerPoll() {
            return maxJobsPerPoll;
        }

        public void setMaxJobsPerPoll(int maxJobsPerPoll) {
            this.maxJobsPerPoll = maxJobsPerPoll;
        }

        public long getPollIntervalInSeconds() {
            return pollIntervalInSeconds;
        }

        public void setPollIntervalInSeconds(long pollIntervalInSeconds) {
            this.pollIntervalInSeconds = pollIntervalInSeconds;
        }

        public String getDeleteFailedJobsAfter() {
            return deleteFailedJobsAfter;
        }

        public void setDeleteFailedJobsAfter(String deleteFailedJobsAfter) {
            this.deleteFailedJobsAfter = deleteFailedJobsAfter;
        }

        private static String defaultWorkerName() {
            String host;
            try {
                host = InetAddress.getLocalHost().getHostName();
            } catch (UnknownHostException e) {
                host = "localhost";
            }
            return "host:" + host + " pid:" + ProcessHandle.current().pid();
        }
    }
}
