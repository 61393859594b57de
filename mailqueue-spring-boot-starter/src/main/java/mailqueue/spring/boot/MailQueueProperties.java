package mailqueue.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the mail queue.
 *
 * @see MailQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "mailqueue")
public class MailQueueProperties {

    /**
     * Database table name for queued jobs.
     */
    private String tableName = "email_queue";

    private final Worker worker = new Worker();
    private final Retry retry = new Retry();
    private final Store store = new Store();
    private final RateLimit rateLimit = new RateLimit();
    private final Metrics metrics = new Metrics();

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public Worker getWorker() {
        return worker;
    }

    public Retry getRetry() {
        return retry;
    }

    public Store getStore() {
        return store;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Worker {
        /**
         * Whether this instance delivers jobs. Requires a Transport bean.
         */
        private boolean enabled = true;

        /**
         * Maximum number of jobs claimed per poll cycle (1..1000).
         */
        private int batchSize = 50;

        /**
         * Sleep between poll cycles when nothing is due.
         */
        private Duration pollInterval = Duration.ofSeconds(10);

        /**
         * Maximum number of deliveries in flight.
         */
        private int concurrency = 5;

        /**
         * Upper bound on a single delivery; exceeding it counts as a transient failure.
         */
        private Duration deliveryTimeout = Duration.ofSeconds(30);

        /**
         * Time allowed for in-flight deliveries to finish on shutdown.
         */
        private Duration drainTimeout = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public Duration getDeliveryTimeout() {
            return deliveryTimeout;
        }

        public void setDeliveryTimeout(Duration deliveryTimeout) {
            this.deliveryTimeout = deliveryTimeout;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }
    }

    public static class Retry {
        /**
         * Default retry budget for jobs submitted without one (1..10).
         */
        private int maxRetries = 3;

        /**
         * Base delay of the exponential backoff (60s..86400s).
         */
        private Duration backoff = Duration.ofSeconds(300);

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getBackoff() {
            return backoff;
        }

        public void setBackoff(Duration backoff) {
            this.backoff = backoff;
        }
    }

    public static class Store {
        /**
         * Attempts per store operation before a transient connectivity failure is raised.
         */
        private int maxAttempts = 2;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class RateLimit {
        /**
         * Whether per-client admission limiting is applied to submissions.
         */
        private boolean enabled = true;

        /**
         * Submissions admitted per client in any one-second window.
         */
        private int perSecond = 10;

        /**
         * Submissions admitted per client in any sixty-second window.
         */
        private int perMinute = 60;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPerSecond() {
            return perSecond;
        }

        public void setPerSecond(int perSecond) {
            this.perSecond = perSecond;
        }

        public int getPerMinute() {
            return perMinute;
        }

        public void setPerMinute(int perMinute) {
            this.perMinute = perMinute;
        }
    }

    public static class Metrics {
        /**
         * Whether to register Micrometer meters when Micrometer is on the classpath.
         */
        private boolean enabled = true;

        /**
         * Prefix for all meter names.
         */
        private String namePrefix = "mailqueue";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
