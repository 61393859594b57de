package mailqueue.spring.boot;

import mailqueue.ConfigurationException;
import mailqueue.MailQueue;
import mailqueue.admission.SlidingWindowRateLimiter;
import mailqueue.dispatch.WorkerDispatcher;
import mailqueue.jdbc.store.AbstractJdbcJobStore;
import mailqueue.jdbc.store.JdbcJobStores;
import mailqueue.jdbc.store.JdbcStoreConfig;
import mailqueue.model.NewJob;
import mailqueue.retry.ExponentialBackoffRetryPolicy;
import mailqueue.retry.RetryPolicy;
import mailqueue.spi.JobStore;
import mailqueue.spi.MetricsExporter;
import mailqueue.transport.Transport;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.logging.Logger;

/**
 * Auto-configuration for the mail queue.
 *
 * <p>Creates a {@link JobStore} for the application's {@link DataSource} (dialect detected from
 * the JDBC URL), a {@link SlidingWindowRateLimiter} and a {@link MailQueue}. When a
 * {@link Transport} bean is present and {@code mailqueue.worker.enabled} is true, the queue is
 * built with a {@link WorkerDispatcher} and started; otherwise it only accepts submissions.
 * The queue never closes the store, transport or exporter beans it is given; the container
 * destroys them after the queue has drained.
 *
 * @see MailQueueProperties
 * @see MailQueueMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(MailQueue.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(MailQueueProperties.class)
public class MailQueueAutoConfiguration {
  private static final Logger logger = Logger.getLogger(MailQueueAutoConfiguration.class.getName());

  static final Duration MIN_BACKOFF = Duration.ofSeconds(60);
  static final Duration MAX_BACKOFF = Duration.ofSeconds(86_400);

  @Bean
  @ConditionalOnMissingBean(JobStore.class)
  public AbstractJdbcJobStore jobStore(DataSource dataSource, MailQueueProperties props) {
    int maxRetries = props.getRetry().getMaxRetries();
    if (maxRetries < NewJob.MIN_RETRIES || maxRetries > NewJob.MAX_RETRIES) {
      throw new ConfigurationException("mailqueue.retry.max-retries must be in ["
          + NewJob.MIN_RETRIES + ", " + NewJob.MAX_RETRIES + "], got: " + maxRetries);
    }
    JdbcStoreConfig config;
    try {
      config = JdbcStoreConfig.builder()
          .tableName(props.getTableName())
          .defaultMaxRetries(maxRetries)
          .maxAttempts(props.getStore().getMaxAttempts())
          .build();
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid mailqueue store configuration: " + e.getMessage(), e);
    }
    AbstractJdbcJobStore store = JdbcJobStores.create(dataSource, config);
    logger.info("Using " + store.name() + " job store on table " + config.tableName());
    return store;
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryPolicy mailQueueRetryPolicy(MailQueueProperties props) {
    Duration backoff = props.getRetry().getBackoff();
    if (backoff == null || backoff.compareTo(MIN_BACKOFF) < 0 || backoff.compareTo(MAX_BACKOFF) > 0) {
      throw new ConfigurationException(
          "mailqueue.retry.backoff must be between 60s and 86400s, got: " + backoff);
    }
    return new ExponentialBackoffRetryPolicy(backoff);
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "mailqueue.rate-limit", name = "enabled", matchIfMissing = true)
  public SlidingWindowRateLimiter mailQueueRateLimiter(MailQueueProperties props) {
    try {
      return new SlidingWindowRateLimiter(
          props.getRateLimit().getPerSecond(), props.getRateLimit().getPerMinute());
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid mailqueue.rate-limit configuration: " + e.getMessage(), e);
    }
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public MailQueue mailQueue(MailQueueProperties props,
      JobStore jobStore,
      RetryPolicy retryPolicy,
      ObjectProvider<Transport> transportProvider,
      ObjectProvider<SlidingWindowRateLimiter> rateLimiterProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    MetricsExporter metrics = metricsProvider.getIfAvailable();
    Transport transport = transportProvider.getIfAvailable();

    var builder = MailQueue.builder()
        .jobStore(jobStore)
        .rateLimiter(rateLimiterProvider.getIfAvailable())
        .metrics(metrics)
        .closeResources(false);

    if (transport != null && props.getWorker().isEnabled()) {
      MailQueueProperties.Worker worker = props.getWorker();
      WorkerDispatcher dispatcher;
      try {
        dispatcher = WorkerDispatcher.builder()
            .jobStore(jobStore)
            .transport(transport)
            .retryPolicy(retryPolicy)
            .metrics(metrics)
            .batchSize(worker.getBatchSize())
            .concurrency(worker.getConcurrency())
            .pollInterval(worker.getPollInterval())
            .deliveryTimeout(worker.getDeliveryTimeout())
            .drainTimeout(worker.getDrainTimeout())
            .closeResources(false)
            .build();
      } catch (IllegalArgumentException | NullPointerException e) {
        throw new ConfigurationException("Invalid mailqueue.worker configuration: " + e.getMessage(), e);
      }
      builder.dispatcher(dispatcher);
    } else if (transport == null) {
      logger.info("No Transport bean found; mail queue runs in submit-only mode");
    }

    MailQueue queue = builder.build();
    queue.start();
    return queue;
  }
}
