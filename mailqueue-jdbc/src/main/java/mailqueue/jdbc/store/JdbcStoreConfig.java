package mailqueue.jdbc.store;

import mailqueue.jdbc.TableNames;
import mailqueue.model.NewJob;
import mailqueue.util.JsonCodec;

import java.time.Clock;
import java.util.Objects;

/**
 * Settings shared by all JDBC job stores. Create via {@link #builder()}; {@link #defaults()}
 * returns the documented defaults.
 */
public final class JdbcStoreConfig {
  private static final JdbcStoreConfig DEFAULTS = builder().build();

  private final String tableName;
  private final Clock clock;
  private final int defaultMaxRetries;
  private final int maxAttempts;
  private final JsonCodec jsonCodec;

  private JdbcStoreConfig(Builder builder) {
    this.tableName = TableNames.validate(builder.tableName);
    this.clock = Objects.requireNonNull(builder.clock, "clock");
    this.jsonCodec = Objects.requireNonNull(builder.jsonCodec, "jsonCodec");
    if (builder.defaultMaxRetries < NewJob.MIN_RETRIES || builder.defaultMaxRetries > NewJob.MAX_RETRIES) {
      throw new IllegalArgumentException("defaultMaxRetries must be in " + NewJob.MIN_RETRIES + ".."
          + NewJob.MAX_RETRIES + ", got: " + builder.defaultMaxRetries);
    }
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + builder.maxAttempts);
    }
    this.defaultMaxRetries = builder.defaultMaxRetries;
    this.maxAttempts = builder.maxAttempts;
  }

  public static JdbcStoreConfig defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String tableName() {
    return tableName;
  }

  public Clock clock() {
    return clock;
  }

  public int defaultMaxRetries() {
    return defaultMaxRetries;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public JsonCodec jsonCodec() {
    return jsonCodec;
  }

  /** Builder for {@link JdbcStoreConfig}. */
  public static final class Builder {
    private String tableName = TableNames.DEFAULT_TABLE;
    private Clock clock = Clock.systemUTC();
    private int defaultMaxRetries = NewJob.DEFAULT_MAX_RETRIES;
    private int maxAttempts = 2;
    private JsonCodec jsonCodec = JsonCodec.getDefault();

    private Builder() {}

    /**
     * Optional. Defaults to {@code email_queue}. Must be a plain SQL identifier.
     *
     * @param tableName the job table
     * @return this builder
     */
    public Builder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    /**
     * Sets the clock used for due-time comparisons and timestamps.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the retry budget stored with jobs that do not specify one.
     *
     * <p>Optional. Defaults to {@code 3}. Must be in {@code 1..10}.
     *
     * @param defaultMaxRetries default retry budget
     * @return this builder
     */
    public Builder defaultMaxRetries(int defaultMaxRetries) {
      this.defaultMaxRetries = defaultMaxRetries;
      return this;
    }

    /**
     * Sets how many times an operation is attempted when it fails with a connectivity error.
     *
     * <p>Optional. Defaults to {@code 2}. Must be &ge; 1.
     *
     * @param maxAttempts attempts per store operation
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Optional. Defaults to {@link JsonCodec#getDefault()}.
     *
     * @param jsonCodec codec for address lists, metadata and template variables
     * @return this builder
     */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    public JdbcStoreConfig build() {
      return new JdbcStoreConfig(this);
    }
  }
}
