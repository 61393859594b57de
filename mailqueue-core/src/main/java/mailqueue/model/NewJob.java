package mailqueue.model;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable submission of a message for asynchronous delivery.
 *
 * <p>Each submission carries a {@code messageId}. A caller-supplied id acts as an idempotency
 * token: submitting the same id twice yields the same job. When absent, a monotonic ULID is
 * generated. Use the {@linkplain Builder builder} to create instances.
 *
 * @see mailqueue.spi.JobStore#enqueue(NewJob)
 */
public final class NewJob {
    public static final String DEFAULT_MESSAGE_TYPE = "transactional";
    public static final int DEFAULT_PRIORITY = 5;
    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 10;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int MIN_RETRIES = 1;
    public static final int MAX_RETRIES = 10;
    private static final int MAX_MESSAGE_ID_LENGTH = 128;

    private final String messageId;
    private final boolean callerSuppliedId;
    private final String messageType;
    private final Recipients recipients;
    private final MessageContent content;
    private final Map<String, String> metadata;
    private final int priority;
    private final Instant scheduledFor;
    private final Integer maxRetries;

    private NewJob(Builder builder) {
        this.callerSuppliedId = builder.messageId != null;
        this.messageId = callerSuppliedId ? builder.messageId : UlidCreator.getMonotonicUlid().toString();
        if (messageId.isBlank() || messageId.length() > MAX_MESSAGE_ID_LENGTH) {
            throw new IllegalArgumentException(
                    "messageId must be 1.." + MAX_MESSAGE_ID_LENGTH + " non-blank characters");
        }
        this.messageType = builder.messageType == null ? DEFAULT_MESSAGE_TYPE : builder.messageType;
        this.recipients = Objects.requireNonNull(builder.recipients, "recipients");
        this.content = Objects.requireNonNull(builder.content, "content");

        Map<String, String> metadataCopy = builder.metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        if (metadataCopy.containsKey(null) || metadataCopy.containsValue(null)) {
            throw new IllegalArgumentException("metadata cannot contain null keys or values");
        }
        this.metadata = metadataCopy;

        if (builder.priority < MIN_PRIORITY || builder.priority > MAX_PRIORITY) {
            throw new IllegalArgumentException(
                    "priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY + ", got: " + builder.priority);
        }
        this.priority = builder.priority;
        this.scheduledFor = builder.scheduledFor;

        if (builder.maxRetries != null && (builder.maxRetries < MIN_RETRIES || builder.maxRetries > MAX_RETRIES)) {
            throw new IllegalArgumentException(
                    "maxRetries must be between " + MIN_RETRIES + " and " + MAX_RETRIES + ", got: " + builder.maxRetries);
        }
        this.maxRetries = builder.maxRetries;
    }

    /**
     * Creates a builder for a message to the given recipients.
     *
     * @param recipients the addressees
     * @return a new builder
     */
    public static Builder builder(Recipients recipients) {
        return new Builder().recipients(recipients);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String messageId() {
        return messageId;
    }

    /** Whether {@link #messageId()} came from the caller and should deduplicate submissions. */
    public boolean hasCallerSuppliedId() {
        return callerSuppliedId;
    }

    public String messageType() {
        return messageType;
    }

    public Recipients recipients() {
        return recipients;
    }

    public MessageContent content() {
        return content;
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public int priority() {
        return priority;
    }

    /**
     * Earliest delivery time, or {@code null} to let the store default it to "now".
     */
    public Instant scheduledFor() {
        return scheduledFor;
    }

    /**
     * Per-job retry budget, or {@code null} to use the store's configured default.
     */
    public Integer maxRetries() {
        return maxRetries;
    }

    @Override
    public String toString() {
        return "NewJob{messageId=" + messageId + ", type=" + messageType
                + ", recipients=" + recipients.size() + ", priority=" + priority + "}";
    }

    /**
     * Builder for {@link NewJob}.
     */
    public static final class Builder {
        private String messageId;
        private String messageType;
        private Recipients recipients;
        private MessageContent content;
        private Map<String, String> metadata;
        private int priority = DEFAULT_PRIORITY;
        private Instant scheduledFor;
        private Integer maxRetries;

        private Builder() {
        }

        /**
         * Sets a caller-chosen message id used as an idempotency token.
         *
         * <p>Optional. Defaults to a generated ULID.
         *
         * @param messageId the message id
         * @return this builder
         */
        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        /**
         * Sets the message category (e.g. {@code booking_created}).
         *
         * <p>Optional. Defaults to {@code transactional}.
         *
         * @param messageType the category
         * @return this builder
         */
        public Builder messageType(String messageType) {
            this.messageType = messageType;
            return this;
        }

        public Builder recipients(Recipients recipients) {
            this.recipients = recipients;
            return this;
        }

        public Builder content(MessageContent content) {
            this.content = content;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        /**
         * Sets the priority; lower values are claimed first.
         *
         * <p>Optional. Defaults to {@code 5}. Must be within 1..10.
         *
         * @param priority the priority
         * @return this builder
         */
        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        /**
         * Sets the earliest time the job becomes eligible for delivery.
         *
         * @param scheduledFor the earliest delivery time
         * @return this builder
         */
        public Builder scheduledFor(Instant scheduledFor) {
            this.scheduledFor = scheduledFor;
            return this;
        }

        /**
         * Overrides the retry budget for this job.
         *
         * <p>Optional. Must be within 1..10.
         *
         * @param maxRetries maximum number of retries after the first attempt
         * @return this builder
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public NewJob build() {
            return new NewJob(this);
        }
    }
}
