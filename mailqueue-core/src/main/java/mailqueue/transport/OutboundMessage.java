package mailqueue.transport;

import mailqueue.model.Job;
import mailqueue.model.MessageContent;
import mailqueue.model.Recipients;

import java.util.Map;
import java.util.Objects;

/**
 * The part of a claimed job a transport needs to deliver it.
 *
 * @param jobId       id of the job being delivered
 * @param messageId   stable message id, usable as a transport-level dedup key
 * @param messageType message category
 * @param recipients  addressees
 * @param content     inline content or template reference
 * @param metadata    opaque caller metadata
 * @param attempt     1-based delivery attempt number
 */
public record OutboundMessage(
    long jobId,
    String messageId,
    String messageType,
    Recipients recipients,
    MessageContent content,
    Map<String, String> metadata,
    int attempt
) {
  public OutboundMessage {
    Objects.requireNonNull(recipients, "recipients");
    Objects.requireNonNull(content, "content");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  public static OutboundMessage from(Job job) {
    return new OutboundMessage(job.id(), job.messageId(), job.messageType(),
        job.recipients(), job.content(), job.metadata(), job.retryCount() + 1);
  }
}
