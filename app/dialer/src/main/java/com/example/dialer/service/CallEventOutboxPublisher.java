/*
 * どこで: Dialer outbox publish サービス
 * 何を: 通話終端イベントの outbox_events を claim して NATS JetStream へ publish する
 * なぜ: 通話状態の確定と後段 (通話分析) への配信の整合性を保つため
 */
package com.example.dialer.service;

import com.example.common.event.CallLifecycleEventPayload;
import com.example.dialer.config.DialerNatsProperties;
import com.example.dialer.config.DialerOutboxProperties;
import com.example.dialer.config.OutboxPublishingCondition;
import com.example.dialer.model.OutboxEventRecord;
import com.example.dialer.model.OutboxStatus;
import com.example.dialer.repository.OutboxEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Conditional;
import org.springframework.stereotype.Service;

@Service
@Conditional(OutboxPublishingCondition.class)
@RequiredArgsConstructor
public class CallEventOutboxPublisher {

  private static final Logger logger = LoggerFactory.getLogger(CallEventOutboxPublisher.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";
  private static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  private static final String HEADER_EVENT_TYPE = "event_type";
  private static final String HEADER_ORG_ID = "org_id";
  private static final String HEADER_CALL_HANDLE = "call_handle";
  private static final String HEADER_OCCURRED_AT = "occurred_at";
  private static final String HEADER_TRACE_ID = "trace_id";
  private static final String HEADER_CONTENT_TYPE = "content_type";

  private final JetStream jetStream;
  private final OutboxEventRepository outboxEventRepository;
  private final DialerOutboxProperties properties;
  private final DialerNatsProperties natsProperties;
  private final ObjectMapper objectMapper;
  private final DialerMetrics metrics;
  private final Clock clock;

  public void publishPendingBatch() {
    final Instant now = Instant.now(clock);
    final String lockedBy = resolveLockedBy();
    final Instant leaseUntil = now.plus(properties.lease());
    final List<OutboxEventRecord> due =
        outboxEventRepository.claimDue(properties.batchSize(), now, leaseUntil, lockedBy);
    for (OutboxEventRecord record : due) {
      try {
        final CallLifecycleEventPayload payload = parsePayload(record);
        final Headers headers = buildHeaders(record, payload);
        final PublishAck ack = publishWithAck(headers, record.payloadJson());
        if (ack == null) {
          throw new IllegalStateException("puback is missing");
        }
        final int updated = outboxEventRepository.markPublished(record.eventId(), lockedBy, now);
        if (updated == 0) {
          logger.warn(
              "call event published but lease was lost eventId={} callHandle={}",
              record.eventId(),
              record.callHandle());
        } else {
          metrics.recordOutboxPublishDelay(Instant.parse(payload.occurredAt()), now);
        }
      } catch (JetStreamApiException | IOException | RuntimeException ex) {
        // DB 更新失敗も publish 失敗と同じくリトライ対象にする
        handleFailure(record, ex, now, lockedBy);
      }
    }
    metrics.updateOutboxBacklog(
        outboxEventRepository.countByStatus(OutboxStatus.PENDING),
        outboxEventRepository.countByStatus(OutboxStatus.FAILED));
  }

  private CallLifecycleEventPayload parsePayload(OutboxEventRecord record) {
    try {
      return objectMapper.readValue(record.payloadJson(), CallLifecycleEventPayload.class);
    } catch (JsonProcessingException ex) {
      // パース不能はリトライしても回復しないので即時 FAILED に寄せる
      throw new OutboxPayloadParseException("outbox payload parse failure", ex);
    }
  }

  private Headers buildHeaders(OutboxEventRecord record, CallLifecycleEventPayload payload) {
    final Headers headers = new Headers();
    // 重複排除キーとして event_id を NATS の標準ヘッダに載せる
    headers.add(HEADER_MESSAGE_ID, payload.eventId());
    headers.add(HEADER_EVENT_TYPE, record.eventType());
    headers.add(HEADER_ORG_ID, record.orgId());
    headers.add(HEADER_CALL_HANDLE, record.callHandle());
    headers.add(HEADER_OCCURRED_AT, payload.occurredAt());
    headers.add(HEADER_TRACE_ID, payload.traceId() == null ? "" : payload.traceId());
    headers.add(HEADER_CONTENT_TYPE, "application/json");
    return headers;
  }

  private PublishAck publishWithAck(Headers headers, String payloadJson)
      throws IOException, JetStreamApiException {
    // puback を受け取れた場合のみ publish 成功とみなす
    return jetStream.publish(
        natsProperties.subject(), headers, payloadJson.getBytes(StandardCharsets.UTF_8));
  }

  private void handleFailure(OutboxEventRecord record, Exception ex, Instant now, String lockedBy) {
    final boolean nonRetryable = ex instanceof OutboxPayloadParseException;
    final int nextAttempt = nonRetryable ? properties.maxAttempts() : record.attemptCount() + 1;
    final boolean failed = nonRetryable || nextAttempt >= properties.maxAttempts();
    final Instant nextRetryAt = failed ? null : now.plus(computeBackoffDuration(nextAttempt));
    final String error = truncateError(ex.getMessage());
    final int updated =
        failed
            ? outboxEventRepository.markFailed(record.eventId(), lockedBy, nextAttempt, error)
            : outboxEventRepository.markRetry(
                record.eventId(), lockedBy, nextAttempt, nextRetryAt, error);
    if (updated == 0) {
      logger.warn(
          "call event failure not recorded because lease was lost eventId={} attempt={}",
          record.eventId(),
          nextAttempt);
    }
    if (failed) {
      if (nonRetryable) {
        logger.error(
            "call event payload is unreadable eventId={} callHandle={}",
            record.eventId(),
            record.callHandle(),
            ex);
      } else {
        logger.warn(
            "call event publish gave up eventId={} callHandle={} attempts={}",
            record.eventId(),
            record.callHandle(),
            nextAttempt,
            ex);
      }
    } else {
      logger.warn(
          "call event publish retry scheduled eventId={} callHandle={} attempt={} nextRetryAt={}",
          record.eventId(),
          record.callHandle(),
          nextAttempt,
          nextRetryAt,
          ex);
    }
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    final long minMillis = properties.backoffMin().toMillis();
    return Duration.ofMillis(Math.max(minMillis, backoffMillis));
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  private String resolveLockedBy() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }

  private static final class OutboxPayloadParseException extends RuntimeException {
    private OutboxPayloadParseException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
