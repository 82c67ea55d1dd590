/*
 * どこで: Dialer サービス層
 * 何を: 発信/claim/応答/webhook のアプリ固有メトリクス記録を集約する
 * なぜ: 担当者の取り合い状況と outbox 遅延を運用で継続監視できるようにするため
 */
package com.example.dialer.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class DialerMetrics {

  private static final String METRIC_CALLS_DIALED = "dialer.calls.dialed";
  private static final String METRIC_DIAL_FAILURES = "dialer.calls.dial.failures";
  private static final String METRIC_REP_CLAIM = "dialer.rep.claim.total";
  private static final String METRIC_ANSWER_OUTCOME = "dialer.answer.outcome.total";
  private static final String METRIC_WEBHOOK = "dialer.webhook.total";
  private static final String METRIC_SIBLINGS_CANCELED = "dialer.batch.siblings.canceled";
  private static final String METRIC_QUEUE_DEPTH = "dialer.queue.depth";
  private static final String METRIC_STALE_CLAIMS = "dialer.rep.stale.released";
  private static final String METRIC_ANSWER_TO_CONNECT = "dialer.answer.connect.latency";
  private static final String METRIC_OUTBOX_PUBLISH_DELAY = "dialer.outbox.publish.delay";
  private static final String METRIC_OUTBOX_PENDING_CURRENT = "dialer.outbox.pending.current";
  private static final String METRIC_OUTBOX_FAILED_CURRENT = "dialer.outbox.failed.current";

  private final MeterRegistry meterRegistry;
  private final AtomicLong queueDepth = new AtomicLong(0);
  private final AtomicLong outboxPendingCurrent = new AtomicLong(0);
  private final AtomicLong outboxFailedCurrent = new AtomicLong(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter callsDialed;
  private final Counter dialFailures;
  private final Counter siblingsCanceled;
  private final Counter staleClaimsReleased;
  private final Timer answerToConnectTimer;
  private final Timer outboxPublishDelayTimer;

  public DialerMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_QUEUE_DEPTH, queueDepth, AtomicLong::get)
        .description("Queued leads waiting to be dialed")
        .register(meterRegistry);
    Gauge.builder(METRIC_OUTBOX_PENDING_CURRENT, outboxPendingCurrent, AtomicLong::get)
        .description("Call events waiting to be published")
        .register(meterRegistry);
    Gauge.builder(METRIC_OUTBOX_FAILED_CURRENT, outboxFailedCurrent, AtomicLong::get)
        .description("Current number of FAILED outbox events")
        .register(meterRegistry);
    this.callsDialed =
        Counter.builder(METRIC_CALLS_DIALED)
            .description("Outbound calls accepted by the telephony provider")
            .register(meterRegistry);
    this.dialFailures =
        Counter.builder(METRIC_DIAL_FAILURES)
            .description("Outbound calls rejected before a call handle was issued")
            .register(meterRegistry);
    this.siblingsCanceled =
        Counter.builder(METRIC_SIBLINGS_CANCELED)
            .description("Batch sibling calls canceled after a human answer")
            .register(meterRegistry);
    this.staleClaimsReleased =
        Counter.builder(METRIC_STALE_CLAIMS)
            .description("Rep claims released by the stale claim reaper")
            .register(meterRegistry);
    this.answerToConnectTimer =
        Timer.builder(METRIC_ANSWER_TO_CONNECT)
            .description("Time from dial to bridging the lead into a rep conference")
            .register(meterRegistry);
    this.outboxPublishDelayTimer =
        Timer.builder(METRIC_OUTBOX_PUBLISH_DELAY)
            .description("Outbox publish delay from event creation to publish completion")
            .register(meterRegistry);
  }

  public void recordDialed(int count) {
    callsDialed.increment(count);
  }

  public void recordDialFailure() {
    dialFailures.increment();
  }

  public void recordRepClaim(String result) {
    increment(METRIC_REP_CLAIM, "Rep claim attempts by result", "result", result);
  }

  public void recordAnswerOutcome(String outcome) {
    increment(METRIC_ANSWER_OUTCOME, "Answer handler outcomes", "outcome", outcome);
  }

  public void recordWebhook(String kind, String result) {
    final String key = METRIC_WEBHOOK + ":" + kind + ":" + result;
    counters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_WEBHOOK)
                    .description("Telephony webhook deliveries")
                    .tags(Tags.of("kind", kind, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordSiblingsCanceled(int count) {
    siblingsCanceled.increment(count);
  }

  public void recordStaleClaimsReleased(int count) {
    staleClaimsReleased.increment(count);
  }

  public void recordAnswerToConnect(Instant dialedAt, Instant connectedAt) {
    if (dialedAt == null || connectedAt == null || connectedAt.isBefore(dialedAt)) {
      return;
    }
    answerToConnectTimer.record(Duration.between(dialedAt, connectedAt));
  }

  public void recordOutboxPublishDelay(Instant createdAt, Instant publishedAt) {
    if (createdAt == null || publishedAt == null || publishedAt.isBefore(createdAt)) {
      return;
    }
    outboxPublishDelayTimer.record(Duration.between(createdAt, publishedAt));
  }

  public void updateQueueDepth(long depth) {
    queueDepth.set(Math.max(depth, 0));
  }

  public void updateOutboxBacklog(long pendingCount, long failedCount) {
    outboxPendingCurrent.set(Math.max(pendingCount, 0));
    outboxFailedCurrent.set(Math.max(failedCount, 0));
  }

  private void increment(String metric, String description, String tagKey, String tagValue) {
    final String key = metric + ":" + tagValue;
    counters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(metric)
                    .description(description)
                    .tags(Tags.of(tagKey, tagValue))
                    .register(meterRegistry))
        .increment();
  }
}
