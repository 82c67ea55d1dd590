/*
 * どこで: Dialer サービス層
 * 何を: 発信キューへの投入/参照/削除と発信結果の反映を担う
 * なぜ: リトライ上限とクールダウンの判断を API とワーカーで共有するため
 */
package com.example.dialer.service;

import com.example.dialer.api.InvalidDialerRequestException;
import com.example.dialer.api.QueueEntryBusyException;
import com.example.dialer.api.request.EnqueueLeadsRequest;
import com.example.dialer.api.request.LeadRequest;
import com.example.dialer.api.response.EnqueueLeadsResponse;
import com.example.dialer.api.response.QueueEntrySummary;
import com.example.dialer.api.response.QueueRemovalResponse;
import com.example.dialer.api.response.QueueStatusResponse;
import com.example.dialer.config.DialerQueueProperties;
import com.example.dialer.model.Disposition;
import com.example.dialer.model.QueueEntryRecord;
import com.example.dialer.model.QueueEntryStatus;
import com.example.dialer.repository.QueueEntryRepository;
import com.example.dialer.repository.RepSessionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class QueueService {

  private static final Logger logger = LoggerFactory.getLogger(QueueService.class);

  private final QueueEntryRepository queueEntryRepository;
  private final RepSessionRepository repSessionRepository;
  private final DialerQueueProperties properties;
  private final Clock clock;

  @Transactional
  public EnqueueLeadsResponse enqueue(String orgId, EnqueueLeadsRequest request) {
    requireText(orgId, "org_id");
    final int priority = request.priority() == null ? 0 : request.priority();
    final Instant now = Instant.now(clock);
    // 1 件でも不正な番号があれば何も投入しない
    final List<String> phones = new ArrayList<>();
    for (LeadRequest lead : request.leads()) {
      phones.add(
          PhoneNumbers.toE164(lead.phone())
              .orElseThrow(
                  () ->
                      new InvalidDialerRequestException(
                          "phone is invalid: lead_id=" + lead.leadId())));
    }
    final List<QueueEntrySummary> entries = new ArrayList<>();
    for (int i = 0; i < request.leads().size(); i++) {
      final LeadRequest lead = request.leads().get(i);
      final QueueEntryRecord record =
          queueEntryRepository.upsert(
              orgId, lead.leadId(), phones.get(i), lead.name(), priority, request.addedBy(), now);
      entries.add(toSummary(record));
    }
    logger.info("leads enqueued orgId={} count={} priority={}", orgId, entries.size(), priority);
    return new EnqueueLeadsResponse(entries.size(), entries);
  }

  public QueueStatusResponse status(String orgId) {
    requireText(orgId, "org_id");
    final Map<String, Integer> counts = new LinkedHashMap<>();
    queueEntryRepository
        .countByStatus(orgId)
        .forEach((status, count) -> counts.put(status.name(), count));
    final List<QueueEntrySummary> entries =
        queueEntryRepository.findByOrgOrdered(orgId, properties.statusPageSize()).stream()
            .map(this::toSummary)
            .toList();
    return new QueueStatusResponse(
        orgId, counts, repSessionRepository.countAvailable(orgId), entries);
  }

  public QueueRemovalResponse remove(String orgId, String leadId) {
    requireText(orgId, "org_id");
    requireText(leadId, "lead_id");
    final int removed = queueEntryRepository.deleteIdle(orgId, leadId);
    if (removed == 0 && queueEntryRepository.findByOrgAndLead(orgId, leadId).isPresent()) {
      throw new QueueEntryBusyException(leadId);
    }
    return new QueueRemovalResponse(removed);
  }

  public QueueRemovalResponse clear(String orgId) {
    requireText(orgId, "org_id");
    final int removed = queueEntryRepository.deleteAllIdle(orgId);
    logger.info("queue cleared orgId={} removed={}", orgId, removed);
    return new QueueRemovalResponse(removed);
  }

  /** 発信結果をエントリへ反映する。終端済みのエントリには何もしない。 */
  public Optional<QueueEntryStatus> markOutcome(UUID entryId, Disposition disposition) {
    final Instant nextAttemptAfter = Instant.now(clock).plus(properties.retryCooldown());
    final Optional<QueueEntryStatus> status =
        queueEntryRepository.markOutcome(
            entryId, disposition, properties.retryLimit(), nextAttemptAfter);
    status.ifPresent(
        s -> logger.info("queue outcome entryId={} disposition={} status={}", entryId, disposition, s));
    return status;
  }

  public void returnToQueue(UUID entryId) {
    queueEntryRepository.returnToQueue(entryId);
  }

  private QueueEntrySummary toSummary(QueueEntryRecord record) {
    return new QueueEntrySummary(
        record.entryId().toString(),
        record.leadId(),
        record.leadName(),
        record.leadPhone(),
        record.priority(),
        record.status().name(),
        record.attemptCount(),
        record.lastDisposition() == null ? null : record.lastDisposition().name(),
        toIsoOrNull(record.addedAt()),
        toIsoOrNull(record.lastAttemptAt()));
  }

  private static String toIsoOrNull(Instant instant) {
    return instant == null ? null : instant.toString();
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new InvalidDialerRequestException(field + " is required");
    }
  }
}
