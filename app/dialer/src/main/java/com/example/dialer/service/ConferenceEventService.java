/*
 * どこで: Dialer サービス層
 * 何を: 会議の入退室通知から担当者の解放を行う
 * なぜ: リードが抜けた時点で担当者を次の通話へ回すため
 */
package com.example.dialer.service;

import com.example.dialer.model.RepSessionRecord;
import com.example.dialer.repository.RepSessionRepository;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ConferenceEventService {

  private static final Logger logger = LoggerFactory.getLogger(ConferenceEventService.class);

  static final String PARTICIPANT_LEAVE = "participant-leave";
  static final String CONFERENCE_END = "conference-end";

  private final RepSessionRepository repSessionRepository;
  private final RepPoolService repPoolService;
  private final DialerMetrics metrics;

  /** 戻り値は担当者を解放したかどうか。 */
  public boolean handle(ConferenceEvent event) {
    final Optional<UUID> sessionId = parseSessionId(event.sessionId());
    if (sessionId.isEmpty()) {
      logger.warn("conference event without valid session_id event={}", event.statusCallbackEvent());
      metrics.recordWebhook("conference", "ignored");
      return false;
    }
    try {
      final boolean released = dispatch(sessionId.get(), event);
      metrics.recordWebhook("conference", released ? "released" : "acknowledged");
      return released;
    } catch (DataAccessException ex) {
      logger.error(
          "conference event handling failed sessionId={} event={}",
          sessionId.get(),
          event.statusCallbackEvent(),
          ex);
      metrics.recordWebhook("conference", "failed");
      return false;
    }
  }

  private boolean dispatch(UUID sessionId, ConferenceEvent event) {
    final String kind = event.statusCallbackEvent() == null ? "" : event.statusCallbackEvent();
    switch (kind) {
      case PARTICIPANT_LEAVE -> {
        final Optional<RepSessionRecord> session = repSessionRepository.findBySessionId(sessionId);
        // 担当者自身の退室は conference-end で扱う
        if (session.isEmpty()
            || event.callHandle() == null
            || !event.callHandle().equals(session.get().claimedCallHandle())) {
          return false;
        }
        return repPoolService.release(sessionId, event.callHandle());
      }
      case CONFERENCE_END -> {
        return repPoolService.releaseConference(sessionId, event.conferenceName());
      }
      default -> {
        logger.debug(
            "conference event sessionId={} event={} callHandle={}",
            sessionId,
            kind,
            event.callHandle());
        return false;
      }
    }
  }

  private static Optional<UUID> parseSessionId(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(UUID.fromString(value.trim()));
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
  }
}
