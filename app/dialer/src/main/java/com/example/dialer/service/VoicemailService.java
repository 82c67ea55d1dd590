/*
 * どこで: Dialer サービス層
 * 何を: 留守電の録音完了/文字起こし完了通知を通話へ添付する
 * なぜ: 文字起こしは通話終了後に非同期で届くため、応答処理とは独立に受けるため
 */
package com.example.dialer.service;

import com.example.dialer.config.DialerAnswerProperties;
import com.example.dialer.model.CallAttemptRecord;
import com.example.dialer.model.Disposition;
import com.example.dialer.repository.CallAttemptRepository;
import com.example.dialer.voice.CallInstruction;
import com.example.dialer.voice.Hangup;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class VoicemailService {

  private static final Logger logger = LoggerFactory.getLogger(VoicemailService.class);

  static final String TRANSCRIPTION_COMPLETED = "completed";

  private final CallAttemptRepository callAttemptRepository;
  private final QueueService queueService;
  private final DialerAnswerProperties answerProperties;
  private final DialerMetrics metrics;

  /** 録音完了時にプロバイダへ返す指示。録音が空なら受け取れなかった旨を伝えて切る。 */
  public CallInstruction recordingCompleted(String callHandle, String recordingUrl) {
    if (recordingUrl == null || recordingUrl.isBlank()) {
      metrics.recordWebhook("voicemail", "empty");
      return new Hangup(answerProperties.voicemailMissedPrompt());
    }
    try {
      final Optional<CallAttemptRecord> attempt = callAttemptRepository.findByCallHandle(callHandle);
      if (attempt.isEmpty()) {
        logger.warn("voicemail for untracked call callHandle={}", callHandle);
        metrics.recordWebhook("voicemail", "untracked");
        return new Hangup(answerProperties.goodbyePrompt());
      }
      callAttemptRepository.attachVoicemailUrl(callHandle, recordingUrl);
      queueService.markOutcome(attempt.get().queueEntryId(), Disposition.VOICEMAIL);
      logger.info("voicemail recorded callHandle={} leadId={}", callHandle, attempt.get().leadId());
      metrics.recordWebhook("voicemail", "attached");
    } catch (DataAccessException ex) {
      logger.error("voicemail attach failed callHandle={}", callHandle, ex);
      metrics.recordWebhook("voicemail", "failed");
    }
    return new Hangup(answerProperties.goodbyePrompt());
  }

  /** 文字起こし通知を添付する。completed 以外は受け取るだけで無視する。 */
  public boolean transcriptionCompleted(
      String callHandle, String transcriptionStatus, String transcriptionText) {
    if (!TRANSCRIPTION_COMPLETED.equalsIgnoreCase(transcriptionStatus)) {
      logger.info(
          "voicemail transcription not completed callHandle={} status={}",
          callHandle,
          transcriptionStatus);
      metrics.recordWebhook("transcription", "ignored");
      return false;
    }
    try {
      final Optional<CallAttemptRecord> attempt = callAttemptRepository.findByCallHandle(callHandle);
      if (attempt.isEmpty()) {
        metrics.recordWebhook("transcription", "untracked");
        return false;
      }
      callAttemptRepository.attachTranscription(callHandle, transcriptionText);
      queueService.markOutcome(attempt.get().queueEntryId(), Disposition.VOICEMAIL);
      metrics.recordWebhook("transcription", "attached");
      return true;
    } catch (DataAccessException ex) {
      logger.error("voicemail transcription attach failed callHandle={}", callHandle, ex);
      metrics.recordWebhook("transcription", "failed");
      return false;
    }
  }
}
