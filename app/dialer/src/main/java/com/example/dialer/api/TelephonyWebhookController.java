/*
 * どこで: Dialer 通話プロバイダ webhook
 * 何を: 応答/status/会議/留守電の通知を受けてサービスへ渡す
 * なぜ: プロバイダ側の再送や通話切断を誘発しないよう、内部エラーでも常に 200 を返すため
 */
package com.example.dialer.api;

import com.example.dialer.config.DialerAnswerProperties;
import com.example.dialer.service.AnswerService;
import com.example.dialer.service.CallLifecycleService;
import com.example.dialer.service.CallStatusEvent;
import com.example.dialer.service.ConferenceEvent;
import com.example.dialer.service.ConferenceEventService;
import com.example.dialer.service.VoicemailService;
import com.example.dialer.voice.CallInstruction;
import com.example.dialer.voice.Hangup;
import com.example.dialer.voice.VoiceXmlRenderer;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/webhooks/telephony")
@RequiredArgsConstructor
public class TelephonyWebhookController {

  private static final Logger logger = LoggerFactory.getLogger(TelephonyWebhookController.class);

  private final AnswerService answerService;
  private final CallLifecycleService lifecycleService;
  private final ConferenceEventService conferenceEventService;
  private final VoicemailService voicemailService;
  private final VoiceXmlRenderer renderer;
  private final DialerAnswerProperties answerProperties;

  @PostMapping(value = "/answer", produces = MediaType.APPLICATION_XML_VALUE)
  public ResponseEntity<String> answer(
      @RequestParam(name = "CallSid", required = false) String callHandle,
      @RequestParam(name = "AnsweredBy", required = false) String answeredBy) {
    CallInstruction instruction;
    try {
      instruction = answerService.handleAnswer(callHandle, answeredBy);
    } catch (RuntimeException ex) {
      logger.error("answer webhook failed callHandle={}", callHandle, ex);
      instruction = new Hangup(answerProperties.errorPrompt());
    }
    return xml(instruction);
  }

  @PostMapping("/status")
  public ResponseEntity<Void> status(
      @RequestParam(name = "CallSid", required = false) String callHandle,
      @RequestParam(name = "CallStatus", required = false) String callStatus,
      @RequestParam(name = "AnsweredBy", required = false) String answeredBy,
      @RequestParam(name = "CallDuration", required = false) String callDuration,
      @RequestParam(name = "RecordingUrl", required = false) String recordingUrl) {
    try {
      lifecycleService.handle(
          new CallStatusEvent(
              callHandle, callStatus, answeredBy, parseDuration(callDuration), recordingUrl));
    } catch (RuntimeException ex) {
      logger.error("status webhook failed callHandle={} status={}", callHandle, callStatus, ex);
    }
    return ResponseEntity.ok().build();
  }

  @PostMapping("/conference")
  public ResponseEntity<Void> conference(
      @RequestParam(name = "session_id", required = false) String sessionId,
      @RequestParam(name = "StatusCallbackEvent", required = false) String event,
      @RequestParam(name = "FriendlyName", required = false) String conferenceName,
      @RequestParam(name = "CallSid", required = false) String callHandle) {
    try {
      conferenceEventService.handle(new ConferenceEvent(sessionId, event, conferenceName, callHandle));
    } catch (RuntimeException ex) {
      logger.error("conference webhook failed sessionId={} event={}", sessionId, event, ex);
    }
    return ResponseEntity.ok().build();
  }

  @PostMapping(value = "/voicemail", produces = MediaType.APPLICATION_XML_VALUE)
  public ResponseEntity<String> voicemail(
      @RequestParam(name = "CallSid", required = false) String callHandle,
      @RequestParam(name = "RecordingUrl", required = false) String recordingUrl) {
    CallInstruction instruction;
    try {
      instruction = voicemailService.recordingCompleted(callHandle, recordingUrl);
    } catch (RuntimeException ex) {
      logger.error("voicemail webhook failed callHandle={}", callHandle, ex);
      instruction = new Hangup(answerProperties.goodbyePrompt());
    }
    return xml(instruction);
  }

  @PostMapping("/voicemail/transcription")
  public ResponseEntity<Void> transcription(
      @RequestParam(name = "CallSid", required = false) String callHandle,
      @RequestParam(name = "TranscriptionStatus", required = false) String transcriptionStatus,
      @RequestParam(name = "TranscriptionText", required = false) String transcriptionText) {
    try {
      voicemailService.transcriptionCompleted(callHandle, transcriptionStatus, transcriptionText);
    } catch (RuntimeException ex) {
      logger.error("transcription webhook failed callHandle={}", callHandle, ex);
    }
    return ResponseEntity.ok().build();
  }

  private ResponseEntity<String> xml(CallInstruction instruction) {
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_XML)
        .body(renderer.render(instruction));
  }

  private static Integer parseDuration(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Integer.valueOf(value.trim());
    } catch (NumberFormatException ex) {
      logger.warn("invalid CallDuration value={}", value);
      return null;
    }
  }
}
