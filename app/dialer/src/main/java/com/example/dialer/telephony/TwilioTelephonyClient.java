/*
 * どこで: Dialer 通話プロバイダ連携
 * 何を: Twilio 互換 REST API で発信/キャンセル/会議参加/録音開始を行う
 * なぜ: SDK に依存せず RestClient の失敗分類に揃えるため
 */
package com.example.dialer.telephony;

import com.example.dialer.config.TelephonyProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class TwilioTelephonyClient implements TelephonyClient {

  private static final Logger logger = LoggerFactory.getLogger(TwilioTelephonyClient.class);
  private static final String CALLS_PATH = "/Accounts/{accountId}/Calls.json";
  private static final String CALL_PATH = "/Accounts/{accountId}/Calls/{callHandle}.json";
  private static final String PARTICIPANTS_PATH =
      "/Accounts/{accountId}/Conferences/{conferenceName}/Participants.json";
  private static final String RECORDINGS_PATH =
      "/Accounts/{accountId}/Calls/{callHandle}/Recordings.json";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient telephonyRestClient;

  private final TelephonyProperties properties;

  public TwilioTelephonyClient(RestClient telephonyRestClient, TelephonyProperties properties) {
    this.telephonyRestClient = telephonyRestClient;
    this.properties = properties;
  }

  @Override
  public String placeCall(PlaceCallRequest request) {
    validateRequired(request.to(), "to is required");
    validateRequired(request.from(), "from is required");
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("To", request.to());
    form.add("From", request.from());
    form.add("Url", request.answerUrl());
    form.add("StatusCallback", request.statusCallbackUrl());
    form.add("StatusCallbackMethod", "POST");
    form.add("StatusCallbackEvent", "initiated");
    form.add("StatusCallbackEvent", "ringing");
    form.add("StatusCallbackEvent", "answered");
    form.add("StatusCallbackEvent", "completed");
    form.add("MachineDetection", properties.machineDetection());
    form.add(
        "MachineDetectionTimeout",
        Long.toString(properties.machineDetectionTimeout().toSeconds()));
    form.add("Timeout", Long.toString(properties.ringTimeout().toSeconds()));
    final TwilioResourceResponse response = post("placeCall", CALLS_PATH, form);
    return requireSid(response.sid(), "placeCall");
  }

  @Override
  public void cancelCall(String callHandle) {
    validateRequired(callHandle, "callHandle is required");
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    // 未応答の発信のみ取り消す。応答済みなら completed を使うがここでは扱わない
    form.add("Status", "canceled");
    post("cancelCall", CALL_PATH, form, callHandle);
  }

  @Override
  public String addConferenceParticipant(ConferenceParticipantRequest request) {
    validateRequired(request.conferenceName(), "conferenceName is required");
    validateRequired(request.to(), "to is required");
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("From", request.from());
    form.add("To", request.to());
    // 担当者側が会議の寿命を持つ
    form.add("StartConferenceOnEnter", "true");
    form.add("EndConferenceOnExit", "true");
    form.add("Beep", "false");
    form.add("ConferenceStatusCallback", request.statusCallbackUrl());
    form.add("ConferenceStatusCallbackEvent", "start");
    form.add("ConferenceStatusCallbackEvent", "end");
    form.add("ConferenceStatusCallbackEvent", "join");
    form.add("ConferenceStatusCallbackEvent", "leave");
    final TwilioResourceResponse response =
        post("addConferenceParticipant", PARTICIPANTS_PATH, form, request.conferenceName());
    return requireSid(response.callSid(), "addConferenceParticipant");
  }

  @Override
  public void startRecording(String callHandle, String recordingCallbackUrl) {
    validateRequired(callHandle, "callHandle is required");
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("RecordingChannels", "dual");
    form.add("RecordingStatusCallback", recordingCallbackUrl);
    form.add("RecordingStatusCallbackEvent", "completed");
    post("startRecording", RECORDINGS_PATH, form, callHandle);
  }

  private TwilioResourceResponse post(
      String operation, String path, MultiValueMap<String, String> form, Object... pathVariables) {
    final Object[] variables = new Object[pathVariables.length + 1];
    variables[0] = properties.accountId();
    System.arraycopy(pathVariables, 0, variables, 1, pathVariables.length);
    try {
      final TwilioResourceResponse response =
          telephonyRestClient
              .post()
              .uri(path, variables)
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(form)
              .retrieve()
              .body(TwilioResourceResponse.class);
      if (response == null) {
        throw new TelephonyIntegrationException(
            TelephonyIntegrationException.Reason.INVALID_RESPONSE,
            "telephony " + operation + " response is empty");
      }
      return response;
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, operation);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, operation);
    } catch (TelephonyIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("telephony {} response parse failed", operation, ex);
      throw new TelephonyIntegrationException(
          TelephonyIntegrationException.Reason.INVALID_RESPONSE,
          "telephony response parse failed",
          ex);
    }
  }

  private TelephonyIntegrationException mapResponseException(
      RestClientResponseException ex, String operation) {
    logger.warn(
        "telephony {} failed with http status={} statusText={}",
        operation,
        ex.getStatusCode().value(),
        ex.getStatusText());
    if (ex.getStatusCode().value() == 404) {
      return new TelephonyIntegrationException(
          TelephonyIntegrationException.Reason.NOT_FOUND, "telephony resource not found", ex);
    }
    if (ex.getStatusCode().is4xxClientError()) {
      return new TelephonyIntegrationException(
          TelephonyIntegrationException.Reason.REJECTED, "telephony request rejected", ex);
    }
    return new TelephonyIntegrationException(
        TelephonyIntegrationException.Reason.BAD_GATEWAY, "telephony server error", ex);
  }

  private TelephonyIntegrationException mapResourceException(
      ResourceAccessException ex, String operation) {
    if (isTimeout(ex)) {
      logger.warn("telephony {} timed out", operation);
      return new TelephonyIntegrationException(
          TelephonyIntegrationException.Reason.TIMEOUT, "telephony request timeout", ex);
    }
    logger.warn("telephony {} connection failed", operation, ex);
    return new TelephonyIntegrationException(
        TelephonyIntegrationException.Reason.BAD_GATEWAY, "telephony connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private void validateRequired(String value, String message) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(message);
    }
  }

  private String requireSid(String sid, String operation) {
    if (sid == null || sid.isBlank()) {
      throw new TelephonyIntegrationException(
          TelephonyIntegrationException.Reason.INVALID_RESPONSE,
          "telephony " + operation + " response has no sid");
    }
    return sid;
  }
}
