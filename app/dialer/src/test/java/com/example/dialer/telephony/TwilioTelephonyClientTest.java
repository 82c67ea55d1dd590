package com.example.dialer.telephony;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.dialer.config.TelephonyProperties;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class TwilioTelephonyClientTest {

  private static final String CALLS_URL = "http://telephony.test/Accounts/AC-test/Calls.json";

  @Test
  void placeCallPostsFormWithMachineDetection() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(CALLS_URL))
        .andExpect(method(POST))
        .andExpect(
            content()
                .formDataContains(
                    Map.of(
                        "To", "+14155550100",
                        "From", "+15550000000",
                        "Url", "http://dialer.test/webhooks/telephony/answer",
                        "MachineDetection", "DetectMessageEnd",
                        "MachineDetectionTimeout", "5",
                        "Timeout", "25")))
        .andRespond(
            withSuccess("{\"sid\":\"CA-1\",\"status\":\"queued\"}", MediaType.APPLICATION_JSON));

    final String callHandle =
        fixture.client.placeCall(
            new PlaceCallRequest(
                "+14155550100",
                "+15550000000",
                "http://dialer.test/webhooks/telephony/answer",
                "http://dialer.test/webhooks/telephony/status"));

    assertThat(callHandle).isEqualTo("CA-1");
    fixture.server.verify();
  }

  @Test
  void placeCallMaps400ToRejected() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo(CALLS_URL)).andRespond(withStatus(HttpStatus.BAD_REQUEST));

    assertThatThrownBy(() -> fixture.client.placeCall(request()))
        .isInstanceOf(TelephonyIntegrationException.class)
        .extracting(ex -> ((TelephonyIntegrationException) ex).reason())
        .isEqualTo(TelephonyIntegrationException.Reason.REJECTED);
  }

  @Test
  void placeCallMaps5xxToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo(CALLS_URL)).andRespond(withServerError());

    assertThatThrownBy(() -> fixture.client.placeCall(request()))
        .isInstanceOf(TelephonyIntegrationException.class)
        .extracting(ex -> ((TelephonyIntegrationException) ex).reason())
        .isEqualTo(TelephonyIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void placeCallWithoutSidIsInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(CALLS_URL))
        .andRespond(withSuccess("{\"status\":\"queued\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.placeCall(request()))
        .isInstanceOf(TelephonyIntegrationException.class)
        .extracting(ex -> ((TelephonyIntegrationException) ex).reason())
        .isEqualTo(TelephonyIntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void placeCallMapsTimeout() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(CALLS_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(() -> fixture.client.placeCall(request()))
        .isInstanceOf(TelephonyIntegrationException.class)
        .extracting(ex -> ((TelephonyIntegrationException) ex).reason())
        .isEqualTo(TelephonyIntegrationException.Reason.TIMEOUT);
  }

  @Test
  void cancelCallSetsCanceledStatus() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://telephony.test/Accounts/AC-test/Calls/CA-2.json"))
        .andExpect(method(POST))
        .andExpect(content().formDataContains(Map.of("Status", "canceled")))
        .andRespond(
            withSuccess(
                "{\"sid\":\"CA-2\",\"status\":\"canceled\"}", MediaType.APPLICATION_JSON));

    fixture.client.cancelCall("CA-2");

    fixture.server.verify();
  }

  @Test
  void cancelOfUnknownCallIsNotFound() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://telephony.test/Accounts/AC-test/Calls/CA-9.json"))
        .andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertThatThrownBy(() -> fixture.client.cancelCall("CA-9"))
        .isInstanceOf(TelephonyIntegrationException.class)
        .extracting(ex -> ((TelephonyIntegrationException) ex).reason())
        .isEqualTo(TelephonyIntegrationException.Reason.NOT_FOUND);
  }

  @Test
  void addParticipantLetsRepOwnConference() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(
            requestTo(
                "http://telephony.test/Accounts/AC-test/Conferences/turbo-org-1-rep-1-1/Participants.json"))
        .andExpect(
            content()
                .formDataContains(
                    Map.of(
                        "To", "client:rep-1-client",
                        "StartConferenceOnEnter", "true",
                        "EndConferenceOnExit", "true")))
        .andRespond(
            withSuccess(
                "{\"call_sid\":\"CA-rep\",\"conference_sid\":\"CF-1\"}",
                MediaType.APPLICATION_JSON));

    final String repLeg =
        fixture.client.addConferenceParticipant(
            new ConferenceParticipantRequest(
                "turbo-org-1-rep-1-1",
                "client:rep-1-client",
                "+15550000000",
                "http://dialer.test/webhooks/telephony/conference?session_id=s-1"));

    assertThat(repLeg).isEqualTo("CA-rep");
  }

  @Test
  void startRecordingRequestsDualChannel() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://telephony.test/Accounts/AC-test/Calls/CA-1/Recordings.json"))
        .andExpect(content().formDataContains(Map.of("RecordingChannels", "dual")))
        .andRespond(withSuccess("{\"sid\":\"RE-1\"}", MediaType.APPLICATION_JSON));

    fixture.client.startRecording("CA-1", "http://dialer.test/webhooks/telephony/status");

    fixture.server.verify();
  }

  private static PlaceCallRequest request() {
    return new PlaceCallRequest(
        "+14155550100",
        "+15550000000",
        "http://dialer.test/webhooks/telephony/answer",
        "http://dialer.test/webhooks/telephony/status");
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://telephony.test").build();
    final TelephonyProperties properties =
        new TelephonyProperties(
            "http://telephony.test",
            "AC-test",
            "token",
            "http://dialer.test",
            "+15550000000",
            List.of(),
            null,
            null,
            Duration.ofSeconds(25),
            true,
            false);
    return new ClientFixture(new TwilioTelephonyClient(restClient, properties), server);
  }

  private record ClientFixture(TwilioTelephonyClient client, MockRestServiceServer server) {}
}
