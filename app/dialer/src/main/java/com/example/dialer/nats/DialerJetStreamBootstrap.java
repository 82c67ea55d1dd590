/*
 * どこで: Dialer NATS 初期化
 * 何を: 通話イベント用の JetStream stream を起動時に作成/更新する
 * なぜ: publish 前に stream を確保し Nats-Msg-Id の重複排除を有効化するため
 */
package com.example.dialer.nats;

import com.example.dialer.config.DialerNatsProperties;
import com.example.dialer.config.OutboxPublishingCondition;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Conditional;
import org.springframework.stereotype.Component;

@Component
@Conditional(OutboxPublishingCondition.class)
@RequiredArgsConstructor
public class DialerJetStreamBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(DialerJetStreamBootstrap.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  private final Connection connection;
  private final DialerNatsProperties properties;

  @PostConstruct
  public void start() {
    ensureSettings();
    try {
      // Nats-Msg-Id の重複排除は stream の duplicate window が前提になる
      final StreamConfiguration streamConfiguration =
          StreamConfiguration.builder()
              .name(properties.stream())
              .subjects(properties.subject())
              .duplicateWindow(properties.duplicateWindow())
              .maxAge(properties.maxAge())
              .storageType(StorageType.File)
              .build();
      upsertStream(connection.jetStreamManagement(), streamConfiguration);
      logger.info(
          "call event stream ensured stream={} subject={} duplicateWindow={} maxAge={}",
          properties.stream(),
          properties.subject(),
          properties.duplicateWindow(),
          properties.maxAge());
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to ensure JetStream stream", ex);
    }
  }

  private void upsertStream(
      JetStreamManagement jetStreamManagement, StreamConfiguration streamConfiguration)
      throws IOException, JetStreamApiException {
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (!isStreamNotFound(ex)) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
    }
  }

  private boolean isStreamNotFound(JetStreamApiException ex) {
    return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
        || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
  }

  private void ensureSettings() {
    if (properties.duplicateWindow().isZero() || properties.duplicateWindow().isNegative()) {
      throw new IllegalStateException("dialer.nats.duplicate-window must be positive");
    }
    // 保持期間が重複排除窓より短いと再送の重複を検出できない
    if (properties.maxAge().compareTo(properties.duplicateWindow()) < 0) {
      throw new IllegalStateException(
          "dialer.nats.max-age must not be shorter than duplicate-window");
    }
  }
}
