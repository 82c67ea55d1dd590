/*
 * どこで: Dialer CRM 連携
 * 何を: 接続確定時のリード担当者割当と通話記録作成を CRM へ依頼する
 * なぜ: 接続結果を CRM 側の画面/履歴へ即時反映するため
 */
package com.example.dialer.crm;

import com.example.dialer.config.CrmClientProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Service
public class CrmClient {

  private static final Logger logger = LoggerFactory.getLogger(CrmClient.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient crmRestClient;

  private final CrmClientProperties properties;

  public CrmClient(RestClient crmRestClient, CrmClientProperties properties) {
    this.crmRestClient = crmRestClient;
    this.properties = properties;
  }

  public void assignLeadOwner(String orgId, String leadId, String repId) {
    validateRequired(orgId, "orgId is required");
    validateRequired(leadId, "leadId is required");
    validateRequired(repId, "repId is required");
    try {
      crmRestClient
          .put()
          .uri(properties.assignOwnerPath(), orgId, leadId)
          .header(properties.tokenHeaderName(), properties.token())
          .body(new AssignLeadOwnerRequest(repId, "contacted"))
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, "assignLeadOwner");
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "assignLeadOwner");
    } catch (RestClientException ex) {
      throw mapClientException(ex, "assignLeadOwner");
    }
  }

  public void createCallRecord(String orgId, CrmCallRecordRequest request) {
    validateRequired(orgId, "orgId is required");
    try {
      crmRestClient
          .post()
          .uri(properties.callRecordPath(), orgId)
          .header(properties.tokenHeaderName(), properties.token())
          .body(request)
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, "createCallRecord");
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, "createCallRecord");
    } catch (RestClientException ex) {
      throw mapClientException(ex, "createCallRecord");
    }
  }

  private CrmIntegrationException mapResponseException(
      RestClientResponseException ex, String operation) {
    logger.warn(
        "crm {} failed with http status={} statusText={}",
        operation,
        ex.getStatusCode().value(),
        ex.getStatusText());
    if (ex.getStatusCode().value() == 401 || ex.getStatusCode().value() == 403) {
      return new CrmIntegrationException(
          CrmIntegrationException.Reason.FORBIDDEN, "crm denied access", ex);
    }
    if (ex.getStatusCode().value() == 404) {
      return new CrmIntegrationException(
          CrmIntegrationException.Reason.NOT_FOUND, "crm resource not found", ex);
    }
    return new CrmIntegrationException(
        CrmIntegrationException.Reason.BAD_GATEWAY, "crm request failed", ex);
  }

  private CrmIntegrationException mapResourceException(
      ResourceAccessException ex, String operation) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        logger.warn("crm {} timed out", operation);
        return new CrmIntegrationException(
            CrmIntegrationException.Reason.TIMEOUT, "crm request timeout", ex);
      }
      current = current.getCause();
    }
    logger.warn("crm {} connection failed", operation, ex);
    return new CrmIntegrationException(
        CrmIntegrationException.Reason.BAD_GATEWAY, "crm connection failed", ex);
  }

  // 本文の変換失敗など、HTTP 応答にも接続にも分類できない失敗
  private CrmIntegrationException mapClientException(RestClientException ex, String operation) {
    logger.warn("crm {} request could not be completed", operation, ex);
    return new CrmIntegrationException(
        CrmIntegrationException.Reason.BAD_GATEWAY, "crm request failed", ex);
  }

  private void validateRequired(String value, String message) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(message);
    }
  }
}
