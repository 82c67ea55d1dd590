/*
 * どこで: Dialer API
 * 何を: CRM から発信キューを操作するエンドポイントを提供する
 * なぜ: リード投入と進捗確認を CRM 画面から行うため
 */
package com.example.dialer.api;

import com.example.dialer.api.request.EnqueueLeadsRequest;
import com.example.dialer.api.response.EnqueueLeadsResponse;
import com.example.dialer.api.response.QueueRemovalResponse;
import com.example.dialer.api.response.QueueStatusResponse;
import com.example.dialer.service.QueueService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/orgs/{org_id}")
@RequiredArgsConstructor
@Validated
public class QueueController {

  private final QueueService queueService;

  @PostMapping("/queue/entries")
  public ResponseEntity<EnqueueLeadsResponse> enqueue(
      @PathVariable("org_id") @NotBlank(message = "org_id is required") String orgId,
      @Valid @RequestBody EnqueueLeadsRequest request) {
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(queueService.enqueue(orgId, request));
  }

  @GetMapping("/queue")
  public QueueStatusResponse status(
      @PathVariable("org_id") @NotBlank(message = "org_id is required") String orgId) {
    return queueService.status(orgId);
  }

  @DeleteMapping("/queue/entries/{lead_id}")
  public QueueRemovalResponse remove(
      @PathVariable("org_id") @NotBlank(message = "org_id is required") String orgId,
      @PathVariable("lead_id") @NotBlank(message = "lead_id is required") String leadId) {
    return queueService.remove(orgId, leadId);
  }

  @DeleteMapping("/queue/entries")
  public QueueRemovalResponse clear(
      @PathVariable("org_id") @NotBlank(message = "org_id is required") String orgId) {
    return queueService.clear(orgId);
  }
}
