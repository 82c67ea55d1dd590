/*
 * どこで: Dialer API
 * 何を: 担当者の一斉発信モード (セッション) の開始/終了を提供する
 * なぜ: 担当者プールへの参加/離脱を CRM から行うため
 */
package com.example.dialer.api;

import com.example.dialer.api.request.OpenRepSessionRequest;
import com.example.dialer.api.response.RepSessionResponse;
import com.example.dialer.service.RepPoolService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/orgs/{org_id}/reps/{rep_id}/session")
@RequiredArgsConstructor
@Validated
public class RepSessionController {

  private final RepPoolService repPoolService;

  @PostMapping
  public RepSessionResponse open(
      @PathVariable("org_id") @NotBlank(message = "org_id is required") String orgId,
      @PathVariable("rep_id") @NotBlank(message = "rep_id is required") String repId,
      @Valid @RequestBody OpenRepSessionRequest request) {
    return repPoolService.openSession(orgId, repId, request);
  }

  @DeleteMapping
  public RepSessionResponse close(
      @PathVariable("org_id") @NotBlank(message = "org_id is required") String orgId,
      @PathVariable("rep_id") @NotBlank(message = "rep_id is required") String repId) {
    return repPoolService.closeSession(orgId, repId);
  }
}
