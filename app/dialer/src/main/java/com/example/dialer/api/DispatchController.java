package com.example.dialer.api;

import com.example.dialer.api.response.DispatchResponse;
import com.example.dialer.service.DispatchResult;
import com.example.dialer.service.DispatchService;
import jakarta.validation.constraints.NotBlank;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/orgs/{org_id}")
@RequiredArgsConstructor
@Validated
public class DispatchController {

  private final DispatchService dispatchService;

  /** ワーカーの周期を待たずに発信サイクルを 1 回回す。 */
  @PostMapping("/dispatch")
  public DispatchResponse dispatch(
      @PathVariable("org_id") @NotBlank(message = "org_id is required") String orgId) {
    final DispatchResult result = dispatchService.runCycle(orgId);
    return new DispatchResponse(
        result.batchId() == null ? null : result.batchId().toString(),
        result.outcome().name().toLowerCase(Locale.ROOT),
        result.availableReps(),
        result.requested(),
        result.callHandles(),
        result.failures());
  }
}
