/*
 * Where: pipeline API
 * What: cancel and check-cancelled endpoints used by the chat card and the running job
 * Why: a conflict must be distinguishable from a normal "nothing to stop"
 */
package com.example.pipeline.api;

import com.example.pipeline.model.CancellationResult;
import com.example.pipeline.service.CancellationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class CancellationController {

  private final CancellationService cancellationService;

  @RequestMapping(
      value = "/api/cancel",
      method = {RequestMethod.GET, RequestMethod.POST})
  public ResponseEntity<CancellationResponse> cancel(
      @RequestParam("executionId") String executionId,
      @RequestParam(name = "jobRef", required = false) String jobRef) {
    final CancellationResult result = cancellationService.cancel(executionId, jobRef);
    final HttpStatus status =
        switch (result.outcome()) {
          case STOPPED, ALREADY_COMPLETED, NOT_RUNNING -> HttpStatus.OK;
          case CONFLICT -> HttpStatus.CONFLICT;
          case STOP_FAILED -> HttpStatus.BAD_GATEWAY;
        };
    return ResponseEntity.status(status).body(CancellationResponse.from(result));
  }

  @GetMapping("/api/check-cancelled")
  public CheckCancelledResponse checkCancelled(@RequestParam("executionId") String executionId) {
    return new CheckCancelledResponse(
        executionId, cancellationService.isCancellationRequested(executionId));
  }
}
