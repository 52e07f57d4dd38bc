/*
 * Where: Bot matchmaker status API
 * What: Exposes slot usage and matchmaking timing
 * Why: The bot runs unattended; this is the read-only window into its state
 */
package com.example.botmatch.api;

import com.example.botmatch.api.response.MatchmakingStatusResponse;
import com.example.botmatch.service.MatchmakingStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/matchmaking")
@RequiredArgsConstructor
public class MatchmakingStatusController {

  private final MatchmakingStatusService statusService;

  @GetMapping("/status")
  public ResponseEntity<MatchmakingStatusResponse> status() {
    return ResponseEntity.ok(statusService.currentStatus());
  }
}
