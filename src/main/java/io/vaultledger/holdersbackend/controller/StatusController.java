package io.vaultledger.holdersbackend.controller;

import io.vaultledger.holdersbackend.model.IndexerStatus;
import io.vaultledger.holdersbackend.service.HoldersQueryService;
import java.util.List;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping(path = "/api/v1", produces = MediaType.APPLICATION_JSON_VALUE)
public class StatusController {
  private final HoldersQueryService holders;

  public StatusController(HoldersQueryService holders) {
    this.holders = holders;
  }

  @GetMapping("/status")
  public Mono<Map<String, List<IndexerStatus>>> getStatus() {
    return holders.status();
  }
}
