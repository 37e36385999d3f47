package io.vaultledger.holdersbackend.controller;

import io.vaultledger.holdersbackend.model.VaultTopology;
import io.vaultledger.holdersbackend.service.HoldersQueryService;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping(path = "/api/v1/config", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class ConfigController {
  private final HoldersQueryService holders;

  public ConfigController(HoldersQueryService holders) {
    this.holders = holders;
  }

  /** Vault topologies of one chain; end-of-life vaults only with {@code include_eol=true}. */
  @GetMapping("/{chain}/vaults")
  public Mono<List<VaultTopology>> getVaults(
      @PathVariable("chain") @NotBlank String chain,
      @RequestParam(value = "include_eol", required = false, defaultValue = "false")
          boolean includeEol) {
    return holders.vaults(chain, includeEol);
  }
}
