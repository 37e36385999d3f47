package io.vaultledger.holdersbackend.controller;

import io.vaultledger.holdersbackend.model.VaultBundle;
import io.vaultledger.holdersbackend.model.VaultTopology;
import io.vaultledger.holdersbackend.service.PartnerBundlesService;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping(path = "/api/v1/partner", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class PartnerController {
  private final PartnerBundlesService bundles;

  public PartnerController(PartnerBundlesService bundles) {
    this.bundles = bundles;
  }

  @GetMapping("/balancer/config/{chain}/{block}/bundles")
  public Mono<List<VaultBundle>> getBalancerBundles(
      @PathVariable("chain") @NotBlank String chain,
      @PathVariable("block") @NotBlank String block) {
    return bundles.balancerBundles(chain, block);
  }

  @GetMapping("/camelot/config/{chain}/bundles")
  public Mono<Map<String, List<VaultTopology>>> getCamelotBundles(
      @PathVariable("chain") @NotBlank String chain,
      @RequestParam(value = "include_eol", required = false, defaultValue = "false")
          boolean includeEol) {
    return bundles.camelotBundles(chain, includeEol).map(vaults -> Map.of("vaults", vaults));
  }
}
