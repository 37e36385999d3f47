package io.vaultledger.holdersbackend.controller;

import io.vaultledger.holdersbackend.model.TokenBalances;
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
@RequestMapping(path = "/api/v1/contract", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class ContractController {
  private final HoldersQueryService holders;

  public ContractController(HoldersQueryService holders) {
    this.holders = holders;
  }

  @GetMapping("/{chain}/{contract_address}/{block}/share-tokens-balances")
  public Mono<List<TokenBalances>> getShareTokenBalances(
      @PathVariable("chain") @NotBlank String chain,
      @PathVariable("contract_address") @NotBlank String contractAddress,
      @PathVariable("block") @NotBlank String block) {
    return holders.contractBalances(chain, contractAddress, block);
  }

  /** Current largest holders of up to 100 tokens; {@code limit} applies per token. */
  @GetMapping("/{chain}/top-holders")
  public Mono<List<TokenBalances>> getTopHolders(
      @PathVariable("chain") @NotBlank String chain,
      @RequestParam("contract_addresses") List<String> contractAddresses,
      @RequestParam(value = "limit", required = false, defaultValue = "100") int limit) {
    return holders.topHolders(chain, contractAddresses, limit);
  }
}
