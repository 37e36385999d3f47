package io.vaultledger.holdersbackend.controller;

import io.vaultledger.holdersbackend.model.HolderRecord;
import io.vaultledger.holdersbackend.model.TokenBalances;
import io.vaultledger.holdersbackend.service.HoldersQueryService;
import jakarta.validation.constraints.NotBlank;
import java.math.BigInteger;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Vault holder endpoints. {@code block} is a block number or {@code latest}; {@code balance_gt}
 * is a raw integer in base share token units.
 */
@RestController
@RequestMapping(path = "/api/v1/vault", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class VaultController {
  private final HoldersQueryService holders;

  public VaultController(HoldersQueryService holders) {
    this.holders = holders;
  }

  @GetMapping("/{chain}/{vault_id}/{block}/share-tokens-balances")
  public Mono<List<TokenBalances>> getShareTokenBalances(
      @PathVariable("chain") @NotBlank String chain,
      @PathVariable("vault_id") @NotBlank String vaultId,
      @PathVariable("block") @NotBlank String block) {
    return holders.vaultTokenBalances(chain, vaultId, block);
  }

  @GetMapping("/{chain}/{vault_id}/{block}/bundle-holder-share")
  public Mono<List<HolderRecord>> getBundleHolderShare(
      @PathVariable("chain") @NotBlank String chain,
      @PathVariable("vault_id") @NotBlank String vaultId,
      @PathVariable("block") @NotBlank String block,
      @RequestParam(value = "balance_gt", required = false) BigInteger balanceGt) {
    return holders.holdersByVaultId(chain, vaultId, block, balanceGt);
  }

  @GetMapping("/{chain}/{vault_address}/{block}/bundle-holder-share-by-vault-address")
  public Mono<List<HolderRecord>> getBundleHolderShareByVaultAddress(
      @PathVariable("chain") @NotBlank String chain,
      @PathVariable("vault_address") @NotBlank String vaultAddress,
      @PathVariable("block") @NotBlank String block,
      @RequestParam(value = "balance_gt", required = false) BigInteger balanceGt) {
    return holders.holdersByVaultAddress(chain, vaultAddress, block, balanceGt);
  }

  @GetMapping("/{chain}/{strategy_address}/{block}/bundle-holder-share-by-strategy-address")
  public Mono<List<HolderRecord>> getBundleHolderShareByStrategyAddress(
      @PathVariable("chain") @NotBlank String chain,
      @PathVariable("strategy_address") @NotBlank String strategyAddress,
      @PathVariable("block") @NotBlank String block,
      @RequestParam(value = "balance_gt", required = false) BigInteger balanceGt) {
    return holders.holdersByStrategyAddress(chain, strategyAddress, block, balanceGt);
  }
}
