package io.vaultledger.holdersbackend.service;

import com.fasterxml.jackson.core.type.TypeReference;
import io.vaultledger.holdersbackend.config.HoldersProperties;
import io.vaultledger.holdersbackend.model.Chain;
import io.vaultledger.holdersbackend.model.HolderRecord;
import io.vaultledger.holdersbackend.model.IndexerStatus;
import io.vaultledger.holdersbackend.model.TokenBalances;
import io.vaultledger.holdersbackend.model.VaultTopology;
import io.vaultledger.holdersbackend.util.Addresses;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Request-level entry point used by the controllers: parses path values, resolves {@code latest},
 * and caches each response under a key built from the resolved inputs.
 */
@Service
public class HoldersQueryService {
  private static final TypeReference<List<HolderRecord>> HOLDERS = new TypeReference<>() {};
  private static final TypeReference<List<TokenBalances>> TOKEN_BALANCES =
      new TypeReference<>() {};
  private static final TypeReference<Map<String, List<IndexerStatus>>> STATUS =
      new TypeReference<>() {};

  private static final long STATUS_TTL_SECONDS = 60;

  private final VaultHoldersService vaultHolders;
  private final ContractHoldersService contractHolders;
  private final VaultConfigService vaultConfig;
  private final IndexerStatusService indexerStatus;
  private final BlockResolver blocks;
  private final RedisCache cache;
  private final long ttlSeconds;

  public HoldersQueryService(
      VaultHoldersService vaultHolders,
      ContractHoldersService contractHolders,
      VaultConfigService vaultConfig,
      IndexerStatusService indexerStatus,
      BlockResolver blocks,
      RedisCache cache,
      HoldersProperties properties) {
    this.vaultHolders = vaultHolders;
    this.contractHolders = contractHolders;
    this.vaultConfig = vaultConfig;
    this.indexerStatus = indexerStatus;
    this.blocks = blocks;
    this.cache = cache;
    this.ttlSeconds = Math.max(1L, properties.getCache().getTtlSeconds());
  }

  public Mono<Map<String, List<IndexerStatus>>> status() {
    return cache.wrap("status", STATUS_TTL_SECONDS, STATUS, indexerStatus::status);
  }

  public Mono<List<VaultTopology>> vaults(String chain, boolean includeEol) {
    return Mono.defer(() -> vaultConfig.listVaults(Chain.parse(chain), includeEol));
  }

  public Mono<List<TokenBalances>> contractBalances(
      String chain, String contractAddress, String block) {
    return Mono.defer(
        () -> {
          Chain c = Chain.parse(chain);
          String address = Addresses.normalize(contractAddress);
          return blocks
              .resolve(c, block)
              .flatMap(
                  b ->
                      cache.wrap(
                          "contract:" + c.key() + ":" + address + ":" + b + ":holders",
                          ttlSeconds,
                          TOKEN_BALANCES,
                          () -> contractHolders.contractBalances(c, address, b)));
        });
  }

  public Mono<List<TokenBalances>> topHolders(
      String chain, List<String> contractAddresses, int limit) {
    return Mono.defer(
        () -> {
          Chain c = Chain.parse(chain);
          if (contractAddresses == null || contractAddresses.isEmpty()) {
            throw new IllegalArgumentException("contract_addresses is required");
          }
          List<String> addresses = Addresses.normalizeAll(contractAddresses);
          return cache.wrap(
              "vault:" + c.key() + ":" + String.join(",", addresses) + ":top-holders:" + limit,
              ttlSeconds,
              TOKEN_BALANCES,
              () -> contractHolders.topHolders(c, addresses, limit));
        });
  }

  public Mono<List<TokenBalances>> vaultTokenBalances(String chain, String vaultId, String block) {
    return Mono.defer(
        () -> {
          Chain c = Chain.parse(chain);
          String id = requireText(vaultId, "vault_id");
          return blocks
              .resolve(c, block)
              .flatMap(
                  b ->
                      cache.wrap(
                          "vault:" + c.key() + ":" + id + ":" + b + ":share-tokens-balances",
                          ttlSeconds,
                          TOKEN_BALANCES,
                          () -> vaultHolders.vaultTokenBalances(c, id, b)));
        });
  }

  public Mono<List<HolderRecord>> holdersByVaultId(
      String chain, String vaultId, String block, BigInteger balanceGt) {
    return holders(
        chain,
        "id",
        () -> requireText(vaultId, "vault_id"),
        block,
        balanceGt,
        (c, id, b, gt) -> vaultHolders.holdersForVaultId(c, id, b, gt));
  }

  public Mono<List<HolderRecord>> holdersByVaultAddress(
      String chain, String vaultAddress, String block, BigInteger balanceGt) {
    return holders(
        chain,
        "vault-address",
        () -> Addresses.normalize(vaultAddress),
        block,
        balanceGt,
        (c, address, b, gt) -> vaultHolders.holdersForVaultAddress(c, address, b, gt));
  }

  public Mono<List<HolderRecord>> holdersByStrategyAddress(
      String chain, String strategyAddress, String block, BigInteger balanceGt) {
    return holders(
        chain,
        "strategy-address",
        () -> Addresses.normalize(strategyAddress),
        block,
        balanceGt,
        (c, address, b, gt) -> vaultHolders.holdersForStrategyAddress(c, address, b, gt));
  }

  private Mono<List<HolderRecord>> holders(
      String chain,
      String lookup,
      Supplier<String> lookupValue,
      String block,
      BigInteger balanceGt,
      HoldersLoader loader) {
    return Mono.defer(
        () -> {
          Chain c = Chain.parse(chain);
          String value = lookupValue.get();
          BigInteger gt = floor(balanceGt);
          return blocks
              .resolve(c, block)
              .flatMap(
                  b ->
                      cache.wrap(
                          String.join(
                              ":",
                              "vault",
                              c.key(),
                              lookup,
                              value,
                              String.valueOf(b),
                              "bundle-holder-share",
                              gt.toString()),
                          ttlSeconds,
                          HOLDERS,
                          () -> loader.load(c, value, b, gt)));
        });
  }

  @FunctionalInterface
  private interface HoldersLoader {
    Mono<List<HolderRecord>> load(Chain chain, String lookupValue, long block, BigInteger balanceGt);
  }

  private static BigInteger floor(BigInteger balanceGt) {
    if (balanceGt == null) return BigInteger.ZERO;
    if (balanceGt.signum() < 0) throw new IllegalArgumentException("balance_gt must be >= 0");
    return balanceGt;
  }

  private static String requireText(String value, String name) {
    if (value == null || value.isBlank()) throw new IllegalArgumentException(name + " is required");
    return value.trim();
  }
}
