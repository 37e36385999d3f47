package io.vaultledger.holdersbackend.service;

import com.fasterxml.jackson.core.type.TypeReference;
import io.vaultledger.holdersbackend.model.Chain;
import io.vaultledger.holdersbackend.model.VaultBundle;
import io.vaultledger.holdersbackend.model.VaultKind;
import io.vaultledger.holdersbackend.model.VaultTopology;
import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** Vault bundles of one liquidity platform, shaped for that platform's integration. */
@Service
public class PartnerBundlesService {
  private static final Logger log = LoggerFactory.getLogger(PartnerBundlesService.class);

  private static final TypeReference<List<VaultBundle>> BUNDLES = new TypeReference<>() {};
  private static final TypeReference<List<VaultTopology>> TOPOLOGIES = new TypeReference<>() {};

  static final Set<String> BALANCER_PLATFORMS = Set.of("balancer", "aura");
  static final String CAMELOT = "camelot";

  private static final long TTL_SECONDS = 300;
  private static final int CONCURRENCY = 4;

  private final VaultConfigService vaultConfig;
  private final VaultHoldersService vaultHolders;
  private final BlockResolver blocks;
  private final RedisCache cache;

  public PartnerBundlesService(
      VaultConfigService vaultConfig,
      VaultHoldersService vaultHolders,
      BlockResolver blocks,
      RedisCache cache) {
    this.vaultConfig = vaultConfig;
    this.vaultHolders = vaultHolders;
    this.blocks = blocks;
    this.cache = cache;
  }

  /** Every balancer-backed vault of {@code chain} with its normalized holders at {@code block}. */
  public Mono<List<VaultBundle>> balancerBundles(String chain, String block) {
    return Mono.defer(
        () -> {
          Chain c = Chain.parse(chain);
          return blocks
              .resolve(c, block)
              .flatMap(
                  b ->
                      cache.wrap(
                          "balancer:config:" + c.key() + ":" + b,
                          TTL_SECONDS,
                          BUNDLES,
                          () -> loadBalancerBundles(c, b)));
        });
  }

  /**
   * Camelot-backed vaults of {@code chain}. A CLM manager wrapped by another listed vault is only
   * reported through that vault.
   */
  public Mono<List<VaultTopology>> camelotBundles(String chain, boolean includeEol) {
    return Mono.defer(
        () -> {
          Chain c = Chain.parse(chain);
          return cache.wrap(
              "camelot:config:" + c.key() + ":" + includeEol,
              TTL_SECONDS,
              TOPOLOGIES,
              () ->
                  vaultConfig
                      .findVaults(c, v -> (includeEol || v.isActive()) && v.isOnPlatform(CAMELOT))
                      .map(PartnerBundlesService::withoutWrappedManagers));
        });
  }

  private Mono<List<VaultBundle>> loadBalancerBundles(Chain chain, long block) {
    return vaultConfig
        .findVaults(chain, PartnerBundlesService::isBalancer)
        .flatMapMany(Flux::fromIterable)
        .flatMapSequential(
            topology ->
                vaultHolders
                    .normalizeHolders(chain, topology, block, BigInteger.ZERO)
                    .map(holders -> new VaultBundle(topology, holders)),
            CONCURRENCY)
        .collectList()
        .doOnSuccess(
            bundles ->
                log.debug(
                    "balancer bundles: chain={} block={} vaults={}",
                    chain.key(),
                    block,
                    bundles.size()));
  }

  static boolean isBalancer(VaultTopology v) {
    return v.platform() != null
        && BALANCER_PLATFORMS.contains(v.platform().toLowerCase(Locale.ROOT));
  }

  static List<VaultTopology> withoutWrappedManagers(List<VaultTopology> vaults) {
    Set<String> wrapped = new HashSet<>();
    for (VaultTopology v : vaults) {
      if (v.kind() == VaultKind.LAYERED) {
        wrapped.add(v.manager().vaultAddress().toLowerCase(Locale.ROOT));
      }
    }
    return vaults.stream()
        .filter(v -> !wrapped.contains(v.vaultAddress().toLowerCase(Locale.ROOT)))
        .toList();
  }
}
