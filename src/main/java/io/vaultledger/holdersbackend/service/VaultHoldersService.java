package io.vaultledger.holdersbackend.service;

import io.vaultledger.holdersbackend.error.HoldersException;
import io.vaultledger.holdersbackend.model.BalanceReconstruction;
import io.vaultledger.holdersbackend.model.Chain;
import io.vaultledger.holdersbackend.model.HoldDetail;
import io.vaultledger.holdersbackend.model.HolderRecord;
import io.vaultledger.holdersbackend.model.ManagerTopology;
import io.vaultledger.holdersbackend.model.TokenBalances;
import io.vaultledger.holdersbackend.model.VaultTopology;
import io.vaultledger.holdersbackend.util.Addresses;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Vault holders expressed in the structure's base share token.
 *
 * <p>For a SIMPLE vault the base token is the vault's own share token, and reward pool and boost
 * balances count one-for-one. For a LAYERED vault the base token is the manager's share token: the
 * outer vault's strategy holds manager shares on behalf of every outer share holder, and each outer
 * holder gets {@code floor(raw * strategyManagerShares / outerTotalSupply)} of them.
 */
@Service
public class VaultHoldersService {
  private static final Logger log = LoggerFactory.getLogger(VaultHoldersService.class);

  private final TokenBalanceAtBlockService balances;
  private final VaultConfigService vaultConfig;
  private final HoldersMetrics metrics;

  public VaultHoldersService(
      TokenBalanceAtBlockService balances, VaultConfigService vaultConfig, HoldersMetrics metrics) {
    this.balances = balances;
    this.vaultConfig = vaultConfig;
    this.metrics = metrics;
  }

  public Mono<List<HolderRecord>> holdersForVaultId(
      Chain chain, String vaultId, long block, BigInteger balanceGt) {
    return vaultConfig
        .findUnique(chain, VaultConfigService.byId(vaultId), "id", vaultId)
        .flatMap(topology -> normalizeHolders(chain, topology, block, balanceGt));
  }

  public Mono<List<HolderRecord>> holdersForVaultAddress(
      Chain chain, String vaultAddress, long block, BigInteger balanceGt) {
    String address = Addresses.normalize(vaultAddress);
    return vaultConfig
        .findUnique(chain, VaultConfigService.byVaultAddress(address), "vault_address", address)
        .flatMap(topology -> normalizeHolders(chain, topology, block, balanceGt));
  }

  public Mono<List<HolderRecord>> holdersForStrategyAddress(
      Chain chain, String strategyAddress, long block, BigInteger balanceGt) {
    String address = Addresses.normalize(strategyAddress);
    return vaultConfig
        .findUnique(
            chain, VaultConfigService.byStrategyAddress(address), "strategy_address", address)
        .flatMap(topology -> normalizeHolders(chain, topology, block, balanceGt));
  }

  /**
   * One normalized balance per real holder of {@code topology} at {@code block}. Holders whose
   * total is not strictly above {@code balanceGt} (default zero) are dropped.
   */
  public Mono<List<HolderRecord>> normalizeHolders(
      Chain chain, VaultTopology topology, long block, BigInteger balanceGt) {
    if (topology.chain() != null && topology.chain() != chain) {
      return Mono.error(
          new IllegalArgumentException(
              "vault " + topology.id() + " is on " + topology.chain().key() + ", not " + chain.key()));
    }
    BigInteger floor = balanceGt == null ? BigInteger.ZERO : balanceGt;
    // Only the zero address is excluded here: strategy balances are the aggregate claims.
    return balances
        .reconstructBalances(chain, block, topology.tokenAddresses(), List.of())
        .map(
            reconstruction -> {
              metrics.normalization(topology.kind());
              return normalize(topology, reconstruction, floor);
            });
  }

  /**
   * Raw balances of every constituent token of the vaults whose id starts with {@code
   * vaultIdPrefix}. Strategies and the vaults' own token contracts are not reported as holders.
   */
  public Mono<List<TokenBalances>> vaultTokenBalances(Chain chain, String vaultIdPrefix, long block) {
    return vaultConfig
        .findVaults(chain, VaultConfigService.byIdPrefix(vaultIdPrefix))
        .flatMap(
            configs -> {
              if (configs.isEmpty()) {
                return Mono.error(HoldersException.vaultNotFound("id", vaultIdPrefix));
              }
              Set<String> tokens = new LinkedHashSet<>();
              Set<String> excluded = new LinkedHashSet<>();
              for (VaultTopology c : configs) {
                tokens.addAll(c.tokenAddresses());
                excluded.addAll(c.operationalAddresses());
              }
              excluded.add(Addresses.ZERO_ADDRESS);
              return balances
                  .reconstructBalances(chain, block, List.copyOf(tokens), List.copyOf(excluded))
                  .map(r -> TokenBalancesView.of(r, excluded, BigInteger.ZERO));
            });
  }

  static List<HolderRecord> normalize(
      VaultTopology topology, BalanceReconstruction reconstruction, BigInteger balanceGt) {
    Set<String> excluded = new LinkedHashSet<>(topology.operationalAddresses());
    excluded.add(Addresses.ZERO_ADDRESS);

    List<HolderRecord> contributions;
    switch (topology.kind()) {
      case LAYERED:
        contributions = layeredContributions(topology, reconstruction, excluded);
        break;
      case SIMPLE:
      default:
        contributions = simpleContributions(topology, reconstruction, excluded);
        break;
    }
    return aggregateByHolder(contributions, balanceGt);
  }

  private static List<HolderRecord> simpleContributions(
      VaultTopology topology, BalanceReconstruction reconstruction, Set<String> excluded) {
    List<HolderRecord> out = new ArrayList<>();
    for (HolderRecord h :
        holdersOf(
            reconstruction,
            topology.vaultAddress(),
            topology.rewardPoolAddresses(),
            topology.boostAddresses())) {
      if (h.balance().signum() != 0 && !excluded.contains(h.holder())) out.add(h);
    }
    return out;
  }

  private static List<HolderRecord> layeredContributions(
      VaultTopology topology, BalanceReconstruction reconstruction, Set<String> excluded) {
    ManagerTopology manager = topology.manager();

    // Already in manager shares.
    List<HolderRecord> managerShareHolders =
        holdersOf(
            reconstruction,
            manager.vaultAddress(),
            manager.rewardPoolAddresses(),
            manager.boostAddresses());

    String strategy = topology.strategyAddress().toLowerCase();
    BigInteger aggregateClaim =
        reconstruction.balancesOf(manager.vaultAddress()).getOrDefault(strategy, BigInteger.ZERO);

    BigInteger outerTotalSupply = BigInteger.ZERO;
    for (BigInteger b : reconstruction.balancesOf(topology.vaultAddress()).values()) {
      if (b.signum() > 0) outerTotalSupply = outerTotalSupply.add(b);
    }

    List<HolderRecord> outerShareHolders = new ArrayList<>();
    for (HolderRecord h :
        holdersOf(
            reconstruction,
            topology.vaultAddress(),
            topology.rewardPoolAddresses(),
            topology.boostAddresses())) {
      // A negative replayed balance holds no claim.
      if (h.balance().signum() > 0 && !excluded.contains(h.holder())) outerShareHolders.add(h);
    }

    if (aggregateClaim.signum() == 0 && outerTotalSupply.signum() > 0) {
      // Indistinguishable from a strategy that has not deposited yet.
      log.warn(
          "no manager shares held by strategy: vault={} strategy={} block={} outerSupply={}",
          topology.id(),
          strategy,
          reconstruction.targetBlock(),
          outerTotalSupply);
    }

    List<HolderRecord> all = new ArrayList<>(managerShareHolders);
    if (outerTotalSupply.signum() > 0) {
      for (HolderRecord h : outerShareHolders) {
        BigInteger converted = h.balance().multiply(aggregateClaim).divide(outerTotalSupply);
        all.add(new HolderRecord(h.holder(), converted, h.holdDetails()));
      }
    }

    List<HolderRecord> out = new ArrayList<>();
    for (HolderRecord h : all) {
      if (h.balance().signum() != 0 && !excluded.contains(h.holder())) out.add(h);
    }
    return out;
  }

  /** One record per (token, holder) with a single provenance entry, tokens in argument order. */
  private static List<HolderRecord> holdersOf(
      BalanceReconstruction reconstruction,
      String shareToken,
      List<String> rewardPools,
      List<String> boosts) {
    Set<String> tokens = new LinkedHashSet<>();
    tokens.add(shareToken.toLowerCase());
    rewardPools.forEach(p -> tokens.add(p.toLowerCase()));
    boosts.forEach(b -> tokens.add(b.toLowerCase()));

    List<HolderRecord> out = new ArrayList<>();
    for (String token : tokens) {
      for (Map.Entry<String, BigInteger> e : reconstruction.balancesOf(token).entrySet()) {
        out.add(
            new HolderRecord(
                e.getKey(), e.getValue(), List.of(new HoldDetail(token, e.getValue()))));
      }
    }
    return out;
  }

  /** Group by holder, sum balances, concatenate provenance; keep totals above {@code balanceGt}. */
  private static List<HolderRecord> aggregateByHolder(
      List<HolderRecord> contributions, BigInteger balanceGt) {
    Map<String, BigInteger> totals = new LinkedHashMap<>();
    Map<String, List<HoldDetail>> details = new LinkedHashMap<>();
    for (HolderRecord h : contributions) {
      String holder = h.holder().toLowerCase();
      totals.merge(holder, h.balance(), BigInteger::add);
      details.computeIfAbsent(holder, k -> new ArrayList<>()).addAll(h.holdDetails());
    }
    List<HolderRecord> out = new ArrayList<>();
    for (Map.Entry<String, BigInteger> e : totals.entrySet()) {
      if (e.getValue().compareTo(balanceGt) <= 0) continue;
      out.add(new HolderRecord(e.getKey(), e.getValue(), details.get(e.getKey())));
    }
    return List.copyOf(out);
  }
}
