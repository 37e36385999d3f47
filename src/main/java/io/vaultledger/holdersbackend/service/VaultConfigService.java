package io.vaultledger.holdersbackend.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.vaultledger.holdersbackend.client.VaultApiClient;
import io.vaultledger.holdersbackend.config.HoldersProperties;
import io.vaultledger.holdersbackend.error.HoldersException;
import io.vaultledger.holdersbackend.model.Chain;
import io.vaultledger.holdersbackend.model.ManagerTopology;
import io.vaultledger.holdersbackend.model.VaultTopology;
import io.vaultledger.holdersbackend.util.Addresses;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Vault registry: joins vaults, CLM managers, reward pools and boosts into one {@link
 * VaultTopology} per vault.
 *
 * <p>A vault whose deposit token is a CLM manager becomes LAYERED on that manager; every other vault
 * and every CLM manager is SIMPLE. Reward pools and boosts attach to the vault or manager whose
 * address they stake.
 */
@Service
public class VaultConfigService {
  private static final Logger log = LoggerFactory.getLogger(VaultConfigService.class);

  private static final String CACHE_PREFIX = "vault-api:";
  private static final TypeReference<JsonNode> JSON = new TypeReference<>() {};

  private final VaultApiClient vaultApi;
  private final RedisCache cache;
  private final long cacheTtlSeconds;

  public VaultConfigService(
      VaultApiClient vaultApi, RedisCache cache, HoldersProperties properties) {
    this.vaultApi = vaultApi;
    this.cache = cache;
    this.cacheTtlSeconds = Math.max(5L, properties.getVaultApi().getCacheTtlSeconds());
  }

  public static Predicate<VaultTopology> byIdPrefix(String prefix) {
    String p = prefix == null ? "" : prefix.trim();
    return v -> v.id() != null && v.id().startsWith(p);
  }

  public static Predicate<VaultTopology> byId(String id) {
    String p = id == null ? "" : id.trim();
    return v -> p.equals(v.id());
  }

  public static Predicate<VaultTopology> byVaultAddress(String address) {
    return v -> Addresses.sameAddress(v.vaultAddress(), address);
  }

  public static Predicate<VaultTopology> byStrategyAddress(String address) {
    return v -> Addresses.sameAddress(v.strategyAddress(), address);
  }

  /** Zero, one or many topologies of {@code chain} matching {@code filter}. */
  public Mono<List<VaultTopology>> findVaults(Chain chain, Predicate<VaultTopology> filter) {
    return loadAll(chain).map(all -> all.stream().filter(filter).toList());
  }

  public Mono<List<VaultTopology>> listVaults(Chain chain, boolean includeEol) {
    return findVaults(chain, v -> includeEol || v.isActive());
  }

  /**
   * The single topology matching {@code filter}; {@code VAULT_NOT_FOUND} or {@code
   * VAULT_NOT_UNIQUE} otherwise. {@code field} and {@code value} name the lookup in the error.
   */
  public Mono<VaultTopology> findUnique(
      Chain chain, Predicate<VaultTopology> filter, String field, String value) {
    return findVaults(chain, filter)
        .flatMap(
            matches -> {
              if (matches.isEmpty()) {
                return Mono.error(HoldersException.vaultNotFound(field, value));
              }
              if (matches.size() > 1) {
                return Mono.error(HoldersException.vaultNotUnique(field, value, matches.size()));
              }
              return Mono.just(matches.get(0));
            });
  }

  private Mono<List<VaultTopology>> loadAll(Chain chain) {
    return Mono.zip(
            fetchCached(VaultApiClient.VAULTS_PATH),
            fetchCached(VaultApiClient.CLM_MANAGERS_PATH),
            fetchCached(VaultApiClient.REWARD_POOLS_PATH),
            fetchCached(VaultApiClient.BOOSTS_PATH))
        .map(t -> buildTopologies(chain, t.getT1(), t.getT2(), t.getT3(), t.getT4()));
  }

  private Mono<JsonNode> fetchCached(String path) {
    return cache.wrap(CACHE_PREFIX + path, cacheTtlSeconds, JSON, () -> vaultApi.fetchArray(path));
  }

  static List<VaultTopology> buildTopologies(
      Chain chain, JsonNode vaults, JsonNode clmManagers, JsonNode rewardPools, JsonNode boosts) {
    Map<String, List<String>> poolsByStakedToken = stakedBy(chain, rewardPools);
    Map<String, List<String>> boostsByStakedToken = stakedBy(chain, boosts);

    Map<String, VaultTopology> byId = new LinkedHashMap<>();
    Map<String, ManagerTopology> managersByAddress = new LinkedHashMap<>();

    for (JsonNode m : clmManagers) {
      if (!onChain(m, chain)) continue;
      String id = text(m, "id");
      String address = address(m, "earnContractAddress");
      String strategy = address(m, "strategy");
      if (id == null || address == null || strategy == null) {
        log.debug("skipping clm manager without id/address/strategy: {}", id);
        continue;
      }
      List<String> pools = poolsByStakedToken.getOrDefault(address, List.of());
      List<String> boostList = boostsByStakedToken.getOrDefault(address, List.of());
      managersByAddress.put(address, new ManagerTopology(id, address, strategy, pools, boostList));
      byId.putIfAbsent(
          id,
          VaultTopology.simple(
              id, chain, text(m, "status"), platform(m), address, strategy, pools, boostList));
    }

    for (JsonNode v : vaults) {
      if (!onChain(v, chain)) continue;
      if ("gov".equalsIgnoreCase(text(v, "type"))) continue;
      String id = text(v, "id");
      String address = address(v, "earnContractAddress");
      String strategy = address(v, "strategy");
      if (id == null || address == null || strategy == null) {
        log.debug("skipping vault without id/address/strategy: {}", id);
        continue;
      }
      List<String> pools = poolsByStakedToken.getOrDefault(address, List.of());
      List<String> boostList = boostsByStakedToken.getOrDefault(address, List.of());
      String status = text(v, "status");
      String platform = platform(v);
      String depositToken = address(v, "tokenAddress");
      ManagerTopology manager = depositToken == null ? null : managersByAddress.get(depositToken);
      VaultTopology topology =
          manager == null
              ? VaultTopology.simple(
                  id, chain, status, platform, address, strategy, pools, boostList)
              : VaultTopology.layered(
                  id, chain, status, platform, address, strategy, pools, boostList, manager);
      byId.putIfAbsent(id, topology);
    }

    return List.copyOf(byId.values());
  }

  /** Staked token address to the addresses of the contracts (pools, boosts) that stake it. */
  private static Map<String, List<String>> stakedBy(Chain chain, JsonNode stakingContracts) {
    Map<String, Set<String>> out = new LinkedHashMap<>();
    for (JsonNode s : stakingContracts) {
      if (!onChain(s, chain)) continue;
      String staked = address(s, "tokenAddress");
      String contract = address(s, "earnContractAddress");
      if (staked == null || contract == null) continue;
      out.computeIfAbsent(staked, k -> new LinkedHashSet<>()).add(contract);
    }
    Map<String, List<String>> frozen = new LinkedHashMap<>();
    out.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
    return frozen;
  }

  /** Liquidity provider first; aura vaults, for one, are provided by balancer. */
  private static String platform(JsonNode node) {
    String p = text(node, "tokenProviderId");
    if (p == null) p = text(node, "platformId");
    return p == null ? null : p.toLowerCase(Locale.ROOT);
  }

  private static boolean onChain(JsonNode node, Chain chain) {
    String c = text(node, "chain");
    return c != null && chain.key().equals(c.toLowerCase(Locale.ROOT));
  }

  private static String address(JsonNode node, String field) {
    String v = text(node, field);
    return Addresses.isValid(v) ? v.toLowerCase(Locale.ROOT) : null;
  }

  private static String text(JsonNode node, String field) {
    JsonNode n = node.path(field);
    if (n.isMissingNode() || n.isNull()) return null;
    String v = n.asText("").trim();
    return v.isBlank() ? null : v;
  }
}
