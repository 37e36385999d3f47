package io.vaultledger.holdersbackend.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vaultledger.holdersbackend.config.HoldersProperties;
import io.vaultledger.holdersbackend.error.HoldersErrorCode;
import io.vaultledger.holdersbackend.error.HoldersException;
import io.vaultledger.holdersbackend.model.BalanceReconstruction;
import io.vaultledger.holdersbackend.model.Chain;
import io.vaultledger.holdersbackend.model.HoldDetail;
import io.vaultledger.holdersbackend.model.HolderRecord;
import io.vaultledger.holdersbackend.model.ManagerTopology;
import io.vaultledger.holdersbackend.model.TokenBalances;
import io.vaultledger.holdersbackend.model.TokenMetadata;
import io.vaultledger.holdersbackend.model.VaultTopology;
import io.vaultledger.holdersbackend.util.Addresses;
import java.math.BigInteger;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

class VaultHoldersServiceTest {
  private static final String VAULT = addr('a');
  private static final String STRATEGY = addr('b');
  private static final String POOL = addr('c');
  private static final String BOOST = addr('d');
  private static final String MANAGER = addr('e');
  private static final String MANAGER_STRATEGY = addr('f');
  private static final String MANAGER_POOL = addr('9');
  private static final String H1 = addr('1');
  private static final String H2 = addr('2');
  private static final String H3 = addr('3');

  private TokenBalanceAtBlockService balances;
  private VaultConfigService vaultConfig;
  private SimpleMeterRegistry registry;
  private VaultHoldersService service;

  @BeforeEach
  void setUp() {
    balances = mock(TokenBalanceAtBlockService.class);
    vaultConfig = mock(VaultConfigService.class);
    registry = new SimpleMeterRegistry();
    service =
        new VaultHoldersService(
            balances, vaultConfig, new HoldersMetrics(registry, new HoldersProperties()));
  }

  private static String addr(char c) {
    return "0x" + String.valueOf(c).repeat(40);
  }

  private static BigInteger big(long v) {
    return BigInteger.valueOf(v);
  }

  private static VaultTopology simple() {
    return VaultTopology.simple(
        "cake-bnb", Chain.BSC, "active", "pancakeswap", VAULT, STRATEGY, List.of(POOL), List.of(BOOST));
  }

  private static VaultTopology layered() {
    ManagerTopology manager =
        new ManagerTopology("cow-bnb", MANAGER, MANAGER_STRATEGY, List.of(MANAGER_POOL), List.of());
    return VaultTopology.layered(
        "cow-bnb-vault", Chain.BSC, "active", "pancakeswap", VAULT, STRATEGY, List.of(), List.of(), manager);
  }

  private static BalanceReconstruction reconstruction(Map<String, Map<String, BigInteger>> balances) {
    return new BalanceReconstruction(Chain.BSC, 200, 100, balances, List.of());
  }

  private static Map<String, HolderRecord> byHolder(List<HolderRecord> records) {
    return records.stream()
        .collect(Collectors.toMap(HolderRecord::holder, Function.identity(), (a, b) -> a, LinkedHashMap::new));
  }

  @Test
  void simpleVaultReportsShareHolders() {
    BalanceReconstruction r = reconstruction(Map.of(VAULT, Map.of(H1, big(600), H2, big(400))));

    List<HolderRecord> out = VaultHoldersService.normalize(simple(), r, BigInteger.ZERO);

    Map<String, HolderRecord> holders = byHolder(out);
    assertEquals(2, holders.size());
    assertEquals(big(600), holders.get(H1).balance());
    assertEquals(big(400), holders.get(H2).balance());
    assertEquals(List.of(new HoldDetail(VAULT, big(600))), holders.get(H1).holdDetails());
  }

  @Test
  void simpleVaultMergesPoolAndBoostPositions() {
    BalanceReconstruction r =
        reconstruction(
            Map.of(
                VAULT, Map.of(H1, big(100), POOL, big(50), BOOST, big(25), STRATEGY, big(7)),
                POOL, Map.of(H1, big(30), H2, big(20)),
                BOOST, Map.of(H2, big(25))));

    Map<String, HolderRecord> holders =
        byHolder(VaultHoldersService.normalize(simple(), r, BigInteger.ZERO));

    assertEquals(Set.of(H1, H2), holders.keySet());
    assertEquals(big(130), holders.get(H1).balance());
    assertEquals(big(45), holders.get(H2).balance());
    assertEquals(2, holders.get(H1).holdDetails().size());
    assertEquals(
        Set.of(POOL, BOOST),
        holders.get(H2).holdDetails().stream().map(HoldDetail::token).collect(Collectors.toSet()));
  }

  @Test
  void layeredVaultConvertsOuterSharesProRata() {
    BalanceReconstruction r =
        reconstruction(
            Map.of(
                VAULT, Map.of(H1, big(80), H2, big(20)),
                MANAGER, Map.of(STRATEGY, big(50), H1, big(7), H3, big(30))));

    Map<String, HolderRecord> holders =
        byHolder(VaultHoldersService.normalize(layered(), r, BigInteger.ZERO));

    assertEquals(Set.of(H1, H2, H3), holders.keySet());
    assertEquals(big(47), holders.get(H1).balance());
    assertEquals(big(10), holders.get(H2).balance());
    assertEquals(big(30), holders.get(H3).balance());
    assertEquals(
        List.of(new HoldDetail(MANAGER, big(7)), new HoldDetail(VAULT, big(80))),
        holders.get(H1).holdDetails());
  }

  @Test
  void layeredConversionFloorsEachHolder() {
    BalanceReconstruction r =
        reconstruction(
            Map.of(
                VAULT, Map.of(H1, big(1), H2, big(1), H3, big(1)),
                MANAGER, Map.of(STRATEGY, big(10))));

    List<HolderRecord> out = VaultHoldersService.normalize(layered(), r, BigInteger.ZERO);

    BigInteger total = out.stream().map(HolderRecord::balance).reduce(BigInteger.ZERO, BigInteger::add);
    assertEquals(3, out.size());
    assertTrue(out.stream().allMatch(h -> h.balance().equals(big(3))));
    // 10 manager shares, 9 attributed: rounding never overshoots the claim.
    assertTrue(total.compareTo(big(10)) <= 0);
  }

  @Test
  void layeredOuterPoolStakersCountThroughThePool() {
    ManagerTopology manager =
        new ManagerTopology("cow-bnb", MANAGER, MANAGER_STRATEGY, List.of(), List.of());
    VaultTopology topology =
        VaultTopology.layered(
            "cow-bnb-vault", Chain.BSC, "active", "pancakeswap", VAULT, STRATEGY, List.of(POOL), List.of(), manager);
    BalanceReconstruction r =
        reconstruction(
            Map.of(
                VAULT, Map.of(H1, big(60), POOL, big(40)),
                POOL, Map.of(H2, big(40)),
                MANAGER, Map.of(STRATEGY, big(200))));

    Map<String, HolderRecord> holders =
        byHolder(VaultHoldersService.normalize(topology, r, BigInteger.ZERO));

    assertEquals(Set.of(H1, H2), holders.keySet());
    assertEquals(big(120), holders.get(H1).balance());
    assertEquals(big(80), holders.get(H2).balance());
  }

  @Test
  void layeredWithoutClaimGivesOnlyDirectManagerHolders() {
    BalanceReconstruction r =
        reconstruction(
            Map.of(VAULT, Map.of(H1, big(80)), MANAGER, Map.of(H3, big(30))));

    Map<String, HolderRecord> holders =
        byHolder(VaultHoldersService.normalize(layered(), r, BigInteger.ZERO));

    assertEquals(Set.of(H3), holders.keySet());
  }

  @Test
  void layeredWithEmptyOuterVaultSkipsConversion() {
    BalanceReconstruction r = reconstruction(Map.of(MANAGER, Map.of(STRATEGY, big(50), H3, big(5))));

    Map<String, HolderRecord> holders =
        byHolder(VaultHoldersService.normalize(layered(), r, BigInteger.ZERO));

    assertEquals(Set.of(H3), holders.keySet());
  }

  @Test
  void operationalAddressesNeverAppear() {
    VaultTopology topology = layered();
    BalanceReconstruction r =
        reconstruction(
            Map.of(
                VAULT, Map.of(H1, big(10), STRATEGY, big(5), MANAGER, big(5), Addresses.ZERO_ADDRESS, big(1)),
                MANAGER, Map.of(STRATEGY, big(50), MANAGER_STRATEGY, big(3), MANAGER_POOL, big(9), VAULT, big(4)),
                MANAGER_POOL, Map.of(H2, big(9), MANAGER_STRATEGY, big(1))));

    List<HolderRecord> out = VaultHoldersService.normalize(topology, r, BigInteger.ZERO);

    Set<String> forbidden = new HashSet<>(topology.operationalAddresses());
    forbidden.add(Addresses.ZERO_ADDRESS);
    assertFalse(out.isEmpty());
    assertTrue(out.stream().noneMatch(h -> forbidden.contains(h.holder())));
  }

  @Test
  void balanceFloorIsStrict() {
    BalanceReconstruction r = reconstruction(Map.of(VAULT, Map.of(H1, big(600), H2, big(400))));

    List<HolderRecord> out = VaultHoldersService.normalize(simple(), r, big(400));

    assertEquals(List.of(H1), out.stream().map(HolderRecord::holder).toList());
  }

  @Test
  void normalizeHoldersReconstructsAllTokensExcludingOnlyZero() {
    VaultTopology topology = layered();
    BalanceReconstruction r =
        reconstruction(
            Map.of(VAULT, Map.of(H1, big(80), H2, big(20)), MANAGER, Map.of(STRATEGY, big(50))));
    when(balances.reconstructBalances(eq(Chain.BSC), eq(200L), anyList(), anyList()))
        .thenReturn(Mono.just(r));

    List<HolderRecord> first = service.normalizeHolders(Chain.BSC, topology, 200L, null).block();
    List<HolderRecord> second = service.normalizeHolders(Chain.BSC, topology, 200L, null).block();

    assertEquals(first, second);
    verify(balances, times(2))
        .reconstructBalances(Chain.BSC, 200L, topology.tokenAddresses(), List.of());
    assertEquals(2.0, registry.counter("holders.normalization", "kind", "layered").count());
  }

  @Test
  void normalizeHoldersIsRepeatable() {
    VaultTopology topology = simple();
    BalanceReconstruction r =
        reconstruction(
            Map.of(
                VAULT, Map.of(H1, big(100), POOL, big(50)),
                POOL, Map.of(H1, big(20), H2, big(30))));
    when(balances.reconstructBalances(eq(Chain.BSC), eq(200L), anyList(), anyList()))
        .thenReturn(Mono.just(r));

    Mono<List<HolderRecord>> holders = service.normalizeHolders(Chain.BSC, topology, 200L, null);
    List<HolderRecord> first = holders.block();
    List<HolderRecord> again = holders.block();
    List<HolderRecord> fresh = service.normalizeHolders(Chain.BSC, topology, 200L, null).block();

    assertEquals(first, again);
    assertEquals(first, fresh);
    assertEquals(big(120), byHolder(first).get(H1).balance());
  }

  @Test
  void layeredNegativeOuterBalanceGetsNoClaim() {
    BalanceReconstruction r =
        reconstruction(
            Map.of(
                VAULT, Map.of(H1, big(-3), H2, big(13)),
                MANAGER, Map.of(STRATEGY, big(7))));

    Map<String, HolderRecord> holders =
        byHolder(VaultHoldersService.normalize(layered(), r, BigInteger.ZERO));

    assertEquals(Set.of(H2), holders.keySet());
    assertEquals(big(7), holders.get(H2).balance());
  }

  @Test
  void normalizeHoldersRejectsTopologyOfAnotherChain() {
    assertThrows(
        IllegalArgumentException.class,
        () -> service.normalizeHolders(Chain.BASE, simple(), 200L, BigInteger.ZERO).block());
  }

  @Test
  void unknownVaultIdIsNotFound() {
    when(vaultConfig.findUnique(eq(Chain.BSC), any(), eq("id"), eq("nope")))
        .thenReturn(Mono.error(HoldersException.vaultNotFound("id", "nope")));

    HoldersException e =
        assertThrows(
            HoldersException.class,
            () -> service.holdersForVaultId(Chain.BSC, "nope", 200L, BigInteger.ZERO).block());

    assertEquals(HoldersErrorCode.VAULT_NOT_FOUND, e.getCode());
    verify(balances, never()).reconstructBalances(any(), anyLong(), anyList(), anyList());
  }

  @Test
  void vaultAddressLookupIsNormalized() {
    when(vaultConfig.findUnique(eq(Chain.BSC), any(), eq("vault_address"), eq(VAULT)))
        .thenReturn(Mono.just(simple()));
    when(balances.reconstructBalances(eq(Chain.BSC), eq(200L), anyList(), anyList()))
        .thenReturn(Mono.just(reconstruction(Map.of(VAULT, Map.of(H1, big(5))))));

    List<HolderRecord> out =
        service
            .holdersForVaultAddress(Chain.BSC, VAULT.toUpperCase().replace("0X", "0x"), 200L, null)
            .block();

    assertEquals(1, out.size());
  }

  @Test
  void vaultTokenBalancesListsConstituentsWithoutOperationalHolders() {
    when(vaultConfig.findVaults(eq(Chain.BSC), any())).thenReturn(Mono.just(List.of(simple())));
    BalanceReconstruction r =
        new BalanceReconstruction(
            Chain.BSC,
            200,
            100,
            Map.of(
                VAULT, Map.of(H1, big(1_500_000_000_000_000_000L), POOL, big(10)),
                POOL, Map.of(H2, big(10)),
                BOOST, Map.of()),
            List.of(
                new TokenMetadata("56-" + VAULT, VAULT, "Moo Cake", "mooCake", 18),
                new TokenMetadata("56-" + POOL, POOL, "Reward Pool", "rMoo", 18)));
    when(balances.reconstructBalances(eq(Chain.BSC), eq(200L), anyList(), anyList()))
        .thenReturn(Mono.just(r));

    List<TokenBalances> out = service.vaultTokenBalances(Chain.BSC, "cake", 200L).block();

    assertEquals(2, out.size());
    assertEquals(1, out.get(0).balances().size());
    assertEquals(H1, out.get(0).balances().get(0).holder());
    assertEquals("1.5", out.get(0).balances().get(0).balance());
    assertEquals("1500000000000000000", out.get(0).balances().get(0).amount());
  }

  @Test
  void vaultTokenBalancesWithoutMatchesIsNotFound() {
    when(vaultConfig.findVaults(eq(Chain.BSC), any())).thenReturn(Mono.just(List.of()));

    HoldersException e =
        assertThrows(
            HoldersException.class, () -> service.vaultTokenBalances(Chain.BSC, "nope", 1L).block());

    assertEquals(HoldersErrorCode.VAULT_NOT_FOUND, e.getCode());
  }
}
