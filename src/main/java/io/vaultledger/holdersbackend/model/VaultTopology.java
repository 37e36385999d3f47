package io.vaultledger.holdersbackend.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Constituent contracts of one vault. {@code kind} tells which fields are populated: {@code
 * manager} is set exactly when {@code kind == LAYERED}. {@code platform} is the lower-cased
 * platform providing the deposited liquidity, when the registry names one.
 */
public record VaultTopology(
    VaultKind kind,
    String id,
    Chain chain,
    String status,
    String platform,
    String vaultAddress,
    String strategyAddress,
    List<String> rewardPoolAddresses,
    List<String> boostAddresses,
    ManagerTopology manager) {

  public VaultTopology {
    rewardPoolAddresses = rewardPoolAddresses == null ? List.of() : List.copyOf(rewardPoolAddresses);
    boostAddresses = boostAddresses == null ? List.of() : List.copyOf(boostAddresses);
    if (kind == VaultKind.LAYERED && manager == null) {
      throw new IllegalArgumentException("layered vault " + id + " has no manager");
    }
    if (kind == VaultKind.SIMPLE && manager != null) {
      throw new IllegalArgumentException("simple vault " + id + " cannot carry a manager");
    }
  }

  public static VaultTopology simple(
      String id,
      Chain chain,
      String status,
      String platform,
      String vaultAddress,
      String strategyAddress,
      List<String> rewardPools,
      List<String> boosts) {
    return new VaultTopology(
        VaultKind.SIMPLE,
        id,
        chain,
        status,
        platform,
        vaultAddress,
        strategyAddress,
        rewardPools,
        boosts,
        null);
  }

  public static VaultTopology layered(
      String id,
      Chain chain,
      String status,
      String platform,
      String vaultAddress,
      String strategyAddress,
      List<String> rewardPools,
      List<String> boosts,
      ManagerTopology manager) {
    return new VaultTopology(
        VaultKind.LAYERED,
        id,
        chain,
        status,
        platform,
        vaultAddress,
        strategyAddress,
        rewardPools,
        boosts,
        manager);
  }

  public boolean isActive() {
    return "active".equalsIgnoreCase(status);
  }

  public boolean isOnPlatform(String name) {
    return platform != null && platform.equalsIgnoreCase(name);
  }

  /** Every token contract of the structure, lower-cased and de-duplicated. */
  public List<String> tokenAddresses() {
    List<String> raw = new ArrayList<>();
    raw.add(vaultAddress);
    if (kind == VaultKind.LAYERED) {
      raw.add(manager.vaultAddress());
      raw.addAll(manager.rewardPoolAddresses());
      raw.addAll(manager.boostAddresses());
    }
    raw.addAll(rewardPoolAddresses);
    raw.addAll(boostAddresses);
    return lowerUnique(raw);
  }

  public List<String> strategyAddresses() {
    List<String> raw = new ArrayList<>();
    raw.add(strategyAddress);
    if (kind == VaultKind.LAYERED) raw.add(manager.strategyAddress());
    return lowerUnique(raw);
  }

  /** Addresses that can never be end-user holders: strategies and the structure's own tokens. */
  public Set<String> operationalAddresses() {
    Set<String> out = new LinkedHashSet<>(strategyAddresses());
    out.addAll(tokenAddresses());
    return Set.copyOf(out);
  }

  private static List<String> lowerUnique(List<String> addresses) {
    Set<String> seen = new LinkedHashSet<>();
    for (String a : addresses) {
      if (a == null || a.isBlank()) continue;
      seen.add(a.trim().toLowerCase(Locale.ROOT));
    }
    return List.copyOf(seen);
  }
}
