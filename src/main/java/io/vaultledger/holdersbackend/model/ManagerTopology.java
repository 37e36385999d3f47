package io.vaultledger.holdersbackend.model;

import java.util.List;

public record ManagerTopology(
    String id,
    String vaultAddress,
    String strategyAddress,
    List<String> rewardPoolAddresses,
    List<String> boostAddresses) {

  public ManagerTopology {
    rewardPoolAddresses = rewardPoolAddresses == null ? List.of() : List.copyOf(rewardPoolAddresses);
    boostAddresses = boostAddresses == null ? List.of() : List.copyOf(boostAddresses);
  }
}
