package io.vaultledger.holdersbackend.model;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Balances of every (token, account) pair at {@code targetBlock}.
 *
 * <p>{@code balances} is keyed by lower-cased token address, then lower-cased account address.
 * Both levels are immutable.
 */
public record BalanceReconstruction(
    Chain chain,
    long targetBlock,
    long snapshotBlock,
    Map<String, Map<String, BigInteger>> balances,
    List<TokenMetadata> tokens) {

  public Map<String, BigInteger> balancesOf(String tokenAddress) {
    if (tokenAddress == null) return Map.of();
    return balances.getOrDefault(tokenAddress.toLowerCase(), Map.of());
  }
}
