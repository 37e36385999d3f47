package io.vaultledger.holdersbackend.service;

import io.vaultledger.holdersbackend.model.BalanceReconstruction;
import io.vaultledger.holdersbackend.model.TokenBalances;
import io.vaultledger.holdersbackend.model.TokenMetadata;
import io.vaultledger.holdersbackend.util.Units;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/** Per-token holder listings rendered for responses. Raw amounts stay exact. */
final class TokenBalancesView {
  private TokenBalancesView() {}

  /**
   * One entry per token the indexer knows, in request order. Holders in {@code excluded} and
   * balances not strictly above {@code balanceGt} are left out.
   */
  static List<TokenBalances> of(
      BalanceReconstruction reconstruction, Collection<String> excluded, BigInteger balanceGt) {
    List<TokenBalances> out = new ArrayList<>();
    for (TokenMetadata meta : reconstruction.tokens()) {
      int decimals = meta.decimals();
      List<TokenBalances.HolderBalance> holders = new ArrayList<>();
      for (Map.Entry<String, BigInteger> e :
          reconstruction.balancesOf(meta.address()).entrySet()) {
        if (excluded.contains(e.getKey())) continue;
        if (e.getValue().compareTo(balanceGt) <= 0) continue;
        holders.add(
            new TokenBalances.HolderBalance(
                e.getKey(), Units.formatUnits(e.getValue(), decimals), e.getValue().toString()));
      }
      out.add(
          new TokenBalances(meta.address(), meta.name(), meta.symbol(), decimals, List.copyOf(holders)));
    }
    return List.copyOf(out);
  }
}
