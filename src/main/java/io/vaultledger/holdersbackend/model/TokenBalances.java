package io.vaultledger.holdersbackend.model;

import java.util.List;

public record TokenBalances(
    String id, String name, String symbol, int decimals, List<HolderBalance> balances) {

  public record HolderBalance(String holder, String balance, String amount) {}
}
