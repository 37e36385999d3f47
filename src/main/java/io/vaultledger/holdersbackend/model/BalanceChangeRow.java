package io.vaultledger.holdersbackend.model;

import java.math.BigInteger;

public record BalanceChangeRow(
    String tokenId,
    String accountId,
    long blockNumber,
    BigInteger balanceBefore,
    BigInteger balanceAfter) {

  public BigInteger delta() {
    return balanceAfter.subtract(balanceBefore);
  }
}
