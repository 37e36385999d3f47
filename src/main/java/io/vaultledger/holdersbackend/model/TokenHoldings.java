package io.vaultledger.holdersbackend.model;

import java.math.BigDecimal;
import java.util.List;

/** Current balances of one token as the indexer stores them, largest first. */
public record TokenHoldings(TokenMetadata token, List<Holding> holdings) {

  public TokenHoldings {
    holdings = holdings == null ? List.of() : List.copyOf(holdings);
  }

  /** {@code amount} is in token units, not raw. */
  public record Holding(String accountId, BigDecimal amount) {}
}
