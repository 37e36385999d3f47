package io.vaultledger.holdersbackend.client;

import io.vaultledger.holdersbackend.model.Chain;
import java.util.Locale;

/** Row ids used by the balance indexer. */
public final class IndexerIds {
  private IndexerIds() {}

  /** {@code <networkId>-<lower-cased address>}. */
  public static String tokenId(Chain chain, String address) {
    return chain.networkId() + "-" + address.trim().toLowerCase(Locale.ROOT);
  }

  /** Accounts are keyed by lower-cased address alone. */
  public static String accountId(String address) {
    return address.trim().toLowerCase(Locale.ROOT);
  }

  /** Address part of a token id; ids without a network prefix are returned lower-cased. */
  public static String addressOfTokenId(String tokenId) {
    String id = tokenId == null ? "" : tokenId.trim().toLowerCase(Locale.ROOT);
    int dash = id.indexOf('-');
    return dash >= 0 ? id.substring(dash + 1) : id;
  }
}
