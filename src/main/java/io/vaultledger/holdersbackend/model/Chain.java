package io.vaultledger.holdersbackend.model;

import java.util.Locale;

/** EVM chains served by the indexer, with the network id the indexer keys its rows on. */
public enum Chain {
  ARBITRUM(42161),
  AVAX(43114),
  BASE(8453),
  BSC(56),
  ETHEREUM(1),
  FANTOM(250),
  FRAXTAL(252),
  GNOSIS(100),
  LINEA(59144),
  MANTA(169),
  MANTLE(5000),
  METIS(1088),
  MODE(34443),
  MOONBEAM(1284),
  OPTIMISM(10),
  POLYGON(137),
  ROOTSTOCK(30),
  SCROLL(534352),
  SEI(1329),
  ZKSYNC(324);

  private final int networkId;

  Chain(int networkId) {
    this.networkId = networkId;
  }

  public int networkId() {
    return networkId;
  }

  /** Lower-case name as used in URLs and the vault registry ("bsc", "zksync"). */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Chain parse(String raw) {
    String v = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
    if (v.isBlank()) throw new IllegalArgumentException("chain is required");
    try {
      return Chain.valueOf(v);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("unsupported chain: " + raw.trim());
    }
  }

  public static Chain fromNetworkId(int networkId) {
    for (Chain c : values()) {
      if (c.networkId == networkId) return c;
    }
    return null;
  }
}
