package io.vaultledger.holdersbackend.model;

public enum VaultKind {
  /** Share token plus reward pools and boosts. */
  SIMPLE,
  /** Share token backed by deposits into an underlying manager vault. */
  LAYERED
}
