package io.vaultledger.holdersbackend.error;

public enum HoldersErrorCode {
  BAD_REQUEST,
  VAULT_NOT_FOUND,
  VAULT_NOT_UNIQUE,
  TOKEN_NOT_FOUND,
  TOKEN_METADATA_MISSING,
  SNAPSHOT_NOT_FOUND,
  INDEXER_BEHIND,
  INDEXER_QUERY_FAILED,
  VAULT_CONFIG_UNAVAILABLE,
  RPC_UNAVAILABLE
}
