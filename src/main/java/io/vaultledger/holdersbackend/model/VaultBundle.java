package io.vaultledger.holdersbackend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** One vault with its holders expressed in the vault structure's base share token. */
public record VaultBundle(
    @JsonProperty("vault_config") VaultTopology vaultConfig, List<HolderRecord> holders) {

  public VaultBundle {
    holders = holders == null ? List.of() : List.copyOf(holders);
  }
}
