package io.vaultledger.holdersbackend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import java.math.BigInteger;
import java.util.List;

public record HolderRecord(
    String holder,
    @JsonSerialize(using = ToStringSerializer.class) BigInteger balance,
    @JsonProperty("hold_details") List<HoldDetail> holdDetails) {

  public HolderRecord {
    holdDetails = holdDetails == null ? List.of() : List.copyOf(holdDetails);
  }
}
