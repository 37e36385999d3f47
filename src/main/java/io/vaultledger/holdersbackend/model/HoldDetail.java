package io.vaultledger.holdersbackend.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import java.math.BigInteger;

/** Raw balance a holder has at one constituent token. */
public record HoldDetail(
    String token, @JsonSerialize(using = ToStringSerializer.class) BigInteger balance) {}
