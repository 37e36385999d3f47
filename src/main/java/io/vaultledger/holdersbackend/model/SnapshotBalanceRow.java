package io.vaultledger.holdersbackend.model;

import java.math.BigInteger;

public record SnapshotBalanceRow(String tokenId, String accountId, BigInteger amount) {}
