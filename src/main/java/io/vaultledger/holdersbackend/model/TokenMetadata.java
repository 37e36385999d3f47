package io.vaultledger.holdersbackend.model;

public record TokenMetadata(
    String id, String address, String name, String symbol, Integer decimals) {}
