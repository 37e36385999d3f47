package io.vaultledger.holdersbackend.model;

public record IndexerStatus(String subgraph, String tag, Long blockNumber, boolean hasErrors) {}
