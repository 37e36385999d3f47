package io.vaultledger.holdersbackend.service;

import io.vaultledger.holdersbackend.client.ChainRpcClients;
import io.vaultledger.holdersbackend.error.HoldersErrorCode;
import io.vaultledger.holdersbackend.error.HoldersException;
import io.vaultledger.holdersbackend.model.Chain;
import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/** Turns a path block ({@code latest} or a decimal number) into a block height. */
@Service
public class BlockResolver {
  private static final Logger log = LoggerFactory.getLogger(BlockResolver.class);

  public static final String LATEST = "latest";

  private final ChainRpcClients rpc;

  public BlockResolver(ChainRpcClients rpc) {
    this.rpc = rpc;
  }

  public Mono<Long> resolve(Chain chain, String block) {
    String raw = block == null ? "" : block.trim();
    if (LATEST.equalsIgnoreCase(raw)) return head(chain);
    return Mono.fromCallable(() -> parseBlock(raw));
  }

  static long parseBlock(String raw) {
    if (raw == null || raw.isBlank()) throw new IllegalArgumentException("block is required");
    long v;
    try {
      v = Long.parseLong(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("block must be a non-negative integer or latest: " + raw);
    }
    if (v < 0) throw new IllegalArgumentException("block must be >= 0: " + raw);
    return v;
  }

  private Mono<Long> head(Chain chain) {
    Optional<Web3j> web3j = rpc.get(chain);
    if (web3j.isEmpty()) {
      return Mono.error(
          new HoldersException(
              HoldersErrorCode.RPC_UNAVAILABLE,
              "No RPC configured for chain " + chain.key(),
              503,
              Map.of("chain", chain.key())));
    }
    return Mono.fromCallable(
            () -> {
              EthBlockNumber res = web3j.get().ethBlockNumber().send();
              if (res == null || res.hasError()) {
                String reason = res == null ? "empty response" : res.getError().getMessage();
                throw new IllegalStateException(reason);
              }
              BigInteger n = res.getBlockNumber();
              return n.longValueExact();
            })
        .subscribeOn(Schedulers.boundedElastic())
        .onErrorMap(
            e -> !(e instanceof HoldersException),
            e -> {
              log.warn("eth_blockNumber failed: chain={}", chain.key(), e);
              return new HoldersException(
                  HoldersErrorCode.RPC_UNAVAILABLE,
                  "Could not read latest block for chain " + chain.key() + ": " + e.getMessage(),
                  503,
                  Map.of("chain", chain.key()),
                  e);
            });
  }
}
