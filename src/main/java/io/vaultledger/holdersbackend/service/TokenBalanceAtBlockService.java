package io.vaultledger.holdersbackend.service;

import io.vaultledger.holdersbackend.client.IndexerClient;
import io.vaultledger.holdersbackend.client.IndexerIds;
import io.vaultledger.holdersbackend.config.HoldersProperties;
import io.vaultledger.holdersbackend.error.HoldersErrorCode;
import io.vaultledger.holdersbackend.error.HoldersException;
import io.vaultledger.holdersbackend.model.BalanceChangeRow;
import io.vaultledger.holdersbackend.model.BalanceReconstruction;
import io.vaultledger.holdersbackend.model.Chain;
import io.vaultledger.holdersbackend.model.SnapshotBalanceRow;
import io.vaultledger.holdersbackend.model.TokenMetadata;
import io.vaultledger.holdersbackend.util.Addresses;
import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Balances of a token set as of an exact block: the last periodic snapshot at or before the block,
 * plus every balance change after the snapshot up to and including the block.
 *
 * <p>Changes are applied as deltas ({@code after - before}) and summed, so the order in which the
 * indexer returns them does not matter.
 */
@Service
public class TokenBalanceAtBlockService {
  private static final Logger log = LoggerFactory.getLogger(TokenBalanceAtBlockService.class);

  private final IndexerClient indexer;
  private final HoldersMetrics metrics;
  private final PaginationOptions pagination;

  public TokenBalanceAtBlockService(
      IndexerClient indexer, HoldersMetrics metrics, HoldersProperties properties) {
    this.indexer = indexer;
    this.metrics = metrics;
    HoldersProperties.Indexer cfg = properties.getIndexer();
    this.pagination =
        new PaginationOptions(
            Math.max(1, cfg.getPageSize()),
            cfg.getFetchAtMost(),
            Duration.ofMillis(Math.max(0L, cfg.getFetchDelayMs())));
  }

  /**
   * @param excludeAccounts accounts left out of the result; empty or null means the zero address
   */
  public Mono<BalanceReconstruction> reconstructBalances(
      Chain chain, long targetBlock, List<String> tokenAddresses, List<String> excludeAccounts) {
    return Mono.defer(
            () -> {
              if (chain == null) throw new IllegalArgumentException("chain is required");
              if (targetBlock < 0) {
                throw new IllegalArgumentException("block must be >= 0: " + targetBlock);
              }
              if (tokenAddresses == null || tokenAddresses.isEmpty()) {
                throw new IllegalArgumentException("at least one token address is required");
              }
              List<String> tokens = Addresses.normalizeAll(tokenAddresses);
              List<String> excluded =
                  excludeAccounts == null || excludeAccounts.isEmpty()
                      ? List.of(Addresses.ZERO_ADDRESS)
                      : Addresses.normalizeAll(excludeAccounts);
              return reconstruct(chain, targetBlock, tokens, excluded);
            })
        .doOnSuccess(r -> metrics.reconstructionSuccess(chain == null ? "" : chain.key()))
        .doOnError(e -> metrics.reconstructionFailure(chain == null ? "" : chain.key(), e));
  }

  private Mono<BalanceReconstruction> reconstruct(
      Chain chain, long targetBlock, List<String> tokens, List<String> excluded) {
    long startedAt = System.currentTimeMillis();
    List<String> tokenIds = tokens.stream().map(a -> IndexerIds.tokenId(chain, a)).toList();
    List<String> excludedIds = excluded.stream().map(IndexerIds::accountId).toList();

    return indexer
        .lastSnapshotBlockAtOrBefore(chain, targetBlock)
        .flatMap(
            snapshot -> {
              if (snapshot.isEmpty()) {
                return Mono.error(
                    new HoldersException(
                        HoldersErrorCode.SNAPSHOT_NOT_FOUND,
                        "No daily snapshot found for chain "
                            + chain.key()
                            + " at or before block "
                            + targetBlock,
                        404,
                        Map.of("chain", chain.key(), "block", targetBlock)));
              }
              long snapshotBlock = snapshot.get();
              return requireIndexedUpTo(chain, targetBlock).thenReturn(snapshotBlock);
            })
        .flatMap(
            snapshotBlock ->
                Mono.zip(
                        fetchSnapshotRows(chain, tokenIds, excludedIds, snapshotBlock),
                        fetchChanges(chain, tokenIds, excludedIds, snapshotBlock, targetBlock),
                        indexer.tokenMetadata(tokenIds))
                    .map(
                        t -> {
                          BalanceReconstruction out =
                              assemble(
                                  chain,
                                  targetBlock,
                                  snapshotBlock,
                                  tokens,
                                  t.getT1(),
                                  t.getT2(),
                                  t.getT3());
                          log.debug(
                              "reconstructed balances: chain={} block={} snapshotBlock={} tokens={} snapshotRows={} changes={} durationMs={}",
                              chain.key(),
                              targetBlock,
                              snapshotBlock,
                              tokens.size(),
                              t.getT1().size(),
                              t.getT2().size(),
                              System.currentTimeMillis() - startedAt);
                          return out;
                        }));
  }

  private Mono<Void> requireIndexedUpTo(Chain chain, long targetBlock) {
    return indexer
        .indexerProgress()
        .flatMap(
            progress -> {
              Long indexed = progress.get(chain.networkId());
              if (indexed == null || indexed < targetBlock) {
                Map<String, Object> details = new HashMap<>();
                details.put("chain", chain.key());
                details.put("block", targetBlock);
                details.put("indexedBlock", indexed);
                return Mono.error(
                    new HoldersException(
                        HoldersErrorCode.INDEXER_BEHIND,
                        "Indexer for chain "
                            + chain.key()
                            + " has processed up to block "
                            + (indexed == null ? "none" : indexed)
                            + ", behind requested block "
                            + targetBlock,
                        503,
                        details));
              }
              return Mono.<Void>empty();
            });
  }

  private Mono<List<SnapshotBalanceRow>> fetchSnapshotRows(
      Chain chain, List<String> tokenIds, List<String> excludedIds, long snapshotBlock) {
    return Paginator.paginate(
        (offset, limit) -> {
          metrics.pageFetched("snapshot");
          return indexer.snapshotBalances(chain, tokenIds, excludedIds, snapshotBlock, offset, limit);
        },
        List::size,
        Paginator::concat,
        pagination);
  }

  private Mono<List<BalanceChangeRow>> fetchChanges(
      Chain chain, List<String> tokenIds, List<String> excludedIds, long snapshotBlock, long block) {
    return Paginator.paginate(
        (offset, limit) -> {
          metrics.pageFetched("changes");
          return indexer.balanceChanges(
              chain, tokenIds, excludedIds, snapshotBlock, block, offset, limit);
        },
        List::size,
        Paginator::concat,
        pagination);
  }

  static BalanceReconstruction assemble(
      Chain chain,
      long targetBlock,
      long snapshotBlock,
      List<String> tokens,
      List<SnapshotBalanceRow> snapshotRows,
      List<BalanceChangeRow> changes,
      List<TokenMetadata> metadataRows) {
    Map<String, Map<String, BigInteger>> balances = new LinkedHashMap<>();
    for (String token : tokens) {
      balances.put(token, new LinkedHashMap<>());
    }

    for (SnapshotBalanceRow row : snapshotRows) {
      String token = IndexerIds.addressOfTokenId(row.tokenId());
      String account = IndexerIds.accountId(row.accountId());
      balances.computeIfAbsent(token, k -> new LinkedHashMap<>()).put(account, row.amount());
    }

    for (BalanceChangeRow change : changes) {
      String token = IndexerIds.addressOfTokenId(change.tokenId());
      String account = IndexerIds.accountId(change.accountId());
      balances
          .computeIfAbsent(token, k -> new LinkedHashMap<>())
          .merge(account, change.delta(), BigInteger::add);
    }

    Map<String, Map<String, BigInteger>> frozen = new LinkedHashMap<>();
    for (Map.Entry<String, Map<String, BigInteger>> e : balances.entrySet()) {
      frozen.put(e.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue())));
    }

    return new BalanceReconstruction(
        chain,
        targetBlock,
        snapshotBlock,
        Collections.unmodifiableMap(frozen),
        orderedMetadata(tokens, metadataRows));
  }

  /** Metadata in request order. Tokens the indexer has never seen are absent. */
  private static List<TokenMetadata> orderedMetadata(
      List<String> tokens, List<TokenMetadata> metadataRows) {
    Map<String, TokenMetadata> byAddress = new HashMap<>();
    for (TokenMetadata meta : metadataRows) {
      if (meta.name() == null) throw HoldersException.metadataMissing(meta.id(), "name");
      if (meta.symbol() == null) throw HoldersException.metadataMissing(meta.id(), "symbol");
      if (meta.decimals() == null) throw HoldersException.metadataMissing(meta.id(), "decimals");
      byAddress.put(meta.address().toLowerCase(), meta);
    }
    List<TokenMetadata> out = new ArrayList<>();
    for (String token : tokens) {
      TokenMetadata meta = byAddress.get(token);
      if (meta != null) out.add(meta);
    }
    return List.copyOf(out);
  }
}
