package io.vaultledger.holdersbackend.service;

import io.vaultledger.holdersbackend.client.IndexerClient;
import io.vaultledger.holdersbackend.client.IndexerIds;
import io.vaultledger.holdersbackend.config.HoldersProperties;
import io.vaultledger.holdersbackend.error.HoldersErrorCode;
import io.vaultledger.holdersbackend.error.HoldersException;
import io.vaultledger.holdersbackend.model.Chain;
import io.vaultledger.holdersbackend.model.TokenBalances;
import io.vaultledger.holdersbackend.model.TokenHoldings;
import io.vaultledger.holdersbackend.model.TokenMetadata;
import io.vaultledger.holdersbackend.util.Addresses;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Service
public class ContractHoldersService {
  public static final int MAX_CONTRACTS = 100;
  public static final int DEFAULT_TOP_LIMIT = 100;
  public static final int MAX_TOP_LIMIT = 1000;

  private final TokenBalanceAtBlockService balances;
  private final IndexerClient indexer;
  private final PaginationOptions tokenPages;

  public ContractHoldersService(
      TokenBalanceAtBlockService balances, IndexerClient indexer, HoldersProperties properties) {
    this.balances = balances;
    this.indexer = indexer;
    HoldersProperties.Indexer cfg = properties.getIndexer();
    this.tokenPages =
        new PaginationOptions(
            Math.max(1, cfg.getPageSize()),
            cfg.getFetchAtMost(),
            Duration.ofMillis(Math.max(0L, cfg.getFetchDelayMs())));
  }

  /** Holders of a single token contract with a balance above zero at {@code block}. */
  public Mono<List<TokenBalances>> contractBalances(Chain chain, String contractAddress, long block) {
    String address = Addresses.normalize(contractAddress);
    return balances
        .reconstructBalances(chain, block, List.of(address), List.of(Addresses.ZERO_ADDRESS))
        .flatMap(
            r -> {
              List<TokenBalances> out =
                  TokenBalancesView.of(r, Set.of(Addresses.ZERO_ADDRESS), BigInteger.ZERO);
              if (out.isEmpty()) {
                return Mono.error(
                    new HoldersException(
                        HoldersErrorCode.TOKEN_NOT_FOUND,
                        "No contract balances found for contract " + address,
                        404,
                        Map.of("chain", chain.key(), "contract", address)));
              }
              return Mono.just(out);
            });
  }

  /**
   * The {@code limit} largest current holders of each token, from the indexer's live balances
   * rather than a reconstruction. Tokens are paged; each token's holder list is not.
   */
  public Mono<List<TokenBalances>> topHolders(
      Chain chain, List<String> contractAddresses, int limit) {
    return Mono.defer(
        () -> {
          if (contractAddresses == null || contractAddresses.isEmpty()) {
            throw new IllegalArgumentException("contract_addresses is required");
          }
          if (contractAddresses.size() > MAX_CONTRACTS) {
            throw new IllegalArgumentException(
                "at most " + MAX_CONTRACTS + " contract_addresses are allowed");
          }
          if (limit < 1 || limit > MAX_TOP_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_TOP_LIMIT);
          }
          List<String> tokenIds =
              Addresses.normalizeAll(contractAddresses).stream()
                  .map(a -> IndexerIds.tokenId(chain, a))
                  .toList();
          List<String> excluded = List.of(IndexerIds.accountId(Addresses.ZERO_ADDRESS));
          return Paginator.paginate(
                  (offset, pageSize) ->
                      indexer.topHolders(tokenIds, excluded, offset, pageSize, limit),
                  List::size,
                  Paginator::concat,
                  tokenPages)
              .map(ContractHoldersService::render);
        });
  }

  static List<TokenBalances> render(List<TokenHoldings> tokens) {
    List<TokenBalances> out = new ArrayList<>();
    for (TokenHoldings t : tokens) {
      TokenMetadata meta = t.token();
      if (meta.symbol() == null) throw HoldersException.metadataMissing(meta.id(), "symbol");
      if (meta.name() == null) throw HoldersException.metadataMissing(meta.id(), "name");
      if (meta.decimals() == null) throw HoldersException.metadataMissing(meta.id(), "decimals");
      int decimals = meta.decimals();
      List<TokenBalances.HolderBalance> holders = new ArrayList<>();
      for (TokenHoldings.Holding h : t.holdings()) {
        BigInteger raw =
            h.amount().movePointRight(decimals).setScale(0, RoundingMode.HALF_UP).toBigIntegerExact();
        holders.add(
            new TokenBalances.HolderBalance(
                IndexerIds.accountId(h.accountId()), h.amount().toPlainString(), raw.toString()));
      }
      out.add(
          new TokenBalances(
              meta.address().toLowerCase(), meta.name(), meta.symbol(), decimals, holders));
    }
    return List.copyOf(out);
  }
}
