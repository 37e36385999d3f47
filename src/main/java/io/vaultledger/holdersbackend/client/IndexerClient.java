package io.vaultledger.holdersbackend.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.vaultledger.holdersbackend.config.HoldersProperties;
import io.vaultledger.holdersbackend.error.HoldersException;
import io.vaultledger.holdersbackend.model.BalanceChangeRow;
import io.vaultledger.holdersbackend.model.Chain;
import io.vaultledger.holdersbackend.model.SnapshotBalanceRow;
import io.vaultledger.holdersbackend.model.TokenHoldings;
import io.vaultledger.holdersbackend.model.TokenMetadata;
import io.vaultledger.holdersbackend.util.Units;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Read-only GraphQL client for the balance indexer.
 *
 * <p>Every call is a single POST; pagination is left to the caller. GraphQL {@code errors} and
 * transport failures both surface as {@link HoldersException} with code {@code
 * INDEXER_QUERY_FAILED}.
 */
@Component
public class IndexerClient {
  private static final Logger log = LoggerFactory.getLogger(IndexerClient.class);

  static final String LAST_SNAPSHOT_QUERY =
      """
      query TokenBalanceSnapshotLastDailySnapshotAtBlock($chainId: Int!, $block: numeric!) {
        TokenBalanceSnapshot(
          where: { chainId: { _eq: $chainId }, blockNumber: { _lte: $block } }
          order_by: { blockNumber: desc }
          limit: 1
        ) {
          blockNumber
        }
      }
      """;

  static final String SNAPSHOT_BALANCES_QUERY =
      """
      query TokenBalanceSnapshotAtBlock(
        $chainId: Int!
        $token_in: [String!]!
        $account_not_in: [String!]!
        $snapshotBlock: numeric!
        $offset: Int!
        $limit: Int!
      ) {
        TokenBalanceSnapshot(
          where: {
            chainId: { _eq: $chainId }
            blockNumber: { _eq: $snapshotBlock }
            token_id: { _in: $token_in }
            account_id: { _nin: $account_not_in }
          }
          order_by: [{ token_id: asc }, { account_id: asc }]
          offset: $offset
          limit: $limit
        ) {
          token_id
          account_id
          amount
        }
      }
      """;

  static final String BALANCE_CHANGES_QUERY =
      """
      query TokenBalanceChangesBetweenBlocks(
        $chainId: Int!
        $token_in: [String!]!
        $account_not_in: [String!]!
        $block_gt: numeric!
        $block_lte: numeric!
        $offset: Int!
        $limit: Int!
      ) {
        TokenBalanceChange(
          where: {
            chainId: { _eq: $chainId }
            blockNumber: { _gt: $block_gt, _lte: $block_lte }
            token_id: { _in: $token_in }
            account_id: { _nin: $account_not_in }
          }
          order_by: [{ blockNumber: asc }, { id: asc }]
          offset: $offset
          limit: $limit
        ) {
          token_id
          account_id
          blockNumber
          balanceBefore
          balanceAfter
        }
      }
      """;

  static final String TOKENS_QUERY =
      """
      query TokenMetadata($token_in: [String!]!) {
        Token(where: { id: { _in: $token_in } }) {
          id
          address
          name
          symbol
          decimals
        }
      }
      """;

  static final String TOP_HOLDERS_QUERY =
      """
      query ContractBalance(
        $token_in: [String!]!
        $account_not_in: [String!]!
        $tokenOffset: Int!
        $tokenLimit: Int!
        $limit: Int!
      ) {
        Token(
          where: { id: { _in: $token_in } }
          order_by: { id: asc }
          offset: $tokenOffset
          limit: $tokenLimit
        ) {
          id
          address
          name
          symbol
          decimals
          balances(
            where: { account_id: { _nin: $account_not_in } }
            order_by: { amount: desc }
            limit: $limit
          ) {
            account_id
            amount
          }
        }
      }
      """;

  static final String STATUS_QUERY =
      """
      query Status {
        _meta {
          networkId
          progressBlock
        }
      }
      """;

  private final WebClient webClient;
  private final String indexerUrl;
  private final Duration timeout;

  public IndexerClient(WebClient webClient, HoldersProperties properties) {
    this.webClient = webClient;
    HoldersProperties.Indexer cfg = properties.getIndexer();
    this.indexerUrl = (cfg.getUrl() == null ? "" : cfg.getUrl().trim()).replaceAll("/+$", "");
    this.timeout = Duration.ofMillis(Math.max(1000L, cfg.getTimeoutMs()));
  }

  /** Block of the most recent periodic snapshot at or before {@code block}, if any. */
  public Mono<Optional<Long>> lastSnapshotBlockAtOrBefore(Chain chain, long block) {
    Map<String, Object> vars = new LinkedHashMap<>();
    vars.put("chainId", chain.networkId());
    vars.put("block", String.valueOf(block));
    return execute("TokenBalanceSnapshotLastDailySnapshotAtBlock", LAST_SNAPSHOT_QUERY, vars)
        .map(
            data -> {
              JsonNode rows = data.path("TokenBalanceSnapshot");
              if (!rows.isArray() || rows.isEmpty()) return Optional.<Long>empty();
              String raw = text(rows.get(0).path("blockNumber"));
              if (raw == null) return Optional.<Long>empty();
              return Optional.of(Units.parseRaw(raw).longValueExact());
            });
  }

  public Mono<List<SnapshotBalanceRow>> snapshotBalances(
      Chain chain,
      List<String> tokenIds,
      List<String> excludedAccountIds,
      long snapshotBlock,
      int offset,
      int limit) {
    Map<String, Object> vars = new LinkedHashMap<>();
    vars.put("chainId", chain.networkId());
    vars.put("token_in", tokenIds);
    vars.put("account_not_in", excludedAccountIds);
    vars.put("snapshotBlock", String.valueOf(snapshotBlock));
    vars.put("offset", offset);
    vars.put("limit", limit);
    String op = "TokenBalanceSnapshotAtBlock";
    return execute(op, SNAPSHOT_BALANCES_QUERY, vars)
        .map(
            data -> {
              List<SnapshotBalanceRow> out = new ArrayList<>();
              for (JsonNode row : data.path("TokenBalanceSnapshot")) {
                out.add(
                    new SnapshotBalanceRow(
                        requireText(op, row, "token_id"),
                        requireText(op, row, "account_id"),
                        requireInteger(op, row, "amount")));
              }
              return out;
            });
  }

  public Mono<List<BalanceChangeRow>> balanceChanges(
      Chain chain,
      List<String> tokenIds,
      List<String> excludedAccountIds,
      long blockGt,
      long blockLte,
      int offset,
      int limit) {
    Map<String, Object> vars = new LinkedHashMap<>();
    vars.put("chainId", chain.networkId());
    vars.put("token_in", tokenIds);
    vars.put("account_not_in", excludedAccountIds);
    vars.put("block_gt", String.valueOf(blockGt));
    vars.put("block_lte", String.valueOf(blockLte));
    vars.put("offset", offset);
    vars.put("limit", limit);
    String op = "TokenBalanceChangesBetweenBlocks";
    return execute(op, BALANCE_CHANGES_QUERY, vars)
        .map(
            data -> {
              List<BalanceChangeRow> out = new ArrayList<>();
              for (JsonNode row : data.path("TokenBalanceChange")) {
                out.add(
                    new BalanceChangeRow(
                        requireText(op, row, "token_id"),
                        requireText(op, row, "account_id"),
                        requireInteger(op, row, "blockNumber").longValueExact(),
                        requireInteger(op, row, "balanceBefore"),
                        requireInteger(op, row, "balanceAfter")));
              }
              return out;
            });
  }

  /** Metadata rows as stored; name, symbol or decimals may be null and are checked by callers. */
  public Mono<List<TokenMetadata>> tokenMetadata(List<String> tokenIds) {
    Map<String, Object> vars = new LinkedHashMap<>();
    vars.put("token_in", tokenIds);
    String op = "TokenMetadata";
    return execute(op, TOKENS_QUERY, vars)
        .map(
            data -> {
              List<TokenMetadata> out = new ArrayList<>();
              for (JsonNode row : data.path("Token")) {
                String id = requireText(op, row, "id");
                String address = text(row.path("address"));
                out.add(
                    new TokenMetadata(
                        id,
                        address == null ? IndexerIds.addressOfTokenId(id) : address.toLowerCase(),
                        text(row.path("name")),
                        text(row.path("symbol")),
                        decimals(row.path("decimals"))));
              }
              return out;
            });
  }

  /**
   * One page of tokens (paged by {@code tokenOffset}/{@code tokenLimit}), each with its {@code
   * limit} largest current balances.
   */
  public Mono<List<TokenHoldings>> topHolders(
      List<String> tokenIds,
      List<String> excludedAccountIds,
      int tokenOffset,
      int tokenLimit,
      int limit) {
    Map<String, Object> vars = new LinkedHashMap<>();
    vars.put("token_in", tokenIds);
    vars.put("account_not_in", excludedAccountIds);
    vars.put("tokenOffset", tokenOffset);
    vars.put("tokenLimit", tokenLimit);
    vars.put("limit", limit);
    String op = "ContractBalance";
    return execute(op, TOP_HOLDERS_QUERY, vars)
        .map(
            data -> {
              List<TokenHoldings> out = new ArrayList<>();
              for (JsonNode row : data.path("Token")) {
                String id = requireText(op, row, "id");
                String address = text(row.path("address"));
                TokenMetadata meta =
                    new TokenMetadata(
                        id,
                        address == null ? IndexerIds.addressOfTokenId(id) : address.toLowerCase(),
                        text(row.path("name")),
                        text(row.path("symbol")),
                        decimals(row.path("decimals")));
                List<TokenHoldings.Holding> holdings = new ArrayList<>();
                for (JsonNode b : row.path("balances")) {
                  holdings.add(
                      new TokenHoldings.Holding(
                          requireText(op, b, "account_id"), requireDecimal(op, b, "amount")));
                }
                out.add(new TokenHoldings(meta, holdings));
              }
              return out;
            });
  }

  /** Highest fully processed block per network id. */
  public Mono<Map<Integer, Long>> indexerProgress() {
    return execute("Status", STATUS_QUERY, Map.of())
        .map(
            data -> {
              Map<Integer, Long> out = new LinkedHashMap<>();
              for (JsonNode meta : data.path("_meta")) {
                JsonNode networkId = meta.path("networkId");
                JsonNode progress = meta.path("progressBlock");
                if (!networkId.isNumber() || progress.isMissingNode() || progress.isNull()) continue;
                out.put(networkId.asInt(), progress.asLong());
              }
              return out;
            });
  }

  private Mono<JsonNode> execute(String operation, String query, Map<String, Object> variables) {
    if (indexerUrl.isBlank()) {
      return Mono.error(
          HoldersException.indexerQueryFailed(operation, "indexer url is not configured", null));
    }
    Map<String, Object> body = Map.of("query", query, "variables", variables);
    return webClient
        .post()
        .uri(URI.create(indexerUrl))
        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
        .bodyValue(body)
        .retrieve()
        .bodyToMono(JsonNode.class)
        .timeout(timeout)
        .switchIfEmpty(
            Mono.error(() -> HoldersException.indexerQueryFailed(operation, "empty response", null)))
        .flatMap(root -> unwrap(operation, root))
        .onErrorMap(
            e -> !(e instanceof HoldersException),
            e -> {
              log.warn("indexer query failed: operation={}", operation, e);
              return HoldersException.indexerQueryFailed(operation, describe(e), e);
            });
  }

  private static Mono<JsonNode> unwrap(String operation, JsonNode root) {
    JsonNode errors = root.path("errors");
    if (errors.isArray() && !errors.isEmpty()) {
      List<String> messages = new ArrayList<>();
      for (JsonNode e : errors) {
        String m = text(e.path("message"));
        messages.add(m == null ? e.toString() : m);
      }
      return Mono.error(
          HoldersException.indexerQueryFailed(operation, String.join(", ", messages), null));
    }
    JsonNode data = root.path("data");
    if (data.isMissingNode() || data.isNull()) {
      return Mono.error(HoldersException.indexerQueryFailed(operation, "response has no data", null));
    }
    return Mono.just(data);
  }

  private static String requireText(String operation, JsonNode row, String field) {
    String v = text(row.path(field));
    if (v == null) {
      throw HoldersException.indexerQueryFailed(operation, "row is missing " + field, null);
    }
    return v;
  }

  private static BigInteger requireInteger(String operation, JsonNode row, String field) {
    String raw = requireText(operation, row, field);
    try {
      return Units.parseRaw(raw);
    } catch (ArithmeticException | NumberFormatException e) {
      throw HoldersException.indexerQueryFailed(
          operation, "row has non-integer " + field + ": " + raw, e);
    }
  }

  private static BigDecimal requireDecimal(String operation, JsonNode row, String field) {
    String raw = requireText(operation, row, field);
    try {
      return new BigDecimal(raw);
    } catch (NumberFormatException e) {
      throw HoldersException.indexerQueryFailed(
          operation, "row has non-numeric " + field + ": " + raw, e);
    }
  }

  private static Integer decimals(JsonNode node) {
    if (node == null || node.isMissingNode() || node.isNull()) return null;
    if (node.isNumber()) return node.asInt();
    String s = text(node);
    if (s == null) return null;
    try {
      return Integer.parseInt(s);
    } catch (NumberFormatException ignored) {
      return null;
    }
  }

  private static String text(JsonNode node) {
    if (node == null || node.isMissingNode() || node.isNull()) return null;
    String v = node.asText(null);
    if (v == null) return null;
    v = v.trim();
    return v.isBlank() ? null : v;
  }

  private static String describe(Throwable e) {
    String m = e.getMessage();
    return m == null || m.isBlank() ? e.getClass().getSimpleName() : m;
  }
}
