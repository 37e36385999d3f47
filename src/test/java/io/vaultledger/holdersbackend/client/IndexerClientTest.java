package io.vaultledger.holdersbackend.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vaultledger.holdersbackend.config.HoldersProperties;
import io.vaultledger.holdersbackend.error.HoldersErrorCode;
import io.vaultledger.holdersbackend.error.HoldersException;
import io.vaultledger.holdersbackend.model.BalanceChangeRow;
import io.vaultledger.holdersbackend.model.Chain;
import io.vaultledger.holdersbackend.model.SnapshotBalanceRow;
import io.vaultledger.holdersbackend.model.TokenHoldings;
import io.vaultledger.holdersbackend.model.TokenMetadata;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

class IndexerClientTest {
  private static final String TOKEN = "0x" + "a".repeat(40);
  private static final String ALICE = "0x" + "1".repeat(40);

  private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

  private IndexerClient client(HttpStatus status, String body) {
    WebClient webClient =
        WebClient.builder()
            .exchangeFunction(
                request -> {
                  lastRequest.set(request);
                  return Mono.just(
                      ClientResponse.create(status)
                          .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                          .body(body)
                          .build());
                })
            .build();
    HoldersProperties properties = new HoldersProperties();
    properties.getIndexer().setUrl("http://indexer.test/v1/graphql/");
    return new IndexerClient(webClient, properties);
  }

  @Test
  void parsesSnapshotRows() {
    IndexerClient client =
        client(
            HttpStatus.OK,
            """
            {"data":{"TokenBalanceSnapshot":[
              {"token_id":"56-%s","account_id":"%s","amount":"1000000000000000000000"}
            ]}}
            """
                .formatted(TOKEN, ALICE));

    List<SnapshotBalanceRow> rows =
        client
            .snapshotBalances(Chain.BSC, List.of("56-" + TOKEN), List.of(), 100L, 0, 1000)
            .block();

    assertEquals(1, rows.size());
    assertEquals(new BigInteger("1000000000000000000000"), rows.get(0).amount());
    assertEquals(HttpMethod.POST, lastRequest.get().method());
    assertEquals("http://indexer.test/v1/graphql", lastRequest.get().url().toString());
  }

  @Test
  void parsesTopHoldersPerToken() {
    IndexerClient client =
        client(
            HttpStatus.OK,
            """
            {"data":{"Token":[
              {"id":"56-%s","address":"%s","name":"Vault","symbol":"mooX","decimals":"18",
               "balances":[{"account_id":"%s","amount":"12.5"}]}
            ]}}
            """
                .formatted(TOKEN, TOKEN.toUpperCase().replace("0X", "0x"), ALICE));

    List<TokenHoldings> page =
        client.topHolders(List.of("56-" + TOKEN), List.of(), 0, 1000, 100).block();

    assertEquals(1, page.size());
    assertEquals(TOKEN, page.get(0).token().address());
    assertEquals(18, page.get(0).token().decimals());
    assertEquals(ALICE, page.get(0).holdings().get(0).accountId());
    assertEquals(new BigDecimal("12.5"), page.get(0).holdings().get(0).amount());
  }

  @Test
  void parsesBalanceChangesWithNumericColumns() {
    IndexerClient client =
        client(
            HttpStatus.OK,
            """
            {"data":{"TokenBalanceChange":[
              {"token_id":"56-%s","account_id":"%s","blockNumber":"150","balanceBefore":"10","balanceAfter":"25.0"}
            ]}}
            """
                .formatted(TOKEN, ALICE));

    List<BalanceChangeRow> rows =
        client.balanceChanges(Chain.BSC, List.of("56-" + TOKEN), List.of(), 100L, 200L, 0, 10).block();

    assertEquals(150L, rows.get(0).blockNumber());
    assertEquals(BigInteger.valueOf(15), rows.get(0).delta());
  }

  @Test
  void lastSnapshotBlockIsEmptyWhenNoRows() {
    IndexerClient client = client(HttpStatus.OK, "{\"data\":{\"TokenBalanceSnapshot\":[]}}");

    Optional<Long> block = client.lastSnapshotBlockAtOrBefore(Chain.BSC, 10L).block();

    assertTrue(block.isEmpty());
  }

  @Test
  void lastSnapshotBlockIsParsed() {
    IndexerClient client =
        client(HttpStatus.OK, "{\"data\":{\"TokenBalanceSnapshot\":[{\"blockNumber\":\"4242\"}]}}");

    assertEquals(Optional.of(4242L), client.lastSnapshotBlockAtOrBefore(Chain.BSC, 5000L).block());
  }

  @Test
  void tokenMetadataKeepsMissingFieldsAsNull() {
    IndexerClient client =
        client(
            HttpStatus.OK,
            """
            {"data":{"Token":[{"id":"56-%s","address":"%s","name":"Moo","symbol":null,"decimals":18}]}}
            """
                .formatted(TOKEN, TOKEN.toUpperCase().replace("0X", "0x")));

    List<TokenMetadata> tokens = client.tokenMetadata(List.of("56-" + TOKEN)).block();

    assertEquals(TOKEN, tokens.get(0).address());
    assertNull(tokens.get(0).symbol());
    assertEquals(18, tokens.get(0).decimals());
  }

  @Test
  void indexerProgressByNetwork() {
    IndexerClient client =
        client(
            HttpStatus.OK,
            "{\"data\":{\"_meta\":[{\"networkId\":56,\"progressBlock\":123},{\"networkId\":8453,\"progressBlock\":null}]}}");

    Map<Integer, Long> progress = client.indexerProgress().block();

    assertEquals(Map.of(56, 123L), progress);
  }

  @Test
  void graphqlErrorsFailTheQuery() {
    IndexerClient client =
        client(HttpStatus.OK, "{\"errors\":[{\"message\":\"field 'foo' not found\"}]}");

    HoldersException e =
        assertThrows(HoldersException.class, () -> client.indexerProgress().block());

    assertEquals(HoldersErrorCode.INDEXER_QUERY_FAILED, e.getCode());
    assertTrue(e.getMessage().contains("field 'foo' not found"));
    assertTrue(e.getMessage().startsWith("Status"));
  }

  @Test
  void httpFailureBecomesQueryFailure() {
    IndexerClient client = client(HttpStatus.BAD_GATEWAY, "{}");

    HoldersException e =
        assertThrows(
            HoldersException.class, () -> client.lastSnapshotBlockAtOrBefore(Chain.BSC, 1L).block());

    assertEquals(HoldersErrorCode.INDEXER_QUERY_FAILED, e.getCode());
    assertEquals(502, e.getHttpStatus());
  }

  @Test
  void malformedAmountFailsTheQuery() {
    IndexerClient client =
        client(
            HttpStatus.OK,
            "{\"data\":{\"TokenBalanceSnapshot\":[{\"token_id\":\"56-x\",\"account_id\":\"y\",\"amount\":\"1.5\"}]}}");

    HoldersException e =
        assertThrows(
            HoldersException.class,
            () -> client.snapshotBalances(Chain.BSC, List.of(), List.of(), 1L, 0, 10).block());

    assertTrue(e.getMessage().contains("amount"));
  }

  @Test
  void unconfiguredUrlFailsWithoutRequest() {
    HoldersProperties properties = new HoldersProperties();
    IndexerClient client = new IndexerClient(WebClient.builder().build(), properties);

    HoldersException e = assertThrows(HoldersException.class, () -> client.indexerProgress().block());

    assertEquals(HoldersErrorCode.INDEXER_QUERY_FAILED, e.getCode());
  }
}
