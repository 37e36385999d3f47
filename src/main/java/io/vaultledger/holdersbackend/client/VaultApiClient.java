package io.vaultledger.holdersbackend.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.vaultledger.holdersbackend.config.HoldersProperties;
import io.vaultledger.holdersbackend.error.HoldersErrorCode;
import io.vaultledger.holdersbackend.error.HoldersException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/** Vault registry HTTP API: vaults, CLM managers, reward pools and boosts as JSON arrays. */
@Component
public class VaultApiClient {
  private static final Logger log = LoggerFactory.getLogger(VaultApiClient.class);

  public static final String VAULTS_PATH = "/vaults";
  public static final String CLM_MANAGERS_PATH = "/cow-vaults";
  public static final String REWARD_POOLS_PATH = "/gov-vaults";
  public static final String BOOSTS_PATH = "/boosts";

  private final WebClient webClient;
  private final String baseUrl;
  private final Duration timeout;

  public VaultApiClient(WebClient webClient, HoldersProperties properties) {
    this.webClient = webClient;
    HoldersProperties.VaultApi cfg = properties.getVaultApi();
    this.baseUrl = (cfg.getBaseUrl() == null ? "" : cfg.getBaseUrl().trim()).replaceAll("/+$", "");
    this.timeout = Duration.ofMillis(Math.max(1000L, cfg.getTimeoutMs()));
  }

  public Mono<JsonNode> fetchArray(String path) {
    if (baseUrl.isBlank()) {
      return Mono.error(unavailable(path, "vault api base url is not configured", null));
    }
    URI uri = URI.create(baseUrl + path);
    return webClient
        .get()
        .uri(uri)
        .retrieve()
        .bodyToMono(JsonNode.class)
        .timeout(timeout)
        .flatMap(
            root ->
                root.isArray()
                    ? Mono.just(root)
                    : Mono.<JsonNode>error(unavailable(path, "expected a JSON array", null)))
        .switchIfEmpty(Mono.error(() -> unavailable(path, "empty response", null)))
        .onErrorMap(
            e -> !(e instanceof HoldersException),
            e -> {
              log.warn("vault api request failed: uri={}", uri, e);
              return unavailable(path, e.getMessage() == null ? e.toString() : e.getMessage(), e);
            });
  }

  private static HoldersException unavailable(String path, String reason, Throwable cause) {
    return new HoldersException(
        HoldersErrorCode.VAULT_CONFIG_UNAVAILABLE,
        "Vault registry " + path + " unavailable: " + reason,
        502,
        Map.of("path", path),
        cause);
  }
}
