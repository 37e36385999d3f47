package io.vaultledger.holdersbackend.config;

import io.netty.channel.ChannelOption;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
public class AppConfig {

  @Bean
  public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory cf) {
    return new StringRedisTemplate(cf);
  }

  /** Shared by {@code IndexerClient} and {@code VaultApiClient}; per-call timeouts are theirs. */
  @Bean
  public WebClient webClient(HoldersProperties properties) {
    HoldersProperties.Http http = properties.getHttp();
    HttpClient httpClient =
        HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.max(500, http.getConnectTimeoutMs()));

    // Snapshot pages and registry payloads run to several MB.
    int maxInMemory = Math.max(256 * 1024, http.getMaxInMemoryBytes());
    ExchangeStrategies strategies =
        ExchangeStrategies.builder()
            .codecs(c -> c.defaultCodecs().maxInMemorySize(maxInMemory))
            .build();

    return WebClient.builder()
        .clientConnector(new ReactorClientHttpConnector(httpClient))
        .exchangeStrategies(strategies)
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
        .defaultHeader(HttpHeaders.USER_AGENT, "holders-backend")
        .build();
  }

  /** Read-only API: GET from any configured origin, no credentials. */
  @Bean
  public CorsWebFilter corsWebFilter(@Value("${app.cors.allowedOrigins:*}") String allowedOrigins) {
    CorsConfiguration cors = new CorsConfiguration();
    cors.setAllowCredentials(false);
    List<String> origins = parseOrigins(allowedOrigins);
    if (origins.isEmpty()) {
      cors.addAllowedOriginPattern("*");
    } else {
      cors.setAllowedOrigins(origins);
    }
    cors.addAllowedHeader("*");
    cors.setAllowedMethods(List.of(HttpMethod.GET.name(), HttpMethod.OPTIONS.name()));
    cors.setMaxAge(Duration.ofHours(1));

    UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/api/**", cors);
    return new CorsWebFilter(source);
  }

  /** Comma-separated origins; blank or {@code *} means any. */
  static List<String> parseOrigins(String raw) {
    if (raw == null || raw.isBlank() || "*".equals(raw.trim())) return List.of();
    return Arrays.stream(raw.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
  }
}
