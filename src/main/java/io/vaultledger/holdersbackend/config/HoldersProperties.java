package io.vaultledger.holdersbackend.config;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.holders")
public class HoldersProperties {
  private boolean metricsEnabled = true;

  private Indexer indexer = new Indexer();
  private VaultApi vaultApi = new VaultApi();
  private Cache cache = new Cache();
  private Rpc rpc = new Rpc();
  private Http http = new Http();

  public boolean isMetricsEnabled() {
    return metricsEnabled;
  }

  public void setMetricsEnabled(boolean metricsEnabled) {
    this.metricsEnabled = metricsEnabled;
  }

  public Indexer getIndexer() {
    return indexer;
  }

  public void setIndexer(Indexer indexer) {
    this.indexer = indexer;
  }

  public VaultApi getVaultApi() {
    return vaultApi;
  }

  public void setVaultApi(VaultApi vaultApi) {
    this.vaultApi = vaultApi;
  }

  public Cache getCache() {
    return cache;
  }

  public void setCache(Cache cache) {
    this.cache = cache;
  }

  public Rpc getRpc() {
    return rpc;
  }

  public void setRpc(Rpc rpc) {
    this.rpc = rpc;
  }

  public Http getHttp() {
    return http;
  }

  public void setHttp(Http http) {
    this.http = http;
  }

  /** Outbound HTTP shared by the indexer and vault registry clients. */
  public static class Http {
    private int maxInMemoryBytes = 32 * 1024 * 1024;
    private int connectTimeoutMs = 5_000;

    public int getMaxInMemoryBytes() {
      return maxInMemoryBytes;
    }

    public void setMaxInMemoryBytes(int maxInMemoryBytes) {
      this.maxInMemoryBytes = maxInMemoryBytes;
    }

    public int getConnectTimeoutMs() {
      return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
      this.connectTimeoutMs = connectTimeoutMs;
    }
  }

  public static class Indexer {
    private String url = "";
    private long timeoutMs = 30_000;
    private int pageSize = 1000;
    private long fetchDelayMs = 0;
    private long fetchAtMost = 1_000_000_000L;

    public String getUrl() {
      return url;
    }

    public void setUrl(String url) {
      this.url = url;
    }

    public long getTimeoutMs() {
      return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
    }

    public int getPageSize() {
      return pageSize;
    }

    public void setPageSize(int pageSize) {
      this.pageSize = pageSize;
    }

    public long getFetchDelayMs() {
      return fetchDelayMs;
    }

    public void setFetchDelayMs(long fetchDelayMs) {
      this.fetchDelayMs = fetchDelayMs;
    }

    public long getFetchAtMost() {
      return fetchAtMost;
    }

    public void setFetchAtMost(long fetchAtMost) {
      this.fetchAtMost = fetchAtMost;
    }
  }

  public static class VaultApi {
    private String baseUrl = "https://api.beefy.finance";
    private long timeoutMs = 15_000;
    private long cacheTtlSeconds = 300;

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public long getTimeoutMs() {
      return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
    }

    public long getCacheTtlSeconds() {
      return cacheTtlSeconds;
    }

    public void setCacheTtlSeconds(long cacheTtlSeconds) {
      this.cacheTtlSeconds = cacheTtlSeconds;
    }
  }

  public static class Cache {
    private long ttlSeconds = 300;

    public long getTtlSeconds() {
      return ttlSeconds;
    }

    public void setTtlSeconds(long ttlSeconds) {
      this.ttlSeconds = ttlSeconds;
    }
  }

  public static class Rpc {
    /** Chain key ("bsc", "base") to JSON-RPC URL. */
    private Map<String, String> urls = new LinkedHashMap<>();

    public Map<String, String> getUrls() {
      return urls;
    }

    public void setUrls(Map<String, String> urls) {
      this.urls = urls == null ? new LinkedHashMap<>() : urls;
    }
  }
}
