package io.vaultledger.holdersbackend.client;

import io.vaultledger.holdersbackend.model.Chain;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3j;

/**
 * One {@link Web3j} per chain, built on first use from the configured RPC URL and kept until the
 * application context closes.
 */
public class ChainRpcClients {
  private static final Logger log = LoggerFactory.getLogger(ChainRpcClients.class);

  private final Map<Chain, String> rpcUrls;
  private final Function<String, Web3j> factory;
  private final ConcurrentHashMap<Chain, Web3j> clients = new ConcurrentHashMap<>();

  public ChainRpcClients(Map<String, String> rpcUrlsByChainKey, Function<String, Web3j> factory) {
    Map<Chain, String> urls = new ConcurrentHashMap<>();
    if (rpcUrlsByChainKey != null) {
      for (Map.Entry<String, String> e : rpcUrlsByChainKey.entrySet()) {
        String url = e.getValue() == null ? "" : e.getValue().trim();
        if (url.isBlank()) continue;
        urls.put(Chain.parse(e.getKey().toLowerCase(Locale.ROOT)), url);
      }
    }
    this.rpcUrls = Map.copyOf(urls);
    this.factory = factory;
  }

  public boolean isConfigured(Chain chain) {
    return rpcUrls.containsKey(chain);
  }

  public Optional<Web3j> get(Chain chain) {
    String url = rpcUrls.get(chain);
    if (url == null) return Optional.empty();
    return Optional.of(
        clients.computeIfAbsent(
            chain,
            c -> {
              log.info("creating rpc client: chain={}", c.key());
              return factory.apply(url);
            }));
  }

  public void shutdown() {
    clients.values().forEach(Web3j::shutdown);
    clients.clear();
  }
}
