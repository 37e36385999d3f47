package io.vaultledger.holdersbackend.service;

import io.vaultledger.holdersbackend.client.IndexerClient;
import io.vaultledger.holdersbackend.model.Chain;
import io.vaultledger.holdersbackend.model.IndexerStatus;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/** Indexing progress per chain key. Networks the service does not support are skipped. */
@Service
public class IndexerStatusService {
  private static final Logger log = LoggerFactory.getLogger(IndexerStatusService.class);

  static final String SUBGRAPH = "envio";
  static final String TAG = "latest";

  private final IndexerClient indexer;

  public IndexerStatusService(IndexerClient indexer) {
    this.indexer = indexer;
  }

  public Mono<Map<String, List<IndexerStatus>>> status() {
    return indexer.indexerProgress().map(IndexerStatusService::byChain);
  }

  static Map<String, List<IndexerStatus>> byChain(Map<Integer, Long> progress) {
    Map<String, List<IndexerStatus>> out = new LinkedHashMap<>();
    for (Map.Entry<Integer, Long> e : progress.entrySet()) {
      Chain chain = Chain.fromNetworkId(e.getKey());
      if (chain == null) {
        log.debug("ignoring progress of unknown network: {}", e.getKey());
        continue;
      }
      out.computeIfAbsent(chain.key(), k -> new ArrayList<>())
          .add(new IndexerStatus(SUBGRAPH, TAG, e.getValue(), false));
    }
    return out;
  }
}
