package io.vaultledger.holdersbackend.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.vaultledger.holdersbackend.config.HoldersProperties;
import io.vaultledger.holdersbackend.error.HoldersException;
import io.vaultledger.holdersbackend.model.VaultKind;
import java.util.Locale;
import org.springframework.stereotype.Component;

@Component
public class HoldersMetrics {
  private final MeterRegistry meterRegistry;
  private final HoldersProperties properties;

  public HoldersMetrics(MeterRegistry meterRegistry, HoldersProperties properties) {
    this.meterRegistry = meterRegistry;
    this.properties = properties;
  }

  public void reconstructionSuccess(String chain) {
    if (!properties.isMetricsEnabled()) return;
    meterRegistry.counter("holders.reconstruction.success", "chain", chain).increment();
  }

  public void reconstructionFailure(String chain, Throwable error) {
    if (!properties.isMetricsEnabled()) return;
    String code =
        error instanceof HoldersException he ? he.getCode().name() : error.getClass().getSimpleName();
    meterRegistry
        .counter("holders.reconstruction.failure", "chain", chain, "code", code)
        .increment();
  }

  public void pageFetched(String query) {
    if (!properties.isMetricsEnabled()) return;
    meterRegistry.counter("holders.indexer.pages", "query", query).increment();
  }

  public void normalization(VaultKind kind) {
    if (!properties.isMetricsEnabled()) return;
    meterRegistry
        .counter("holders.normalization", "kind", kind.name().toLowerCase(Locale.ROOT))
        .increment();
  }
}
