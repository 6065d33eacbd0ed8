package com.otcswap.engine.reconciliation;

import java.math.BigDecimal;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingReconciliationReporter implements ReconciliationReporter {
  private static final Logger log = LoggerFactory.getLogger(LoggingReconciliationReporter.class);

  @Override
  public void report(ReconciliationResult result) {
    if (result.status() == ReconciliationStatus.DEFICIT) {
      log.warn(
          "Custody reconciliation status={} assets={} drift={}",
          result.status(),
          result.expectedByAsset().size(),
          result.driftByAsset());
      return;
    }
    log.info(
        "Custody reconciliation status={} assets={} drift_assets={}",
        result.status(),
        result.expectedByAsset().size(),
        countDrifting(result.driftByAsset()));
  }

  private static long countDrifting(Map<String, BigDecimal> driftByAsset) {
    return driftByAsset.values().stream().filter(drift -> drift.signum() != 0).count();
  }
}
