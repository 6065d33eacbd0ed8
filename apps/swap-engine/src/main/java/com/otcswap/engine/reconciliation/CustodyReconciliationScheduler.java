package com.otcswap.engine.reconciliation;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    prefix = "swap.reconciliation",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = false)
public class CustodyReconciliationScheduler {
  private final CustodyReconciliationService reconciliationService;

  public CustodyReconciliationScheduler(CustodyReconciliationService reconciliationService) {
    this.reconciliationService = reconciliationService;
  }

  @Scheduled(fixedDelayString = "${swap.reconciliation.fixed-delay-ms:300000}")
  public void runScheduled() {
    reconciliationService.runOnce();
  }
}
