package com.otcswap.engine.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
public class SwapEventLogger {
  private static final Logger log = LoggerFactory.getLogger(SwapEventLogger.class);

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onEvent(SwapEngineEvent event) {
    log.info("Swap event type={} event={}", event.getClass().getSimpleName(), event);
  }
}
