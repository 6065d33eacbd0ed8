package com.otcswap.engine.config;

import com.otcswap.domain.swap.FeeSchedule;
import com.otcswap.engine.custody.AssetTransferGateway;
import com.otcswap.engine.custody.CustodyTransfers;
import com.otcswap.engine.custody.InMemoryAssetTransferGateway;
import com.otcswap.engine.guard.ReentrancyGuard;
import com.otcswap.engine.metrics.MicrometerSwapTelemetry;
import com.otcswap.engine.metrics.NoOpSwapTelemetry;
import com.otcswap.engine.metrics.SwapTelemetry;
import com.otcswap.engine.state.SwapEngineState;
import com.otcswap.engine.tx.InMemoryTransactionManager;
import com.otcswap.engine.tx.SettlementExecutor;
import com.otcswap.engine.tx.TransactionalChangeJournal;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.support.TransactionTemplate;

@Configuration
public class SwapEngineConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock swapEngineClock() {
    return Clock.systemUTC();
  }

  @Bean
  public InMemoryTransactionManager settlementTransactionManager() {
    return new InMemoryTransactionManager();
  }

  @Bean
  public TransactionTemplate settlementTransactionTemplate(
      InMemoryTransactionManager settlementTransactionManager) {
    return new TransactionTemplate(settlementTransactionManager);
  }

  @Bean
  public TransactionalChangeJournal settlementChangeJournal(
      InMemoryTransactionManager settlementTransactionManager) {
    return new TransactionalChangeJournal(settlementTransactionManager);
  }

  @Bean
  public SwapEngineState swapEngineState(
      SwapEngineProperties properties, TransactionalChangeJournal settlementChangeJournal) {
    return new SwapEngineState(
        properties.getOwner(),
        properties.getAllowedAssets(),
        new FeeSchedule(properties.getFeeAsset(), properties.getFeeAmount()),
        settlementChangeJournal);
  }

  @Bean
  @ConditionalOnMissingBean(AssetTransferGateway.class)
  public InMemoryAssetTransferGateway inMemoryAssetTransferGateway(
      SwapEngineProperties properties, TransactionalChangeJournal settlementChangeJournal) {
    return new InMemoryAssetTransferGateway(
        properties.getCustodyAccount(), settlementChangeJournal.whenActive());
  }

  @Bean
  public CustodyTransfers custodyTransfers(
      AssetTransferGateway assetTransferGateway, SwapEngineProperties properties) {
    return new CustodyTransfers(assetTransferGateway, properties.getCustodyAccount());
  }

  @Bean
  @ConditionalOnMissingBean
  public SwapTelemetry swapTelemetry(ObjectProvider<MeterRegistry> meterRegistryProvider) {
    MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable();
    if (meterRegistry == null) {
      return new NoOpSwapTelemetry();
    }
    return new MicrometerSwapTelemetry(meterRegistry);
  }

  @Bean
  public SettlementExecutor settlementExecutor(
      ReentrancyGuard reentrancyGuard,
      TransactionTemplate settlementTransactionTemplate,
      SwapTelemetry swapTelemetry) {
    return new SettlementExecutor(reentrancyGuard, settlementTransactionTemplate, swapTelemetry);
  }
}
