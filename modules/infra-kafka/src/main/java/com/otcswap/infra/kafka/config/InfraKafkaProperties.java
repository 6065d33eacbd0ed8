package com.otcswap.infra.kafka.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "infra.kafka")
public class InfraKafkaProperties {
  private boolean enabled = false;
  private List<String> bootstrapServers = new ArrayList<>(List.of("localhost:9092"));
  private Producer producer = new Producer();
  private Topics topics = new Topics();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public List<String> getBootstrapServers() {
    return bootstrapServers;
  }

  public void setBootstrapServers(List<String> bootstrapServers) {
    this.bootstrapServers = bootstrapServers;
  }

  public Producer getProducer() {
    return producer;
  }

  public void setProducer(Producer producer) {
    this.producer = producer;
  }

  public Topics getTopics() {
    return topics;
  }

  public void setTopics(Topics topics) {
    this.topics = topics;
  }

  public String bootstrapServersAsCsv() {
    return String.join(",", bootstrapServers);
  }

  public static class Producer {
    private String clientId = "swap-engine";
    private String acks = "all";
    private boolean idempotenceEnabled = true;
    private int retries = 3;
    private String compressionType = "lz4";
    private int lingerMs = 5;
    private int batchSize = 32768;
    private int deliveryTimeoutMs = 120000;
    private int requestTimeoutMs = 30000;
    private int maxInFlightRequestsPerConnection = 5;
    private long sendTimeoutMs = 0L;

    public String getClientId() {
      return clientId;
    }

    public void setClientId(String clientId) {
      this.clientId = clientId;
    }

    public String getAcks() {
      return acks;
    }

    public void setAcks(String acks) {
      this.acks = acks;
    }

    public boolean isIdempotenceEnabled() {
      return idempotenceEnabled;
    }

    public void setIdempotenceEnabled(boolean idempotenceEnabled) {
      this.idempotenceEnabled = idempotenceEnabled;
    }

    public int getRetries() {
      return retries;
    }

    public void setRetries(int retries) {
      this.retries = retries;
    }

    public String getCompressionType() {
      return compressionType;
    }

    public void setCompressionType(String compressionType) {
      this.compressionType = compressionType;
    }

    public int getLingerMs() {
      return lingerMs;
    }

    public void setLingerMs(int lingerMs) {
      this.lingerMs = lingerMs;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public int getDeliveryTimeoutMs() {
      return deliveryTimeoutMs;
    }

    public void setDeliveryTimeoutMs(int deliveryTimeoutMs) {
      this.deliveryTimeoutMs = deliveryTimeoutMs;
    }

    public int getRequestTimeoutMs() {
      return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(int requestTimeoutMs) {
      this.requestTimeoutMs = requestTimeoutMs;
    }

    public int getMaxInFlightRequestsPerConnection() {
      return maxInFlightRequestsPerConnection;
    }

    public void setMaxInFlightRequestsPerConnection(int maxInFlightRequestsPerConnection) {
      this.maxInFlightRequestsPerConnection = maxInFlightRequestsPerConnection;
    }

    public long getSendTimeoutMs() {
      return sendTimeoutMs;
    }

    public void setSendTimeoutMs(long sendTimeoutMs) {
      this.sendTimeoutMs = sendTimeoutMs;
    }
  }

  public static class Topics {
    private boolean enabled = true;
    private int partitions = 3;
    private int replicationFactor = 1;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getPartitions() {
      return partitions;
    }

    public void setPartitions(int partitions) {
      this.partitions = partitions;
    }

    public int getReplicationFactor() {
      return replicationFactor;
    }

    public void setReplicationFactor(int replicationFactor) {
      this.replicationFactor = replicationFactor;
    }
  }
}
