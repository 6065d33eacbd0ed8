package com.otcswap.infra.kafka.producer;

final class EventKeys {
  private EventKeys() {}

  static String require(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " must not be blank");
    }
    return value;
  }
}
