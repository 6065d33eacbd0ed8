package com.otcswap.engine.claims;

import java.math.BigDecimal;

public record Withdrawal(String principal, String asset, BigDecimal amount, BigDecimal remaining) {}
