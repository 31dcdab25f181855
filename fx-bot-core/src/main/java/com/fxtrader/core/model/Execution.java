package com.fxtrader.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One fill of an order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Execution(
    @JsonProperty("executionId") long executionId,
    @JsonProperty("orderId") long orderId,
    @JsonProperty("positionId") long positionId,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("price") double price,
    @JsonProperty("size") long size,
    @JsonProperty("fee") double fee,
    @JsonProperty("timestamp") Instant timestamp
) {}
