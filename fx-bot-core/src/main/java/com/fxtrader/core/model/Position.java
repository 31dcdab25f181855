package com.fxtrader.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Immutable record of an open position as the exchange reports it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Position(
    @JsonProperty("positionId") long positionId,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("side") Side side,
    @JsonProperty("price") double entryPrice,
    @JsonProperty("size") long size,
    @JsonProperty("openTime") Instant openTime
) {}
