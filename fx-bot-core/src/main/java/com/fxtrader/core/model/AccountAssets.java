package com.fxtrader.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Account margin snapshot. {@code availableAmount} is what new orders may use.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountAssets(
    @JsonProperty("availableAmount") double availableAmount,
    @JsonProperty("balance") double balance
) {}
