package com.fxtrader.core.schedule;

import com.fxtrader.core.model.TradePlanEntry;

import java.io.IOException;
import java.util.List;

/**
 * Supplies the day's trade plan. Rows that cannot be parsed are skipped by the source.
 */
@FunctionalInterface
public interface TradePlanSource {

    List<TradePlanEntry> load() throws IOException;
}
