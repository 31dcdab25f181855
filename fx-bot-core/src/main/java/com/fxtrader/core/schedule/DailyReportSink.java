package com.fxtrader.core.schedule;

import com.fxtrader.core.model.TradeResult;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

/**
 * Durable export of one day's results.
 */
@FunctionalInterface
public interface DailyReportSink {

    void export(LocalDate date, List<TradeResult> results) throws IOException;
}
