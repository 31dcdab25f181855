package com.fxtrader.core.metrics;

import com.fxtrader.core.api.ExchangeGateway.ApiStats;
import com.fxtrader.core.model.TradeResult;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Performance summary recomputed from the trade history on demand.
 *
 * Drawdown is measured on the cumulative pips and amount curves from a running peak that
 * starts at zero.
 */
public record PerformanceMetrics(
    int totalTrades,
    int wins,
    int losses,
    double totalPips,
    double totalAmount,
    double maxDrawdownPips,
    double maxDrawdownAmount,
    long apiCalls,
    long apiErrors,
    Duration uptime
) {

    public static PerformanceMetrics from(List<TradeResult> history, ApiStats api, Duration uptime) {
        int wins = 0;
        double pips = 0;
        double amount = 0;
        double peakPips = 0;
        double peakAmount = 0;
        double ddPips = 0;
        double ddAmount = 0;

        for (TradeResult r : history) {
            if (r.isWin()) {
                wins++;
            }
            pips += r.profitPips();
            amount += r.profitAmount();
            peakPips = Math.max(peakPips, pips);
            peakAmount = Math.max(peakAmount, amount);
            ddPips = Math.max(ddPips, peakPips - pips);
            ddAmount = Math.max(ddAmount, peakAmount - amount);
        }
        return new PerformanceMetrics(history.size(), wins, history.size() - wins, pips, amount,
            ddPips, ddAmount, api.calls(), api.errors(), uptime);
    }

    public double winRate() {
        return totalTrades == 0 ? 0.0 : wins * 100.0 / totalTrades;
    }

    public double averagePips() {
        return totalTrades == 0 ? 0.0 : totalPips / totalTrades;
    }

    public double apiSuccessRate() {
        return apiCalls == 0 ? 100.0 : (apiCalls - apiErrors) * 100.0 / apiCalls;
    }

    public String format(double balance) {
        return String.format(Locale.ROOT, """
            📈 Performance
            Trades: %d (wins %d / losses %d), win rate %.1f%%
            Pips: %+.1f total, %+.1f average
            Amount: %+,.0f
            Balance: %,.0f
            Max drawdown: %.1f pips / %,.0f
            API: %d calls, %d errors (%.1f%% success)
            Uptime: %dh %02dm""",
            totalTrades, wins, losses, winRate(),
            totalPips, averagePips(),
            totalAmount,
            balance,
            maxDrawdownPips, maxDrawdownAmount,
            apiCalls, apiErrors, apiSuccessRate(),
            uptime.toHours(), uptime.toMinutesPart());
    }
}
