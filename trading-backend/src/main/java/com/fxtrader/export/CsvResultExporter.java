package com.fxtrader.export;

import com.fxtrader.core.model.Symbols;
import com.fxtrader.core.model.TradeResult;
import com.fxtrader.core.schedule.DailyReportSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Writes one day's results to {@code <dir>/daily_results_YYYY-MM-DD.csv}, replacing any earlier
 * export of the same day.
 */
public final class CsvResultExporter implements DailyReportSink {
    private static final Logger logger = LoggerFactory.getLogger(CsvResultExporter.class);

    static final String HEADER =
        "date,symbol,side,entry_price,exit_price,lot_size,profit_pips,profit_amount,entry_time,exit_time";
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path directory;

    public CsvResultExporter(Path directory) {
        this.directory = directory;
    }

    @Override
    public void export(LocalDate date, List<TradeResult> results) throws IOException {
        Files.createDirectories(directory);
        Path target = fileFor(date);
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            writer.write(HEADER);
            writer.newLine();
            for (TradeResult r : results) {
                writer.write(row(date, r));
                writer.newLine();
            }
        }
        logger.info("💾 Wrote {} result(s) to {}", results.size(), target);
    }

    public Path fileFor(LocalDate date) {
        return directory.resolve("daily_results_" + date + ".csv");
    }

    static String row(LocalDate date, TradeResult r) {
        return String.join(",",
            date.toString(),
            r.symbol(),
            r.side().name(),
            Symbols.formatPrice(r.entryPrice(), r.symbol()),
            Symbols.formatPrice(r.exitPrice(), r.symbol()),
            String.valueOf(r.lotSize()),
            String.format(Locale.ROOT, "%.1f", r.profitPips()),
            String.format(Locale.ROOT, "%.0f", r.profitAmount()),
            r.entryTime().format(DATE_TIME),
            r.exitTime().format(DATE_TIME));
    }
}
