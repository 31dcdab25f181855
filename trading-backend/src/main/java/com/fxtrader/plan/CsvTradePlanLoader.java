package com.fxtrader.plan;

import com.fxtrader.core.model.Side;
import com.fxtrader.core.model.Symbols;
import com.fxtrader.core.model.TradePlanEntry;
import com.fxtrader.core.notify.Notifier;
import com.fxtrader.core.schedule.TradePlanSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Reads the daily plan from trades.csv.
 *
 * The first line is a header. Columns: 0 label (ignored), 1 side, 2 symbol, 3 entry HH:mm:ss,
 * 4 exit HH:mm:ss, 5 lot (blank for auto). Blank lines are ignored; malformed rows are skipped
 * with a warning and a notification.
 */
public final class CsvTradePlanLoader implements TradePlanSource {
    private static final Logger logger = LoggerFactory.getLogger(CsvTradePlanLoader.class);
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final int MIN_COLUMNS = 6;

    private final Path file;
    private final Notifier notifier;

    public CsvTradePlanLoader(Path file, Notifier notifier) {
        this.file = file;
        this.notifier = notifier;
    }

    @Override
    public List<TradePlanEntry> load() throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        var entries = new ArrayList<TradePlanEntry>();
        var skipped = new ArrayList<String>();

        // Line 1 is the header
        for (int i = 1; i < lines.size(); i++) {
            int rowNumber = i + 1;
            String line = lines.get(i);
            if (line.isBlank() || line.replace(",", "").isBlank()) {
                continue;
            }
            parseRow(rowNumber, line.split(",", -1)).ifPresentOrElse(entries::add, () -> skipped.add("#" + rowNumber));
        }

        logger.info("📄 Loaded {} trade(s) from {}{}", entries.size(), file,
            skipped.isEmpty() ? "" : ", skipped rows " + skipped);
        return entries;
    }

    Optional<TradePlanEntry> parseRow(int rowNumber, String[] cells) {
        if (cells.length < MIN_COLUMNS) {
            return skip(rowNumber, "expected " + MIN_COLUMNS + " columns, found " + cells.length);
        }
        String rawSide = cells[1].strip();
        String rawSymbol = cells[2].strip();
        String rawEntry = cells[3].strip();
        String rawExit = cells[4].strip();
        String rawLot = cells[5].strip();
        if (rawSide.isEmpty() || rawSymbol.isEmpty() || rawEntry.isEmpty() || rawExit.isEmpty()) {
            return skip(rowNumber, "incomplete row");
        }

        Optional<Side> side = Side.parse(rawSide);
        if (side.isEmpty()) {
            return skip(rowNumber, "invalid side '" + rawSide + "' (use 買/売, long/short, l/s or BUY/SELL)");
        }

        LocalTime entryTime;
        LocalTime exitTime;
        try {
            entryTime = LocalTime.parse(rawEntry, TIME);
            exitTime = LocalTime.parse(rawExit, TIME);
        } catch (DateTimeParseException e) {
            return skip(rowNumber, "time must be HH:mm:ss, got '" + rawEntry + "' / '" + rawExit + "'");
        }

        OptionalLong lot = OptionalLong.empty();
        if (!rawLot.isEmpty()) {
            try {
                long parsed = Math.round(Double.parseDouble(rawLot));
                if (parsed <= 0) {
                    return skip(rowNumber, "lot must be positive, got '" + rawLot + "'");
                }
                lot = OptionalLong.of(parsed);
            } catch (NumberFormatException e) {
                return skip(rowNumber, "lot is not a number: '" + rawLot + "'");
            }
        }

        return Optional.of(new TradePlanEntry(rowNumber, Symbols.normalize(rawSymbol), side.get(), rawSide,
            entryTime, exitTime, lot));
    }

    private Optional<TradePlanEntry> skip(int rowNumber, String reason) {
        logger.warn("⚠️ Row {} of {} skipped: {}", rowNumber, file.getFileName(), reason);
        notifier.send(String.format("⚠️ Trade plan row %d skipped: %s", rowNumber, reason));
        return Optional.empty();
    }
}
