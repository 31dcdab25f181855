package com.fxtrader.core.model;

import java.util.Locale;

/**
 * Currency pair helpers: notation, pip size and price formatting.
 */
public final class Symbols {

    public static final String USD_JPY = "USD_JPY";
    public static final String ACCOUNT_CURRENCY = "JPY";

    private static final double JPY_PIP = 0.01;
    private static final double DEFAULT_PIP = 0.0001;

    private Symbols() {
    }

    /**
     * Normalize plan notation to the exchange's: USD/JPY and USDJPY both become USD_JPY.
     */
    public static String normalize(String raw) {
        String pair = raw.strip().toUpperCase(Locale.ROOT);
        if (pair.contains("/")) {
            return pair.replace("/", "_");
        }
        if (pair.length() == 6 && !pair.contains("_")) {
            return pair.substring(0, 3) + "_" + pair.substring(3);
        }
        return pair;
    }

    public static boolean isJpyQuoted(String symbol) {
        return symbol.contains("JPY");
    }

    public static String quoteCurrency(String symbol) {
        int separator = symbol.indexOf('_');
        return separator >= 0 ? symbol.substring(separator + 1) : symbol.substring(Math.max(0, symbol.length() - 3));
    }

    public static boolean isQuotedInAccountCurrency(String symbol) {
        return ACCOUNT_CURRENCY.equals(quoteCurrency(symbol));
    }

    /**
     * Pair converting the symbol's quote currency into the account currency, e.g. EUR_USD -> USD_JPY.
     */
    public static String accountCrossSymbol(String symbol) {
        return quoteCurrency(symbol) + "_" + ACCOUNT_CURRENCY;
    }

    public static double pipSize(String symbol) {
        return isJpyQuoted(symbol) ? JPY_PIP : DEFAULT_PIP;
    }

    public static String formatPrice(double price, String symbol) {
        return isJpyQuoted(symbol)
            ? String.format(Locale.ROOT, "%.3f", price)
            : String.format(Locale.ROOT, "%.5f", price);
    }

    /**
     * Signed pip distance from entry to the given price, positive when the move favors the side.
     * Rounded to 2 decimals.
     */
    public static double pips(double entryPrice, double price, Side side, String symbol) {
        double move = side == Side.BUY ? price - entryPrice : entryPrice - price;
        return round2(move / pipSize(symbol));
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
