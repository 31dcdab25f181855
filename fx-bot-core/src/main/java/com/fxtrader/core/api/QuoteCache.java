package com.fxtrader.core.api;

import com.fxtrader.core.model.Quote;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-lived quote cache keyed by symbol. Expired entries are never served.
 */
public class QuoteCache {
    public static final Duration DEFAULT_TTL = Duration.ofSeconds(5);

    private final Map<String, Quote> quotes = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public QuoteCache(Clock clock) {
        this(clock, DEFAULT_TTL);
    }

    public QuoteCache(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * Fresh quotes for the requested symbols; symbols missing or expired are absent from the result.
     */
    public Map<String, Quote> getFresh(Collection<String> symbols) {
        var now = clock.instant();
        var result = new HashMap<String, Quote>();
        for (String symbol : symbols) {
            Quote quote = quotes.get(symbol);
            if (quote != null && !quote.isExpired(now)) {
                result.put(symbol, quote);
            }
        }
        return result;
    }

    /**
     * Store raw quotes, stamping each with now + ttl.
     */
    public void putAll(List<Quote> fetched) {
        var expiresAt = clock.instant().plus(ttl);
        for (Quote q : fetched) {
            quotes.put(q.symbol(), new Quote(q.symbol(), q.bid(), q.ask(), expiresAt));
        }
    }

    public void clear() {
        quotes.clear();
    }
}
