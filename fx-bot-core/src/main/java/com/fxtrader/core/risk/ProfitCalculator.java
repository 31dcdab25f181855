package com.fxtrader.core.risk;

import com.fxtrader.core.api.ApiException;
import com.fxtrader.core.api.ExchangeGateway;
import com.fxtrader.core.model.Quote;
import com.fxtrader.core.model.Side;
import com.fxtrader.core.model.Symbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Realized profit of a closed position, in pips and in account currency.
 */
public class ProfitCalculator {
    private static final Logger logger = LoggerFactory.getLogger(ProfitCalculator.class);

    private final ExchangeGateway gateway;

    public ProfitCalculator(ExchangeGateway gateway) {
        this.gateway = gateway;
    }

    public double pips(String symbol, Side side, double entryPrice, double exitPrice) {
        return Symbols.pips(entryPrice, exitPrice, side, symbol);
    }

    /**
     * pips x size x pipSize, converted into the account currency through the cross bid
     * when the pair is quoted in another currency. Left unconverted if that rate is unavailable.
     */
    public double amount(String symbol, double pips, long size) throws InterruptedException {
        double amount = pips * size * Symbols.pipSize(symbol);
        if (!Symbols.isQuotedInAccountCurrency(symbol)) {
            String cross = Symbols.accountCrossSymbol(symbol);
            try {
                Quote quote = gateway.getCachedQuotes(List.of(cross)).get(cross);
                if (quote != null && quote.bid() > 0) {
                    amount *= quote.bid();
                } else {
                    logger.warn("⚠️ {} rate unavailable, {} profit left in {}", cross, symbol, Symbols.quoteCurrency(symbol));
                }
            } catch (ApiException e) {
                logger.warn("⚠️ {} lookup failed, {} profit left unconverted: {}", cross, symbol, e.getMessage());
            }
        }
        return Symbols.round2(amount);
    }
}
