package com.fxtrader.core.risk;

import com.fxtrader.core.api.ApiException;
import com.fxtrader.core.api.ExchangeGateway;
import com.fxtrader.core.model.Quote;
import com.fxtrader.core.model.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for PositionSizer.
 * Quotes come from a mocked gateway; no network.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PositionSizer Tests")
class PositionSizerTest {

    private static final Instant FAR_FUTURE = Instant.parse("2100-01-01T00:00:00Z");

    @Mock
    private ExchangeGateway gateway;

    private PositionSizer sizer;

    @BeforeEach
    void setUp() {
        sizer = new PositionSizer(gateway, 1.0);
    }

    private static Optional<Quote> quote(String symbol, double bid, double ask) {
        return Optional.of(new Quote(symbol, bid, ask, FAR_FUTURE));
    }

    @Nested
    @DisplayName("JPY-quoted pairs")
    class JpyQuoted {

        @Test
        @DisplayName("100000 balance at 10x on USD_JPY ask 150.000 sizes 6333")
        void referenceExample() throws InterruptedException {
            when(gateway.getQuote("USD_JPY")).thenReturn(quote("USD_JPY", 149.990, 150.000));

            assertThat(sizer.size(100_000, "USD_JPY", Side.BUY, 10)).isEqualTo(6333);
        }

        @Test
        @DisplayName("SELL sizes on the bid")
        void sellUsesBid() throws InterruptedException {
            when(gateway.getQuote("USD_JPY")).thenReturn(quote("USD_JPY", 95.0, 150.0));

            // 95000 x 10 / 95
            assertThat(sizer.size(100_000, "USD_JPY", Side.SELL, 10)).isEqualTo(10_000);
        }

        @Test
        @DisplayName("Risk ratio scales the available balance")
        void riskRatioApplied() throws InterruptedException {
            var halfSizer = new PositionSizer(gateway, 0.5);
            when(gateway.getQuote("USD_JPY")).thenReturn(quote("USD_JPY", 99.99, 100.0));

            // 100000 x 0.5 x 0.95 x 10 / 100
            assertThat(halfSizer.size(100_000, "USD_JPY", Side.BUY, 10)).isEqualTo(4750);
        }

        @Test
        @DisplayName("Never returns more than the maximum volume")
        void clampedHigh() throws InterruptedException {
            when(gateway.getQuote("USD_JPY")).thenReturn(quote("USD_JPY", 149.99, 150.0));

            assertThat(sizer.size(1_000_000_000, "USD_JPY", Side.BUY, 100)).isEqualTo(PositionSizer.MAX_VOLUME);
        }

        @Test
        @DisplayName("Never returns less than the minimum volume")
        void clampedLow() throws InterruptedException {
            when(gateway.getQuote("USD_JPY")).thenReturn(quote("USD_JPY", 149.99, 150.0));

            assertThat(sizer.size(1, "USD_JPY", Side.BUY, 1)).isEqualTo(PositionSizer.MIN_VOLUME);
        }

        @ParameterizedTest(name = "balance {0}")
        @ValueSource(doubles = {1_000, 10_000, 100_000, 1_000_000, 10_000_000})
        @DisplayName("Volume is monotonic in balance and leverage")
        void monotonic(double balance) throws InterruptedException {
            when(gateway.getQuote("USD_JPY")).thenReturn(quote("USD_JPY", 149.99, 150.0));

            long base = sizer.size(balance, "USD_JPY", Side.BUY, 5);
            assertThat(sizer.size(balance * 2, "USD_JPY", Side.BUY, 5)).isGreaterThanOrEqualTo(base);
            assertThat(sizer.size(balance, "USD_JPY", Side.BUY, 10)).isGreaterThanOrEqualTo(base);
            assertThat(base).isBetween(PositionSizer.MIN_VOLUME, PositionSizer.MAX_VOLUME);
        }
    }

    @Nested
    @DisplayName("Cross-currency pairs")
    class CrossPairs {

        @Test
        @DisplayName("EUR_USD converts the balance through the USD_JPY bid")
        void convertsThroughCross() throws InterruptedException {
            when(gateway.getQuote("EUR_USD")).thenReturn(quote("EUR_USD", 1.0999, 1.1000));
            when(gateway.getQuote("USD_JPY")).thenReturn(quote("USD_JPY", 150.0, 150.01));

            // 95000 / 150 = 633.33 USD, x 10 / 1.1 = 5757.5
            assertThat(sizer.size(100_000, "EUR_USD", Side.BUY, 10)).isEqualTo(5757);
        }

        @Test
        @DisplayName("Falls back to the unconverted formula when the cross rate is missing")
        void fallsBackWithoutCross() throws InterruptedException {
            when(gateway.getQuote("EUR_USD")).thenReturn(quote("EUR_USD", 1.0999, 1.1000));
            when(gateway.getQuote("USD_JPY")).thenThrow(new ApiException(ApiException.Kind.TRANSIENT, "timeout"));

            // 95000 x 10 / 1.1 = 863636, clamped
            assertThat(sizer.size(100_000, "EUR_USD", Side.BUY, 10)).isEqualTo(PositionSizer.MAX_VOLUME);
        }
    }

    @Nested
    @DisplayName("Invalid input")
    class InvalidInput {

        @ParameterizedTest(name = "balance {0}")
        @ValueSource(doubles = {0, -1, Double.NaN})
        @DisplayName("Rejects non-positive balance before any quote lookup")
        void rejectsBalance(double balance) throws InterruptedException {
            assertThatThrownBy(() -> sizer.size(balance, "USD_JPY", Side.BUY, 10))
                .isInstanceOf(SizingException.class)
                .satisfies(e -> assertThat(((SizingException) e).reason()).isEqualTo(SizingException.Reason.INVALID_INPUT));
            verify(gateway, never()).getQuote(anyString());
        }

        @Test
        @DisplayName("Rejects zero leverage")
        void rejectsLeverage() {
            assertThatThrownBy(() -> sizer.size(100_000, "USD_JPY", Side.BUY, 0))
                .isInstanceOf(SizingException.class);
        }

        @Test
        @DisplayName("Missing quote is QUOTE_UNAVAILABLE")
        void missingQuote() throws InterruptedException {
            when(gateway.getQuote("USD_JPY")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> sizer.size(100_000, "USD_JPY", Side.BUY, 10))
                .isInstanceOf(SizingException.class)
                .satisfies(e -> assertThat(((SizingException) e).reason()).isEqualTo(SizingException.Reason.QUOTE_UNAVAILABLE));
        }

        @Test
        @DisplayName("Rejects a risk ratio outside (0, 1]")
        void rejectsRiskRatio() {
            assertThatThrownBy(() -> new PositionSizer(gateway, 1.5)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("clamp bounds")
    void clamp() {
        assertThat(PositionSizer.clamp(0)).isEqualTo(1);
        assertThat(PositionSizer.clamp(-5)).isEqualTo(1);
        assertThat(PositionSizer.clamp(250_000)).isEqualTo(250_000);
        assertThat(PositionSizer.clamp(600_000)).isEqualTo(500_000);
    }
}
