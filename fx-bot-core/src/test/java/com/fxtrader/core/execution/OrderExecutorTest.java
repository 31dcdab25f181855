package com.fxtrader.core.execution;

import com.fxtrader.core.api.ApiException;
import com.fxtrader.core.api.ExchangeGateway;
import com.fxtrader.core.ledger.TradeLedger;
import com.fxtrader.core.model.AccountAssets;
import com.fxtrader.core.model.CloseReason;
import com.fxtrader.core.model.Execution;
import com.fxtrader.core.model.Position;
import com.fxtrader.core.model.Quote;
import com.fxtrader.core.model.ScheduledTrade;
import com.fxtrader.core.model.Side;
import com.fxtrader.core.model.TradePlanEntry;
import com.fxtrader.core.monitor.MonitoredPosition;
import com.fxtrader.core.monitor.PositionRegistry;
import com.fxtrader.core.notify.Notifier;
import com.fxtrader.core.risk.DailyVolumeLedger;
import com.fxtrader.core.risk.PositionSizer;
import com.fxtrader.core.risk.ProfitCalculator;
import com.fxtrader.core.testing.AdvancingSleeper;
import com.fxtrader.core.testing.ManualClock;
import com.fxtrader.core.testing.TestConfigs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for OrderExecutor entry and exit paths against a mocked exchange.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("OrderExecutor Tests")
class OrderExecutorTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);
    private static final Instant FAR_FUTURE = Instant.parse("2100-01-01T00:00:00Z");

    @Mock
    private ExchangeGateway gateway;
    @Mock
    private Notifier notifier;

    private ManualClock clock;
    private AdvancingSleeper sleeper;
    private DailyVolumeLedger volumeLedger;
    private TradeLedger tradeLedger;
    private PositionRegistry registry;
    private OrderExecutor executor;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(DAY.atTime(9, 0));
        sleeper = new AdvancingSleeper(clock);
        volumeLedger = new DailyVolumeLedger(500_000);
        tradeLedger = new TradeLedger();
        registry = new PositionRegistry();
        executor = newExecutor(volumeLedger);
    }

    private OrderExecutor newExecutor(DailyVolumeLedger volumes) {
        return new OrderExecutor(TestConfigs.defaults(), gateway, new PositionSizer(gateway, 1.0),
            new ProfitCalculator(gateway), volumes, tradeLedger, registry, notifier,
            new SimpleMeterRegistry(), clock, sleeper);
    }

    private static ScheduledTrade trade(long lot) {
        var entry = new TradePlanEntry(2, "USD_JPY", Side.BUY, "買", LocalTime.of(9, 0), LocalTime.of(9, 30),
            OptionalLong.of(lot));
        return new ScheduledTrade(entry, DAY.atTime(9, 0), DAY.atTime(9, 30));
    }

    private static Optional<Quote> quote(double bid, double ask) {
        return Optional.of(new Quote("USD_JPY", bid, ask, FAR_FUTURE));
    }

    private static Position position(long id) {
        return new Position(id, "USD_JPY", Side.BUY, 150.0, 10_000, Instant.parse("2024-03-01T09:00:01Z"));
    }

    private static Execution fill(long orderId, long positionId, double price, double fee) {
        return new Execution(9000 + orderId, orderId, positionId, "USD_JPY", price, 10_000, fee,
            Instant.parse("2024-03-01T09:00:01Z"));
    }

    @Nested
    @DisplayName("Entry")
    class Entry {

        @Test
        @DisplayName("Tight spread places the order and resolves the position from its fill")
        void entersOnTightSpread() throws InterruptedException {
            when(gateway.getQuote("USD_JPY")).thenReturn(quote(150.000, 150.005));
            when(gateway.placeMarketOrder("USD_JPY", Side.BUY, 10_000)).thenReturn(1001L);
            when(gateway.getExecutions(1001L)).thenReturn(List.of(fill(1001, 555, 150.005, 12.0)));
            when(gateway.getOpenPositions("USD_JPY")).thenReturn(List.of(position(554), position(555)));

            var trade = trade(10_000);
            var opened = executor.enter(trade);

            assertThat(opened).hasValueSatisfying(p -> {
                assertThat(p.positionId()).isEqualTo(555);
                assertThat(p.planRow()).isEqualTo(2);
                assertThat(p.exitAt()).isEqualTo(DAY.atTime(9, 30));
            });
            assertThat(executor.stateOf(trade)).contains(ExecutionState.MONITORING);
            assertThat(volumeLedger.volumeFor("USD_JPY")).isEqualTo(10_000);
            assertThat(tradeLedger.feeTotal()).isCloseTo(12.0, within(1e-9));
            verify(notifier).send(contains("Entry filled"));
        }

        @Test
        @DisplayName("Wide spread holds the entry back on every attempt and never sends an order")
        void wideSpreadNeverOrders() throws InterruptedException {
            when(gateway.getQuote("USD_JPY")).thenReturn(quote(150.000, 150.050));

            var trade = trade(10_000);
            assertThat(executor.enter(trade)).isEmpty();

            verify(gateway, never()).placeMarketOrder(anyString(), any(), anyLong());
            verify(notifier, times(3)).send(contains("Entry held back"));
            verify(notifier).send(contains("Entry failed"));
            assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(5), Duration.ofSeconds(5));
            assertThat(executor.stateOf(trade)).contains(ExecutionState.FAILED);
            assertThat(volumeLedger.volumeFor("USD_JPY")).isZero();
        }

        @Test
        @DisplayName("The same scheduled trade is entered at most once")
        void singleFlight() throws InterruptedException {
            when(gateway.getQuote("USD_JPY")).thenReturn(quote(150.000, 150.050));
            var trade = trade(10_000);
            executor.enter(trade);

            assertThat(executor.enter(trade)).isEmpty();

            verify(gateway, times(3)).getQuote("USD_JPY");
        }

        @Test
        @DisplayName("Volume cap rejects the entry before any order is sent")
        void volumeCapRejects() throws InterruptedException {
            executor = newExecutor(new DailyVolumeLedger(5_000));
            when(gateway.getQuote("USD_JPY")).thenReturn(quote(150.000, 150.005));

            assertThat(executor.enter(trade(10_000))).isEmpty();

            verify(gateway, never()).placeMarketOrder(anyString(), any(), anyLong());
            verify(notifier).send(contains("daily volume limit exceeded"));
        }

        @Test
        @DisplayName("A failed order gives its reserved volume back")
        void failedOrderReleasesVolume() throws InterruptedException {
            when(gateway.getQuote("USD_JPY")).thenReturn(quote(150.000, 150.005));
            when(gateway.placeMarketOrder("USD_JPY", Side.BUY, 10_000))
                .thenThrow(new ApiException(ApiException.Kind.TRANSIENT, "insufficient funds", "ERR-201", null));

            assertThat(executor.enter(trade(10_000))).isEmpty();

            verify(gateway, times(3)).placeMarketOrder("USD_JPY", Side.BUY, 10_000);
            verify(gateway, never()).getOpenPositions(anyString());
            assertThat(volumeLedger.volumeFor("USD_JPY")).isZero();
        }

        @Test
        @DisplayName("An order that timed out but opened a position is not placed again")
        void unknownOutcomeLanded() throws InterruptedException {
            when(gateway.getQuote("USD_JPY")).thenReturn(quote(150.000, 150.005));
            when(gateway.placeMarketOrder("USD_JPY", Side.BUY, 10_000))
                .thenThrow(new ApiException(ApiException.Kind.TRANSIENT, "POST /v1/order timed out"));
            when(gateway.getOpenPositions("USD_JPY")).thenReturn(List.of(position(555)));

            var trade = trade(10_000);
            var opened = executor.enter(trade);

            assertThat(opened).hasValueSatisfying(p -> assertThat(p.positionId()).isEqualTo(555));
            verify(gateway, times(1)).placeMarketOrder("USD_JPY", Side.BUY, 10_000);
            assertThat(executor.stateOf(trade)).contains(ExecutionState.MONITORING);
            assertThat(volumeLedger.volumeFor("USD_JPY")).isEqualTo(10_000);
            verify(notifier).send(contains("Entry filled"));
        }

        @Test
        @DisplayName("An order that timed out without a position is placed again after checking")
        void unknownOutcomeNotLanded() throws InterruptedException {
            when(gateway.getQuote("USD_JPY")).thenReturn(quote(150.000, 150.005));
            when(gateway.placeMarketOrder("USD_JPY", Side.BUY, 10_000))
                .thenThrow(new ApiException(ApiException.Kind.TRANSIENT, "POST /v1/order: HTTP 502"))
                .thenReturn(1001L);
            when(gateway.getOpenPositions("USD_JPY")).thenReturn(List.of(), List.of(position(555)));

            var opened = executor.enter(trade(10_000));

            assertThat(opened).hasValueSatisfying(p -> assertThat(p.positionId()).isEqualTo(555));
            verify(gateway, times(2)).placeMarketOrder("USD_JPY", Side.BUY, 10_000);
            assertThat(volumeLedger.volumeFor("USD_JPY")).isEqualTo(10_000);
        }

        @Test
        @DisplayName("A failing position check blocks a second order until the entry gives up")
        void unknownOutcomeUnverifiable() throws InterruptedException {
            when(gateway.getQuote("USD_JPY")).thenReturn(quote(150.000, 150.005));
            when(gateway.placeMarketOrder("USD_JPY", Side.BUY, 10_000))
                .thenThrow(new ApiException(ApiException.Kind.TRANSIENT, "POST /v1/order timed out"));
            when(gateway.getOpenPositions("USD_JPY"))
                .thenThrow(new ApiException(ApiException.Kind.TRANSIENT, "GET /v1/openPositions: HTTP 503"));

            var trade = trade(10_000);
            assertThat(executor.enter(trade)).isEmpty();

            verify(gateway, times(1)).placeMarketOrder("USD_JPY", Side.BUY, 10_000);
            assertThat(executor.stateOf(trade)).contains(ExecutionState.FAILED);
            assertThat(volumeLedger.volumeFor("USD_JPY")).isZero();
        }

        @Test
        @DisplayName("Adopt takes over an untracked position on the planned side")
        void adoptsOrphan() throws InterruptedException {
            var trade = trade(10_000);
            when(gateway.getOpenPositions("USD_JPY")).thenReturn(List.of(position(777)));

            var adopted = executor.adopt(trade);

            assertThat(adopted).hasValueSatisfying(p -> assertThat(p.positionId()).isEqualTo(777));
            assertThat(executor.stateOf(trade)).contains(ExecutionState.MONITORING);
        }

        @Test
        @DisplayName("Finished entries are forgotten, open ones are kept")
        void clearFinished() throws InterruptedException {
            when(gateway.getQuote("USD_JPY")).thenReturn(quote(150.000, 150.050));
            var trade = trade(10_000);
            executor.enter(trade);

            executor.clearFinished();

            assertThat(executor.states()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Exit")
    class Exit {

        private MonitoredPosition tracked;

        @BeforeEach
        void track() {
            tracked = new MonitoredPosition(position(555), 2, DAY.atTime(9, 0), DAY.atTime(9, 30));
            registry.register(tracked);
        }

        @Test
        @DisplayName("Close records the realized result from the close fill")
        void closesAndRecords() throws InterruptedException {
            when(gateway.closePosition(tracked.position())).thenReturn(2002L);
            when(gateway.getExecutions(2002L)).thenReturn(List.of(fill(2002, 555, 150.200, 8.0)));
            when(gateway.getAssets()).thenReturn(new AccountAssets(1_000_000, 1_002_000));
            clock.set(DAY.atTime(9, 30));

            var result = executor.close(tracked, CloseReason.SCHEDULED);

            assertThat(result).hasValueSatisfying(r -> {
                assertThat(r.profitPips()).isEqualTo(20.0);
                assertThat(r.profitAmount()).isCloseTo(2000.0, within(0.01));
                assertThat(r.exitTime()).isEqualTo(DAY.atTime(9, 30));
                assertThat(r.reason()).isEqualTo(CloseReason.SCHEDULED);
            });
            assertThat(tradeLedger.pending()).hasSize(1);
            assertThat(registry.isTracked(555)).isFalse();
            assertThat(registry.claimOf(555)).isEmpty();
        }

        @Test
        @DisplayName("A position already claimed by another path is not closed twice")
        void respectsExistingClaim() throws InterruptedException {
            registry.tryClaim(555, CloseReason.STOP_LOSS);

            assertThat(executor.close(tracked, CloseReason.SCHEDULED)).isEmpty();

            verify(gateway, never()).closePosition(any());
            assertThat(registry.claimOf(555)).contains(CloseReason.STOP_LOSS);
        }

        @Test
        @DisplayName("Without close fills the mark price is used")
        void fallsBackToMarkPrice() throws InterruptedException {
            when(gateway.closePosition(tracked.position())).thenReturn(2002L);
            when(gateway.getExecutions(2002L)).thenReturn(List.of());
            when(gateway.getQuote("USD_JPY")).thenReturn(quote(149.900, 149.905));
            when(gateway.getAssets()).thenReturn(new AccountAssets(1_000_000, 999_000));

            var result = executor.close(tracked, CloseReason.STOP_LOSS);

            assertThat(result).hasValueSatisfying(r -> {
                assertThat(r.exitPrice()).isEqualTo(149.900);
                assertThat(r.profitPips()).isEqualTo(-10.0);
            });
        }

        @Test
        @DisplayName("An accepted close is recorded even when every follow-up lookup fails")
        void acceptedCloseSurvivesLookupOutage() throws InterruptedException {
            var outage = new ApiException(ApiException.Kind.TRANSIENT, "GET: HTTP 503 - maintenance");
            when(gateway.closePosition(tracked.position())).thenReturn(2002L);
            when(gateway.getExecutions(2002L)).thenThrow(outage);
            when(gateway.getQuote("USD_JPY")).thenThrow(outage);
            when(gateway.getAssets()).thenThrow(outage);

            var result = executor.close(tracked, CloseReason.SCHEDULED);

            assertThat(result).hasValueSatisfying(r -> {
                assertThat(r.exitPrice()).isEqualTo(150.0);
                assertThat(r.profitPips()).isZero();
            });
            assertThat(tradeLedger.pending()).hasSize(1);
            assertThat(registry.isTracked(555)).isFalse();
            assertThat(registry.claimOf(555)).isEmpty();
        }

        @Test
        @DisplayName("Transient close failures are retried up to the exit attempts")
        void closeRetriesTransientFailures() throws InterruptedException {
            when(gateway.closePosition(tracked.position()))
                .thenThrow(new ApiException(ApiException.Kind.TRANSIENT, "POST /v1/closeOrder timed out"))
                .thenThrow(new ApiException(ApiException.Kind.RATE_LIMITED, "throttled", "ERR-5003", null))
                .thenReturn(2002L);
            when(gateway.getExecutions(2002L)).thenReturn(List.of(fill(2002, 555, 150.100, 0)));
            when(gateway.getAssets()).thenReturn(new AccountAssets(1_000_000, 1_001_000));

            assertThat(executor.close(tracked, CloseReason.SCHEDULED)).isPresent();

            verify(gateway, times(3)).closePosition(tracked.position());
            assertThat(sleeper.sleeps()).containsExactly(Duration.ofSeconds(10), Duration.ofSeconds(10));
        }

        @Test
        @DisplayName("When every close fails the claim is released and a manual action is requested")
        void closeFailureReleasesClaim() throws InterruptedException {
            when(gateway.closePosition(tracked.position()))
                .thenThrow(new ApiException(ApiException.Kind.AUTH, "ERR-5201 invalid signature"));

            assertThat(executor.close(tracked, CloseReason.SCHEDULED)).isEmpty();

            verify(gateway, times(2)).closePosition(tracked.position());
            verify(notifier).send(contains("Manual action required"));
            assertThat(registry.claimOf(555)).isEmpty();
            assertThat(registry.isTracked(555)).isTrue();
            assertThat(tradeLedger.pending()).isEmpty();
        }
    }
}
