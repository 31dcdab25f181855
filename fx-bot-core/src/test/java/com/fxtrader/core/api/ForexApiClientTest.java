package com.fxtrader.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fxtrader.core.model.Position;
import com.fxtrader.core.model.Side;
import com.fxtrader.core.testing.AdvancingSleeper;
import com.fxtrader.core.testing.ManualClock;
import io.javalin.Javalin;
import io.javalin.http.Handler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ForexApiClient against a local fake exchange.
 */
@DisplayName("ForexApiClient Tests")
class ForexApiClientTest {

    private static final String API_KEY = "test-key";
    private static final String API_SECRET = "test-secret";
    private static final String OK_EMPTY = "{\"status\":0,\"data\":[]}";
    private static final String THROTTLED =
        "{\"status\":5,\"messages\":[{\"message_code\":\"ERR-5003\",\"message_string\":\"Requests are too many.\"}]}";

    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();
    private final AtomicReference<Map<String, String>> lastHeaders = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastQuery = new AtomicReference<>();

    private Javalin exchange;
    private ManualClock clock;
    private RateLimitGate gate;
    private ForexApiClient client;

    @BeforeEach
    void setUp() {
        exchange = Javalin.create(cfg -> cfg.showJavalinBanner = false);
        clock = new ManualClock(LocalDateTime.of(2024, 3, 1, 9, 0));
        var sleeper = new AdvancingSleeper(clock);
        gate = new RateLimitGate(20, 5, clock, sleeper, () -> 0.0);
    }

    @AfterEach
    void tearDown() {
        exchange.stop();
    }

    private void respond(String method, String path, String... bodies) {
        var counter = hits.computeIfAbsent(path, p -> new AtomicInteger());
        Handler handler = ctx -> {
            int n = counter.getAndIncrement();
            lastHeaders.set(Map.of(
                "API-KEY", String.valueOf(ctx.header("API-KEY")),
                "API-TIMESTAMP", String.valueOf(ctx.header("API-TIMESTAMP")),
                "API-SIGN", String.valueOf(ctx.header("API-SIGN"))));
            lastBody.set(ctx.body());
            lastQuery.set(ctx.queryString());
            ctx.contentType("application/json").result(bodies[Math.min(n, bodies.length - 1)]);
        };
        if (method.equals("GET")) {
            exchange.get(path, handler);
        } else {
            exchange.post(path, handler);
        }
    }

    private void start() {
        exchange.start(0);
        String base = "http://localhost:" + exchange.port();
        client = new ForexApiClient(API_KEY, API_SECRET, base + "/private", base + "/public",
            gate, new QuoteCache(clock), new SimpleMeterRegistry(), clock, new AdvancingSleeper(clock));
    }

    private int hitsOf(String path) {
        return hits.getOrDefault(path, new AtomicInteger()).get();
    }

    @Nested
    @DisplayName("Signing and parsing")
    class SigningAndParsing {

        @Test
        @DisplayName("Private GET carries key, timestamp and HMAC signature over the path")
        void signsPrivateRequests() throws Exception {
            respond("GET", "/private/v1/account/assets",
                "{\"status\":0,\"data\":{\"availableAmount\":\"900000\",\"balance\":\"1000000\"}}");
            start();

            var assets = client.getAssets();

            assertThat(assets.availableAmount()).isEqualTo(900_000.0);
            assertThat(assets.balance()).isEqualTo(1_000_000.0);
            var headers = lastHeaders.get();
            long timestamp = Long.parseLong(headers.get("API-TIMESTAMP"));
            assertThat(headers.get("API-KEY")).isEqualTo(API_KEY);
            assertThat(headers.get("API-SIGN"))
                .isEqualTo(new HmacSigner(API_SECRET).sign(timestamp, "GET", "/v1/account/assets", ""))
                .matches("[0-9a-f]{64}");
        }

        @Test
        @DisplayName("Ticker is batched and limited to the requested symbols")
        void quotes() throws Exception {
            respond("GET", "/public/v1/ticker", "{\"status\":0,\"data\":["
                + "{\"symbol\":\"USD_JPY\",\"bid\":\"150.000\",\"ask\":\"150.005\"},"
                + "{\"symbol\":\"EUR_JPY\",\"bid\":\"162.100\",\"ask\":\"162.110\"},"
                + "{\"symbol\":\"GBP_JPY\",\"bid\":\"190.000\",\"ask\":\"190.020\"}]}");
            start();

            var quotes = client.getQuotes(List.of("USD_JPY", "EUR_JPY"));

            assertThat(quotes).containsOnlyKeys("USD_JPY", "EUR_JPY");
            assertThat(quotes.get("USD_JPY").ask()).isEqualTo(150.005);
            assertThat(lastQuery.get()).isEqualTo("symbol=USD_JPY%2CEUR_JPY");
        }

        @Test
        @DisplayName("Cached quotes are served without a second request while fresh")
        void cachedQuotes() throws Exception {
            respond("GET", "/public/v1/ticker",
                "{\"status\":0,\"data\":[{\"symbol\":\"USD_JPY\",\"bid\":\"150.000\",\"ask\":\"150.005\"}]}");
            start();

            client.getCachedQuotes(List.of("USD_JPY"));
            client.getCachedQuotes(List.of("USD_JPY"));

            assertThat(hitsOf("/public/v1/ticker")).isEqualTo(1);
        }

        @Test
        @DisplayName("Positions wrapped in data.list are flattened")
        void wrappedList() throws Exception {
            respond("GET", "/private/v1/openPositions", "{\"status\":0,\"data\":{\"list\":["
                + "{\"positionId\":123,\"symbol\":\"USD_JPY\",\"side\":\"BUY\",\"price\":\"150.123\","
                + "\"size\":\"10000\",\"openTime\":\"2024-03-01T00:00:00.000Z\",\"lossGain\":\"-20\"}]}}");
            start();

            List<Position> positions = client.getOpenPositions("USD_JPY");

            assertThat(positions).singleElement().satisfies(p -> {
                assertThat(p.positionId()).isEqualTo(123);
                assertThat(p.side()).isEqualTo(Side.BUY);
                assertThat(p.entryPrice()).isEqualTo(150.123);
                assertThat(p.size()).isEqualTo(10_000);
                assertThat(p.openTime()).isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
            });
            assertThat(lastQuery.get()).isEqualTo("symbol=USD_JPY");
        }

        @Test
        @DisplayName("Market order posts a signed MARKET body and returns the order id")
        void placesOrder() throws Exception {
            respond("POST", "/private/v1/order", "{\"status\":0,\"data\":[{\"rootOrderId\":1,\"orderId\":4567}]}");
            start();

            long orderId = client.placeMarketOrder("USD_JPY", Side.SELL, 10_000);

            assertThat(orderId).isEqualTo(4567);
            JsonNode body = mapper.readTree(lastBody.get());
            assertThat(body.path("symbol").asText()).isEqualTo("USD_JPY");
            assertThat(body.path("side").asText()).isEqualTo("SELL");
            assertThat(body.path("size").asText()).isEqualTo("10000");
            assertThat(body.path("executionType").asText()).isEqualTo("MARKET");
            long timestamp = Long.parseLong(lastHeaders.get().get("API-TIMESTAMP"));
            assertThat(lastHeaders.get().get("API-SIGN"))
                .isEqualTo(new HmacSigner(API_SECRET).sign(timestamp, "POST", "/v1/order", lastBody.get()));
        }

        @Test
        @DisplayName("Close order settles the position on the opposite side")
        void closesPosition() throws Exception {
            respond("POST", "/private/v1/closeOrder", "{\"status\":0,\"data\":[{\"orderId\":8888}]}");
            start();
            var position = new Position(123, "USD_JPY", Side.BUY, 150.0, 10_000, null);

            assertThat(client.closePosition(position)).isEqualTo(8888);

            JsonNode body = mapper.readTree(lastBody.get());
            assertThat(body.path("side").asText()).isEqualTo("SELL");
            assertThat(body.path("settlePosition").get(0).path("positionId").asLong()).isEqualTo(123);
            assertThat(body.path("settlePosition").get(0).path("size").asText()).isEqualTo("10000");
        }

        @Test
        @DisplayName("Order response without an order id is malformed")
        void missingOrderId() {
            respond("POST", "/private/v1/order", OK_EMPTY);
            start();

            assertThatThrownBy(() -> client.placeMarketOrder("USD_JPY", Side.BUY, 1))
                .isInstanceOf(ApiException.class)
                .satisfies(e -> assertThat(((ApiException) e).kind()).isEqualTo(ApiException.Kind.MALFORMED));
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class Failures {

        @Test
        @DisplayName("ERR-5003 is retried and feeds the rate gate")
        void throttleRetried() throws Exception {
            respond("GET", "/private/v1/executions", THROTTLED, THROTTLED,
                "{\"status\":0,\"data\":{\"list\":[{\"executionId\":1,\"orderId\":42,\"positionId\":7,"
                    + "\"symbol\":\"USD_JPY\",\"price\":\"150.1\",\"size\":\"10000\",\"fee\":\"0\"}]}}");
            start();

            var executions = client.getExecutions(42);

            assertThat(executions).singleElement().satisfies(e -> assertThat(e.positionId()).isEqualTo(7));
            assertThat(hitsOf("/private/v1/executions")).isEqualTo(3);
            assertThat(lastQuery.get()).isEqualTo("orderId=42");
            var stats = client.stats();
            assertThat(stats.calls()).isEqualTo(3);
            assertThat(stats.errors()).isEqualTo(2);
            // two throttles then one clean call
            assertThat(stats.throttleStreak()).isEqualTo(1);
            assertThat(stats.currentLimit()).isEqualTo(20);
        }

        @Test
        @DisplayName("Persistent throttling gives up as RATE_LIMITED after three attempts")
        void throttleExhausted() {
            respond("GET", "/private/v1/account/assets", THROTTLED);
            start();

            assertThatThrownBy(() -> client.getAssets())
                .isInstanceOf(ApiException.class)
                .satisfies(e -> assertThat(((ApiException) e).kind()).isEqualTo(ApiException.Kind.RATE_LIMITED));
            assertThat(hitsOf("/private/v1/account/assets")).isEqualTo(3);
            assertThat(gate.currentLimit()).isEqualTo(15);
        }

        @Test
        @DisplayName("An outage that outlasts the retries surfaces as a TRANSIENT ApiException")
        void outageExhausted() {
            var count = new AtomicInteger();
            exchange.get("/private/v1/executions", ctx -> {
                count.incrementAndGet();
                ctx.status(503).result("maintenance");
            });
            start();

            assertThatThrownBy(() -> client.getExecutions(99))
                .isExactlyInstanceOf(ApiException.class)
                .hasMessageContaining("HTTP 503")
                .satisfies(e -> assertThat(((ApiException) e).kind()).isEqualTo(ApiException.Kind.TRANSIENT));
            assertThat(count.get()).isEqualTo(3);
            assertThat(client.stats().errors()).isEqualTo(3);
        }

        @Test
        @DisplayName("A new order answered with 5xx is not sent again")
        void orderWithUnknownOutcomeNotResent() {
            var count = new AtomicInteger();
            exchange.post("/private/v1/order", ctx -> {
                count.incrementAndGet();
                ctx.status(502).result("bad gateway");
            });
            start();

            assertThatThrownBy(() -> client.placeMarketOrder("USD_JPY", Side.BUY, 10_000))
                .isInstanceOf(ApiException.class)
                .satisfies(e -> assertThat(((ApiException) e).outcomeUnknown()).isTrue());
            assertThat(count.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("A throttled new order was refused by the exchange and is sent again")
        void throttledOrderResent() throws Exception {
            respond("POST", "/private/v1/order", THROTTLED,
                "{\"status\":0,\"data\":[{\"rootOrderId\":1,\"orderId\":4568}]}");
            start();

            assertThat(client.placeMarketOrder("USD_JPY", Side.SELL, 10_000)).isEqualTo(4568);
            assertThat(hitsOf("/private/v1/order")).isEqualTo(2);
        }

        @Test
        @DisplayName("401 is an AUTH failure and is not retried")
        void authNotRetried() {
            exchange.get("/private/v1/account/assets", ctx -> {
                hits.computeIfAbsent(ctx.path(), p -> new AtomicInteger()).incrementAndGet();
                ctx.status(401).result("{\"status\":1}");
            });
            start();

            assertThatThrownBy(() -> client.getAssets())
                .isInstanceOf(ApiException.class)
                .satisfies(e -> assertThat(((ApiException) e).kind()).isEqualTo(ApiException.Kind.AUTH));
            assertThat(hitsOf("/private/v1/account/assets")).isEqualTo(1);
        }

        @Test
        @DisplayName("Exchange rejection with a code is left to the caller")
        void coded() {
            respond("POST", "/private/v1/order",
                "{\"status\":1,\"messages\":[{\"message_code\":\"ERR-201\",\"message_string\":\"Insufficient funds\"}]}");
            start();

            assertThatThrownBy(() -> client.placeMarketOrder("USD_JPY", Side.BUY, 10_000))
                .isInstanceOf(ApiException.class)
                .hasMessageContaining("ERR-201")
                .satisfies(e -> assertThat(((ApiException) e).messageCode()).contains("ERR-201"));
            assertThat(hitsOf("/private/v1/order")).isEqualTo(1);
        }

        @Test
        @DisplayName("5xx is transient and retried")
        void serverErrorRetried() throws Exception {
            var count = new AtomicInteger();
            exchange.get("/private/v1/account/assets", ctx -> {
                if (count.getAndIncrement() == 0) {
                    ctx.status(503).result("maintenance");
                } else {
                    ctx.result("{\"status\":0,\"data\":{\"availableAmount\":\"1\",\"balance\":\"2\"}}");
                }
            });
            start();

            assertThat(client.getAssets().balance()).isEqualTo(2.0);
            assertThat(count.get()).isEqualTo(2);
        }
    }
}
