package com.fxtrader.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fxtrader.core.config.Config;
import com.fxtrader.core.model.AccountAssets;
import com.fxtrader.core.model.Execution;
import com.fxtrader.core.model.Position;
import com.fxtrader.core.model.Quote;
import com.fxtrader.core.model.Side;
import com.fxtrader.core.retry.RetryExhaustedException;
import com.fxtrader.core.retry.RetryPolicy;
import com.fxtrader.core.time.Sleeper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Signed, paced and retrying client for the forex exchange REST API.
 *
 * Every request goes through the shared {@link RateLimitGate}; private endpoints carry
 * {@code API-KEY}, {@code API-TIMESTAMP} and {@code API-SIGN} headers. Throttling and
 * transport failures are retried with exponential backoff; exchange rejections and
 * auth failures are not. New orders are only retried when the exchange cannot have seen them.
 * Every failure reaches the caller as an {@link ApiException}.
 */
public final class ForexApiClient implements ExchangeGateway {
    private static final Logger logger = LoggerFactory.getLogger(ForexApiClient.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);
    private static final int MAX_ATTEMPTS = 3;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final HmacSigner signer;
    private final String privateBaseUrl;
    private final String publicBaseUrl;
    private final RateLimitGate rateGate;
    private final QuoteCache quoteCache;
    private final RetryPolicy retryPolicy;
    private final RetryPolicy orderPolicy;
    private final Clock clock;

    private final AtomicLong calls = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final Counter callCounter;
    private final Counter errorCounter;
    private final Timer latency;

    public ForexApiClient(Config config, MeterRegistry registry, Clock clock, Sleeper sleeper) {
        this(config.apiKey(), config.apiSecret(), config.privateApiUrl(), config.publicApiUrl(),
            new RateLimitGate(clock, sleeper), new QuoteCache(clock), registry, clock, sleeper);
    }

    public ForexApiClient(String apiKey, String apiSecret, String privateBaseUrl, String publicBaseUrl,
                          RateLimitGate rateGate, QuoteCache quoteCache, MeterRegistry registry,
                          Clock clock, Sleeper sleeper) {
        this.apiKey = apiKey;
        this.signer = new HmacSigner(apiSecret);
        this.privateBaseUrl = stripTrailingSlash(privateBaseUrl);
        this.publicBaseUrl = stripTrailingSlash(publicBaseUrl);
        this.rateGate = rateGate;
        this.quoteCache = quoteCache;
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(REQUEST_TIMEOUT)
                .build();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule());
        this.retryPolicy = RetryPolicy.exponential("exchange request", MAX_ATTEMPTS, sleeper)
                .retryOn(ForexApiClient::retryableAtTransport);
        this.orderPolicy = RetryPolicy.exponential("new order", MAX_ATTEMPTS, sleeper)
                .retryOn(ForexApiClient::retryableUnsent);
        this.callCounter = Counter.builder("fx.api.calls").description("Exchange API requests").register(registry);
        this.errorCounter = Counter.builder("fx.api.errors").description("Failed exchange API requests").register(registry);
        this.latency = Timer.builder("fx.api.latency").description("Exchange API round trip").register(registry);

        logger.info("ForexApiClient initialized for {} (rate ceiling {}/s)", this.privateBaseUrl, rateGate.ceiling());
    }

    @Override
    public AccountAssets getAssets() throws InterruptedException {
        var envelope = privateCall("GET", "/v1/account/assets", Map.of(), null);
        return convert(envelope.first("assets"), AccountAssets.class);
    }

    @Override
    public Map<String, Quote> getQuotes(Collection<String> symbols) throws InterruptedException {
        var wanted = new LinkedHashSet<>(symbols);
        if (wanted.isEmpty()) {
            return Map.of();
        }
        var envelope = publicCall("/v1/ticker", Map.of("symbol", String.join(",", wanted)));
        var now = clock.instant();
        var result = new HashMap<String, Quote>();
        for (JsonNode node : envelope.data()) {
            String symbol = node.path("symbol").asText("");
            if (!wanted.contains(symbol)) {
                continue;
            }
            double bid = node.path("bid").asDouble(Double.NaN);
            double ask = node.path("ask").asDouble(Double.NaN);
            if (Double.isNaN(bid) || Double.isNaN(ask) || bid <= 0 || ask <= 0) {
                logger.warn("⚠️ Ticker for {} has no usable bid/ask: {}", symbol, node);
                continue;
            }
            result.put(symbol, new Quote(symbol, bid, ask, now.plus(QuoteCache.DEFAULT_TTL)));
        }
        return result;
    }

    @Override
    public Map<String, Quote> getCachedQuotes(Collection<String> symbols) throws InterruptedException {
        var result = new HashMap<>(quoteCache.getFresh(symbols));
        var missing = symbols.stream().filter(s -> !result.containsKey(s)).distinct().toList();
        if (!missing.isEmpty()) {
            var fetched = getQuotes(missing);
            quoteCache.putAll(new ArrayList<>(fetched.values()));
            result.putAll(quoteCache.getFresh(missing));
        }
        return result;
    }

    @Override
    public long placeMarketOrder(String symbol, Side side, long size) throws InterruptedException {
        ObjectNode body = objectMapper.createObjectNode()
            .put("symbol", symbol)
            .put("side", side.name())
            .put("size", String.valueOf(size))
            .put("executionType", "MARKET");
        var envelope = privateCall(orderPolicy, "POST", "/v1/order", Map.of(), body);
        long orderId = orderId(envelope, "order");
        logger.info("📤 Market order {} {} {} placed: orderId={}", side, size, symbol, orderId);
        return orderId;
    }

    @Override
    public long closePosition(Position position) throws InterruptedException {
        ObjectNode body = objectMapper.createObjectNode()
            .put("symbol", position.symbol())
            .put("side", position.side().opposite().name())
            .put("executionType", "MARKET");
        body.putArray("settlePosition").addObject()
            .put("positionId", position.positionId())
            .put("size", String.valueOf(position.size()));
        var envelope = privateCall("POST", "/v1/closeOrder", Map.of(), body);
        long orderId = orderId(envelope, "closeOrder");
        logger.info("📥 Close order for position {} placed: orderId={}", position.positionId(), orderId);
        return orderId;
    }

    @Override
    public List<Execution> getExecutions(long orderId) throws InterruptedException {
        var envelope = privateCall("GET", "/v1/executions", Map.of("orderId", String.valueOf(orderId)), null);
        var executions = new ArrayList<Execution>();
        for (JsonNode node : envelope.data()) {
            executions.add(convert(node, Execution.class));
        }
        return executions;
    }

    @Override
    public List<Position> getOpenPositions(String symbol) throws InterruptedException {
        Map<String, String> query = symbol == null ? Map.of() : Map.of("symbol", symbol);
        var envelope = privateCall("GET", "/v1/openPositions", query, null);
        var positions = new ArrayList<Position>();
        for (JsonNode node : envelope.data()) {
            positions.add(convert(node, Position.class));
        }
        return positions;
    }

    @Override
    public ApiStats stats() {
        return new ApiStats(calls.get(), errors.get(), rateGate.currentLimit(), rateGate.consecutiveThrottles());
    }

    public RateLimitGate rateGate() {
        return rateGate;
    }

    // ==================== Transport ====================

    private ApiEnvelope privateCall(String method, String path, Map<String, String> query, JsonNode body)
            throws InterruptedException {
        return privateCall(retryPolicy, method, path, query, body);
    }

    private ApiEnvelope privateCall(RetryPolicy policy, String method, String path, Map<String, String> query,
                                    JsonNode body) throws InterruptedException {
        String json = body == null ? "" : body.toString();
        return withRetries(policy, method, path, () -> {
            long timestamp = clock.millis();
            var builder = HttpRequest.newBuilder()
                    .uri(URI.create(privateBaseUrl + path + queryString(query)))
                    .header("API-KEY", apiKey)
                    .header("API-TIMESTAMP", String.valueOf(timestamp))
                    .header("API-SIGN", signer.sign(timestamp, method, path, json))
                    .timeout(REQUEST_TIMEOUT);
            var request = switch (method) {
                case "GET" -> builder.GET().build();
                case "POST" -> builder.header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(json)).build();
                default -> throw new IllegalArgumentException(String.format("Unsupported HTTP method: %s", method));
            };
            return send(method, path, request);
        });
    }

    private ApiEnvelope publicCall(String path, Map<String, String> query) throws InterruptedException {
        return withRetries(retryPolicy, "GET", path, () -> {
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(publicBaseUrl + path + queryString(query)))
                    .timeout(REQUEST_TIMEOUT)
                    .GET()
                    .build();
            return send("GET", path, request);
        });
    }

    /**
     * Run {@code attempt} under {@code policy}. Once attempts run out the last failure is
     * rethrown as is, so callers only ever see {@link ApiException}.
     */
    private ApiEnvelope withRetries(RetryPolicy policy, String method, String path,
                                    Callable<ApiEnvelope> attempt) throws InterruptedException {
        try {
            return policy.execute(attempt);
        } catch (RetryExhaustedException e) {
            if (e.getCause() instanceof ApiException last) {
                throw last;
            }
            throw new ApiException(ApiException.Kind.TRANSIENT,
                String.format("%s %s failed after %d attempts", method, path, e.attempts()), e);
        }
    }

    /**
     * One attempt: pace, send, classify. Counts one call and, on failure, one error.
     */
    private ApiEnvelope send(String method, String path, HttpRequest request) throws InterruptedException {
        rateGate.acquire(method);
        calls.incrementAndGet();
        callCounter.increment();
        Instant started = clock.instant();
        try {
            var envelope = classify(method, path, httpClient.send(request, HttpResponse.BodyHandlers.ofString()));
            rateGate.recordSuccess();
            return envelope;
        } catch (HttpTimeoutException e) {
            recordError();
            throw new ApiException(ApiException.Kind.TRANSIENT, method + " " + path + " timed out", e);
        } catch (IOException e) {
            recordError();
            throw new ApiException(ApiException.Kind.TRANSIENT, method + " " + path + " failed: " + e.getMessage(), e);
        } catch (ApiException e) {
            recordError();
            throw e;
        } finally {
            latency.record(Duration.between(started, clock.instant()));
        }
    }

    private ApiEnvelope classify(String method, String path, HttpResponse<String> response) {
        int code = response.statusCode();
        if (code == 401 || code == 403) {
            logger.error("🔒 {} {} rejected credentials: HTTP {}", method, path, code);
            throw new ApiException(ApiException.Kind.AUTH, String.format("%s %s: HTTP %d", method, path, code));
        }
        if (code < 200 || code >= 300) {
            throw new ApiException(ApiException.Kind.TRANSIENT,
                String.format("%s %s: HTTP %d - %s", method, path, code, response.body()));
        }
        var envelope = ApiEnvelope.parse(objectMapper, response.body());
        if (envelope.isThrottled()) {
            rateGate.recordThrottle();
            logger.warn("🐢 {} {} throttled by exchange ({})", method, path, envelope.errorSummary());
            throw new ApiException(ApiException.Kind.RATE_LIMITED,
                method + " " + path + " throttled", ApiEnvelope.THROTTLE_CODE, null);
        }
        if (!envelope.isOk()) {
            logger.warn("⚠️ {} {} returned error: {}", method, path, envelope.errorSummary());
            throw new ApiException(ApiException.Kind.TRANSIENT,
                method + " " + path + " rejected: " + envelope.errorSummary(), envelope.firstCode(), null);
        }
        return envelope;
    }

    private void recordError() {
        errors.incrementAndGet();
        errorCounter.increment();
    }

    /**
     * Throttling and transport failures are retried here; exchange rejections carry a message
     * code and are left to the caller's own retry loop.
     */
    private static boolean retryableAtTransport(Throwable t) {
        if (!(t instanceof ApiException api)) {
            return false;
        }
        return api.kind() == ApiException.Kind.RATE_LIMITED
            || (api.kind() == ApiException.Kind.TRANSIENT && api.messageCode().isEmpty());
    }

    /**
     * A new order may only be sent again when the exchange refused it (throttle) or the
     * connection never opened. A timeout or 5xx after sending leaves the outcome unknown.
     */
    private static boolean retryableUnsent(Throwable t) {
        if (!(t instanceof ApiException api)) {
            return false;
        }
        if (api.kind() == ApiException.Kind.RATE_LIMITED) {
            return true;
        }
        return api.kind() == ApiException.Kind.TRANSIENT
            && (api.getCause() instanceof ConnectException || api.getCause() instanceof HttpConnectTimeoutException);
    }

    private long orderId(ApiEnvelope envelope, String what) {
        JsonNode id = envelope.first(what).path("orderId");
        if (id.isMissingNode() || id.isNull()) {
            throw new ApiException(ApiException.Kind.MALFORMED, what + " response has no orderId");
        }
        return id.asLong();
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new ApiException(ApiException.Kind.MALFORMED,
                "Cannot read " + type.getSimpleName() + " from " + node, e);
        }
    }

    private static String queryString(Map<String, String> query) {
        if (query.isEmpty()) {
            return "";
        }
        var parts = new ArrayList<String>();
        query.forEach((k, v) -> parts.add(k + "=" + URLEncoder.encode(v, StandardCharsets.UTF_8)));
        return "?" + String.join("&", parts);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
