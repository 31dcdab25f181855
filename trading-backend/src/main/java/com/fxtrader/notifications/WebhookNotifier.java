package com.fxtrader.notifications;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fxtrader.core.notify.Notifier;
import com.fxtrader.metrics.MetricsService;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Discord-style webhook notifier ({@code {"content": "..."}} payloads).
 *
 * Messages are delivered in order on a background thread through RateLimiter -> Retry ->
 * CircuitBreaker, so a dead or throttled webhook never blocks a trading loop. Messages longer
 * than the webhook's limit are split on line boundaries.
 */
public final class WebhookNotifier implements Notifier {
    private static final Logger logger = LoggerFactory.getLogger(WebhookNotifier.class);

    static final int MAX_MESSAGE_LENGTH = 1900;
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);

    private final URI webhookUri;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Executor delivery;

    private final CircuitBreaker circuitBreaker;
    private final RateLimiter rateLimiter;
    private final Retry retry;

    public WebhookNotifier(String webhookUrl) {
        this(webhookUrl, HttpClient.newBuilder().connectTimeout(REQUEST_TIMEOUT).build(), newDeliveryThread());
    }

    /**
     * @param delivery runs each send; a direct executor makes sends synchronous
     */
    public WebhookNotifier(String webhookUrl, HttpClient httpClient, Executor delivery) {
        this.webhookUri = URI.create(webhookUrl);
        this.httpClient = httpClient;
        this.delivery = delivery;

        // Open after half of the last 10 deliveries failed, probe again after 60s
        var cbConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .slidingWindowSize(10)
            .waitDurationInOpenState(Duration.ofSeconds(60))
            .permittedNumberOfCallsInHalfOpenState(2)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .build();
        this.circuitBreaker = CircuitBreaker.of("webhook", cbConfig);

        // Discord allows roughly 30 messages a minute per webhook
        var rlConfig = RateLimiterConfig.custom()
            .limitForPeriod(30)
            .limitRefreshPeriod(Duration.ofMinutes(1))
            .timeoutDuration(Duration.ofSeconds(10))
            .build();
        this.rateLimiter = RateLimiter.of("webhook", rlConfig);

        var retryConfig = RetryConfig.custom()
            .maxAttempts(3)
            .waitDuration(Duration.ofSeconds(1))
            .retryExceptions(IOException.class, UncheckedIOException.class, WebhookRejectedException.class)
            .build();
        this.retry = Retry.of("webhook", retryConfig);

        circuitBreaker.getEventPublisher()
            .onStateTransition(event -> logger.warn("Webhook circuit breaker: {}", event.getStateTransition()));
    }

    private static ExecutorService newDeliveryThread() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "fx-webhook");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void send(String message) {
        if (message == null || message.isBlank()) {
            return;
        }
        delivery.execute(() -> {
            for (String chunk : chunk(message, MAX_MESSAGE_LENGTH)) {
                deliver(chunk);
            }
        });
    }

    private void deliver(String chunk) {
        Supplier<Integer> decorated = RateLimiter.decorateSupplier(rateLimiter,
            Retry.decorateSupplier(retry,
                CircuitBreaker.decorateSupplier(circuitBreaker, () -> post(chunk))));
        try {
            decorated.get();
            MetricsService.getInstance().recordNotification("sent");
            logger.debug("Webhook notification sent: {}", abbreviate(chunk));
        } catch (RuntimeException e) {
            MetricsService.getInstance().recordNotification("failed");
            logger.error("❌ Webhook notification dropped ({}): {}", e.getClass().getSimpleName(), abbreviate(chunk), e);
        }
    }

    private int post(String content) {
        String body;
        try {
            body = objectMapper.writeValueAsString(Map.of("content", content));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode notification", e);
        }
        var request = HttpRequest.newBuilder()
            .uri(webhookUri)
            .timeout(REQUEST_TIMEOUT)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new WebhookRejectedException(response.statusCode(), response.body());
            }
            return response.statusCode();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while sending notification", e);
        }
    }

    /**
     * GET on the webhook URL; true on a 2xx answer.
     */
    @Override
    public boolean ping() {
        var request = HttpRequest.newBuilder()
            .uri(webhookUri)
            .timeout(REQUEST_TIMEOUT)
            .GET()
            .build();
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.discarding()).statusCode() / 100 == 2;
        } catch (IOException e) {
            logger.warn("⚠️ Webhook ping failed: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public String getCircuitBreakerState() {
        return circuitBreaker.getState().name();
    }

    /**
     * Split into pieces of at most {@code limit} characters, preferring line breaks.
     */
    static List<String> chunk(String message, int limit) {
        var chunks = new ArrayList<String>();
        String rest = message;
        while (rest.length() > limit) {
            int cut = rest.lastIndexOf('\n', limit);
            if (cut <= 0) {
                cut = limit;
            }
            chunks.add(rest.substring(0, cut));
            rest = rest.substring(cut).stripLeading();
        }
        if (!rest.isEmpty()) {
            chunks.add(rest);
        }
        return chunks;
    }

    private static String abbreviate(String text) {
        return text.length() <= 100 ? text : text.substring(0, 100) + "...";
    }

    /**
     * Non-2xx answer from the webhook.
     */
    static final class WebhookRejectedException extends RuntimeException {
        WebhookRejectedException(int status, String body) {
            super("Webhook returned HTTP " + status + ": " + abbreviate(body == null ? "" : body));
        }
    }
}
