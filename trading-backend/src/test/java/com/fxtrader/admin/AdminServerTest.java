package com.fxtrader.admin;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fxtrader.backup.BackupService;
import com.fxtrader.core.api.ApiException;
import com.fxtrader.core.api.ExchangeGateway;
import com.fxtrader.core.api.ExchangeGateway.ApiStats;
import com.fxtrader.core.execution.OrderExecutor;
import com.fxtrader.core.health.HealthMonitor;
import com.fxtrader.core.ledger.TradeLedger;
import com.fxtrader.core.model.Position;
import com.fxtrader.core.model.Side;
import com.fxtrader.core.monitor.PositionRegistry;
import com.fxtrader.core.notify.Notifier;
import com.fxtrader.core.protection.EmergencyProtocol;
import com.fxtrader.core.supervisor.Supervisor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AdminServer Tests")
class AdminServerTest {

    private static final String TOKEN = "s3cret";

    @Mock
    private ExchangeGateway gateway;
    @Mock
    private OrderExecutor executor;
    @Mock
    private HealthMonitor healthMonitor;
    @Mock
    private EmergencyProtocol emergency;
    @Mock
    private Supervisor supervisor;
    @Mock
    private BackupService backupService;
    @Mock
    private Notifier notifier;

    private final HttpClient http = HttpClient.newHttpClient();
    private final ObjectMapper mapper = new ObjectMapper();
    private final PositionRegistry registry = new PositionRegistry();
    private final TradeLedger ledger = new TradeLedger();
    private AdminServer server;
    private int port;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private void startWith(Optional<String> token) {
        server = new AdminServer(token, gateway, executor, registry, ledger, healthMonitor, emergency,
            supervisor, backupService, notifier, Runnable::run);
        port = server.start(0);
    }

    private HttpResponse<String> call(String method, String path, String bearer) throws Exception {
        var builder = HttpRequest.newBuilder(URI.create("http://localhost:" + port + path));
        if (bearer != null) {
            builder.header("Authorization", "Bearer " + bearer);
        }
        builder.method(method, HttpRequest.BodyPublishers.noBody());
        return http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode json(HttpResponse<String> response) throws Exception {
        return mapper.readTree(response.body());
    }

    @Nested
    @DisplayName("Without an admin token")
    class NoToken {

        @Test
        @DisplayName("Command routes do not exist")
        void commandsAbsent() throws Exception {
            startWith(Optional.of("  "));

            assertEquals(404, call("GET", "/api/commands", TOKEN).statusCode());
            assertEquals(404, call("POST", "/api/kill", null).statusCode());
            verifyNoInteractions(emergency);
        }

        @Test
        @DisplayName("Liveness and metrics stay open")
        void openRoutes() throws Exception {
            startWith(Optional.empty());

            var health = call("GET", "/healthz", null);
            assertEquals(200, health.statusCode());
            assertEquals("ok", health.body());
            assertEquals(200, call("GET", "/metrics", null).statusCode());
        }
    }

    @Nested
    @DisplayName("Authorization")
    class Authorization {

        @Test
        @DisplayName("Missing or wrong bearer token is rejected")
        void rejects() throws Exception {
            startWith(Optional.of(TOKEN));

            assertEquals(401, call("GET", "/api/commands", null).statusCode());
            assertEquals(401, call("GET", "/api/commands", "wrong").statusCode());
            assertEquals(401, call("POST", "/api/kill", TOKEN + "x").statusCode());
            verifyNoInteractions(emergency);
        }

        @Test
        @DisplayName("Correct token lists the commands")
        void accepts() throws Exception {
            startWith(Optional.of(TOKEN));

            var response = call("GET", "/api/commands", TOKEN);

            assertEquals(200, response.statusCode());
            assertThat(json(response).has("POST /api/kill")).isTrue();
            assertThat(json(response).size()).isEqualTo(AdminServer.COMMANDS.size());
        }
    }

    @Nested
    @DisplayName("Commands")
    class Commands {

        @Test
        @DisplayName("kill flattens everything and reports the outcome")
        void kill() throws Exception {
            startWith(Optional.of(TOKEN));
            when(emergency.flattenAll("operator kill")).thenReturn(Map.of("success", true, "closed", 2));

            var response = call("POST", "/api/kill", TOKEN);

            assertEquals(200, response.statusCode());
            assertThat(json(response).path("closed").asInt()).isEqualTo(2);
            verify(notifier).send("🧯 Kill command received: closing all positions");
        }

        @Test
        @DisplayName("stop and restart hand off to the supervisor")
        void lifecycle() throws Exception {
            startWith(Optional.of(TOKEN));

            assertEquals(202, call("POST", "/api/stop", TOKEN).statusCode());
            assertEquals(202, call("POST", "/api/restart", TOKEN).statusCode());

            verify(supervisor).stop("operator command");
            verify(supervisor).autoRestart("operator command");
        }

        @Test
        @DisplayName("positions lists exchange positions with tracking flags")
        void positions() throws Exception {
            startWith(Optional.of(TOKEN));
            when(gateway.getOpenPositions(null)).thenReturn(List.of(
                new Position(55, "USD_JPY", Side.BUY, 150.0, 10_000, Instant.parse("2024-03-01T00:00:00Z"))));

            var rows = json(call("GET", "/api/positions", TOKEN));

            assertThat(rows.size()).isEqualTo(1);
            assertThat(rows.get(0).path("positionId").asLong()).isEqualTo(55);
            assertThat(rows.get(0).path("tracked").asBoolean()).isFalse();
            assertThat(rows.get(0).path("closing").isNull()).isTrue();
        }

        @Test
        @DisplayName("status reports rate limiter and ledger state")
        void status() throws Exception {
            startWith(Optional.of(TOKEN));
            when(gateway.stats()).thenReturn(new ApiStats(40, 2, 15, 1));
            when(gateway.getOpenPositions(null)).thenReturn(List.of());
            when(healthMonitor.uptime()).thenReturn(Duration.ofMinutes(3));
            ledger.addFee(120);

            var status = json(call("GET", "/api/status", TOKEN));

            assertThat(status.path("rateLimit").asInt()).isEqualTo(15);
            assertThat(status.path("apiCalls").asLong()).isEqualTo(40);
            assertThat(status.path("feeTotal").asDouble()).isEqualTo(120.0);
            assertThat(status.path("uptimeSeconds").asLong()).isEqualTo(180);
        }

        @Test
        @DisplayName("testlot previews sizing without trading")
        void testLot() throws Exception {
            startWith(Optional.of(TOKEN));
            when(executor.previewSize("USD_JPY", Side.SELL)).thenReturn(6333L);

            var body = json(call("GET", "/api/testlot/USD_JPY/short", TOKEN));

            assertThat(body.path("side").asText()).isEqualTo("SELL");
            assertThat(body.path("size").asLong()).isEqualTo(6333);
        }

        @Test
        @DisplayName("testlot with an unknown side is a bad request")
        void testLotBadSide() throws Exception {
            startWith(Optional.of(TOKEN));

            assertEquals(400, call("GET", "/api/testlot/USD_JPY/hold", TOKEN).statusCode());
            verifyNoInteractions(executor);
        }

        @Test
        @DisplayName("Exchange failures surface as 502")
        void exchangeFailure() throws Exception {
            startWith(Optional.of(TOKEN));
            when(gateway.getOpenPositions(null)).thenThrow(new ApiException(ApiException.Kind.TRANSIENT, "maintenance"));

            var response = call("GET", "/api/positions", TOKEN);

            assertEquals(502, response.statusCode());
            assertThat(json(response).path("error").asText()).isEqualTo("maintenance");
        }
    }
}
