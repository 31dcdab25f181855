package com.fxtrader.core.config;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Properties;
import java.util.function.Function;

/**
 * Bot configuration loaded from environment variables or config.properties.
 * Environment variables win over the file. Every value is range-checked with Bean Validation
 * at construction; an invalid config never leaves this class.
 */
public final class Config {
    private static final Logger logger = LoggerFactory.getLogger(Config.class);

    public static final String CONFIG_PATH_PROPERTY = "fx.config";
    private static final String CONFIG_FILE = "config.properties";
    private static final String DEFAULT_PRIVATE_URL = "https://forex-api.coin.z.com/private";
    private static final String DEFAULT_PUBLIC_URL = "https://forex-api.coin.z.com/public";

    @NotBlank(message = "API_KEY is required")
    private final String apiKey;

    @NotBlank(message = "API_SECRET is required")
    private final String apiSecret;

    @NotBlank(message = "WEBHOOK_URL is required")
    private final String webhookUrl;

    @DecimalMin(value = "0.001", message = "SPREAD_THRESHOLD must be between 0.001 and 1.0")
    @DecimalMax(value = "1.0", message = "SPREAD_THRESHOLD must be between 0.001 and 1.0")
    private final double spreadThreshold;

    @Min(value = 0, message = "JITTER_SECONDS must be between 0 and 60")
    @Max(value = 60, message = "JITTER_SECONDS must be between 0 and 60")
    private final int jitterSeconds;

    @Min(value = 1, message = "ENTRY_ORDER_RETRY_INTERVAL must be between 1 and 60")
    @Max(value = 60, message = "ENTRY_ORDER_RETRY_INTERVAL must be between 1 and 60")
    private final int entryOrderRetryInterval;

    @Min(value = 1, message = "MAX_ENTRY_ORDER_ATTEMPTS must be between 1 and 10")
    @Max(value = 10, message = "MAX_ENTRY_ORDER_ATTEMPTS must be between 1 and 10")
    private final int maxEntryOrderAttempts;

    @Min(value = 1, message = "EXIT_ORDER_RETRY_INTERVAL must be between 1 and 60")
    @Max(value = 60, message = "EXIT_ORDER_RETRY_INTERVAL must be between 1 and 60")
    private final int exitOrderRetryInterval;

    @Min(value = 1, message = "MAX_EXIT_ORDER_ATTEMPTS must be between 1 and 10")
    @Max(value = 10, message = "MAX_EXIT_ORDER_ATTEMPTS must be between 1 and 10")
    private final int maxExitOrderAttempts;

    @DecimalMin(value = "0", message = "STOP_LOSS_PIPS must be between 0 and 1000")
    @DecimalMax(value = "1000", message = "STOP_LOSS_PIPS must be between 0 and 1000")
    private final double stopLossPips;

    @DecimalMin(value = "0", message = "TAKE_PROFIT_PIPS must be between 0 and 1000")
    @DecimalMax(value = "1000", message = "TAKE_PROFIT_PIPS must be between 0 and 1000")
    private final double takeProfitPips;

    @Min(value = 1, message = "POSITION_CHECK_INTERVAL must be between 1 and 60")
    @Max(value = 60, message = "POSITION_CHECK_INTERVAL must be between 1 and 60")
    private final int positionCheckInterval;

    @Min(value = 1, message = "POSITION_CHECK_INTERVAL_MINUTES must be between 1 and 99")
    @Max(value = 99, message = "POSITION_CHECK_INTERVAL_MINUTES must be between 1 and 99")
    private final int positionCheckIntervalMinutes;

    @Min(value = 1, message = "LEVERAGE must be between 1 and 100")
    @Max(value = 100, message = "LEVERAGE must be between 1 and 100")
    private final int leverage;

    @DecimalMin(value = "0.1", message = "RISK_RATIO must be between 0.1 and 1.0")
    @DecimalMax(value = "1.0", message = "RISK_RATIO must be between 0.1 and 1.0")
    private final double riskRatio;

    private final boolean autoLot;

    @Min(value = 0, message = "AUTO_RESTART_HOUR must be between 0 and 24")
    @Max(value = 24, message = "AUTO_RESTART_HOUR must be between 0 and 24")
    private final Integer autoRestartHour;

    @Min(value = 1, message = "SYMBOL_DAILY_VOLUME_LIMIT must be at least 1")
    private final long symbolDailyVolumeLimit;

    @Pattern(regexp = "^https://.*", message = "PRIVATE_API_URL must use HTTPS")
    private final String privateApiUrl;

    @Pattern(regexp = "^https://.*", message = "PUBLIC_API_URL must use HTTPS")
    private final String publicApiUrl;

    @Min(value = 1, message = "ADMIN_PORT must be between 1 and 65535")
    @Max(value = 65535, message = "ADMIN_PORT must be between 1 and 65535")
    private final int adminPort;

    private final String adminToken;

    @NotBlank(message = "TRADES_FILE must not be blank")
    private final String tradesFile;

    @NotBlank(message = "RESULTS_DIR must not be blank")
    private final String resultsDir;

    @NotBlank(message = "BACKUP_DIR must not be blank")
    private final String backupDir;

    @Min(value = 0, message = "DAILY_CUTOFF_HOUR must be between 0 and 23")
    @Max(value = 23, message = "DAILY_CUTOFF_HOUR must be between 0 and 23")
    private final int dailyCutoffHour;

    private final Path configFile;

    private final List<String> parseErrors = new ArrayList<>();
    private final Properties properties;
    private final Function<String, String> environment;

    private Config(Properties properties, Function<String, String> environment, Path configFile) {
        this.properties = properties;
        this.environment = environment;
        this.configFile = configFile;

        this.apiKey = getString("API_KEY", null);
        this.apiSecret = getString("API_SECRET", null);
        this.webhookUrl = getString("WEBHOOK_URL", null);
        this.spreadThreshold = getDouble("SPREAD_THRESHOLD", 0.01);
        this.jitterSeconds = getInt("JITTER_SECONDS", 3);
        this.entryOrderRetryInterval = getInt("ENTRY_ORDER_RETRY_INTERVAL", 5);
        this.maxEntryOrderAttempts = getInt("MAX_ENTRY_ORDER_ATTEMPTS", 3);
        this.exitOrderRetryInterval = getInt("EXIT_ORDER_RETRY_INTERVAL", 10);
        this.maxExitOrderAttempts = getInt("MAX_EXIT_ORDER_ATTEMPTS", 3);
        this.stopLossPips = getDouble("STOP_LOSS_PIPS", 0);
        this.takeProfitPips = getDouble("TAKE_PROFIT_PIPS", 0);
        this.positionCheckInterval = getInt("POSITION_CHECK_INTERVAL", 5);
        this.positionCheckIntervalMinutes = getInt("POSITION_CHECK_INTERVAL_MINUTES", 10);
        this.leverage = getInt("LEVERAGE", 10);
        this.riskRatio = getDouble("RISK_RATIO", 1.0);
        this.autoLot = getSwitch("AUTOLOT", true);
        this.autoRestartHour = getOptionalInt("AUTO_RESTART_HOUR");
        this.symbolDailyVolumeLimit = getLong("SYMBOL_DAILY_VOLUME_LIMIT", 15_000_000L);
        this.privateApiUrl = getString("PRIVATE_API_URL", DEFAULT_PRIVATE_URL);
        this.publicApiUrl = getString("PUBLIC_API_URL", DEFAULT_PUBLIC_URL);
        this.adminPort = getInt("ADMIN_PORT", 8080);
        this.adminToken = getString("ADMIN_TOKEN", null);
        this.tradesFile = getString("TRADES_FILE", "trades.csv");
        this.resultsDir = getString("RESULTS_DIR", "daily_results");
        this.backupDir = getString("BACKUP_DIR", "backups");
        this.dailyCutoffHour = getInt("DAILY_CUTOFF_HOUR", 19);

        validate();
        logger.info("📋 Configuration loaded: leverage={}, riskRatio={}, autoLot={}, SL={} pips, TP={} pips",
            leverage, riskRatio, autoLot, stopLossPips, takeProfitPips);
    }

    /**
     * Load from the file named by {@code -Dfx.config} (default {@code config.properties}),
     * with environment variables taking precedence.
     */
    public static Config load() {
        Path path = Path.of(System.getProperty(CONFIG_PATH_PROPERTY, CONFIG_FILE));
        return new Config(readProperties(path), System::getenv, path);
    }

    /**
     * Build from explicit properties only; the environment is ignored.
     */
    public static Config forTest(Properties testProps) {
        return new Config(testProps, key -> null, Path.of(CONFIG_FILE));
    }

    private static Properties readProperties(Path path) {
        var props = new Properties();
        if (Files.exists(path)) {
            try (InputStream is = Files.newInputStream(path)) {
                props.load(is);
                logger.info("📋 Loaded config from: {}", path.toAbsolutePath());
            } catch (IOException e) {
                logger.warn("⚠️ Could not read {}: {}", path, e.getMessage());
            }
        } else {
            logger.warn("⚠️ No {} found, relying on environment variables", path);
        }
        return props;
    }

    /**
     * Validate configuration using Bean Validation.
     * Unparseable values are reported together with range violations.
     */
    private void validate() {
        Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
        var errorMessages = new ArrayList<>(parseErrors);
        validator.validate(this).stream()
            .map(v -> v.getPropertyPath() + ": " + v.getMessage())
            .sorted()
            .forEach(errorMessages::add);

        if (!errorMessages.isEmpty()) {
            throw new IllegalStateException(
                "Configuration validation failed: " + String.join(", ", errorMessages));
        }
    }

    private Optional<String> lookup(String key) {
        return Optional.ofNullable(environment.apply(key))
            .or(() -> Optional.ofNullable(properties.getProperty(key)))
            .map(String::trim)
            .filter(v -> !v.isEmpty());
    }

    private String getString(String key, String defaultValue) {
        return lookup(key).orElse(defaultValue);
    }

    private int getInt(String key, int defaultValue) {
        return (int) getLong(key, defaultValue);
    }

    private long getLong(String key, long defaultValue) {
        var value = lookup(key);
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.get());
        } catch (NumberFormatException e) {
            parseErrors.add(key + ": '" + value.get() + "' is not a whole number");
            return defaultValue;
        }
    }

    private double getDouble(String key, double defaultValue) {
        var value = lookup(key);
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.get());
        } catch (NumberFormatException e) {
            parseErrors.add(key + ": '" + value.get() + "' is not a number");
            return defaultValue;
        }
    }

    private Integer getOptionalInt(String key) {
        var value = lookup(key);
        if (value.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(value.get());
        } catch (NumberFormatException e) {
            parseErrors.add(key + ": '" + value.get() + "' is not a whole number");
            return null;
        }
    }

    private boolean getSwitch(String key, boolean defaultValue) {
        var value = lookup(key);
        if (value.isEmpty()) {
            return defaultValue;
        }
        return switch (value.get().toUpperCase(Locale.ROOT)) {
            case "TRUE" -> true;
            case "FALSE" -> false;
            default -> {
                parseErrors.add(key + ": must be TRUE or FALSE, got '" + value.get() + "'");
                yield defaultValue;
            }
        };
    }

    // ========== Getters ==========

    public String apiKey() { return apiKey; }
    public String apiSecret() { return apiSecret; }
    public String webhookUrl() { return webhookUrl; }
    public double spreadThreshold() { return spreadThreshold; }
    public int jitterSeconds() { return jitterSeconds; }
    public int maxEntryOrderAttempts() { return maxEntryOrderAttempts; }
    public int maxExitOrderAttempts() { return maxExitOrderAttempts; }
    public double stopLossPips() { return stopLossPips; }
    public double takeProfitPips() { return takeProfitPips; }
    public int leverage() { return leverage; }
    public double riskRatio() { return riskRatio; }
    public boolean autoLot() { return autoLot; }
    public long symbolDailyVolumeLimit() { return symbolDailyVolumeLimit; }
    public String privateApiUrl() { return privateApiUrl; }
    public String publicApiUrl() { return publicApiUrl; }
    public int adminPort() { return adminPort; }
    public int dailyCutoffHour() { return dailyCutoffHour; }
    public int positionCheckIntervalMinutes() { return positionCheckIntervalMinutes; }

    public Duration entryOrderRetryInterval() {
        return Duration.ofSeconds(entryOrderRetryInterval);
    }

    public Duration exitOrderRetryInterval() {
        return Duration.ofSeconds(exitOrderRetryInterval);
    }

    /** Interval of the SL/TP poll loop. */
    public Duration positionCheckInterval() {
        return Duration.ofSeconds(positionCheckInterval);
    }

    /** Interval of the unscheduled-position sweep. */
    public Duration sweepInterval() {
        return Duration.ofMinutes(positionCheckIntervalMinutes);
    }

    /** Restart hour, 24 meaning midnight. Empty when daily restart is off. */
    public OptionalInt autoRestartHour() {
        return autoRestartHour == null ? OptionalInt.empty() : OptionalInt.of(autoRestartHour);
    }

    public Optional<String> adminToken() {
        return Optional.ofNullable(adminToken);
    }

    public Path configFile() { return configFile; }
    public Path tradesFile() { return Path.of(tradesFile); }
    public Path resultsDir() { return Path.of(resultsDir); }
    public Path backupDir() { return Path.of(backupDir); }

    /**
     * One-line summary for startup notifications, without secrets.
     */
    public String summary() {
        return String.format(
            "Leverage=%d, RiskRatio=%.2f, AutoLot=%s, Spread<=%.3f, Jitter=%ds, SL=%.1f pips, TP=%.1f pips, Sweep=%dmin, Restart=%s",
            leverage, riskRatio, autoLot ? "ON" : "OFF", spreadThreshold, jitterSeconds,
            stopLossPips, takeProfitPips, positionCheckIntervalMinutes,
            autoRestartHour == null ? "off" : autoRestartHour + ":00");
    }
}
