package io.leasekeep.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.leasekeep.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public record LeaseSettings(
        int autoSaveIntervalSeconds,
        int writeCooldownSeconds,
        int forceLoadMaxSteps,
        int forceLoadStepSeconds,
        int deadLockAssumedAfterSeconds,
        int issueCountForCriticalState,
        int issueWindowSeconds,
        int criticalStateWindowSeconds,
        int retryMaxAttempts,
        long retryBaseBackoffMs,
        long retryMaxBackoffMs,
        long tickMillis,
        long payloadMaxBytes
) {
    public static final int DEFAULT_AUTO_SAVE_INTERVAL_SECONDS = 30;
    public static final int DEFAULT_WRITE_COOLDOWN_SECONDS = 7;
    public static final int DEFAULT_FORCE_LOAD_MAX_STEPS = 8;
    public static final int DEFAULT_FORCE_LOAD_STEP_SECONDS = 15;
    public static final int DEFAULT_DEAD_LOCK_ASSUMED_AFTER_SECONDS = 30 * 60;
    public static final int DEFAULT_ISSUE_COUNT_FOR_CRITICAL_STATE = 5;
    public static final int DEFAULT_ISSUE_WINDOW_SECONDS = 60;
    public static final int DEFAULT_CRITICAL_STATE_WINDOW_SECONDS = 120;
    public static final int DEFAULT_RETRY_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_RETRY_BASE_BACKOFF_MS = 1_000L;
    public static final long DEFAULT_RETRY_MAX_BACKOFF_MS = 10_000L;
    public static final long DEFAULT_TICK_MILLIS = 1_000L;
    public static final long DEFAULT_PAYLOAD_MAX_BYTES = 4_000_000L;

    public LeaseSettings {
        List<String> invalid = new ArrayList<>();
        requirePositive(invalid, "autoSaveIntervalSeconds", autoSaveIntervalSeconds);
        requirePositive(invalid, "writeCooldownSeconds", writeCooldownSeconds);
        requirePositive(invalid, "forceLoadMaxSteps", forceLoadMaxSteps);
        requirePositive(invalid, "forceLoadStepSeconds", forceLoadStepSeconds);
        requirePositive(invalid, "deadLockAssumedAfterSeconds", deadLockAssumedAfterSeconds);
        requirePositive(invalid, "issueCountForCriticalState", issueCountForCriticalState);
        requirePositive(invalid, "issueWindowSeconds", issueWindowSeconds);
        requirePositive(invalid, "criticalStateWindowSeconds", criticalStateWindowSeconds);
        requirePositive(invalid, "retryMaxAttempts", retryMaxAttempts);
        requirePositive(invalid, "retryBaseBackoffMs", retryBaseBackoffMs);
        requirePositive(invalid, "retryMaxBackoffMs", retryMaxBackoffMs);
        requirePositive(invalid, "tickMillis", tickMillis);
        requirePositive(invalid, "payloadMaxBytes", payloadMaxBytes);
        if (retryMaxBackoffMs < retryBaseBackoffMs) {
            invalid.add("retryMaxBackoffMs must be >= retryBaseBackoffMs");
        }
        if (!invalid.isEmpty()) {
            throw new InvalidConfigurationException("Invalid lease settings: " + String.join(", ", invalid));
        }
    }

    public static LeaseSettings defaults() {
        return new LeaseSettings(
                DEFAULT_AUTO_SAVE_INTERVAL_SECONDS,
                DEFAULT_WRITE_COOLDOWN_SECONDS,
                DEFAULT_FORCE_LOAD_MAX_STEPS,
                DEFAULT_FORCE_LOAD_STEP_SECONDS,
                DEFAULT_DEAD_LOCK_ASSUMED_AFTER_SECONDS,
                DEFAULT_ISSUE_COUNT_FOR_CRITICAL_STATE,
                DEFAULT_ISSUE_WINDOW_SECONDS,
                DEFAULT_CRITICAL_STATE_WINDOW_SECONDS,
                DEFAULT_RETRY_MAX_ATTEMPTS,
                DEFAULT_RETRY_BASE_BACKOFF_MS,
                DEFAULT_RETRY_MAX_BACKOFF_MS,
                DEFAULT_TICK_MILLIS,
                DEFAULT_PAYLOAD_MAX_BYTES
        );
    }

    public static LeaseSettings load(LeaseKeepConfig config) {
        Path file = config.settingsFile();
        if (!Files.exists(file)) {
            return defaults();
        }
        try {
            return fromJson(Files.readString(file));
        } catch (IOException e) {
            throw new InvalidConfigurationException("Failed to read settings file: " + file, e);
        }
    }

    public static LeaseSettings fromJson(String json) {
        SettingsFile file;
        try {
            file = Jsons.compact().readValue(json == null || json.isBlank() ? "{}" : json, SettingsFile.class);
        } catch (JsonProcessingException e) {
            throw new InvalidConfigurationException("Malformed settings JSON", e);
        }
        return fromFile(file, defaults());
    }

    static LeaseSettings fromFile(SettingsFile file, LeaseSettings defaults) {
        return new LeaseSettings(
                orDefault(file.autoSaveIntervalSeconds(), defaults.autoSaveIntervalSeconds()),
                orDefault(file.writeCooldownSeconds(), defaults.writeCooldownSeconds()),
                orDefault(file.forceLoadMaxSteps(), defaults.forceLoadMaxSteps()),
                orDefault(file.forceLoadStepSeconds(), defaults.forceLoadStepSeconds()),
                orDefault(file.deadLockAssumedAfterSeconds(), defaults.deadLockAssumedAfterSeconds()),
                orDefault(file.issueCountForCriticalState(), defaults.issueCountForCriticalState()),
                orDefault(file.issueWindowSeconds(), defaults.issueWindowSeconds()),
                orDefault(file.criticalStateWindowSeconds(), defaults.criticalStateWindowSeconds()),
                orDefault(file.retryMaxAttempts(), defaults.retryMaxAttempts()),
                orDefault(file.retryBaseBackoffMs(), defaults.retryBaseBackoffMs()),
                orDefault(file.retryMaxBackoffMs(), defaults.retryMaxBackoffMs()),
                orDefault(file.tickMillis(), defaults.tickMillis()),
                orDefault(file.payloadMaxBytes(), defaults.payloadMaxBytes())
        );
    }

    public long autoSaveIntervalMs() {
        return autoSaveIntervalSeconds * 1_000L;
    }

    public long writeCooldownMs() {
        return writeCooldownSeconds * 1_000L;
    }

    public long forceLoadStepMs() {
        return forceLoadStepSeconds * 1_000L;
    }

    public long deadLockAssumedAfterMs() {
        return deadLockAssumedAfterSeconds * 1_000L;
    }

    public long issueWindowMs() {
        return issueWindowSeconds * 1_000L;
    }

    public long criticalStateWindowMs() {
        return criticalStateWindowSeconds * 1_000L;
    }

    private static void requirePositive(List<String> invalid, String name, long value) {
        if (value < 1L) {
            invalid.add(name + " must be >= 1 (was " + value + ")");
        }
    }

    private static int orDefault(Integer raw, int fallback) {
        return raw == null ? fallback : raw;
    }

    private static long orDefault(Long raw, long fallback) {
        return raw == null ? fallback : raw;
    }

    record SettingsFile(
            Integer autoSaveIntervalSeconds,
            Integer writeCooldownSeconds,
            Integer forceLoadMaxSteps,
            Integer forceLoadStepSeconds,
            Integer deadLockAssumedAfterSeconds,
            Integer issueCountForCriticalState,
            Integer issueWindowSeconds,
            Integer criticalStateWindowSeconds,
            Integer retryMaxAttempts,
            Long retryBaseBackoffMs,
            Long retryMaxBackoffMs,
            Long tickMillis,
            Long payloadMaxBytes
    ) {
    }
}
