package com.phillippitts.autoremediation.config.settings;

import com.phillippitts.autoremediation.domain.ActionType;
import com.phillippitts.autoremediation.domain.RemediationSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Overlays a JSON file on top of the property-based settings. The file is re-read whenever its
 * modification time changes, so operators can retune thresholds and limits between ticks.
 *
 * <p>Recognized shape (every key optional):
 * <pre>
 * {
 *   "thresholds":  {"error_rate": 0.2, "error_rate_critical": 0.6, "cpu_percent": 80,
 *                   "cpu_sustained_ticks": 3, "response_time_ms": 500, "memory_mb": 1024,
 *                   "memory_growth_ticks": 4},
 *   "remediation": {"max_actions_per_window": 3, "max_restarts_per_5min": 3, "window_seconds": 300,
 *                   "cooldown_seconds": 120, "failure_threshold": 3, "success_threshold": 1,
 *                   "error_rate_action": "restart_container", "enable_auto_scale": false,
 *                   "advisory_action": "heal"}
 * }
 * </pre>
 * {@code max_restarts_per_5min} is accepted as an alias of {@code max_actions_per_window};
 * {@code enable_auto_scale: true} selects {@code scale_up} for high error rates.
 *
 * <p>A missing file means no overlay. An unreadable, malformed or invalid file is logged and
 * the last good overlay stays in effect until the file changes again.
 */
public class OverlayConfigSource implements ConfigSource {

    private static final Logger LOG = LogManager.getLogger(OverlayConfigSource.class);

    private final ConfigSource base;
    private final Path file;

    private FileTime seenModified;
    private JSONObject overlay;

    public OverlayConfigSource(ConfigSource base, Path file) {
        this.base = Objects.requireNonNull(base, "base");
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public synchronized RemediationSettings current() {
        RemediationSettings settings = base.current();
        refresh(settings);
        return overlay == null ? settings : apply(settings, overlay);
    }

    private void refresh(RemediationSettings baseSettings) {
        FileTime modified;
        try {
            modified = Files.getLastModifiedTime(file);
        } catch (NoSuchFileException e) {
            if (overlay != null || seenModified != null) {
                LOG.warn("Config overlay {} disappeared; keeping last good overlay", file);
                seenModified = null;
            }
            return;
        } catch (IOException e) {
            LOG.warn("Cannot stat config overlay {}: {}", file, e.toString());
            return;
        }
        if (modified.equals(seenModified)) {
            return;
        }
        seenModified = modified;
        try {
            JSONObject candidate = new JSONObject(Files.readString(file, StandardCharsets.UTF_8));
            RemediationSettings applied = apply(baseSettings, candidate);
            List<String> problems = SettingsChecks.problems(applied);
            if (!problems.isEmpty()) {
                LOG.error("Config overlay {} rejected, keeping last good settings: {}", file, problems);
                return;
            }
            overlay = candidate;
            LOG.info("Config overlay {} loaded: thresholds={}, limits={}", file,
                    applied.thresholds(), applied.limits());
        } catch (IOException | JSONException | IllegalArgumentException e) {
            LOG.error("Config overlay {} unreadable, keeping last good settings: {}", file, e.toString());
        }
    }

    static RemediationSettings apply(RemediationSettings s, JSONObject json) {
        JSONObject t = json.optJSONObject("thresholds");
        RemediationSettings.Thresholds thresholds = s.thresholds();
        if (t != null) {
            thresholds = new RemediationSettings.Thresholds(
                    t.optDouble("error_rate", thresholds.errorRate()),
                    t.optDouble("error_rate_critical", thresholds.errorRateCritical()),
                    t.optDouble("cpu_percent", thresholds.cpuPercent()),
                    t.optInt("cpu_sustained_ticks", thresholds.cpuSustainedTicks()),
                    t.optDouble("response_time_ms", thresholds.responseTimeMs()),
                    t.optDouble("memory_mb", thresholds.memoryMb()),
                    t.optInt("memory_growth_ticks", thresholds.memoryGrowthTicks()));
        }

        JSONObject r = json.optJSONObject("remediation");
        RemediationSettings.Limits limits = s.limits();
        RemediationSettings.ActionPolicy policy = s.policy();
        Duration lifecycleTimeout = s.lifecycleTimeout();
        if (r != null) {
            lifecycleTimeout = Duration.ofMillis(r.optLong("lifecycle_timeout_ms", lifecycleTimeout.toMillis()));
            int maxActions = r.optInt("max_restarts_per_5min", limits.maxActionsPerWindow());
            maxActions = r.optInt("max_actions_per_window", maxActions);
            limits = new RemediationSettings.Limits(
                    maxActions,
                    Duration.ofSeconds(r.optLong("window_seconds", limits.window().toSeconds())),
                    Duration.ofSeconds(r.optLong("cooldown_seconds", limits.cooldown().toSeconds())),
                    r.optInt("failure_threshold", limits.failureThreshold()),
                    r.optInt("success_threshold", limits.successThreshold()));
            String errorRateAction = policy.errorRateAction();
            if (r.has("enable_auto_scale")) {
                errorRateAction = r.getBoolean("enable_auto_scale")
                        ? ActionType.SCALE_UP.code()
                        : ActionType.RESTART_CONTAINER.code();
            }
            errorRateAction = r.optString("error_rate_action", errorRateAction);
            policy = new RemediationSettings.ActionPolicy(
                    errorRateAction,
                    r.optString("advisory_action", policy.advisoryAction()),
                    policy.overrides(),
                    policy.targets());
        }
        return new RemediationSettings(s.services(), thresholds, limits, policy, s.snapshotTimeout(),
                s.minAttemptInterval(), lifecycleTimeout, s.historySize());
    }
}
