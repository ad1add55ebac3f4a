package com.phillippitts.autoremediation.config.settings;

import com.phillippitts.autoremediation.domain.ActionType;
import com.phillippitts.autoremediation.domain.FindingKind;
import com.phillippitts.autoremediation.domain.RemediationSettings;
import com.phillippitts.autoremediation.exception.UnknownActionTypeException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Cross-field checks shared by startup validation and the overlay reloader.
 */
public final class SettingsChecks {

    private SettingsChecks() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns human readable problems; empty when the settings are usable.
     */
    public static List<String> problems(RemediationSettings settings) {
        List<String> problems = new ArrayList<>();
        RemediationSettings.Thresholds t = settings.thresholds();
        if (!(t.errorRate() > 0.0 && t.errorRate() <= 1.0)) {
            problems.add("error-rate must be in (0, 1], got: " + t.errorRate());
        }
        if (!(t.errorRateCritical() > t.errorRate() && t.errorRateCritical() <= 1.0)) {
            problems.add("error-rate-critical must be above error-rate (" + t.errorRate()
                    + ") and at most 1, got: " + t.errorRateCritical());
        }
        if (t.cpuPercent() <= 0 || t.responseTimeMs() <= 0 || t.memoryMb() <= 0) {
            problems.add("cpu-percent, response-time-ms and memory-mb must be positive");
        }
        if (t.cpuSustainedTicks() < 1 || t.memoryGrowthTicks() < 1) {
            problems.add("cpu-sustained-ticks and memory-growth-ticks must be at least 1");
        }

        RemediationSettings.Limits l = settings.limits();
        if (l.maxActionsPerWindow() < 1 || l.failureThreshold() < 1 || l.successThreshold() < 1) {
            problems.add("max-actions-per-window, failure-threshold and success-threshold must be at least 1");
        }
        if (l.window().isNegative() || l.window().isZero() || l.cooldown().isNegative() || l.cooldown().isZero()) {
            problems.add("window-seconds and cooldown-seconds must be positive");
        }
        if (settings.lifecycleTimeout().isNegative() || settings.lifecycleTimeout().isZero()) {
            problems.add("lifecycle-timeout-ms must be positive");
        }

        RemediationSettings.ActionPolicy p = settings.policy();
        checkAction(problems, "error-rate-action", p.errorRateAction());
        ActionType errorRateAction = parseQuietly(p.errorRateAction());
        if (errorRateAction != null
                && errorRateAction != ActionType.RESTART_CONTAINER && errorRateAction != ActionType.SCALE_UP) {
            problems.add("error-rate-action must be restart_container or scale_up, got: '"
                    + p.errorRateAction() + "'");
        }
        checkAction(problems, "advisory-action", p.advisoryAction());
        for (Map.Entry<String, String> e : p.overrides().entrySet()) {
            try {
                FindingKind.fromCode(e.getKey());
            } catch (IllegalArgumentException ex) {
                problems.add("overrides key is not a finding kind: '" + e.getKey() + "'");
            }
            checkAction(problems, "overrides." + e.getKey(), e.getValue());
        }
        if (settings.historySize() < Math.max(t.cpuSustainedTicks(), t.memoryGrowthTicks())) {
            problems.add("history-size (" + settings.historySize()
                    + ") must cover cpu-sustained-ticks and memory-growth-ticks");
        }
        return problems;
    }

    private static void checkAction(List<String> problems, String key, String code) {
        if (parseQuietly(code) == null) {
            problems.add(key + " is not an action type: '" + code + "'. Allowed: "
                    + "restart_container, scale_up, scale_down, heal, manual");
        }
    }

    private static ActionType parseQuietly(String code) {
        try {
            return ActionType.fromCode(code);
        } catch (UnknownActionTypeException e) {
            return null;
        }
    }
}
