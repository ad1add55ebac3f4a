package com.phillippitts.autoremediation.config.settings;

import com.phillippitts.autoremediation.domain.RemediationSettings;

/**
 * Supplies the settings snapshot used for one tick. Called at the top of every tick, so changes
 * take effect without a restart.
 */
@FunctionalInterface
public interface ConfigSource {

    RemediationSettings current();
}
