/**
 * Per-tick settings snapshots: built from properties, optionally overlaid from a JSON file.
 */
package com.phillippitts.autoremediation.config.settings;
