/**
 * Spring wiring: thread pools and their metrics, the settings source, optional notification
 * channels and startup validation.
 */
package com.phillippitts.autoremediation.config;
