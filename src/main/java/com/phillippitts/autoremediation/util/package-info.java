/**
 * Small shared helpers for timing, process cleanup and log-safe text.
 */
package com.phillippitts.autoremediation.util;
