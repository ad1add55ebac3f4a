/**
 * Micrometer instrumentation for detection and remediation.
 */
package com.phillippitts.autoremediation.service.metrics;
