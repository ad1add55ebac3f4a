/**
 * Threshold detectors and the per-service snapshot history they read.
 */
package com.phillippitts.autoremediation.service.detect;
