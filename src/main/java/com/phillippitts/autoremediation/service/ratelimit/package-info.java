/**
 * Frequency cap on remediation attempts.
 */
package com.phillippitts.autoremediation.service.ratelimit;
