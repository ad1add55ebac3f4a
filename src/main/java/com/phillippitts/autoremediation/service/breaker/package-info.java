/**
 * Per-service circuit breaker that gates automatic remediation on the recent failure pattern.
 */
package com.phillippitts.autoremediation.service.breaker;
