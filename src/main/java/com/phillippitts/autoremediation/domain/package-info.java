/**
 * Immutable domain values: findings, incidents, remediation actions, breaker records,
 * action-window entries, metrics snapshots and the per-tick settings snapshot.
 */
package com.phillippitts.autoremediation.domain;
