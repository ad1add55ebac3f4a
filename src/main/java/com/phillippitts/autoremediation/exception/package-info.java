/**
 * Unchecked exception hierarchy rooted at
 * {@link com.phillippitts.autoremediation.exception.AutoRemediationException}.
 *
 * <p>Signal errors ({@link com.phillippitts.autoremediation.exception.SnapshotUnavailableException})
 * become health-check findings, action errors
 * ({@link com.phillippitts.autoremediation.exception.LifecycleException}) become failed actions,
 * persistence errors ({@link com.phillippitts.autoremediation.exception.PersistenceException}) abort
 * the current incident for one tick, and programming errors such as
 * {@link com.phillippitts.autoremediation.exception.UnknownActionTypeException} are fatal only to
 * the incident being processed.
 */
package com.phillippitts.autoremediation.exception;
