/**
 * The scheduled monitoring loop and the per-service tick it drives.
 *
 * <p>Services are processed in parallel on the monitor pool; at most one tick per service runs
 * at a time.
 */
package com.phillippitts.autoremediation.service.orchestration;
