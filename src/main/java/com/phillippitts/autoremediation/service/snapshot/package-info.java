/**
 * Metrics snapshot sources and the timeout-bounded collector used each tick.
 */
package com.phillippitts.autoremediation.service.snapshot;
