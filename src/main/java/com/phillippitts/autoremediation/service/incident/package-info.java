/**
 * Incident deduplication and lifecycle.
 */
package com.phillippitts.autoremediation.service.incident;
