/**
 * Request-scoped logging context.
 */
package com.phillippitts.autoremediation.config.logging;
