/**
 * Inbox for signals from external advisors, drained into findings each tick.
 */
package com.phillippitts.autoremediation.service.advisory;
