/**
 * Action selection, bounded lifecycle calls and outcome recording, for both automatic and
 * operator-initiated remediation.
 */
package com.phillippitts.autoremediation.service.remediation;
