/**
 * Actuator endpoint for operators.
 */
package com.phillippitts.autoremediation.presentation.endpoint;
