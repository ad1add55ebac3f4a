/**
 * Actuator health contribution.
 */
package com.phillippitts.autoremediation.service.health;
