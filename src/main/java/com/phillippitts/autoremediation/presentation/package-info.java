/**
 * HTTP boundary: the advisory intake controller, its exception mapping and the operator
 * actuator endpoint. Presentation depends on services, never the reverse.
 */
package com.phillippitts.autoremediation.presentation;
