/**
 * Maps exceptions to HTTP responses for the REST controllers.
 */
package com.phillippitts.autoremediation.presentation.exception;
