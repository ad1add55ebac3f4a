/**
 * REST controllers.
 */
package com.phillippitts.autoremediation.presentation.controller;
