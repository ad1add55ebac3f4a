/**
 * State store abstraction with transactional writes and the in-memory implementation.
 */
package com.phillippitts.autoremediation.service.store;
