/**
 * Notification events and their outbound channels (console log, Slack webhook).
 *
 * <p>Components publish {@link com.phillippitts.autoremediation.service.notification.NotificationEvent}
 * through Spring's event bus from after-commit hooks; the
 * {@link com.phillippitts.autoremediation.service.notification.NotificationDispatcher} delivers them
 * asynchronously.
 */
package com.phillippitts.autoremediation.service.notification;
