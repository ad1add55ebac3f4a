/**
 * Typed {@code @ConfigurationProperties} bound from {@code remediation.*} and {@code threadpool.*}.
 */
package com.phillippitts.autoremediation.config.properties;
