/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.telesession.config.ThreadPoolConfig} - analysis executor,
 *       session scheduler and the clock</li>
 *   <li>{@link com.phillippitts.telesession.config.ThreadPoolMetricsConfig} - analysis pool gauges</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code @ConfigurationProperties}</li>
 *   <li>{@code config.websocket} - socket endpoint registration</li>
 *   <li>{@code config.telemetry} - analysis collaborator wiring</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.telesession.config;
