/**
 * Streaming pose telemetry with per-session throttling and single-flight analysis.
 */
package com.phillippitts.telesession.service.telemetry;
