package com.phillippitts.telesession.service.telemetry;

/**
 * Receives analysis updates for one session.
 */
@FunctionalInterface
public interface TelemetrySubscriber {

    void onUpdate(TelemetryUpdate update);
}
