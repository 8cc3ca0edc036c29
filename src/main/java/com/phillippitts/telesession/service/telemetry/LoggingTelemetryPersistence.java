package com.phillippitts.telesession.service.telemetry;

import com.phillippitts.telesession.domain.AnalysisResult;
import com.phillippitts.telesession.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Default persistence hook: records results in the log only. Replace it with a bean that
 * writes to the records store.
 */
public class LoggingTelemetryPersistence implements TelemetryPersistence {

    private static final Logger LOG = LogManager.getLogger(LoggingTelemetryPersistence.class);
    private static final int FEEDBACK_PREVIEW = 40;

    @Override
    public void persist(AnalysisResult result) {
        LOG.debug("Result for frame {}: score={}, feedback='{}'", result.frameSequenceNumber(), result.score(),
                LogSanitizer.truncate(result.feedback(), FEEDBACK_PREVIEW));
    }
}
