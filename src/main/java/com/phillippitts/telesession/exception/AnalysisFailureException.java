package com.phillippitts.telesession.exception;

/**
 * Raised when the analysis collaborator fails or returns an unusable response.
 */
public class AnalysisFailureException extends TeleSessionException {

    public AnalysisFailureException(String message) {
        super(ErrorCode.ANALYSIS_FAILURE, message);
    }

    public AnalysisFailureException(String message, Throwable cause) {
        super(ErrorCode.ANALYSIS_FAILURE, message, cause);
    }
}
