package com.phillippitts.telesession.service.telemetry;

/**
 * Raw answer of the analysis collaborator for one frame.
 *
 * @param score    movement quality score
 * @param feedback coaching feedback, may be empty
 */
public record Analysis(double score, String feedback) {

    public Analysis {
        if (Double.isNaN(score) || Double.isInfinite(score)) {
            throw new IllegalArgumentException("score must be finite, got: " + score);
        }
        feedback = feedback == null ? "" : feedback;
    }
}
