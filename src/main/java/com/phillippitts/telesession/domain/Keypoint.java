package com.phillippitts.telesession.domain;

import java.util.Objects;

/**
 * A single joint coordinate produced by the capture loop.
 *
 * @param name       joint name, e.g. {@code left_shoulder}
 * @param x          normalized horizontal coordinate
 * @param y          normalized vertical coordinate
 * @param z          depth, 0.0 when the estimator is 2D
 * @param confidence detection confidence in [0.0, 1.0]
 */
public record Keypoint(String name, double x, double y, double z, double confidence) {

    public Keypoint {
        Objects.requireNonNull(name, "Keypoint name must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }
}
