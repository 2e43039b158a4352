package com.transparenta.analytics.model;

/**
 * Ties a view to a code previously selected in the other classification dimension.
 */
public record PivotConstraint(ClassificationDimension dimension, String code) {

    public PivotConstraint {
        if (dimension == null) {
            throw new IllegalArgumentException("pivot dimension must be provided");
        }
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("pivot code must be provided");
        }
    }
}
