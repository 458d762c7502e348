package com.vidnyan.grader.domain.step;

/**
 * Source of the text released after every step passed.
 */
@FunctionalInterface
public interface SuccessArtifactSource {

    /**
     * Never throws; a missing artifact yields an error text.
     */
    String release();
}
