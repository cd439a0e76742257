package com.mixtape.playlist.core.exception;

import com.mixtape.playlist.core.position.ReorderValidation;

/**
 * Domain exception thrown when a submitted ordering is not an exact permutation of the live tracks.
 */
public class ReorderRejectedException extends RuntimeException {

    private final ReorderValidation validation;

    public ReorderRejectedException(ReorderValidation validation) {
        super(validation.message());
        this.validation = validation;
    }

    public ReorderValidation getValidation() {
        return validation;
    }
}
