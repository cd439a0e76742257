package com.mixtape.playlist.core.exception;

/**
 * Thrown when a listing query carries an unusable page, page size or sort option.
 */
public class InvalidPaginationException extends RuntimeException {

    private final String parameter;

    public InvalidPaginationException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    /**
     * @return name of the offending query parameter
     */
    public String getParameter() {
        return parameter;
    }
}
