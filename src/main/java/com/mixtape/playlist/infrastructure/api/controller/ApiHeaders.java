package com.mixtape.playlist.infrastructure.api.controller;

/**
 * Request headers understood by the API.
 */
public final class ApiHeaders {

    /**
     * Opaque caller identity, set by the authentication layer in front of this service.
     */
    public static final String USER_ID = "X-User-Id";

    /**
     * Longest caller identity that can be stored as a playlist owner.
     */
    public static final int MAX_USER_ID_LENGTH = 255;

    private ApiHeaders() {
    }
}
