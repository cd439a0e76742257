package com.mixtape.playlist.infrastructure.api.controller;

import com.mixtape.playlist.core.exception.InvalidCallerIdentityException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Rejects requests whose caller identity is blank or too long to be stored as an owner id.
 * An absent header is left to the controllers, which declare it as required.
 */
public class CallerIdentityInterceptor implements HandlerInterceptor {

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String userId = request.getHeader(ApiHeaders.USER_ID);
        if (userId == null) {
            return true;
        }
        if (userId.isBlank()) {
            throw new InvalidCallerIdentityException("Caller identity must not be blank");
        }
        if (userId.length() > ApiHeaders.MAX_USER_ID_LENGTH) {
            throw new InvalidCallerIdentityException(
                    "Caller identity must be at most " + ApiHeaders.MAX_USER_ID_LENGTH + " characters");
        }
        return true;
    }
}
