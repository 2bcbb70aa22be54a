package com.replyfeed.api;

import jakarta.servlet.http.HttpServletRequest;

import java.util.Optional;

/**
 * Identifies the authenticated user behind a request.
 * 
 * Token verification happens upstream; the core only sees an opaque DID.
 */
public interface RequesterResolver {

    Optional<String> resolve(HttpServletRequest request);
}
