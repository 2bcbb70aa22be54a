package com.replyfeed.api;

import com.replyfeed.config.FeedGeneratorProperties;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads the requester DID from a header set by the authenticating proxy.
 */
@Component
@RequiredArgsConstructor
public class HeaderRequesterResolver implements RequesterResolver {

    private final FeedGeneratorProperties properties;

    @Override
    public Optional<String> resolve(HttpServletRequest request) {
        String value = request.getHeader(properties.getHttp().getRequesterHeader());
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }
}
