package com.replyfeed.api;

import com.replyfeed.config.FeedGeneratorProperties;
import com.replyfeed.domain.model.FeedPage;
import com.replyfeed.domain.service.FeedReader;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Feed generator XRPC endpoints.
 * 
 * GET /xrpc/app.bsky.feed.getFeedSkeleton          - a page of the requester's reply feed
 * GET /xrpc/app.bsky.feed.describeFeedGenerator    - feeds published by this generator
 * GET /.well-known/did.json                        - did:web document for the service
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class FeedController {

    private final FeedReader feedReader;
    private final RequesterResolver requesterResolver;
    private final FeedGeneratorProperties properties;

    @GetMapping("/xrpc/app.bsky.feed.getFeedSkeleton")
    public ResponseEntity<FeedPage> getFeedSkeleton(
            @RequestParam(required = false) String feed,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) String limit,
            HttpServletRequest request) {

        if (feed == null || feed.isBlank()) {
            throw new IllegalArgumentException("missing feed query param");
        }

        Integer pageSize = null;
        if (limit != null && !limit.isBlank()) {
            try {
                pageSize = Integer.valueOf(limit.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid limit query param");
            }
        }

        String userDid = requesterResolver.resolve(request).orElseThrow(MissingRequesterException::new);
        log.info("Feed skeleton request: feed={}, user={}, cursor={}", feed, userDid, cursor);

        return ResponseEntity.ok(feedReader.readFeed(feed, userDid, cursor, pageSize));
    }

    @GetMapping("/xrpc/app.bsky.feed.describeFeedGenerator")
    public ResponseEntity<Map<String, Object>> describeFeedGenerator() {
        FeedGeneratorProperties.Publisher publisher = properties.getPublisher();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("did", "did:web:" + publisher.getHostName());
        body.put("feeds", List.of(Map.of("uri", String.format("at://%s/app.bsky.feed.generator/%s",
                publisher.getDidBase(), properties.getFeed().getName()))));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/.well-known/did.json")
    public ResponseEntity<Map<String, Object>> wellKnownDid() {
        String host = properties.getPublisher().getHostName();

        Map<String, Object> service = new LinkedHashMap<>();
        service.put("id", "#bsky_fg");
        service.put("type", "BskyFeedGenerator");
        service.put("serviceEndpoint", "https://" + host);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("@context", List.of("https://www.w3.org/ns/did/v1"));
        body.put("id", "did:web:" + host);
        body.put("service", List.of(service));
        return ResponseEntity.ok(body);
    }
}
