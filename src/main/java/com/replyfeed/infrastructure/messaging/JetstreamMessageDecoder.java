package com.replyfeed.infrastructure.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.replyfeed.domain.model.FirehoseEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Decodes Jetstream JSON frames into {@link FirehoseEvent}s.
 * 
 * Frame shape:
 * {"did": ..., "time_us": ..., "kind": "commit",
 *  "commit": {"operation": ..., "collection": ..., "rkey": ..., "record": {...}}}
 * 
 * Identity and account frames, commits missing a did or rkey, and anything
 * that is not JSON, decode to empty.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JetstreamMessageDecoder {

    private static final String COMMIT_KIND = "commit";

    private final ObjectMapper objectMapper;

    public Optional<FirehoseEvent> decode(String frame) {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            log.debug("Skipping undecodable Jetstream frame: {}", e.getMessage());
            return Optional.empty();
        }

        if (root == null || !COMMIT_KIND.equals(root.path("kind").asText())) {
            return Optional.empty();
        }

        JsonNode commit = root.path("commit");
        if (!commit.isObject()) {
            return Optional.empty();
        }

        String did = textOrNull(root.path("did"));
        String rkey = textOrNull(commit.path("rkey"));
        if (did == null || rkey == null) {
            log.debug("Skipping commit without did or rkey: did={}, rkey={}", did, rkey);
            return Optional.empty();
        }

        long timeUs = root.path("time_us").asLong(0L);
        JsonNode record = commit.get("record");

        return Optional.of(FirehoseEvent.builder()
                .authorDid(did)
                .operation(FirehoseEvent.Operation.fromWire(commit.path("operation").asText(null)))
                .collection(commit.path("collection").asText(null))
                .recordKey(rkey)
                .record(record != null && !record.isNull() ? record : null)
                .timestamp(timeUs > 0 ? Instant.EPOCH.plus(timeUs, ChronoUnit.MICROS).toString() : null)
                .cursor(timeUs > 0 ? timeUs : null)
                .build());
    }

    private static String textOrNull(JsonNode node) {
        if (!node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        return node.asText();
    }
}
