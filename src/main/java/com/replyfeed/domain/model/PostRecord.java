package com.replyfeed.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Optional;

/**
 * The parts of an {@code app.bsky.feed.post} record the feed generator reads.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PostRecord {

    private String text;
    private ReplyRef reply;
    private String createdAt;

    /**
     * URI of the post this one replies to, if it is a reply.
     */
    public Optional<String> replyParentUri() {
        if (reply == null || reply.getParent() == null) {
            return Optional.empty();
        }
        String uri = reply.getParent().getUri();
        if (uri == null || uri.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(uri);
    }

    public boolean containsMarker(String marker) {
        return text != null && marker != null && !marker.isEmpty() && text.contains(marker);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReplyRef {
        private StrongRef root;
        private StrongRef parent;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StrongRef {
        private String uri;
        private String cid;
    }
}
