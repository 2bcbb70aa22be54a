package com.replyfeed.domain.service;

import com.replyfeed.config.FeedGeneratorProperties;
import com.replyfeed.domain.model.FeedPage;
import com.replyfeed.domain.model.FeedPost;
import com.replyfeed.infrastructure.persistence.FeedStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read side of the feed: turns stored rows into a cursor-paginated skeleton.
 * 
 * Cursor semantics:
 * - The cursor is the createdAt (epoch millis) of the last item on the previous page
 * - Rows strictly older than the cursor are returned, newest first
 * - A cursor is handed back only when the page came back full; so a user with
 *   exactly {@code limit} remaining rows gets a cursor that leads to an empty page
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedReader {

    /** Upper bound used when the client has no cursor yet. */
    static final long NEWEST_CURSOR = 9_999_999_999_999L;

    private final FeedStore feedStore;
    private final FeedGeneratorProperties properties;

    /**
     * Serve a page of the named feed.
     * 
     * @throws UnknownFeedException if the feed URI does not name the published feed
     */
    public FeedPage readFeed(String feedUri, String userDid, String cursor, Integer limit) {
        if (!isPublishedFeed(feedUri)) {
            throw new UnknownFeedException(feedUri);
        }
        return read(userDid, cursor, limit);
    }

    public FeedPage read(String userDid, String cursor, Integer limit) {
        int pageSize = clampLimit(limit);
        long before = parseCursor(cursor);

        List<FeedPost> rows = feedStore.getUserFeed(userDid, before, pageSize);

        List<FeedPage.FeedItem> items = rows.stream()
                .map(row -> FeedPage.FeedItem.builder()
                        .post(row.getReplyUri())
                        .feedContext(row.getSubscribedPostUri())
                        .build())
                .collect(Collectors.toList());

        String nextCursor = "";
        if (!rows.isEmpty() && rows.size() == pageSize) {
            nextCursor = Long.toString(rows.get(rows.size() - 1).getCreatedAt());
        }

        return FeedPage.builder()
                .cursor(nextCursor)
                .feed(items)
                .build();
    }

    /**
     * Feed URIs look like {@code at://<publisher>/app.bsky.feed.generator/<name>}; only the name is checked.
     */
    boolean isPublishedFeed(String feedUri) {
        if (feedUri == null || feedUri.isBlank()) {
            return false;
        }
        String name = feedUri.substring(feedUri.lastIndexOf('/') + 1);
        return name.equals(properties.getFeed().getName());
    }

    int clampLimit(Integer limit) {
        FeedGeneratorProperties.Feed feed = properties.getFeed();
        if (limit == null || limit < 1 || limit > feed.getMaxLimit()) {
            return feed.getDefaultLimit();
        }
        return limit;
    }

    long parseCursor(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            return NEWEST_CURSOR;
        }
        try {
            // createdAt comes from the post author, so cursors before 1970 are legitimate
            return Long.parseLong(cursor.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring unparseable feed cursor '{}'", cursor);
            return NEWEST_CURSOR;
        }
    }
}
