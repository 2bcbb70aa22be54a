package com.replyfeed.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Feed skeleton page returned to the client.
 * 
 * An empty cursor means there are no further pages.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedPage {

    @Builder.Default
    private String cursor = "";

    @Builder.Default
    private List<FeedItem> feed = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FeedItem {
        private String post;
        private String feedContext;
    }
}
