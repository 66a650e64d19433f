package com.example.wormhole.model;

/**
 * YouTube channel snippet and statistics.
 *
 * @param id              channel id ({@code UC...})
 * @param title           channel title
 * @param description     channel description
 * @param customUrl       handle such as {@code @name}, may be null
 * @param thumbnails      avatar thumbnails
 * @param subscriberCount subscriber count, null when hidden
 * @param videoCount      uploaded video count, may be null
 * @param verified        platform verification flag
 */
public record YouTubeChannel(
        String id,
        String title,
        String description,
        String customUrl,
        Thumbnails thumbnails,
        Long subscriberCount,
        Long videoCount,
        boolean verified
) {
    public record Thumbnails(String defaultUrl, String medium, String high) {}
}
