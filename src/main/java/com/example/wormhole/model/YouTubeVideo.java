package com.example.wormhole.model;

public record YouTubeVideo(
        String id,
        String title,
        String description,
        String channelId,
        String channelTitle,
        String publishedAt
) {}
