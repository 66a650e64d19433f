package com.example.wormhole.model;

public record BilibiliVideo(
        String bvid,
        long aid,
        String title,
        String pic,
        String author,
        long mid,
        long created,
        String length,
        long play,
        long danmaku
) {}
