package com.example.wormhole.client;

import com.example.wormhole.model.YouTubeChannel;
import com.example.wormhole.model.YouTubeVideo;

import java.util.List;

/**
 * YouTube data used by verification. Every method throws {@link PlatformFetchException}
 * when the call fails or the daily quota is exhausted.
 */
public interface YouTubeApi {

    YouTubeChannel getChannel(String channelId);

    /** Channels matching a keyword; channels whose details cannot be loaded are skipped. */
    List<YouTubeChannel> searchChannels(String query, int maxResults);

    /** Most recent uploads of a channel. */
    List<YouTubeVideo> getChannelVideos(String channelId, int maxResults);
}
