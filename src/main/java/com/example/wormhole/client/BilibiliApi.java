package com.example.wormhole.client;

import com.example.wormhole.model.BilibiliUser;
import com.example.wormhole.model.BilibiliVideo;

import java.util.List;

/**
 * Bilibili data used by verification and candidate discovery.
 * Every method throws {@link PlatformFetchException} when the call fails.
 */
public interface BilibiliApi {

    BilibiliUser getUserInfo(String uid);

    List<BilibiliVideo> getUserVideos(String uid, int page, int pageSize);

    /** Owners of the videos on the hot ranking, unique by UID. */
    List<BilibiliUser> getHotRankings();

    /** Owners of the videos on the must-watch list, unique by UID. */
    List<BilibiliUser> getMustWatchList();

    List<BilibiliUser> getTop100Creators();
}
