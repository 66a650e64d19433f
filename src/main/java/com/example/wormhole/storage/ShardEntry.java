package com.example.wormhole.storage;

import com.example.wormhole.model.UserMapping;

/**
 * One keyed record for {@link ShardStore#batchWrite(java.util.List)}.
 */
public record ShardEntry(String id, UserMapping mapping) {}
