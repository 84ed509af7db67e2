package edu.stanford.futuredata.shardview.interfaces;

import java.util.List;

public interface ShardResolver {
    /*
     Maps a time range onto the time-partitioned shards of an account.
     */

    // Shards covering [startTime, endTime] (epoch seconds), oldest first.
    List<String> shardsForRange(String accountId, long startTime, long endTime);
}
