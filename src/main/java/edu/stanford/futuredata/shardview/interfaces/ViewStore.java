package edu.stanford.futuredata.shardview.interfaces;

import edu.stanford.futuredata.shardview.utilities.StoreQueryOptions;
import edu.stanford.futuredata.shardview.utilities.ViewQueryResult;

public interface ViewStore {
    /*
     A document store split into shards.  Each shard exposes named views whose rows are ordered by key.

     Rows are JSON objects carrying at least "key", usually also "id", "value" and (with include_docs) "doc".
     */

    // Query a view on one shard.  A missing shard or view is reported as notFound, never thrown.
    ViewQueryResult query(String shard, String view, StoreQueryOptions options);
}
