package edu.stanford.futuredata.shardview.utilities;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Options for one shard query.  Built once per request; each fold round derives a copy with
 * its own start key and limit.
 */
public class StoreQueryOptions {
    public final JsonNode startKey;
    public final JsonNode endKey;
    // Null means unlimited.
    public final Integer limit;
    public final boolean descending;
    public final boolean includeDocs;
    // Store-specific options handed through untouched (reduce, group, stale, ...).
    public final Map<String, Object> extra;

    public StoreQueryOptions(JsonNode startKey, JsonNode endKey, Integer limit, boolean descending,
                             boolean includeDocs, Map<String, Object> extra) {
        this.startKey = startKey;
        this.endKey = endKey;
        this.limit = limit;
        this.descending = descending;
        this.includeDocs = includeDocs;
        this.extra = Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    public StoreQueryOptions forRound(JsonNode startKey, Integer limit) {
        return new StoreQueryOptions(startKey, endKey, limit, descending, includeDocs, extra);
    }

    public Optional<Object> getExtra(String key) {
        return Optional.ofNullable(extra.get(key));
    }

    @Override
    public String toString() {
        return String.format("startkey=%s endkey=%s limit=%s descending=%b include_docs=%b extra=%s",
                startKey, endKey, limit, descending, includeDocs, extra.keySet());
    }
}
