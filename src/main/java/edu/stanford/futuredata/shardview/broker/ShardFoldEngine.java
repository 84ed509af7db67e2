package edu.stanford.futuredata.shardview.broker;

import com.fasterxml.jackson.databind.JsonNode;
import edu.stanford.futuredata.shardview.interfaces.ViewStore;
import edu.stanford.futuredata.shardview.utilities.LoadError;
import edu.stanford.futuredata.shardview.utilities.StoreQueryOptions;
import edu.stanford.futuredata.shardview.utilities.ViewQueryResult;
import org.javatuples.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Walks the descriptor's shards in order, one store query per round, until the page is full, the
 * shards run out, or something fails.  Every query over-fetches by one row; that extra row is
 * never returned and its key becomes the cursor for the next round (or the next page).
 */
public class ShardFoldEngine {
    private static final Logger logger = LoggerFactory.getLogger(ShardFoldEngine.class);

    public enum Continuation {
        // Page is full and more data exists.
        EXHAUSTED,
        // Query the same shard again from the new cursor.
        SAME_SHARD,
        // This shard has nothing more to give.
        NEXT_SHARD
    }

    private final ViewStore store;

    public ShardFoldEngine(ViewStore store) {
        this.store = store;
    }

    /*
     * FOLD
     */

    // Runs the whole request.  Status, error, rows and cursor end up on the descriptor.
    public void fold(QueryDescriptor d) {
        List<String> shards = d.getShards();
        int shardNum = 0;
        while (true) {
            if (shardNum >= shards.size()) {
                logger.debug("View {}: all {} shards queried, {} rows", d.getView(), shards.size(), d.totalQueried);
                d.succeed();
                return;
            }
            String shard = shards.get(shardNum);
            boolean lastShard = shardNum == shards.size() - 1;
            Integer limit = limitWithLastKey(d.isChunked(), d.getPageSize(), d.getChunkSize(), d.totalQueried);
            JsonNode previousKey = d.lastKey;
            JsonNode startKey = previousKey != null ? previousKey : d.getStartKey().orElse(null);
            StoreQueryOptions options = d.getStoreOptions().forRound(startKey, limit);
            logger.debug("Querying view {} on {} startkey {} page size {} limit {} direction {}",
                    d.getView(), shard, startKey, d.getPageSize(), limit, d.getDirection());

            ViewQueryResult result;
            try {
                result = store.query(shard, d.getView(), options);
            } catch (RuntimeException e) {
                logger.error("Store failure on {} view {}: {}", shard, d.getView(), e.getMessage());
                d.fail(LoadError.dataStore(String.valueOf(e.getMessage()), d.getView(), shard));
                return;
            }

            if (result.status == ViewQueryResult.Status.NOT_FOUND) {
                if (lastShard) {
                    logger.debug("View {} missing on last shard {}", d.getView(), shard);
                    d.fail(LoadError.missingResource(d.getView(), shard));
                    return;
                }
                logger.debug("View {} missing on {}, moving on", d.getView(), shard);
                d.lastKey = null;
                shardNum++;
                continue;
            } else if (result.status == ViewQueryResult.Status.ERROR) {
                logger.error("Querying view {} on {} failed: {}", d.getView(), shard, result.reason);
                d.fail(LoadError.dataStore(result.reason, d.getView(), shard));
                return;
            }

            Pair<List<JsonNode>, JsonNode> page;
            int accepted;
            try {
                page = lastKey(limit, result.rows, previousKey);
                accepted = ResultPipeline.process(d, page.getValue0(), shard);
            } catch (IOException | RuntimeException e) {
                logger.error("Processing results of view {} on {} failed: {}", d.getView(), shard, e.getMessage());
                d.fail(LoadError.systemFault("datastore_fault", String.valueOf(e.getMessage())));
                return;
            }
            if (accepted == ResultPipeline.STOP) {
                d.lastKey = null;
                return;
            }
            if (d.getPageSize() != null && (long) d.totalQueried + accepted > d.getPageSize()) {
                logger.error("View {} on {} returned {} rows with {} of {} already queried",
                        d.getView(), shard, accepted, d.totalQueried, d.getPageSize());
                d.fail(LoadError.systemFault("datastore_fault", "page size exceeded"));
                return;
            }

            JsonNode nextKey = page.getValue1();
            Continuation next = decide(d.getPageSize(), d.totalQueried, accepted, nextKey, previousKey);
            d.totalQueried += accepted;
            logger.debug("View {} on {}: {} rows accepted, {} total, next key {}, {}",
                    d.getView(), shard, accepted, d.totalQueried, nextKey, next);
            switch (next) {
                case EXHAUSTED:
                    d.lastKey = nextKey;
                    d.succeed();
                    return;
                case SAME_SHARD:
                    d.lastKey = nextKey;
                    break;
                case NEXT_SHARD:
                default:
                    d.lastKey = null;
                    shardNum++;
                    break;
            }
        }
    }

    /*
     * ROUND HELPERS
     */

    /**
     * Store limit for the next round: one more than the rows still wanted, so the extra row tells
     * whether more data follows.  Null means unlimited.  Clamped to {@code Integer.MAX_VALUE}.
     */
    public static Integer limitWithLastKey(boolean chunked, Integer pageSize, int chunkSize, int totalQueried) {
        long limit;
        if (!chunked) {
            if (pageSize == null) {
                return null;
            }
            limit = 1L + pageSize - totalQueried;
        } else if (pageSize == null) {
            limit = 1L + chunkSize;
        } else if (chunkSize == pageSize) {
            limit = 1L + pageSize - totalQueried;
        } else if (chunkSize < (long) pageSize - totalQueried) {
            limit = 1L + chunkSize;
        } else {
            limit = 1L + pageSize - totalQueried;
        }
        return (int) Math.min(limit, Integer.MAX_VALUE);
    }

    /**
     * Split a batch into the rows to return and the next cursor.  A full batch ends in the sentinel
     * row, which is dropped and whose key becomes the cursor.  An empty batch keeps the previous
     * cursor; a short batch has none.
     */
    public static Pair<List<JsonNode>, JsonNode> lastKey(Integer limit, List<JsonNode> rows, JsonNode previousKey) {
        if (rows.isEmpty()) {
            return new Pair<>(rows, previousKey);
        } else if (limit == null || rows.size() < limit) {
            return new Pair<>(rows, null);
        } else if (rows.size() > limit) {
            throw new IllegalStateException(String.format("store returned %d rows for limit %d", rows.size(), limit));
        }
        JsonNode sentinel = rows.get(rows.size() - 1);
        return new Pair<>(rows.subList(0, rows.size() - 1), sentinel.get("key"));
    }

    public static Continuation decide(Integer pageSize, int totalQueried, int accepted,
                                      JsonNode nextKey, JsonNode previousKey) {
        if (pageSize != null && totalQueried + accepted == pageSize && nextKey != null) {
            return Continuation.EXHAUSTED;
        } else if (nextKey != null && !nextKey.equals(previousKey)) {
            return Continuation.SAME_SHARD;
        }
        return Continuation.NEXT_SHARD;
    }
}
