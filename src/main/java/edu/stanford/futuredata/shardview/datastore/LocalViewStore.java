package edu.stanford.futuredata.shardview.datastore;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.stanford.futuredata.shardview.interfaces.ViewStore;
import edu.stanford.futuredata.shardview.utilities.StoreQueryOptions;
import edu.stanford.futuredata.shardview.utilities.Utilities;
import edu.stanford.futuredata.shardview.utilities.ViewQueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory view store.  Each shard holds named views; each view is a list of rows kept sorted by
 * key (ties broken by id).  Bounds are inclusive and follow the query direction.
 */
public class LocalViewStore implements ViewStore {
    private static final Logger logger = LoggerFactory.getLogger(LocalViewStore.class);

    private static final Comparator<JsonNode> ROW_ORDER = Comparator
            .<JsonNode, JsonNode>comparing(row -> row.get("key"), KeyCollator.INSTANCE)
            .thenComparing(row -> row.path("id").asText());

    // Map from shard names to views to rows.
    private final Map<String, Map<String, List<JsonNode>>> shards = new ConcurrentHashMap<>();

    /*
     * LOADING
     */

    public void createShard(String shard) {
        shards.computeIfAbsent(shard, s -> new ConcurrentHashMap<>());
    }

    public void addRow(String shard, String view, Object key, String id, Object value, Object doc) {
        ObjectNode row = Utilities.objectMapper.createObjectNode();
        row.put("id", id);
        row.set("key", Utilities.toJson(key));
        row.set("value", Utilities.toJson(value));
        if (doc != null) {
            row.set("doc", Utilities.toJson(doc));
        }
        addRows(shard, view, List.of(row));
    }

    // Rows need a "key"; they are merged into the view in collation order.
    public void addRows(String shard, String view, List<JsonNode> rows) {
        Map<String, List<JsonNode>> views = shards.computeIfAbsent(shard, s -> new ConcurrentHashMap<>());
        views.compute(view, (v, existing) -> {
            List<JsonNode> merged = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            for (JsonNode row: rows) {
                assert(row.has("key"));
                merged.add(row.deepCopy());
            }
            merged.sort(ROW_ORDER);
            return Collections.unmodifiableList(merged);
        });
    }

    // A shard document maps view names to arrays of rows.
    public void loadShard(String shard, JsonNode document) {
        createShard(shard);
        Iterator<Map.Entry<String, JsonNode>> it = document.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> view = it.next();
            List<JsonNode> rows = new ArrayList<>();
            view.getValue().forEach(rows::add);
            addRows(shard, view.getKey(), rows);
        }
        logger.info("Loaded shard {} with {} views", shard, document.size());
    }

    public void dropShard(String shard) {
        shards.remove(shard);
    }

    public Set<String> getShards() {
        return Collections.unmodifiableSet(shards.keySet());
    }

    /*
     * QUERIES
     */

    @Override
    public ViewQueryResult query(String shard, String view, StoreQueryOptions options) {
        Map<String, List<JsonNode>> views = shards.get(shard);
        if (views == null) {
            return ViewQueryResult.notFound();
        }
        List<JsonNode> rows = views.get(view);
        if (rows == null) {
            return ViewQueryResult.notFound();
        }
        if (options.getExtra("reduce").map(r -> Utilities.isTrue(Utilities.toJson(r))).orElse(false)) {
            return ViewQueryResult.error("reduce_unsupported");
        }
        List<JsonNode> ordered = new ArrayList<>(rows);
        if (options.descending) {
            Collections.reverse(ordered);
        }
        List<JsonNode> result = new ArrayList<>();
        for (JsonNode row: ordered) {
            if (options.limit != null && result.size() >= options.limit) {
                break;
            }
            if (!inRange(row.get("key"), options)) {
                continue;
            }
            if (!options.includeDocs && row.has("doc")) {
                ObjectNode copy = row.deepCopy();
                copy.remove("doc");
                result.add(copy);
            } else {
                result.add(row);
            }
        }
        logger.debug("Shard {} view {} returned {} rows for {}", shard, view, result.size(), options);
        return ViewQueryResult.ok(result);
    }

    // Start and end are inclusive and given in iteration order.
    private static boolean inRange(JsonNode key, StoreQueryOptions options) {
        int sign = options.descending ? -1 : 1;
        if (options.startKey != null && sign * KeyCollator.INSTANCE.compare(key, options.startKey) < 0) {
            return false;
        }
        return options.endKey == null || sign * KeyCollator.INSTANCE.compare(key, options.endKey) <= 0;
    }
}
