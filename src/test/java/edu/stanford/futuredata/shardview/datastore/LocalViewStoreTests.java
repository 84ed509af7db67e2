package edu.stanford.futuredata.shardview.datastore;

import com.fasterxml.jackson.databind.JsonNode;
import edu.stanford.futuredata.shardview.utilities.StoreQueryOptions;
import edu.stanford.futuredata.shardview.utilities.ViewQueryResult;
import edu.stanford.futuredata.shardview.viewmockinterface.ViewRows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class LocalViewStoreTests {

    private static final Logger logger = LoggerFactory.getLogger(LocalViewStoreTests.class);

    private LocalViewStore store;

    @BeforeEach
    public void setUp() {
        store = new LocalViewStore();
        for (int i = 5; i >= 1; i--) {
            store.addRow("s", "v", i, "id" + i, i * 10, ViewRows.json("{\"n\":" + i + "}"));
        }
    }

    private static StoreQueryOptions options(Integer start, Integer end, Integer limit, boolean descending,
                                             boolean includeDocs) {
        return new StoreQueryOptions(start == null ? null : ViewRows.json(start.toString()),
                end == null ? null : ViewRows.json(end.toString()), limit, descending, includeDocs, Map.of());
    }

    private static List<String> ids(ViewQueryResult result) {
        assertEquals(ViewQueryResult.Status.OK, result.status);
        return ViewRows.ids(result.rows);
    }

    @Test
    public void testInclusiveBounds() {
        logger.info("testInclusiveBounds");
        assertEquals(List.of("id2", "id3", "id4"), ids(store.query("s", "v", options(2, 4, null, false, false))));
        assertEquals(List.of("id4", "id3", "id2"), ids(store.query("s", "v", options(4, 2, null, true, false))));
        assertEquals(List.of("id1", "id2"), ids(store.query("s", "v", options(null, null, 2, false, false))));
        assertEquals(List.of("id5", "id4"), ids(store.query("s", "v", options(null, null, 2, true, false))));
    }

    @Test
    public void testIncludeDocs() {
        logger.info("testIncludeDocs");
        List<JsonNode> without = store.query("s", "v", options(1, 1, null, false, false)).rows;
        assertFalse(without.get(0).has("doc"));
        List<JsonNode> with = store.query("s", "v", options(1, 1, null, false, true)).rows;
        assertEquals(1, with.get(0).get("doc").get("n").asInt());
    }

    @Test
    public void testMissingShardOrView() {
        logger.info("testMissingShardOrView");
        assertEquals(ViewQueryResult.Status.NOT_FOUND, store.query("nope", "v", options(null, null, null, false, false)).status);
        assertEquals(ViewQueryResult.Status.NOT_FOUND, store.query("s", "nope", options(null, null, null, false, false)).status);
    }

    @Test
    public void testReduceUnsupported() {
        logger.info("testReduceUnsupported");
        StoreQueryOptions reduce = new StoreQueryOptions(null, null, null, false, false, Map.of("reduce", true));
        ViewQueryResult result = store.query("s", "v", reduce);
        assertEquals(ViewQueryResult.Status.ERROR, result.status);
        assertEquals("reduce_unsupported", result.reason);
    }

    @Test
    public void testLoadShardDocument() {
        logger.info("testLoadShardDocument");
        store.loadShard("account/x", ViewRows.json(
                "{\"users/by_name\":[{\"id\":\"u2\",\"key\":\"b\",\"value\":2},{\"id\":\"u1\",\"key\":\"a\",\"value\":1}]}"));
        assertEquals(List.of("u1", "u2"), ids(store.query("account/x", "users/by_name",
                options(null, null, null, false, false))));
        assertTrue(store.getShards().contains("account/x"));
        store.dropShard("account/x");
        assertFalse(store.getShards().contains("account/x"));
    }

    @Test
    public void testConcurrentWritesAndReads() throws InterruptedException {
        logger.info("testConcurrentWritesAndReads");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        for (int i = 100; i < 200; i++) {
            int key = i;
            pool.submit(() -> store.addRow("s", "v", key, "id" + key, key, null));
            pool.submit(() -> store.query("s", "v", options(null, null, null, false, false)));
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(105, store.query("s", "v", options(null, null, null, false, false)).rows.size());
    }
}
