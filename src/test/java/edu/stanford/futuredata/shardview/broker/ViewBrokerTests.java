package edu.stanford.futuredata.shardview.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.stanford.futuredata.shardview.datastore.LocalViewStore;
import edu.stanford.futuredata.shardview.datastore.MonthlyShardResolver;
import edu.stanford.futuredata.shardview.interfaces.RowMapper;
import edu.stanford.futuredata.shardview.utilities.*;
import edu.stanford.futuredata.shardview.viewmockinterface.FixedConfig;
import edu.stanford.futuredata.shardview.viewmockinterface.ViewRows;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ViewBrokerTests {

    private static final Logger logger = LoggerFactory.getLogger(ViewBrokerTests.class);

    private static final String VIEW = "cdrs/listing_by_timestamp";
    // 2024-01-20T00:00:00Z and 2024-02-10T00:00:00Z
    private static final long JAN_20 = 1_705_708_800L;
    private static final long FEB_10 = 1_707_523_200L;
    private static final long DAY = 86_400L;

    private LocalViewStore store;
    private ViewBroker broker;

    @BeforeEach
    public void setUp() {
        store = new LocalViewStore();
        broker = new ViewBroker(store, new FixedConfig(), new MonthlyShardResolver(),
                Clock.fixed(Instant.ofEpochSecond(FEB_10), ZoneOffset.UTC));
        // One record per day from Jan 15 to Feb 14, in the month's shard.
        for (long t = JAN_20 - 5 * DAY; t < FEB_10 + 5 * DAY; t += DAY) {
            String shard = t < 1_706_745_600L ? "account/a1-202401" : "account/a1-202402";
            store.addRow(shard, VIEW, t, "cdr-" + t, t, null);
        }
        store.addRow("account/a1", "users/crossbar_listing", "alice", "u1", "Alice", null);
        store.addRow("account/a1", "users/crossbar_listing", "bob", "u2", "Bob", null);
        store.addRow("account/a1", "users/crossbar_listing", "carol", "u3", "Carol", null);
    }

    private static List<Long> keys(List<JsonNode> rows) {
        List<Long> keys = new ArrayList<>();
        rows.forEach(r -> keys.add(r.get("key").asLong()));
        return keys;
    }

    @Test
    public void testLoadAccountShard() {
        logger.info("testLoadAccountShard");
        ViewRequest request = ViewRequest.builder().accountId("a1").pageSize(2).build();
        ViewResponse response = broker.load(request, "users/crossbar_listing");
        assertTrue(response.isSuccess());
        assertFalse(response.isChunked());
        assertEquals(List.of("u1", "u2"), ViewRows.ids(response.getData()));

        ObjectNode body = response.toJson();
        assertEquals("success", body.get("status").asText());
        assertEquals(2, body.get("page_size").asInt());
        assertEquals("carol", body.get("next_start_key").asText());
        assertFalse(body.has("start_key"));
        assertEquals(2, body.get("data").size());
    }

    @Test
    public void testLoadWithMapper() {
        logger.info("testLoadWithMapper");
        ViewRequest request = ViewRequest.builder().accountId("a1").paginate(false).build();
        ViewResponse response = broker.load(request, "users/crossbar_listing",
                new ViewOptions().set(ViewOptions.MAPPER, RowMapper.values()));
        List<String> names = new ArrayList<>();
        response.getData().forEach(v -> names.add(v.asText()));
        assertEquals(List.of("Alice", "Bob", "Carol"), names);
        assertFalse(response.toJson().has("next_start_key"));
    }

    @Test
    public void testLoadPartitionedAcrossMonths() {
        logger.info("testLoadPartitionedAcrossMonths");
        ViewRequest request = ViewRequest.builder().accountId("a1").paginate(false)
                .requestValue("created_from", JAN_20).requestValue("created_to", FEB_10).build();
        ViewResponse response = broker.loadPartitioned(request, VIEW);
        assertTrue(response.isSuccess());
        List<Long> keys = keys(response.getData());
        assertEquals(22, keys.size());
        assertEquals(JAN_20, keys.get(0));
        assertEquals(FEB_10, keys.get(keys.size() - 1));
        for (int i = 1; i < keys.size(); i++) {
            assertTrue(keys.get(i - 1) < keys.get(i));
        }
    }

    @Test
    public void testLoadPartitionedDescendingPages() {
        logger.info("testLoadPartitionedDescendingPages");
        ViewRequest request = ViewRequest.builder().accountId("a1").pageSize(5)
                .requestValue("created_from", JAN_20).requestValue("created_to", FEB_10)
                .requestValue("descending", true).build();
        ViewResponse response = broker.loadPartitioned(request, VIEW);
        assertEquals(List.of(FEB_10, FEB_10 - DAY, FEB_10 - 2 * DAY, FEB_10 - 3 * DAY, FEB_10 - 4 * DAY),
                keys(response.getData()));
        assertEquals(FEB_10 - 5 * DAY, response.getEnvelope().get("next_start_key").asLong());
        assertEquals(FEB_10, response.getEnvelope().get("start_key").asLong());
    }

    @Test
    public void testLoadRangeDefaultsToNow() {
        logger.info("testLoadRangeDefaultsToNow");
        ViewRequest request = ViewRequest.builder().accountId("a1").paginate(false)
                .requestValue("created_from", FEB_10 - 2 * DAY).build();
        ViewResponse response = broker.loadRange(request, VIEW,
                new ViewOptions().set(ViewOptions.DATABASES, "account/a1-202402"));
        assertEquals(List.of(FEB_10 - 2 * DAY, FEB_10 - DAY, FEB_10), keys(response.getData()));
    }

    @Test
    public void testValidationFailureIsResponse() {
        logger.info("testValidationFailureIsResponse");
        ViewRequest request = ViewRequest.builder().accountId("a1")
                .requestValue("created_from", FEB_10).requestValue("created_to", JAN_20).build();
        ViewResponse response = broker.loadPartitioned(request, VIEW);
        assertEquals(ViewResponse.Status.ERROR, response.getStatus());
        assertEquals(LoadError.Kind.VALIDATION, response.getError().get().kind);
        ObjectNode envelope = response.getEnvelope();
        assertEquals("error", envelope.get("status").asText());
        assertEquals("date_range", envelope.get("error").asText());
        assertEquals(400, envelope.get("error_code").asInt());
        assertEquals("created_from", envelope.get("field").asText());
        assertTrue(response.getData().isEmpty());
    }

    @Test
    public void testMissingViewIsNotFound() {
        logger.info("testMissingViewIsNotFound");
        ViewResponse response = broker.load(ViewRequest.builder().accountId("a1").build(), "no/such_view");
        assertEquals(LoadError.Kind.NOT_FOUND, response.getError().get().kind);
        assertEquals(404, response.getEnvelope().get("error_code").asInt());
    }

    @Test
    public void testNoAccountIsNoTarget() {
        logger.info("testNoAccountIsNoTarget");
        ViewResponse response = broker.load(ViewRequest.builder().build(), VIEW);
        assertEquals("no_target", response.getError().get().code);
    }
}
