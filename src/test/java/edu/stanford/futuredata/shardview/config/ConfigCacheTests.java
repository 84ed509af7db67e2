package edu.stanford.futuredata.shardview.config;

import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.stanford.futuredata.shardview.broker.LoadParamsBuilder;
import edu.stanford.futuredata.shardview.viewmockinterface.ViewRows;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigCacheTests {

    private static final Logger logger = LoggerFactory.getLogger(ConfigCacheTests.class);

    static class MemoryCatalog implements ConfigCatalog {
        final Map<String, ObjectNode> documents = new HashMap<>();
        int fetches = 0;
        boolean failWrites = false;

        @Override
        public Optional<ObjectNode> fetchCategory(String category) {
            fetches++;
            return Optional.ofNullable(documents.get(category)).map(ObjectNode::deepCopy);
        }

        @Override
        public boolean storeCategory(String category, ObjectNode document) {
            if (failWrites) {
                return false;
            }
            documents.put(category, document.deepCopy());
            return true;
        }
    }

    @Test
    public void testBundledDefaults() {
        logger.info("testBundledDefaults");
        ConfigCache config = new ConfigCache("node1");
        assertEquals(50, config.getPositiveInt("crossbar", LoadParamsBuilder.PAGE_SIZE_KEY, 1));
        assertEquals(2682000, config.getPositiveInt("crossbar", "maximum_range", 1));
        assertEquals(9, config.getPositiveInt("crossbar", "unknown_key", 9));
        assertEquals(9, config.getPositiveInt("no_such_category", "page_size", 9));
    }

    @Test
    public void testNodeSectionWins() {
        logger.info("testNodeSectionWins");
        assertEquals(7, new ConfigCache("node1").getPositiveInt("testing", "page_size", 1));
        assertEquals(20, new ConfigCache("node2").getPositiveInt("testing", "page_size", 1));
        assertEquals("bundled", new ConfigCache("node1").getString("testing", "name", "x"));
    }

    @Test
    public void testCatalogBeforeBundled() {
        logger.info("testCatalogBeforeBundled");
        MemoryCatalog catalog = new MemoryCatalog();
        catalog.documents.put("crossbar", (ObjectNode) ViewRows.json("{\"default\":{\"pagination_page_size\":30}}"));
        ConfigCache config = new ConfigCache("node1", catalog);
        assertEquals(30, config.getPositiveInt("crossbar", LoadParamsBuilder.PAGE_SIZE_KEY, 1));
        assertEquals(30, config.getPositiveInt("crossbar", LoadParamsBuilder.PAGE_SIZE_KEY, 1));
        assertEquals(1, catalog.fetches);
    }

    @Test
    public void testNonPositiveValuesFallBack() {
        logger.info("testNonPositiveValuesFallBack");
        MemoryCatalog catalog = new MemoryCatalog();
        catalog.documents.put("c", (ObjectNode) ViewRows.json(
                "{\"default\":{\"zero\":0,\"negative\":-4,\"text\":\"12\",\"junk\":\"abc\",\"fraction\":1.5}}"));
        ConfigCache config = new ConfigCache("node1", catalog);
        assertEquals(3, config.getPositiveInt("c", "zero", 3));
        assertEquals(3, config.getPositiveInt("c", "negative", 3));
        assertEquals(12, config.getPositiveInt("c", "text", 3));
        assertEquals(3, config.getPositiveInt("c", "junk", 3));
        assertEquals(3, config.getPositiveInt("c", "fraction", 3));
    }

    @Test
    public void testSetAndFlush() {
        logger.info("testSetAndFlush");
        MemoryCatalog catalog = new MemoryCatalog();
        ConfigCache config = new ConfigCache("node1", catalog);
        assertTrue(config.set("crossbar", LoadParamsBuilder.PAGE_SIZE_KEY, 11));
        assertEquals(11, config.getPositiveInt("crossbar", LoadParamsBuilder.PAGE_SIZE_KEY, 1));
        // Bundled defaults were carried into the stored document.
        assertEquals(50, catalog.documents.get("crossbar").get("default").get("load_view_chunk_size").asInt());
        assertEquals(11, catalog.documents.get("crossbar").get("node1").get("pagination_page_size").asInt());

        assertTrue(config.setDefault("crossbar", "maximum_range", 100));
        assertEquals(100, new ConfigCache("node2", catalog).getPositiveInt("crossbar", "maximum_range", 1));

        ((ObjectNode) catalog.documents.get("crossbar").get("node1")).put("pagination_page_size", 12);
        assertEquals(11, config.getPositiveInt("crossbar", LoadParamsBuilder.PAGE_SIZE_KEY, 1));
        config.flush("crossbar");
        assertEquals(12, config.getPositiveInt("crossbar", LoadParamsBuilder.PAGE_SIZE_KEY, 1));

        assertTrue(config.importCategory("crossbar"));
        assertEquals(50, config.getPositiveInt("crossbar", LoadParamsBuilder.PAGE_SIZE_KEY, 1));
        config.flush();
        assertEquals(12, config.getPositiveInt("crossbar", LoadParamsBuilder.PAGE_SIZE_KEY, 1));
        assertFalse(config.importCategory("no_such_category"));
    }

    @Test
    public void testFailedWriteKeepsOldValue() {
        logger.info("testFailedWriteKeepsOldValue");
        MemoryCatalog catalog = new MemoryCatalog();
        catalog.failWrites = true;
        ConfigCache config = new ConfigCache("node1", catalog);
        assertFalse(config.set("crossbar", LoadParamsBuilder.PAGE_SIZE_KEY, 11));
        assertEquals(50, config.getPositiveInt("crossbar", LoadParamsBuilder.PAGE_SIZE_KEY, 1));
    }
}
