package edu.stanford.futuredata.shardview.datastore;

import com.fasterxml.jackson.databind.JsonNode;
import edu.stanford.futuredata.shardview.viewmockinterface.ViewRows;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class KeyCollatorTests {

    private static final Logger logger = LoggerFactory.getLogger(KeyCollatorTests.class);

    @Test
    public void testTypeOrder() {
        logger.info("testTypeOrder");
        List<JsonNode> expected = List.of(
                ViewRows.json("null"), ViewRows.json("false"), ViewRows.json("true"),
                ViewRows.json("-1"), ViewRows.json("2.5"), ViewRows.json("10"),
                ViewRows.json("\"A\""), ViewRows.json("\"a\""), ViewRows.json("\"b\""),
                ViewRows.json("[]"), ViewRows.json("[1]"), ViewRows.json("[1,\"a\"]"), ViewRows.json("[2]"),
                ViewRows.json("{}"), ViewRows.json("{\"a\":1}"));
        List<JsonNode> shuffled = new ArrayList<>(expected);
        Collections.reverse(shuffled);
        shuffled.sort(KeyCollator.INSTANCE);
        assertEquals(expected, shuffled);
    }

    @Test
    public void testNumbersCompareByValue() {
        logger.info("testNumbersCompareByValue");
        assertEquals(0, KeyCollator.INSTANCE.compare(ViewRows.json("1"), ViewRows.json("1.0")));
        assertTrue(KeyCollator.INSTANCE.compare(ViewRows.json("9"), ViewRows.json("10")) < 0);
        assertTrue(KeyCollator.INSTANCE.compare(null, ViewRows.json("0")) < 0);
    }
}
