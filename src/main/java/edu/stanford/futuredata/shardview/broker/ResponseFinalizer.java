package edu.stanford.futuredata.shardview.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.stanford.futuredata.shardview.utilities.ChunkFormat;
import edu.stanford.futuredata.shardview.utilities.LoadError;
import edu.stanford.futuredata.shardview.utilities.ViewRequest;
import edu.stanford.futuredata.shardview.utilities.ViewResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a folded descriptor into the caller's response: a buffered payload, or the closing
 * chunk of a streamed one.
 */
public class ResponseFinalizer {
    private static final Logger logger = LoggerFactory.getLogger(ResponseFinalizer.class);

    public static final String PAGE_SIZE = "page_size";
    public static final String NEXT_START_KEY = "next_start_key";

    static ViewResponse finish(QueryDescriptor d) {
        if (!d.isChunked()) {
            return buffered(d, d.getQueriedRows());
        } else if (!d.isStartedChunk()) {
            // Nothing went out, so the caller can still send an ordinary response.
            return buffered(d, List.of());
        } else if (d.getChunkFormat() == ChunkFormat.CSV) {
            return new ViewResponse(d.getStatus(), List.of(), envelope(d, true), d.getError().orElse(null),
                    true, d.getTransport());
        }
        ObjectNode envelope = envelope(d, true);
        try {
            ChunkStreams.closeJsonStream(d.getTransport(), fields(envelope));
        } catch (IOException e) {
            logger.warn("Closing chunked response of view {} failed: {}", d.getView(), e.getMessage());
            LoadError error = LoadError.systemFault("datastore_fault", String.valueOf(e.getMessage()));
            return new ViewResponse(ViewResponse.Status.ERROR, List.of(), envelope, error, true, d.getTransport());
        }
        if (d.getStatus() == ViewResponse.Status.ERROR) {
            logger.warn("Chunked response of view {} ended with {}", d.getView(), d.getError().orElse(null));
        }
        return new ViewResponse(d.getStatus(), List.of(), envelope, d.getError().orElse(null), true, d.getTransport());
    }

    private static ViewResponse buffered(QueryDescriptor d, List<JsonNode> rows) {
        ObjectNode envelope = envelope(d, !d.isChunked());
        if (d.getStatus() == ViewResponse.Status.ERROR) {
            return ViewResponse.failed(d.getError().get(), envelope, d.getTransport());
        }
        return new ViewResponse(ViewResponse.Status.SUCCESS, rows, envelope, null, false, d.getTransport());
    }

    private static ObjectNode envelope(QueryDescriptor d, boolean withPaging) {
        ObjectNode envelope = d.getRequest().getEnvelope();
        if (withPaging) {
            addPaging(envelope, d);
        } else {
            removePaging(envelope);
        }
        if (d.getStatus() == ViewResponse.Status.SUCCESS) {
            envelope.put("status", "success");
        } else if (d.isChunked() && d.isStartedChunk()) {
            envelope.put("status", "error");
            d.getError().ifPresent(error -> envelope.setAll(error.toJson()));
        }
        return envelope;
    }

    /**
     * Without a cursor the paging fields are removed; with one they carry the page's start key,
     * its size and the key to continue from.
     */
    public static void addPaging(ObjectNode envelope, QueryDescriptor d) {
        if (d.getLastKey().isEmpty()) {
            removePaging(envelope);
            return;
        }
        JsonNode startKey = d.getStartKey().orElse(null);
        if (startKey == null) {
            envelope.remove(ViewRequest.START_KEY);
        } else {
            envelope.set(ViewRequest.START_KEY, startKey);
        }
        envelope.put(PAGE_SIZE, d.getTotalQueried());
        envelope.set(NEXT_START_KEY, d.getLastKey().get());
    }

    private static void removePaging(ObjectNode envelope) {
        envelope.remove(List.of(ViewRequest.START_KEY, PAGE_SIZE, NEXT_START_KEY));
    }

    private static Map<String, JsonNode> fields(ObjectNode envelope) {
        Map<String, JsonNode> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = envelope.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            fields.put(field.getKey(), field.getValue());
        }
        return fields;
    }
}
