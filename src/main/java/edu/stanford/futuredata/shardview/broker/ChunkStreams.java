package edu.stanford.futuredata.shardview.broker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import edu.stanford.futuredata.shardview.interfaces.ChunkTransport;
import edu.stanford.futuredata.shardview.utilities.ChunkFormat;
import edu.stanford.futuredata.shardview.utilities.Utilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wire helpers for chunked responses.  Public so chunked mappers that write for themselves
 * produce the same framing as the loader.
 */
public class ChunkStreams {
    private static final Logger logger = LoggerFactory.getLogger(ChunkStreams.class);

    public static final String JSON_OPEN = "{\"data\":[";
    public static final String CONTENT_TYPE = "content-type";
    public static final String CONTENT_DISPOSITION = "content-disposition";
    public static final String CSV_CONTENT_TYPE = "application/octet-stream";
    public static final String CSV_DISPOSITION = "attachment; filename=\"result.csv\"";

    /**
     * Open the chunked response.  JSON writes the opening of the envelope; CSV only sends the
     * download headers, the mapper writes its own header line.
     */
    public static void initChunkStream(ChunkTransport transport, ChunkFormat format) throws IOException {
        Map<String, String> headers = new LinkedHashMap<>(transport.responseHeaders());
        if (format == ChunkFormat.CSV) {
            headers.put(CONTENT_TYPE, CSV_CONTENT_TYPE);
            headers.put(CONTENT_DISPOSITION, CSV_DISPOSITION);
            transport.openChunked(headers);
        } else {
            transport.openChunked(headers);
            transport.writeChunk(Utilities.stringToByteString(JSON_OPEN));
        }
    }

    /**
     * Encode a batch of rows and send it as one chunk.  The first batch opens the stream, later
     * ones are comma-prefixed.  Empty batches send nothing; a batch that fails to encode is
     * logged and dropped.
     */
    public static void sendJsons(ChunkTransport transport, List<JsonNode> rows) throws IOException {
        if (rows.isEmpty()) {
            return;
        }
        String body;
        try {
            body = Utilities.encodeArrayBody(rows);
        } catch (JsonProcessingException e) {
            logger.error("Dropping batch of {} rows, encoding failed: {}", rows.size(), e.getMessage());
            return;
        }
        if (!transport.isChunkStarted()) {
            initChunkStream(transport, ChunkFormat.JSON);
            transport.writeChunk(Utilities.stringToByteString(body));
        } else {
            transport.writeChunk(Utilities.stringToByteString("," + body));
        }
    }

    public static void sendLines(ChunkTransport transport, List<String> lines) throws IOException {
        if (!transport.isChunkStarted()) {
            initChunkStream(transport, ChunkFormat.CSV);
        }
        if (!lines.isEmpty()) {
            transport.writeChunk(Utilities.stringToByteString(String.join("", lines)));
        }
    }

    // "]" then ",\"field\":value" for each non-empty envelope field, then "}".
    public static void closeJsonStream(ChunkTransport transport, Map<String, JsonNode> trailer) throws IOException {
        StringBuilder closing = new StringBuilder("]");
        for (Map.Entry<String, JsonNode> field: trailer.entrySet()) {
            if (field.getKey().equals("data") || Utilities.isEmpty(field.getValue())) {
                continue;
            }
            closing.append(',')
                    .append(Utilities.encode(Utilities.objectMapper.getNodeFactory().textNode(field.getKey())))
                    .append(':')
                    .append(Utilities.encode(field.getValue()));
        }
        closing.append('}');
        transport.writeChunk(Utilities.stringToByteString(closing.toString()));
    }
}
