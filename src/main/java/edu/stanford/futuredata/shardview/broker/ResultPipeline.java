package edu.stanford.futuredata.shardview.broker;

import com.fasterxml.jackson.databind.JsonNode;
import edu.stanford.futuredata.shardview.interfaces.ChunkTransport;
import edu.stanford.futuredata.shardview.interfaces.ChunkedResult;
import edu.stanford.futuredata.shardview.interfaces.RowMapper;
import edu.stanford.futuredata.shardview.utilities.ChunkFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Runs one shard batch through the mapper and then either buffers it on the descriptor or
 * writes it out as chunks.
 */
class ResultPipeline {
    private static final Logger logger = LoggerFactory.getLogger(ResultPipeline.class);

    // Returned instead of a row count when the chunked mapper asked to stop.
    static final int STOP = -1;

    /**
     * Process a batch (sentinel already stripped).  Returns how many rows were accepted into the
     * page, or {@link #STOP}.  Mapper and transport failures propagate to the fold.
     */
    static int process(QueryDescriptor d, List<JsonNode> rows, String shard) throws IOException {
        List<JsonNode> filtered = RowMapper.applyOrIdentity(d.getMapper(), d.getRequest(), rows);
        if (!d.isChunked()) {
            d.queriedRows.addAll(filtered);
            return filtered.size();
        }
        ChunkTransport transport = d.getTransport();
        ChunkedResult result = d.getChunkedMapper() == null
                ? ChunkedResult.rows(filtered)
                : d.getChunkedMapper().apply(transport, filtered, shard);
        if (transport.isChunkStarted()) {
            d.markChunkStarted();
        }
        switch (result.kind) {
            case STOP:
                logger.debug("Chunked mapper stopped the load of {} on {}", d.getView(), shard);
                if (result.error != null) {
                    d.fail(result.error);
                }
                return STOP;
            case SENT:
                return result.sentCount;
            case ROWS:
                if (d.getChunkFormat() != ChunkFormat.JSON) {
                    throw new IllegalStateException("chunked mapper returned rows for a "
                            + d.getChunkFormat() + " response");
                }
                ChunkStreams.sendJsons(transport, result.rows);
                if (transport.isChunkStarted()) {
                    d.markChunkStarted();
                }
                return result.rows.size();
            case LINES:
                if (d.getChunkFormat() != ChunkFormat.CSV) {
                    throw new IllegalStateException("chunked mapper returned lines for a "
                            + d.getChunkFormat() + " response");
                }
                ChunkStreams.sendLines(transport, result.lines);
                d.markChunkStarted();
                return result.sentCount;
            default:
                throw new IllegalStateException("unknown chunked result " + result.kind);
        }
    }
}
