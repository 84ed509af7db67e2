package edu.stanford.futuredata.shardview.interfaces;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.List;

/**
 * Per-batch hook for chunked responses.  Runs once per shard batch, after the row mapper, and
 * decides what goes out on the wire (see {@link ChunkedResult}).  Rows arrive in key order; keep
 * that order in whatever you return.
 *
 * <p>For CSV, write the header yourself ahead of the first row when
 * {@link ChunkTransport#isChunkStarted()} is still false.
 */
public final class ChunkedMapper {

    public interface BatchSender {
        ChunkedResult apply(ChunkTransport transport, List<JsonNode> rows) throws IOException;
    }

    public interface ShardBatchSender {
        ChunkedResult apply(ChunkTransport transport, List<JsonNode> rows, String shard) throws IOException;
    }

    private final BatchSender batchSender;
    private final ShardBatchSender shardBatchSender;

    private ChunkedMapper(BatchSender batchSender, ShardBatchSender shardBatchSender) {
        this.batchSender = batchSender;
        this.shardBatchSender = shardBatchSender;
    }

    public static ChunkedMapper of(BatchSender sender) {
        return new ChunkedMapper(sender, null);
    }

    // Mapper that also wants to know which shard the batch came from.
    public static ChunkedMapper withShard(ShardBatchSender sender) {
        return new ChunkedMapper(null, sender);
    }

    public ChunkedResult apply(ChunkTransport transport, List<JsonNode> rows, String shard) throws IOException {
        if (shardBatchSender != null) {
            return shardBatchSender.apply(transport, rows, shard);
        }
        return batchSender.apply(transport, rows);
    }
}
