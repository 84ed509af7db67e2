package edu.stanford.futuredata.shardview.utilities;

/**
 * Raised while building load parameters, before any shard is queried.
 */
public class LoadException extends Exception {
    public final LoadError error;

    public LoadException(LoadError error) {
        super(error.message);
        this.error = error;
    }

    public LoadException(LoadError error, Throwable cause) {
        super(error.message, cause);
        this.error = error;
    }
}
