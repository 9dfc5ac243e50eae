package com.tokenwatch.indexer.modules.chain.rpc;

/**
 * Thrown when a chain RPC call fails (HTTP, I/O or JSON-RPC error).
 * Transient failures are retried by {@link com.tokenwatch.indexer.util.RetryPolicy}.
 */
public class RpcException extends RuntimeException {

    private final boolean transientFailure;

    public RpcException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public RpcException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
