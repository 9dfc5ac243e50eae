package com.tokenwatch.indexer.modules.transfers.events;

/**
 * Thrown when a log cannot be decoded as an ERC-20 Transfer.
 */
public class TransferDecodingException extends RuntimeException {

    public TransferDecodingException(String message) {
        super(message);
    }

    public TransferDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
