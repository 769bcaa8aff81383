package com.ryuqq.sortedfeed.core.spi;

/**
 * Backing store or notification transport failure.
 *
 * <p>Fatal at this layer: never retried by the mutation engine and always propagated
 * to the caller. Recovery belongs to connection management.</p>
 *
 * @author SortedFeed Team
 * @since 1.0.0
 */
public class FeedStoreException extends RuntimeException {

    /**
     * Creates an exception with a message.
     *
     * @param message the detail message
     */
    public FeedStoreException(String message) {
        super(message);
    }

    /**
     * Creates an exception wrapping a transport failure.
     *
     * @param message the detail message
     * @param cause the underlying failure
     */
    public FeedStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
