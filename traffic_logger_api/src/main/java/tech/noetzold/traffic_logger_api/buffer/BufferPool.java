package tech.noetzold.traffic_logger_api.buffer;

/**
 * Shared pool of byte arrays used to capture request bodies.
 * Implementations must allow concurrent {@link #lease} and {@link #release} calls.
 */
public interface BufferPool {

    /**
     * Leases an array of at least {@code size} bytes. The caller owns it until
     * the returned {@link PooledBuffer} is closed. Its content is not zeroed.
     */
    PooledBuffer lease(int size);

    /**
     * Hands an array back to the pool. The caller must not touch it afterwards.
     */
    void release(byte[] buffer);
}
