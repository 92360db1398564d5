package tech.noetzold.traffic_logger_api.buffer;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A byte array leased from a {@link BufferPool}. Closing it returns the array
 * to the pool; only the first close has an effect.
 */
public final class PooledBuffer implements AutoCloseable {

    private final BufferPool pool;
    private final byte[] array;
    private final AtomicBoolean released = new AtomicBoolean();

    PooledBuffer(BufferPool pool, byte[] array) {
        this.pool = pool;
        this.array = array;
    }

    public byte[] array() {
        if (released.get()) {
            throw new IllegalStateException("Buffer already returned to the pool");
        }
        return array;
    }

    public int capacity() {
        return array.length;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            pool.release(array);
        }
    }
}
