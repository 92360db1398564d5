package tech.noetzold.traffic_logger_api.buffer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link BufferPool} with power-of-two size classes from {@value #MIN_SIZE} bytes
 * up to a configured maximum. Each class keeps a bounded number of idle arrays.
 * Leases above the maximum are served with fresh arrays that are never pooled.
 */
public class SizeClassedBufferPool implements BufferPool {

    private static final Logger logger = LoggerFactory.getLogger(SizeClassedBufferPool.class);

    static final int MIN_SIZE = 16;
    static final int MAX_CLASS_SIZE = 1 << 30;

    private final int maxPooledSize;
    private final int maxBuffersPerSize;
    private final Bucket[] buckets;

    public SizeClassedBufferPool(int maxPooledSize, int maxBuffersPerSize) {
        if (maxPooledSize < MIN_SIZE || maxPooledSize > MAX_CLASS_SIZE) {
            throw new IllegalArgumentException("maxPooledSize must be between " + MIN_SIZE
                    + " and " + MAX_CLASS_SIZE + ": " + maxPooledSize);
        }
        if (maxBuffersPerSize <= 0) {
            throw new IllegalArgumentException("maxBuffersPerSize must be positive: " + maxBuffersPerSize);
        }
        this.maxPooledSize = classSize(maxPooledSize);
        this.maxBuffersPerSize = maxBuffersPerSize;
        this.buckets = new Bucket[classIndex(this.maxPooledSize) + 1];
        for (int i = 0; i < buckets.length; i++) {
            buckets[i] = new Bucket(MIN_SIZE << i);
        }
        logger.debug("Buffer pool ready: {} size classes up to {} bytes, {} idle buffers per class",
                buckets.length, this.maxPooledSize, maxBuffersPerSize);
    }

    @Override
    public PooledBuffer lease(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
        if (size > maxPooledSize) {
            return new PooledBuffer(this, new byte[size]);
        }
        Bucket bucket = buckets[classIndex(classSize(size))];
        byte[] array = bucket.idle.poll();
        if (array == null) {
            array = new byte[bucket.size];
        } else {
            bucket.idleCount.decrementAndGet();
        }
        return new PooledBuffer(this, array);
    }

    @Override
    public void release(byte[] buffer) {
        if (buffer == null || buffer.length < MIN_SIZE || buffer.length > maxPooledSize
                || Integer.bitCount(buffer.length) != 1) {
            return;
        }
        Bucket bucket = buckets[classIndex(buffer.length)];
        // reserve a slot first so the idle queue never grows past the limit
        if (bucket.idleCount.incrementAndGet() > maxBuffersPerSize) {
            bucket.idleCount.decrementAndGet();
            return;
        }
        bucket.idle.offer(buffer);
    }

    /**
     * Number of idle arrays currently held for the size class serving {@code size}.
     */
    public int idleCount(int size) {
        if (size > maxPooledSize) {
            return 0;
        }
        return buckets[classIndex(classSize(size))].idleCount.get();
    }

    public int getMaxPooledSize() {
        return maxPooledSize;
    }

    static int classSize(int size) {
        if (size <= MIN_SIZE) {
            return MIN_SIZE;
        }
        int highest = Integer.highestOneBit(size);
        return highest == size ? size : highest << 1;
    }

    private static int classIndex(int classSize) {
        return Integer.numberOfTrailingZeros(classSize) - Integer.numberOfTrailingZeros(MIN_SIZE);
    }

    private static final class Bucket {
        private final int size;
        private final Queue<byte[]> idle = new ConcurrentLinkedQueue<>();
        private final AtomicInteger idleCount = new AtomicInteger();

        private Bucket(int size) {
            this.size = size;
        }
    }
}
