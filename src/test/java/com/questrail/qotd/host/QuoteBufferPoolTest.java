package com.questrail.qotd.host;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class QuoteBufferPoolTest {

    @Test
    void rentAllocatesBuffersOfTheCurrentBound() {
        QuoteBufferPool pool = new QuoteBufferPool(512, 4);

        assertEquals(512, pool.rent().length);
        assertEquals(0, pool.pooledCount());
    }

    @Test
    void releasedBufferIsReusedLastInFirstOut() {
        QuoteBufferPool pool = new QuoteBufferPool(16, 4);
        byte[] a = pool.rent();
        byte[] b = pool.rent();

        pool.release(a);
        pool.release(b);

        assertEquals(2, pool.pooledCount());
        assertSame(b, pool.rent());
        assertSame(a, pool.rent());
        assertEquals(0, pool.pooledCount());
    }

    @Test
    void releaseBeyondCapacityDropsTheBuffer() {
        QuoteBufferPool pool = new QuoteBufferPool(16, 1);

        pool.release(pool.rent());
        pool.release(new byte[16]);

        assertEquals(1, pool.pooledCount());
    }

    @Test
    void changingTheBoundClearsThePoolAndDiscardsStaleBuffers() {
        QuoteBufferPool pool = new QuoteBufferPool(16, 4);
        byte[] stale = pool.rent();
        pool.release(pool.rent());
        assertEquals(1, pool.pooledCount());

        pool.setMaximumQuoteLength(32);
        assertEquals(0, pool.pooledCount());

        // Rented under the old bound, must never be handed out again
        pool.release(stale);
        assertEquals(0, pool.pooledCount());
        assertEquals(32, pool.rent().length);
    }

    @Test
    void settingTheSameBoundKeepsPooledBuffers() {
        QuoteBufferPool pool = new QuoteBufferPool(16, 4);
        pool.release(pool.rent());

        pool.setMaximumQuoteLength(16);

        assertEquals(1, pool.pooledCount());
    }

    @Test
    void loweringPooledCountTrimsThePool() {
        QuoteBufferPool pool = new QuoteBufferPool(8, 4);
        for (int i = 0; i < 4; i++) {
            pool.release(new byte[8]);
        }
        assertEquals(4, pool.pooledCount());

        pool.setMaximumPooledBuffers(1);

        assertEquals(1, pool.pooledCount());
        assertEquals(1, pool.maximumPooledBuffers());
    }

    @Test
    void zeroPooledBuffersDisablesPooling() {
        QuoteBufferPool pool = new QuoteBufferPool(8, 0);
        pool.release(pool.rent());

        assertEquals(0, pool.pooledCount());
    }

    @Test
    void releasingNullIsIgnored() {
        QuoteBufferPool pool = new QuoteBufferPool(8, 2);
        pool.release(null);

        assertEquals(0, pool.pooledCount());
    }

    @Test
    void boundsAreValidated() {
        assertThrows(IllegalArgumentException.class, () -> new QuoteBufferPool(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new QuoteBufferPool(65536, 1));
        assertThrows(IllegalArgumentException.class, () -> new QuoteBufferPool(8, -1));

        QuoteBufferPool pool = new QuoteBufferPool(65535, 1);
        assertThrows(IllegalArgumentException.class, () -> pool.setMaximumQuoteLength(-5));
        assertThrows(IllegalArgumentException.class, () -> pool.setMaximumPooledBuffers(-1));
        assertEquals(65535, pool.maximumQuoteLength());
    }

    @Test
    void rentOfTheCurrentBoundIsServedFromThePool() {
        QuoteBufferPool pool = new QuoteBufferPool(16, 4);
        byte[] pooled = pool.rent();
        pool.release(pooled);

        assertSame(pooled, pool.rent(16));
    }

    @Test
    void rentOfAnEarlierBoundAllocatesAndIsNotPooled() {
        QuoteBufferPool pool = new QuoteBufferPool(16, 4);
        pool.release(pool.rent());

        byte[] captured = pool.rent(64);

        assertEquals(64, captured.length);
        assertEquals(1, pool.pooledCount());
        pool.release(captured);
        assertEquals(1, pool.pooledCount());
        assertThrows(IllegalArgumentException.class, () -> pool.rent(0));
    }

    @Test
    void concurrentRentersNeverAllocateMoreBuffersThanThereAreRenters() throws Exception {
        int renters = 4;
        QuoteBufferPool pool = new QuoteBufferPool(16, renters);

        Set<byte[]> before = rentConcurrently(pool, renters);
        assertTrue(before.size() <= renters, "allocated " + before.size() + " buffers for " + renters + " renters");

        pool.setMaximumQuoteLength(32);
        Set<byte[]> after = rentConcurrently(pool, renters);

        assertTrue(after.size() <= renters, "allocated " + after.size() + " buffers for " + renters + " renters");
        for (byte[] buffer : after) {
            assertEquals(32, buffer.length);
            assertFalse(before.contains(buffer), "buffer from the old bound was rented again");
        }
    }

    private static Set<byte[]> rentConcurrently(QuoteBufferPool pool, int renters) throws Exception {
        Set<byte[]> seen = Collections.synchronizedSet(Collections.newSetFromMap(new IdentityHashMap<>()));
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(renters);
        try {
            Future<?>[] loops = new Future<?>[renters];
            for (int i = 0; i < renters; i++) {
                loops[i] = executor.submit(() -> {
                    go.await();
                    for (int round = 0; round < 2_000; round++) {
                        byte[] buffer = pool.rent();
                        seen.add(buffer);
                        buffer[0]++;
                        pool.release(buffer);
                    }
                    return null;
                });
            }
            go.countDown();
            for (Future<?> loop : loops) {
                loop.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        return seen;
    }
}
