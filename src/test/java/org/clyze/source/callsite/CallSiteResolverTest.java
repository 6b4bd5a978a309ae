package org.clyze.source.callsite;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.clyze.source.callsite.fixtures.JavaCalls;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CallSiteResolverTest {
    private static final int THREADS = 6;

    /** Concurrent first resolutions must all see the same file and node. */
    @Test
    void concurrentFirstResolution() throws Exception {
        ExecutionPosition position = JavaCalls.simple().getPosition();
        CallSiteResolver resolver = new CallSiteResolver();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        try {
            List<Future<CallSite>> futures = new ArrayList<>();
            for (int i = 0; i < THREADS; i++)
                futures.add(pool.submit(() -> {
                    start.await();
                    return resolver.resolveCallSite(position);
                }));
            start.countDown();
            CallSite first = futures.get(0).get();
            assertEquals("Probe.here()", first.getCallSource());
            for (Future<CallSite> future : futures) {
                CallSite site = future.get();
                assertSame(first.getSourceFile(), site.getSourceFile());
                assertSame(first.getCall(), site.getCall());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
