package club.agentgate.scheduler;

import club.agentgate.interceptor.GateAdmissionInterceptor;
import club.agentgate.service.BlockList;
import club.agentgate.service.RateLimiter;
import club.agentgate.support.MutableClock;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IdentifierStateSweeperTest {

    @Test
    void expiredWindowsAndBlocksAreEvicted() {
        var clock = MutableClock.atEpochMillis(0);
        var rateLimiter = new RateLimiter(10, 1000, clock);
        var blockList = new BlockList(2000, clock);
        rateLimiter.check("a");
        rateLimiter.check("b");
        blockList.block("c", "manual");

        clock.setMillis(1500);
        var sweeper = new IdentifierStateSweeper(rateLimiter, blockList, mock(GateAdmissionInterceptor.class));
        sweeper.sweepExpiredEntries();
        assertEquals(0, rateLimiter.trackedIdentifiers());
        assertEquals(1, blockList.size());

        clock.setMillis(2500);
        sweeper.sweepExpiredEntries();
        assertEquals(0, blockList.size());
    }

    @Test
    void rejectionStreaksAreSweptToo() {
        var clock = MutableClock.atEpochMillis(0);
        var interceptor = mock(GateAdmissionInterceptor.class);
        when(interceptor.evictExpiredRejections()).thenReturn(2);

        new IdentifierStateSweeper(new RateLimiter(10, 1000, clock), new BlockList(1000, clock), interceptor)
                .sweepExpiredEntries();

        verify(interceptor).evictExpiredRejections();
    }

    @Test
    void failureIsContained() {
        var rateLimiter = mock(RateLimiter.class);
        var blockList = mock(BlockList.class);
        when(rateLimiter.evictExpired()).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> new IdentifierStateSweeper(rateLimiter, blockList,
                mock(GateAdmissionInterceptor.class)).sweepExpiredEntries());
        verify(rateLimiter).evictExpired();
    }
}
