package club.agentgate.service;

import club.agentgate.support.MutableClock;
import java.time.Instant;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BlockListTest {

    @Test
    void blockedUntilExpiryThenLazilyRemoved() {
        var clock = MutableClock.atEpochMillis(0);
        var blockList = new BlockList(300_000, clock);

        blockList.block("10.0.0.1", "Rate limit exceeded");
        assertTrue(blockList.isBlocked("10.0.0.1"));

        clock.setMillis(300_000);
        assertTrue(blockList.isBlocked("10.0.0.1"), "still blocked at expiresAt");

        clock.setMillis(300_001);
        assertFalse(blockList.isBlocked("10.0.0.1"));
        assertEquals(0, blockList.size(), "expired entry is deleted on read");
    }

    @Test
    void secondBlockMovesExpiryForward() {
        var clock = MutableClock.atEpochMillis(0);
        var blockList = new BlockList(1000, clock);

        blockList.block("x", "first");
        clock.setMillis(800);
        var renewed = blockList.block("x", "second");

        assertEquals(Instant.ofEpochMilli(1800), renewed.expiresAt());
        clock.setMillis(1500);
        assertTrue(blockList.isBlocked("x"));
        assertEquals("second", blockList.find("x").orElseThrow().reason());
    }

    @Test
    void nullReasonFallsBackToDefault() {
        var blockList = new BlockList(1000, MutableClock.atEpochMillis(0));

        assertEquals(BlockList.DEFAULT_REASON, blockList.block("x", null).reason());
    }

    @Test
    void unknownIdentifierIsNotBlocked() {
        var blockList = new BlockList(1000, MutableClock.atEpochMillis(0));

        assertFalse(blockList.isBlocked("nobody"));
        assertFalse(blockList.unblock("nobody"));
    }

    @Test
    void unblockRemovesEntry() {
        var blockList = new BlockList(1000, MutableClock.atEpochMillis(0));
        blockList.block("x", "manual");

        assertTrue(blockList.unblock("x"));
        assertFalse(blockList.isBlocked("x"));
    }

    @Test
    void evictExpiredSweepsWithoutReads() {
        var clock = MutableClock.atEpochMillis(0);
        var blockList = new BlockList(1000, clock);
        blockList.block("a", "r");
        blockList.block("b", "r");
        clock.setMillis(500);
        blockList.block("c", "r");

        clock.setMillis(1200);
        assertEquals(2, blockList.evictExpired());
        assertEquals(1, blockList.size());
        assertTrue(blockList.isBlocked("c"));
    }
}
