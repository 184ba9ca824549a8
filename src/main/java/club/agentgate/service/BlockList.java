/**
 * 此服务类维护被临时封禁的标识符。
 *
 * 主要职责:
 * - `block` 无条件地(重新)写入封禁记录，重复封禁会把过期时间向后推。
 * - `isBlocked` 执行惰性过期: 读到过期记录时删除它并返回false。
 * - 提供过期记录的批量清理入口，供定时任务使用。
 *
 * 封禁不会由 `RateLimiter` 自动触发，而是由观察到多次拒绝的调用方决定。
 *
 * 关联:
 * - `SecurityGate`: 通过 `blockIdentifier` / `isBlocked` 调用此类。
 * - `GateAdmissionInterceptor`: 连续被限流达到阈值时触发封禁。
 * - `IdentifierStateSweeper`: 定期调用 `evictExpired`。
 */
package club.agentgate.service;

import club.agentgate.model.BlockEntry;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class BlockList {

    private static final Logger logger = LoggerFactory.getLogger(BlockList.class);

    public static final String DEFAULT_REASON = "Rate limit exceeded";

    private final Map<String, BlockEntry> entries = new ConcurrentHashMap<>();

    private final long blockDurationMs;
    private final Clock clock;

    public BlockList(long blockDurationMs, Clock clock) {
        if (blockDurationMs <= 0) {
            throw new IllegalArgumentException("blockDurationMs必须为正数");
        }
        this.blockDurationMs = blockDurationMs;
        this.clock = clock;
    }

    public BlockEntry block(String identifier, String reason) {
        var now = clock.instant();
        var entry = new BlockEntry(reason != null ? reason : DEFAULT_REASON, now, now.plusMillis(blockDurationMs));
        entries.put(identifier, entry);
        logger.warn("标识符 '{}' 已被封禁，原因: {}，解封时间: {}", identifier, entry.reason(), entry.expiresAt());
        return entry;
    }

    public boolean isBlocked(String identifier) {
        return find(identifier).isPresent();
    }

    /**
     * 查找标识符当前有效的封禁记录。过期记录会在同一把锁内被删除。
     */
    public Optional<BlockEntry> find(String identifier) {
        var now = clock.instant();
        var entry = entries.computeIfPresent(identifier, (key, current) -> {
            if (current.isExpired(now)) {
                logger.info("标识符 '{}' 的封禁已过期，自动解除。", key);
                return null;
            }
            return current;
        });
        return Optional.ofNullable(entry);
    }

    public boolean unblock(String identifier) {
        var removed = entries.remove(identifier);
        if (removed != null) {
            logger.info("标识符 '{}' 已被手动解封。", identifier);
        }
        return removed != null;
    }

    /**
     * @return 被移除的过期封禁记录数。
     */
    public int evictExpired() {
        var now = clock.instant();
        var evicted = new AtomicInteger();
        for (var identifier : entries.keySet()) {
            entries.computeIfPresent(identifier, (key, entry) -> {
                if (entry.isExpired(now)) {
                    evicted.incrementAndGet();
                    return null;
                }
                return entry;
            });
        }
        return evicted.get();
    }

    public int size() {
        return entries.size();
    }
}
