/**
 * 此服务类实现了按标识符计数的固定窗口速率限制。
 *
 * 主要职责:
 * - 为每个标识符(IP、会话或代理ID)维护一个 `RateWindow`，首次请求时惰性创建。
 * - 当前时间超过 `resetTime` 后，整体替换为新窗口，而不是在旧窗口上累加。
 * - 窗口内请求数达到上限后拒绝请求，且不再增加计数。
 * - 提供过期窗口的清理入口，供定时任务回收内存。
 *
 * 这是固定窗口而非滑动窗口: 跨越窗口边界的突发流量可能短暂超过预期速率，
 * 换来的是每个标识符O(1)的内存和计算开销。
 *
 * 关联:
 * - `SecurityGate`: 通过 `checkRateLimit` 调用此类。
 * - `IdentifierStateSweeper`: 定期调用 `evictExpired`。
 */
package club.agentgate.service;

import club.agentgate.dto.RateLimitStatus;
import club.agentgate.model.RateWindow;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    private final Map<String, RateWindow> windows = new ConcurrentHashMap<>();

    private final int maxRequests;
    private final long windowMs;
    private final Clock clock;

    public RateLimiter(int maxRequests, long windowMs, Clock clock) {
        if (maxRequests <= 0 || windowMs <= 0) {
            throw new IllegalArgumentException("maxRequests与windowMs必须为正数");
        }
        this.maxRequests = maxRequests;
        this.windowMs = windowMs;
        this.clock = clock;
        logger.info("速率限制器初始化，每 {} ms 最多 {} 次请求。", windowMs, maxRequests);
    }

    /**
     * 为标识符登记一次请求并返回检查结果。
     *
     * @param identifier 调用方标识符。
     * @return 本次请求是否被接受、剩余次数及窗口结束时间。
     */
    public RateLimitStatus check(String identifier) {
        var now = clock.instant();
        var outcome = new AtomicReference<RateLimitStatus>();

        // compute对同一个键串行执行，窗口过期判断与替换在同一把锁内完成
        windows.compute(identifier, (key, window) -> {
            if (window == null || window.isExpired(now)) {
                var fresh = new RateWindow(1, now.plusMillis(windowMs));
                outcome.set(RateLimitStatus.allowed(maxRequests - 1, fresh.resetTime()));
                return fresh;
            }
            if (window.count() >= maxRequests) {
                outcome.set(RateLimitStatus.rejected(window.resetTime()));
                return window; // 拒绝时不再计数
            }
            var next = window.increment();
            outcome.set(RateLimitStatus.allowed(maxRequests - next.count(), next.resetTime()));
            return next;
        });

        var status = outcome.get();
        if (status.allowed()) {
            logger.debug("请求允许: 标识符 '{}', 剩余 {}/{}", identifier, status.remaining(), maxRequests);
        } else {
            logger.warn("速率限制已超出: 标识符 '{}', 窗口将于 {} 重置", identifier, status.resetTime());
        }
        return status;
    }

    /**
     * 移除所有已过期的窗口。判断与删除在同一个键的锁内完成，不会误删被并发刷新的窗口。
     *
     * @return 被移除的窗口数。
     */
    public int evictExpired() {
        var now = clock.instant();
        var evicted = new AtomicInteger();
        for (var identifier : windows.keySet()) {
            windows.computeIfPresent(identifier, (key, window) -> {
                if (window.isExpired(now)) {
                    evicted.incrementAndGet();
                    return null;
                }
                return window;
            });
        }
        return evicted.get();
    }

    public void reset() {
        windows.clear();
        logger.info("所有速率限制窗口已重置。");
    }

    public int trackedIdentifiers() {
        return windows.size();
    }
}
