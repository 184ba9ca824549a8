/**
 * 此文件定义了一个用于存储单个标识符固定窗口计数的数据记录。
 *
 * 窗口过期后不会被合并，而是整体替换为一个新的窗口。
 *
 * 关联:
 * - `RateLimiter`: 以标识符为键在内存中维护此记录。
 */
package club.agentgate.model;

import java.time.Instant;

public record RateWindow(int count, Instant resetTime) {

    public RateWindow increment() {
        return new RateWindow(count + 1, resetTime);
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(resetTime);
    }
}
