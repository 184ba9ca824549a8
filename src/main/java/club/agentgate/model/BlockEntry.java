/**
 * 此文件定义了一个被封禁标识符的封禁记录。
 *
 * 关联:
 * - `BlockList`: 以标识符为键在内存中维护此记录，并在读取时惰性删除过期记录。
 */
package club.agentgate.model;

import java.time.Instant;

public record BlockEntry(String reason, Instant blockedAt, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
