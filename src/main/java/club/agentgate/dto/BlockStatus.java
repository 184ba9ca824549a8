/**
 * 此文件定义了单个标识符的封禁状态。
 *
 * 未被封禁时，`reason`、`blockedAt`、`expiresAt` 均为null且不会被序列化。
 */
package club.agentgate.dto;

import club.agentgate.model.BlockEntry;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BlockStatus(String identifier, boolean blocked, String reason, Instant blockedAt, Instant expiresAt) {

    public static BlockStatus of(String identifier, BlockEntry entry) {
        return new BlockStatus(identifier, true, entry.reason(), entry.blockedAt(), entry.expiresAt());
    }

    public static BlockStatus notBlocked(String identifier) {
        return new BlockStatus(identifier, false, null, null, null);
    }
}
