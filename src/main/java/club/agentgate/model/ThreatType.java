/**
 * 此文件定义了安全事件的类型。
 *
 * 关联:
 * - `ThreatEvent`: 使用此枚举标识事件的来源。
 * - 各扫描阶段: 在记录事件时选择对应的类型。
 */
package club.agentgate.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ThreatType {
    // 负载扫描
    MALICIOUS_CONTENT,
    INJECTION_ATTACK,
    MALFORMED_PAYLOAD,

    // 行动计划
    DANGEROUS_ACTION,
    PERMISSION_VIOLATION,
    RESOURCE_ABUSE,

    // 解决方案 (仅记录，不拦截)
    UNSAFE_SOLUTION,
    ETHICAL_VIOLATION;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
