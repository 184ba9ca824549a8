/**
 * 此文件定义了网关的基础计数指标，不含派生的评分与等级。
 *
 * 关联:
 * - `SecurityGate#getMetrics`: 生成此记录。
 */
package club.agentgate.dto;

public record GateMetrics(
        String id,
        long threatsDetected,
        long threatsBlocked,
        int vulnerabilities,
        double integrity,
        int threats,
        int vulnerabilityCount) {}
