/**
 * 此文件定义了安全指标的派生快照。
 *
 * 每次读取时都会根据威胁日志和漏洞日志重新计算，不会被缓存。
 *
 * 关联:
 * - `SecurityMetrics`: 生成此快照。
 * - `SecurityMonitorController`: 作为 `/api/monitor/security` 的响应体。
 */
package club.agentgate.dto;

import club.agentgate.model.Severity;
import club.agentgate.model.ThreatEvent;
import java.util.List;

/**
 * @param threatsDetected    检测到的威胁总数(包括认证/授权失败和解决方案告警)。
 * @param threatsBlocked     被拒绝的负载数。
 * @param vulnerabilities    漏洞日志中的条目数。
 * @param integrity          外部设置的完整性指标，取值 [0, 1]。
 * @param threats            威胁日志中的条目数。
 * @param score              安全评分，`max(0, 100 - 10*威胁数 - 5*漏洞数)`。
 * @param threatLevel        按威胁数划分的等级。
 * @param vulnerabilityLevel 按漏洞数划分的等级。
 * @param recentThreats      最近的威胁事件，按记录顺序排列。
 */
public record SecuritySnapshot(
        long threatsDetected,
        long threatsBlocked,
        int vulnerabilities,
        double integrity,
        int threats,
        int score,
        Severity threatLevel,
        Severity vulnerabilityLevel,
        List<ThreatEvent> recentThreats) {}
