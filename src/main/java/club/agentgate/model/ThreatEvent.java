/**
 * 此文件定义了一条被记录的安全事件。
 *
 * 事件一旦追加到 `SecurityMetrics` 的日志中便不可变。
 *
 * 关联:
 * - `SecurityMetrics`: 追加并汇总此类事件。
 * - `SecurityEventSink`: 每条事件都会被推送给已注册的接收方。
 */
package club.agentgate.model;

import java.time.Instant;

/**
 * @param type      事件类型。
 * @param ruleId    触发事件的规则标识，例如 `content.script-tag`。
 * @param detail    面向运维人员的描述。
 * @param severity  严重程度。
 * @param timestamp 记录时间。
 */
public record ThreatEvent(ThreatType type, String ruleId, String detail, Severity severity, Instant timestamp) {}
