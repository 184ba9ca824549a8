/**
 * 此接口定义了安全事件的接收方。
 *
 * 每条写入 `SecurityMetrics` 的威胁或漏洞事件都会按注册顺序推送给所有接收方。
 * 实现应尽快返回；抛出的异常会被记录，不会影响校验流程。
 *
 * 关联:
 * - `SecurityMetrics`: 持有接收方列表并负责推送。
 * - `LoggingSecurityEventSink`: 将事件写入日志。
 * - `SecurityEventBroadcaster`: 将事件广播给WebSocket订阅者。
 */
package club.agentgate.service;

import club.agentgate.model.ThreatEvent;

@FunctionalInterface
public interface SecurityEventSink {

    /**
     * @param event         被记录的事件。
     * @param vulnerability 事件写入的是漏洞日志时为 `true`，威胁日志时为 `false`。
     */
    void onEvent(ThreatEvent event, boolean vulnerability);
}
