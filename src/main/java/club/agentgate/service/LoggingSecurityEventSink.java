/**
 * 将安全事件写入日志的接收方，在 `monitoring.enabled` 时由网关注册。
 */
package club.agentgate.service;

import club.agentgate.model.Severity;
import club.agentgate.model.ThreatEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingSecurityEventSink implements SecurityEventSink {

    private static final Logger logger = LoggerFactory.getLogger("club.agentgate.security-events");

    @Override
    public void onEvent(ThreatEvent event, boolean vulnerability) {
        var log = vulnerability ? "漏洞" : "威胁";
        if (event.severity() == Severity.CRITICAL || event.severity() == Severity.HIGH) {
            logger.warn("[{}] {} | 规则: {} | 级别: {} | {}",
                    log, event.type().code(), event.ruleId(), event.severity().code(), event.detail());
        } else {
            logger.info("[{}] {} | 规则: {} | 级别: {} | {}",
                    log, event.type().code(), event.ruleId(), event.severity().code(), event.detail());
        }
    }
}
