/**
 * 内容扫描阶段: 检测脚本/标记注入、动态求值调用以及Shell/文件访问调用。
 */
package club.agentgate.scanner;

import club.agentgate.exception.FailureKind;
import club.agentgate.model.ThreatType;
import club.agentgate.service.SecurityMetrics;
import java.util.List;

public class ContentScanner extends PatternScanner {

    public ContentScanner(List<ThreatRule> rules, SecurityMetrics metrics) {
        super(rules, metrics);
    }

    @Override
    public String name() {
        return "content";
    }

    @Override
    protected ThreatType threatType() {
        return ThreatType.MALICIOUS_CONTENT;
    }

    @Override
    protected FailureKind failureKind() {
        return FailureKind.CONTENT;
    }

    @Override
    protected String describe(ThreatRule rule) {
        return "负载包含被禁止的内容 (" + rule.id() + ")";
    }
}
