/**
 * 注入扫描阶段: 检测SQL注入与Shell命令注入。命中的规则一律按严重(critical)记录。
 */
package club.agentgate.scanner;

import club.agentgate.exception.FailureKind;
import club.agentgate.model.Severity;
import club.agentgate.model.ThreatType;
import club.agentgate.service.SecurityMetrics;
import java.util.List;

public class InjectionScanner extends PatternScanner {

    public InjectionScanner(List<ThreatRule> rules, SecurityMetrics metrics) {
        super(rules, metrics);
    }

    @Override
    public String name() {
        return "injection";
    }

    @Override
    protected ThreatType threatType() {
        return ThreatType.INJECTION_ATTACK;
    }

    @Override
    protected FailureKind failureKind() {
        return FailureKind.INJECTION;
    }

    @Override
    protected Severity severityOf(ThreatRule rule) {
        return Severity.CRITICAL;
    }

    @Override
    protected String describe(ThreatRule rule) {
        var target = rule.category() == RuleCategory.SQL ? "SQL" : "Shell";
        return "检测到" + target + "注入 (" + rule.id() + ")";
    }
}
