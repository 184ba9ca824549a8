/**
 * 按规则表顺序匹配、在第一条命中规则处失败的扫描阶段基类。
 *
 * 子类只决定事件类型、失败类别和事件的严重程度，控制流由此类统一实现。
 *
 * 关联:
 * - `ContentScanner`, `InjectionScanner`: 此类的子类。
 */
package club.agentgate.scanner;

import club.agentgate.exception.FailureKind;
import club.agentgate.exception.ValidationFailureException;
import club.agentgate.model.Severity;
import club.agentgate.model.ThreatType;
import club.agentgate.service.SecurityMetrics;
import java.util.List;

public abstract class PatternScanner implements ScanStage {

    private final List<ThreatRule> rules;
    private final SecurityMetrics metrics;

    protected PatternScanner(List<ThreatRule> rules, SecurityMetrics metrics) {
        this.rules = List.copyOf(rules);
        this.metrics = metrics;
    }

    protected abstract ThreatType threatType();

    protected abstract FailureKind failureKind();

    protected abstract String describe(ThreatRule rule);

    /**
     * 事件的严重程度，默认沿用规则表中的设置。
     */
    protected Severity severityOf(ThreatRule rule) {
        return rule.severity();
    }

    @Override
    public void scan(PayloadSnapshot snapshot) {
        for (var rule : rules) {
            if (rule.matches(snapshot.text())) {
                var detail = describe(rule);
                metrics.recordThreat(threatType(), rule.id(), detail, severityOf(rule));
                throw new ValidationFailureException(failureKind(), detail);
            }
        }
    }
}
