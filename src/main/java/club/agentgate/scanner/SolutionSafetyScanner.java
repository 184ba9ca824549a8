/**
 * 解决方案安全扫描阶段，只在 `validateSolution` 中执行。
 *
 * 命中的每条规则都会作为漏洞事件记录，并计入检测数，但不会拒绝解决方案。
 * 需要强制拦截的调用方应读取 `getSecurityMetrics()` 自行决定。
 */
package club.agentgate.scanner;

import club.agentgate.model.ThreatEvent;
import club.agentgate.model.ThreatType;
import club.agentgate.service.SecurityMetrics;
import java.util.ArrayList;
import java.util.List;

public class SolutionSafetyScanner {

    private final List<ThreatRule> rules;
    private final SecurityMetrics metrics;

    public SolutionSafetyScanner(List<ThreatRule> rules, SecurityMetrics metrics) {
        this.rules = List.copyOf(rules);
        this.metrics = metrics;
    }

    /**
     * @return 本次记录的事件，未命中任何规则时为空列表。
     */
    public List<ThreatEvent> scan(PayloadSnapshot snapshot) {
        var findings = new ArrayList<ThreatEvent>();
        for (var rule : rules) {
            if (rule.matches(snapshot.text())) {
                var type = rule.category() == RuleCategory.ETHICS
                        ? ThreatType.ETHICAL_VIOLATION
                        : ThreatType.UNSAFE_SOLUTION;
                var detail = type == ThreatType.ETHICAL_VIOLATION
                        ? "解决方案可能存在伦理问题 (" + rule.id() + ")"
                        : "解决方案可能有害 (" + rule.id() + ")";
                findings.add(metrics.recordVulnerability(type, rule.id(), detail, rule.severity()));
                metrics.recordDetection();
            }
        }
        return findings;
    }
}
