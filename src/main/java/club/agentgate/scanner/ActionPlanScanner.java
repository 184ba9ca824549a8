/**
 * 行动计划扫描阶段，只在 `validateActionPlan` 中执行。
 *
 * 主要职责:
 * - 扫描敏感/危险行动标签，每个命中的标签记录为一条 `dangerous_action` 事件，但不会因此拒绝计划。
 * - 检查计划声明的 `permissions` 是否都包含在调用方被授予的权限中。
 * - 检查计划声明的 `resources` (memory/cpu/time/network) 以及 `actions` 数量是否超出上限。
 *
 * 关联:
 * - `ThreatScanner#scanActionPlan`: 在内容与结构校验之后调用此阶段。
 * - `GateProperties.Resources`: 提供资源上限。
 */
package club.agentgate.scanner;

import club.agentgate.config.GateProperties;
import club.agentgate.exception.FailureKind;
import club.agentgate.exception.ValidationFailureException;
import club.agentgate.model.Severity;
import club.agentgate.model.ThreatEvent;
import club.agentgate.model.ThreatType;
import club.agentgate.service.SecurityMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class ActionPlanScanner {

    private final List<ThreatRule> actionTags;
    private final SecurityMetrics metrics;
    private final GateProperties.Resources limits;

    public ActionPlanScanner(List<ThreatRule> actionTags, SecurityMetrics metrics, GateProperties.Resources limits) {
        this.actionTags = List.copyOf(actionTags);
        this.metrics = metrics;
        this.limits = limits;
    }

    /**
     * @param snapshot 行动计划的快照，树根必须是对象(由结构校验保证)。
     * @param granted  调用方被授予的权限。
     * @return 本次记录的敏感行动事件。
     */
    public List<ThreatEvent> scan(PayloadSnapshot snapshot, Set<String> granted) {
        var findings = recordSensitiveActions(snapshot);
        checkPermissions(snapshot.tree(), granted);
        checkResources(snapshot.tree());
        return findings;
    }

    private List<ThreatEvent> recordSensitiveActions(PayloadSnapshot snapshot) {
        var findings = new ArrayList<ThreatEvent>();
        for (var rule : actionTags) {
            if (rule.matches(snapshot.text())) {
                findings.add(metrics.recordThreat(ThreatType.DANGEROUS_ACTION, rule.id(),
                        "行动计划包含" + (rule.category() == RuleCategory.DANGEROUS_ACTION ? "危险" : "敏感")
                                + "行动标签 (" + rule.id() + ")",
                        rule.severity()));
            }
        }
        return findings;
    }

    private void checkPermissions(JsonNode plan, Set<String> granted) {
        var declared = plan.get("permissions");
        if (declared == null || declared.isNull()) {
            return;
        }
        if (!declared.isArray()) {
            throw reject(ThreatType.PERMISSION_VIOLATION, "permission.malformed", FailureKind.PERMISSION,
                    "permissions 必须是字符串数组");
        }
        for (var permission : declared) {
            if (!permission.isTextual() || !granted.contains(permission.asText())) {
                throw reject(ThreatType.PERMISSION_VIOLATION, "permission.missing", FailureKind.PERMISSION,
                        "行动计划需要未被授予的权限: " + permission.asText());
            }
        }
    }

    private void checkResources(JsonNode plan) {
        var resources = plan.get("resources");
        if (resources != null && !resources.isNull()) {
            if (!resources.isObject()) {
                throw reject(ThreatType.RESOURCE_ABUSE, "resource.malformed", FailureKind.RESOURCE,
                        "resources 必须是对象");
            }
            for (var ceiling : ceilings().entrySet()) {
                checkCeiling(resources, ceiling.getKey(), ceiling.getValue());
            }
        }

        var actions = plan.get("actions");
        if (actions != null && actions.isArray() && actions.size() > limits.actions()) {
            throw reject(ThreatType.RESOURCE_ABUSE, "resource.actions", FailureKind.RESOURCE,
                    "行动数量 " + actions.size() + " 超过上限 " + limits.actions());
        }
    }

    private Map<String, Long> ceilings() {
        // 顺序即检查顺序
        var ceilings = new LinkedHashMap<String, Long>();
        ceilings.put("memory", limits.memory());
        ceilings.put("cpu", limits.cpu());
        ceilings.put("time", limits.time());
        ceilings.put("network", limits.network());
        return ceilings;
    }

    private void checkCeiling(JsonNode resources, String name, long ceiling) {
        var value = resources.get(name);
        if (value == null || value.isNull()) {
            return;
        }
        if (!value.isNumber()) {
            throw reject(ThreatType.RESOURCE_ABUSE, "resource.malformed", FailureKind.RESOURCE,
                    "资源 " + name + " 的声明值必须是数字");
        }
        if (value.doubleValue() > ceiling) {
            throw reject(ThreatType.RESOURCE_ABUSE, "resource." + name, FailureKind.RESOURCE,
                    "资源 " + name + " 的声明值 " + value.asText() + " 超过上限 " + ceiling);
        }
    }

    private ValidationFailureException reject(ThreatType type, String ruleId, FailureKind kind, String detail) {
        metrics.recordThreat(type, ruleId, detail, Severity.HIGH);
        return new ValidationFailureException(kind, detail);
    }
}
