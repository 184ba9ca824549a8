/**
 * 此类按固定顺序组合各扫描阶段，为网关的三个校验入口提供扫描流程。
 *
 * 主要职责:
 * - 每个入口先由 `StructureValidator` 创建一次快照，之后所有阶段共享它。
 * - `scanInput`: 内容 -> 结构 -> 注入。
 * - `scanActionPlan`: 内容 -> 结构(必须是对象) -> 行动计划。
 * - `scanSolution`: 仅解决方案安全扫描，只记录不拦截。
 * - 任一阶段失败即终止，不做部分恢复。
 *
 * 关联:
 * - `SecurityGate`: 唯一的调用方。
 * - `RuleTables`: 提供各阶段的规则表。
 */
package club.agentgate.scanner;

import club.agentgate.config.GateProperties;
import club.agentgate.model.ThreatEvent;
import club.agentgate.service.SecurityMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Set;

public class ThreatScanner {

    private final StructureValidator structureValidator;
    private final ContentScanner contentScanner;
    private final InjectionScanner injectionScanner;
    private final ActionPlanScanner actionPlanScanner;
    private final SolutionSafetyScanner solutionSafetyScanner;
    private final List<ScanStage> inputStages;

    public ThreatScanner(
            ObjectMapper objectMapper,
            RuleTables rules,
            SecurityMetrics metrics,
            GateProperties.Scan scan,
            GateProperties.Resources resources) {
        this.structureValidator = new StructureValidator(objectMapper, metrics, scan.maxPayloadBytes(), scan.maxDepth());
        this.contentScanner = new ContentScanner(rules.content(), metrics);
        this.injectionScanner = new InjectionScanner(rules.injection(), metrics);
        this.actionPlanScanner = new ActionPlanScanner(rules.actionTags(), metrics, resources);
        this.solutionSafetyScanner = new SolutionSafetyScanner(rules.solution(), metrics);
        this.inputStages = List.of(contentScanner, structureValidator, injectionScanner);
    }

    public void scanInput(Object payload) {
        var snapshot = structureValidator.snapshot(payload);
        for (var stage : inputStages) {
            stage.scan(snapshot);
        }
    }

    /**
     * @return 记录下来的敏感行动事件(不导致失败)。
     */
    public List<ThreatEvent> scanActionPlan(Object plan, Set<String> grantedPermissions) {
        var snapshot = structureValidator.snapshot(plan);
        contentScanner.scan(snapshot);
        structureValidator.scanObject(snapshot);
        return actionPlanScanner.scan(snapshot, grantedPermissions);
    }

    /**
     * 解决方案不经过结构校验；无法创建快照(循环引用或嵌套超过硬上限)时跳过扫描。
     *
     * @return 记录下来的解决方案安全事件(不导致失败)。
     */
    public List<ThreatEvent> scanSolution(Object solution) {
        return structureValidator.trySnapshot(solution)
                .map(solutionSafetyScanner::scan)
                .orElse(List.of());
    }

    public List<String> inputStageNames() {
        return inputStages.stream().map(ScanStage::name).toList();
    }
}
