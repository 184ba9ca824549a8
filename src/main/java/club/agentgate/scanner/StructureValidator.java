/**
 * 结构校验阶段，同时负责创建所有阶段共享的 `PayloadSnapshot`。
 *
 * 主要职责:
 * - 创建快照: 在任何序列化之前拒绝循环引用，以及超出硬上限(20层)的嵌套；然后只转换、序列化一次。
 * - 宽松快照: 解决方案只做记录不做拦截，无法创建快照时记录日志并跳过，不产生威胁事件。
 * - 扫描: 拒绝非容器负载(行动计划必须是对象)、超出大小上限的负载和超出深度上限的负载。
 *
 * 关联:
 * - `ThreatScanner`: 每个校验入口都先创建快照，再按顺序执行各阶段。
 */
package club.agentgate.scanner;

import club.agentgate.exception.FailureKind;
import club.agentgate.exception.ValidationFailureException;
import club.agentgate.model.Severity;
import club.agentgate.model.ThreatType;
import club.agentgate.service.SecurityMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class StructureValidator implements ScanStage {

    private static final Logger logger = LoggerFactory.getLogger(StructureValidator.class);

    /** 递归遍历的硬上限，与配置的最大深度无关。 */
    static final int HARD_DEPTH_CAP = 20;

    private final ObjectMapper objectMapper;
    private final SecurityMetrics metrics;
    private final int maxPayloadBytes;
    private final int maxDepth;

    public StructureValidator(ObjectMapper objectMapper, SecurityMetrics metrics, int maxPayloadBytes, int maxDepth) {
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.maxPayloadBytes = maxPayloadBytes;
        this.maxDepth = maxDepth;
    }

    /**
     * 快照创建失败的内部信号，携带规则ID，由调用方决定拦截还是跳过。
     */
    private static final class MalformedPayloadException extends RuntimeException {
        private final String ruleId;

        MalformedPayloadException(String ruleId, String detail) {
            super(detail);
            this.ruleId = ruleId;
        }
    }

    @Override
    public String name() {
        return "structure";
    }

    /**
     * 将负载转换为只读快照。
     *
     * @param payload `JsonNode`、`Map`、`Collection`、数组、POJO或标量。
     * @return 可供所有扫描阶段使用的快照。
     * @throws ValidationFailureException 负载存在循环引用、嵌套过深或无法序列化。
     */
    public PayloadSnapshot snapshot(Object payload) {
        try {
            return capture(payload);
        } catch (MalformedPayloadException e) {
            throw reject(e.ruleId, e.getMessage());
        }
    }

    /**
     * 与 `snapshot` 相同，但失败时不记录威胁也不抛出异常，只返回空。
     */
    public Optional<PayloadSnapshot> trySnapshot(Object payload) {
        try {
            return Optional.of(capture(payload));
        } catch (MalformedPayloadException e) {
            logger.warn("负载无法创建快照，跳过扫描 [{}]: {}", e.ruleId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void scan(PayloadSnapshot snapshot) {
        if (!snapshot.tree().isContainerNode()) {
            throw reject("structure.not-object", "负载必须是JSON对象或数组，实际为 " + snapshot.tree().getNodeType());
        }
        checkLimits(snapshot);
    }

    /**
     * 与 `scan` 相同，但只接受JSON对象。用于行动计划。
     */
    public void scanObject(PayloadSnapshot snapshot) {
        if (!snapshot.tree().isObject()) {
            throw reject("structure.not-object", "行动计划必须是JSON对象，实际为 " + snapshot.tree().getNodeType());
        }
        checkLimits(snapshot);
    }

    private PayloadSnapshot capture(Object payload) {
        JsonNode tree;
        if (payload == null) {
            tree = NullNode.getInstance();
        } else if (payload instanceof JsonNode node) {
            tree = node;
        } else {
            ensureAcyclic(payload, Collections.newSetFromMap(new IdentityHashMap<>()), 0);
            tree = toTree(payload);
        }

        var depth = depthOf(tree, 0);
        if (depth > HARD_DEPTH_CAP) {
            throw new MalformedPayloadException("structure.depth-cap", "负载嵌套深度超过硬上限 " + HARD_DEPTH_CAP);
        }

        try {
            var text = objectMapper.writeValueAsString(tree);
            return new PayloadSnapshot(tree, text, text.getBytes(StandardCharsets.UTF_8).length, depth);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("structure.unserializable", "负载无法序列化: " + e.getOriginalMessage());
        }
    }

    private void checkLimits(PayloadSnapshot snapshot) {
        if (snapshot.byteSize() > maxPayloadBytes) {
            throw reject("structure.size", "负载大小 " + snapshot.byteSize() + " 字节超过上限 " + maxPayloadBytes);
        }
        if (snapshot.depth() > maxDepth) {
            throw reject("structure.depth", "负载嵌套深度 " + snapshot.depth() + " 超过上限 " + maxDepth);
        }
    }

    /**
     * 标量与空容器为当前层级，非空容器为子节点的最大深度。超过硬上限时返回 `HARD_DEPTH_CAP + 1` 并停止递归。
     */
    static int depthOf(JsonNode node, int level) {
        if (!node.isContainerNode()) {
            return level;
        }
        if (level >= HARD_DEPTH_CAP) {
            return HARD_DEPTH_CAP + 1;
        }
        var deepest = level;
        for (var child : node) {
            deepest = Math.max(deepest, depthOf(child, level + 1));
            if (deepest > HARD_DEPTH_CAP) {
                break;
            }
        }
        return deepest;
    }

    /**
     * 沿当前路径检查Map/集合/数组是否引用了自己的祖先。POJO交给Jackson处理。
     */
    private void ensureAcyclic(Object value, Set<Object> path, int level) {
        if (!(value instanceof Map<?, ?>) && !(value instanceof Iterable<?>) && !(value instanceof Object[])) {
            return;
        }
        if (level >= HARD_DEPTH_CAP) {
            throw new MalformedPayloadException("structure.depth-cap", "负载嵌套深度超过硬上限 " + HARD_DEPTH_CAP);
        }
        if (!path.add(value)) {
            throw new MalformedPayloadException("structure.cycle", "负载包含循环引用，无法序列化");
        }
        if (value instanceof Map<?, ?> map) {
            for (var child : map.values()) {
                ensureAcyclic(child, path, level + 1);
            }
        } else if (value instanceof Iterable<?> iterable) {
            for (var child : iterable) {
                ensureAcyclic(child, path, level + 1);
            }
        } else {
            for (var child : (Object[]) value) {
                ensureAcyclic(child, path, level + 1);
            }
        }
        path.remove(value);
    }

    private JsonNode toTree(Object payload) {
        try {
            JsonNode tree = objectMapper.valueToTree(payload);
            return tree != null ? tree : NullNode.getInstance();
        } catch (IllegalArgumentException e) {
            // Jackson把POJO的自引用和无限递归包装为IllegalArgumentException
            throw new MalformedPayloadException("structure.unserializable", "负载无法序列化: " + e.getMessage());
        }
    }

    private ValidationFailureException reject(String ruleId, String detail) {
        metrics.recordThreat(ThreatType.MALFORMED_PAYLOAD, ruleId, detail, Severity.HIGH);
        return new ValidationFailureException(FailureKind.STRUCTURE, detail);
    }
}
