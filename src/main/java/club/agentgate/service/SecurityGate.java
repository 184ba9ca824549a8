/**
 * 安全网关: 代理的每个查询、行动计划和候选解决方案在被执行或返回之前都要经过这里。
 *
 * 主要职责:
 * - 准入: 组合 `RateLimiter` 与 `BlockList`。封禁记录优先于速率窗口，被封禁的标识符一律拒绝。
 * - 校验: 通过 `ThreatScanner` 执行 `validateInput` / `validateActionPlan` / `validateSolution`，
 *   失败时更新拦截计数后原样抛出，不做重试。
 * - 认证/授权: 委托给可替换的 `Authenticator` / `Authorizer`，失败时返回false并计入检测数。
 * - 初始化: `initialize` 是幂等的；失败会抛给调用方，网关保持未初始化状态。
 *
 * 关联:
 * - `GateConfig`: 构建并初始化此类。
 * - `ValidationController`, `SecurityMonitorController`, `GateAdmissionInterceptor`: HTTP入口。
 */
package club.agentgate.service;

import club.agentgate.config.GateProperties;
import club.agentgate.dto.BlockStatus;
import club.agentgate.dto.GateMetrics;
import club.agentgate.dto.RateLimitOverview;
import club.agentgate.dto.RateLimitStatus;
import club.agentgate.dto.SecuritySnapshot;
import club.agentgate.exception.GateNotInitializedException;
import club.agentgate.exception.ValidationFailureException;
import club.agentgate.model.Credentials;
import club.agentgate.model.GateAction;
import club.agentgate.model.GateUser;
import club.agentgate.scanner.ThreatScanner;
import club.agentgate.service.auth.Authenticator;
import club.agentgate.service.auth.Authorizer;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SecurityGate {

    private static final Logger logger = LoggerFactory.getLogger(SecurityGate.class);

    private final String id = UUID.randomUUID().toString();

    private final RateLimiter rateLimiter;
    private final BlockList blockList;
    private final ThreatScanner threatScanner;
    private final SecurityMetrics metrics;
    private final Authenticator authenticator;
    private final Authorizer authorizer;

    private volatile boolean initialized;
    private volatile Set<String> userPermissions = Set.of();

    public SecurityGate(
            RateLimiter rateLimiter,
            BlockList blockList,
            ThreatScanner threatScanner,
            SecurityMetrics metrics,
            Authenticator authenticator,
            Authorizer authorizer) {
        this.rateLimiter = rateLimiter;
        this.blockList = blockList;
        this.threatScanner = threatScanner;
        this.metrics = metrics;
        this.authenticator = authenticator;
        this.authorizer = authorizer;
        logger.info("安全网关已创建: {}", id);
    }

    // ---- 初始化 ----

    /**
     * 初始化网关。首次成功之后的调用不做任何事。
     *
     * @param config 网关配置，其中的 `userPermissions` 用于行动计划的权限检查。
     * @throws IllegalArgumentException 配置无效，此时网关保持未初始化。
     */
    public synchronized void initialize(GateProperties config) {
        if (initialized) {
            logger.debug("安全网关 {} 已初始化，忽略重复调用。", id);
            return;
        }
        logger.info("正在初始化安全网关 {}...", id);
        try {
            if (config == null) {
                throw new IllegalArgumentException("网关配置不能为空");
            }
            var permissions = resolvePermissions(config);

            initializeAuthentication(config);
            initializeAuthorization(config);
            initializeEncryption(config);
            initializeMonitoring(config);

            this.userPermissions = permissions;
            this.initialized = true;
            logger.info("安全网关初始化成功。输入校验阶段: {}，已授予权限: {}",
                    threatScanner.inputStageNames(), permissions);
        } catch (RuntimeException e) {
            logger.error("安全网关初始化失败", e);
            throw e;
        }
    }

    public boolean isInitialized() {
        return initialized;
    }

    private Set<String> resolvePermissions(GateProperties config) {
        var permissions = new LinkedHashSet<String>();
        for (var permission : config.userPermissions()) {
            if (permission == null || permission.isBlank()) {
                throw new IllegalArgumentException("userPermissions 中不能包含空权限");
            }
            permissions.add(permission.trim());
        }
        return Set.copyOf(permissions);
    }

    private void initializeAuthentication(GateProperties config) {
        if (config.authentication().enabled()) {
            logger.debug("认证子系统已启用，实现: {}", authenticator.getClass().getSimpleName());
        }
    }

    private void initializeAuthorization(GateProperties config) {
        if (config.authorization().enabled()) {
            logger.debug("授权子系统已启用，实现: {}", authorizer.getClass().getSimpleName());
        }
    }

    private void initializeEncryption(GateProperties config) {
        if (config.encryption().enabled()) {
            logger.debug("加密子系统已启用。");
        }
    }

    private void initializeMonitoring(GateProperties config) {
        if (config.monitoring().enabled()) {
            metrics.subscribe(new LoggingSecurityEventSink());
            logger.debug("安全监控已启用，事件将写入日志。");
        }
    }

    // ---- 准入 ----

    /**
     * 为标识符登记一次请求。被封禁的标识符直接拒绝，不消耗窗口计数，`resetTime` 为解封时间。
     */
    public RateLimitStatus checkRateLimit(String identifier) {
        var block = blockList.find(identifier);
        if (block.isPresent()) {
            logger.debug("标识符 '{}' 处于封禁状态，拒绝请求。", identifier);
            return RateLimitStatus.rejected(block.get().expiresAt());
        }
        return rateLimiter.check(identifier);
    }

    public void blockIdentifier(String identifier) {
        blockIdentifier(identifier, BlockList.DEFAULT_REASON);
    }

    public void blockIdentifier(String identifier, String reason) {
        blockList.block(identifier, reason);
    }

    public boolean isBlocked(String identifier) {
        return blockList.isBlocked(identifier);
    }

    public BlockStatus getBlockStatus(String identifier) {
        return blockList.find(identifier)
                .map(entry -> BlockStatus.of(identifier, entry))
                .orElseGet(() -> BlockStatus.notBlocked(identifier));
    }

    public boolean unblockIdentifier(String identifier) {
        return blockList.unblock(identifier);
    }

    public void resetRateLimits() {
        rateLimiter.reset();
    }

    public RateLimitOverview getRateLimitOverview() {
        return new RateLimitOverview(rateLimiter.trackedIdentifiers(), blockList.size());
    }

    // ---- 校验 ----

    public void validateInput(Object input) {
        ensureInitialized();
        logger.debug("开始校验输入");
        guard("输入", () -> threatScanner.scanInput(input));
        logger.debug("输入校验完成");
    }

    public void validateActionPlan(Object plan) {
        ensureInitialized();
        logger.debug("开始校验行动计划");
        var granted = userPermissions;
        guard("行动计划", () -> {
            var findings = threatScanner.scanActionPlan(plan, granted);
            if (!findings.isEmpty()) {
                logger.warn("行动计划包含 {} 个敏感行动标签，已记录。", findings.size());
            }
        });
        logger.debug("行动计划校验完成");
    }

    /**
     * 校验解决方案。命中的规则只记录为漏洞事件，不会导致失败。
     */
    public void validateSolution(Object solution) {
        ensureInitialized();
        logger.debug("开始校验解决方案");
        guard("解决方案", () -> {
            var findings = threatScanner.scanSolution(solution);
            if (!findings.isEmpty()) {
                logger.warn("解决方案触发 {} 条安全告警，已记录但未拦截。", findings.size());
            }
        });
        logger.debug("解决方案校验完成");
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new GateNotInitializedException();
        }
    }

    private void guard(String subject, Runnable scan) {
        try {
            scan.run();
        } catch (ValidationFailureException e) {
            metrics.recordBlocked();
            logger.warn("{}校验未通过 [{}]: {}", subject, e.getKind().code(), e.getDetail());
            throw e;
        }
    }

    // ---- 认证/授权 ----

    public boolean authenticate(Credentials credentials) {
        try {
            logger.debug("正在认证用户: {}", credentials);
            var valid = credentials != null && authenticator.authenticate(credentials);
            if (valid) {
                logger.debug("认证成功");
            } else {
                logger.warn("认证失败: {}", credentials);
                metrics.recordDetection();
            }
            return valid;
        } catch (RuntimeException e) {
            logger.error("认证过程中发生错误", e);
            metrics.recordDetection();
            return false;
        }
    }

    public boolean authorize(GateUser user, GateAction action) {
        try {
            logger.debug("正在授权动作: 用户 {}, 动作 {}",
                    user != null ? user.id() : null, action != null ? action.type() : null);
            var permitted = authorizer.authorize(user, action);
            if (permitted) {
                logger.debug("授权成功");
            } else {
                logger.warn("授权失败: 用户 {}, 动作 {}",
                        user != null ? user.id() : null, action != null ? action.type() : null);
                metrics.recordDetection();
            }
            return permitted;
        } catch (RuntimeException e) {
            logger.error("授权过程中发生错误", e);
            metrics.recordDetection();
            return false;
        }
    }

    // ---- 指标 ----

    public GateMetrics getMetrics() {
        var snapshot = metrics.snapshot();
        return new GateMetrics(
                id,
                snapshot.threatsDetected(),
                snapshot.threatsBlocked(),
                snapshot.vulnerabilities(),
                snapshot.integrity(),
                snapshot.threats(),
                snapshot.vulnerabilities());
    }

    public SecuritySnapshot getSecurityMetrics() {
        return metrics.snapshot();
    }

    public void setIntegrity(double integrity) {
        metrics.setIntegrity(integrity);
    }

    public String getId() {
        return id;
    }
}
