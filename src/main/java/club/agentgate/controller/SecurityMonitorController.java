/**
 * 此文件提供了用于监控网关安全状态的API端点。
 *
 * 主要职责:
 * - `/api/monitor/security`: 返回派生的安全快照(评分、威胁等级、最近事件)。
 * - `/api/monitor/metrics`: 返回基础计数指标。
 * - `/api/monitor/blocked/{identifier}`: 查询或解除单个标识符的封禁。
 * - `/api/monitor/rate-limits`: 查询或重置速率限制状态。
 * - 修改操作(DELETE)由 `AdminAuthenticationInterceptor` 要求管理员凭据。
 *
 * 关联:
 * - `SecurityGate`: 提供所有监控数据与管理操作。
 */
package club.agentgate.controller;

import club.agentgate.dto.BlockStatus;
import club.agentgate.dto.GateMetrics;
import club.agentgate.dto.RateLimitOverview;
import club.agentgate.dto.SecuritySnapshot;
import club.agentgate.service.SecurityGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/monitor")
public class SecurityMonitorController {

    private static final Logger logger = LoggerFactory.getLogger(SecurityMonitorController.class);

    private final SecurityGate securityGate;

    public SecurityMonitorController(SecurityGate securityGate) {
        this.securityGate = securityGate;
    }

    @GetMapping("/security")
    public SecuritySnapshot getSecurityMetrics() {
        var snapshot = securityGate.getSecurityMetrics();
        logger.debug("安全快照: 评分 {}, 威胁等级 {}", snapshot.score(), snapshot.threatLevel());
        return snapshot;
    }

    @GetMapping("/metrics")
    public GateMetrics getMetrics() {
        return securityGate.getMetrics();
    }

    @GetMapping("/blocked/{identifier}")
    public BlockStatus getBlockStatus(@PathVariable String identifier) {
        return securityGate.getBlockStatus(identifier);
    }

    @DeleteMapping("/blocked/{identifier}")
    public ResponseEntity<Void> unblock(@PathVariable String identifier) {
        logger.info("收到解除封禁请求: {}", identifier);
        return securityGate.unblockIdentifier(identifier)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/rate-limits")
    public RateLimitOverview getRateLimitOverview() {
        return securityGate.getRateLimitOverview();
    }

    @DeleteMapping("/rate-limits")
    public ResponseEntity<Void> resetRateLimits() {
        logger.info("收到重置速率限制请求。");
        securityGate.resetRateLimits();
        return ResponseEntity.noContent().build();
    }
}
