/**
 * 此文件定义了一个专用于清理过期标识符状态的定时任务。
 *
 * 主要职责:
 * - 按固定间隔移除过期的速率窗口、过期的封禁记录以及窗口已结束的连续拒绝计数，
 *   避免大量不同标识符导致内存无限增长。
 * - 惰性过期仍然生效；此任务只回收长期没有再被读取的条目。
 *
 * 关联:
 * - `RateLimiter`, `BlockList`: 调用它们的 `evictExpired` 方法。
 * - `GateAdmissionInterceptor`: 调用其 `evictExpiredRejections` 方法。
 * - `AgentGateApplication`: 需要有`@EnableScheduling`注解来启用此定时任务。
 */
package club.agentgate.scheduler;

import club.agentgate.interceptor.GateAdmissionInterceptor;
import club.agentgate.service.BlockList;
import club.agentgate.service.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class IdentifierStateSweeper {

    private static final Logger logger = LoggerFactory.getLogger(IdentifierStateSweeper.class);

    private final RateLimiter rateLimiter;
    private final BlockList blockList;
    private final GateAdmissionInterceptor admissionInterceptor;

    public IdentifierStateSweeper(
            RateLimiter rateLimiter, BlockList blockList, GateAdmissionInterceptor admissionInterceptor) {
        this.rateLimiter = rateLimiter;
        this.blockList = blockList;
        this.admissionInterceptor = admissionInterceptor;
    }

    @Scheduled(fixedDelayString = "${gate.sweep.interval-ms:60000}",
            initialDelayString = "${gate.sweep.interval-ms:60000}")
    public void sweepExpiredEntries() {
        try {
            var windows = rateLimiter.evictExpired();
            var blocks = blockList.evictExpired();
            var streaks = admissionInterceptor.evictExpiredRejections();
            if (windows > 0 || blocks > 0 || streaks > 0) {
                logger.info("过期条目清理完成: 速率窗口 {} 个, 封禁记录 {} 个, 连续拒绝计数 {} 个。",
                        windows, blocks, streaks);
            } else {
                logger.debug("过期条目清理完成，没有需要移除的条目。");
            }
        } catch (Exception e) {
            // 捕获并记录所有异常，防止定时任务因未捕获的异常而停止后续执行。
            logger.error("执行过期条目清理任务时发生错误。", e);
        }
    }
}
