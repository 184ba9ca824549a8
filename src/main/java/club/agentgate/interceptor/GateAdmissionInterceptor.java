/**
 * 此文件定义了一个在请求到达Controller之前执行网关准入检查的Spring拦截器。
 *
 * 主要职责:
 * - 基于客户端IP地址(优先取代理头)识别调用方。
 * - 被封禁的调用方直接返回 `403 Forbidden`。
 * - 通过 `SecurityGate#checkRateLimit` 登记请求；超出限制时返回 `429 Too Many Requests`。
 * - 调用方连续被限流达到阈值后，将其封禁一段时间；任意一次放行都会清零连续计数。
 * - 在响应头中写入剩余次数和窗口重置时间。
 * - 连续拒绝计数随速率窗口一起过期，由 `IdentifierStateSweeper` 定期清理。
 *
 * 关联:
 * - `WebConfig`: 此拦截器在此类中被注册到 `/v1/**`。
 * - `SecurityGate`: 提供速率限制与封禁能力。
 * - `application.yml`: 从此文件读取连续拒绝阈值 (`gate.block.rejection-threshold`)。
 */
package club.agentgate.interceptor;

import club.agentgate.config.GateProperties;
import club.agentgate.service.SecurityGate;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class GateAdmissionInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(GateAdmissionInterceptor.class);

    static final String HEADER_X_FORWARDED_FOR = "X-Forwarded-For";
    static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    static final String HEADER_RESET = "X-RateLimit-Reset";

    private final SecurityGate securityGate;
    private final int rejectionThreshold;
    private final Clock clock;

    // 映射: 客户端ID -> 连续被限流的次数及最近一次拒绝所在窗口的结束时间
    private final Map<String, RejectionStreak> consecutiveRejections = new ConcurrentHashMap<>();

    record RejectionStreak(int count, Instant windowResetTime) {

        RejectionStreak next(Instant resetTime) {
            return new RejectionStreak(count + 1, resetTime);
        }
    }

    public GateAdmissionInterceptor(SecurityGate securityGate, GateProperties properties, Clock clock) {
        this.securityGate = securityGate;
        this.rejectionThreshold = properties.block().rejectionThreshold();
        this.clock = clock;
        logger.info("网关准入拦截器初始化，连续被限流 {} 次后自动封禁。", rejectionThreshold);
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        // 对CORS预检请求(OPTIONS)直接放行
        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            return true;
        }

        var clientId = getClientIdentifier(request);

        if (securityGate.isBlocked(clientId)) {
            logger.warn("已封禁的客户端 '{}' 请求 {}，拒绝访问。", clientId, request.getRequestURI());
            sendError(response, HttpStatus.FORBIDDEN, "该客户端已被临时封禁，请稍后再试。");
            return false;
        }

        var status = securityGate.checkRateLimit(clientId);
        response.setHeader(HEADER_REMAINING, String.valueOf(status.remaining()));
        response.setHeader(HEADER_RESET, String.valueOf(status.resetTime().toEpochMilli()));

        if (!status.allowed()) {
            // merge对同一个键原子执行
            var rejections = consecutiveRejections.merge(clientId, new RejectionStreak(1, status.resetTime()),
                    (streak, first) -> streak.next(first.windowResetTime())).count();
            if (rejections >= rejectionThreshold) {
                consecutiveRejections.remove(clientId);
                securityGate.blockIdentifier(clientId);
            }
            logger.warn("速率限制已超出: 客户端ID '{}', 连续拒绝 {} 次", clientId, rejections);
            sendError(response, HttpStatus.TOO_MANY_REQUESTS, "请求过于频繁，请稍后再试。");
            return false;
        }

        consecutiveRejections.remove(clientId);
        logger.debug("请求允许: 客户端ID '{}', 剩余 {}", clientId, status.remaining());
        return true;
    }

    /**
     * 移除窗口已结束的连续拒绝计数。窗口结束后的下一次请求必然被放行并清零计数，因此移除不改变封禁判定。
     *
     * @return 被移除的计数条目数。
     */
    public int evictExpiredRejections() {
        var now = clock.instant();
        var evicted = new AtomicInteger();
        for (var clientId : consecutiveRejections.keySet()) {
            consecutiveRejections.computeIfPresent(clientId, (key, streak) -> {
                if (now.isAfter(streak.windowResetTime())) {
                    evicted.incrementAndGet();
                    return null;
                }
                return streak;
            });
        }
        return evicted.get();
    }

    int trackedRejectionStreaks() {
        return consecutiveRejections.size();
    }

    /**
     * 获取客户端标识符，优先使用代理服务器设置的头信息，最后回退到直接连接的IP地址。
     */
    private String getClientIdentifier(HttpServletRequest request) {
        var ip = request.getHeader(HEADER_X_FORWARDED_FOR);
        if (ip != null && !ip.isBlank() && !"unknown".equalsIgnoreCase(ip)) {
            // 如果`X-Forwarded-For`包含多个IP，第一个通常是原始客户端IP
            return ip.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    private void sendError(HttpServletResponse response, HttpStatus status, String message) throws IOException {
        response.setStatus(status.value());
        response.setContentType("application/json;charset=UTF-8");
        var errorJson = """
                {
                  "code": %d,
                  "message": "%s"
                }
                """.formatted(status.value(), message);
        response.getWriter().write(errorJson);
    }
}
