/**
 * 此文件定义了一次速率限制检查的结果。
 *
 * 关联:
 * - `RateLimiter` / `SecurityGate`: 返回此记录。
 * - `GateAdmissionInterceptor`: 据此决定放行或返回429，并写入 `X-RateLimit-*` 响应头。
 */
package club.agentgate.dto;

import java.time.Instant;

/**
 * @param allowed   本次请求是否被接受。
 * @param remaining 当前窗口内剩余的请求次数。
 * @param resetTime 当前窗口(或封禁)的结束时间。
 */
public record RateLimitStatus(boolean allowed, int remaining, Instant resetTime) {

    public static RateLimitStatus allowed(int remaining, Instant resetTime) {
        return new RateLimitStatus(true, remaining, resetTime);
    }

    public static RateLimitStatus rejected(Instant resetTime) {
        return new RateLimitStatus(false, 0, resetTime);
    }
}
