/**
 * 此文件定义了速率限制状态的概览，供监控接口使用。
 */
package club.agentgate.dto;

public record RateLimitOverview(int trackedIdentifiers, int blockedIdentifiers) {}
