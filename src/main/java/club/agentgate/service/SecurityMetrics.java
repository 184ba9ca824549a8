/**
 * 此服务类负责安全事件的记录与汇总。
 *
 * 主要职责:
 * - 维护只追加的威胁日志与漏洞日志，事件写入后不再修改。
 * - 维护检测数、拦截数计数器以及外部可设置的完整性指标。
 * - 按需派生快照: 安全评分、威胁等级与漏洞等级。
 * - 将每条事件推送给已注册的 `SecurityEventSink`。
 *
 * 线程安全: 日志追加与快照读取在同一把锁内完成；计数器为原子类型；
 * 接收方的推送发生在锁外，来自并发调用的事件顺序没有语义。
 *
 * 关联:
 * - 各扫描阶段: 在失败之前调用 `recordThreat` / `recordVulnerability`。
 * - `SecurityGate`: 调用 `recordBlocked` 与 `recordDetection`，并对外提供快照。
 */
package club.agentgate.service;

import club.agentgate.dto.SecuritySnapshot;
import club.agentgate.model.Severity;
import club.agentgate.model.ThreatEvent;
import club.agentgate.model.ThreatType;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SecurityMetrics {

    private static final Logger logger = LoggerFactory.getLogger(SecurityMetrics.class);

    private static final int BASE_SCORE = 100;
    private static final int THREAT_PENALTY = 10;
    private static final int VULNERABILITY_PENALTY = 5;

    private final Object lock = new Object();
    private final List<ThreatEvent> threats = new ArrayList<>();
    private final List<ThreatEvent> vulnerabilities = new ArrayList<>();

    private final AtomicLong threatsDetected = new AtomicLong();
    private final AtomicLong threatsBlocked = new AtomicLong();
    private volatile double integrity = 1.0;

    private final List<SecurityEventSink> sinks = new CopyOnWriteArrayList<>();

    private final Clock clock;
    private final int recentLimit;

    public SecurityMetrics(Clock clock, int recentLimit) {
        this.clock = clock;
        this.recentLimit = recentLimit;
    }

    public void subscribe(SecurityEventSink sink) {
        sinks.add(sink);
        logger.info("已注册安全事件接收方: {}", sink.getClass().getSimpleName());
    }

    public void unsubscribe(SecurityEventSink sink) {
        sinks.remove(sink);
    }

    /**
     * 记录一条威胁事件，同时增加检测计数。
     */
    public ThreatEvent recordThreat(ThreatType type, String ruleId, String detail, Severity severity) {
        var event = new ThreatEvent(type, ruleId, detail, severity, clock.instant());
        recordThreat(event);
        return event;
    }

    public void recordThreat(ThreatEvent event) {
        synchronized (lock) {
            threats.add(event);
        }
        threatsDetected.incrementAndGet();
        publish(event, false);
    }

    public ThreatEvent recordVulnerability(ThreatType type, String ruleId, String detail, Severity severity) {
        var event = new ThreatEvent(type, ruleId, detail, severity, clock.instant());
        recordVulnerability(event);
        return event;
    }

    public void recordVulnerability(ThreatEvent event) {
        synchronized (lock) {
            vulnerabilities.add(event);
        }
        publish(event, true);
    }

    /**
     * 只增加检测计数，不写入日志，也不影响评分。用于认证/授权失败。
     */
    public void recordDetection() {
        threatsDetected.incrementAndGet();
    }

    public void recordBlocked() {
        threatsBlocked.incrementAndGet();
    }

    public void setIntegrity(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("integrity不能为NaN");
        }
        this.integrity = Math.max(0.0, Math.min(1.0, value));
    }

    public SecuritySnapshot snapshot() {
        int threatCount;
        int vulnerabilityCount;
        List<ThreatEvent> recent;
        synchronized (lock) {
            threatCount = threats.size();
            vulnerabilityCount = vulnerabilities.size();
            recent = List.copyOf(threats.subList(Math.max(0, threatCount - recentLimit), threatCount));
        }
        return new SecuritySnapshot(
                threatsDetected.get(),
                threatsBlocked.get(),
                vulnerabilityCount,
                integrity,
                threatCount,
                score(threatCount, vulnerabilityCount),
                threatLevel(threatCount),
                vulnerabilityLevel(vulnerabilityCount),
                recent);
    }

    public long getThreatsDetected() {
        return threatsDetected.get();
    }

    public long getThreatsBlocked() {
        return threatsBlocked.get();
    }

    public double getIntegrity() {
        return integrity;
    }

    public int threatCount() {
        synchronized (lock) {
            return threats.size();
        }
    }

    public int vulnerabilityCount() {
        synchronized (lock) {
            return vulnerabilities.size();
        }
    }

    static int score(int threatCount, int vulnerabilityCount) {
        // long运算，避免事件数极大时溢出
        long penalty = (long) THREAT_PENALTY * threatCount + (long) VULNERABILITY_PENALTY * vulnerabilityCount;
        return (int) Math.max(0L, BASE_SCORE - penalty);
    }

    static Severity threatLevel(int threatCount) {
        if (threatCount > 10) return Severity.CRITICAL;
        if (threatCount > 5) return Severity.HIGH;
        if (threatCount > 2) return Severity.MEDIUM;
        return Severity.LOW;
    }

    static Severity vulnerabilityLevel(int vulnerabilityCount) {
        if (vulnerabilityCount > 5) return Severity.CRITICAL;
        if (vulnerabilityCount > 2) return Severity.HIGH;
        if (vulnerabilityCount > 0) return Severity.MEDIUM;
        return Severity.LOW;
    }

    private void publish(ThreatEvent event, boolean vulnerability) {
        for (var sink : sinks) {
            try {
                sink.onEvent(event, vulnerability);
            } catch (RuntimeException e) {
                // 接收方的故障不能影响校验结果
                logger.error("安全事件接收方 {} 处理事件 {} 失败", sink.getClass().getSimpleName(), event.ruleId(), e);
            }
        }
    }
}
