/**
 * 此文件定义了安全网关相关的Spring配置。
 *
 * 主要职责:
 * - 提供统一的 `Clock` Bean，所有读取时间的组件都从这里取时间。
 * - 根据 `GateProperties` 构建速率限制器、封禁列表、安全指标、规则表与扫描器。
 * - 提供默认的占位认证/授权实现；容器中已有其他实现时，默认实现自动让位。
 * - 创建 `SecurityGate` 并用同一份配置完成初始化。
 *
 * 关联:
 * - `GateProperties`: 为此类提供类型安全的配置数据。
 * - `SecurityEventSink`: 容器中所有接收方(如WebSocket广播器)都会注册到 `SecurityMetrics`。
 */
package club.agentgate.config;

import club.agentgate.scanner.RuleTables;
import club.agentgate.scanner.ThreatScanner;
import club.agentgate.service.BlockList;
import club.agentgate.service.RateLimiter;
import club.agentgate.service.SecurityEventSink;
import club.agentgate.service.SecurityGate;
import club.agentgate.service.SecurityMetrics;
import club.agentgate.service.auth.Authenticator;
import club.agentgate.service.auth.Authorizer;
import club.agentgate.service.auth.PermissionListAuthorizer;
import club.agentgate.service.auth.StaticCredentialAuthenticator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(GateProperties.class)
public class GateConfig {

    private static final Logger logger = LoggerFactory.getLogger(GateConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimiter rateLimiter(GateProperties properties, Clock clock) {
        var rateLimit = properties.rateLimit();
        return new RateLimiter(rateLimit.maxRequests(), rateLimit.windowMs(), clock);
    }

    @Bean
    public BlockList blockList(GateProperties properties, Clock clock) {
        logger.info("封禁列表已配置，封禁时长 {} ms。", properties.block().durationMs());
        return new BlockList(properties.block().durationMs(), clock);
    }

    @Bean
    public SecurityMetrics securityMetrics(
            GateProperties properties, Clock clock, ObjectProvider<SecurityEventSink> sinks) {
        var metrics = new SecurityMetrics(clock, properties.scan().recentThreats());
        sinks.orderedStream().forEach(metrics::subscribe);
        return metrics;
    }

    /**
     * 默认规则表。替换此Bean即可扩展或更换规则，而不需要修改扫描流程。
     */
    @Bean
    @ConditionalOnMissingBean
    public RuleTables ruleTables() {
        var rules = RuleTables.defaults();
        logger.info("规则表已加载: 内容 {} 条, 注入 {} 条, 行动标签 {} 条, 解决方案 {} 条。",
                rules.content().size(), rules.injection().size(),
                rules.actionTags().size(), rules.solution().size());
        return rules;
    }

    @Bean
    public ThreatScanner threatScanner(
            ObjectMapper objectMapper, RuleTables ruleTables, SecurityMetrics metrics, GateProperties properties) {
        logger.info("负载扫描上限: 大小 {} 字节, 深度 {}。",
                properties.scan().maxPayloadBytes(), properties.scan().maxDepth());
        return new ThreatScanner(objectMapper, ruleTables, metrics, properties.scan(), properties.resources());
    }

    @Bean
    @ConditionalOnMissingBean
    public Authenticator authenticator(GateProperties properties) {
        var authentication = properties.authentication();
        logger.warn("正在使用占位认证实现(固定用户名/密码)，请勿用于生产环境。");
        return new StaticCredentialAuthenticator(authentication.username(), authentication.password());
    }

    @Bean
    @ConditionalOnMissingBean
    public Authorizer authorizer() {
        return new PermissionListAuthorizer();
    }

    @Bean
    public SecurityGate securityGate(
            RateLimiter rateLimiter,
            BlockList blockList,
            ThreatScanner threatScanner,
            SecurityMetrics metrics,
            Authenticator authenticator,
            Authorizer authorizer,
            GateProperties properties) {
        var gate = new SecurityGate(rateLimiter, blockList, threatScanner, metrics, authenticator, authorizer);
        gate.initialize(properties);
        return gate;
    }
}
