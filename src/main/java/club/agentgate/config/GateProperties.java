/**
 * 此文件定义了安全网关的类型安全配置属性。
 *
 * 主要职责:
 * - 使用 `@ConfigurationProperties` 将 `application.yml` 中以 "gate" 为前缀的配置项
 *   (速率限制、封禁时长、扫描上限、资源上限、清理周期、各子系统开关、用户权限)
 *   绑定到此不可变记录及其嵌套记录上。
 * - 为缺失的配置段提供默认值，使得网关在没有任何配置时也能以默认策略运行。
 * - 它同时是 `SecurityGate.initialize` 接收的配置对象。
 *
 * 关联:
 * - `GateConfig`: 根据此配置构建速率限制器、封禁列表、扫描器与网关。
 * - `SecurityGate`: 初始化时读取子系统开关与 `userPermissions`。
 * - `application.yml`: 是此配置类的数据源。
 */
package club.agentgate.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 将 application.yml 中的 'gate' 配置项映射到此不可变记录。
 *
 * @param rateLimit       固定窗口速率限制参数。
 * @param block           临时封禁参数。
 * @param scan            负载扫描的结构上限。
 * @param resources       行动计划声明资源的上限。
 * @param sweep           过期条目清理任务的周期。
 * @param authentication  认证子系统开关及占位凭据。
 * @param authorization   授权子系统开关。
 * @param encryption      加密子系统开关。
 * @param monitoring      监控子系统开关，启用时所有安全事件会写入日志。
 * @param userPermissions 调用方被授予的权限，行动计划声明的权限必须是它的子集。
 */
@Validated
@ConfigurationProperties(prefix = "gate")
public record GateProperties(
        @Valid RateLimit rateLimit,
        @Valid Block block,
        @Valid Scan scan,
        @Valid Resources resources,
        @Valid Sweep sweep,
        Authentication authentication,
        Toggle authorization,
        Toggle encryption,
        Toggle monitoring,
        List<String> userPermissions) {

    public GateProperties {
        rateLimit = rateLimit != null ? rateLimit : new RateLimit(null, null);
        block = block != null ? block : new Block(null, null);
        scan = scan != null ? scan : new Scan(null, null, null);
        resources = resources != null ? resources : new Resources(null, null, null, null, null);
        sweep = sweep != null ? sweep : new Sweep(null);
        authentication = authentication != null ? authentication : new Authentication(null, null, null);
        authorization = authorization != null ? authorization : new Toggle(true);
        encryption = encryption != null ? encryption : new Toggle(false);
        monitoring = monitoring != null ? monitoring : new Toggle(true);
        userPermissions = userPermissions != null ? List.copyOf(userPermissions) : List.of();
    }

    /**
     * 全部使用默认值的配置，供没有Spring上下文的调用方与测试使用。
     */
    public static GateProperties defaults() {
        return new GateProperties(null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * 返回一个仅替换了用户权限的副本。
     */
    public GateProperties withUserPermissions(List<String> permissions) {
        return new GateProperties(rateLimit, block, scan, resources, sweep,
                authentication, authorization, encryption, monitoring, permissions);
    }

    /**
     * 返回一个仅替换了速率限制参数的副本。
     */
    public GateProperties withRateLimit(int maxRequests, long windowMs) {
        return new GateProperties(new RateLimit(maxRequests, windowMs), block, scan, resources, sweep,
                authentication, authorization, encryption, monitoring, userPermissions);
    }

    /**
     * @param maxRequests 每个窗口内允许的最大请求数，默认100。
     * @param windowMs    窗口长度(毫秒)，默认60000。
     */
    public record RateLimit(@Positive Integer maxRequests, @Positive Long windowMs) {
        public RateLimit {
            maxRequests = maxRequests != null ? maxRequests : 100;
            windowMs = windowMs != null ? windowMs : 60_000L;
        }
    }

    /**
     * @param durationMs         封禁时长(毫秒)，默认300000。
     * @param rejectionThreshold HTTP入口连续被限流多少次后自动封禁，默认3。
     */
    public record Block(@Positive Long durationMs, @Positive Integer rejectionThreshold) {
        public Block {
            durationMs = durationMs != null ? durationMs : 300_000L;
            rejectionThreshold = rejectionThreshold != null ? rejectionThreshold : 3;
        }
    }

    /**
     * @param maxPayloadBytes 序列化后负载的最大字节数，默认1 MiB。
     * @param maxDepth        允许的最大嵌套深度，默认10。
     * @param recentThreats   指标快照中保留的最近威胁事件数，默认20。
     */
    public record Scan(@Positive Integer maxPayloadBytes, @Positive Integer maxDepth, @Positive Integer recentThreats) {
        public Scan {
            maxPayloadBytes = maxPayloadBytes != null ? maxPayloadBytes : 1024 * 1024;
            maxDepth = maxDepth != null ? maxDepth : 10;
            recentThreats = recentThreats != null ? recentThreats : 20;
        }
    }

    /**
     * 行动计划 `resources` 声明的上限。
     *
     * @param memory  内存(字节)，默认1 GiB。
     * @param cpu     CPU占用(百分比)，默认100。
     * @param time    执行时间(毫秒)，默认30000。
     * @param network 网络流量(字节)，默认100 MiB。
     * @param actions 单个计划中行动条目的最大数量。
     */
    public record Resources(
            @Positive Long memory,
            @Positive Long cpu,
            @Positive Long time,
            @Positive Long network,
            @Positive Integer actions) {
        public Resources {
            memory = memory != null ? memory : 1024L * 1024 * 1024;
            cpu = cpu != null ? cpu : 100L;
            time = time != null ? time : 30_000L;
            network = network != null ? network : 100L * 1024 * 1024;
            actions = actions != null ? actions : 100;
        }
    }

    /**
     * @param intervalMs 清理任务的执行间隔(毫秒)，默认60000。
     */
    public record Sweep(@Positive Long intervalMs) {
        public Sweep {
            intervalMs = intervalMs != null ? intervalMs : 60_000L;
        }
    }

    /**
     * 认证占位实现使用的固定凭据。仅作为扩展点，不是生产级认证。
     */
    public record Authentication(Boolean enabled, String username, String password) {
        public Authentication {
            enabled = enabled != null ? enabled : true;
            username = username != null ? username : "admin";
            password = password != null ? password : "password";
        }

        @Override
        public String toString() {
            return "Authentication{enabled=" + enabled + ", username='" + username + "', password='***'}";
        }
    }

    public record Toggle(Boolean enabled) {
        public Toggle {
            enabled = enabled != null && enabled;
        }
    }
}
