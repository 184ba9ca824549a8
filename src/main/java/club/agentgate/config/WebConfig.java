/**
 * 此文件定义了Spring Web MVC的核心配置。
 *
 * 主要职责:
 * - 注册 `GateAdmissionInterceptor`，对 `/v1/**` 下的所有请求执行封禁与速率限制检查。
 * - 注册 `AdminAuthenticationInterceptor`，要求 `/api/monitor/**` 下的修改操作携带管理员凭据。
 *
 * 关联:
 * - `GateAdmissionInterceptor`: 在此被注册，并应用于网关的校验接口。
 * - `AdminAuthenticationInterceptor`: 在此被注册，并应用于监控接口。
 */
package club.agentgate.config;

import club.agentgate.interceptor.AdminAuthenticationInterceptor;
import club.agentgate.interceptor.GateAdmissionInterceptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private static final Logger logger = LoggerFactory.getLogger(WebConfig.class);

    private static final String API_V1_PATHS_PATTERN = "/v1/**";
    private static final String MONITOR_PATHS_PATTERN = "/api/monitor/**";

    private final GateAdmissionInterceptor gateAdmissionInterceptor;
    private final AdminAuthenticationInterceptor adminAuthenticationInterceptor;

    public WebConfig(
            GateAdmissionInterceptor gateAdmissionInterceptor,
            AdminAuthenticationInterceptor adminAuthenticationInterceptor) {
        this.gateAdmissionInterceptor = gateAdmissionInterceptor;
        this.adminAuthenticationInterceptor = adminAuthenticationInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(gateAdmissionInterceptor)
                .addPathPatterns(API_V1_PATHS_PATTERN);
        registry.addInterceptor(adminAuthenticationInterceptor)
                .addPathPatterns(MONITOR_PATHS_PATTERN);
        logger.info("网关准入拦截器已注册，作用于路径: {}；管理认证拦截器已注册，作用于路径: {}",
                API_V1_PATHS_PATTERN, MONITOR_PATHS_PATTERN);
    }
}
