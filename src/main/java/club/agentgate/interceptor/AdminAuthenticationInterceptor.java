/**
 * 此文件定义了一个保护监控管理操作的Spring拦截器。
 *
 * 主要职责:
 * - 解除封禁与重置速率限制会改变准入状态，只有通过认证的管理员可以调用。
 * - 从 `Authorization: Basic ...` 头中解析凭据，交给 `SecurityGate#authenticate` 校验。
 * - 缺少或错误的凭据返回 `401 Unauthorized` 并附带 `WWW-Authenticate` 头。
 * - 只读请求(GET等)直接放行。
 *
 * 关联:
 * - `WebConfig`: 此拦截器在此类中被注册到 `/api/monitor/**`。
 * - `SecurityMonitorController`: 被保护的管理端点。
 */
package club.agentgate.interceptor;

import club.agentgate.model.Credentials;
import club.agentgate.service.SecurityGate;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class AdminAuthenticationInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(AdminAuthenticationInterceptor.class);

    private static final String BASIC_PREFIX = "Basic ";
    static final String REALM_CHALLENGE = "Basic realm=\"agent-gate\"";

    // 会修改网关状态的HTTP方法
    private static final Set<String> MUTATING_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

    private final SecurityGate securityGate;

    public AdminAuthenticationInterceptor(SecurityGate securityGate) {
        this.securityGate = securityGate;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        if (!MUTATING_METHODS.contains(request.getMethod())) {
            return true;
        }

        var credentials = parseBasicCredentials(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (credentials == null) {
            logger.warn("管理请求缺少有效的Basic凭据: {} {}", request.getMethod(), request.getRequestURI());
            sendUnauthorized(response);
            return false;
        }
        if (!securityGate.authenticate(credentials)) {
            logger.warn("管理请求认证失败: 用户 '{}', {} {}",
                    credentials.username(), request.getMethod(), request.getRequestURI());
            sendUnauthorized(response);
            return false;
        }

        logger.info("管理请求已认证: 用户 '{}', {} {}",
                credentials.username(), request.getMethod(), request.getRequestURI());
        return true;
    }

    /**
     * 解析 `Basic base64(username:password)`。格式不正确时返回null。
     */
    static Credentials parseBasicCredentials(String header) {
        if (header == null || !header.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
            return null;
        }
        String decoded;
        try {
            decoded = new String(
                    Base64.getDecoder().decode(header.substring(BASIC_PREFIX.length()).trim()),
                    StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            logger.debug("Authorization头不是有效的Base64: {}", e.getMessage());
            return null;
        }
        var separator = decoded.indexOf(':');
        if (separator < 0) {
            return null;
        }
        return new Credentials(decoded.substring(0, separator), decoded.substring(separator + 1));
    }

    private void sendUnauthorized(HttpServletResponse response) throws IOException {
        var status = HttpStatus.UNAUTHORIZED;
        response.setStatus(status.value());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, REALM_CHALLENGE);
        response.setContentType("application/json;charset=UTF-8");
        var errorJson = """
                {
                  "code": %d,
                  "message": "%s"
                }
                """.formatted(status.value(), "管理操作需要有效的管理员凭据。");
        response.getWriter().write(errorJson);
    }
}
