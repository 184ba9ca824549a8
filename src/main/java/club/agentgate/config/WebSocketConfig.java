/**
 * 此文件定义了WebSocket连接的Spring配置。
 *
 * 主要职责:
 * - 启用WebSocket支持 (`@EnableWebSocket`)。
 * - 注册 `SecurityEventBroadcaster`，在 `/ws/security-events` 上向监控端实时推送安全事件。
 * - 配置WebSocket服务器的底层参数，如缓冲区大小和会话超时时间。
 *
 * 关联:
 * - `SecurityEventBroadcaster`: 在此被注册为WebSocket处理器。
 * - `application.yml`: 读取允许的源 (`gate.websocket.allowed-origins`) 与容器参数 (`websocket.max.*`)。
 */
package club.agentgate.config;

import club.agentgate.handler.SecurityEventBroadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketConfig.class);
    private static final String SECURITY_EVENTS_PATH = "/ws/security-events";
    private static final int KB_TO_BYTES = 1024;
    private static final long MIN_TO_MS = 60 * 1000L;

    private final SecurityEventBroadcaster securityEventBroadcaster;
    private final String[] allowedOrigins;
    private final int maxTextMessageBufferSize;
    private final int maxBinaryMessageBufferSize;
    private final long maxSessionIdleTimeoutMs;

    public WebSocketConfig(
            SecurityEventBroadcaster securityEventBroadcaster,
            @Value("${gate.websocket.allowed-origins:*}") String[] allowedOrigins,
            @Value("${websocket.max.text-buffer-size-kb:64}") int maxTextMessageBufferSizeKb,
            @Value("${websocket.max.binary-buffer-size-kb:64}") int maxBinaryMessageBufferSizeKb,
            @Value("${websocket.max.session-timeout-min:30}") long maxSessionIdleTimeoutMin) {

        this.securityEventBroadcaster = securityEventBroadcaster;
        this.allowedOrigins = allowedOrigins;
        this.maxTextMessageBufferSize = maxTextMessageBufferSizeKb * KB_TO_BYTES;
        this.maxBinaryMessageBufferSize = maxBinaryMessageBufferSizeKb * KB_TO_BYTES;
        this.maxSessionIdleTimeoutMs = maxSessionIdleTimeoutMin * MIN_TO_MS;

        logger.info("WebSocketConfig初始化。安全事件路径: {}, 允许的源: {}",
                SECURITY_EVENTS_PATH, String.join(", ", allowedOrigins));
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(securityEventBroadcaster, SECURITY_EVENTS_PATH)
                .setAllowedOrigins(this.allowedOrigins);
        logger.info("已为路径'{}'注册SecurityEventBroadcaster。", SECURITY_EVENTS_PATH);
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        var container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(this.maxTextMessageBufferSize);
        container.setMaxBinaryMessageBufferSize(this.maxBinaryMessageBufferSize);
        container.setMaxSessionIdleTimeout(this.maxSessionIdleTimeoutMs);
        logger.info(
                "WebSocket容器已配置: MaxTextSize[{} B], MaxBinarySize[{} B], IdleTimeout[{} ms]",
                this.maxTextMessageBufferSize,
                this.maxBinaryMessageBufferSize,
                this.maxSessionIdleTimeoutMs);
        return container;
    }
}
