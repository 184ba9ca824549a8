/**
 * 此文件是安全事件的WebSocket推送处理器。
 *
 * 主要职责:
 * - 管理监控端WebSocket连接的生命周期，维护当前所有订阅会话。
 * - 作为 `SecurityEventSink`，把每条被记录的威胁/漏洞事件序列化为JSON并推送给所有订阅者。
 * - 发送失败或已关闭的会话会被移除。
 * - 客户端发送的 `ping` 以 `pong` 回应，其余消息忽略。
 *
 * 关联:
 * - `WebSocketConfig`: 在此类中被注册到 `/ws/security-events`。
 * - `GateConfig`: 将此接收方注册到 `SecurityMetrics`。
 */
package club.agentgate.handler;

import club.agentgate.model.ThreatEvent;
import club.agentgate.service.SecurityEventSink;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

@Component
public class SecurityEventBroadcaster implements WebSocketHandler, SecurityEventSink {

    private static final Logger logger = LoggerFactory.getLogger(SecurityEventBroadcaster.class);

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 64 * 1024;

    // 映射: sessionId -> 线程安全包装后的会话。事件可能来自多个请求线程并发推送。
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper;

    public SecurityEventBroadcaster(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // 推送给订阅者的消息结构
    record EventMessage(String log, ThreatEvent event) {}

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
        logger.info("安全事件订阅已建立: 会话ID {}，当前订阅数 {}", session.getId(), sessions.size());
    }

    @Override
    public void handleMessage(WebSocketSession session, WebSocketMessage<?> message) {
        var payload = String.valueOf(message.getPayload()).trim();
        if ("ping".equalsIgnoreCase(payload)) {
            var target = sessions.getOrDefault(session.getId(), session);
            send(target, "pong");
        } else {
            logger.debug("忽略来自会话 {} 的消息。", session.getId());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus closeStatus) {
        sessions.remove(session.getId());
        logger.info("安全事件订阅已关闭: 会话ID {} | 状态: {}", session.getId(), closeStatus);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.error("WebSocket传输错误 | 会话ID {}: {}", session.getId(), exception.getMessage());
        sessions.remove(session.getId());
    }

    @Override
    public boolean supportsPartialMessages() {
        return false;
    }

    @Override
    public void onEvent(ThreatEvent event, boolean vulnerability) {
        if (sessions.isEmpty()) {
            return;
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(new EventMessage(vulnerability ? "vulnerability" : "threat", event));
        } catch (JsonProcessingException e) {
            logger.error("安全事件序列化失败: {}", event.ruleId(), e);
            return;
        }
        sessions.values().forEach(session -> send(session, json));
    }

    public int getSubscriberCount() {
        return sessions.size();
    }

    private void send(WebSocketSession session, String text) {
        if (!session.isOpen()) {
            logger.warn("会话 {} 已关闭，移除订阅。", session.getId());
            sessions.remove(session.getId());
            return;
        }
        try {
            session.sendMessage(new TextMessage(text));
        } catch (IOException | RuntimeException e) {
            logger.warn("向会话 {} 推送安全事件失败，移除订阅: {}", session.getId(), e.getMessage());
            sessions.remove(session.getId());
        }
    }
}
