/**
 * 此文件负责将`ServerMessage`序列化并写入WebSocket会话。
 *
 * 主要职责:
 * - 向单个会话或一组会话发送消息，发出即返回。
 * - 写入失败只影响该接收方: 记录错误并以`SERVER_ERROR`关闭会话，容器随后报告断线，
 *   由`ConnectionLifecycleService`按普通断线处理。其余接收方照常投递。
 *
 * 关联:
 * - `ServerMessage`: 消息类型。
 * - `CollabWebSocketHandler`: 将每个会话包装为`ConcurrentWebSocketSessionDecorator`，
 *   同一会话的写入按调用顺序串行执行。
 */
package club.ppmc.collab.transport;

import club.ppmc.collab.dto.ServerMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Collection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

@Component
public class MessageSender {
    private static final Logger logger = LoggerFactory.getLogger(MessageSender.class);

    private final ObjectMapper objectMapper;

    public MessageSender(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return 消息帧已交给传输层时返回`true`。
     */
    public boolean send(WebSocketSession session, ServerMessage message) {
        if (session == null) {
            return false;
        }
        if (!session.isOpen()) {
            logger.warn("会话 {} 已关闭，跳过消息 {}。", session.getId(), message.getClass().getSimpleName());
            return false;
        }
        TextMessage frame;
        try {
            frame = new TextMessage(objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            logger.error("序列化消息 {} 失败 | 会话ID {}: {}",
                    message.getClass().getSimpleName(), session.getId(), e.getMessage(), e);
            return false;
        }
        return write(session, frame, message);
    }

    /**
     * 将同一条消息发给所有会话，消息只序列化一次。
     * @return 成功交给传输层的会话数。
     */
    public int sendAll(Collection<WebSocketSession> sessions, ServerMessage message) {
        if (sessions.isEmpty()) {
            return 0;
        }
        TextMessage frame;
        try {
            frame = new TextMessage(objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            logger.error("序列化消息 {} 失败: {}", message.getClass().getSimpleName(), e.getMessage(), e);
            return 0;
        }
        var delivered = 0;
        for (var session : sessions) {
            if (session == null) continue;
            if (!session.isOpen()) {
                logger.warn("会话 {} 已关闭，跳过消息 {}。", session.getId(), message.getClass().getSimpleName());
                continue;
            }
            if (write(session, frame, message)) {
                delivered++;
            }
        }
        return delivered;
    }

    private boolean write(WebSocketSession session, TextMessage frame, ServerMessage message) {
        try {
            session.sendMessage(frame);
            return true;
        } catch (IOException | IllegalStateException | SessionLimitExceededException e) {
            logger.error("向会话 {} 发送 {} 失败: {}，关闭该会话。",
                    session.getId(), message.getClass().getSimpleName(), e.getMessage());
            closeQuietly(session);
            return false;
        }
    }

    private void closeQuietly(WebSocketSession session) {
        try {
            session.close(CloseStatus.SERVER_ERROR);
        } catch (IOException e) {
            logger.warn("发送失败后关闭会话 {} 时再次出错: {}", session.getId(), e.getMessage());
        }
    }
}
