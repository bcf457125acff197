/**
 * 此文件是协作中继的WebSocket消息处理器。
 *
 * 主要职责:
 * - 管理连接生命周期 (`afterConnectionEstablished`, `afterConnectionClosed`)。连接建立时将会话包装为
 *   `ConcurrentWebSocketSessionDecorator`，来自不同处理线程的发送按调用顺序逐个写出。
 * - 将每个文本帧解析为`ClientMessage`，并路由到在线状态、通话协商或状态转发服务。
 * - 以`pong`响应`ping`，以`error`消息响应格式错误的帧，两种情况下连接均保持打开。
 *
 * 关联:
 * - `PresenceService`, `CallNegotiationService`, `StateRelayService`, `ConnectionLifecycleService`。
 * - `WebSocketConfig`: 在`/collab`上注册此处理器。
 */
package club.ppmc.collab.handler;

import club.ppmc.collab.config.WebSocketProperties;
import club.ppmc.collab.dto.ClientMessage;
import club.ppmc.collab.dto.ServerMessage;
import club.ppmc.collab.service.CallNegotiationService;
import club.ppmc.collab.service.ConnectionLifecycleService;
import club.ppmc.collab.service.PresenceService;
import club.ppmc.collab.service.StateRelayService;
import club.ppmc.collab.transport.MessageSender;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
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
public class CollabWebSocketHandler implements WebSocketHandler {
    private static final Logger logger = LoggerFactory.getLogger(CollabWebSocketHandler.class);

    private final PresenceService presenceService;
    private final CallNegotiationService negotiationService;
    private final StateRelayService relayService;
    private final ConnectionLifecycleService lifecycleService;
    private final MessageSender sender;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int sendTimeLimitMs;
    private final int sendBufferLimitBytes;

    // 会话ID -> 该会话的串行发送装饰器
    private final Map<String, WebSocketSession> connections = new ConcurrentHashMap<>();

    public CollabWebSocketHandler(
            PresenceService presenceService,
            CallNegotiationService negotiationService,
            StateRelayService relayService,
            ConnectionLifecycleService lifecycleService,
            MessageSender sender,
            ObjectMapper objectMapper,
            WebSocketProperties webSocketProperties,
            Clock clock) {
        this.presenceService = presenceService;
        this.negotiationService = negotiationService;
        this.relayService = relayService;
        this.lifecycleService = lifecycleService;
        this.sender = sender;
        this.objectMapper = objectMapper;
        this.clock = clock;
        var limits = webSocketProperties.send();
        this.sendTimeLimitMs = Math.toIntExact(limits.timeLimit().toMillis());
        this.sendBufferLimitBytes = Math.toIntExact(limits.bufferLimit().toBytes());
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        connections.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferLimitBytes));
        logger.info("新的WebSocket连接已建立: 会话ID {}", session.getId());
    }

    @Override
    public void handleMessage(WebSocketSession session, WebSocketMessage<?> message) {
        var connection = connectionFor(session);
        if (!(message instanceof TextMessage textMessage)) {
            logger.warn("忽略来自会话 {} 的非文本帧: {}", session.getId(), message.getClass().getSimpleName());
            sendErrorMessage(connection, "仅支持JSON文本帧。");
            return;
        }
        ClientMessage clientMessage;
        try {
            clientMessage = objectMapper.readValue(textMessage.getPayload(), ClientMessage.class);
        } catch (JsonProcessingException e) {
            logger.warn("无法解析来自会话 {} 的消息: {}", session.getId(), e.getOriginalMessage());
            sendErrorMessage(connection, "无效的消息格式或未知的消息类型。");
            return;
        }
        if (clientMessage == null) {
            sendErrorMessage(connection, "消息为空。");
            return;
        }

        logReceivedMessage(connection, clientMessage);
        try {
            route(connection, clientMessage);
        } catch (RuntimeException e) {
            logger.error("处理消息 {} 失败 | 会话ID {}: {}", clientMessage.type(), session.getId(), e.getMessage(), e);
            sendErrorMessage(connection, "消息处理失败。");
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus closeStatus) {
        logger.info("WebSocket连接已关闭: 会话ID {} | 状态: {}", session.getId(), closeStatus);
        var connection = connections.remove(session.getId());
        lifecycleService.onDisconnect(connection != null ? connection : session);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.error("WebSocket传输错误 | 会话ID {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public boolean supportsPartialMessages() {
        return false; // 大段代码也以完整文本帧到达
    }

    private void route(WebSocketSession session, ClientMessage message) {
        switch (message.type()) {
            case JOIN -> presenceService.join(session, (ClientMessage.Join) message);
            case LEAVE -> lifecycleService.onLeave(session, ((ClientMessage.Leave) message).room());
            case WAIT_FOR_ADMISSION -> presenceService.relayAdmissionNotice(session, (ClientMessage.WaitForAdmission) message);
            case PING -> sender.send(session, new ServerMessage.Pong(clock.millis()));

            case CALL_REQUEST -> negotiationService.requestCall(session, (ClientMessage.CallRequest) message);
            case CALL_ACCEPT -> negotiationService.acceptCall(session, (ClientMessage.CallAccept) message);
            case RENEGOTIATION_REQUEST ->
                    negotiationService.requestRenegotiation(session, (ClientMessage.RenegotiationRequest) message);
            case RENEGOTIATION_ANSWER ->
                    negotiationService.answerRenegotiation(session, (ClientMessage.RenegotiationAnswer) message);
            case ICE_CANDIDATE -> negotiationService.relayIceCandidate(session, (ClientMessage.IceCandidate) message);
            case VIDEO_TOGGLE -> negotiationService.relayVideoToggle(session, (ClientMessage.VideoToggle) message);
            case AUDIO_TOGGLE -> negotiationService.relayAudioToggle(session, (ClientMessage.AudioToggle) message);

            case CODE_BROADCAST -> relayService.relayCode(session, (ClientMessage.CodeBroadcast) message);
            case LANGUAGE_BROADCAST -> relayService.relayLanguage(session, (ClientMessage.LanguageBroadcast) message);
            case OUTPUT_BROADCAST -> relayService.relayOutput(session, (ClientMessage.OutputBroadcast) message);
            case SYNC_TO_CONNECTION -> relayService.syncToConnection(session, (ClientMessage.SyncToConnection) message);
            case WHITEBOARD_UPDATE -> relayService.relayWhiteboard(session, (ClientMessage.WhiteboardUpdate) message);
            case WHITEBOARD_CLEAR -> relayService.clearWhiteboard(session, (ClientMessage.WhiteboardClear) message);
        }
    }

    // 未经包装的会话原样返回
    private WebSocketSession connectionFor(WebSocketSession session) {
        return connections.getOrDefault(session.getId(), session);
    }

    private void sendErrorMessage(WebSocketSession session, String errorMessageText) {
        sender.send(session, new ServerMessage.ErrorNotice(errorMessageText));
    }

    private void logReceivedMessage(WebSocketSession session, ClientMessage message) {
        switch (message.type()) {
            case CODE_BROADCAST, WHITEBOARD_UPDATE, ICE_CANDIDATE, PING ->
                    logger.debug("收到消息: {} | 会话: {}", message.type(), session.getId());
            default -> logger.info("收到消息: {} | 会话: {}", message, session.getId());
        }
    }
}
