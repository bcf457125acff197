/**
 * 此文件负责在房间成员之间转发共享的临时状态。
 *
 * 主要职责:
 * - 房间内广播（不含发送者）: 代码内容、语言切换、运行输出、白板笔画与清空。
 * - 定向投递给单个连接: 新成员的状态同步，以及 `CallNegotiationService` 使用的寻址。
 * - 不保存任何转发内容，负载原样发出。
 *
 * 寻址失败（目标未知、目标与发送者不在同一房间、发送者不在房间内）时丢弃消息。
 * 开启 `collab.relay.notify-undeliverable` 后，定向消息的发送者会收到 `peer-unavailable` 回复。
 *
 * 关联:
 * - `ParticipantRegistry`: 房间成员与连接会话的来源。
 * - `MessageSender`: 实际的写出操作。
 */
package club.ppmc.collab.service;

import club.ppmc.collab.config.CollabProperties;
import club.ppmc.collab.dto.ClientMessage;
import club.ppmc.collab.dto.ServerMessage;
import club.ppmc.collab.model.RoomMember;
import club.ppmc.collab.registry.ParticipantRegistry;
import club.ppmc.collab.transport.MessageSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.WebSocketSession;

@Service
public class StateRelayService {
    private static final Logger logger = LoggerFactory.getLogger(StateRelayService.class);

    private final ParticipantRegistry registry;
    private final MessageSender sender;
    private final boolean notifyUndeliverable;

    public StateRelayService(ParticipantRegistry registry, MessageSender sender, CollabProperties properties) {
        this.registry = registry;
        this.sender = sender;
        this.notifyUndeliverable = properties.relay().notifyUndeliverable();
    }

    public void relayCode(WebSocketSession session, ClientMessage.CodeBroadcast message) {
        broadcast(message.room(), session, new ServerMessage.CodeUpdate(message.code()));
    }

    public void relayLanguage(WebSocketSession session, ClientMessage.LanguageBroadcast message) {
        broadcast(message.room(), session, new ServerMessage.LanguageUpdate(message.language(), message.snippet()));
    }

    public void relayOutput(WebSocketSession session, ClientMessage.OutputBroadcast message) {
        broadcast(message.room(), session, new ServerMessage.OutputUpdate(message.output()));
    }

    public void relayWhiteboard(WebSocketSession session, ClientMessage.WhiteboardUpdate message) {
        broadcast(message.room(), session, new ServerMessage.WhiteboardUpdate(message.strokes()));
    }

    public void clearWhiteboard(WebSocketSession session, ClientMessage.WhiteboardClear message) {
        broadcast(message.room(), session, new ServerMessage.WhiteboardCleared(session.getId()));
    }

    /**
     * 将发送者的当前状态发给一个连接，通常是刚被放行的新成员。
     */
    public void syncToConnection(WebSocketSession session, ClientMessage.SyncToConnection message) {
        sendToPeer(session, message.targetConnection(), new ServerMessage.StateSync(session.getId(), message.payload()));
    }

    /**
     * 将 {@code message} 投递给 {@code room} 中除 {@code session} 以外的所有成员。
     * @return 成功交给传输层的成员数。
     */
    public int broadcast(String room, WebSocketSession session, ServerMessage message) {
        if (room == null || room.isBlank()) {
            logger.warn("丢弃来自 {} 的 {}: 未指定房间。", session.getId(), message.getClass().getSimpleName());
            return 0;
        }
        var members = registry.membersOf(room);
        if (members.stream().noneMatch(member -> member.connectionId().equals(session.getId()))) {
            logger.warn("丢弃来自 {} 的 {}: 不是房间 '{}' 的成员。",
                    session.getId(), message.getClass().getSimpleName(), room);
            return 0;
        }
        var recipients = members.stream()
                .filter(member -> !member.connectionId().equals(session.getId()))
                .map(RoomMember::session)
                .toList();
        var delivered = sender.sendAll(recipients, message);
        logger.debug("{} 已从 {} 转发给房间 '{}' 的 {}/{} 名成员。",
                message.getClass().getSimpleName(), session.getId(), room, delivered, recipients.size());
        return delivered;
    }

    /**
     * 当 {@code targetConnectionId} 已注册且与 {@code session} 同在一个房间时，将 {@code message} 投递给它。
     * @return 消息已交给传输层时返回 `true`。
     */
    public boolean sendToPeer(WebSocketSession session, String targetConnectionId, ServerMessage message) {
        var target = resolvePeer(session, targetConnectionId);
        if (target == null) {
            if (notifyUndeliverable) {
                sender.send(session, new ServerMessage.PeerUnavailable(targetConnectionId));
            }
            return false;
        }
        var delivered = sender.send(target, message);
        logger.debug("{} 已从 {} 发往 {}: {}。",
                message.getClass().getSimpleName(), session.getId(), targetConnectionId, delivered ? "成功" : "失败");
        return delivered;
    }

    private WebSocketSession resolvePeer(WebSocketSession session, String targetConnectionId) {
        if (targetConnectionId == null || targetConnectionId.isBlank()) {
            logger.warn("来自 {} 的定向消息缺少目标连接。", session.getId());
            return null;
        }
        if (targetConnectionId.equals(session.getId())) {
            logger.warn("来自 {} 的定向消息以自身为目标，已丢弃。", session.getId());
            return null;
        }
        var target = registry.connection(targetConnectionId);
        if (target.isEmpty()) {
            logger.warn("目标连接 {} 未注册，来自 {} 的消息已丢弃。",
                    targetConnectionId, session.getId());
            return null;
        }
        if (registry.sharedRoom(session.getId(), targetConnectionId).isEmpty()) {
            logger.warn("连接 {} 与 {} 不在同一房间，消息已丢弃。", session.getId(), targetConnectionId);
            return null;
        }
        return target.get();
    }
}
