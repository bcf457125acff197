/**
 * 此文件实现协作房间的在线状态与入场协议。
 *
 * 主要职责:
 * - `join`: 注册连接，向加入者回送 `joined`，用 `participant-joined` 通知已有成员；
 *   房间内已有人时，通知加入者等待放行。
 * - 转发已有成员发给新成员的等待放行通知。
 * - 广播成员离开 (`participant-left`)，并保持每个成员的名单最新。
 *
 * 是否放行由客户端界面决定，本服务不会以此限制通话协商。
 *
 * 关联:
 * - `ParticipantRegistry`: 成员与身份状态。
 * - `ConnectionLifecycleService`: 离开与断线后调用 `announceDeparture`。
 */
package club.ppmc.collab.service;

import club.ppmc.collab.dto.ClientMessage;
import club.ppmc.collab.dto.ServerMessage;
import club.ppmc.collab.model.Departure;
import club.ppmc.collab.model.RoomMember;
import club.ppmc.collab.registry.ParticipantRegistry;
import club.ppmc.collab.transport.MessageSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.WebSocketSession;

@Service
public class PresenceService {
    private static final Logger logger = LoggerFactory.getLogger(PresenceService.class);

    private final ParticipantRegistry registry;
    private final StateRelayService relay;
    private final MessageSender sender;

    public PresenceService(ParticipantRegistry registry, StateRelayService relay, MessageSender sender) {
        this.registry = registry;
        this.relay = relay;
        this.sender = sender;
    }

    public void join(WebSocketSession session, ClientMessage.Join message) {
        var identity = message.identity();
        var room = message.room();
        if (identity == null || identity.isBlank() || room == null || room.isBlank()) {
            logger.warn("加入请求中身份或房间为空 | 会话ID: {}", session.getId());
            sender.send(session, new ServerMessage.ErrorNotice("加入房间需要非空的身份和房间ID。"));
            return;
        }

        var existing = registry.register(identity, session, room);
        sender.send(session, new ServerMessage.Joined(identity, room));
        logger.info("'{}' 已加入房间 '{}' | 会话ID: {} | 其他成员 {} 名",
                identity, room, session.getId(), existing.size());

        if (!existing.isEmpty()) {
            sender.sendAll(existing.stream().map(RoomMember::session).toList(),
                    new ServerMessage.ParticipantJoined(identity, session.getId()));
            var admitter = existing.get(0);
            sender.send(session, new ServerMessage.WaitForAdmission(admitter.identity(), admitter.connectionId()));
        }
        publishRoster(room);
    }

    /**
     * 将成员发出的“请等待放行”通知转发给其指定的新成员。
     */
    public void relayAdmissionNotice(WebSocketSession session, ClientMessage.WaitForAdmission message) {
        var fromIdentity = registry.lookupIdentity(session.getId()).orElse(message.identity());
        relay.sendToPeer(session, message.to(), new ServerMessage.WaitForAdmission(fromIdentity, session.getId()));
    }

    /**
     * 通知 {@code departure} 中每个房间的剩余成员该参与者已离开，随后刷新名单。
     */
    public void announceDeparture(Departure departure) {
        var notice = new ServerMessage.ParticipantLeft(departure.identity(), departure.connectionId());
        for (var room : departure.rooms()) {
            var remaining = registry.membersOf(room);
            sender.sendAll(remaining.stream().map(RoomMember::session).toList(), notice);
            logger.info("'{}' (会话 {}) 已离开房间 '{}' | 剩余成员 {} 名",
                    departure.identity(), departure.connectionId(), room, remaining.size());
            publishRoster(room);
        }
    }

    private void publishRoster(String room) {
        var members = registry.membersOf(room);
        if (members.isEmpty()) {
            return;
        }
        var roster = new ServerMessage.RoomRoster(room, members.stream().map(RoomMember::view).toList());
        sender.sendAll(members.stream().map(RoomMember::session).toList(), roster);
    }
}
