/**
 * 此文件负责离开连接的清理工作。
 *
 * 主要职责:
 * - 主动离开某个房间与传输层断线走同一条路径: 在一次注册表调用中解析身份并移除映射，
 *   离开者是通话一方时拆除该房间的协商会话，最后通知剩余成员。
 * - 幂等: 已不在注册表中的连接不会产生任何通知。
 *
 * 关联:
 * - `CollabWebSocketHandler`: 收到 `leave` 时调用 `onLeave`，会话关闭时调用 `onDisconnect`。
 * - `PresenceService#announceDeparture`, `CallNegotiationService#tearDown`。
 */
package club.ppmc.collab.service;

import club.ppmc.collab.model.Departure;
import club.ppmc.collab.registry.ParticipantRegistry;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.WebSocketSession;

@Service
public class ConnectionLifecycleService {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionLifecycleService.class);

    private final ParticipantRegistry registry;
    private final PresenceService presenceService;
    private final CallNegotiationService negotiationService;

    public ConnectionLifecycleService(
            ParticipantRegistry registry,
            PresenceService presenceService,
            CallNegotiationService negotiationService) {
        this.registry = registry;
        this.presenceService = presenceService;
        this.negotiationService = negotiationService;
    }

    /**
     * 离开 {@code room}；{@code room} 为空时离开该连接所在的全部房间。
     */
    public Optional<Departure> onLeave(WebSocketSession session, String room) {
        if (room == null || room.isBlank()) {
            return onDisconnect(session);
        }
        var departure = registry.leave(session.getId(), room);
        departure.ifPresentOrElse(this::tearDown,
                () -> logger.debug("会话 {} 不是房间 '{}' 的成员，忽略离开请求。", session.getId(), room));
        return departure;
    }

    /**
     * 将已关闭的传输会话视为主动离开其所在的全部房间。
     */
    public Optional<Departure> onDisconnect(WebSocketSession session) {
        var departure = registry.remove(session);
        departure.ifPresentOrElse(this::tearDown,
                () -> logger.debug("会话 {} 未注册，无需清理。", session.getId()));
        return departure;
    }

    private void tearDown(Departure departure) {
        departure.rooms().forEach(room -> negotiationService.tearDown(room, departure.connectionId()));
        presenceService.announceDeparture(departure);
    }
}
