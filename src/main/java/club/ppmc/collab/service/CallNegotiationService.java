/**
 * 此文件负责房间内两方之间WebRTC握手的撮合。
 *
 * 主要职责:
 * - 将 offer、answer、重协商消息、ICE候选和音视频开关转发给目标连接。SDP与候选内容不透明，从不解析。
 * - 按房间记录谁呼叫了谁以及当前协商阶段
 *   (`IDLE -> OFFER_SENT -> CONNECTED <-> RENEGOTIATING`，终态 `TORN_DOWN`)。
 *
 * 转发与阶段跟踪相互独立: 只要目标可达，消息就会被转发；只有当它是会话双方之间预期的下一步时，
 * 才会推进阶段。过期或乱序的消息仍被转发，但不会使会话回退，也不会跳过 offer/answer。
 *
 * 会话表的每个房间条目只通过 `compute` 系列方法修改。创建会话时在 `compute` 内部核对双方的
 * 成员身份，拆除同样经由 `compute`，因此与断线并发的呼叫请求不会留下指向已离开连接的会话。
 *
 * 关联:
 * - `StateRelayService#sendToPeer`: 定向投递及寻址校验。
 * - `ConnectionLifecycleService`: 在离开和断线时调用 `tearDown`。
 * - `NegotiationTimeoutTask`: 调用 `expireStaleOffers`。
 */
package club.ppmc.collab.service;

import club.ppmc.collab.dto.ClientMessage;
import club.ppmc.collab.dto.ServerMessage;
import club.ppmc.collab.model.NegotiationPhase;
import club.ppmc.collab.model.NegotiationSession;
import club.ppmc.collab.registry.ParticipantRegistry;
import club.ppmc.collab.transport.MessageSender;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.WebSocketSession;

@Service
public class CallNegotiationService {
    private static final Logger logger = LoggerFactory.getLogger(CallNegotiationService.class);

    // 房间ID -> 协商会话；没有条目即为 IDLE
    private final Map<String, NegotiationSession> sessions = new ConcurrentHashMap<>();

    private final ParticipantRegistry registry;
    private final StateRelayService relay;
    private final MessageSender sender;
    private final Clock clock;

    public CallNegotiationService(
            ParticipantRegistry registry, StateRelayService relay, MessageSender sender, Clock clock) {
        this.registry = registry;
        this.relay = relay;
        this.sender = sender;
        this.clock = clock;
    }

    /**
     * `call-request`: 转发 offer，并为主叫与被叫共同所在的房间开启新会话。
     * 同一对连接之间的旧会话会被重置；其他两名仍在房间内的成员之间的会话保持不变，
     * 第三名成员无法接管房间的通话。
     */
    public void requestCall(WebSocketSession session, ClientMessage.CallRequest message) {
        var caller = session.getId();
        var callee = message.to();
        var fromIdentity = registry.lookupIdentity(caller).orElse(message.identity());

        var delivered = relay.sendToPeer(session, callee,
                new ServerMessage.IncomingCall(caller, message.offer(), fromIdentity));
        if (!delivered) {
            return;
        }
        registry.sharedRoom(caller, callee).ifPresent(room -> sessions.compute(room, (key, current) -> {
            if (!registry.isMember(caller, room) || !registry.isMember(callee, room)) {
                logger.info("房间 '{}': {} 或 {} 已离开，呼叫仅转发，不建立会话。", room, caller, callee);
                return current;
            }
            if (current != null && !current.isBetween(caller, callee) && partiesPresent(current)) {
                logger.info("房间 '{}': {} 正在与 {} 协商，来自 {} 的呼叫仅转发。",
                        room, current.callerConnection(), current.calleeConnection(), caller);
                return current;
            }
            if (current != null) {
                logger.info("房间 '{}': {} 的 call-request 替换了处于 {} 阶段的会话。", room, caller, current.phase());
            }
            logger.info("房间 '{}': {} -> {} 进入 OFFER_SENT 阶段。", room, caller, callee);
            return NegotiationSession.offered(room, caller, callee, clock.instant());
        }));
    }

    /**
     * `call-accept`: 转发 answer；若应答的是待处理的 offer，则 `OFFER_SENT -> CONNECTED`。
     */
    public void acceptCall(WebSocketSession session, ClientMessage.CallAccept message) {
        var callee = session.getId();
        var caller = message.to();
        if (relay.sendToPeer(session, caller, new ServerMessage.CallAccepted(callee, message.answer()))) {
            advance(callee, caller, NegotiationPhase.OFFER_SENT, NegotiationPhase.CONNECTED, true);
        }
    }

    /**
     * `renegotiation-request`: 转发新的 offer；`CONNECTED -> RENEGOTIATING`。
     */
    public void requestRenegotiation(WebSocketSession session, ClientMessage.RenegotiationRequest message) {
        var from = session.getId();
        if (relay.sendToPeer(session, message.to(), new ServerMessage.RenegotiationNeeded(from, message.offer()))) {
            advance(from, message.to(), NegotiationPhase.CONNECTED, NegotiationPhase.RENEGOTIATING, false);
        }
    }

    /**
     * `renegotiation-answer`: 转发 answer；`RENEGOTIATING -> CONNECTED`。
     */
    public void answerRenegotiation(WebSocketSession session, ClientMessage.RenegotiationAnswer message) {
        var from = session.getId();
        if (relay.sendToPeer(session, message.to(), new ServerMessage.RenegotiationFinal(from, message.answer()))) {
            advance(from, message.to(), NegotiationPhase.RENEGOTIATING, NegotiationPhase.CONNECTED, false);
        }
    }

    public void relayIceCandidate(WebSocketSession session, ClientMessage.IceCandidate message) {
        relay.sendToPeer(session, message.to(), new ServerMessage.IceCandidate(session.getId(), message.candidate()));
    }

    /**
     * 音视频开关消息附带发送者注册时的身份，接收方据此核对对端。
     */
    public void relayVideoToggle(WebSocketSession session, ClientMessage.VideoToggle message) {
        var identity = registry.lookupIdentity(session.getId()).orElse(message.identity());
        relay.sendToPeer(session, message.to(), new ServerMessage.RemoteVideoToggle(message.isOff(), identity));
    }

    public void relayAudioToggle(WebSocketSession session, ClientMessage.AudioToggle message) {
        var identity = registry.lookupIdentity(session.getId()).orElse(message.identity());
        relay.sendToPeer(session, message.to(), new ServerMessage.RemoteAudioToggle(message.isOff(), identity));
    }

    /**
     * 若 {@code connectionId} 是房间会话的一方，则将会话置为 `TORN_DOWN` 并丢弃。其他成员离开时会话不受影响。
     * @return 被拆除的会话；没有可拆除的会话时返回空。
     */
    public Optional<NegotiationSession> tearDown(String room, String connectionId) {
        var torn = new NegotiationSession[1];
        sessions.compute(room, (key, current) -> {
            if (current == null || !current.involves(connectionId)) {
                return current;
            }
            logger.info("房间 '{}': {} 已离开，协商 {} -> TORN_DOWN。", room, connectionId, current.phase());
            torn[0] = current.advance(NegotiationPhase.TORN_DOWN, clock.instant());
            return null;
        });
        return Optional.ofNullable(torn[0]);
    }

    /**
     * 拆除所有停留在 `OFFER_SENT` 超过 {@code timeout} 的会话，并通知主叫。
     * @return 过期的会话。
     */
    public List<NegotiationSession> expireStaleOffers(Duration timeout) {
        var cutoff = clock.instant().minus(timeout);
        var expired = new ArrayList<NegotiationSession>();
        for (var session : List.copyOf(sessions.values())) {
            if (session.phase() != NegotiationPhase.OFFER_SENT || !session.updatedAt().isBefore(cutoff)) {
                continue;
            }
            // 期间已被应答或被新的 offer 替换，保持原样
            if (!sessions.remove(session.room(), session)) {
                continue;
            }
            logger.warn("房间 '{}': 来自 {} 的 offer 超过 {} 未被应答，已过期。",
                    session.room(), session.callerConnection(), timeout);
            registry.connection(session.callerConnection())
                    .ifPresent(caller -> sender.send(caller, new ServerMessage.NegotiationExpired(session.room())));
            expired.add(session.advance(NegotiationPhase.TORN_DOWN, clock.instant()));
        }
        return expired;
    }

    public NegotiationPhase phaseOf(String room) {
        var session = sessions.get(room);
        return session == null ? NegotiationPhase.IDLE : session.phase();
    }

    public Optional<NegotiationSession> sessionOf(String room) {
        return Optional.ofNullable(sessions.get(room));
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    private boolean partiesPresent(NegotiationSession session) {
        return registry.isMember(session.callerConnection(), session.room())
                && registry.isMember(session.calleeConnection(), session.room());
    }

    /**
     * 当发送方与目标恰为会话双方时，将两者共同房间的会话从 {@code expected} 推进到 {@code next}。
     * {@code fromCallee} 为真时，发送方必须是被叫。
     */
    private void advance(String senderId, String targetId, NegotiationPhase expected, NegotiationPhase next,
            boolean fromCallee) {
        registry.sharedRoom(senderId, targetId).ifPresent(room -> sessions.computeIfPresent(room, (key, current) -> {
            var parties = fromCallee
                    ? current.calleeConnection().equals(senderId) && current.callerConnection().equals(targetId)
                    : current.isBetween(senderId, targetId);
            if (!parties || current.phase() != expected) {
                logger.debug("房间 '{}': 来自 {} 的消息不改变阶段 {}（期望推进到 {}），仅转发。",
                        room, senderId, current.phase(), next);
                return current;
            }
            logger.info("房间 '{}': 协商 {} -> {}。", room, current.phase(), next);
            return current.advance(next, clock.instant());
        }));
    }
}
