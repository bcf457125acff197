/**
 * 此文件定义了服务器通过协作WebSocket推送给客户端的消息。
 *
 * 每种服务器事件对应一个record，Jackson根据`@JsonTypeName`写出`type`字段。
 * 转发的负载 (`offer`、`answer`、`candidate`、`strokes`、`payload`) 即发送方客户端提交的原始JSON节点。
 *
 * 关联:
 * - `MessageSender`: 将这些record序列化为文本帧。
 * - 各服务类负责创建它们。
 */
package club.ppmc.collab.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(ServerMessage.Joined.class),
        @JsonSubTypes.Type(ServerMessage.ParticipantJoined.class),
        @JsonSubTypes.Type(ServerMessage.WaitForAdmission.class),
        @JsonSubTypes.Type(ServerMessage.RoomRoster.class),
        @JsonSubTypes.Type(ServerMessage.ParticipantLeft.class),
        @JsonSubTypes.Type(ServerMessage.IncomingCall.class),
        @JsonSubTypes.Type(ServerMessage.CallAccepted.class),
        @JsonSubTypes.Type(ServerMessage.RenegotiationNeeded.class),
        @JsonSubTypes.Type(ServerMessage.RenegotiationFinal.class),
        @JsonSubTypes.Type(ServerMessage.IceCandidate.class),
        @JsonSubTypes.Type(ServerMessage.RemoteVideoToggle.class),
        @JsonSubTypes.Type(ServerMessage.RemoteAudioToggle.class),
        @JsonSubTypes.Type(ServerMessage.NegotiationExpired.class),
        @JsonSubTypes.Type(ServerMessage.CodeUpdate.class),
        @JsonSubTypes.Type(ServerMessage.LanguageUpdate.class),
        @JsonSubTypes.Type(ServerMessage.OutputUpdate.class),
        @JsonSubTypes.Type(ServerMessage.StateSync.class),
        @JsonSubTypes.Type(ServerMessage.WhiteboardUpdate.class),
        @JsonSubTypes.Type(ServerMessage.WhiteboardCleared.class),
        @JsonSubTypes.Type(ServerMessage.PeerUnavailable.class),
        @JsonSubTypes.Type(ServerMessage.Pong.class),
        @JsonSubTypes.Type(ServerMessage.ErrorNotice.class)
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface ServerMessage {

    // 在线状态

    @JsonTypeName("joined")
    record Joined(String identity, String room) implements ServerMessage {}

    @JsonTypeName("participant-joined")
    record ParticipantJoined(String identity, String connection) implements ServerMessage {}

    @JsonTypeName("wait-for-admission")
    record WaitForAdmission(String fromIdentity, String from) implements ServerMessage {}

    @JsonTypeName("room-roster")
    record RoomRoster(String room, List<ParticipantView> participants) implements ServerMessage {}

    @JsonTypeName("participant-left")
    record ParticipantLeft(String identity, String connection) implements ServerMessage {}

    // 通话协商

    @JsonTypeName("incoming-call")
    record IncomingCall(String from, JsonNode offer, String fromIdentity) implements ServerMessage {}

    @JsonTypeName("call-accepted")
    record CallAccepted(String from, JsonNode answer) implements ServerMessage {}

    @JsonTypeName("renegotiation-needed")
    record RenegotiationNeeded(String from, JsonNode offer) implements ServerMessage {}

    @JsonTypeName("renegotiation-final")
    record RenegotiationFinal(String from, JsonNode answer) implements ServerMessage {}

    @JsonTypeName("ice-candidate")
    record IceCandidate(String from, JsonNode candidate) implements ServerMessage {}

    @JsonTypeName("remote-video-toggle")
    record RemoteVideoToggle(@JsonProperty("isOff") boolean isOff, String identity) implements ServerMessage {}

    @JsonTypeName("remote-audio-toggle")
    record RemoteAudioToggle(@JsonProperty("isOff") boolean isOff, String identity) implements ServerMessage {}

    @JsonTypeName("negotiation-expired")
    record NegotiationExpired(String room) implements ServerMessage {}

    // 共享状态

    @JsonTypeName("code-update")
    record CodeUpdate(String code) implements ServerMessage {}

    @JsonTypeName("language-update")
    record LanguageUpdate(String language, String snippet) implements ServerMessage {}

    @JsonTypeName("output-update")
    record OutputUpdate(String output) implements ServerMessage {}

    @JsonTypeName("state-sync")
    record StateSync(String from, JsonNode payload) implements ServerMessage {}

    @JsonTypeName("whiteboard-update")
    record WhiteboardUpdate(JsonNode strokes) implements ServerMessage {}

    @JsonTypeName("whiteboard-clear")
    record WhiteboardCleared(String from) implements ServerMessage {}

    // 服务器回复

    @JsonTypeName("peer-unavailable")
    record PeerUnavailable(String to) implements ServerMessage {}

    @JsonTypeName("pong")
    record Pong(long serverTime) implements ServerMessage {}

    @JsonTypeName("error")
    record ErrorNotice(String message) implements ServerMessage {}
}
