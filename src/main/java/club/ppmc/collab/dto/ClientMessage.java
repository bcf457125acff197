/**
 * 此文件定义了客户端通过协作WebSocket发送的消息。
 *
 * 每种客户端事件对应一个record，由JSON的`type`属性选择，例如
 * `{"type":"join","identity":"alice@x","room":"r1"}` 绑定为 {@link ClientMessage.Join}。
 * WebRTC描述、ICE候选、白板笔画和同步负载以 {@link JsonNode} 保存，原样转发，不做解析。
 *
 * 关联:
 * - `MessageType`: 每个record的`type()`返回的常量。
 * - `CollabWebSocketHandler`: 将消息帧解析为此类型并路由。
 */
package club.ppmc.collab.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ClientMessage.Join.class, name = "join"),
        @JsonSubTypes.Type(value = ClientMessage.Leave.class, name = "leave"),
        @JsonSubTypes.Type(value = ClientMessage.WaitForAdmission.class, name = "wait-for-admission"),
        @JsonSubTypes.Type(value = ClientMessage.Ping.class, name = "ping"),
        @JsonSubTypes.Type(value = ClientMessage.CallRequest.class, name = "call-request"),
        @JsonSubTypes.Type(value = ClientMessage.CallAccept.class, name = "call-accept"),
        @JsonSubTypes.Type(value = ClientMessage.RenegotiationRequest.class, name = "renegotiation-request"),
        @JsonSubTypes.Type(value = ClientMessage.RenegotiationAnswer.class, name = "renegotiation-answer"),
        @JsonSubTypes.Type(value = ClientMessage.IceCandidate.class, name = "ice-candidate"),
        @JsonSubTypes.Type(value = ClientMessage.VideoToggle.class, name = "video-toggle"),
        @JsonSubTypes.Type(value = ClientMessage.AudioToggle.class, name = "audio-toggle"),
        @JsonSubTypes.Type(value = ClientMessage.CodeBroadcast.class, name = "code-broadcast"),
        @JsonSubTypes.Type(value = ClientMessage.LanguageBroadcast.class, name = "language-broadcast"),
        @JsonSubTypes.Type(value = ClientMessage.OutputBroadcast.class, name = "output-broadcast"),
        @JsonSubTypes.Type(value = ClientMessage.SyncToConnection.class, name = "sync-to-connection"),
        @JsonSubTypes.Type(value = ClientMessage.WhiteboardUpdate.class, name = "whiteboard-update"),
        @JsonSubTypes.Type(value = ClientMessage.WhiteboardClear.class, name = "whiteboard-clear")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public sealed interface ClientMessage {

    MessageType type();

    record Join(String identity, String room) implements ClientMessage {
        @Override
        public MessageType type() {
            return MessageType.JOIN;
        }
    }

    record Leave(String room, String identity) implements ClientMessage {
        @Override
        public MessageType type() {
            return MessageType.LEAVE;
        }
    }

    /** 已入场的成员发给新成员，提示其等待放行。 */
    record WaitForAdmission(String to, String identity) implements ClientMessage {
        @Override
        public MessageType type() {
            return MessageType.WAIT_FOR_ADMISSION;
        }
    }

    record Ping(Long sentAt) implements ClientMessage {
        @Override
        public MessageType type() {
            return MessageType.PING;
        }
    }

    record CallRequest(String to, JsonNode offer, String identity) implements ClientMessage {
        @Override
        public MessageType type() {
            return MessageType.CALL_REQUEST;
        }

        @Override
        public String toString() {
            return "CallRequest{to='" + to + "', identity='" + identity + "', offer=<sdp>}";
        }
    }

    record CallAccept(String to, JsonNode answer) implements ClientMessage {
        @Override
        public MessageType type() {
            return MessageType.CALL_ACCEPT;
        }

        @Override
        public String toString() {
            return "CallAccept{to='" + to + "', answer=<sdp>}";
        }
    }

    record RenegotiationRequest(String to, JsonNode offer) implements ClientMessage {
        @Override
        public MessageType type() {
            return MessageType.RENEGOTIATION_REQUEST;
        }

        @Override
        public String toString() {
            return "RenegotiationRequest{to='" + to + "', offer=<sdp>}";
        }
    }

    record RenegotiationAnswer(String to, JsonNode answer) implements ClientMessage {
        @Override
        public MessageType type() {
            return MessageType.RENEGOTIATION_ANSWER;
        }

        @Override
        public String toString() {
            return "RenegotiationAnswer{to='" + to + "', answer=<sdp>}";
        }
    }

    record IceCandidate(String to, JsonNode candidate) implements ClientMessage {
        @Override
        public MessageType type() {
            return MessageType.ICE_CANDIDATE;
        }
    }

    record VideoToggle(String to, @JsonProperty("isOff") boolean isOff, String identity)
            implements ClientMessage {
        @Override
        public MessageType type() {
            return MessageType.VIDEO_TOGGLE;
        }
    }

    record AudioToggle(String to, @JsonProperty("isOff") boolean isOff, String identity)
            implements ClientMessage {
        @Override
        public MessageType type() {
            return MessageType.AUDIO_TOGGLE;
        }
    }

    record CodeBroadcast(String room, String code) implements ClientMessage {
        @Override
        public MessageType type() {
            return MessageType.CODE_BROADCAST;
        }

        @Override
        public String toString() {
            return "CodeBroadcast{room='" + room + "', code=<" + (code == null ? 0 : code.length()) + " chars>}";
        }
    }

    record LanguageBroadcast(String room, String language, String snippet) implements ClientMessage {
        @Override
        public MessageType type() {
            return MessageType.LANGUAGE_BROADCAST;
        }

        @Override
        public String toString() {
            return "LanguageBroadcast{room='" + room + "', language='" + language + "'}";
        }
    }

    record OutputBroadcast(String room, String output) implements ClientMessage {
        @Override
        public MessageType type() {
            return MessageType.OUTPUT_BROADCAST;
        }

        @Override
        public String toString() {
            return "OutputBroadcast{room='" + room + "', output=<" + (output == null ? 0 : output.length()) + " chars>}";
        }
    }

    record SyncToConnection(String targetConnection, JsonNode payload) implements ClientMessage {
        @Override
        public MessageType type() {
            return MessageType.SYNC_TO_CONNECTION;
        }

        @Override
        public String toString() {
            return "SyncToConnection{targetConnection='" + targetConnection + "', payload=<state>}";
        }
    }

    record WhiteboardUpdate(String room, JsonNode strokes) implements ClientMessage {
        @Override
        public MessageType type() {
            return MessageType.WHITEBOARD_UPDATE;
        }

        @Override
        public String toString() {
            return "WhiteboardUpdate{room='" + room + "', strokes=<"
                    + (strokes == null ? 0 : strokes.size()) + ">}";
        }
    }

    record WhiteboardClear(String room) implements ClientMessage {
        @Override
        public MessageType type() {
            return MessageType.WHITEBOARD_CLEAR;
        }
    }
}
