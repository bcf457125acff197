/**
 * 此文件定义了客户端可以发送的所有消息类型。
 *
 * 使用枚举使处理器中的switch类型安全；每个常量的线上名称即对应`ClientMessage` record的`type`值。
 *
 * 关联:
 * - `ClientMessage`: 每个record从`type()`返回对应常量。
 * - `CollabWebSocketHandler`: 按此枚举路由消息。
 */
package club.ppmc.collab.dto;

public enum MessageType {
    // 在线状态
    JOIN("join"),
    LEAVE("leave"),
    WAIT_FOR_ADMISSION("wait-for-admission"),
    PING("ping"),

    // 通话协商
    CALL_REQUEST("call-request"),
    CALL_ACCEPT("call-accept"),
    RENEGOTIATION_REQUEST("renegotiation-request"),
    RENEGOTIATION_ANSWER("renegotiation-answer"),
    ICE_CANDIDATE("ice-candidate"),
    VIDEO_TOGGLE("video-toggle"),
    AUDIO_TOGGLE("audio-toggle"),

    // 共享状态转发
    CODE_BROADCAST("code-broadcast"),
    LANGUAGE_BROADCAST("language-broadcast"),
    OUTPUT_BROADCAST("output-broadcast"),
    SYNC_TO_CONNECTION("sync-to-connection"),
    WHITEBOARD_UPDATE("whiteboard-update"),
    WHITEBOARD_CLEAR("whiteboard-clear");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
