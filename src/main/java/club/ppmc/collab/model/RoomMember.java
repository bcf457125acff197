/**
 * `ParticipantRegistry`中的一名房间成员。
 *
 * 关联:
 * - `ParticipantRegistry#membersOf`: 生成此对象。
 * - `StateRelayService`, `PresenceService`: 向`session`发送消息。
 */
package club.ppmc.collab.model;

import club.ppmc.collab.dto.ParticipantView;
import org.springframework.web.socket.WebSocketSession;

/**
 * @param connectionId 在线连接的ID，即其他成员在`to`字段中使用的地址。
 * @param identity     成员加入时使用的类邮箱标识；仅在身份从未解析时为`null`。
 * @param session      传输会话，由WebSocket容器持有。
 */
public record RoomMember(String connectionId, String identity, WebSocketSession session) {

    public ParticipantView view() {
        return new ParticipantView(connectionId, identity);
    }

    @Override
    public String toString() {
        return "RoomMember{connectionId='" + connectionId + "', identity='" + identity + "'}";
    }
}
