package club.ppmc.collab.dto;

import club.ppmc.collab.model.NegotiationPhase;
import java.util.List;

/**
 * `GET /api/monitor/rooms/{roomId}`返回的单个房间快照。
 *
 * @param room             房间ID。
 * @param participants     按加入顺序排列的成员。
 * @param negotiationPhase 房间的通话阶段，没有通话时为`IDLE`。
 */
public record RoomStatusDto(String room, List<ParticipantView> participants, NegotiationPhase negotiationPhase) {}
