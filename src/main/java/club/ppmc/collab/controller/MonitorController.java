/**
 * 此文件提供用于监控服务器状态的只读API端点。
 *
 * 主要职责:
 * - `/api/monitor/status`: 返回在线连接数、房间数、进行中的协商数以及服务器时间。
 * - `/api/monitor/rooms/{roomId}`: 返回单个房间的成员与通话阶段，房间不存在时返回404。
 *
 * 关联:
 * - `ParticipantRegistry`, `CallNegotiationService`: 数据来源。
 * - `WebConfig`: `/api/**`的CORS配置。
 */
package club.ppmc.collab.controller;

import club.ppmc.collab.dto.RoomStatusDto;
import club.ppmc.collab.dto.ServerStatusDto;
import club.ppmc.collab.model.RoomMember;
import club.ppmc.collab.registry.ParticipantRegistry;
import club.ppmc.collab.service.CallNegotiationService;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/monitor")
public class MonitorController {

    private static final Logger logger = LoggerFactory.getLogger(MonitorController.class);

    private final ParticipantRegistry registry;
    private final CallNegotiationService negotiationService;
    private final Clock clock;

    public MonitorController(ParticipantRegistry registry, CallNegotiationService negotiationService, Clock clock) {
        this.registry = registry;
        this.negotiationService = negotiationService;
        this.clock = clock;
    }

    @GetMapping("/status")
    public ServerStatusDto getServerStatus() {
        logger.info("收到获取服务器状态的请求 /api/monitor/status");
        try {
            var status = ServerStatusDto.success(
                    registry.connectionCount(),
                    registry.roomCount(),
                    negotiationService.activeSessionCount(),
                    clock.millis());
            logger.debug("服务器状态获取成功: {}", status);
            return status;
        } catch (RuntimeException e) {
            logger.error("获取服务器状态时发生未知错误。", e);
            return ServerStatusDto.error(e.getMessage(), clock.millis());
        }
    }

    @GetMapping("/rooms/{roomId}")
    public ResponseEntity<RoomStatusDto> getRoom(@PathVariable String roomId) {
        logger.info("收到获取房间状态的请求 /api/monitor/rooms/{}", roomId);
        var members = registry.membersOf(roomId);
        if (members.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        var participants = members.stream().map(RoomMember::view).toList();
        return ResponseEntity.ok(new RoomStatusDto(roomId, participants, negotiationService.phaseOf(roomId)));
    }
}
