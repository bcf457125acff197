/**
 * 此文件定义了表示服务器状态的数据传输对象(DTO)。
 *
 * 关联:
 * - `MonitorController`: 根据注册表与协商统计构建此对象，作为`/api/monitor/status`的响应体。
 */
package club.ppmc.collab.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerStatusDto(
        int onlineConnections,
        int activeRooms,
        int activeNegotiations,
        long serverTime,
        String status,
        String errorMessage) {

    public static ServerStatusDto success(int onlineConnections, int activeRooms, int activeNegotiations, long serverTime) {
        return new ServerStatusDto(onlineConnections, activeRooms, activeNegotiations, serverTime, "running", null);
    }

    public static ServerStatusDto error(String message, long serverTime) {
        return new ServerStatusDto(-1, -1, -1, serverTime, "error", message);
    }
}
