/**
 * 每个房间中两个连接之间通话握手的记录。
 *
 * 只做标记，从不保存SDP或ICE内容，也不代表任一端真实的WebRTC状态。
 * 实例不可变，由`CallNegotiationService`按房间原子替换。
 */
package club.ppmc.collab.model;

import java.time.Instant;

public record NegotiationSession(
        String room,
        String callerConnection,
        String calleeConnection,
        NegotiationPhase phase,
        Instant updatedAt) {

    public static NegotiationSession offered(String room, String caller, String callee, Instant now) {
        return new NegotiationSession(room, caller, callee, NegotiationPhase.OFFER_SENT, now);
    }

    /**
     * @return {@code from} 与 {@code to} 是否恰为此会话的双方（方向不限）。
     */
    public boolean isBetween(String from, String to) {
        return (callerConnection.equals(from) && calleeConnection.equals(to))
                || (calleeConnection.equals(from) && callerConnection.equals(to));
    }

    public boolean involves(String connectionId) {
        return callerConnection.equals(connectionId) || calleeConnection.equals(connectionId);
    }

    /**
     * @throws IllegalStateException 状态机不允许此步骤时抛出。
     */
    public NegotiationSession advance(NegotiationPhase next, Instant now) {
        if (!phase.canAdvanceTo(next)) {
            throw new IllegalStateException("房间 " + room + " 中不允许的协商步骤: " + phase + " -> " + next);
        }
        return new NegotiationSession(room, callerConnection, calleeConnection, next, now);
    }
}
