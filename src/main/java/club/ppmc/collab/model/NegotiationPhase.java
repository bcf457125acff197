/**
 * 房间通话协商的阶段。
 *
 * `IDLE -> OFFER_SENT -> CONNECTED -> RENEGOTIATING -> CONNECTED ... -> TORN_DOWN`。
 * 应答步骤并入`OFFER_SENT -> CONNECTED`: 信令层看不到ICE何时完成，转发answer即视为通话建立。
 */
package club.ppmc.collab.model;

public enum NegotiationPhase {
    IDLE,
    OFFER_SENT,
    CONNECTED,
    RENEGOTIATING,
    TORN_DOWN;

    /**
     * @return 从当前阶段进入 {@code next} 是否为状态机允许的步骤。
     */
    public boolean canAdvanceTo(NegotiationPhase next) {
        return switch (this) {
            case IDLE -> next == OFFER_SENT || next == TORN_DOWN;
            case OFFER_SENT -> next == CONNECTED || next == TORN_DOWN;
            case CONNECTED -> next == RENEGOTIATING || next == TORN_DOWN;
            case RENEGOTIATING -> next == CONNECTED || next == TORN_DOWN;
            case TORN_DOWN -> false;
        };
    }
}
