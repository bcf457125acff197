/**
 * 此文件定义了`application.yml`中`collab`部分的类型安全绑定。
 *
 * 示例:
 *   ```yaml
 *   collab:
 *     relay:
 *       notify-undeliverable: false
 *     negotiation:
 *       timeout: 0s
 *       sweep-interval-ms: 15000
 *   ```
 *
 * 关联:
 * - `StateRelayService`: 读取转发失败时是否回复发送者。
 * - `NegotiationTimeoutTask`: 读取协商超时。
 */
package club.ppmc.collab.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "collab")
@Validated
public record CollabProperties(
        @Valid @NotNull @DefaultValue Relay relay,
        @Valid @NotNull @DefaultValue Negotiation negotiation) {

    /**
     * @param notifyUndeliverable 为true时，目标不可达的消息会向发送者回复`peer-unavailable`；否则静默丢弃。
     */
    public record Relay(@DefaultValue("false") boolean notifyUndeliverable) {}

    /**
     * @param timeout 会话停留在OFFER_SENT的最长时间；为0时不做过期清理。
     */
    public record Negotiation(@NotNull @DefaultValue("0s") Duration timeout) {

        public boolean timeoutEnabled() {
            return !timeout.isZero() && !timeout.isNegative();
        }
    }
}
