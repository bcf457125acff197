/**
 * 此文件定义了`application.yml`中`websocket`部分的类型安全绑定。
 *
 * 示例:
 *   ```yaml
 *   websocket:
 *     max:
 *       text-buffer-size: 2048KB
 *       binary-buffer-size: 512KB
 *       session-idle-timeout: 30m
 *     send:
 *       time-limit: 10s
 *       buffer-limit: 4MB
 *   ```
 *
 * 关联:
 * - `WebSocketConfig`: 用`max`配置Servlet WebSocket容器。
 * - `CollabWebSocketHandler`: 用`send`限制每个连接的发送队列。
 */
package club.ppmc.collab.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DataSizeUnit;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.util.unit.DataSize;
import org.springframework.util.unit.DataUnit;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "websocket")
@Validated
public record WebSocketProperties(
        @Valid @NotNull @DefaultValue Max max,
        @Valid @NotNull @DefaultValue Send send) {

    /**
     * 容器级限制。代码和白板笔画以单个文本帧传输，因此文本缓冲区比二进制缓冲区大。
     */
    public record Max(
            @NotNull @DefaultValue("2048") @DataSizeUnit(DataUnit.KILOBYTES) DataSize textBufferSize,
            @NotNull @DefaultValue("512") @DataSizeUnit(DataUnit.KILOBYTES) DataSize binaryBufferSize,
            @NotNull @DefaultValue("30") @DurationUnit(ChronoUnit.MINUTES) Duration sessionIdleTimeout) {}

    /**
     * 单个连接的发送限制，超出后该连接被关闭。
     */
    public record Send(
            @NotNull @DefaultValue("10000") @DurationUnit(ChronoUnit.MILLIS) Duration timeLimit,
            @NotNull @DefaultValue("4096") @DataSizeUnit(DataUnit.KILOBYTES) DataSize bufferLimit) {}
}
