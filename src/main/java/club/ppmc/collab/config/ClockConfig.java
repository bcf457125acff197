/**
 * 此文件提供协商阶段打时间戳所用的`Clock`。
 *
 * 关联:
 * - `CallNegotiationService`: 每次阶段变更打时间戳，过期清理时比较时间戳。
 * - `CollabWebSocketHandler`: `pong`中的服务器时间。
 */
package club.ppmc.collab.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
