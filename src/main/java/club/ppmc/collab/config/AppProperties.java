/**
 * 此文件定义了`application.yml`中`allowed`部分的类型安全绑定。
 *
 * 关联:
 * - `WebConfig`, `WebSocketConfig`: 读取CORS与WebSocket握手允许的源列表。
 */
package club.ppmc.collab.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param origins 允许调用HTTP接口及建立WebSocket连接的源。
 */
@ConfigurationProperties(prefix = "allowed")
public record AppProperties(List<String> origins) {}
