/**
 * 此文件配置协作WebSocket端点。
 *
 * 主要职责:
 * - 启用WebSocket支持，并在`/collab`上注册`CollabWebSocketHandler`，只接受`allowed.origins`中的来源。
 * - 按`websocket.max`设置Servlet WebSocket容器的缓冲区大小和空闲超时。
 *
 * 关联:
 * - `WebSocketProperties`, `AppProperties`: 配置来源。
 */
package club.ppmc.collab.config;

import club.ppmc.collab.handler.CollabWebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
@EnableConfigurationProperties({AppProperties.class, CollabProperties.class, WebSocketProperties.class})
public class WebSocketConfig implements WebSocketConfigurer {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketConfig.class);
    public static final String COLLAB_PATH = "/collab";

    private final CollabWebSocketHandler collabWebSocketHandler;
    private final AppProperties appProperties;
    private final WebSocketProperties.Max limits;

    public WebSocketConfig(
            CollabWebSocketHandler collabWebSocketHandler,
            AppProperties appProperties,
            WebSocketProperties webSocketProperties) {
        this.collabWebSocketHandler = collabWebSocketHandler;
        this.appProperties = appProperties;
        this.limits = webSocketProperties.max();
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        var origins = appProperties.origins().toArray(String[]::new);
        registry.addHandler(collabWebSocketHandler, COLLAB_PATH).setAllowedOrigins(origins);
        logger.info("协作端点'{}'已注册，允许的源: {}", COLLAB_PATH, appProperties.origins());
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        var container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(Math.toIntExact(limits.textBufferSize().toBytes()));
        container.setMaxBinaryMessageBufferSize(Math.toIntExact(limits.binaryBufferSize().toBytes()));
        container.setMaxSessionIdleTimeout(limits.sessionIdleTimeout().toMillis());
        logger.info("WebSocket容器限制: 文本帧[{}], 二进制帧[{}], 空闲超时[{}]",
                limits.textBufferSize(), limits.binaryBufferSize(), limits.sessionIdleTimeout());
        return container;
    }
}
