/**
 * 此文件是Spring Web MVC的配置类。
 *
 * 主要职责:
 * - 为监控接口配置CORS，使浏览器客户端可以轮询房间状态。
 *
 * 关联:
 * - `AppProperties`: 允许的源。
 * - `MonitorController`: 此映射覆盖的接口。
 */
package club.ppmc.collab.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private static final Logger logger = LoggerFactory.getLogger(WebConfig.class);

    private static final String API_PATHS_PATTERN = "/api/**";
    private static final String[] ALLOWED_CORS_METHODS = new String[] {"GET", "OPTIONS"};

    private final String[] allowedCorsOrigins;

    public WebConfig(AppProperties appProperties) {
        this.allowedCorsOrigins = appProperties.origins().toArray(new String[0]);
        logger.info("WebConfig初始化。CORS允许的源: {}", appProperties.origins());
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping(API_PATHS_PATTERN)
                .allowedOrigins(this.allowedCorsOrigins)
                .allowedMethods(ALLOWED_CORS_METHODS)
                .allowedHeaders("*");

        logger.info("CORS映射已配置: 路径[{}], 允许的源[{}], 允许的方法[{}]",
                API_PATHS_PATTERN,
                String.join(", ", this.allowedCorsOrigins),
                String.join(", ", ALLOWED_CORS_METHODS));
    }
}
