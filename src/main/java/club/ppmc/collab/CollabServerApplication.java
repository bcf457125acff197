/**
 * 协作信令服务器的主入口。
 *
 * 主要职责:
 * - 启动Spring应用 (`@SpringBootApplication`)。
 * - `@EnableScheduling`开启定时任务支持，使`NegotiationTimeoutTask`得以运行。
 */
package club.ppmc.collab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CollabServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CollabServerApplication.class, args);
    }
}
