/**
 * 此文件定义了一个清理未应答呼叫的定时任务。
 *
 * 主要职责:
 * - 每隔`collab.negotiation.sweep-interval-ms`，请`CallNegotiationService`拆除停留在`OFFER_SENT`
 *   超过`collab.negotiation.timeout`的会话。
 * - 超时为0（默认值）时不做任何事。
 *
 * 关联:
 * - `CollabServerApplication`: 需要`@EnableScheduling`注解来启用此定时任务。
 */
package club.ppmc.collab.scheduler;

import club.ppmc.collab.config.CollabProperties;
import club.ppmc.collab.service.CallNegotiationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class NegotiationTimeoutTask {

    private static final Logger logger = LoggerFactory.getLogger(NegotiationTimeoutTask.class);

    private final CallNegotiationService negotiationService;
    private final CollabProperties.Negotiation settings;

    public NegotiationTimeoutTask(CallNegotiationService negotiationService, CollabProperties properties) {
        this.negotiationService = negotiationService;
        this.settings = properties.negotiation();
    }

    @Scheduled(fixedDelayString = "${collab.negotiation.sweep-interval-ms:15000}")
    public void sweep() {
        expireUnansweredOffers();
    }

    /**
     * @return 本次清理的会话数。
     */
    public int expireUnansweredOffers() {
        if (!settings.timeoutEnabled()) {
            return 0;
        }
        try {
            var expired = negotiationService.expireStaleOffers(settings.timeout());
            if (!expired.isEmpty()) {
                logger.info("已清理 {} 个未应答的呼叫。", expired.size());
            }
            return expired.size();
        } catch (RuntimeException e) {
            // 捕获所有异常，防止定时任务因未捕获的异常而停止后续执行
            logger.error("执行呼叫过期清理任务时发生错误。", e);
            return 0;
        }
    }
}
