package com.ryuqq.railway.application.effect.alerting;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 알림을 WARN 로그로 남기는 Sender.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LoggingAlertSender implements AlertSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertSender.class);

    @Override
    public void send(AlertContext context) {
        log.warn("ALERT {}: {} failures in {} (last: {} at step {}, metadata={})",
            context.workflowName(), context.failureCount(), context.timeWindow(),
            context.trigger().getFailureException(), context.trigger().getFailureStep(),
            context.trigger().getId());
    }
}
