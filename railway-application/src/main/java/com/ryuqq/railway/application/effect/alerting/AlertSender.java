package com.ryuqq.railway.application.effect.alerting;

/**
 * 알림 전송 채널 (Slack, 이메일, 페이저 등).
 *
 * <p>{@link AlertingEffectProvider}가 알림 조건을 만족했을 때 등록된 모든 Sender를 순서대로 호출합니다.
 * 한 Sender의 예외는 로그만 남고 다음 Sender 호출을 막지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AlertSender {

    /**
     * 알림 전송.
     *
     * @param context 알림 내용
     */
    void send(AlertContext context);
}
