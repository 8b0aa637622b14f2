package com.ryuqq.railway.application.effect.alerting;

import com.ryuqq.railway.application.effect.EffectProvider;
import com.ryuqq.railway.application.effect.EffectProviderFactory;
import com.ryuqq.railway.core.spi.DataContextFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * {@link AlertingEffectProvider} 팩토리.
 *
 * <p>재전송 억제 상태는 팩토리가 가지고 있어 실행마다 만들어지는 Provider가 공유합니다.
 * cooldown이 0이면 억제하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AlertingEffectProviderFactory implements EffectProviderFactory {

    private final DataContextFactory dataContextFactory;
    private final List<AlertSender> senders;
    private final AlertConfigurationRegistry configurations;
    private final AlertCooldown cooldown;
    private final Clock clock;

    public AlertingEffectProviderFactory(DataContextFactory dataContextFactory, List<AlertSender> senders,
                                         AlertConfigurationRegistry configurations) {
        this(dataContextFactory, senders, configurations, Duration.ZERO, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param dataContextFactory 실패 이력 조회용
     * @param senders 알림 채널 (호출 순서)
     * @param configurations Workflow별 알림 조건
     * @param cooldown 알림 후 같은 Workflow의 알림을 억제할 기간
     * @param clock 시계
     * @throws IllegalArgumentException 인자가 null이거나 cooldown이 음수인 경우
     */
    public AlertingEffectProviderFactory(DataContextFactory dataContextFactory, List<AlertSender> senders,
                                         AlertConfigurationRegistry configurations, Duration cooldown, Clock clock) {
        if (dataContextFactory == null) {
            throw new IllegalArgumentException("dataContextFactory cannot be null");
        }
        if (senders == null) {
            throw new IllegalArgumentException("senders cannot be null");
        }
        if (configurations == null) {
            throw new IllegalArgumentException("configurations cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.dataContextFactory = dataContextFactory;
        this.senders = List.copyOf(senders);
        this.configurations = configurations;
        this.cooldown = new AlertCooldown(cooldown);
        this.clock = clock;
    }

    @Override
    public EffectProvider create() {
        return new AlertingEffectProvider(dataContextFactory, senders, configurations, cooldown, clock);
    }
}
