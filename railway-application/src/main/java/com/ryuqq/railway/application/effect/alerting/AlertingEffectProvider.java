package com.ryuqq.railway.application.effect.alerting;

import com.ryuqq.railway.application.effect.EffectProvider;
import com.ryuqq.railway.core.model.Entity;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.spi.DataContext;
import com.ryuqq.railway.core.spi.DataContextFactory;
import com.ryuqq.railway.core.statemachine.WorkflowState;
import com.ryuqq.railway.core.workflow.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Workflow 실패 시 알림 조건을 평가해 {@link AlertSender}로 알리는 Provider.
 *
 * <p><strong>onError 처리 흐름:</strong></p>
 * <pre>
 * 알림 조건 조회 (등록되지 않은 Workflow → 종료)
 *   ↓
 * 재전송 억제 기간 확인 (활성 → 종료)
 *   ↓
 * 이번 실패가 필터에 맞는지 확인
 *   ↓
 * minimumFailures == 1 → 저장소 조회 없이 바로 전송
 * minimumFailures  > 1 → timeWindow 안의 종료된 실행 조회, 필터에 맞는 FAILED 수 계산
 *   ↓
 * 기준 도달 시 모든 Sender에 전송 → 억제 기간 시작
 * </pre>
 *
 * <p>onError는 마지막 저장 직전에 호출되므로 이번 실패는 저장소 조회 결과에 없고 별도로 더해집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class AlertingEffectProvider implements EffectProvider {

    private static final Logger log = LoggerFactory.getLogger(AlertingEffectProvider.class);
    private static final String UNKNOWN = "Unknown";

    private final DataContextFactory dataContextFactory;
    private final List<AlertSender> senders;
    private final AlertConfigurationRegistry configurations;
    private final AlertCooldown cooldown;
    private final Clock clock;

    AlertingEffectProvider(DataContextFactory dataContextFactory, List<AlertSender> senders,
                           AlertConfigurationRegistry configurations, AlertCooldown cooldown, Clock clock) {
        this.dataContextFactory = dataContextFactory;
        this.senders = senders;
        this.configurations = configurations;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    @Override
    public void track(Entity<?> model) {
    }

    @Override
    public void update(Entity<?> model) {
    }

    @Override
    public void saveChanges(CancellationToken token) {
    }

    @Override
    public void onError(Metadata metadata, Exception exception, CancellationToken token) {
        String workflowName = metadata.getName();
        AlertConfiguration configuration = configurations.find(workflowName).orElse(null);
        if (configuration == null) {
            return;
        }
        Instant now = clock.instant();
        if (cooldown.isActive(workflowName, now)) {
            log.debug("Alert for {} suppressed, cooldown period active", workflowName);
            return;
        }
        if (!configuration.matches(metadata)) {
            log.debug("Failure of {} (metadata={}) does not match alert filters", workflowName, metadata.getId());
            return;
        }

        AlertContext context = configuration.minimumFailures() == 1
            ? singleFailure(metadata, configuration)
            : failuresInWindow(metadata, configuration, now);
        if (context == null) {
            return;
        }
        send(context, now);
    }

    @Override
    public void close() {
    }

    private AlertContext singleFailure(Metadata trigger, AlertConfiguration configuration) {
        return new AlertContext(
            trigger.getName(),
            trigger,
            1,
            Duration.ZERO,
            1,
            trigger.getStartTime(),
            null,
            Map.of(Objects.requireNonNullElse(trigger.getFailureException(), UNKNOWN), 1L),
            Map.of(Objects.requireNonNullElse(trigger.getFailureStep(), UNKNOWN), 1L),
            trigger.getInput() == null || trigger.getInput().isEmpty() ? List.of() : List.of(trigger.getInput()),
            configuration);
    }

    private AlertContext failuresInWindow(Metadata trigger, AlertConfiguration configuration, Instant now) {
        Instant windowStart = now.minus(configuration.timeWindow());
        List<Metadata> finished;
        try (DataContext context = dataContextFactory.create()) {
            finished = context.metadata().findAll(row -> row.getName().equals(trigger.getName())
                && !Objects.equals(row.getId(), trigger.getId())
                && row.getWorkflowState().isTerminal()
                && !row.getStartTime().isBefore(windowStart));
        }
        List<Metadata> all = new ArrayList<>(finished);
        all.add(trigger);
        List<Metadata> failed = all.stream()
            .filter(row -> row.getWorkflowState() == WorkflowState.FAILED)
            .filter(configuration::matches)
            .toList();

        if (failed.size() < configuration.minimumFailures()) {
            log.debug("Alert conditions not met for {}: {} failures < {} required",
                trigger.getName(), failed.size(), configuration.minimumFailures());
            return null;
        }

        Instant lastSuccess = all.stream()
            .filter(row -> row.getWorkflowState() == WorkflowState.COMPLETED)
            .map(Metadata::getEndTime)
            .filter(Objects::nonNull)
            .max(Comparator.naturalOrder())
            .orElse(null);
        Instant firstFailure = failed.stream()
            .map(Metadata::getStartTime)
            .min(Comparator.naturalOrder())
            .orElse(trigger.getStartTime());

        return new AlertContext(
            trigger.getName(),
            trigger,
            failed.size(),
            configuration.timeWindow(),
            all.size(),
            firstFailure,
            lastSuccess,
            frequency(failed, Metadata::getFailureException),
            frequency(failed, Metadata::getFailureStep),
            failed.stream().map(Metadata::getInput).filter(input -> input != null && !input.isEmpty()).toList(),
            configuration);
    }

    private static Map<String, Long> frequency(List<Metadata> failed, Function<Metadata, String> key) {
        return failed.stream().collect(Collectors.groupingBy(
            row -> Objects.requireNonNullElse(key.apply(row), UNKNOWN), Collectors.counting()));
    }

    private void send(AlertContext context, Instant now) {
        log.info("Sending alert for workflow {}: {} failures met alert conditions",
            context.workflowName(), context.failureCount());
        for (AlertSender sender : senders) {
            try {
                sender.send(context);
            } catch (Exception e) {
                log.error("Alert sender {} failed for workflow {}", sender.getClass().getName(),
                    context.workflowName(), e);
            }
        }
        cooldown.start(context.workflowName(), now);
    }
}
