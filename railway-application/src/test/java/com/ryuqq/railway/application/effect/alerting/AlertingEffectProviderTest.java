package com.ryuqq.railway.application.effect.alerting;

import com.ryuqq.railway.application.effect.EffectProvider;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.spi.DataContext;
import com.ryuqq.railway.core.spi.DataContextFactory;
import com.ryuqq.railway.core.spi.Table;
import com.ryuqq.railway.core.workflow.CancellationToken;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * AlertingEffectProvider 유닛 테스트.
 *
 * <ul>
 *   <li>등록된 Workflow의 실패만 알림</li>
 *   <li>minimumFailures 1은 저장소 조회 없이 바로 전송</li>
 *   <li>minimumFailures 2 이상은 기간 안의 FAILED 수(이번 실패 포함)로 판단</li>
 *   <li>재전송 억제, Sender 예외 격리, 예외/Step 필터</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class AlertingEffectProviderTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");
    private static final String REPORT = "com.example.Report";

    @Mock
    private DataContextFactory dataContextFactory;

    @Mock
    private DataContext dataContext;

    @Mock
    private Table<Metadata> metadataTable;

    @Mock
    private AlertSender sender;

    @Mock
    private AlertSender brokenSender;

    private final AlertConfigurationRegistry configurations = new AlertConfigurationRegistry();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private EffectProvider provider(Duration cooldown, AlertSender... senders) {
        return new AlertingEffectProviderFactory(dataContextFactory, List.of(senders), configurations, cooldown, clock)
            .create();
    }

    private static Metadata failed(long id, Instant startTime, String step, Exception exception) {
        Metadata metadata = Metadata.create(REPORT, null, startTime);
        metadata.setId(id);
        metadata.markInProgress();
        metadata.fail(startTime.plusSeconds(1), step, exception);
        return metadata;
    }

    private static Metadata completed(long id, Instant startTime) {
        Metadata metadata = Metadata.create(REPORT, null, startTime);
        metadata.setId(id);
        metadata.markInProgress();
        metadata.complete(startTime.plusSeconds(1));
        return metadata;
    }

    private void givenHistory(List<Metadata> history) {
        when(dataContextFactory.create()).thenReturn(dataContext);
        when(dataContext.metadata()).thenReturn(metadataTable);
        when(metadataTable.findAll(any())).thenAnswer(invocation -> {
            Predicate<Metadata> filter = invocation.getArgument(0);
            return history.stream().filter(filter).toList();
        });
    }

    private void fail(EffectProvider provider, Metadata trigger) {
        provider.onError(trigger, new IllegalStateException(trigger.getFailureReason()), CancellationToken.none());
    }

    @Test
    void onError_등록되지_않은_Workflow면_알림_없음() {
        // given
        EffectProvider provider = provider(Duration.ZERO, sender);

        // when
        fail(provider, failed(1L, NOW, "Render", new IllegalStateException("boom")));

        // then
        verifyNoInteractions(sender, dataContextFactory);
    }

    @Test
    void onError_minimumFailures가_1이면_저장소_조회_없이_바로_전송() {
        // given
        configurations.register(REPORT, new AlertConfiguration());
        EffectProvider provider = provider(Duration.ZERO, sender);
        Metadata trigger = failed(1L, NOW, "Render", new IllegalStateException("boom"));
        trigger.setInput("{\"month\":1}");

        // when
        fail(provider, trigger);

        // then
        ArgumentCaptor<AlertContext> sent = ArgumentCaptor.forClass(AlertContext.class);
        verify(sender).send(sent.capture());
        AlertContext context = sent.getValue();
        assertThat(context.workflowName()).isEqualTo(REPORT);
        assertThat(context.trigger()).isSameAs(trigger);
        assertThat(context.failureCount()).isEqualTo(1);
        assertThat(context.timeWindow()).isEqualTo(Duration.ZERO);
        assertThat(context.failedStepFrequency()).containsEntry("Render", 1L);
        assertThat(context.exceptionFrequency()).containsEntry(IllegalStateException.class.getName(), 1L);
        assertThat(context.failedInputs()).containsExactly("{\"month\":1}");
        verifyNoInteractions(dataContextFactory);
    }

    @Test
    void onError_기간_안의_실패가_기준에_도달하면_이력과_함께_전송() {
        // given
        configurations.register(REPORT, new AlertConfiguration().withMinimumFailures(3)
            .withTimeWindow(Duration.ofMinutes(30)));
        givenHistory(List.of(
            failed(1L, NOW.minusSeconds(1200), "Render", new TimeoutException("slow")),
            completed(2L, NOW.minusSeconds(900)),
            failed(3L, NOW.minusSeconds(600), "Render", new IllegalStateException("boom")),
            failed(4L, NOW.minus(Duration.ofHours(2)), "Render", new IllegalStateException("old"))));
        EffectProvider provider = provider(Duration.ZERO, sender);

        // when
        fail(provider, failed(5L, NOW, "Upload", new IllegalStateException("boom")));

        // then
        ArgumentCaptor<AlertContext> sent = ArgumentCaptor.forClass(AlertContext.class);
        verify(sender).send(sent.capture());
        AlertContext context = sent.getValue();
        assertThat(context.failureCount()).isEqualTo(3);
        assertThat(context.totalExecutions()).isEqualTo(4);
        assertThat(context.timeWindow()).isEqualTo(Duration.ofMinutes(30));
        assertThat(context.firstFailureTime()).isEqualTo(NOW.minusSeconds(1200));
        assertThat(context.lastSuccessTime()).isEqualTo(NOW.minusSeconds(899));
        assertThat(context.failedStepFrequency()).containsEntry("Render", 2L).containsEntry("Upload", 1L);
        assertThat(context.exceptionFrequency())
            .containsEntry(IllegalStateException.class.getName(), 2L)
            .containsEntry(TimeoutException.class.getName(), 1L);
        verify(dataContext).close();
    }

    @Test
    void onError_기간_안의_실패가_기준_미만이면_전송하지_않음() {
        // given
        configurations.register(REPORT, new AlertConfiguration().withMinimumFailures(3));
        givenHistory(List.of(failed(1L, NOW.minusSeconds(60), "Render", new IllegalStateException("boom"))));
        EffectProvider provider = provider(Duration.ZERO, sender);

        // when
        fail(provider, failed(2L, NOW, "Render", new IllegalStateException("boom")));

        // then
        verify(sender, never()).send(any());
    }

    @Test
    void onError_억제_기간_중에는_다시_전송하지_않고_Provider가_바뀌어도_유지() {
        // given
        configurations.register(REPORT, new AlertConfiguration());
        AlertingEffectProviderFactory factory = new AlertingEffectProviderFactory(dataContextFactory,
            List.of(sender), configurations, Duration.ofMinutes(10), clock);

        // when
        fail(factory.create(), failed(1L, NOW, "Render", new IllegalStateException("boom")));
        fail(factory.create(), failed(2L, NOW, "Render", new IllegalStateException("boom")));

        // then
        verify(sender, times(1)).send(any());
    }

    @Test
    void onError_Sender_하나가_실패해도_나머지_Sender는_호출() {
        // given
        configurations.register(REPORT, new AlertConfiguration());
        doThrow(new IllegalStateException("webhook down")).when(brokenSender).send(any());
        EffectProvider provider = provider(Duration.ZERO, brokenSender, sender);

        // when
        fail(provider, failed(1L, NOW, "Render", new IllegalStateException("boom")));

        // then
        verify(brokenSender).send(any());
        verify(sender).send(any());
    }

    @Test
    void onError_예외_타입이나_Step이_필터와_다르면_전송하지_않음() {
        // given
        configurations.register(REPORT, new AlertConfiguration()
            .withExceptionType(TimeoutException.class)
            .withFailureStep("Upload"));
        EffectProvider provider = provider(Duration.ZERO, sender);

        // when
        fail(provider, failed(1L, NOW, "Upload", new IllegalStateException("boom")));
        fail(provider, failed(2L, NOW, "Render", new TimeoutException("slow")));
        fail(provider, failed(3L, NOW, "Upload", new TimeoutException("slow")));

        // then
        verify(sender, times(1)).send(any());
    }

    @Test
    void AlertConfiguration_잘못된_값은_거부() {
        assertThatThrownBy(() -> new AlertConfiguration().withMinimumFailures(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("minimumFailures must be positive");
        assertThatThrownBy(() -> new AlertConfiguration().withTimeWindow(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AlertingEffectProviderFactory(dataContextFactory, List.of(sender),
            configurations, Duration.ofSeconds(-1), clock))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
