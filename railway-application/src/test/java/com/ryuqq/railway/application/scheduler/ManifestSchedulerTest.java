package com.ryuqq.railway.application.scheduler;

import com.ryuqq.railway.application.effect.EffectRunner;
import com.ryuqq.railway.application.effect.EffectWorkflow;
import com.ryuqq.railway.application.json.JsonMapper;
import com.ryuqq.railway.application.registry.WorkflowRegistry;
import com.ryuqq.railway.core.model.Manifest;
import com.ryuqq.railway.core.model.ScheduleType;
import com.ryuqq.railway.core.result.Result;
import com.ryuqq.railway.core.schedule.Cron;
import com.ryuqq.railway.core.schedule.Every;
import com.ryuqq.railway.core.schedule.ManifestOptions;
import com.ryuqq.railway.core.schedule.ManifestProperties;
import com.ryuqq.railway.core.spi.CronEvaluator;
import com.ryuqq.railway.core.spi.DataContext;
import com.ryuqq.railway.core.spi.DataContextFactory;
import com.ryuqq.railway.core.spi.DataContextTransaction;
import com.ryuqq.railway.core.spi.Table;
import com.ryuqq.railway.core.workflow.WorkflowException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ManifestScheduler 유닛 테스트.
 *
 * <p>저장소는 Mock으로 대체하고 검증 순서와 트랜잭션 경계를 확인합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ManifestSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    record SyncInput(String region) implements ManifestProperties {
    }

    record UnknownInput(String value) implements ManifestProperties {
    }

    static final class SyncCustomers extends EffectWorkflow<SyncInput, String> {
        SyncCustomers(EffectRunner runner) {
            super(runner);
        }

        @Override
        protected Result<String> runInternal(SyncInput input) {
            return Result.success(input.region());
        }
    }

    static final class ImportUnknown extends EffectWorkflow<UnknownInput, String> {
        ImportUnknown(EffectRunner runner) {
            super(runner);
        }

        @Override
        protected Result<String> runInternal(UnknownInput input) {
            return Result.success(input.value());
        }
    }

    @Mock
    private DataContextFactory dataContextFactory;

    @Mock
    private DataContext dataContext;

    @Mock
    private DataContextTransaction transaction;

    @Mock
    private Table<Manifest> manifests;

    @Mock
    private CronEvaluator cronEvaluator;

    private ManifestScheduler scheduler;

    @BeforeEach
    void setUp() {
        WorkflowRegistry registry = new WorkflowRegistry().register(SyncInput.class, SyncCustomers.class, SyncCustomers::new);
        scheduler = new ManifestScheduler(dataContextFactory, registry, cronEvaluator, new JsonMapper(),
            new SchedulerConfig(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void givenOpenContext() {
        when(dataContextFactory.create()).thenReturn(dataContext);
        when(dataContext.beginTransaction()).thenReturn(transaction);
        when(dataContext.manifests()).thenReturn(manifests);
    }

    @Test
    void 등록되지_않은_Workflow는_DB_접근_전에_거부() {
        // when & then
        assertThatThrownBy(() -> scheduler.schedule(ImportUnknown.class, "unknown", new UnknownInput("x"),
                Every.minutes(5), ManifestOptions.defaults()))
            .isInstanceOf(WorkflowException.class)
            .hasMessageContaining("is not registered");
        verify(dataContextFactory, never()).create();
    }

    @Test
    void 잘못된_cron_표현식은_DB_접근_전에_거부() {
        // given
        doThrow(new IllegalArgumentException("bad field")).when(cronEvaluator).validate(anyString());

        // when & then
        assertThatThrownBy(() -> scheduler.schedule(SyncCustomers.class, "sync-eu", new SyncInput("eu"),
                Cron.expression("61 * * * *"), ManifestOptions.defaults()))
            .isInstanceOf(WorkflowException.class)
            .hasMessageContaining("Invalid cron expression '61 * * * *'")
            .hasCauseInstanceOf(IllegalArgumentException.class);
        verify(dataContextFactory, never()).create();
    }

    @Test
    void 새_Manifest는_정의를_채워_추가하고_커밋() {
        // given
        givenOpenContext();
        when(manifests.findFirst(any())).thenReturn(Optional.empty());
        when(manifests.add(any(Manifest.class))).thenAnswer(invocation -> {
            Manifest added = invocation.getArgument(0);
            added.setId(1L);
            return added;
        });

        // when
        Manifest saved = scheduler.schedule(SyncCustomers.class, "sync-eu", new SyncInput("eu"),
            Every.minutes(15), ManifestOptions.defaults().withPriority(4));

        // then
        assertThat(saved.getId()).isEqualTo(1L);
        assertThat(saved.getName()).isEqualTo(SyncCustomers.class.getName());
        assertThat(saved.getPropertyTypeName()).isEqualTo(SyncInput.class.getName());
        assertThat(saved.getProperties()).isEqualTo("{\"region\":\"eu\"}");
        assertThat(saved.getScheduleType()).isEqualTo(ScheduleType.INTERVAL);
        assertThat(saved.getIntervalSeconds()).isEqualTo(900L);
        assertThat(saved.getMaxRetries()).isEqualTo(3);
        assertThat(saved.getPriority()).isEqualTo(4);
        assertThat(saved.getCreatedAt()).isEqualTo(NOW);
        verify(dataContext).saveChanges();
        verify(transaction).commit();
        verify(transaction).close();
        verify(dataContext).close();
    }

    @Test
    void trigger_없는_Manifest면_커밋하지_않고_예외() {
        // given
        givenOpenContext();
        when(manifests.findFirst(any())).thenReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> scheduler.trigger("missing"))
            .isInstanceOf(WorkflowException.class)
            .hasMessageContaining("No manifest found with ExternalId 'missing'");
        verify(transaction, never()).commit();
        verify(transaction).close();
        verify(dataContext).close();
    }
}
