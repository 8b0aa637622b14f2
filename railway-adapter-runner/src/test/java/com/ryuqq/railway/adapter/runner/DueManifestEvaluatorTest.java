package com.ryuqq.railway.adapter.runner;

import com.ryuqq.railway.core.model.Manifest;
import com.ryuqq.railway.core.model.ScheduleType;
import com.ryuqq.railway.core.spi.CronEvaluator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * DueManifestEvaluator 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DueManifestEvaluatorTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    @Mock
    private CronEvaluator cronEvaluator;

    private Manifest manifest(ScheduleType type) {
        Manifest manifest = new Manifest();
        manifest.setId(1L);
        manifest.setScheduleType(type);
        return manifest;
    }

    @Test
    void INTERVAL_한_번도_성공하지_않았거나_주기가_지나면_실행() {
        // given
        DueManifestEvaluator evaluator = new DueManifestEvaluator(cronEvaluator);
        Manifest manifest = manifest(ScheduleType.INTERVAL);
        manifest.setIntervalSeconds(300L);

        // when & then
        assertThat(evaluator.isDue(manifest, Map.of(), NOW)).isTrue();
        manifest.setLastSuccessfulRun(NOW.minusSeconds(299));
        assertThat(evaluator.isDue(manifest, Map.of(), NOW)).isFalse();
        manifest.setLastSuccessfulRun(NOW.minusSeconds(300));
        assertThat(evaluator.isDue(manifest, Map.of(), NOW)).isTrue();
    }

    @Test
    void CRON_마지막_성공_이후_다음_실행_시각이_지났으면_실행() {
        // given
        DueManifestEvaluator evaluator = new DueManifestEvaluator(cronEvaluator);
        Manifest manifest = manifest(ScheduleType.CRON);
        manifest.setCronExpression("0 * * * *");
        manifest.setCreatedAt(NOW.minusSeconds(1800));
        when(cronEvaluator.nextOccurrence("0 * * * *", NOW.minusSeconds(1800))).thenReturn(NOW);
        when(cronEvaluator.nextOccurrence("0 * * * *", NOW)).thenReturn(NOW.plusSeconds(3600));

        // when & then
        assertThat(evaluator.isDue(manifest, Map.of(), NOW)).isTrue();
        manifest.setLastSuccessfulRun(NOW);
        assertThat(evaluator.isDue(manifest, Map.of(), NOW)).isFalse();
    }

    @Test
    void DEPENDENT_부모가_마지막_실행_이후_성공했을_때만_실행() {
        // given
        DueManifestEvaluator evaluator = new DueManifestEvaluator(cronEvaluator);
        Manifest parent = manifest(ScheduleType.INTERVAL);
        Manifest child = manifest(ScheduleType.DEPENDENT);
        child.setId(2L);
        child.setDependsOnManifestId(1L);
        Map<Long, Manifest> byId = Map.of(1L, parent, 2L, child);

        // when & then
        assertThat(evaluator.isDue(child, byId, NOW)).isFalse();
        parent.setLastSuccessfulRun(NOW.minusSeconds(60));
        assertThat(evaluator.isDue(child, byId, NOW)).isTrue();
        child.setLastSuccessfulRun(NOW.minusSeconds(30));
        assertThat(evaluator.isDue(child, byId, NOW)).isFalse();
    }

    @Test
    void NONE_trigger_없이는_실행하지_않음() {
        // given
        DueManifestEvaluator evaluator = new DueManifestEvaluator(cronEvaluator);

        // when & then
        assertThat(evaluator.isDue(manifest(ScheduleType.NONE), Map.of(), NOW)).isFalse();
    }
}
