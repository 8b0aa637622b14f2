package com.ryuqq.railway.application.scheduler;

import com.ryuqq.railway.application.effect.EffectWorkflow;
import com.ryuqq.railway.application.json.JsonMapper;
import com.ryuqq.railway.application.registry.WorkflowRegistry;
import com.ryuqq.railway.core.model.Manifest;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.model.ScheduleType;
import com.ryuqq.railway.core.model.WorkQueueEntry;
import com.ryuqq.railway.core.schedule.ManifestItem;
import com.ryuqq.railway.core.schedule.ManifestOptions;
import com.ryuqq.railway.core.schedule.ManifestProperties;
import com.ryuqq.railway.core.schedule.Schedule;
import com.ryuqq.railway.core.spi.CronEvaluator;
import com.ryuqq.railway.core.spi.DataContext;
import com.ryuqq.railway.core.spi.DataContextFactory;
import com.ryuqq.railway.core.spi.DataContextTransaction;
import com.ryuqq.railway.core.workflow.WorkflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Manifest 예약 서비스.
 *
 * <p>모든 변경은 하나의 트랜잭션 안에서 이루어지며, 어떤 예외든 발생하면 그 호출이 만든 변경은 전부 롤백됩니다.
 * Workflow/입력 타입 조합은 DB에 쓰기 전에 {@link WorkflowRegistry}로 검증합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>externalId 기준 업서트 (실행 상태 필드 보존)</li>
 *   <li>일괄 예약과 prefix 기준 정리(prune)</li>
 *   <li>부모 Manifest 연결 및 순환 의존 거부</li>
 *   <li>활성화/비활성화, 즉시 실행(trigger)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * scheduler.schedule(SyncCustomers.class, "sync-customers", new SyncInput("eu"),
 *     Every.minutes(15), ManifestOptions.defaults().withMaxRetries(5));
 * scheduler.scheduleDependent(ReportCustomers.class, "report-customers", new ReportInput(),
 *     "sync-customers", ManifestOptions.defaults());
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ManifestScheduler {

    private static final Logger log = LoggerFactory.getLogger(ManifestScheduler.class);

    private final DataContextFactory dataContextFactory;
    private final WorkflowRegistry registry;
    private final CronEvaluator cronEvaluator;
    private final JsonMapper jsonMapper;
    private final SchedulerConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param dataContextFactory DataContext 팩토리
     * @param registry Workflow 레지스트리
     * @param cronEvaluator cron 표현식 검증기
     * @param jsonMapper 입력 직렬화
     * @param config 스케줄러 설정
     * @param clock 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ManifestScheduler(DataContextFactory dataContextFactory, WorkflowRegistry registry,
                             CronEvaluator cronEvaluator, JsonMapper jsonMapper,
                             SchedulerConfig config, Clock clock) {
        if (dataContextFactory == null) {
            throw new IllegalArgumentException("dataContextFactory cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (cronEvaluator == null) {
            throw new IllegalArgumentException("cronEvaluator cannot be null");
        }
        if (jsonMapper == null) {
            throw new IllegalArgumentException("jsonMapper cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.dataContextFactory = dataContextFactory;
        this.registry = registry;
        this.cronEvaluator = cronEvaluator;
        this.jsonMapper = jsonMapper;
        this.config = config;
        this.clock = clock;
    }

    // ============================================================
    // 단건 예약
    // ============================================================

    /**
     * Manifest 예약 (externalId 기준 업서트).
     *
     * @param workflowType 실행할 Workflow
     * @param externalId 업서트 키
     * @param input Workflow 입력
     * @param schedule 실행 주기
     * @param options 옵션
     * @param <I> 입력 타입
     * @return 저장된 Manifest
     * @throws WorkflowException 등록되지 않은 Workflow/입력 조합 또는 잘못된 cron 표현식
     */
    public <I extends ManifestProperties> Manifest schedule(Class<? extends EffectWorkflow<I, ?>> workflowType,
                                                            String externalId, I input,
                                                            Schedule schedule, ManifestOptions options) {
        Manifest definition = define(workflowType, ManifestItem.of(externalId, input), schedule, options);
        return inTransaction(context -> {
            Manifest saved = upsert(context, definition);
            context.saveChanges();
            return saved;
        });
    }

    /**
     * 부모 Manifest 성공 후 실행되는 Manifest 예약.
     *
     * @param workflowType 실행할 Workflow
     * @param externalId 업서트 키
     * @param input Workflow 입력
     * @param parentExternalId 부모 Manifest의 externalId (먼저 예약되어 있어야 함)
     * @param options 옵션
     * @param <I> 입력 타입
     * @return 저장된 Manifest
     * @throws WorkflowException 부모가 없거나 순환 의존이 생기는 경우
     */
    public <I extends ManifestProperties> Manifest scheduleDependent(
            Class<? extends EffectWorkflow<I, ?>> workflowType, String externalId, I input,
            String parentExternalId, ManifestOptions options) {
        Manifest definition = define(workflowType, ManifestItem.of(externalId, input), Schedule.dependent(), options);
        return inTransaction(context -> {
            Manifest saved = upsertDependent(context, definition, parentExternalId);
            context.saveChanges();
            return saved;
        });
    }

    // ============================================================
    // 일괄 예약
    // ============================================================

    public <S, I extends ManifestProperties> List<Manifest> scheduleMany(
            Class<? extends EffectWorkflow<I, ?>> workflowType, Collection<S> sources,
            Function<? super S, ManifestItem<I>> mapper, Schedule schedule) {
        return scheduleMany(workflowType, sources, mapper, schedule, source -> ManifestOptions.defaults(), null);
    }

    /**
     * 원본 목록을 Manifest로 일괄 예약.
     *
     * <p>전체가 한 트랜잭션입니다. 한 항목이라도 실패하면 어떤 Manifest도 남지 않습니다.
     * prunePrefix가 있으면 그 prefix로 시작하지만 이번 목록에 없는 Manifest를 관련 행과 함께 삭제합니다.</p>
     *
     * @param workflowType 실행할 Workflow
     * @param sources 원본 목록
     * @param mapper 원본 → (externalId, input)
     * @param schedule 모든 항목에 적용할 주기
     * @param options 원본별 옵션
     * @param prunePrefix 정리할 externalId prefix (null이면 정리 안 함)
     * @param <S> 원본 타입
     * @param <I> 입력 타입
     * @return 저장된 Manifest (입력 순서)
     */
    public <S, I extends ManifestProperties> List<Manifest> scheduleMany(
            Class<? extends EffectWorkflow<I, ?>> workflowType, Collection<S> sources,
            Function<? super S, ManifestItem<I>> mapper, Schedule schedule,
            Function<? super S, ManifestOptions> options, String prunePrefix) {
        return inTransaction(context -> {
            List<Manifest> saved = new ArrayList<>(sources.size());
            for (S source : sources) {
                Manifest definition = define(workflowType, mapper.apply(source), schedule, options.apply(source));
                saved.add(upsert(context, definition));
            }
            prune(context, prunePrefix, saved);
            context.saveChanges();
            log.info("Scheduled {} manifests for {}", saved.size(), workflowType.getName());
            return saved;
        });
    }

    /**
     * 부모가 있는 Manifest 일괄 예약. 부모는 이미 저장되어 있거나 같은 목록의 앞쪽에 있어야 합니다.
     *
     * @param workflowType 실행할 Workflow
     * @param sources 원본 목록
     * @param mapper 원본 → (externalId, input)
     * @param parentExternalId 원본 → 부모 externalId
     * @param options 원본별 옵션
     * @param prunePrefix 정리할 externalId prefix (null이면 정리 안 함)
     * @param <S> 원본 타입
     * @param <I> 입력 타입
     * @return 저장된 Manifest (입력 순서)
     */
    public <S, I extends ManifestProperties> List<Manifest> scheduleManyDependent(
            Class<? extends EffectWorkflow<I, ?>> workflowType, Collection<S> sources,
            Function<? super S, ManifestItem<I>> mapper, Function<? super S, String> parentExternalId,
            Function<? super S, ManifestOptions> options, String prunePrefix) {
        return inTransaction(context -> {
            List<Manifest> saved = new ArrayList<>(sources.size());
            for (S source : sources) {
                Manifest definition = define(workflowType, mapper.apply(source), Schedule.dependent(),
                    options.apply(source));
                saved.add(upsertDependent(context, definition, parentExternalId.apply(source)));
            }
            prune(context, prunePrefix, saved);
            context.saveChanges();
            log.info("Scheduled {} dependent manifests for {}", saved.size(), workflowType.getName());
            return saved;
        });
    }

    // ============================================================
    // 상태 변경
    // ============================================================

    public void disable(String externalId) {
        setEnabled(externalId, false);
    }

    public void enable(String externalId) {
        setEnabled(externalId, true);
    }

    /**
     * 주기와 무관하게 즉시 실행할 WorkQueue 항목 생성. Manifest에 저장된 현재 입력을 사용합니다.
     *
     * @param externalId Manifest externalId
     * @return 생성된 WorkQueue 항목
     * @throws WorkflowException Manifest가 없는 경우
     */
    public WorkQueueEntry trigger(String externalId) {
        return inTransaction(context -> {
            Manifest manifest = require(context, externalId);
            WorkQueueEntry entry = context.workQueue()
                .add(WorkQueueEntry.fromManifest(manifest, clock.instant(), clock.instant()));
            context.saveChanges();
            log.info("Triggered manifest {} (workQueueId={})", externalId, entry.getId());
            return entry;
        });
    }

    // ============================================================
    // 내부 구현
    // ============================================================

    private <I extends ManifestProperties> Manifest define(Class<? extends EffectWorkflow<I, ?>> workflowType,
                                                           ManifestItem<I> item, Schedule schedule,
                                                           ManifestOptions options) {
        if (workflowType == null) {
            throw new IllegalArgumentException("workflowType cannot be null");
        }
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        if (schedule == null) {
            throw new IllegalArgumentException("schedule cannot be null");
        }
        ManifestOptions effective = options == null ? ManifestOptions.defaults() : options;
        registry.validate(workflowType, item.input().getClass());
        if (schedule.type() == ScheduleType.CRON) {
            validateCron(schedule.cronExpression());
        }

        Manifest manifest = new Manifest();
        manifest.setExternalId(item.externalId());
        manifest.setName(workflowType.getName());
        manifest.setPropertyTypeName(item.input().getClass().getName());
        manifest.setProperties(jsonMapper.write(item.input()));
        manifest.setEnabled(effective.enabled());
        manifest.setScheduleType(schedule.type());
        manifest.setCronExpression(schedule.cronExpression());
        manifest.setIntervalSeconds(schedule.interval() == null ? null : schedule.interval().toSeconds());
        manifest.setMaxRetries(effective.maxRetries() == null ? config.defaultMaxRetries() : effective.maxRetries());
        manifest.setTimeoutSeconds(effective.timeout() == null ? null : effective.timeout().toSeconds());
        manifest.setGroupId(effective.groupId());
        manifest.setPriority(effective.priority());
        return manifest;
    }

    private void validateCron(String expression) {
        try {
            cronEvaluator.validate(expression);
        } catch (IllegalArgumentException e) {
            throw new WorkflowException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    private Manifest upsert(DataContext context, Manifest definition) {
        return context.manifests().findFirst(row -> definition.getExternalId().equals(row.getExternalId()))
            .map(existing -> {
                existing.applyDefinition(definition);
                context.manifests().update(existing);
                log.debug("Updated manifest {}", existing.getExternalId());
                return existing;
            })
            .orElseGet(() -> {
                definition.setCreatedAt(clock.instant());
                Manifest added = context.manifests().add(definition);
                log.debug("Created manifest {} (id={})", added.getExternalId(), added.getId());
                return added;
            });
    }

    private Manifest upsertDependent(DataContext context, Manifest definition, String parentExternalId) {
        if (parentExternalId == null || parentExternalId.isBlank()) {
            throw new IllegalArgumentException("parentExternalId cannot be null or blank");
        }
        Manifest parent = context.manifests()
            .findFirst(row -> parentExternalId.equals(row.getExternalId()))
            .orElseThrow(() -> new WorkflowException("Parent manifest with ExternalId '" + parentExternalId
                + "' was not found. Schedule parents before their dependents."));
        definition.setDependsOnManifestId(parent.getId());
        Manifest saved = upsert(context, definition);
        ManifestDependencyGraph.of(context.manifests().findAll())
            .findCycle(saved.getId())
            .ifPresent(cycle -> {
                throw new WorkflowException("Manifest '" + saved.getExternalId()
                    + "' would depend on itself through manifests " + cycle);
            });
        return saved;
    }

    private void prune(DataContext context, String prunePrefix, List<Manifest> kept) {
        if (prunePrefix == null) {
            return;
        }
        Set<String> keep = kept.stream().map(Manifest::getExternalId).collect(Collectors.toSet());
        Map<Long, Manifest> stale = new LinkedHashMap<>();
        for (Manifest manifest : context.manifests().findAll(row -> row.getExternalId().startsWith(prunePrefix)
                && !keep.contains(row.getExternalId()))) {
            stale.put(manifest.getId(), manifest);
        }
        if (stale.isEmpty()) {
            return;
        }
        ManifestDependencyGraph graph = ManifestDependencyGraph.of(context.manifests().findAll());
        for (Manifest manifest : stale.values()) {
            for (Long child : graph.children(manifest.getId())) {
                if (!stale.containsKey(child)) {
                    throw new WorkflowException("Cannot prune manifest '" + manifest.getExternalId()
                        + "': manifest " + child + " still depends on it");
                }
            }
        }
        Set<Long> manifestIds = new HashSet<>(stale.keySet());
        context.deadLetters().removeAll(row -> manifestIds.contains(row.getManifestId()));
        context.workQueue().removeAll(row -> manifestIds.contains(row.getManifestId()));
        Set<Long> metadataIds = context.metadata().findAll(row -> manifestIds.contains(row.getManifestId()))
            .stream().map(Metadata::getId).collect(Collectors.toSet());
        context.logs().removeAll(row -> metadataIds.contains(row.getMetadataId()));
        context.metadata().removeAll(row -> metadataIds.contains(row.getId()));
        manifestIds.forEach(id -> context.manifests().remove(id));
        log.info("Pruned {} manifests with prefix '{}'", manifestIds.size(), prunePrefix);
    }

    private void setEnabled(String externalId, boolean enabled) {
        inTransaction(context -> {
            Manifest manifest = require(context, externalId);
            manifest.setEnabled(enabled);
            context.manifests().update(manifest);
            context.saveChanges();
            log.info("Manifest {} {}", externalId, enabled ? "enabled" : "disabled");
            return manifest;
        });
    }

    private static Manifest require(DataContext context, String externalId) {
        return context.manifests().findFirst(row -> row.getExternalId().equals(externalId))
            .orElseThrow(() -> new WorkflowException("No manifest found with ExternalId '" + externalId + "'"));
    }

    private <T> T inTransaction(Function<DataContext, T> work) {
        try (DataContext context = dataContextFactory.create();
             DataContextTransaction transaction = context.beginTransaction()) {
            T result = work.apply(context);
            transaction.commit();
            return result;
        }
    }
}
