package com.ryuqq.railway.testkit.contract;

import com.ryuqq.railway.adapter.inmemory.store.InMemoryDataContextFactory;
import com.ryuqq.railway.adapter.inmemory.store.InMemoryDatabase;
import com.ryuqq.railway.adapter.inmemory.task.InMemoryTaskServer;
import com.ryuqq.railway.adapter.runner.BackoffCalculator;
import com.ryuqq.railway.adapter.runner.DueManifestEvaluator;
import com.ryuqq.railway.adapter.runner.ExecutionFailureHandler;
import com.ryuqq.railway.adapter.runner.JavacronEvaluator;
import com.ryuqq.railway.adapter.runner.ManifestDispatcher;
import com.ryuqq.railway.adapter.runner.ManifestExecutor;
import com.ryuqq.railway.adapter.runner.WorkQueueDispatcher;
import com.ryuqq.railway.application.deadletter.DeadLetterService;
import com.ryuqq.railway.application.effect.DataContextEffectProviderFactory;
import com.ryuqq.railway.application.effect.EffectProviderFactory;
import com.ryuqq.railway.application.effect.EffectProviderRegistry;
import com.ryuqq.railway.application.effect.EffectRunner;
import com.ryuqq.railway.application.effect.ParameterEffectProviderFactory;
import com.ryuqq.railway.application.effect.StepLoggingEffectProviderFactory;
import com.ryuqq.railway.application.json.JsonMapper;
import com.ryuqq.railway.application.registry.WorkflowBus;
import com.ryuqq.railway.application.registry.WorkflowRegistry;
import com.ryuqq.railway.application.scheduler.ManifestScheduler;
import com.ryuqq.railway.application.scheduler.SchedulerConfig;
import com.ryuqq.railway.core.model.DeadLetter;
import com.ryuqq.railway.core.model.Manifest;
import com.ryuqq.railway.core.model.Metadata;
import com.ryuqq.railway.core.model.WorkQueueEntry;
import com.ryuqq.railway.core.spi.DataContext;
import com.ryuqq.railway.core.statemachine.WorkflowState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>Wires the whole engine against the in-memory adapters: one {@link InMemoryDatabase}, a
 * {@link MutableClock}, the workflow registry and bus, the manifest scheduler, both dispatchers, the executor,
 * the failure handler (zero backoff) and the dead-letter service. The {@link InMemoryTaskServer} runs the
 * executor inline, so one {@link #dispatchCycle()} takes due manifests all the way to a finished Metadata row.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractContractTest {
 *     {@literal @}Override
 *     protected void registerWorkflows(WorkflowRegistry registry) {
 *         registry.register(MyInput.class, MyWorkflow.class, MyWorkflow::new);
 *     }
 *
 *     {@literal @}Test
 *     void testScenario() {
 *         scheduler.schedule(MyWorkflow.class, "job-1", new MyInput(), Every.minutes(5), ManifestOptions.defaults());
 *         dispatchCycle();
 *         assertWorkflowState(latestMetadata("job-1").getId(), WorkflowState.COMPLETED);
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

    protected InMemoryDatabase database;
    protected InMemoryDataContextFactory dataContextFactory;
    protected MutableClock clock;
    protected JsonMapper jsonMapper;
    protected SchedulerConfig config;
    protected WorkflowRegistry registry;
    protected EffectProviderRegistry effectProviderRegistry;
    protected Supplier<EffectRunner> effectRunners;
    protected WorkflowBus bus;
    protected ManifestScheduler scheduler;
    protected InMemoryTaskServer taskServer;
    protected DeadLetterService deadLetterService;
    protected ExecutionFailureHandler failureHandler;
    protected ManifestExecutor executor;
    protected ManifestDispatcher manifestDispatcher;
    protected WorkQueueDispatcher workQueueDispatcher;

    /**
     * Sets up test fixtures before each test.
     *
     * <p>Creates a fresh database and a fresh set of components.</p>
     */
    @BeforeEach
    void setUp() {
        database = new InMemoryDatabase();
        dataContextFactory = new InMemoryDataContextFactory(database);
        clock = new MutableClock(START);
        jsonMapper = new JsonMapper();
        config = schedulerConfig();

        registry = new WorkflowRegistry();
        registerWorkflows(registry);

        effectProviderRegistry = new EffectProviderRegistry();
        List<EffectProviderFactory> factories = List.of(
            new ParameterEffectProviderFactory(jsonMapper),
            new DataContextEffectProviderFactory(dataContextFactory)
        );
        effectRunners = EffectRunner.supplier(factories, List.of(new StepLoggingEffectProviderFactory()),
            effectProviderRegistry);
        bus = new WorkflowBus(registry, effectRunners);

        scheduler = new ManifestScheduler(dataContextFactory, registry, new JavacronEvaluator(), jsonMapper,
            config, clock);

        taskServer = new InMemoryTaskServer();
        deadLetterService = new DeadLetterService(dataContextFactory, taskServer, clock);
        failureHandler = new ExecutionFailureHandler(dataContextFactory, deadLetterService,
            new BackoffCalculator(0, 0, 0.0, () -> 0.0), clock);
        executor = new ManifestExecutor(dataContextFactory, registry, bus, jsonMapper, failureHandler, clock);
        taskServer.bind(executor::execute);

        manifestDispatcher = new ManifestDispatcher(dataContextFactory,
            new DueManifestEvaluator(new JavacronEvaluator()), config, clock);
        workQueueDispatcher = new WorkQueueDispatcher(dataContextFactory, taskServer, failureHandler, config, clock);
    }

    /**
     * Cleans up test fixtures after each test.
     *
     * <p>Clears all in-memory state to prevent test interference.</p>
     */
    @AfterEach
    void tearDown() {
        if (database != null) {
            database.clear();
        }
    }

    /**
     * Registers the workflows a test class needs. Called once per test before any component is built.
     *
     * @param registry the registry shared by the bus, scheduler and executor
     */
    protected void registerWorkflows(WorkflowRegistry registry) {
    }

    protected SchedulerConfig schedulerConfig() {
        return new SchedulerConfig();
    }

    /**
     * Runs one manifest dispatch and one work queue dispatch. Dispatched work runs inline.
     *
     * @return number of dispatched work queue entries
     */
    protected int dispatchCycle() {
        manifestDispatcher.pump();
        return workQueueDispatcher.pump();
    }

    protected Manifest manifest(String externalId) {
        try (DataContext context = dataContextFactory.create()) {
            return context.manifests().findFirst(row -> externalId.equals(row.getExternalId()))
                .orElseThrow(() -> new AssertionError("No manifest with ExternalId " + externalId));
        }
    }

    protected List<Manifest> manifests() {
        try (DataContext context = dataContextFactory.create()) {
            return context.manifests().findAll();
        }
    }

    protected List<Metadata> metadataOf(String externalId) {
        long manifestId = manifest(externalId).getId();
        try (DataContext context = dataContextFactory.create()) {
            return context.metadata().findAll(row -> row.getManifestId() != null && row.getManifestId() == manifestId)
                .stream()
                .sorted(Comparator.comparing(Metadata::getId))
                .toList();
        }
    }

    protected Metadata latestMetadata(String externalId) {
        List<Metadata> runs = metadataOf(externalId);
        if (runs.isEmpty()) {
            throw new AssertionError("Manifest " + externalId + " has not run");
        }
        return runs.get(runs.size() - 1);
    }

    protected Metadata metadata(long metadataId) {
        try (DataContext context = dataContextFactory.create()) {
            return context.metadata().findById(metadataId)
                .orElseThrow(() -> new AssertionError("No metadata with id " + metadataId));
        }
    }

    protected List<Metadata> allMetadata() {
        try (DataContext context = dataContextFactory.create()) {
            return context.metadata().findAll();
        }
    }

    protected List<WorkQueueEntry> workQueueOf(String externalId) {
        long manifestId = manifest(externalId).getId();
        try (DataContext context = dataContextFactory.create()) {
            return context.workQueue().findAll(row -> row.getManifestId() != null && row.getManifestId() == manifestId);
        }
    }

    protected List<DeadLetter> deadLettersOf(String externalId) {
        long manifestId = manifest(externalId).getId();
        try (DataContext context = dataContextFactory.create()) {
            return context.deadLetters().findAll(row -> row.getManifestId() == manifestId);
        }
    }

    /**
     * Asserts that the metadata row is in the expected state.
     *
     * @param metadataId the metadata id
     * @param expectedState the expected workflow state
     */
    protected void assertWorkflowState(long metadataId, WorkflowState expectedState) {
        WorkflowState actualState = metadata(metadataId).getWorkflowState();
        assertEquals(expectedState, actualState,
            String.format("Expected workflow state %s but was %s for metadata: %d",
                expectedState, actualState, metadataId));
    }
}
