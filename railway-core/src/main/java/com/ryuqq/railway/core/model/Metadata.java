package com.ryuqq.railway.core.model;

import com.ryuqq.railway.core.statemachine.StateTransition;
import com.ryuqq.railway.core.statemachine.WorkflowState;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.UUID;

/**
 * Workflow 실행 한 건의 기록.
 *
 * <p>Effect 계층이 실행 전에 만들고 세 시점(초기화, Step 경계, 종료)에 갱신합니다.
 * 상태는 {@link StateTransition} 규칙에 따라 단방향으로만 바뀝니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태이면 endTime은 null이 아니고 currentlyRunningStep은 null</li>
 *   <li>failure* 필드는 FAILED 또는 CANCELLED에서만 채워짐</li>
 * </ul>
 *
 * <p>inputObject/outputObject는 저장되지 않는 실행 중 값이며, 파라미터 Effect가 JSON으로 직렬화해
 * input/output에 기록합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Metadata implements Entity<Metadata> {

    private Long id;
    private Long parentId;
    private Long manifestId;
    private String externalId;
    private String name;
    private String executor;
    private WorkflowState workflowState;
    private String failureStep;
    private String failureException;
    private String failureReason;
    private String stackTrace;
    private String input;
    private String output;
    private Instant startTime;
    private Instant endTime;
    private String currentlyRunningStep;
    private Instant stepStartedAt;

    private Object inputObject;
    private Object outputObject;

    public Metadata() {
    }

    /**
     * PENDING 상태의 새 실행 기록 생성.
     *
     * @param name Workflow 이름
     * @param externalId 외부 식별자 (null이면 UUID 생성)
     * @param startTime 생성 시각
     * @return Metadata
     * @throws IllegalArgumentException name 또는 startTime이 null인 경우
     */
    public static Metadata create(String name, String externalId, Instant startTime) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (startTime == null) {
            throw new IllegalArgumentException("startTime cannot be null");
        }
        Metadata metadata = new Metadata();
        metadata.name = name;
        metadata.externalId = externalId == null ? UUID.randomUUID().toString() : externalId;
        metadata.workflowState = WorkflowState.PENDING;
        metadata.startTime = startTime;
        return metadata;
    }

    /**
     * PENDING → IN_PROGRESS.
     *
     * @throws IllegalStateException PENDING이 아닌 경우
     */
    public void markInProgress() {
        workflowState = StateTransition.transition(workflowState, WorkflowState.IN_PROGRESS);
    }

    /**
     * 실행 중인 Step 기록.
     *
     * @param stepName Step 이름
     * @param startedAt Step 시작 시각
     */
    public void markStepStarted(String stepName, Instant startedAt) {
        if (workflowState.isTerminal()) {
            throw new IllegalStateException("Cannot record step progress on terminal metadata: " + workflowState);
        }
        this.currentlyRunningStep = stepName;
        this.stepStartedAt = startedAt;
    }

    /**
     * 실행 중인 Step 종료 기록. 다음 Step이 시작되기 전까지 currentlyRunningStep은 null입니다.
     */
    public void markStepFinished() {
        if (workflowState.isTerminal()) {
            throw new IllegalStateException("Cannot record step progress on terminal metadata: " + workflowState);
        }
        this.currentlyRunningStep = null;
        this.stepStartedAt = null;
    }

    /**
     * 성공 종료.
     *
     * @param endTime 종료 시각
     */
    public void complete(Instant endTime) {
        finish(WorkflowState.COMPLETED, endTime);
    }

    /**
     * 실패 종료.
     *
     * @param endTime 종료 시각
     * @param step 실패한 Step 이름 (null 허용)
     * @param exception 실패 원인
     */
    public void fail(Instant endTime, String step, Exception exception) {
        finish(WorkflowState.FAILED, endTime);
        recordFailure(step, exception);
    }

    /**
     * 사유 문자열로 실패 종료 (예외 객체가 없는 경우, 예: 타임아웃 회수).
     *
     * @param endTime 종료 시각
     * @param exceptionType 예외 유형 이름
     * @param reason 실패 사유
     */
    public void failWithReason(Instant endTime, String exceptionType, String reason) {
        finish(WorkflowState.FAILED, endTime);
        this.failureException = exceptionType;
        this.failureReason = reason;
    }

    /**
     * 취소 종료.
     *
     * @param endTime 종료 시각
     * @param step 취소 시점 Step 이름 (null 허용)
     * @param exception 취소 예외
     */
    public void cancel(Instant endTime, String step, Exception exception) {
        finish(WorkflowState.CANCELLED, endTime);
        recordFailure(step, exception);
    }

    private void finish(WorkflowState terminal, Instant endTime) {
        if (endTime == null) {
            throw new IllegalArgumentException("endTime cannot be null");
        }
        this.workflowState = StateTransition.transition(workflowState, terminal);
        this.endTime = endTime;
        this.currentlyRunningStep = null;
        this.stepStartedAt = null;
    }

    private void recordFailure(String step, Exception exception) {
        this.failureStep = step;
        if (exception != null) {
            this.failureException = exception.getClass().getName();
            this.failureReason = exception.getMessage();
            StringWriter writer = new StringWriter();
            exception.printStackTrace(new PrintWriter(writer));
            this.stackTrace = writer.toString();
        }
    }

    @Override
    public Metadata copy() {
        Metadata copy = new Metadata();
        copy.id = id;
        copy.overwrite(this);
        return copy;
    }

    /**
     * id를 제외한 모든 값을 source의 값으로 교체. 저장된 행을 실행 중인 Metadata의 최신 상태로 맞출 때 사용합니다.
     *
     * @param source 값을 가져올 Metadata
     */
    public void overwrite(Metadata source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        this.parentId = source.parentId;
        this.manifestId = source.manifestId;
        this.externalId = source.externalId;
        this.name = source.name;
        this.executor = source.executor;
        this.workflowState = source.workflowState;
        this.failureStep = source.failureStep;
        this.failureException = source.failureException;
        this.failureReason = source.failureReason;
        this.stackTrace = source.stackTrace;
        this.input = source.input;
        this.output = source.output;
        this.startTime = source.startTime;
        this.endTime = source.endTime;
        this.currentlyRunningStep = source.currentlyRunningStep;
        this.stepStartedAt = source.stepStartedAt;
        this.inputObject = source.inputObject;
        this.outputObject = source.outputObject;
    }

    @Override
    public Long getId() {
        return id;
    }

    @Override
    public void setId(Long id) {
        this.id = id;
    }

    public Long getParentId() {
        return parentId;
    }

    public void setParentId(Long parentId) {
        this.parentId = parentId;
    }

    public Long getManifestId() {
        return manifestId;
    }

    public void setManifestId(Long manifestId) {
        this.manifestId = manifestId;
    }

    public String getExternalId() {
        return externalId;
    }

    public void setExternalId(String externalId) {
        this.externalId = externalId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getExecutor() {
        return executor;
    }

    public void setExecutor(String executor) {
        this.executor = executor;
    }

    public WorkflowState getWorkflowState() {
        return workflowState;
    }

    /**
     * 저장소 복원용. 상태 변경은 markInProgress/complete/fail/cancel을 사용해야 합니다.
     */
    public void setWorkflowState(WorkflowState workflowState) {
        this.workflowState = workflowState;
    }

    public String getFailureStep() {
        return failureStep;
    }

    public String getFailureException() {
        return failureException;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public String getStackTrace() {
        return stackTrace;
    }

    public String getInput() {
        return input;
    }

    public void setInput(String input) {
        this.input = input;
    }

    public String getOutput() {
        return output;
    }

    public void setOutput(String output) {
        this.output = output;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public String getCurrentlyRunningStep() {
        return currentlyRunningStep;
    }

    public Instant getStepStartedAt() {
        return stepStartedAt;
    }

    public Object getInputObject() {
        return inputObject;
    }

    public void setInputObject(Object inputObject) {
        this.inputObject = inputObject;
    }

    public Object getOutputObject() {
        return outputObject;
    }

    public void setOutputObject(Object outputObject) {
        this.outputObject = outputObject;
    }

    @Override
    public String toString() {
        return "Metadata{id=" + id + ", name='" + name + "', externalId='" + externalId
            + "', state=" + workflowState + "}";
    }
}
