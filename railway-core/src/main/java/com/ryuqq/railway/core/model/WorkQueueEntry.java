package com.ryuqq.railway.core.model;

import java.time.Instant;

/**
 * "지금 실행할 차례"를 나타내는 디스패치 대기 항목.
 *
 * <p>큐에 넣는 시점의 Manifest 입력을 복사해 두며, 디스패처가 점유(claimedAt)한 뒤
 * Metadata를 만들고 DISPATCHED로 바꿉니다. 점유가 visibility timeout보다 오래되면
 * 버려진 것으로 보고 다시 점유할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WorkQueueEntry implements Entity<WorkQueueEntry> {

    private Long id;
    private String externalId;
    private String workflowName;
    private String input;
    private String inputTypeName;
    private WorkQueueStatus status = WorkQueueStatus.QUEUED;
    private int priority;
    private Instant createdAt;
    private Instant availableAt;
    private Instant claimedAt;
    private Instant dispatchedAt;
    private Long manifestId;
    private Long metadataId;

    /**
     * Manifest의 현재 입력으로 QUEUED 항목 생성.
     *
     * @param manifest 원본 Manifest
     * @param now 생성 시각
     * @param availableAt 디스패치 가능 시각
     * @return 새 항목
     */
    public static WorkQueueEntry fromManifest(Manifest manifest, Instant now, Instant availableAt) {
        if (manifest == null) {
            throw new IllegalArgumentException("manifest cannot be null");
        }
        WorkQueueEntry entry = new WorkQueueEntry();
        entry.externalId = manifest.getExternalId();
        entry.workflowName = manifest.getName();
        entry.input = manifest.getProperties();
        entry.inputTypeName = manifest.getPropertyTypeName();
        entry.priority = manifest.getPriority();
        entry.manifestId = manifest.getId();
        entry.createdAt = now;
        entry.availableAt = availableAt;
        return entry;
    }

    /**
     * QUEUED → DISPATCHED.
     *
     * @param metadataId 생성된 Metadata id
     * @param dispatchedAt 디스패치 시각
     * @throws IllegalStateException 이미 DISPATCHED인 경우
     */
    public void markDispatched(long metadataId, Instant dispatchedAt) {
        if (status != WorkQueueStatus.QUEUED) {
            throw new IllegalStateException("WorkQueue entry " + id + " is already " + status);
        }
        this.status = WorkQueueStatus.DISPATCHED;
        this.metadataId = metadataId;
        this.dispatchedAt = dispatchedAt;
    }

    /**
     * 점유 가능 여부 (QUEUED, 디스패치 가능 시각 경과, 점유 없음 또는 점유 만료).
     *
     * @param now 현재 시각
     * @param staleBefore 이 시각 이전의 점유는 만료로 간주
     * @return 점유 가능하면 true
     */
    public boolean isClaimable(Instant now, Instant staleBefore) {
        return status == WorkQueueStatus.QUEUED
            && (availableAt == null || !availableAt.isAfter(now))
            && (claimedAt == null || claimedAt.isBefore(staleBefore));
    }

    @Override
    public WorkQueueEntry copy() {
        WorkQueueEntry copy = new WorkQueueEntry();
        copy.id = id;
        copy.externalId = externalId;
        copy.workflowName = workflowName;
        copy.input = input;
        copy.inputTypeName = inputTypeName;
        copy.status = status;
        copy.priority = priority;
        copy.createdAt = createdAt;
        copy.availableAt = availableAt;
        copy.claimedAt = claimedAt;
        copy.dispatchedAt = dispatchedAt;
        copy.manifestId = manifestId;
        copy.metadataId = metadataId;
        return copy;
    }

    @Override
    public Long getId() {
        return id;
    }

    @Override
    public void setId(Long id) {
        this.id = id;
    }

    public String getExternalId() {
        return externalId;
    }

    public void setExternalId(String externalId) {
        this.externalId = externalId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public void setWorkflowName(String workflowName) {
        this.workflowName = workflowName;
    }

    public String getInput() {
        return input;
    }

    public void setInput(String input) {
        this.input = input;
    }

    public String getInputTypeName() {
        return inputTypeName;
    }

    public void setInputTypeName(String inputTypeName) {
        this.inputTypeName = inputTypeName;
    }

    public WorkQueueStatus getStatus() {
        return status;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getAvailableAt() {
        return availableAt;
    }

    public void setAvailableAt(Instant availableAt) {
        this.availableAt = availableAt;
    }

    public Instant getClaimedAt() {
        return claimedAt;
    }

    public void setClaimedAt(Instant claimedAt) {
        this.claimedAt = claimedAt;
    }

    public Instant getDispatchedAt() {
        return dispatchedAt;
    }

    public Long getManifestId() {
        return manifestId;
    }

    public void setManifestId(Long manifestId) {
        this.manifestId = manifestId;
    }

    public Long getMetadataId() {
        return metadataId;
    }
}
