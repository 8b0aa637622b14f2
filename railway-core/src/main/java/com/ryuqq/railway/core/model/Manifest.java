package com.ryuqq.railway.core.model;

import java.time.Instant;

/**
 * 스케줄 가능한 작업 정의.
 *
 * <p>externalId가 업서트 키입니다. 같은 externalId로 다시 스케줄하면 스케줄/입력/옵션 필드만 덮어쓰고
 * 실행 상태 필드(lastSuccessfulRun, retryCount, createdAt, claimedAt)는 그대로 둡니다.</p>
 *
 * <p>부모 관계는 {@code dependsOnManifestId} 정수 FK로만 표현하며, 순환은 스케줄 시점에 거부됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Manifest implements Entity<Manifest> {

    private Long id;
    private String externalId;
    private String name;
    private String propertyTypeName;
    private String properties;
    private boolean enabled = true;
    private ScheduleType scheduleType = ScheduleType.NONE;
    private String cronExpression;
    private Long intervalSeconds;
    private int maxRetries;
    private Long timeoutSeconds;
    private Instant lastSuccessfulRun;
    private String groupId;
    private int priority;
    private Long dependsOnManifestId;

    // 실행 상태
    private Instant createdAt;
    private int retryCount;
    private Instant claimedAt;

    /**
     * 실행 상태 필드를 제외한 정의 필드를 source 값으로 덮어씀.
     *
     * @param source 새 정의
     */
    public void applyDefinition(Manifest source) {
        this.name = source.name;
        this.propertyTypeName = source.propertyTypeName;
        this.properties = source.properties;
        this.enabled = source.enabled;
        this.scheduleType = source.scheduleType;
        this.cronExpression = source.cronExpression;
        this.intervalSeconds = source.intervalSeconds;
        this.maxRetries = source.maxRetries;
        this.timeoutSeconds = source.timeoutSeconds;
        this.groupId = source.groupId;
        this.priority = source.priority;
        this.dependsOnManifestId = source.dependsOnManifestId;
    }

    @Override
    public Manifest copy() {
        Manifest copy = new Manifest();
        copy.id = id;
        copy.externalId = externalId;
        copy.applyDefinition(this);
        copy.lastSuccessfulRun = lastSuccessfulRun;
        copy.createdAt = createdAt;
        copy.retryCount = retryCount;
        copy.claimedAt = claimedAt;
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

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getPropertyTypeName() {
        return propertyTypeName;
    }

    public void setPropertyTypeName(String propertyTypeName) {
        this.propertyTypeName = propertyTypeName;
    }

    public String getProperties() {
        return properties;
    }

    public void setProperties(String properties) {
        this.properties = properties;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public ScheduleType getScheduleType() {
        return scheduleType;
    }

    public void setScheduleType(ScheduleType scheduleType) {
        this.scheduleType = scheduleType;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
    }

    public Long getIntervalSeconds() {
        return intervalSeconds;
    }

    public void setIntervalSeconds(Long intervalSeconds) {
        this.intervalSeconds = intervalSeconds;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(Long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public Instant getLastSuccessfulRun() {
        return lastSuccessfulRun;
    }

    public void setLastSuccessfulRun(Instant lastSuccessfulRun) {
        this.lastSuccessfulRun = lastSuccessfulRun;
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public Long getDependsOnManifestId() {
        return dependsOnManifestId;
    }

    public void setDependsOnManifestId(Long dependsOnManifestId) {
        this.dependsOnManifestId = dependsOnManifestId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    /**
     * 마지막 성공 이후 연속 실패 횟수.
     */
    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    /**
     * 디스패처가 이 Manifest를 큐에 넣기 위해 점유한 시각 (점유 해제 시 null).
     */
    public Instant getClaimedAt() {
        return claimedAt;
    }

    public void setClaimedAt(Instant claimedAt) {
        this.claimedAt = claimedAt;
    }

    @Override
    public String toString() {
        return "Manifest{id=" + id + ", externalId='" + externalId + "', name='" + name
            + "', scheduleType=" + scheduleType + "}";
    }
}
