package com.ryuqq.railway.core.model;

import java.time.Instant;

/**
 * 재시도 한도를 소진한 작업 기록.
 *
 * <p>AWAITING_INTERVENTION으로 생성되며 운영자의 retry 또는 acknowledge로만 해소됩니다.
 * 디스패처는 이 상태의 DeadLetter가 있는 Manifest를 실행하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DeadLetter implements Entity<DeadLetter> {

    private Long id;
    private Long manifestId;
    private Instant deadLetteredAt;
    private DeadLetterStatus status;
    private String reason;
    private int retryCount;
    private Instant resolvedAt;
    private String resolutionNote;
    private Long retryMetadataId;

    /**
     * AWAITING_INTERVENTION 상태로 생성.
     *
     * @param manifestId 대상 Manifest id
     * @param reason 사유
     * @param retryCount 소진된 재시도 횟수
     * @param now 생성 시각
     * @return DeadLetter
     */
    public static DeadLetter create(long manifestId, String reason, int retryCount, Instant now) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        DeadLetter deadLetter = new DeadLetter();
        deadLetter.manifestId = manifestId;
        deadLetter.reason = reason;
        deadLetter.retryCount = retryCount;
        deadLetter.deadLetteredAt = now;
        deadLetter.status = DeadLetterStatus.AWAITING_INTERVENTION;
        return deadLetter;
    }

    /**
     * 확인 처리 (재실행 없이 종결).
     *
     * @param note 처리 메모
     * @param now 처리 시각
     * @throws IllegalStateException AWAITING_INTERVENTION이 아닌 경우
     */
    public void acknowledge(String note, Instant now) {
        requireAwaiting();
        this.status = DeadLetterStatus.ACKNOWLEDGED;
        this.resolutionNote = note;
        this.resolvedAt = now;
    }

    /**
     * 재실행 처리.
     *
     * @param retryMetadataId 재실행용으로 만든 Metadata id
     * @param now 처리 시각
     * @throws IllegalStateException AWAITING_INTERVENTION이 아닌 경우
     */
    public void markRetried(long retryMetadataId, Instant now) {
        requireAwaiting();
        this.status = DeadLetterStatus.RETRIED;
        this.retryMetadataId = retryMetadataId;
        this.resolvedAt = now;
        this.resolutionNote = "Retried as metadata " + retryMetadataId;
    }

    /**
     * 재시도 실행 요청이 실패했을 때 다시 처리 대기 상태로 되돌림.
     *
     * @param note 처리 메모
     * @throws IllegalStateException RETRIED 상태가 아닌 경우
     */
    public void reopen(String note) {
        if (status != DeadLetterStatus.RETRIED) {
            throw new IllegalStateException("DeadLetter " + id + " was not retried (status: " + status + ")");
        }
        this.status = DeadLetterStatus.AWAITING_INTERVENTION;
        this.retryMetadataId = null;
        this.resolvedAt = null;
        this.resolutionNote = note;
    }

    private void requireAwaiting() {
        if (status != DeadLetterStatus.AWAITING_INTERVENTION) {
            throw new IllegalStateException("DeadLetter " + id + " is already resolved (status: " + status + ")");
        }
    }

    @Override
    public DeadLetter copy() {
        DeadLetter copy = new DeadLetter();
        copy.id = id;
        copy.manifestId = manifestId;
        copy.deadLetteredAt = deadLetteredAt;
        copy.status = status;
        copy.reason = reason;
        copy.retryCount = retryCount;
        copy.resolvedAt = resolvedAt;
        copy.resolutionNote = resolutionNote;
        copy.retryMetadataId = retryMetadataId;
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

    public Long getManifestId() {
        return manifestId;
    }

    public Instant getDeadLetteredAt() {
        return deadLetteredAt;
    }

    public DeadLetterStatus getStatus() {
        return status;
    }

    public String getReason() {
        return reason;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public String getResolutionNote() {
        return resolutionNote;
    }

    public Long getRetryMetadataId() {
        return retryMetadataId;
    }
}
