package com.ryuqq.railway.core.schedule;

/**
 * 일괄 스케줄에서 원본 항목 하나가 매핑되는 (externalId, input) 쌍.
 *
 * @param externalId Manifest 업서트 키
 * @param input Workflow 입력
 * @param <I> 입력 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ManifestItem<I extends ManifestProperties>(String externalId, I input) {

    public ManifestItem {
        if (externalId == null || externalId.isBlank()) {
            throw new IllegalArgumentException("externalId cannot be null or blank");
        }
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
    }

    public static <I extends ManifestProperties> ManifestItem<I> of(String externalId, I input) {
        return new ManifestItem<>(externalId, input);
    }
}
