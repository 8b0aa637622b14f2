package com.ryuqq.railway.application.effect.alerting;

import com.ryuqq.railway.core.model.Metadata;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * Workflow별 알림 조건.
 *
 * <p>minimumFailures가 1이면 실패 한 건마다 알림을 보내며 저장소를 조회하지 않습니다.
 * 2 이상이면 timeWindow 안의 FAILED 실행 수(이번 실패 포함)가 기준에 도달해야 알림을 보냅니다.</p>
 *
 * <p>exceptionTypes와 failureSteps가 비어 있지 않으면 해당 조건(하나라도 일치)에 맞는 실패만 셉니다.</p>
 *
 * @param minimumFailures 알림에 필요한 최소 실패 수
 * @param timeWindow 실패를 세는 기간
 * @param exceptionTypes 대상 예외 타입 이름 (전체 이름 또는 단순 이름)
 * @param failureSteps 대상 Step 이름
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record AlertConfiguration(
    int minimumFailures,
    Duration timeWindow,
    Set<String> exceptionTypes,
    Set<String> failureSteps
) {

    private static final int DEFAULT_MINIMUM_FAILURES = 1;
    private static final Duration DEFAULT_TIME_WINDOW = Duration.ofHours(1);

    public AlertConfiguration() {
        this(DEFAULT_MINIMUM_FAILURES, DEFAULT_TIME_WINDOW, Set.of(), Set.of());
    }

    public AlertConfiguration {
        if (minimumFailures <= 0) {
            throw new IllegalArgumentException("minimumFailures must be positive (current: " + minimumFailures + ")");
        }
        if (timeWindow == null || timeWindow.isNegative() || timeWindow.isZero()) {
            throw new IllegalArgumentException("timeWindow must be positive (current: " + timeWindow + ")");
        }
        if (exceptionTypes == null) {
            throw new IllegalArgumentException("exceptionTypes cannot be null");
        }
        if (failureSteps == null) {
            throw new IllegalArgumentException("failureSteps cannot be null");
        }
        exceptionTypes = Set.copyOf(exceptionTypes);
        failureSteps = Set.copyOf(failureSteps);
    }

    public AlertConfiguration withMinimumFailures(int minimumFailures) {
        return new AlertConfiguration(minimumFailures, timeWindow, exceptionTypes, failureSteps);
    }

    public AlertConfiguration withTimeWindow(Duration timeWindow) {
        return new AlertConfiguration(minimumFailures, timeWindow, exceptionTypes, failureSteps);
    }

    /**
     * 대상 예외 타입 추가.
     *
     * @param exceptionType 예외 타입
     * @return 새 설정
     */
    public AlertConfiguration withExceptionType(Class<? extends Exception> exceptionType) {
        if (exceptionType == null) {
            throw new IllegalArgumentException("exceptionType cannot be null");
        }
        Set<String> types = new HashSet<>(exceptionTypes);
        types.add(exceptionType.getName());
        return new AlertConfiguration(minimumFailures, timeWindow, types, failureSteps);
    }

    public AlertConfiguration withFailureStep(String stepName) {
        if (stepName == null || stepName.isBlank()) {
            throw new IllegalArgumentException("stepName cannot be null or blank");
        }
        Set<String> steps = new HashSet<>(failureSteps);
        steps.add(stepName);
        return new AlertConfiguration(minimumFailures, timeWindow, exceptionTypes, steps);
    }

    /**
     * 실패 기록이 필터 조건에 맞는지 확인.
     *
     * @param failed FAILED Metadata
     * @return 조건에 맞으면 true
     */
    public boolean matches(Metadata failed) {
        String exception = failed.getFailureException();
        if (!exceptionTypes.isEmpty() && exception != null && !matchesException(exception)) {
            return false;
        }
        String step = failed.getFailureStep();
        return failureSteps.isEmpty() || step == null || failureSteps.contains(step);
    }

    private boolean matchesException(String exception) {
        String simpleName = exception.substring(exception.lastIndexOf('.') + 1);
        return exceptionTypes.contains(exception) || exceptionTypes.contains(simpleName);
    }
}
