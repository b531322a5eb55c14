package com.bikeredlights.ride.service;

/**
 * fix 하나를 처리한 결과.
 */
public enum FixOutcome {
    /** 진행 중인 라이드 없음 */
    IGNORED,
    /** 검증 실패 (거절 횟수만 증가) */
    REJECTED,
    /** 속도/방위각 갱신에만 사용 (일시정지 중) */
    ACCEPTED,
    /** 경로 포인트로 기록됨 → 영속화 대상 */
    RECORDED
}
