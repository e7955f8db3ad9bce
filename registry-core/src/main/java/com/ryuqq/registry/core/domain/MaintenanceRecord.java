package com.ryuqq.registry.core.domain;

import com.ryuqq.registry.core.model.Address;

/**
 * 정비 기록 한 건. (vin, mechanic) 단위로 추가 전용 시퀀스에 저장됩니다.
 *
 * @param mechanic 정비사 주소
 * @param description 작업 내용
 * @param timestamp 기록 시각 (epoch seconds)
 * @param critical 안전 관련 중대 정비 여부
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record MaintenanceRecord(
    Address mechanic,
    String description,
    long timestamp,
    boolean critical
) {

    public MaintenanceRecord {
        if (mechanic == null) {
            throw new IllegalArgumentException("mechanic cannot be null");
        }
        if (description == null) {
            throw new IllegalArgumentException("description cannot be null");
        }
    }
}
