package com.ryuqq.registry.core.domain;

import com.ryuqq.registry.core.model.Address;
import com.ryuqq.registry.core.model.Vin;

/**
 * 차량 보험 증권.
 *
 * <p>VIN당 하나의 증권 레코드만 유지되며, 새 증권 생성 시 이전 레코드를 대체합니다.
 * 소유권 이전 시 삭제되지 않고 비활성화됩니다.</p>
 *
 * @param vin 대상 차량
 * @param insurer 보험사 주소
 * @param vehicleOwner 생성 시점의 차량 소유자 (스냅샷)
 * @param startDate 시작 시각 (epoch seconds)
 * @param endDate 종료 시각 (epoch seconds)
 * @param active 활성 여부
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record InsurancePolicy(
    Vin vin,
    Address insurer,
    Address vehicleOwner,
    long startDate,
    long endDate,
    boolean active
) {

    public InsurancePolicy {
        if (vin == null || insurer == null || vehicleOwner == null) {
            throw new IllegalArgumentException("vin, insurer and vehicleOwner cannot be null");
        }
    }

    public InsurancePolicy deactivate() {
        return new InsurancePolicy(vin, insurer, vehicleOwner, startDate, endDate, false);
    }
}
