package com.ryuqq.registry.core.error;

/**
 * 레지스트리 오류 분류.
 *
 * <ul>
 *   <li>{@link #VALIDATION}: 잘못된/빈 입력, 대상의 역할이 부적절한 경우</li>
 *   <li>{@link #AUTHORIZATION}: 호출자에게 필요한 역할이나 관계가 없는 경우</li>
 *   <li>{@link #NOT_FOUND}: 참조한 주소/DID/VIN/자격증명이 존재하지 않는 경우</li>
 *   <li>{@link #CONFLICT}: 중복 등록 (주소, VIN, 자격증명 ID, DID)</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public enum ErrorKind {
    VALIDATION,
    AUTHORIZATION,
    NOT_FOUND,
    CONFLICT
}
