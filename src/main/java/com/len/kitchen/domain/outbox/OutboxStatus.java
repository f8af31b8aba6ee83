package com.len.kitchen.domain.outbox;

public enum OutboxStatus {
    PENDING,    // 발행 대기 (재시도 포함)
    PUBLISHED,  // 발행 완료
    FAILED      // 재시도 한도 초과
}
