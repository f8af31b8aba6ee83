package com.len.kitchen.domain.outbox;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 티켓 전이 이벤트 outbox 행. Kafka key는 ticketId.
 */
@Entity
@Table(
        name = "outbox_event",
        indexes = @Index(name = "ix_outbox_status_due", columnList = "status, next_attempt_at")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEvent {

    static final int DEFAULT_MAX_ATTEMPTS = 10;
    static final long MAX_BACKOFF_SECONDS = 60;
    private static final int ERROR_LENGTH = 500;

    @Id
    @Column(name = "event_id", length = 64, nullable = false, updatable = false)
    private String eventId;

    @Column(name = "topic", length = 120, nullable = false, updatable = false)
    private String topic;

    @Column(name = "ticket_key", length = 40, nullable = false, updatable = false)
    private String ticketKey;

    @Lob
    @Column(name = "payload", nullable = false, updatable = false)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private OutboxStatus status;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Column(name = "next_attempt_at", nullable = false)
    private LocalDateTime nextAttemptAt;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @Column(name = "last_error", length = ERROR_LENGTH)
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static OutboxEvent forTicket(String eventId, String topic, Long ticketId, String payload,
                                        LocalDateTime occurredAt) {
        OutboxEvent e = new OutboxEvent();
        e.eventId = eventId;
        e.topic = topic;
        e.ticketKey = String.valueOf(ticketId);
        e.payload = payload;
        e.status = OutboxStatus.PENDING;
        e.maxAttempts = DEFAULT_MAX_ATTEMPTS;
        e.nextAttemptAt = occurredAt;
        e.createdAt = occurredAt;
        e.updatedAt = occurredAt;
        return e;
    }

    public void published(LocalDateTime now) {
        this.status = OutboxStatus.PUBLISHED;
        this.publishedAt = now;
        this.lastError = null;
        this.updatedAt = now;
    }

    /**
     * 발행 시도 실패를 기록한다.
     * 시도 횟수가 한도에 닿으면 FAILED, 아니면 backoff 후 재시도.
     *
     * @return 더 이상 재시도하지 않으면 true
     */
    public boolean failAttempt(String error, LocalDateTime now) {
        this.attempts++;
        this.lastError = truncate(error);
        this.updatedAt = now;

        if (attempts >= maxAttempts) {
            this.status = OutboxStatus.FAILED;
            return true;
        }
        this.nextAttemptAt = now.plusSeconds(backoffSeconds(attempts));
        return false;
    }

    /**
     * 같은 티켓의 앞선 이벤트가 재시도 대기 중이면 그 시각까지 미룬다. 시도 횟수는 늘지 않는다.
     */
    public void holdUntil(LocalDateTime until, LocalDateTime now) {
        if (until.isAfter(nextAttemptAt)) {
            this.nextAttemptAt = until;
        }
        this.updatedAt = now;
    }

    // 2, 4, 8, 16, 32, 60, 60 ...
    static long backoffSeconds(int attempts) {
        return Math.min(MAX_BACKOFF_SECONDS, 1L << Math.min(6, attempts));
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= ERROR_LENGTH) return s;
        return s.substring(0, ERROR_LENGTH);
    }
}
