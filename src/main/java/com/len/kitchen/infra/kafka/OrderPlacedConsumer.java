package com.len.kitchen.infra.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.len.kitchen.application.intake.OrderPlacedPayload;
import com.len.kitchen.application.routing.RoutingResult;
import com.len.kitchen.application.ticket.TicketService;
import com.len.kitchen.common.exception.BusinessException;
import com.len.kitchen.common.exception.StorageFailureException;
import com.len.kitchen.domain.order.KitchenOrder;
import com.len.kitchen.domain.ticket.Actor;
import com.len.kitchen.infra.intake.ConsumerDedupStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 주문 시스템의 주문 생성 이벤트를 받아 스테이션 라우팅으로 넘긴다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "kitchen.intake.kafka-enabled", havingValue = "true", matchIfMissing = true)
public class OrderPlacedConsumer {

    public static final String TOPIC = "kitchen.order.placed.v1";

    private static final String METRIC_SKIP = "kitchen.intake.skip";
    private static final String METRIC_PROCESSED = "kitchen.intake.processed";
    private static final String METRIC_RETRYABLE_ERROR = "kitchen.intake.retryable_error";

    private final ObjectMapper objectMapper;
    private final TicketService ticketService;
    private final ConsumerDedupStore dedupStore;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @KafkaListener(
            topics = TOPIC,
            groupId = "${spring.kafka.consumer.group-id:kitchen-display}"
    )
    public void onMessage(String payload) {
        OrderPlacedPayload evt;

        // 1) JSON 파싱
        try {
            evt = objectMapper.readValue(payload, OrderPlacedPayload.class);
        } catch (Exception e) {
            countSkip("invalid_payload");
            log.warn("Skip invalid payload. payload={}", payload, e);
            return;
        }

        // 2) 필수 필드 검증 (null 항목 포함)
        if (isBlank(evt.eventId()) || isBlank(evt.hubId()) || isBlank(evt.orderId())
                || evt.lines() == null || evt.lines().isEmpty() || evt.lines().contains(null)) {
            countSkip("invalid_fields");
            log.warn("Skip invalid event fields. event={}", evt);
            return;
        }

        // 3) 주문 변환은 dedup 기록 전에 끝낸다
        KitchenOrder order = evt.toOrder();
        Actor actor = isBlank(evt.placedBy()) ? Actor.system() : Actor.of(evt.placedBy());

        // 4) consumer 멱등 (이미 처리된 event면 skip)
        if (!dedupStore.markProcessed(evt.eventId(), LocalDateTime.now(clock))) {
            countSkip("duplicate");
            log.debug("Duplicate event skipped. eventId={}", evt.eventId());
            return;
        }

        // 5) 라우팅
        try {
            RoutingResult result = ticketService.route(order, actor);
            meterRegistry.counter(METRIC_PROCESSED).increment();
            log.info("Order intake processed. eventId={}, hubId={}, orderId={}, tickets={}, failures={}",
                    evt.eventId(), evt.hubId(), evt.orderId(), result.tickets().size(), result.failures().size());

        } catch (StorageFailureException e) {
            // 재시도 가능: dedup 롤백 후 예외 재던짐
            meterRegistry.counter(METRIC_RETRYABLE_ERROR).increment();
            rollbackDedup(evt.eventId());
            log.error("Retryable intake error. eventId={}", evt.eventId(), e);
            throw e;

        } catch (BusinessException e) {
            countSkip("business_exception");
            log.warn("Skip non-retryable business error. eventId={}, code={}", evt.eventId(), e.getErrorCode());

        } catch (Exception e) {
            // 예상 못한 오류도 dedup을 남기면 재전달이 중복으로 버려진다
            meterRegistry.counter(METRIC_RETRYABLE_ERROR).increment();
            rollbackDedup(evt.eventId());
            log.error("Unexpected intake error. eventId={}", evt.eventId(), e);
            throw e;
        }
    }

    private void countSkip(String reason) {
        meterRegistry.counter(METRIC_SKIP, "reason", reason).increment();
    }

    private void rollbackDedup(String eventId) {
        try {
            dedupStore.forget(eventId);
            log.warn("Dedup rollback done. eventId={}", eventId);
        } catch (Exception ex) {
            log.error("Dedup rollback failed. eventId={}", eventId, ex);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
