package com.len.kitchen.infra.outbox;

import com.len.kitchen.domain.outbox.OutboxEvent;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 대기 중인 티켓 이벤트를 Kafka로 발행한다.
 * 같은 티켓의 이벤트는 생성 순서대로 나가야 하므로, 앞 이벤트가 재시도 대기에 들어가면
 * 같은 배치의 뒤 이벤트도 그 시각까지 보류한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "kitchen.outbox.publish-enabled", havingValue = "true", matchIfMissing = true)
public class OutboxPublisher {

    enum Outcome {
        PUBLISHED("published"),
        RETRY("retry"),
        FAILED("failed"),
        HELD("held");

        private final String tag;

        Outcome(String tag) {
            this.tag = tag;
        }
    }

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${kitchen.outbox.batch-size:100}")
    private int batchSize;

    @Value("${kitchen.outbox.publish-timeout-ms:3000}")
    private long publishTimeoutMs;

    @Scheduled(fixedDelayString = "${kitchen.outbox.publish-interval-ms:300}")
    @Transactional
    public void publish() {
        meterRegistry.counter("kitchen.outbox.publish.tick").increment();
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            List<OutboxEvent> batch = outboxEventRepository.lockPendingBatch(now(), batchSize);
            if (batch.isEmpty()) {
                meterRegistry.counter("kitchen.outbox.batch", "result", "empty").increment();
                return;
            }
            meterRegistry.summary("kitchen.outbox.batch.size").record(batch.size());

            Map<Outcome, Integer> tally = publishInTicketOrder(batch);
            outboxEventRepository.saveAll(batch);

            tally.forEach((outcome, n) ->
                    meterRegistry.counter("kitchen.outbox.events", "result", outcome.tag).increment(n));
            log.info("Ticket event batch done. size={}, outcome={}", batch.size(), tally);
        } finally {
            sample.stop(meterRegistry.timer("kitchen.outbox.publish.loop"));
        }
    }

    private Map<Outcome, Integer> publishInTicketOrder(List<OutboxEvent> batch) {
        Map<Outcome, Integer> tally = new EnumMap<>(Outcome.class);
        // ticketKey -> 앞 이벤트의 재시도 시각
        Map<String, LocalDateTime> waiting = new HashMap<>();

        for (OutboxEvent event : batch) {
            Outcome outcome;
            LocalDateTime retryAt = waiting.get(event.getTicketKey());
            if (retryAt != null) {
                event.holdUntil(retryAt, now());
                outcome = Outcome.HELD;
            } else {
                outcome = send(event);
                if (outcome == Outcome.RETRY) {
                    waiting.put(event.getTicketKey(), event.getNextAttemptAt());
                }
            }
            tally.merge(outcome, 1, Integer::sum);

            // 남은 이벤트는 PENDING 그대로 두고 다음 tick에서 다시 잡힌다
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
        }
        return tally;
    }

    private Outcome send(OutboxEvent event) {
        try {
            kafkaTemplate.send(event.getTopic(), event.getTicketKey(), event.getPayload())
                    .get(publishTimeoutMs, TimeUnit.MILLISECONDS);
            event.published(now());
            return Outcome.PUBLISHED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail(event, "interrupted");
        } catch (Exception e) {
            return fail(event, describe(e));
        }
    }

    private Outcome fail(OutboxEvent event, String error) {
        if (event.failAttempt(error, now())) {
            log.error("Ticket event publish gave up. eventId={}, ticketId={}, attempts={}, err={}",
                    event.getEventId(), event.getTicketKey(), event.getAttempts(), event.getLastError());
            return Outcome.FAILED;
        }
        log.warn("Ticket event publish deferred. eventId={}, ticketId={}, attempts={}, nextAttemptAt={}, err={}",
                event.getEventId(), event.getTicketKey(), event.getAttempts(), event.getNextAttemptAt(),
                event.getLastError());
        return Outcome.RETRY;
    }

    private static String describe(Exception e) {
        Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
