package com.len.kitchen.application.autobump;

import com.len.kitchen.application.ticket.TicketStateMachine;
import com.len.kitchen.common.exception.BusinessException;
import com.len.kitchen.domain.lock.HubTickLockStore;
import com.len.kitchen.domain.settings.KitchenSettings;
import com.len.kitchen.domain.settings.KitchenSettingsProvider;
import com.len.kitchen.domain.ticket.TicketState;
import com.len.kitchen.infra.ticket.TicketJpaRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 조리중(IN_PROGRESS) 상태로 오래 머문 티켓을 시스템 actor로 bump 한다.
 * <p>
 * - 허브마다 설정(auto_bump_enabled, delay, interval)을 따로 읽고 따로 스캔한다.
 * - 한 허브 스캔이 실패해도 다른 허브는 계속 진행.
 * - 후보는 락 없이 뽑고, 티켓마다 상태 머신이 락을 잡은 뒤 다시 확인한다.
 *   그 사이 사람이 먼저 bump 했으면 조용히 건너뛴다 (다음 tick에서 다시 평가).
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "kitchen.auto-bump.enabled", havingValue = "true", matchIfMissing = true)
public class AutoBumpScheduler {

    private static final String METRIC_TICK = "kitchen.autobump.tick";
    private static final String METRIC_BUMPED = "kitchen.autobump.bumped";
    private static final String METRIC_SKIPPED = "kitchen.autobump.skipped";

    private final TicketJpaRepository ticketRepository;
    private final TicketStateMachine stateMachine;
    private final KitchenSettingsProvider settingsProvider;
    private final HubTickLockStore lockStore;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // 허브별 마지막 스캔 시각
    private final Map<String, LocalDateTime> lastScanAt = new ConcurrentHashMap<>();

    @Value("${kitchen.auto-bump.batch-size:500}")
    private int batchSize;

    @Value("${kitchen.auto-bump.lock-ttl-ms:5000}")
    private long lockTtlMs;

    @Scheduled(
            initialDelayString = "${kitchen.auto-bump.initial-delay-ms:1000}",
            fixedDelayString = "${kitchen.auto-bump.tick-ms:1000}"
    )
    public void tick() {
        meterRegistry.counter(METRIC_TICK).increment();

        List<String> hubIds;
        try {
            hubIds = ticketRepository.findHubIdsWithState(TicketState.IN_PROGRESS);
        } catch (DataAccessException e) {
            log.warn("[AutoBump] hub scan skipped, storage unavailable", e);
            return;
        }

        for (String hubId : hubIds) {
            try {
                int bumped = scanIfDue(hubId);
                if (bumped > 0) {
                    log.info("[AutoBump] hubId={}, bumped={}", hubId, bumped);
                }
            } catch (Exception e) {
                log.warn("[AutoBump] hub scan failed. hubId={}", hubId, e);
            }
        }
    }

    int scanIfDue(String hubId) {
        KitchenSettings settings = settingsProvider.settingsFor(hubId);
        if (!settings.autoBumpEnabled()) {
            return 0;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime last = lastScanAt.get(hubId);
        long interval = settings.autoBumpIntervalSeconds();
        // interval 0 이하 = 매 tick 스캔
        if (interval > 0 && last != null && now.isBefore(last.plusSeconds(interval))) {
            return 0;
        }

        Optional<String> token = lockStore.tryLock(hubId, Duration.ofMillis(lockTtlMs));
        if (token.isEmpty()) {
            // 다른 인스턴스가 이 허브를 스캔 중
            return 0;
        }

        try {
            lastScanAt.put(hubId, now);
            return scan(hubId, settings, now);
        } finally {
            lockStore.unlock(hubId, token.get());
        }
    }

    private int scan(String hubId, KitchenSettings settings, LocalDateTime now) {
        LocalDateTime cutoff = now.minusSeconds(Math.max(settings.autoBumpDelaySeconds(), 0));
        List<Long> candidates = ticketRepository.findOverdueInProgressIds(
                hubId, cutoff, PageRequest.of(0, batchSize));

        int bumped = 0;
        for (Long ticketId : candidates) {
            try {
                if (stateMachine.bumpIfOverdue(ticketId, cutoff).isPresent()) {
                    bumped++;
                    meterRegistry.counter(METRIC_BUMPED).increment();
                } else {
                    countSkip("state_changed");
                    log.debug("[AutoBump] skipped, state changed. ticketId={}", ticketId);
                }
            } catch (BusinessException e) {
                countSkip("business_exception");
                log.debug("[AutoBump] skipped. ticketId={}, code={}", ticketId, e.getErrorCode());
            } catch (DataAccessException e) {
                // 다음 tick에서 다시 평가된다
                countSkip("storage_error");
                log.warn("[AutoBump] bump failed. ticketId={}, err={}", ticketId, e.getMessage());
            }
        }
        return bumped;
    }

    private void countSkip(String reason) {
        meterRegistry.counter(METRIC_SKIPPED, "reason", reason).increment();
    }
}
