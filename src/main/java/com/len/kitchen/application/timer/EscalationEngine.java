package com.len.kitchen.application.timer;

import com.len.kitchen.domain.settings.KitchenSettings;
import com.len.kitchen.domain.ticket.Ticket;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 현재 상태에 머문 시간으로 긴급도를 분류한다.
 * 현재 시각과 티켓만 보고 계산하며 자체 상태는 없다.
 */
@Component
@RequiredArgsConstructor
public class EscalationEngine {

    private final Clock clock;

    public Duration elapsed(Ticket ticket) {
        Duration d = Duration.between(ticket.getLastTransitionAt(), LocalDateTime.now(clock));
        return d.isNegative() ? Duration.ZERO : d;
    }

    public EscalationLevel classify(Ticket ticket, KitchenSettings settings) {
        if (ticket.getState().isTerminal()) {
            return EscalationLevel.NORMAL;
        }
        return classify(elapsed(ticket), settings);
    }

    /**
     * 임계값 0 이하 = 해당 단계 비활성.
     */
    public EscalationLevel classify(Duration elapsed, KitchenSettings settings) {
        long seconds = elapsed.getSeconds();

        long critical = settings.criticalThresholdSeconds();
        if (critical > 0 && seconds >= critical) {
            return EscalationLevel.CRITICAL;
        }

        long warning = settings.warningThresholdSeconds();
        if (warning > 0 && seconds >= warning) {
            return EscalationLevel.WARNING;
        }
        return EscalationLevel.NORMAL;
    }

    // 시계는 한 번만 읽는다. 경과 시간과 긴급도가 같은 시점 기준이어야 함
    public TicketTiming timingOf(Ticket ticket, KitchenSettings settings) {
        Duration elapsed = elapsed(ticket);
        EscalationLevel level = ticket.getState().isTerminal()
                ? EscalationLevel.NORMAL
                : classify(elapsed, settings);
        return new TicketTiming(elapsed.getSeconds(), level);
    }
}
