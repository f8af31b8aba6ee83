package com.len.kitchen.application.timer;

import com.len.kitchen.domain.settings.KitchenSettings;
import com.len.kitchen.domain.ticket.Ticket;
import com.len.kitchen.domain.ticket.TicketTrigger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class EscalationEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:30:00Z");

    private final EscalationEngine engine = new EscalationEngine(Clock.fixed(NOW, ZoneOffset.UTC));

    private static KitchenSettings thresholds(int warning, int critical) {
        KitchenSettings d = KitchenSettings.defaults();
        return new KitchenSettings(warning, critical,
                d.autoBumpEnabled(), d.autoBumpDelaySeconds(), d.autoBumpIntervalSeconds(),
                d.autoAcceptEnabled(), d.itemsPerPage(), d.refreshIntervalSeconds(),
                d.showTimer(), d.soundEnabled(), d.soundOnNewOrder(), d.soundOnRush(), d.colorCodingEnabled());
    }

    @Test
    @DisplayName("기본 임계값(900/1800초) 경계")
    void defaults_boundaries() {
        KitchenSettings s = KitchenSettings.defaults();

        assertThat(engine.classify(Duration.ofSeconds(899), s)).isEqualTo(EscalationLevel.NORMAL);
        assertThat(engine.classify(Duration.ofSeconds(900), s)).isEqualTo(EscalationLevel.WARNING);
        assertThat(engine.classify(Duration.ofSeconds(1799), s)).isEqualTo(EscalationLevel.WARNING);
        assertThat(engine.classify(Duration.ofSeconds(1800), s)).isEqualTo(EscalationLevel.CRITICAL);
    }

    @Test
    @DisplayName("warning 임계값 0 이하면 warning 단계 없이 critical만")
    void nonPositiveWarning_disablesWarning() {
        KitchenSettings s = thresholds(0, 600);

        assertThat(engine.classify(Duration.ofSeconds(0), s)).isEqualTo(EscalationLevel.NORMAL);
        assertThat(engine.classify(Duration.ofSeconds(599), s)).isEqualTo(EscalationLevel.NORMAL);
        assertThat(engine.classify(Duration.ofSeconds(600), s)).isEqualTo(EscalationLevel.CRITICAL);
    }

    @Test
    @DisplayName("critical 임계값 음수면 warning까지만 올라간다")
    void negativeCritical_disablesCritical() {
        KitchenSettings s = thresholds(60, -1);

        assertThat(engine.classify(Duration.ofHours(10), s)).isEqualTo(EscalationLevel.WARNING);
    }

    @Test
    @DisplayName("warning >= critical 설정이면 critical이 우선")
    void warningAboveCritical_criticalWins() {
        KitchenSettings s = thresholds(600, 300);

        assertThat(engine.classify(Duration.ofSeconds(300), s)).isEqualTo(EscalationLevel.CRITICAL);
    }

    @Test
    @DisplayName("경과 시간은 마지막 전이 시각 기준")
    void elapsed_fromLastTransition() {
        LocalDateTime created = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC).minusMinutes(20);
        Ticket t = Ticket.receive("hub-1", "ord-1", "line-1", "grill", "Fries", 1, null, 0, created);
        t.apply(TicketTrigger.ACCEPT, created.plusMinutes(15));

        TicketTiming timing = engine.timingOf(t, KitchenSettings.defaults());

        assertThat(timing.elapsedSeconds()).isEqualTo(300);
        assertThat(timing.level()).isEqualTo(EscalationLevel.NORMAL);
    }

    @Test
    @DisplayName("timingOf: 경과 시간과 긴급도는 같은 시점 기준")
    void timingOf_readsClockOnce() {
        LocalDateTime start = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);
        Ticket t = Ticket.receive("hub-1", "ord-1", "line-1", "grill", "Fries", 1, null, 0, start);
        // 읽을 때마다 1초씩 흐르는 시계: 첫 읽기 899초, 두 번째 읽기 900초
        AtomicLong reads = new AtomicLong();
        Clock stepping = new Clock() {
            @Override
            public ZoneId getZone() {
                return ZoneOffset.UTC;
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                return NOW.plusSeconds(899 + reads.getAndIncrement());
            }
        };

        TicketTiming timing = new EscalationEngine(stepping).timingOf(t, KitchenSettings.defaults());

        assertThat(timing.elapsedSeconds()).isEqualTo(899);
        assertThat(timing.level()).isEqualTo(EscalationLevel.NORMAL);
        assertThat(reads.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("미래 시각의 전이는 경과 0초로 본다")
    void futureTransition_elapsedZero() {
        LocalDateTime future = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC).plusMinutes(1);
        Ticket t = Ticket.receive("hub-1", "ord-1", "line-1", "grill", "Fries", 1, null, 0, future);

        assertThat(engine.elapsed(t)).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("종료된 티켓은 오래됐어도 NORMAL")
    void terminalTicket_alwaysNormal() {
        LocalDateTime longAgo = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC).minusHours(3);
        Ticket t = Ticket.receive("hub-1", "ord-1", "line-1", "grill", "Fries", 1, null, 0, longAgo);
        t.apply(TicketTrigger.CANCEL, longAgo.plusSeconds(1));

        assertThat(engine.classify(t, KitchenSettings.defaults())).isEqualTo(EscalationLevel.NORMAL);
    }
}
