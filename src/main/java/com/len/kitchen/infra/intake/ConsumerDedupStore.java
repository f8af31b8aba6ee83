package com.len.kitchen.infra.intake;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

@Repository
@RequiredArgsConstructor
public class ConsumerDedupStore {

    private final JdbcTemplate jdbcTemplate;

    /**
     * @return 처음 보는 eventId면 true, 이미 처리한 것이면 false
     */
    public boolean markProcessed(String eventId, LocalDateTime now) {
        try {
            jdbcTemplate.update(
                    "INSERT INTO consumer_dedup(event_id, processed_at) VALUES (?, ?)",
                    eventId, now
            );
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    public void forget(String eventId) {
        jdbcTemplate.update("DELETE FROM consumer_dedup WHERE event_id = ?", eventId);
    }
}
