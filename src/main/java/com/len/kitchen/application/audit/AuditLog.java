package com.len.kitchen.application.audit;

import com.len.kitchen.domain.audit.AuditEntry;
import com.len.kitchen.infra.audit.AuditEntryJpaRepository;
import com.len.kitchen.infra.audit.AuditEntrySpecifications;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 티켓 상태 변경 이력 (append-only).
 * 쓰기는 항상 상태 변경과 같은 트랜잭션 안에서만 허용한다.
 */
@Service
@RequiredArgsConstructor
public class AuditLog {

    private static final Sort CHRONOLOGICAL = Sort.by(Sort.Order.asc("occurredAt"), Sort.Order.asc("id"));

    private final AuditEntryJpaRepository auditRepository;

    // 트랜잭션 밖에서 호출되면 IllegalTransactionStateException
    @Transactional(propagation = Propagation.MANDATORY)
    public AuditEntry append(AuditEntry entry) {
        return auditRepository.save(entry);
    }

    @Transactional(readOnly = true)
    public Slice<AuditEntry> query(AuditFilter filter, Pageable pageable) {
        Pageable sorted = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(), CHRONOLOGICAL);
        return auditRepository.findSlice(AuditEntrySpecifications.matching(filter), sorted);
    }

    @Transactional(readOnly = true)
    public List<AuditEntry> historyOf(Long ticketId) {
        return auditRepository.findByTicketIdOrderByIdAsc(ticketId);
    }

    @Transactional(readOnly = true)
    public long countForTicket(Long ticketId) {
        return auditRepository.countByTicketId(ticketId);
    }
}
