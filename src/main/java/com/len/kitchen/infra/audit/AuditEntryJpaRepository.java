package com.len.kitchen.infra.audit;

import com.len.kitchen.domain.audit.AuditEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.List;

public interface AuditEntryJpaRepository extends JpaRepository<AuditEntry, Long>,
        JpaSpecificationExecutor<AuditEntry>, AuditEntrySliceQuery {

    long countByTicketId(Long ticketId);

    List<AuditEntry> findByTicketIdOrderByIdAsc(Long ticketId);
}
