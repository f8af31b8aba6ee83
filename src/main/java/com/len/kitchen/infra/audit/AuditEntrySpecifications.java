package com.len.kitchen.infra.audit;

import com.len.kitchen.application.audit.AuditFilter;
import com.len.kitchen.domain.audit.AuditEntry;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;

public final class AuditEntrySpecifications {

    private AuditEntrySpecifications() {}

    public static Specification<AuditEntry> matching(AuditFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (filter.hubId() != null) {
                predicates.add(cb.equal(root.get("hubId"), filter.hubId()));
            }
            if (filter.ticketId() != null) {
                predicates.add(cb.equal(root.get("ticketId"), filter.ticketId()));
            }
            if (filter.orderId() != null) {
                predicates.add(cb.equal(root.get("orderId"), filter.orderId()));
            }
            if (filter.stationId() != null) {
                predicates.add(cb.equal(root.get("stationId"), filter.stationId()));
            }
            if (filter.actor() != null) {
                predicates.add(cb.equal(root.get("actor"), filter.actor()));
            }
            if (filter.action() != null) {
                predicates.add(cb.equal(root.get("action"), filter.action()));
            }
            if (filter.from() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("occurredAt"), filter.from()));
            }
            if (filter.to() != null) {
                predicates.add(cb.lessThan(root.get("occurredAt"), filter.to()));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
