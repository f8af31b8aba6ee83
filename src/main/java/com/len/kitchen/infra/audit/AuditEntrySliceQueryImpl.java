package com.len.kitchen.infra.audit;

import com.len.kitchen.domain.audit.AuditEntry;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.domain.SliceImpl;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.query.QueryUtils;

import java.util.List;

// AuditEntryJpaRepository 의 fragment 구현 (이름 규칙: 인터페이스명 + Impl)
public class AuditEntrySliceQueryImpl implements AuditEntrySliceQuery {

    @PersistenceContext
    private EntityManager em;

    @Override
    public Slice<AuditEntry> findSlice(Specification<AuditEntry> spec, Pageable pageable) {
        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<AuditEntry> query = cb.createQuery(AuditEntry.class);
        Root<AuditEntry> root = query.from(AuditEntry.class);

        Predicate where = spec.toPredicate(root, query, cb);
        if (where != null) {
            query.where(where);
        }
        query.select(root).orderBy(QueryUtils.toOrders(pageable.getSort(), root, cb));

        List<AuditEntry> rows = em.createQuery(query)
                .setFirstResult((int) pageable.getOffset())
                .setMaxResults(pageable.getPageSize() + 1)
                .getResultList();

        boolean hasNext = rows.size() > pageable.getPageSize();
        List<AuditEntry> content = hasNext ? rows.subList(0, pageable.getPageSize()) : rows;
        return new SliceImpl<>(content, pageable, hasNext);
    }
}
