package com.len.kitchen.infra.audit;

import com.len.kitchen.domain.audit.AuditEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.domain.Specification;

public interface AuditEntrySliceQuery {

    /**
     * count 쿼리 없이 size+1 건을 읽어 다음 페이지 유무만 판단한다.
     */
    Slice<AuditEntry> findSlice(Specification<AuditEntry> spec, Pageable pageable);
}
