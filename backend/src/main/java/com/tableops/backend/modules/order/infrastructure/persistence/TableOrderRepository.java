package com.tableops.backend.modules.order.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.tableops.backend.modules.order.domain.OrderStatus;
import com.tableops.backend.modules.order.domain.TableOrder;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TableOrderRepository extends JpaRepository<TableOrder, UUID>, JpaSpecificationExecutor<TableOrder> {

    /**
     * Compare-and-set on the status column. Returns 0 when another request already moved the order.
     */
    @Modifying(clearAutomatically = true)
    @Query("""
            update TableOrder o
               set o.status = :to,
                   o.updatedAt = :now
             where o.id = :id
               and o.status = :from
            """)
    int updateStatusIfCurrent(@Param("id") UUID id,
                              @Param("from") OrderStatus from,
                              @Param("to") OrderStatus to,
                              @Param("now") OffsetDateTime now);
}
