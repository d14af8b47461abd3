package com.tableops.backend.modules.order.infrastructure.persistence;

import java.time.LocalDate;

import com.tableops.backend.modules.order.domain.OrderNumberSequence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OrderNumberSequenceRepository extends JpaRepository<OrderNumberSequence, LocalDate> {

    /**
     * Atomically claims the next number of the day; concurrent callers never receive the same value.
     */
    @Query(value = """
            insert into order_number_sequence (business_date, last_number)
            values (:businessDate, 1)
            on conflict (business_date)
            do update set last_number = order_number_sequence.last_number + 1
            returning last_number
            """, nativeQuery = true)
    Integer claimNext(@Param("businessDate") LocalDate businessDate);
}
