package com.nosota.groupbuy.repository;

import com.nosota.groupbuy.model.PurchaseOrder;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for {@link PurchaseOrder} entity operations.
 */
@Repository
public interface PurchaseOrderRepository extends JpaRepository<PurchaseOrder, Long> {

    Page<PurchaseOrder> findAllByOrderByIdDesc(Pageable pageable);

    /**
     * Finds orders by lifecycle flags, newest first.
     * (true, false) = OPEN, (false, true) = FULFILLED, (false, false) = CANCELLED.
     */
    Page<PurchaseOrder> findByActiveAndFulfilledOrderByIdDesc(boolean active, boolean fulfilled, Pageable pageable);

    /**
     * Finds open orders whose deadline passed before reaching the minimum units threshold.
     *
     * @param now Current time
     * @return Order IDs in creation order
     */
    @Query("SELECT o.id FROM PurchaseOrder o " +
            "WHERE o.active = true AND o.deadline < :now AND o.totalUnitsCommitted < o.minUnits " +
            "ORDER BY o.id")
    List<Long> findExpiredUnderfundedOrderIds(@Param("now") LocalDateTime now);
}
