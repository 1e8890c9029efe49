package com.nosota.groupbuy.repository;

import com.nosota.groupbuy.model.Contribution;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ContributionRepository extends JpaRepository<Contribution, Long> {

    /**
     * Gets the contributions of an order in join order.
     */
    List<Contribution> findByOrderIdOrderByIdAsc(Long orderId);

    /**
     * One-contribution-per-retailer lookup used by joinOrder.
     */
    boolean existsByOrderIdAndRetailerId(Long orderId, String retailerId);
}
