package com.nosota.groupbuy.repository;

import com.nosota.groupbuy.model.RewardRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RewardRecordRepository extends JpaRepository<RewardRecord, Long> {

    Optional<RewardRecord> findByOrderIdAndRetailerId(Long orderId, String retailerId);

    List<RewardRecord> findByOrderIdOrderByIdAsc(Long orderId);

    boolean existsByOrderId(Long orderId);
}
