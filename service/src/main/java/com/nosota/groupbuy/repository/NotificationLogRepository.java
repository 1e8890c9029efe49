package com.nosota.groupbuy.repository;

import com.nosota.groupbuy.api.model.NotificationType;
import com.nosota.groupbuy.model.NotificationLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface NotificationLogRepository extends JpaRepository<NotificationLogEntry, Long> {

    List<NotificationLogEntry> findByOrderIdOrderByIdAsc(Long orderId);

    long countByOrderIdAndType(Long orderId, NotificationType type);
}
