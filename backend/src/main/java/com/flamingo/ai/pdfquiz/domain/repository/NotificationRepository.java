package com.flamingo.ai.pdfquiz.domain.repository;

import com.flamingo.ai.pdfquiz.domain.entity.Notification;
import com.flamingo.ai.pdfquiz.domain.enums.NotificationStatus;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for outbox notifications. */
@Repository
public interface NotificationRepository extends JpaRepository<Notification, Long> {

  List<Notification> findByStatusOrderByIdAsc(NotificationStatus status, Pageable pageable);

  List<Notification> findByJobId(String jobId);

  long countByStatus(NotificationStatus status);
}
