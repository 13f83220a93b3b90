package com.karting.entries.persistence.repository;

import com.karting.entries.persistence.entity.FailedNotificationEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FailedNotificationRepository extends JpaRepository<FailedNotificationEntity, String> {

    List<FailedNotificationEntity> findAllByOrderByOccurredAtDesc(Pageable pageable);
}
