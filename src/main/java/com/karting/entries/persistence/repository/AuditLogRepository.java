package com.karting.entries.persistence.repository;

import com.karting.entries.persistence.entity.AuditLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLogEntity, String> {

    List<AuditLogEntity> findByTargetIdOrderByOccurredAtAsc(String targetId);

    List<AuditLogEntity> findByActionOrderByOccurredAtDesc(String action);
}
