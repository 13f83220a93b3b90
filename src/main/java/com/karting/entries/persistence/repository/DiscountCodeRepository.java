package com.karting.entries.persistence.repository;

import com.karting.entries.persistence.entity.DiscountCodeEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DiscountCodeRepository extends JpaRepository<DiscountCodeEntity, String> {

    Optional<DiscountCodeEntity> findByCodeIgnoreCase(String code);
}
