package com.karting.entries.persistence.repository;

import com.karting.entries.persistence.entity.PoolEngineRentalEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PoolEngineRentalRepository extends JpaRepository<PoolEngineRentalEntity, String> {

    Optional<PoolEngineRentalEntity> findByDriverIdAndChampionshipClassAndRentalTypeAndSeasonYear(
            String driverId, String championshipClass, String rentalType, int seasonYear);

    Optional<PoolEngineRentalEntity> findByPaymentReference(String paymentReference);

    List<PoolEngineRentalEntity> findByDriverIdAndSeasonYear(String driverId, int seasonYear);
}
