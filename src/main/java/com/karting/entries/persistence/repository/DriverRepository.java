package com.karting.entries.persistence.repository;

import com.karting.entries.persistence.entity.DriverEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DriverRepository extends JpaRepository<DriverEntity, String> {

    Optional<DriverEntity> findByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCase(String email);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DriverEntity d SET d.nextRaceEntryStatus = :status, d.nextRaceEngineRentalStatus = :rental "
            + "WHERE d.driverId = :driverId")
    int updateNextRaceStatus(@Param("driverId") String driverId,
                             @Param("status") String status,
                             @Param("rental") String rentalStatus);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DriverEntity d SET d.seasonEngineRental = true WHERE d.driverId = :driverId")
    int markSeasonEngineRental(@Param("driverId") String driverId);
}
