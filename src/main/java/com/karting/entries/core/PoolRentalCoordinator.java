package com.karting.entries.core;

import com.karting.entries.api.DuplicateEntryException;
import com.karting.entries.api.NotFoundException;
import com.karting.entries.api.ValidationFailedException;
import com.karting.entries.compliance.ComplianceAuditLogger;
import com.karting.entries.domain.GatewayCheckout;
import com.karting.entries.domain.GatewayForm;
import com.karting.entries.domain.PaymentReference;
import com.karting.entries.domain.PaymentStatus;
import com.karting.entries.messaging.EntryEventProducer;
import com.karting.entries.persistence.entity.DriverEntity;
import com.karting.entries.persistence.entity.PoolEngineRentalEntity;
import com.karting.entries.persistence.repository.DriverRepository;
import com.karting.entries.persistence.repository.PoolEngineRentalRepository;
import com.karting.entries.persistence.service.EntryStore;
import com.karting.entries.persistence.service.StoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Season pool-engine rentals. One row per (driver, class, rental type, season); a Pending row is
 * re-used with a fresh reference when the driver retries checkout.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PoolRentalCoordinator {

    private final DriverRepository driverRepository;
    private final PoolEngineRentalRepository poolRentalRepository;
    private final EntryStore entryStore;
    private final StoreTransactions transactions;
    private final PriceCalculator priceCalculator;
    private final GatewayAdapter gatewayAdapter;
    private final EntryEventProducer eventProducer;
    private final ComplianceAuditLogger auditLogger;

    @Value("${karting.payfast.return-url:http://localhost:8080/payment-success.html}")
    private String returnUrl;

    @Value("${karting.payfast.cancel-url:http://localhost:8080/payment-cancel.html}")
    private String cancelUrl;

    @Value("${karting.payfast.notify-url:http://localhost:8080/api/v1/payments/notify}")
    private String notifyUrl;

    public PoolRentalInitiation initiate(String driverId, String championshipClass, String rentalType) {
        if (championshipClass == null || championshipClass.isBlank()) {
            throw new ValidationFailedException("championshipClass", "Championship class is required");
        }
        DriverEntity driver = driverRepository.findById(driverId)
                .orElseThrow(() -> new NotFoundException("Driver " + driverId + " not found"));
        BigDecimal amount = priceCalculator.quotePoolRental(rentalType);

        long now = System.currentTimeMillis();
        int seasonYear = Instant.ofEpochMilli(now).atZone(ZoneOffset.UTC).getYear();
        PaymentReference.Pool reference = PaymentReference.pool(championshipClass, rentalType, driverId, now);
        GatewayForm form = gatewayAdapter.buildCheckoutForm(GatewayCheckout.builder()
                .paymentReference(reference.getValue())
                .amount(amount)
                .itemName("Pool Engine Rental - " + championshipClass)
                .itemDescription(rentalType + " engine rental, " + seasonYear + " season")
                .returnUrl(returnUrl)
                .cancelUrl(cancelUrl)
                .notifyUrl(notifyUrl)
                .payerEmail(driver.getEmail())
                .payerFirstName(driver.getFirstName())
                .payerLastName(driver.getLastName())
                .build());

        PoolEngineRentalEntity saved = transactions.execute("initiate_pool_rental", () -> {
            PoolEngineRentalEntity rental = poolRentalRepository
                    .findByDriverIdAndChampionshipClassAndRentalTypeAndSeasonYear(driverId, championshipClass, rentalType, seasonYear)
                    .orElse(null);
            if (rental != null && rental.getPaymentStatus() == PaymentStatus.COMPLETED) {
                throw new DuplicateEntryException(rental.getPaymentReference(),
                        "Season rental already paid for " + championshipClass + " " + rentalType + " " + seasonYear);
            }
            if (rental == null) {
                rental = PoolEngineRentalEntity.builder()
                        .rentalId(UUID.randomUUID().toString())
                        .driverId(driverId)
                        .championshipClass(championshipClass)
                        .rentalType(rentalType)
                        .seasonYear(seasonYear)
                        .build();
            }
            rental.setAmountPaid(amount);
            rental.setPaymentReference(reference.getValue());
            rental.setPaymentStatus(PaymentStatus.PENDING);
            PoolEngineRentalEntity row = poolRentalRepository.saveAndFlush(rental);

            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("paymentReference", row.getPaymentReference());
            detail.put("championshipClass", championshipClass);
            detail.put("rentalType", rentalType);
            detail.put("seasonYear", seasonYear);
            detail.put("amount", amount);
            entryStore.appendAudit("pool_rental_initiated", EntryCoordinator.ACTOR_DRIVER, row.getRentalId(), detail);
            return row;
        });

        auditLogger.logPoolRental(saved.getRentalId(), saved.getPaymentReference(), PaymentStatus.PENDING, EntryCoordinator.ACTOR_DRIVER);
        eventProducer.publishPoolRental("POOL_RENTAL_INITIATED", saved, EntryCoordinator.ACTOR_DRIVER);
        return new PoolRentalInitiation(saved, form);
    }
}
