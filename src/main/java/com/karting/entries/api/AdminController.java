package com.karting.entries.api;

import com.karting.entries.api.dto.CancelEntryRequestDto;
import com.karting.entries.api.dto.DiscountCodeDto;
import com.karting.entries.api.dto.DiscountCodeRequestDto;
import com.karting.entries.api.dto.EntryEditRequestDto;
import com.karting.entries.api.dto.EventDto;
import com.karting.entries.api.dto.EventRequestDto;
import com.karting.entries.api.dto.FailedNotificationDto;
import com.karting.entries.api.dto.ManualEntryRequestDto;
import com.karting.entries.api.dto.RaceEntryDto;
import com.karting.entries.api.dto.ReconcileRequestDto;
import com.karting.entries.api.dto.ReconcileResponseDto;
import com.karting.entries.core.AdminReconcileRequest;
import com.karting.entries.core.EntryAdministration;
import com.karting.entries.core.EntryCoordinator;
import com.karting.entries.core.EntryEdit;
import com.karting.entries.core.EventDefinition;
import com.karting.entries.core.ManualEntryRequest;
import com.karting.entries.core.PaymentReconciler;
import com.karting.entries.export.EntryListPdfExporter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Operator endpoints. Every request carries {@code X-Admin-Token} (checked by
 * {@link AdminTokenInterceptor}) and optionally {@code X-Admin-Actor} for the audit trail.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Tag(name = "Admin", description = "Manual entries, reconciliation, events and discount codes")
public class AdminController {

    private final EntryCoordinator coordinator;
    private final EntryAdministration administration;
    private final PaymentReconciler reconciler;
    private final EntryListPdfExporter pdfExporter;

    @PostMapping("/race-entries")
    @Operation(summary = "Add a race entry at a chosen payment status",
            description = "Ignores the registration window. paymentStatus is COMPLETED, FREE or PENDING.")
    public ResponseEntity<RaceEntryDto> addManualEntry(@Valid @RequestBody ManualEntryRequestDto dto,
                                                       @RequestHeader(value = AdminTokenInterceptor.ACTOR_HEADER, required = false) String actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(RaceEntryDto.from(coordinator.addManualEntry(
                ManualEntryRequest.builder()
                        .driverId(dto.getDriverId())
                        .eventId(dto.getEventId())
                        .raceClass(dto.getRaceClass())
                        .items(dto.getItems() == null ? List.of() : dto.getItems())
                        .paymentStatus(dto.getPaymentStatus())
                        .discountCode(dto.getDiscountCode())
                        .sendEmail(dto.isSendEmail())
                        .actor(actor)
                        .build())));
    }

    @PatchMapping("/race-entries/{entryId}")
    @Operation(summary = "Edit class, items or team code of an entry")
    public ResponseEntity<RaceEntryDto> editEntry(@PathVariable String entryId,
                                                  @Valid @RequestBody EntryEditRequestDto dto,
                                                  @RequestHeader(value = AdminTokenInterceptor.ACTOR_HEADER, required = false) String actor) {
        return ResponseEntity.ok(RaceEntryDto.from(administration.editEntry(entryId, EntryEdit.builder()
                .raceClass(dto.getRaceClass())
                .items(dto.getItems())
                .teamCode(dto.getTeamCode())
                .actor(actor)
                .build())));
    }

    @PostMapping("/race-entries/{entryId}/cancel")
    @Operation(summary = "Cancel an entry",
            description = "With expectedStatus the cancel only applies if the entry is still in that payment state.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Entry cancelled"),
            @ApiResponse(responseCode = "409", description = "PAYMENT_STATE_MISMATCH: entry moved on or is already cancelled")
    })
    public ResponseEntity<RaceEntryDto> cancelEntry(@PathVariable String entryId,
                                                    @RequestBody(required = false) CancelEntryRequestDto dto,
                                                    @RequestHeader(value = AdminTokenInterceptor.ACTOR_HEADER, required = false) String actor) {
        return ResponseEntity.ok(RaceEntryDto.from(administration.cancelEntry(entryId,
                dto == null ? null : dto.getExpectedStatus(), actor)));
    }

    @GetMapping("/race-entries")
    @Operation(summary = "List race entries, optionally for one event")
    public ResponseEntity<List<RaceEntryDto>> listEntries(@RequestParam(required = false) String eventId) {
        return ResponseEntity.ok(administration.listEntries(eventId).stream()
                .map(RaceEntryDto::from)
                .collect(Collectors.toList()));
    }

    @GetMapping(value = "/race-entries/export", produces = MediaType.APPLICATION_PDF_VALUE)
    @Operation(summary = "Export an event's entry list as PDF with ticket barcodes")
    public ResponseEntity<byte[]> exportEntries(@RequestParam String eventId) {
        byte[] pdf = pdfExporter.export(eventId);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_PDF)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename("race-entries-" + eventId + ".pdf").build().toString())
                .body(pdf);
    }

    @PostMapping("/payments/reconcile")
    @Operation(summary = "Apply a payment the gateway never notified",
            description = "Same effect as a COMPLETE notification for the reference. Repeating it is a no-op.")
    public ResponseEntity<ReconcileResponseDto> reconcile(@Valid @RequestBody ReconcileRequestDto dto,
                                                          @RequestHeader(value = AdminTokenInterceptor.ACTOR_HEADER, required = false) String actor) {
        return ResponseEntity.ok(ReconcileResponseDto.from(reconciler.reconcileManually(AdminReconcileRequest.builder()
                .paymentReference(dto.getPaymentReference())
                .payerEmail(dto.getPayerEmail())
                .payerFirstName(dto.getPayerFirstName())
                .payerLastName(dto.getPayerLastName())
                .amount(dto.getAmount())
                .pfPaymentId(dto.getPfPaymentId())
                .actor(actor)
                .build())));
    }

    @GetMapping("/failed-notifications")
    @Operation(summary = "List notifications that failed processing, newest first")
    public ResponseEntity<List<FailedNotificationDto>> failedNotifications(
            @Parameter(description = "Maximum rows, 1 to 500") @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(administration.listFailedNotifications(limit).stream()
                .map(FailedNotificationDto::from)
                .collect(Collectors.toList()));
    }

    @PostMapping("/events")
    @Operation(summary = "Create an event")
    public ResponseEntity<EventDto> createEvent(@Valid @RequestBody EventRequestDto dto,
                                                @RequestHeader(value = AdminTokenInterceptor.ACTOR_HEADER, required = false) String actor) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(EventDto.from(administration.createEvent(toDefinition(dto.getEventId(), dto), actor)));
    }

    @PutMapping("/events/{eventId}")
    @Operation(summary = "Update an event, including its registration window")
    public ResponseEntity<EventDto> updateEvent(@PathVariable String eventId,
                                                @Valid @RequestBody EventRequestDto dto,
                                                @RequestHeader(value = AdminTokenInterceptor.ACTOR_HEADER, required = false) String actor) {
        return ResponseEntity.ok(EventDto.from(administration.updateEvent(eventId, toDefinition(eventId, dto), actor)));
    }

    @PutMapping("/discount-codes/{code}")
    @Operation(summary = "Create or replace a discount code")
    public ResponseEntity<DiscountCodeDto> upsertDiscountCode(@PathVariable String code,
                                                              @Valid @RequestBody DiscountCodeRequestDto dto,
                                                              @RequestHeader(value = AdminTokenInterceptor.ACTOR_HEADER, required = false) String actor) {
        return ResponseEntity.ok(DiscountCodeDto.from(administration.upsertDiscountCode(code, dto.getDiscountType(),
                dto.getDiscountValue(), dto.getDescription(), dto.isActive(), actor)));
    }

    private static EventDefinition toDefinition(String eventId, EventRequestDto dto) {
        return EventDefinition.builder()
                .eventId(eventId)
                .name(dto.getName())
                .eventDate(dto.getEventDate())
                .venue(dto.getVenue())
                .registrationDeadline(dto.getRegistrationDeadline())
                .entryFee(dto.getEntryFee())
                .registrationOpen(dto.isRegistrationOpen())
                .build();
    }
}
