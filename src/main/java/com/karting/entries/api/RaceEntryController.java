package com.karting.entries.api;

import com.karting.entries.api.dto.InitiationResponseDto;
import com.karting.entries.api.dto.RaceEntryDto;
import com.karting.entries.api.dto.RaceEntryRequestDto;
import com.karting.entries.core.EntryCoordinator;
import com.karting.entries.core.EntryRequest;
import com.karting.entries.core.InitiationResult;
import com.karting.entries.persistence.entity.DriverEntity;
import com.karting.entries.persistence.entity.RaceEntryEntity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Driver-facing race entries. The caller is always the authenticated driver; there is no way to
 * enter on someone else's behalf here.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/race-entries")
@RequiredArgsConstructor
@Tag(name = "Race entries", description = "Initiate paid or free race entries and list your own")
public class RaceEntryController {

    private final EntryCoordinator coordinator;
    private final DriverAuthenticator authenticator;

    @PostMapping("/initiate")
    @Operation(summary = "Start a paid race entry",
            description = "Writes a Pending entry and returns the PayFast form fields to POST from the browser. "
                    + "A discount code that makes the entry free returns free=true and no form. "
                    + "Repeating requestKey returns the first result.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Form fields, or a confirmed free entry",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = InitiationResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "VALIDATION_FAILED or DISCOUNT_INVALID"),
            @ApiResponse(responseCode = "404", description = "Event not found"),
            @ApiResponse(responseCode = "409", description = "REGISTRATION_CLOSED")
    })
    public ResponseEntity<InitiationResponseDto> initiate(@Valid @RequestBody RaceEntryRequestDto dto,
                                                          HttpServletRequest httpRequest) {
        DriverEntity driver = authenticator.authenticate(httpRequest);
        InitiationResult result = coordinator.initiatePaidEntry(toRequest(driver, dto));
        log.debug("Initiation returned: paymentReference={}, free={}, replayed={}",
                result.getPaymentReference(), result.isFree(), result.isReplayed());
        return ResponseEntity.ok(InitiationResponseDto.from(result));
    }

    @PostMapping("/free")
    @Operation(summary = "Register a free race entry",
            description = "Requires a discount code of type FREE. No payment step.")
    public ResponseEntity<RaceEntryDto> registerFree(@Valid @RequestBody RaceEntryRequestDto dto,
                                                     HttpServletRequest httpRequest) {
        DriverEntity driver = authenticator.authenticate(httpRequest);
        RaceEntryEntity entry = coordinator.completeFreeEntry(toRequest(driver, dto));
        return ResponseEntity.status(HttpStatus.CREATED).body(RaceEntryDto.from(entry));
    }

    @GetMapping("/mine")
    @Operation(summary = "List your race entries with ticket references")
    public ResponseEntity<List<RaceEntryDto>> mine(HttpServletRequest httpRequest) {
        DriverEntity driver = authenticator.authenticate(httpRequest);
        return ResponseEntity.ok(coordinator.entriesForDriver(driver.getDriverId()).stream()
                .map(RaceEntryDto::from)
                .collect(Collectors.toList()));
    }

    private static EntryRequest toRequest(DriverEntity driver, RaceEntryRequestDto dto) {
        return EntryRequest.builder()
                .driverId(driver.getDriverId())
                .eventId(dto.getEventId())
                .raceClass(dto.getRaceClass())
                .items(dto.getItems() == null ? List.of() : dto.getItems())
                .discountCode(dto.getDiscountCode())
                .requestKey(dto.getRequestKey())
                .build();
    }
}
