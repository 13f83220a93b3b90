package com.karting.entries.api;

import com.karting.entries.api.dto.PoolRentalRequestDto;
import com.karting.entries.api.dto.PoolRentalResponseDto;
import com.karting.entries.core.PoolRentalCoordinator;
import com.karting.entries.persistence.entity.DriverEntity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/pool-rentals")
@RequiredArgsConstructor
@Tag(name = "Pool engine rentals", description = "Season-long engine rentals from the pool")
public class PoolRentalController {

    private final PoolRentalCoordinator poolRentalCoordinator;
    private final DriverAuthenticator authenticator;

    @PostMapping("/initiate")
    @Operation(summary = "Start a season pool-engine rental payment")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Pending rental and PayFast form fields"),
            @ApiResponse(responseCode = "400", description = "Unknown rental type or missing class"),
            @ApiResponse(responseCode = "409", description = "DUPLICATE_ENTRY: this season rental is already paid")
    })
    public ResponseEntity<PoolRentalResponseDto> initiate(@Valid @RequestBody PoolRentalRequestDto dto,
                                                          HttpServletRequest httpRequest) {
        DriverEntity driver = authenticator.authenticate(httpRequest);
        return ResponseEntity.ok(PoolRentalResponseDto.from(
                poolRentalCoordinator.initiate(driver.getDriverId(), dto.getChampionshipClass(), dto.getRentalType())));
    }
}
