package com.karting.entries.core;

import com.karting.entries.domain.GatewayForm;
import com.karting.entries.persistence.entity.PoolEngineRentalEntity;
import lombok.Value;

@Value
public class PoolRentalInitiation {

    PoolEngineRentalEntity rental;
    GatewayForm gatewayForm;
}
