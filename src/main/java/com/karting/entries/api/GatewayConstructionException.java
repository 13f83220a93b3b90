package com.karting.entries.api;

import org.springframework.http.HttpStatus;

/**
 * The outbound gateway redirect could not be assembled.
 */
public class GatewayConstructionException extends EntryServiceException {

    public GatewayConstructionException(String message) {
        super(message);
    }

    public GatewayConstructionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "GATEWAY_CONSTRUCTION_FAILED";
    }

    @Override
    public HttpStatus getStatus() {
        return HttpStatus.BAD_GATEWAY;
    }
}
