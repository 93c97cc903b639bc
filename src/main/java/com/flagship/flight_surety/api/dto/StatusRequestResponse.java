package com.flagship.flight_surety.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.flight_surety.oracle.ResponseKey;
import lombok.Value;

/**
 * The index oracles must hold to answer an opened status request.
 */
@Value
public class StatusRequestResponse {

    @JsonProperty("index")
    int index;

    @JsonProperty("flight")
    String flight;

    public static StatusRequestResponse from(ResponseKey key) {
        return new StatusRequestResponse(key.getIndex(), key.getFlight().toString());
    }
}
