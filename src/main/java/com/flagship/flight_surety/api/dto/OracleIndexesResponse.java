package com.flagship.flight_surety.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class OracleIndexesResponse {

    @JsonProperty("oracle")
    String oracle;

    @JsonProperty("indexes")
    List<Integer> indexes;
}
