package com.cityflow.traffic.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * POJO representation of a suite of traffic cases.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TrafficCaseDefinition {
    private String name;
    private List<CaseDef> cases;

    /** One city map with its expected serialized result. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class CaseDef {
        private String name;
        private List<String> input;
        private String expected;
    }
}
