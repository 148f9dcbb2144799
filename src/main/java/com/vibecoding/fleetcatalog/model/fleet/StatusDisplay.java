package com.vibecoding.fleetcatalog.model.fleet;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fleet 리소스의 status.display 블록
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StatusDisplay {
    private String readyClusters;     // "2/3"
    private String state;             // Ready, NotReady, ErrApplied ...
    private String message;
    private Boolean error;
}
