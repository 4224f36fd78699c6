package com.temporal.wcc.service.api.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A failed merge group resubmitted from a batch report.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroupRetryRequest {

    private String label;

    @NotEmpty(message = "eventIds cannot be empty")
    private List<String> eventIds;
}
