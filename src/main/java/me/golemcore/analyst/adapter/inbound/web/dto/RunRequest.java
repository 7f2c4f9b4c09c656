package me.golemcore.analyst.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of a run call. A missing {@code maxSteps} uses the configured default.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunRequest {
    private Integer maxSteps;
}
