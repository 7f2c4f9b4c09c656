package me.golemcore.analyst.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Query against the search backend, in the backend's native DSL.
 */
@Data
@Builder
public class SearchRequest {

    private String index;
    private Map<String, Object> query;
    private int size;
    private List<Map<String, Object>> sort;
}
