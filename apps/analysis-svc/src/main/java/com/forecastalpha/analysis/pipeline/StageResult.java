package com.forecastalpha.analysis.pipeline;

import com.forecastalpha.analysis.model.Table;
import java.util.List;

/**
 * Output of one pipeline stage: the new table plus the steps applied, in application order.
 */
public record StageResult(Table table, List<String> steps) {
    public StageResult {
        steps = List.copyOf(steps);
    }
}
