package com.ultron.gateway.queue;

import java.util.ArrayList;
import java.util.List;

/**
 * Attached to a unit that replaced several queued units on overflow. The
 * executor writes the summary; the queue only records what was collapsed.
 *
 * @param droppedUnits number of queued units folded into this one
 * @param summaryLines one short line per folded unit, oldest first
 */
public record SummaryRequest(int droppedUnits, List<String> summaryLines) {

    public SummaryRequest {
        summaryLines = summaryLines != null ? List.copyOf(summaryLines) : List.of();
    }

    public SummaryRequest merge(SummaryRequest other) {
        if (other == null) {
            return this;
        }
        List<String> lines = new ArrayList<>(summaryLines);
        lines.addAll(other.summaryLines);
        return new SummaryRequest(droppedUnits + other.droppedUnits, lines);
    }

    /**
     * Prompt text describing the collapse, used as the synthetic unit's prompt.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder()
                .append("[")
                .append(droppedUnits)
                .append(" queued message batch(es) were collapsed while the agent was busy. Summarize them before replying:]");
        for (String line : summaryLines) {
            sb.append("\n- ").append(line);
        }
        return sb.toString();
    }
}
