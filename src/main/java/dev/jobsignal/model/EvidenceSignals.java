package dev.jobsignal.model;

import dev.jobsignal.entity.AiSignal;
import dev.jobsignal.entity.LeadershipSignal;
import dev.jobsignal.entity.ToolAdoption;

import java.util.Collection;
import java.util.List;

/**
 * All evidence stored for one company.
 */
public record EvidenceSignals(
        List<LeadershipSignal> leadership,
        List<ToolAdoption> tools,
        List<AiSignal> signals) {

    public EvidenceSignals {
        leadership = List.copyOf(leadership);
        tools = List.copyOf(tools);
        signals = List.copyOf(signals);
    }

    public static EvidenceSignals empty() {
        return new EvidenceSignals(List.of(), List.of(), List.of());
    }

    /**
     * General signals whose type indicates culture.
     */
    public List<AiSignal> culture(Collection<SignalType> cultureTypes) {
        return signals.stream()
                .filter(signal -> cultureTypes.contains(signal.getSignalType()))
                .toList();
    }

    public int totalCount() {
        return leadership.size() + tools.size() + signals.size();
    }
}
