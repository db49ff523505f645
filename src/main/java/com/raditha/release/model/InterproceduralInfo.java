package com.raditha.release.model;

import java.util.List;

/**
 * Advisory record of calls that receive the tracked variable.
 *
 * @param callsWithVariable         every call passing the variable as an argument
 * @param potentialReleasingCallees the subset whose name or parameter suggests it takes ownership
 */
public record InterproceduralInfo(List<String> callsWithVariable, List<String> potentialReleasingCallees) {

    public InterproceduralInfo {
        callsWithVariable = List.copyOf(callsWithVariable);
        potentialReleasingCallees = List.copyOf(potentialReleasingCallees);
    }

    public static InterproceduralInfo none() {
        return new InterproceduralInfo(List.of(), List.of());
    }

    public boolean mayBeReleasedByCallee() {
        return !potentialReleasingCallees.isEmpty();
    }
}
