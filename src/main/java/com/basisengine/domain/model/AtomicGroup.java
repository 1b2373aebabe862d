package com.basisengine.domain.model;

import com.basisengine.domain.enums.AtomicGroupStatus;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;

/**
 * Instructions sharing one atomic group id, ordered by {@code sequenceInGroup}.
 * Status only moves forward; an illegal transition is a programming error.
 */
@Getter
public class AtomicGroup {

    private final String groupId;
    private final List<Instruction> instructions;
    private AtomicGroupStatus status = AtomicGroupStatus.PENDING;
    private final List<AtomicGroupStatus> history = new ArrayList<>(List.of(AtomicGroupStatus.PENDING));

    public AtomicGroup(String groupId, List<Instruction> members) {
        this.groupId = groupId;
        List<Instruction> sorted = new ArrayList<>(members);
        sorted.sort(Comparator.comparingInt(Instruction::getSequenceInGroup));
        this.instructions = Collections.unmodifiableList(sorted);
    }

    public AtomicGroupStatus transitionTo(AtomicGroupStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal atomic group transition " + status + " -> " + next + " for group " + groupId);
        }
        AtomicGroupStatus previous = status;
        status = next;
        history.add(next);
        return previous;
    }

    public Set<String> touchedVenues() {
        Set<String> venues = new LinkedHashSet<>();
        instructions.forEach(i -> venues.addAll(i.touchedVenues()));
        return venues;
    }

    public boolean containsFlashLoan() {
        return instructions.stream().anyMatch(i -> i.getAction().isFlashLoan());
    }
}
