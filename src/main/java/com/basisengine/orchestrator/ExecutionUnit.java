package com.basisengine.orchestrator;

import com.basisengine.domain.model.AtomicGroup;
import com.basisengine.domain.model.Instruction;
import java.util.LinkedHashSet;
import java.util.Set;

/** One thing the orchestrator executes at a time: a singleton instruction or a whole atomic group. */
public interface ExecutionUnit {

    Set<String> touchedVenues();

    String label();

    record Single(Instruction instruction) implements ExecutionUnit {

        @Override
        public Set<String> touchedVenues() {
            return new LinkedHashSet<>(instruction.touchedVenues());
        }

        @Override
        public String label() {
            return instruction.getId();
        }
    }

    record Group(AtomicGroup group) implements ExecutionUnit {

        @Override
        public Set<String> touchedVenues() {
            return group.touchedVenues();
        }

        @Override
        public String label() {
            return group.getGroupId();
        }
    }
}
