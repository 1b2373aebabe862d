package com.basisengine.reconciliation;

import com.basisengine.domain.model.ExecutionResult;
import com.basisengine.domain.model.Instruction;
import java.time.Instant;

/** A timed-out instruction whose outcome is still unknown. */
public record PendingSettlement(Instruction instruction, ExecutionResult timedOut, Instant registeredAt) {

    public String instructionId() {
        return instruction.getId();
    }

    public String venue() {
        return instruction.getVenue();
    }
}
