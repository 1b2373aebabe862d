package com.basisengine.domain.model;

/** An instruction paired with the result its execution produced. */
public record ExecutedInstruction(Instruction instruction, ExecutionResult result) {

    public boolean isSuccess() {
        return result.isSuccess();
    }
}
