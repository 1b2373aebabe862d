package com.basisengine.exception;

import java.util.Map;

/**
 * No enabled adapter serves the instruction's (venue, action class). Fatal to that instruction only;
 * raised before anything is submitted.
 */
public class UnroutableInstructionException extends BaseException {

    public UnroutableInstructionException(String instructionId, String venue, String reason) {
        super(
                ErrorCode.UNROUTABLE,
                "Instruction " + instructionId + " is unroutable on venue " + venue + ": " + reason,
                Map.of("instructionId", String.valueOf(instructionId), "venue", String.valueOf(venue)));
    }
}
