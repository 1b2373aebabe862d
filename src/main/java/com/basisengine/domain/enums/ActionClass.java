package com.basisengine.domain.enums;

import java.util.Optional;

/**
 * Second half of the routing key. An adapter registers for (venue, action class) pairs.
 */
public enum ActionClass {
    CEX_TRADE,
    ONCHAIN_OPERATION,
    WALLET_TRANSFER;

    /**
     * Resolves the action class for an action on a venue of the given type.
     * Empty when the combination has no meaning (e.g. a flash loan on a CEX).
     */
    public static Optional<ActionClass> resolve(InstructionAction action, VenueType venueType) {
        if (action == null || venueType == null) {
            return Optional.empty();
        }
        if (action == InstructionAction.TRANSFER) {
            return Optional.of(WALLET_TRANSFER);
        }
        return switch (venueType) {
            case CEX -> action.isTrade() ? Optional.of(CEX_TRADE) : Optional.empty();
            case ONCHAIN -> Optional.of(ONCHAIN_OPERATION);
            case WALLET -> Optional.empty();
        };
    }
}
