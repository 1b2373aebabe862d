package com.basisengine.coordination;

import com.basisengine.domain.enums.InstructionAction;
import com.basisengine.domain.enums.OrderType;
import com.basisengine.domain.enums.VenueType;
import com.basisengine.domain.model.ExecutionResult;
import com.basisengine.domain.model.FlashLoanInstruction;
import com.basisengine.domain.model.Instruction;
import com.basisengine.domain.model.TradeInstruction;
import com.basisengine.domain.model.TransferInstruction;
import com.basisengine.routing.VenueRegistry;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Decides how to undo a settled group leg.
 *
 * <ul>
 *   <li>FLASH_BORROW: repay the borrowed amount (the group's own repay never ran)</li>
 *   <li>CEX trade: opposite market trade for the filled size</li>
 *   <li>transfer: transfer the amount back</li>
 *   <li>swaps, on-chain trades and repays: none; they settled irreversible chain state</li>
 * </ul>
 *
 * <p>Compensations carry the original id with a {@value #SUFFIX} suffix and no group id.
 */
@Component
public class CompensationPlanner {

    static final String SUFFIX = "-COMP";

    private final VenueRegistry venueRegistry;

    public CompensationPlanner(VenueRegistry venueRegistry) {
        this.venueRegistry = venueRegistry;
    }

    public Optional<Instruction> plan(Instruction settled, ExecutionResult result) {
        BigDecimal size = result.getFilledSize() != null ? result.getFilledSize().abs() : settled.absoluteSize();

        if (settled instanceof FlashLoanInstruction borrow && borrow.getAction() == InstructionAction.FLASH_BORROW) {
            return Optional.of(FlashLoanInstruction.builder()
                    .id(settled.getId() + SUFFIX)
                    .action(InstructionAction.FLASH_REPAY)
                    .venue(settled.getVenue())
                    .asset(settled.getAsset())
                    .signedSize(size.negate())
                    .feeBps(borrow.getFeeBps())
                    .timestamp(Instant.now())
                    .build());
        }
        if (settled instanceof TradeInstruction
                && venueRegistry.typeOf(settled.getVenue()).orElse(null) == VenueType.CEX) {
            BigDecimal reversed = settled.getSignedSize().signum() < 0 ? size : size.negate();
            return Optional.of(TradeInstruction.builder()
                    .id(settled.getId() + SUFFIX)
                    .action(settled.getAction())
                    .venue(settled.getVenue())
                    .asset(settled.getAsset())
                    .signedSize(reversed)
                    .orderType(OrderType.MARKET)
                    .leverage(settled.getLeverage())
                    .timestamp(Instant.now())
                    .build());
        }
        if (settled instanceof TransferInstruction transfer) {
            return Optional.of(TransferInstruction.builder()
                    .id(settled.getId() + SUFFIX)
                    .action(InstructionAction.TRANSFER)
                    .venue(transfer.getTargetVenue())
                    .targetVenue(transfer.getVenue())
                    .asset(settled.getAsset())
                    .signedSize(size)
                    .timestamp(Instant.now())
                    .build());
        }
        return Optional.empty();
    }
}
