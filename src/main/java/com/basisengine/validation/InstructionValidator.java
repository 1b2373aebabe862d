package com.basisengine.validation;

import com.basisengine.domain.enums.InstructionAction;
import com.basisengine.domain.enums.OrderType;
import com.basisengine.domain.model.Instruction;
import com.basisengine.domain.model.TradeInstruction;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Checks instructions before anything is routed or submitted.
 *
 * <p>Field constraints come from the Jakarta annotations on the instruction types. On top of
 * those:
 * <ul>
 *   <li>LIMIT trades need a positive limit price</li>
 *   <li>group members share one group id and have distinct sequence numbers</li>
 *   <li>a group that borrows a flash loan ends with a FLASH_REPAY of the same asset on the same venue</li>
 * </ul>
 *
 * <p>Returns violation messages; an empty list means valid.
 */
@Component
public class InstructionValidator {

    private final Validator validator;

    public InstructionValidator(Validator validator) {
        this.validator = validator;
    }

    public List<String> validate(Instruction instruction) {
        List<String> violations = new ArrayList<>();
        if (instruction == null) {
            violations.add("instruction is null");
            return violations;
        }
        for (ConstraintViolation<Instruction> violation : validator.validate(instruction)) {
            violations.add(violation.getPropertyPath() + " " + violation.getMessage());
        }
        if (instruction instanceof TradeInstruction trade && trade.getOrderType() == OrderType.LIMIT) {
            if (trade.getLimitPrice() == null || trade.getLimitPrice().signum() <= 0) {
                violations.add("limitPrice required for LIMIT orders");
            }
        }
        violations.sort(Comparator.naturalOrder());
        return violations;
    }

    /** Validates every member and the group-level rules. Members must be in sequence order. */
    public List<String> validateGroup(List<Instruction> members) {
        List<String> violations = new ArrayList<>();
        if (members.isEmpty()) {
            violations.add("group is empty");
            return violations;
        }
        for (Instruction member : members) {
            validate(member).forEach(v -> violations.add(member.getId() + ": " + v));
        }

        String groupId = members.get(0).getAtomicGroupId();
        Set<Integer> sequences = new HashSet<>();
        for (Instruction member : members) {
            if (groupId == null || !groupId.equals(member.getAtomicGroupId())) {
                violations.add(member.getId() + ": atomicGroupId differs within group");
            }
            if (!sequences.add(member.getSequenceInGroup())) {
                violations.add(member.getId() + ": duplicate sequenceInGroup " + member.getSequenceInGroup());
            }
        }

        List<Instruction> borrows = members.stream()
                .filter(m -> m.getAction() == InstructionAction.FLASH_BORROW)
                .toList();
        if (!borrows.isEmpty()) {
            Instruction last = members.get(members.size() - 1);
            if (last.getAction() != InstructionAction.FLASH_REPAY) {
                violations.add("flash loan group must end with FLASH_REPAY");
            } else {
                for (Instruction borrow : borrows) {
                    if (!borrow.getAsset().equals(last.getAsset()) || !borrow.getVenue().equals(last.getVenue())) {
                        violations.add(borrow.getId() + ": FLASH_REPAY must repay the borrowed asset on the same venue");
                    }
                }
            }
        }
        return violations;
    }
}
