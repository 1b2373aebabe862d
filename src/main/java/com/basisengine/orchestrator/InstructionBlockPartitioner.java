package com.basisengine.orchestrator;

import com.basisengine.domain.model.AtomicGroup;
import com.basisengine.domain.model.Instruction;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Splits an instruction block into execution units while keeping the block's order.
 *
 * <p>A group occupies the position of its first member in the block; its members are ordered by
 * {@code sequenceInGroup} regardless of where they appeared. Singletons keep input order.
 */
@Component
public class InstructionBlockPartitioner {

    public List<ExecutionUnit> partition(List<Instruction> block) {
        Map<String, List<Instruction>> groups = new LinkedHashMap<>();
        List<Object> order = new ArrayList<>();

        for (Instruction instruction : block) {
            if (instruction.isGrouped()) {
                List<Instruction> members = groups.get(instruction.getAtomicGroupId());
                if (members == null) {
                    members = new ArrayList<>();
                    groups.put(instruction.getAtomicGroupId(), members);
                    order.add(instruction.getAtomicGroupId());
                }
                members.add(instruction);
            } else {
                order.add(instruction);
            }
        }

        List<ExecutionUnit> units = new ArrayList<>(order.size());
        for (Object entry : order) {
            if (entry instanceof Instruction single) {
                units.add(new ExecutionUnit.Single(single));
            } else {
                String groupId = (String) entry;
                units.add(new ExecutionUnit.Group(new AtomicGroup(groupId, groups.get(groupId))));
            }
        }
        return units;
    }
}
