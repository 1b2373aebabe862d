package com.basisengine.unit.orchestrator;

import static org.assertj.core.api.Assertions.assertThat;

import com.basisengine.domain.enums.InstructionAction;
import com.basisengine.domain.model.Instruction;
import com.basisengine.domain.model.TradeInstruction;
import com.basisengine.orchestrator.ExecutionUnit;
import com.basisengine.orchestrator.InstructionBlockPartitioner;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InstructionBlockPartitionerTest {

    private final InstructionBlockPartitioner partitioner = new InstructionBlockPartitioner();

    private static Instruction instruction(String id, String groupId, int sequence) {
        return TradeInstruction.builder()
                .id(id)
                .action(InstructionAction.OPEN)
                .venue("binance")
                .asset("BTC")
                .signedSize(BigDecimal.ONE)
                .atomicGroupId(groupId)
                .sequenceInGroup(sequence)
                .build();
    }

    @Test
    @DisplayName("Singletons keep block order and a group sits where its first member appeared")
    void preservesBlockOrder() {
        List<ExecutionUnit> units = partitioner.partition(List.of(
                instruction("S1", null, 0),
                instruction("G1-b", "G1", 2),
                instruction("S2", null, 0),
                instruction("G1-a", "G1", 1),
                instruction("S3", null, 0)));

        assertThat(units).extracting(ExecutionUnit::label).containsExactly("S1", "G1", "S2", "S3");
        ExecutionUnit.Group group = (ExecutionUnit.Group) units.get(1);
        assertThat(group.group().getInstructions())
                .extracting(Instruction::getId)
                .containsExactly("G1-a", "G1-b");
    }

    @Test
    @DisplayName("Blank group id is treated as a singleton")
    void blankGroupIsSingleton() {
        List<ExecutionUnit> units = partitioner.partition(List.of(instruction("S1", " ", 0)));

        assertThat(units).singleElement().isInstanceOf(ExecutionUnit.Single.class);
    }

    @Test
    @DisplayName("Separate groups stay separate")
    void separateGroups() {
        List<ExecutionUnit> units = partitioner.partition(List.of(
                instruction("A1", "A", 1), instruction("B1", "B", 1), instruction("A2", "A", 2)));

        assertThat(units).extracting(ExecutionUnit::label).containsExactly("A", "B");
        assertThat(((ExecutionUnit.Group) units.get(0)).group().getInstructions()).hasSize(2);
    }

    @Test
    @DisplayName("Empty block yields no units")
    void emptyBlock() {
        assertThat(partitioner.partition(List.of())).isEmpty();
    }
}
