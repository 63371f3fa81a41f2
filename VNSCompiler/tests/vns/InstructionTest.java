package vns;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class InstructionTest {

  @Test
  public void everyOpcodeNameCreatesAnInstruction() throws InstructionException {
    for (Opcode opcode : Opcode.values()) {
      Instruction instruction = Instruction.create(opcode.opcodeName(), null);
      assertThat(instruction.opcode()).isEqualTo(opcode);
      assertThat(instruction.arguments()).isEmpty();
    }
  }

  @Test
  public void unknownOpcodeName() {
    InvalidOpcodeException ex =
        assertThrows(
            InvalidOpcodeException.class,
            () -> Instruction.create("dance", Arguments.of(Arguments.CONTENT, "la la")));
    assertThat(ex.opcodeName()).isEqualTo("dance");
    assertThat(ex).hasMessageThat().contains("Unknown opcode 'dance'");

    assertThrows(InvalidOpcodeException.class, () -> Instruction.create("SAY", null));
    assertThrows(InvalidOpcodeException.class, () -> Instruction.create("", null));
  }

  @Test
  public void opcodeLookup() {
    assertThat(Opcode.lookup("set-scene-image")).hasValue(Opcode.SET_SCENE_IMAGE);
    assertThat(Opcode.lookup("no_op")).isEmpty();
  }

  @Test
  public void keepsArgumentsByReference() throws InstructionException {
    Arguments arguments = Arguments.of(Arguments.CONTENT, "hello");
    Instruction instruction = Instruction.create("say", arguments);

    assertThat(instruction.arguments()).hasValue(arguments);
    arguments.put(Arguments.POSITION, Position.LEFT);
    assertThat(instruction.argument(Arguments.POSITION)).hasValue(Position.LEFT);
  }

  @Test
  public void requireArguments() {
    Instruction noOp = Instruction.of(Opcode.NO_OP);
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, noOp::requireArguments);
    assertThat(ex).hasMessageThat().contains("'no-op' requires arguments");
  }

  @Test
  public void debugString() {
    assertThat(Instruction.of(Opcode.NO_OP).toString()).isEqualTo("Opcode \"no-op\" = {}");
    assertThat(
            Instruction.create(
                    Opcode.SAY,
                    Arguments.of(Arguments.CONTENT, "hi", Arguments.POSITION, Position.RIGHT))
                .toString())
        .isEqualTo("Opcode \"say\" = {content: hi, position: RIGHT}");
  }
}
