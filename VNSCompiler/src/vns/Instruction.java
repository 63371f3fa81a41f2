package vns;

import java.util.Optional;

import com.google.common.base.Preconditions;

/**
 * One unit of a scene's script.
 *
 * <p>The opcode is fixed at construction; the arguments (when present) belong to whichever
 * processor is currently handling the instruction and may be extended in place.  Instructions
 * compare by identity: a processor that returns its input unchanged returns the same object.
 */
public final class Instruction {
  private final Opcode opcode;
  private final Arguments arguments;

  private Instruction(Opcode opcode, Arguments arguments) {
    this.opcode = Preconditions.checkNotNull(opcode);
    this.arguments = arguments;
  }

  public static Instruction create(String opcodeName, Arguments arguments)
      throws InvalidOpcodeException {
    return new Instruction(Opcode.forName(opcodeName), arguments);
  }

  public static Instruction create(Opcode opcode, Arguments arguments) {
    return new Instruction(opcode, Preconditions.checkNotNull(arguments));
  }

  public static Instruction of(Opcode opcode) {
    return new Instruction(opcode, null);
  }

  public Opcode opcode() {
    return opcode;
  }

  public Optional<Arguments> arguments() {
    return Optional.ofNullable(arguments);
  }

  public Arguments requireArguments() {
    Preconditions.checkArgument(arguments != null, "'%s' requires arguments", opcode);
    return arguments;
  }

  public <T> Optional<T> argument(Arguments.Key<T> key) {
    return arguments == null ? Optional.empty() : arguments.get(key);
  }

  public boolean is(Opcode opcode) {
    return this.opcode == opcode;
  }

  @Override
  public String toString() {
    if (arguments == null || arguments.isEmpty()) {
      return String.format("Opcode \"%s\" = {}", opcode);
    }
    return String.format("Opcode \"%s\" = %s", opcode, arguments);
  }
}
