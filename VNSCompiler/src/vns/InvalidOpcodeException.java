package vns;

public class InvalidOpcodeException extends InstructionException {
  private static final long serialVersionUID = 1L;

  private final String opcodeName;

  public InvalidOpcodeException(String opcodeName) {
    super(String.format("Unknown opcode '%s'", opcodeName));
    this.opcodeName = opcodeName;
  }

  public String opcodeName() {
    return opcodeName;
  }
}
