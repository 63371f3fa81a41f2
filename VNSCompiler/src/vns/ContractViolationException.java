package vns;

public class ContractViolationException extends InstructionException {
  private static final long serialVersionUID = 1L;

  private final Opcode opcode;

  public ContractViolationException(Opcode opcode, String errorMsg) {
    super(String.format("%s: %s", opcode.opcodeName(), errorMsg));
    this.opcode = opcode;
  }

  public Opcode opcode() {
    return opcode;
  }
}
