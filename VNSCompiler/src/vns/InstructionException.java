package vns;

public class InstructionException extends Exception {
  private static final long serialVersionUID = 1L;

  public InstructionException(String errorMsg) {
    super(errorMsg);
  }
}
