package vns;

import java.util.Set;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableSet;

public class MissingProcessorException extends InstructionException {
  private static final long serialVersionUID = 1L;

  private final ImmutableSet<Opcode> missing;

  public MissingProcessorException(Set<Opcode> missing) {
    super(
        String.format(
            "No processor for opcode(s): %s",
            missing.stream().map(Opcode::opcodeName).collect(Collectors.joining(", "))));
    this.missing = ImmutableSet.copyOf(missing);
  }

  public ImmutableSet<Opcode> missing() {
    return missing;
  }
}
