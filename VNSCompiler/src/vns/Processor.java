package vns;

/**
 * Lowers one instruction.  A processor that builds new instructions is responsible for running
 * them through {@code rewriter} itself before returning; the rewriter never recurses into a
 * result on its own.
 */
@FunctionalInterface
public interface Processor {
  ProcessResult process(Instruction instruction, InstructionRewriter rewriter)
      throws InstructionException;
}
