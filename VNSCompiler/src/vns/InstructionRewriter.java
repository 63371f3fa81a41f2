package vns;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;

/**
 * Dispatches instructions to their processors.
 *
 * <p>{@link #process} performs exactly one dispatch.  Processors that synthesize instructions call
 * back into {@link #process} themselves; the rewriter counts how deeply those calls nest and fails
 * once they pass {@link Settings#maxRewriteDepth()}, which only a cycle between processors should
 * be able to reach.
 *
 * <p>Not thread-safe.
 */
public final class InstructionRewriter {
  private static final Logger log = LogManager.getLogger(InstructionRewriter.class);

  private final ProcessorTable table;
  private final int maxDepth;

  private int depth = 0;
  private int deepestNesting = 0;

  private InstructionRewriter(ProcessorTable table, int maxDepth) {
    this.table = Preconditions.checkNotNull(table);
    this.maxDepth = maxDepth;
  }

  // Runs the startup completeness check (in debug mode) before returning a usable rewriter.
  public static InstructionRewriter create(Settings settings, ProcessorTable table)
      throws MissingProcessorException {
    CompletenessCheck.runAtStartup(settings, table);
    return new InstructionRewriter(table, settings.maxRewriteDepth());
  }

  public static InstructionRewriter standard(Settings settings, ImageMetadataProvider imageMetadata)
      throws MissingProcessorException {
    return create(settings, ProcessorTable.standard(settings.layout(), imageMetadata));
  }

  public ProcessResult process(Instruction instruction) throws InstructionException {
    Opcode opcode = instruction.opcode();
    Processor processor = table.get(opcode).orElse(null);
    if (processor == null) {
      throw new MissingProcessorException(ImmutableSet.of(opcode));
    }

    if (depth > maxDepth) {
      throw new ContractViolationException(
          opcode, String.format("instructions nested more than %d deep", maxDepth));
    }
    deepestNesting = Math.max(deepestNesting, depth);

    ProcessResult result;
    depth++;
    try {
      result = processor.process(instruction, this);
    } finally {
      depth--;
    }

    if (result == null) {
      throw new ContractViolationException(opcode, "processor returned no result");
    }
    if (log.isDebugEnabled()) {
      log.debug("{}{} -> {}", Strings.repeat("  ", depth), opcode, result.kind());
    }
    return result;
  }

  // The deepest nesting of process() calls seen so far; a top-level call is depth 0.
  public int deepestNesting() {
    return deepestNesting;
  }
}
