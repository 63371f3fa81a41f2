package vns;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ImmutableSet;

// Every opcode a script can name must have a processor, or the first scene that uses it would
// fail halfway through being built.
public final class CompletenessCheck {
  private static final Logger log = LogManager.getLogger(CompletenessCheck.class);

  public static void verify(ProcessorTable table) throws MissingProcessorException {
    ImmutableSet<Opcode> missing = table.missingOpcodes();
    if (!missing.isEmpty()) {
      throw new MissingProcessorException(missing);
    }
  }

  // Returns true if the check ran.
  public static boolean runAtStartup(Settings settings, ProcessorTable table)
      throws MissingProcessorException {
    if (!settings.debugMode()) {
      log.debug("Debug mode is off; skipping the processor completeness check");
      return false;
    }

    try {
      verify(table);
    } catch (MissingProcessorException ex) {
      log.error("Processor table is incomplete: {}", ex.getMessage());
      throw ex;
    }
    log.info("Processor table covers all {} opcodes", Opcode.values().length);
    return true;
  }

  private CompletenessCheck() {}
}
