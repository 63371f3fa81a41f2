package vns;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

// The closed set of instructions a scene may contain.  Adding a constant here requires a matching
// processor in ProcessorTable.standard(), which CompletenessCheck enforces.
public enum Opcode {
  MONOLOGUE("monologue"),
  SAY("say"),
  SET_CHARACTER_IMAGE("set-character-image"),
  DRAW_CHARACTER("draw-character"),
  CHANGE_SCENE("change-scene"),
  NO_OP("no-op"),
  SET_SCENE_IMAGE("set-scene-image");

  private final String opcodeName;

  Opcode(String opcodeName) {
    this.opcodeName = opcodeName;
  }

  public String opcodeName() {
    return opcodeName;
  }

  private static final ImmutableMap<String, Opcode> OPCODE_MAP =
      Arrays.asList(values())
          .stream()
          .collect(ImmutableMap.toImmutableMap(Opcode::opcodeName, o -> o));

  public static Optional<Opcode> lookup(String opcodeName) {
    return Optional.ofNullable(OPCODE_MAP.get(opcodeName));
  }

  public static Opcode forName(String opcodeName) throws InvalidOpcodeException {
    Opcode opcode = OPCODE_MAP.get(opcodeName);
    if (opcode == null) {
      throw new InvalidOpcodeException(opcodeName);
    }
    return opcode;
  }

  @Override
  public String toString() {
    return opcodeName;
  }
}
