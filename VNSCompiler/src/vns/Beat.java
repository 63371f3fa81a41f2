package vns;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

// One step of a scene: the instructions executed before the player is asked to advance.
@AutoValue
public abstract class Beat {
  public abstract ImmutableList<Instruction> instructions();

  public final boolean isCombined() {
    return instructions().size() > 1;
  }

  // The instruction that gives this beat its text, if any.
  public final Instruction last() {
    return instructions().get(instructions().size() - 1);
  }

  public static Beat of(Instruction instruction) {
    return new AutoValue_Beat(ImmutableList.of(instruction));
  }

  public static Beat of(List<Instruction> instructions) {
    Preconditions.checkArgument(!instructions.isEmpty(), "a beat needs at least one instruction");
    return new AutoValue_Beat(ImmutableList.copyOf(instructions));
  }
}
