package vns;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;

/**
 * What a {@link Processor} produces for one instruction.
 *
 * <ul>
 *   <li>{@link Single}: one instruction, executed as one beat.
 *   <li>{@link Group} with {@code flatten() == true}: the members stand in for the original
 *       instruction as if each had been written at top level, one after the other.
 *   <li>{@link Group} with {@code flatten() == false}: a combined unit; all members are executed
 *       together as one beat.
 * </ul>
 *
 * Consumers must keep the two kinds of group apart.
 */
public abstract class ProcessResult {
  public enum Kind {
    SINGLE,
    GROUP;
  }

  private ProcessResult() {}

  public abstract Kind kind();

  // Every instruction in this result, depth-first, in execution order.
  public abstract ImmutableList<Instruction> instructions();

  public final Single asSingle() {
    if (kind() != Kind.SINGLE) throw new IllegalStateException("not a single result: " + this);
    return (Single) this;
  }

  public final Group asGroup() {
    if (kind() != Kind.GROUP) throw new IllegalStateException("not a group result: " + this);
    return (Group) this;
  }

  public static ProcessResult single(Instruction instruction) {
    return new AutoValue_ProcessResult_Single(instruction);
  }

  public static ProcessResult flattened(List<ProcessResult> members) {
    return new AutoValue_ProcessResult_Group(ImmutableList.copyOf(members), true);
  }

  public static ProcessResult combined(List<ProcessResult> members) {
    return new AutoValue_ProcessResult_Group(ImmutableList.copyOf(members), false);
  }

  @AutoValue
  public abstract static class Single extends ProcessResult {
    public abstract Instruction instruction();

    @Override
    public final Kind kind() {
      return Kind.SINGLE;
    }

    @Override
    public final ImmutableList<Instruction> instructions() {
      return ImmutableList.of(instruction());
    }
  }

  @AutoValue
  public abstract static class Group extends ProcessResult {
    public abstract ImmutableList<ProcessResult> members();

    public abstract boolean flatten();

    @Override
    public final Kind kind() {
      return Kind.GROUP;
    }

    @Memoized
    @Override
    public ImmutableList<Instruction> instructions() {
      return members()
          .stream()
          .flatMap(m -> m.instructions().stream())
          .collect(ImmutableList.toImmutableList());
    }
  }
}
