package vns;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * A named sequence of beats, built by lowering the author's instructions.
 *
 * <p>Scenes compare by identity.
 */
public final class Scene {
  private static final Logger log = LogManager.getLogger(Scene.class);

  private final String name;
  private ImmutableList<Beat> beats = null;
  private int beatIndex = 0;

  private Scene(String name) {
    this.name = name;
  }

  public String name() {
    return name;
  }

  public ImmutableList<Beat> beats() {
    return beats;
  }

  public Optional<Beat> currentBeat() {
    return beatIndex < beats.size() ? Optional.of(beats.get(beatIndex)) : Optional.empty();
  }

  public int beatIndex() {
    return beatIndex;
  }

  public boolean hasNext() {
    return beatIndex + 1 < beats.size();
  }

  // Returns false at the last beat.
  public boolean moveForward() {
    if (!hasNext()) return false;
    beatIndex++;
    return true;
  }

  // Returns false at the first beat.
  public boolean moveBack() {
    if (beatIndex == 0) return false;
    beatIndex--;
    return true;
  }

  public void rewind() {
    beatIndex = 0;
  }

  @Override
  public String toString() {
    return String.format("Scene %s (%d beats)", name, beats == null ? 0 : beats.size());
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public static final class Builder {
    private final String name;
    private final List<Instruction> instructions = new ArrayList<>();

    private Builder(String name) {
      this.name = Preconditions.checkNotNull(name);
    }

    @CanIgnoreReturnValue
    public Builder add(Instruction instruction) {
      instructions.add(Preconditions.checkNotNull(instruction));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addAll(Iterable<Instruction> instructions) {
      instructions.forEach(this::add);
      return this;
    }

    public Scene build(InstructionRewriter rewriter) throws InstructionException {
      ImmutableList.Builder<Beat> beats = ImmutableList.builder();
      for (Instruction instruction : instructions) {
        appendBeats(rewriter.process(instruction), beats);
      }

      Scene scene = new Scene(name);
      scene.beats = beats.build();
      int bound = bindPendingTargets(scene);
      log.debug(
          "Built {} from {} instructions, bound {} scene targets",
          scene,
          instructions.size(),
          bound);
      return scene;
    }

    private static void appendBeats(ProcessResult result, ImmutableList.Builder<Beat> beats) {
      switch (result.kind()) {
        case SINGLE:
          beats.add(Beat.of(result.asSingle().instruction()));
          break;
        case GROUP:
          ProcessResult.Group group = result.asGroup();
          if (group.flatten()) {
            for (ProcessResult member : group.members()) {
              appendBeats(member, beats);
            }
          } else {
            beats.add(Beat.of(group.instructions()));
          }
          break;
        default:
          throw new AssertionError(result.kind());
      }
    }

    // Points every placeholder scene target at the scene that now exists.
    private static int bindPendingTargets(Scene scene) {
      int bound = 0;
      Target target = Target.scene(scene);
      for (Beat beat : scene.beats) {
        for (Instruction instruction : beat.instructions()) {
          Optional<Target> current = instruction.argument(Arguments.TARGET);
          if (current.isPresent() && current.get().isPendingScene()) {
            instruction.requireArguments().put(Arguments.TARGET, target);
            bound++;
          }
        }
      }
      return bound;
    }
  }
}
