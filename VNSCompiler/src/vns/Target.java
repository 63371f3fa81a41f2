package vns;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

// What a set-*-image instruction changes the image of.  Scene targets start out PENDING_SCENE
// because the instruction is produced while its scene is still being built; Scene.Builder binds
// them once the scene exists.
public abstract class Target {
  public enum Kind {
    CHARACTER,
    PENDING_SCENE,
    BOUND_SCENE;
  }

  private Target() {}

  public abstract Kind kind();

  public final boolean isPendingScene() {
    return kind() == Kind.PENDING_SCENE;
  }

  public StoryCharacter character() {
    throw new IllegalStateException("not a character target: " + kind());
  }

  public Scene scene() {
    throw new IllegalStateException("not a bound scene target: " + kind());
  }

  public static Target character(StoryCharacter character) {
    return new AutoValue_Target_CharacterTarget(Preconditions.checkNotNull(character));
  }

  public static Target pendingScene() {
    return PendingScene.INSTANCE;
  }

  public static Target scene(Scene scene) {
    return new AutoValue_Target_BoundScene(Preconditions.checkNotNull(scene));
  }

  @AutoValue
  abstract static class CharacterTarget extends Target {
    abstract StoryCharacter boundCharacter();

    @Override
    public final Kind kind() {
      return Kind.CHARACTER;
    }

    @Override
    public final StoryCharacter character() {
      return boundCharacter();
    }
  }

  @AutoValue
  abstract static class BoundScene extends Target {
    abstract Scene boundScene();

    @Override
    public final Kind kind() {
      return Kind.BOUND_SCENE;
    }

    @Override
    public final Scene scene() {
      return boundScene();
    }
  }

  private static final class PendingScene extends Target {
    private static final PendingScene INSTANCE = new PendingScene();

    @Override
    public Kind kind() {
      return Kind.PENDING_SCENE;
    }

    @Override
    public String toString() {
      return "<pending scene>";
    }
  }
}
