package vns;

import com.google.auto.value.AutoValue;

// Fixed screen geometry.  The scene rectangle is the dialog box; characters are anchored to its
// edges or to the screen center.
@AutoValue
public abstract class Layout {
  public static final int DEFAULT_MARGIN = 10;

  private static final Layout DEFAULT =
      builder()
          .setSceneX(100)
          .setSceneY(300)
          .setSceneWidth(600)
          .setSceneHeight(240)
          .setScreenCenterX(400)
          .setMargin(DEFAULT_MARGIN)
          .build();

  public static Layout defaults() {
    return DEFAULT;
  }

  public abstract int sceneX();

  public abstract int sceneY();

  public abstract int sceneWidth();

  public abstract int sceneHeight();

  public abstract int screenCenterX();

  public abstract int margin();

  public final int sceneRight() {
    return sceneX() + sceneWidth();
  }

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_Layout.Builder().setMargin(DEFAULT_MARGIN);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setSceneX(int sceneX);

    public abstract Builder setSceneY(int sceneY);

    public abstract Builder setSceneWidth(int sceneWidth);

    public abstract Builder setSceneHeight(int sceneHeight);

    public abstract Builder setScreenCenterX(int screenCenterX);

    public abstract Builder setMargin(int margin);

    public abstract Layout build();
  }
}
