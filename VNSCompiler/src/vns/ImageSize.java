package vns;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

@AutoValue
public abstract class ImageSize {
  public abstract int width();

  public abstract int height();

  public static ImageSize of(int width, int height) {
    Preconditions.checkArgument(width >= 0 && height >= 0, "negative size %sx%s", width, height);
    return new AutoValue_ImageSize(width, height);
  }
}
