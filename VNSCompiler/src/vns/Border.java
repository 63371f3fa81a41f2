package vns;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

@AutoValue
public abstract class Border {
  public abstract Color color();

  public abstract int width();

  public static Border of(Color color, int width) {
    Preconditions.checkArgument(!color.isTransparent(), "transparent borders are not drawn");
    Preconditions.checkArgument(width >= 0, "negative border width: %s", width);
    return new AutoValue_Border(color, width);
  }

  @Override
  public final String toString() {
    return String.format("%dpx %s", width(), color().format());
  }
}
