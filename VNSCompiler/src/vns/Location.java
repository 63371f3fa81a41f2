package vns;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class Location {
  public abstract int x();

  public abstract int y();

  public static Location of(int x, int y) {
    return new AutoValue_Location(x, y);
  }

  @Override
  public final String toString() {
    return String.format("[%d, %d]", x(), y());
  }
}
