package vns;

import com.google.auto.value.AutoValue;

// Where draw-character puts a character's current image on screen.
@AutoValue
public abstract class ImagePlacement {
  public abstract Image image();

  public abstract Location location();

  public static ImagePlacement of(Image image, Location location) {
    return new AutoValue_ImagePlacement(image, location);
  }
}
