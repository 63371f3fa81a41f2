package vns;

import com.google.auto.value.AutoValue;

// A handle to an image asset.  The size is what the asset declares; the renderer may measure it
// differently, see ImageMetadataProvider.
@AutoValue
public abstract class Image {
  public abstract String path();

  public abstract ImageSize declaredSize();

  public static Image of(String path, int width, int height) {
    return new AutoValue_Image(path, ImageSize.of(width, height));
  }
}
