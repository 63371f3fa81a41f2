package vns;

@FunctionalInterface
public interface ImageMetadataProvider {
  ImageSize sizeOf(Image image);

  static ImageMetadataProvider declared() {
    return Image::declaredSize;
  }
}
