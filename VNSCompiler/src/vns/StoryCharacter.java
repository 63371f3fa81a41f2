package vns;

import java.util.Optional;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

// Instructions share one instance for the life of the story, so position and image changes made
// by one instruction are seen by every later one. Both are guarded by the instance's monitor.
public final class StoryCharacter {
  private final String name;
  private final ImmutableMap<String, Image> images;
  private final Color textColor;
  private final Color borderColor;
  private final int borderWidth;

  private String currentImageKey;
  private Position position;

  private StoryCharacter(Builder builder) {
    this.name = builder.name;
    this.images = builder.images.build();
    this.textColor = builder.textColor;
    this.borderColor = builder.borderColor;
    this.borderWidth = builder.borderWidth;
    this.currentImageKey = builder.currentImageKey;
    this.position = builder.position;

    if (currentImageKey != null) {
      Preconditions.checkArgument(
          images.containsKey(currentImageKey),
          "%s has no image named '%s'",
          name,
          currentImageKey);
    }
  }

  public String name() {
    return name;
  }

  public ImmutableMap<String, Image> images() {
    return images;
  }

  public Color textColor() {
    return textColor;
  }

  public Color borderColor() {
    return borderColor;
  }

  public int borderWidth() {
    return borderWidth;
  }

  public synchronized Optional<String> currentImageKey() {
    return Optional.ofNullable(currentImageKey);
  }

  public synchronized Optional<Image> currentImage() {
    return currentImageKey == null
        ? Optional.empty()
        : Optional.ofNullable(images.get(currentImageKey));
  }

  public synchronized void setCurrentImage(String imageKey) {
    Preconditions.checkArgument(
        images.containsKey(imageKey), "%s has no image named '%s'", name, imageKey);
    this.currentImageKey = imageKey;
  }

  public synchronized void clearCurrentImage() {
    this.currentImageKey = null;
  }

  public synchronized Position position() {
    return position;
  }

  public synchronized void setPosition(Position position) {
    this.position = Preconditions.checkNotNull(position);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("position", position())
        .add("image", currentImageKey().orElse(null))
        .omitNullValues()
        .toString();
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public static final class Builder {
    private final String name;
    private final ImmutableMap.Builder<String, Image> images = ImmutableMap.builder();
    private Color textColor = Color.BLACK;
    private Color borderColor = Color.TRANSPARENT;
    private int borderWidth = 0;
    private String currentImageKey = null;
    private Position position = Position.CENTER;

    private Builder(String name) {
      this.name = Preconditions.checkNotNull(name);
    }

    @CanIgnoreReturnValue
    public Builder addImage(String key, Image image) {
      images.put(key, image);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setCurrentImage(String key) {
      this.currentImageKey = key;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setTextColor(Color textColor) {
      this.textColor = Preconditions.checkNotNull(textColor);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setBorder(Color borderColor, int borderWidth) {
      Preconditions.checkArgument(borderWidth >= 0, "negative border width: %s", borderWidth);
      this.borderColor = Preconditions.checkNotNull(borderColor);
      this.borderWidth = borderWidth;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setPosition(Position position) {
      this.position = Preconditions.checkNotNull(position);
      return this;
    }

    public StoryCharacter build() {
      return new StoryCharacter(this);
    }
  }
}
