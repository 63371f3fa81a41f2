package vns;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * The named arguments of an {@link Instruction}.
 *
 * <p>Processors read and write arguments in place; a processed instruction carries whatever its
 * processor attached (an image placement, a border, a target) alongside what the author wrote.
 * Well-known arguments are read through typed {@link Key}s, which check the stored value's class.
 */
public final class Arguments {
  public static final class Key<T> {
    private final String name;
    private final Class<?> type;

    private Key(String name, Class<?> type) {
      this.name = name;
      this.type = type;
    }

    public String name() {
      return name;
    }

    private static <T> Key<T> of(String name, Class<T> type) {
      return new Key<>(name, type);
    }

    private static <E> Key<List<E>> listOf(String name) {
      return new Key<>(name, List.class);
    }

    @SuppressWarnings("unchecked")
    private T cast(Object value) {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException(
            String.format(
                "argument '%s' should be a %s, not %s",
                name, type.getSimpleName(), value.getClass().getSimpleName()));
      }
      return (T) value;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  // A single line of dialogue.
  public static final Key<String> CONTENT = Key.of("content", String.class);

  // The lines of a monologue.  Shares its name with CONTENT; the opcode decides which applies.
  public static final Key<List<String>> LINES = Key.listOf("content");

  public static final Key<StoryCharacter> CHARACTER = Key.of("character", StoryCharacter.class);
  public static final Key<Position> POSITION = Key.of("position", Position.class);
  public static final Key<ImagePlacement> IMAGE = Key.of("image", ImagePlacement.class);
  public static final Key<Border> BORDER = Key.of("border", Border.class);
  public static final Key<Target> TARGET = Key.of("target", Target.class);
  public static final Key<String> IMAGE_NAME = Key.of("image-name", String.class);
  public static final Key<String> SCENE = Key.of("scene", String.class);

  private final Map<String, Object> values = new LinkedHashMap<>();

  private Arguments() {}

  public static Arguments create() {
    return new Arguments();
  }

  public static <T> Arguments of(Key<T> key, T value) {
    return create().put(key, value);
  }

  public static <A, B> Arguments of(Key<A> key1, A value1, Key<B> key2, B value2) {
    return create().put(key1, value1).put(key2, value2);
  }

  @CanIgnoreReturnValue
  public <T> Arguments put(Key<T> key, T value) {
    values.put(key.name(), key.cast(Preconditions.checkNotNull(value, key.name())));
    return this;
  }

  @CanIgnoreReturnValue
  public Arguments put(String name, Object value) {
    values.put(name, Preconditions.checkNotNull(value, name));
    return this;
  }

  public <T> Optional<T> get(Key<T> key) {
    Object value = values.get(key.name());
    return value == null ? Optional.empty() : Optional.of(key.cast(value));
  }

  public Optional<Object> get(String name) {
    return Optional.ofNullable(values.get(name));
  }

  public <T> T require(Key<T> key) {
    Object value = values.get(key.name());
    Preconditions.checkArgument(value != null, "missing required argument '%s'", key.name());
    return key.cast(value);
  }

  public boolean has(Key<?> key) {
    return values.containsKey(key.name());
  }

  @CanIgnoreReturnValue
  public Optional<Object> remove(Key<?> key) {
    return Optional.ofNullable(values.remove(key.name()));
  }

  public ImmutableSet<String> names() {
    return ImmutableSet.copyOf(values.keySet());
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  @Override
  public String toString() {
    return values
        .entrySet()
        .stream()
        .map(e -> String.format("%s: %s", e.getKey(), e.getValue()))
        .collect(Collectors.joining(", ", "{", "}"));
  }
}
