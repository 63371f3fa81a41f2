package vns;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;

@AutoValue
public abstract class Color {
  private static final CharMatcher HEX_DIGITS =
      CharMatcher.inRange('0', '9')
          .or(CharMatcher.inRange('a', 'f'))
          .or(CharMatcher.inRange('A', 'F'));

  // Marks "no border" on a character.
  public static final Color TRANSPARENT = of(0, 0, 0, 0);

  public static final Color BLACK = of(0, 0, 0);

  public abstract int red();

  public abstract int green();

  public abstract int blue();

  public abstract int alpha();

  public final boolean isTransparent() {
    return equals(TRANSPARENT);
  }

  public static Color of(int red, int green, int blue) {
    return of(red, green, blue, 255);
  }

  public static Color of(int red, int green, int blue, int alpha) {
    checkChannel(red, "red");
    checkChannel(green, "green");
    checkChannel(blue, "blue");
    checkChannel(alpha, "alpha");
    return new AutoValue_Color(red, green, blue, alpha);
  }

  private static void checkChannel(int value, String channel) {
    Preconditions.checkArgument(
        value >= 0 && value <= 255, "%s channel out of range: %s", channel, value);
  }

  // Accepts "#rgb", "#rrggbb" and "#rrggbbaa".
  public static Color parse(String hex) {
    Preconditions.checkArgument(hex.startsWith("#"), "color must start with '#': %s", hex);
    String digits = hex.substring(1);
    Preconditions.checkArgument(HEX_DIGITS.matchesAllOf(digits), "bad hex color: %s", hex);

    switch (digits.length()) {
      case 3:
        return of(
            nibble(digits.charAt(0)) * 17,
            nibble(digits.charAt(1)) * 17,
            nibble(digits.charAt(2)) * 17);
      case 6:
        return of(channel(digits, 0), channel(digits, 2), channel(digits, 4));
      case 8:
        return of(channel(digits, 0), channel(digits, 2), channel(digits, 4), channel(digits, 6));
      default:
        throw new IllegalArgumentException("bad hex color length: " + hex);
    }
  }

  private static int nibble(char ch) {
    return Character.digit(ch, 16);
  }

  private static int channel(String digits, int offset) {
    return nibble(digits.charAt(offset)) * 16 + nibble(digits.charAt(offset + 1));
  }

  public final String format() {
    if (alpha() == 255) {
      return String.format("#%02x%02x%02x", red(), green(), blue());
    }
    return String.format("#%02x%02x%02x%02x", red(), green(), blue(), alpha());
  }

  @Override
  public final String toString() {
    return format();
  }
}
