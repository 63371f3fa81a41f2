package vns;

// Horizontal anchor of a character image, relative to the dialog box.
public enum Position {
  LEFT,
  CENTER,
  RIGHT;
}
