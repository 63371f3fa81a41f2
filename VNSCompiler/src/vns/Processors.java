package vns;

import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;

// The standard processor for each opcode.  See ProcessorTable.standard().
final class Processors {
  private static final Processor IDENTITY =
      (instruction, rewriter) -> ProcessResult.single(instruction);

  static Processor identity() {
    return IDENTITY;
  }

  // Splits a monologue into one 'say' per line, keeping the author's order.  The result is
  // flattened: each line is its own beat.
  static final class Monologue implements Processor {
    @Override
    public ProcessResult process(Instruction instruction, InstructionRewriter rewriter)
        throws InstructionException {
      Arguments arguments = instruction.requireArguments();
      List<String> lines = arguments.require(Arguments.LINES);
      StoryCharacter character = arguments.require(Arguments.CHARACTER);

      ImmutableList.Builder<ProcessResult> results = ImmutableList.builder();
      for (String line : lines) {
        Instruction say =
            Instruction.create(
                Opcode.SAY, Arguments.of(Arguments.CONTENT, line, Arguments.CHARACTER, character));
        results.add(rewriter.process(say));
      }
      return ProcessResult.flattened(results.build());
    }
  }

  // A character with a current image is drawn before speaking, in the same beat.
  static final class Say implements Processor {
    @Override
    public ProcessResult process(Instruction instruction, InstructionRewriter rewriter)
        throws InstructionException {
      Optional<StoryCharacter> character = instruction.argument(Arguments.CHARACTER);
      // Checked again under the character's monitor by DrawCharacter; single-threaded use only.
      if (!character.isPresent() || !character.get().currentImage().isPresent()) {
        return ProcessResult.single(instruction);
      }

      Instruction draw =
          Instruction.create(
              Opcode.DRAW_CHARACTER, Arguments.of(Arguments.CHARACTER, character.get()));
      return ProcessResult.combined(
          ImmutableList.of(rewriter.process(draw), ProcessResult.single(instruction)));
    }
  }

  /**
   * Computes where the character's current image goes.  The image sits {@link Layout#margin()}
   * above the bottom of the scene height and is anchored horizontally by position.
   *
   * <p>An explicit {@code position} argument moves the character for good; without one the
   * character's own position is used and left alone.
   */
  static final class DrawCharacter implements Processor {
    private final Layout layout;
    private final ImageMetadataProvider imageMetadata;

    DrawCharacter(Layout layout, ImageMetadataProvider imageMetadata) {
      this.layout = Preconditions.checkNotNull(layout);
      this.imageMetadata = Preconditions.checkNotNull(imageMetadata);
    }

    @Override
    public ProcessResult process(Instruction instruction, InstructionRewriter rewriter) {
      Arguments arguments = instruction.requireArguments();
      StoryCharacter character = arguments.require(Arguments.CHARACTER);
      Optional<Position> explicitPosition = arguments.get(Arguments.POSITION);

      Image image;
      Position position;
      ImageSize size;
      synchronized (character) {
        Optional<Image> current = character.currentImage();
        Preconditions.checkState(
            current.isPresent(), "%s has no current image to draw", character.name());
        image = current.get();
        position = explicitPosition.orElse(character.position());

        // The character only moves once the draw is certain to succeed.
        size =
            Verify.verifyNotNull(
                imageMetadata.sizeOf(image), "no size for %s", image.path());
        if (explicitPosition.isPresent()) {
          character.setPosition(position);
        }
      }

      int y = layout.sceneHeight() - size.height() - layout.margin();
      arguments.put(Arguments.IMAGE, ImagePlacement.of(image, Location.of(x(position, size), y)));

      if (!character.borderColor().isTransparent()) {
        arguments.put(
            Arguments.BORDER, Border.of(character.borderColor(), character.borderWidth()));
      }
      return ProcessResult.single(instruction);
    }

    private int x(Position position, ImageSize size) {
      switch (position) {
        case CENTER:
          return layout.screenCenterX() - size.width() / 2;
        case RIGHT:
          return layout.sceneRight() - size.width();
        case LEFT:
          return layout.sceneX();
        default:
          throw new AssertionError(position);
      }
    }
  }

  static final class SetCharacterImage implements Processor {
    @Override
    public ProcessResult process(Instruction instruction, InstructionRewriter rewriter) {
      Arguments arguments = instruction.requireArguments();
      arguments.put(Arguments.TARGET, Target.character(arguments.require(Arguments.CHARACTER)));
      return ProcessResult.single(instruction);
    }
  }

  // The owning scene doesn't exist yet; Scene.Builder replaces the placeholder after building.
  static final class SetSceneImage implements Processor {
    @Override
    public ProcessResult process(Instruction instruction, InstructionRewriter rewriter) {
      instruction.requireArguments().put(Arguments.TARGET, Target.pendingScene());
      return ProcessResult.single(instruction);
    }
  }

  private Processors() {}
}
