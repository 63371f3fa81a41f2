package vns;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class InstructionRewriterTest {

  private static final Image ERIC_SMILING = Image.of("images/eric-smiling.png", 120, 200);

  private InstructionRewriter rewriter;

  @BeforeEach
  public void setUp() throws MissingProcessorException {
    rewriter =
        InstructionRewriter.standard(
            Settings.builder().setDebugMode(true).build(), ImageMetadataProvider.declared());
  }

  private static StoryCharacter withoutImage() {
    return StoryCharacter.builder("Jeff").build();
  }

  private static StoryCharacter withImage() {
    return StoryCharacter.builder("Eric")
        .addImage("smiling", ERIC_SMILING)
        .setCurrentImage("smiling")
        .build();
  }

  private static Instruction say(String content, StoryCharacter character) {
    return Instruction.create(
        Opcode.SAY, Arguments.of(Arguments.CONTENT, content, Arguments.CHARACTER, character));
  }

  private static Instruction monologue(StoryCharacter character, String... lines) {
    return Instruction.create(
        Opcode.MONOLOGUE,
        Arguments.of(
            Arguments.LINES, ImmutableList.copyOf(lines), Arguments.CHARACTER, character));
  }

  @Test
  public void identityOpcodes() throws InstructionException {
    for (Opcode opcode : ImmutableList.of(Opcode.NO_OP, Opcode.CHANGE_SCENE)) {
      Instruction instruction = Instruction.of(opcode);
      ProcessResult result = rewriter.process(instruction);

      assertThat(result.kind()).isEqualTo(ProcessResult.Kind.SINGLE);
      assertThat(result.asSingle().instruction()).isSameInstanceAs(instruction);
      assertThat(instruction.arguments()).isEmpty();
    }
  }

  @Test
  public void monologueWithoutImageFlattensIntoSays() throws InstructionException {
    StoryCharacter jeff = withoutImage();

    ProcessResult result = rewriter.process(monologue(jeff, "a", "b", "c"));

    ProcessResult.Group group = result.asGroup();
    assertThat(group.flatten()).isTrue();
    assertThat(group.members()).hasSize(3);

    ImmutableList.Builder<String> contents = ImmutableList.builder();
    for (ProcessResult member : group.members()) {
      Instruction say = member.asSingle().instruction();
      assertThat(say.opcode()).isEqualTo(Opcode.SAY);
      assertThat(say.argument(Arguments.CHARACTER)).hasValue(jeff);
      contents.add(say.argument(Arguments.CONTENT).get());
    }
    assertThat(contents.build()).containsExactly("a", "b", "c").inOrder();
  }

  @Test
  public void emptyMonologue() throws InstructionException {
    ProcessResult result = rewriter.process(monologue(withoutImage()));
    assertThat(result.asGroup().flatten()).isTrue();
    assertThat(result.asGroup().members()).isEmpty();
  }

  @Test
  public void sayWithImageDrawsFirst() throws InstructionException {
    StoryCharacter eric = withImage();
    Instruction say = say("hi", eric);

    ProcessResult.Group group = rewriter.process(say).asGroup();

    assertThat(group.flatten()).isFalse();
    assertThat(group.members()).hasSize(2);

    Instruction draw = group.members().get(0).asSingle().instruction();
    assertThat(draw.opcode()).isEqualTo(Opcode.DRAW_CHARACTER);
    assertThat(draw.argument(Arguments.CHARACTER)).hasValue(eric);
    assertThat(draw.argument(Arguments.IMAGE).get().image()).isEqualTo(ERIC_SMILING);

    assertThat(group.members().get(1).asSingle().instruction()).isSameInstanceAs(say);
    assertThat(group.instructions()).containsExactly(draw, say).inOrder();
  }

  @Test
  public void sayWithoutImageIsUnchanged() throws InstructionException {
    Instruction say = say("hi", withoutImage());

    ProcessResult result = rewriter.process(say);

    assertThat(result.asSingle().instruction()).isSameInstanceAs(say);
    assertThat(say.requireArguments().names()).containsExactly("content", "character");
  }

  @Test
  public void narrationWithoutCharacterIsUnchanged() throws InstructionException {
    Instruction narration = Instruction.create(Opcode.SAY, Arguments.of(Arguments.CONTENT, "..."));
    assertThat(rewriter.process(narration).asSingle().instruction()).isSameInstanceAs(narration);
  }

  @Test
  public void characterWithDanglingImageKeyIsNotDrawn() throws InstructionException {
    StoryCharacter eric = withImage();
    eric.clearCurrentImage();

    assertThat(rewriter.process(say("hi", eric)).kind()).isEqualTo(ProcessResult.Kind.SINGLE);
  }

  @Test
  public void monologueWithImageNestsTwoDeep() throws InstructionException {
    ProcessResult.Group group = rewriter.process(monologue(withImage(), "one", "two")).asGroup();

    assertThat(group.flatten()).isTrue();
    assertThat(group.members()).hasSize(2);
    for (ProcessResult member : group.members()) {
      assertThat(member.asGroup().flatten()).isFalse();
      assertThat(
              member.instructions().stream()
                  .map(Instruction::opcode)
                  .collect(ImmutableList.toImmutableList()))
          .containsExactly(Opcode.DRAW_CHARACTER, Opcode.SAY)
          .inOrder();
    }
    assertThat(rewriter.deepestNesting()).isEqualTo(2);
  }

  @Test
  public void setCharacterImageTargetsTheCharacter() throws InstructionException {
    StoryCharacter eric = withImage();
    Instruction instruction =
        Instruction.create(
            Opcode.SET_CHARACTER_IMAGE,
            Arguments.of(Arguments.CHARACTER, eric, Arguments.IMAGE_NAME, "smiling"));

    ProcessResult result = rewriter.process(instruction);

    assertThat(result.asSingle().instruction()).isSameInstanceAs(instruction);
    Target target = instruction.argument(Arguments.TARGET).get();
    assertThat(target.kind()).isEqualTo(Target.Kind.CHARACTER);
    assertThat(target.character()).isSameInstanceAs(eric);
  }

  @Test
  public void setSceneImageTargetsPendingScene() throws InstructionException {
    Instruction instruction =
        Instruction.create(
            Opcode.SET_SCENE_IMAGE, Arguments.of(Arguments.IMAGE_NAME, "backgrounds/jail.png"));

    ProcessResult result = rewriter.process(instruction);

    assertThat(result.asSingle().instruction()).isSameInstanceAs(instruction);
    Target target = instruction.argument(Arguments.TARGET).get();
    assertThat(target.kind()).isEqualTo(Target.Kind.PENDING_SCENE);
    assertThat(target.isPendingScene()).isTrue();

    Scene someScene = Scene.builder("ANY").build(rewriter);
    assertThat(target).isNotEqualTo(Target.scene(someScene));
    assertThrows(IllegalStateException.class, target::scene);
  }

  @Test
  public void nullResultIsAContractViolation() throws MissingProcessorException {
    ProcessorTable table =
        ProcessorTable.standard(Layout.defaults(), ImageMetadataProvider.declared())
            .toBuilder()
            .replace(Opcode.NO_OP, (instruction, rewriter) -> null)
            .build();
    InstructionRewriter broken = InstructionRewriter.create(Settings.defaults(), table);

    ContractViolationException ex =
        assertThrows(
            ContractViolationException.class, () -> broken.process(Instruction.of(Opcode.NO_OP)));
    assertThat(ex.opcode()).isEqualTo(Opcode.NO_OP);
    assertThat(ex).hasMessageThat().contains("processor returned no result");
  }

  @Test
  public void cyclicProcessorsHitTheDepthLimit() throws MissingProcessorException {
    ProcessorTable table =
        ProcessorTable.standard(Layout.defaults(), ImageMetadataProvider.declared())
            .toBuilder()
            .replace(
                Opcode.NO_OP,
                (instruction, rewriter) -> rewriter.process(Instruction.of(Opcode.NO_OP)))
            .build();
    InstructionRewriter cyclic =
        InstructionRewriter.create(Settings.builder().setMaxRewriteDepth(3).build(), table);

    ContractViolationException ex =
        assertThrows(
            ContractViolationException.class, () -> cyclic.process(Instruction.of(Opcode.NO_OP)));
    assertThat(ex).hasMessageThat().contains("nested more than 3 deep");
    assertThat(cyclic.deepestNesting()).isEqualTo(3);
  }

  @Test
  public void missingProcessorAtDispatch() throws MissingProcessorException {
    ProcessorTable table =
        ProcessorTable.standard(Layout.defaults(), ImageMetadataProvider.declared())
            .toBuilder()
            .remove(Opcode.CHANGE_SCENE)
            .build();
    // Debug mode off: the startup check is skipped, so the gap shows up at dispatch.
    InstructionRewriter lenient = InstructionRewriter.create(Settings.defaults(), table);

    MissingProcessorException ex =
        assertThrows(
            MissingProcessorException.class,
            () -> lenient.process(Instruction.of(Opcode.CHANGE_SCENE)));
    assertThat(ex.missing()).containsExactly(Opcode.CHANGE_SCENE);
  }
}
