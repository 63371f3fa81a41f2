package vns;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

public final class ProcessorTable {
  private final ImmutableMap<Opcode, Processor> processors;

  private ProcessorTable(Map<Opcode, Processor> processors) {
    this.processors = ImmutableMap.copyOf(processors);
  }

  public Optional<Processor> get(Opcode opcode) {
    return Optional.ofNullable(processors.get(opcode));
  }

  public ImmutableSet<Opcode> registeredOpcodes() {
    return processors.keySet();
  }

  public ImmutableSet<Opcode> missingOpcodes() {
    return Sets.difference(EnumSet.allOf(Opcode.class), processors.keySet()).immutableCopy();
  }

  // The processors every story uses.
  public static ProcessorTable standard(Layout layout, ImageMetadataProvider imageMetadata) {
    return builder()
        .register(Opcode.MONOLOGUE, new Processors.Monologue())
        .register(Opcode.SAY, new Processors.Say())
        .register(Opcode.SET_CHARACTER_IMAGE, new Processors.SetCharacterImage())
        .register(Opcode.DRAW_CHARACTER, new Processors.DrawCharacter(layout, imageMetadata))
        .register(Opcode.CHANGE_SCENE, Processors.identity())
        .register(Opcode.NO_OP, Processors.identity())
        .register(Opcode.SET_SCENE_IMAGE, new Processors.SetSceneImage())
        .build();
  }

  public Builder toBuilder() {
    Builder builder = builder();
    builder.processors.putAll(processors);
    return builder;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private final Map<Opcode, Processor> processors = new EnumMap<>(Opcode.class);

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder register(Opcode opcode, Processor processor) {
      Preconditions.checkNotNull(processor);
      Preconditions.checkState(
          processors.putIfAbsent(opcode, processor) == null,
          "duplicate processor for opcode '%s'",
          opcode);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder replace(Opcode opcode, Processor processor) {
      processors.put(opcode, Preconditions.checkNotNull(processor));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder remove(Opcode opcode) {
      processors.remove(opcode);
      return this;
    }

    public ProcessorTable build() {
      return new ProcessorTable(processors);
    }
  }
}
