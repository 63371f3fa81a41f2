package vns;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;

// The scenes of a story and the player's path through them. START is entered on creation.
public final class Story {
  private static final Logger log = LogManager.getLogger(Story.class);

  public static final String START = "START";

  private final ImmutableMap<String, Scene> scenes;
  private final Set<String> visitedScenes = new LinkedHashSet<>();
  private final List<Scene> sceneHistory = new ArrayList<>();

  private Story(ImmutableMap<String, Scene> scenes) {
    this.scenes = scenes;
  }

  public static Story of(Collection<Scene> scenes) {
    ImmutableMap.Builder<String, Scene> builder = ImmutableMap.builder();
    scenes.forEach(s -> builder.put(s.name(), s));

    Story story = new Story(builder.buildOrThrow());
    if (story.scenes.containsKey(START)) {
      story.changeToScene(START);
    }
    return story;
  }

  public ImmutableMap<String, Scene> scenes() {
    return scenes;
  }

  public Optional<Scene> currentScene() {
    return sceneHistory.isEmpty()
        ? Optional.empty()
        : Optional.of(Iterables.getLast(sceneHistory));
  }

  public Scene changeToScene(String name) {
    Scene scene = scenes.get(name);
    Preconditions.checkArgument(scene != null, "no scene named '%s'", name);

    scene.rewind();
    visitedScenes.add(name);
    sceneHistory.add(scene);
    log.info("Changed to scene {}", name);
    return scene;
  }

  // Follows a change-scene instruction's 'scene' argument.
  public Scene follow(Instruction changeScene) {
    Preconditions.checkArgument(
        changeScene.is(Opcode.CHANGE_SCENE), "not a change-scene instruction: %s", changeScene);
    return changeToScene(changeScene.requireArguments().require(Arguments.SCENE));
  }

  // Returns to the previous scene in the history, if there is one.
  public Optional<Scene> goBack() {
    if (sceneHistory.size() < 2) return Optional.empty();

    sceneHistory.remove(sceneHistory.size() - 1);
    Scene previous = Iterables.getLast(sceneHistory);
    previous.rewind();
    log.info("Went back to scene {}", previous.name());
    return Optional.of(previous);
  }

  public boolean hasVisited(String name) {
    return visitedScenes.contains(name);
  }

  public ImmutableSet<String> visitedScenes() {
    return ImmutableSet.copyOf(visitedScenes);
  }

  // Oldest first.
  public ImmutableList<Scene> sceneHistory() {
    return ImmutableList.copyOf(sceneHistory);
  }
}
