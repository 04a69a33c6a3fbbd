package cafe.woden.roomlist.model;

import java.util.Objects;
import java.util.Set;

/**
 * Per-room lifecycle signals.
 *
 * <p>{@link TagsAboutToChange} and {@link TagsChanged} are always emitted as a pair, synchronously,
 * with the tag mutation happening in between.
 */
public sealed interface RoomEvent
    permits RoomEvent.TagsAboutToChange, RoomEvent.TagsChanged, RoomEvent.DisplayAttributeChanged {

  RoomRef room();

  record TagsAboutToChange(RoomRef room) implements RoomEvent {}

  record TagsChanged(RoomRef room) implements RoomEvent {}

  record DisplayAttributeChanged(RoomRef room, Set<RoomAspect> aspects) implements RoomEvent {
    public DisplayAttributeChanged {
      Objects.requireNonNull(room, "room");
      aspects = (aspects == null) ? Set.of() : Set.copyOf(aspects);
    }
  }
}
