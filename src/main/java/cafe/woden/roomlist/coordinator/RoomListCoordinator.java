package cafe.woden.roomlist.coordinator;

import cafe.woden.roomlist.api.RoomListChange;
import cafe.woden.roomlist.api.RoomListChangeStream;
import cafe.woden.roomlist.api.RoomListListener;
import cafe.woden.roomlist.config.RoomListConfigStore;
import cafe.woden.roomlist.config.RoomListProperties;
import cafe.woden.roomlist.index.GroupInsertion;
import cafe.woden.roomlist.index.RoomGroupIndex;
import cafe.woden.roomlist.index.RoomInsertion;
import cafe.woden.roomlist.index.RoomPosition;
import cafe.woden.roomlist.index.RoomRemoval;
import cafe.woden.roomlist.model.Room;
import cafe.woden.roomlist.model.RoomAspect;
import cafe.woden.roomlist.model.RoomEvent;
import cafe.woden.roomlist.model.RoomRef;
import cafe.woden.roomlist.order.Grouping;
import cafe.woden.roomlist.order.RoomGroupCaptions;
import cafe.woden.roomlist.order.RoomOrder;
import cafe.woden.roomlist.order.Sorting;
import cafe.woden.roomlist.order.TagsOrder;
import cafe.woden.roomlist.source.RoomSource;
import cafe.woden.roomlist.source.SourceEvent;
import cafe.woden.roomlist.source.SourceRegistry;
import io.reactivex.rxjava3.core.Flowable;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Keeps the grouped room list in sync with its sources.
 *
 * <p>Owns the {@link RoomGroupIndex}: reacts to source and room events, turns them into index
 * mutations and reports each mutation to the registered {@link RoomListListener}s with exact
 * positions. Events that cannot be applied incrementally (a room replacing another, sources coming
 * and going, ordering changes) rebuild the index and report a full reset instead.
 *
 * <p>All entry points are serialized on this instance. Room and source events are handled on the
 * thread that emits them.
 */
@Component
@ApplicationLayer
public class RoomListCoordinator {
  private static final Logger log = LoggerFactory.getLogger(RoomListCoordinator.class);

  private final RoomListConfigStore configStore;
  private final boolean strictIntegrityChecks;
  private final SourceRegistry sources = new SourceRegistry();
  private final RoomSubscriptions subscriptions = new RoomSubscriptions();
  private final TagUpdateCapture tagUpdate = new TagUpdateCapture();
  private final RoomGroupIndex index;
  private final CopyOnWriteArrayList<RoomListListener> listeners = new CopyOnWriteArrayList<>();
  private final RoomListChangeStream changeStream = new RoomListChangeStream();

  @Autowired
  public RoomListCoordinator(RoomListProperties props, RoomListConfigStore configStore) {
    this(
        RoomOrder.byTag(initialTagsOrder(props, configStore)),
        configStore,
        props != null && props.strictIntegrityChecksEnabled());
  }

  public RoomListCoordinator(
      RoomOrder order, RoomListConfigStore configStore, boolean strictIntegrityChecks) {
    this.index = new RoomGroupIndex(Objects.requireNonNull(order, "order"));
    this.configStore = configStore;
    this.strictIntegrityChecks = strictIntegrityChecks;
    listeners.add(changeStream);
  }

  private static TagsOrder initialTagsOrder(
      RoomListProperties props, RoomListConfigStore configStore) {
    if (configStore != null) {
      Optional<List<String>> saved = configStore.readTagsOrder();
      if (saved.isPresent()) return new TagsOrder(saved.get());
    }
    if (props != null && !props.tagsOrder().isEmpty()) {
      return new TagsOrder(props.tagsOrder());
    }
    TagsOrder defaults = TagsOrder.defaults();
    if (configStore != null) configStore.rememberTagsOrder(defaults.patterns());
    return defaults;
  }

  @PreDestroy
  void shutdown() {
    synchronized (this) {
      subscriptions.dispose();
    }
  }

  public void addListener(RoomListListener listener) {
    listeners.addIfAbsent(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(RoomListListener listener) {
    listeners.remove(listener);
  }

  /** All row-level changes as a hot stream. */
  public Flowable<RoomListChange> changes() {
    return changeStream.changes();
  }

  public synchronized void addSource(RoomSource source) {
    Objects.requireNonNull(source, "source");
    if (!sources.register(source)) return;

    subscriptions.subscribeSource(source, this::onSourceEvent);
    for (Room r : source.rooms()) {
      connectRoomSignals(r);
    }
    index.rebuildAll(sources.sources());
    log.debug(
        "[roomlist] Attached source '{}' with {} room(s)", source.id(), source.roomCount());
    emitFullReset();
  }

  public synchronized void removeSource(RoomSource source) {
    Objects.requireNonNull(source, "source");
    if (!sources.contains(source)) {
      integrityViolation("[roomlist] Source '{}' is missing in the room list", source.id());
      return;
    }
    String sid = source.id();
    int rows = index.removeRoomsIf(r -> r.sourceId().equals(sid));
    subscriptions.unsubscribeSource(sid);
    subscriptions.unsubscribeRoomsOf(sid);
    sources.deregister(source);
    log.debug("[roomlist] Detached source '{}' ({} row(s) removed)", sid, rows);
    emitFullReset();
  }

  /**
   * A room was added to a source, or replaced the previous object for the same room.
   *
   * <p>Anything about the room may have changed along the way, so the list is rebuilt.
   */
  public synchronized void replaceRoom(Room room, Room previous) {
    Objects.requireNonNull(room, "room");
    if (previous == room) {
      log.error("[roomlist] {} tried to replace itself", room.ref());
      refresh(room, Set.of());
      return;
    }
    if (previous != null && !room.id().equals(previous.id())) {
      log.error("[roomlist] Attempt to update room {} to {}", previous.id(), room.id());
    }
    if (previous != null && !previous.ref().equals(room.ref())) {
      subscriptions.unsubscribeRoom(previous.ref());
    }
    connectRoomSignals(room);

    index.rebuildAll(sources.sources());
    emitFullReset();
  }

  /** Removes every row of a room that is about to leave its source. */
  public synchronized void deleteRoom(Room room) {
    Objects.requireNonNull(room, "room");
    List<String> found = new ArrayList<>();
    for (String caption : index.order().groups(room)) {
      if (index.locateGroup(caption).isEmpty()) {
        integrityViolation(
            "[roomlist] Invalid group {} for room {}", caption, room.ref());
        continue;
      }
      if (index.locate(caption, room).isEmpty()) {
        integrityViolation(
            "[roomlist] The current order lists room {} in group {} but the index doesn't have it",
            room.ref(),
            caption);
        continue;
      }
      found.add(caption);
    }
    for (String caption : found) {
      index.locate(caption, room).ifPresent(this::doRemoveRoom);
    }
    subscriptions.unsubscribeRoom(room.ref());
  }

  /** First half of a tag change: remembers where {@code room} currently is. */
  public synchronized void prepareToUpdateGroups(Room room) {
    Objects.requireNonNull(room, "room");
    if (tagUpdate.isCapturing()) {
      integrityViolation(
          "[roomlist] Tag update for {} started while the update for {} is still in progress",
          room.ref(),
          tagUpdate.room());
      return;
    }
    List<TagUpdateCapture.CapturedRow> rows = new ArrayList<>();
    for (String caption : index.order().groups(room)) {
      Optional<RoomPosition> pos = index.locate(caption, room);
      if (pos.isEmpty()) {
        integrityViolation(
            "[roomlist] Room {} should be in group {} but the index doesn't have it",
            room.ref(),
            caption);
        continue;
      }
      rows.add(new TagUpdateCapture.CapturedRow(caption, pos.get().roomPosition()));
    }
    tagUpdate.begin(room.ref(), rows);
  }

  /**
   * Second half of a tag change.
   *
   * <p>Rows in groups the room still belongs to are moved to their new sorted position, rows in
   * groups it left are removed, and the room is inserted into groups it joined.
   */
  public synchronized void updateGroups(Room room) {
    Objects.requireNonNull(room, "room");
    if (!tagUpdate.isCapturingFor(room.ref())) {
      if (tagUpdate.isCapturing()) {
        integrityViolation(
            "[roomlist] Tags of {} changed while the update for {} is in progress",
            room.ref(),
            tagUpdate.room());
        return;
      }
      integrityViolation(
          "[roomlist] Tags of {} changed without a preceding notice; rebuilding", room.ref());
      index.rebuildAll(sources.sources());
      emitFullReset();
      return;
    }

    List<TagUpdateCapture.CapturedRow> rows = new ArrayList<>();
    for (TagUpdateCapture.CapturedRow row : tagUpdate.finish()) {
      OptionalInt gPos = index.locateGroup(row.caption());
      Optional<Room> atRow =
          gPos.isPresent() ? index.roomAt(gPos.getAsInt(), row.roomPosition()) : Optional.empty();
      if (atRow.isEmpty() || !atRow.get().ref().equals(room.ref())) {
        integrityViolation(
            "[roomlist] Captured row of {} in group {} at {} is stale; skipping",
            room.ref(),
            row.caption(),
            row.roomPosition());
        continue;
      }
      rows.add(row);
    }

    List<String> groups = new ArrayList<>(index.order().groups(room));
    for (TagUpdateCapture.CapturedRow row : rows) {
      int gPos = index.locateGroup(row.caption()).getAsInt();
      int oldPos = row.roomPosition();
      if (groups.remove(row.caption())) {
        int newPos = index.relocationTarget(gPos, oldPos).orElse(oldPos);
        if (newPos == oldPos) continue;
        if (index.moveRoom(gPos, oldPos, newPos)) {
          notifyListeners(l -> l.roomMoved(gPos, oldPos, newPos));
        }
      } else {
        doRemoveRoom(new RoomPosition(gPos, oldPos));
      }
    }
    insertRoomToGroups(groups, room);
  }

  /** Reports a display change at every row of {@code room}; empty {@code aspects} means all. */
  public synchronized void refresh(Room room, Set<RoomAspect> aspects) {
    Objects.requireNonNull(room, "room");
    Set<RoomAspect> a = aspects == null ? Set.of() : Set.copyOf(aspects);
    for (RoomPosition pos : visitRoom(room)) {
      notifyListeners(l -> l.dataChanged(pos.groupPosition(), pos.roomPosition(), a));
    }
  }

  public synchronized void setOrder(Grouping grouping, Sorting sorting) {
    RoomOrder next = new RoomOrder(grouping, sorting, index.order().tagsOrder());
    index.rebuildAll(next, sources.sources());
    emitFullReset();
  }

  public synchronized void setTagsOrder(List<String> tagsOrder) {
    RoomOrder current = index.order();
    TagsOrder next = new TagsOrder(tagsOrder);
    if (configStore != null) configStore.rememberTagsOrder(next.patterns());
    index.rebuildAll(
        new RoomOrder(current.grouping(), current.sorting(), next), sources.sources());
    emitFullReset();
  }

  /**
   * Removes a tag from every room of every source; the group goes away as its rooms lose the tag.
   *
   * <p>Groups the list creates itself (direct chats, untagged) cannot be deleted.
   */
  public synchronized void deleteTag(String caption) {
    String tag = Objects.toString(caption, "");
    if (tag.isBlank()) {
      log.error("[roomlist] Invalid tag '{}'", caption);
      return;
    }
    if (RoomGroupCaptions.isSystemCaption(tag)) {
      log.warn("[roomlist] System groups cannot be deleted (tried to delete {} group)", tag);
      return;
    }
    for (RoomSource s : sources.sources()) {
      for (Room r : s.roomsWithTag(tag)) {
        r.removeTag(tag);
      }
    }
  }

  public synchronized void deleteTag(int groupPosition) {
    Optional<String> caption = index.captionAt(groupPosition);
    if (caption.isEmpty()) {
      log.error("[roomlist] Invalid tag at position {}", groupPosition);
      return;
    }
    deleteTag(caption.get());
  }

  public synchronized RoomOrder order() {
    return index.order();
  }

  public synchronized List<RoomSource> sources() {
    return sources.sources();
  }

  public synchronized int totalRooms() {
    return sources.totalRooms();
  }

  public synchronized int groupCount() {
    return index.groupCount();
  }

  public synchronized int roomCount(int groupPosition) {
    return index.roomCount(groupPosition);
  }

  public synchronized Optional<String> captionAt(int groupPosition) {
    return index.captionAt(groupPosition);
  }

  public synchronized Optional<Room> roomAt(int groupPosition, int roomPosition) {
    return index.roomAt(groupPosition, roomPosition);
  }

  public synchronized Optional<RoomPosition> locate(String caption, Room room) {
    return index.locate(caption, room);
  }

  public synchronized List<String> captions() {
    return index.captions();
  }

  public synchronized Map<String, List<RoomRef>> layout() {
    return index.layout();
  }

  public synchronized Optional<String> groupLabel(int groupPosition) {
    return index.captionAt(groupPosition).map(RoomLabels::groupLabel);
  }

  public synchronized Optional<String> roomLabel(int groupPosition, int roomPosition) {
    List<RoomSource> attached = sources.sources();
    return index.roomAt(groupPosition, roomPosition).map(r -> RoomLabels.roomLabel(r, attached));
  }

  synchronized boolean isTagUpdateInProgress() {
    return tagUpdate.isCapturing();
  }

  synchronized boolean isSubscribed(RoomRef ref) {
    return subscriptions.isRoomSubscribed(ref);
  }

  private void onSourceEvent(SourceEvent event) {
    if (event instanceof SourceEvent.RoomAdded e) {
      replaceRoom(e.room(), null);
    } else if (event instanceof SourceEvent.RoomReplaced e) {
      replaceRoom(e.room(), e.previous());
    } else if (event instanceof SourceEvent.RoomRemoved e) {
      deleteRoom(e.room());
    } else if (event instanceof SourceEvent.Disconnected e) {
      Optional<RoomSource> source;
      synchronized (this) {
        source = sources.find(e.sourceId());
      }
      source.ifPresent(this::removeSource);
    }
  }

  private void connectRoomSignals(Room room) {
    subscriptions.subscribeRoom(room, ev -> onRoomEvent(room, ev));
  }

  private void onRoomEvent(Room room, RoomEvent event) {
    if (event instanceof RoomEvent.TagsAboutToChange) {
      prepareToUpdateGroups(room);
    } else if (event instanceof RoomEvent.TagsChanged) {
      updateGroups(room);
    } else if (event instanceof RoomEvent.DisplayAttributeChanged e) {
      refresh(room, e.aspects());
    }
  }

  private List<RoomPosition> visitRoom(Room room) {
    List<RoomPosition> out = new ArrayList<>();
    for (String caption : index.order().groups(room)) {
      if (index.locateGroup(caption).isEmpty()) {
        integrityViolation("[roomlist] Invalid group {} for room {}", caption, room.ref());
        continue;
      }
      Optional<RoomPosition> pos = index.locate(caption, room);
      if (pos.isEmpty()) {
        integrityViolation(
            "[roomlist] The current order lists room {} in group {} but the index doesn't have it",
            room.ref(),
            caption);
        continue;
      }
      out.add(pos.get());
    }
    return out;
  }

  private void insertRoomToGroups(List<String> captions, Room room) {
    for (String caption : captions) {
      GroupInsertion g = index.insertGroupIfAbsent(caption);
      if (g.created()) {
        notifyListeners(l -> l.groupInserted(g.position()));
      }
      RoomInsertion r = index.insertRoom(caption, room);
      if (r.isInserted()) {
        notifyListeners(l -> l.roomInserted(r.groupPosition(), r.roomPosition()));
      }
    }
  }

  private void doRemoveRoom(RoomPosition pos) {
    Optional<RoomRemoval> removal = index.removeRoom(pos.groupPosition(), pos.roomPosition());
    if (removal.isEmpty()) return;
    RoomRemoval rm = removal.get();
    notifyListeners(l -> l.roomRemoved(rm.groupPosition(), rm.roomPosition()));
    if (rm.groupRemoved()) {
      notifyListeners(l -> l.groupRemoved(rm.groupPosition()));
    }
  }

  private void emitFullReset() {
    notifyListeners(RoomListListener::fullReset);
  }

  private void notifyListeners(Consumer<RoomListListener> call) {
    for (RoomListListener l : listeners) {
      try {
        call.accept(l);
      } catch (RuntimeException e) {
        log.warn("[roomlist] Room list listener {} failed", l, e);
      }
    }
  }

  private void integrityViolation(String format, Object... args) {
    String message = MessageFormatter.arrayFormat(format, args).getMessage();
    if (strictIntegrityChecks) throw new IllegalStateException(message);
    log.error(message);
  }
}
