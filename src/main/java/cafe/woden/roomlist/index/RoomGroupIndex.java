package cafe.woden.roomlist.index;

import cafe.woden.roomlist.model.Room;
import cafe.woden.roomlist.model.RoomRef;
import cafe.woden.roomlist.order.RoomOrder;
import cafe.woden.roomlist.source.RoomSource;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.IntFunction;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two-level ordered container: groups sorted by the group comparator of the current {@link
 * RoomOrder}, each holding rooms sorted by that group's room comparator.
 *
 * <p>Every structural change goes through a small set of primitives that report the exact
 * positions touched, so the caller can turn them into row notifications. The index itself never
 * notifies anybody. Not thread-safe.
 */
public final class RoomGroupIndex {
  private static final Logger log = LoggerFactory.getLogger(RoomGroupIndex.class);

  private final ArrayList<RoomGroup> groups = new ArrayList<>();
  private RoomOrder order;

  public RoomGroupIndex(RoomOrder order) {
    this.order = Objects.requireNonNull(order, "order");
  }

  public RoomOrder order() {
    return order;
  }

  public int groupCount() {
    return groups.size();
  }

  public boolean isValidGroupPosition(int groupPosition) {
    return groupPosition >= 0 && groupPosition < groups.size();
  }

  public boolean isValidRoomPosition(int groupPosition, int roomPosition) {
    return isValidGroupPosition(groupPosition)
        && roomPosition >= 0
        && roomPosition < groups.get(groupPosition).rooms.size();
  }

  /** @return the number of rooms in the group, or 0 for an invalid position */
  public int roomCount(int groupPosition) {
    return isValidGroupPosition(groupPosition) ? groups.get(groupPosition).rooms.size() : 0;
  }

  public Optional<String> captionAt(int groupPosition) {
    return isValidGroupPosition(groupPosition)
        ? Optional.of(groups.get(groupPosition).caption)
        : Optional.empty();
  }

  public Optional<Room> roomAt(int groupPosition, int roomPosition) {
    return isValidRoomPosition(groupPosition, roomPosition)
        ? Optional.of(groups.get(groupPosition).rooms.get(roomPosition))
        : Optional.empty();
  }

  /** Read-only view of one group's rooms; empty for an invalid position. */
  public List<Room> rooms(int groupPosition) {
    return isValidGroupPosition(groupPosition)
        ? Collections.unmodifiableList(groups.get(groupPosition).rooms)
        : List.of();
  }

  public List<String> captions() {
    ArrayList<String> out = new ArrayList<>(groups.size());
    for (RoomGroup g : groups) out.add(g.caption);
    return out;
  }

  /** Snapshot of the whole index as caption to room refs, in index order. */
  public Map<String, List<RoomRef>> layout() {
    LinkedHashMap<String, List<RoomRef>> out = new LinkedHashMap<>();
    for (RoomGroup g : groups) {
      ArrayList<RoomRef> refs = new ArrayList<>(g.rooms.size());
      for (Room r : g.rooms) refs.add(r.ref());
      out.put(g.caption, List.copyOf(refs));
    }
    return out;
  }

  public OptionalInt locateGroup(String caption) {
    String c = Objects.toString(caption, "");
    int gPos = lowerBoundGroup(c);
    if (gPos == groups.size() || !groups.get(gPos).caption.equals(c)) return OptionalInt.empty();
    return OptionalInt.of(gPos);
  }

  /**
   * Finds the row of {@code room} under {@code caption} by the same binary search insertion uses.
   *
   * <p>Only finds the room if its current sort key matches the one it was inserted with.
   */
  public Optional<RoomPosition> locate(String caption, Room room) {
    if (room == null) return Optional.empty();
    OptionalInt gPos = locateGroup(caption);
    if (gPos.isEmpty()) return Optional.empty();
    RoomGroup group = groups.get(gPos.getAsInt());
    int rPos = lowerBoundRoom(group, room);
    if (rPos == group.rooms.size() || !sameRoom(group.rooms.get(rPos), room)) {
      return Optional.empty();
    }
    return Optional.of(new RoomPosition(gPos.getAsInt(), rPos));
  }

  public GroupInsertion insertGroupIfAbsent(String caption) {
    String c = Objects.toString(caption, "");
    if (c.isBlank()) throw new IllegalArgumentException("group caption must not be blank");
    int gPos = lowerBoundGroup(c);
    if (gPos < groups.size() && groups.get(gPos).caption.equals(c)) {
      return new GroupInsertion(gPos, false);
    }
    groups.add(gPos, new RoomGroup(c));
    return new GroupInsertion(gPos, true);
  }

  /** Inserts {@code room} at its sorted position in an existing group. */
  public RoomInsertion insertRoom(String caption, Room room) {
    Objects.requireNonNull(room, "room");
    OptionalInt gPos = locateGroup(caption);
    if (gPos.isEmpty()) {
      log.error(
          "[roomlist] Cannot insert {} into missing group {}", room.ref(), caption);
      return RoomInsertion.groupMissing();
    }
    RoomGroup group = groups.get(gPos.getAsInt());
    int rPos = lowerBoundRoom(group, room);
    if (rPos < group.rooms.size() && sameRoom(group.rooms.get(rPos), room)) {
      log.warn("[roomlist] {} is already listed under group {}", room.ref(), group.caption);
      return RoomInsertion.alreadyPresent(gPos.getAsInt(), rPos);
    }
    group.rooms.add(rPos, room);
    log.debug("[roomlist] Added {} to group {}", room.ref(), group.caption);
    return RoomInsertion.inserted(gPos.getAsInt(), rPos);
  }

  /**
   * Removes the room at the given row, and its group too if that was the last room.
   *
   * @return empty (and nothing changed) if the position is invalid
   */
  public Optional<RoomRemoval> removeRoom(int groupPosition, int roomPosition) {
    if (!isValidRoomPosition(groupPosition, roomPosition)) {
      log.error(
          "[roomlist] Attempt to remove a room at invalid position ({}, {})",
          groupPosition,
          roomPosition);
      return Optional.empty();
    }
    RoomGroup group = groups.get(groupPosition);
    Room removed = group.rooms.remove(roomPosition);
    log.debug("[roomlist] Removing {} from group {}", removed.ref(), group.caption);
    boolean groupRemoved = group.rooms.isEmpty();
    if (groupRemoved) groups.remove(groupPosition);
    return Optional.of(
        new RoomRemoval(removed, group.caption, groupPosition, roomPosition, groupRemoved));
  }

  /**
   * Where the room at the given row belongs now, as its index once moved there.
   *
   * <p>For use after the room's sort key changed in place; the other rooms of the group are assumed
   * to still be in order.
   */
  public OptionalInt relocationTarget(int groupPosition, int roomPosition) {
    if (!isValidRoomPosition(groupPosition, roomPosition)) return OptionalInt.empty();
    RoomGroup group = groups.get(groupPosition);
    Room room = group.rooms.get(roomPosition);
    List<Room> rooms = group.rooms;
    int size = rooms.size() - 1;
    IntFunction<Room> others = i -> rooms.get(i < roomPosition ? i : i + 1);
    return OptionalInt.of(lowerBound(others, size, room, order.roomComparator(group.caption)));
  }

  /**
   * Moves a room within its group.
   *
   * @param newRoomPosition index of the room after the move
   * @return true if anything moved
   */
  public boolean moveRoom(int groupPosition, int oldRoomPosition, int newRoomPosition) {
    if (!isValidRoomPosition(groupPosition, oldRoomPosition)
        || !isValidRoomPosition(groupPosition, newRoomPosition)) {
      log.error(
          "[roomlist] Attempt to move a room at invalid position ({}, {} -> {})",
          groupPosition,
          oldRoomPosition,
          newRoomPosition);
      return false;
    }
    if (oldRoomPosition == newRoomPosition) return false;
    ArrayList<Room> rooms = groups.get(groupPosition).rooms;
    rooms.add(newRoomPosition, rooms.remove(oldRoomPosition));
    return true;
  }

  /**
   * Removes every room matching {@code filter} from every group, dropping groups that become empty.
   *
   * @return the number of room rows removed
   */
  public int removeRoomsIf(Predicate<? super Room> filter) {
    Objects.requireNonNull(filter, "filter");
    int removed = 0;
    for (Iterator<RoomGroup> it = groups.iterator(); it.hasNext(); ) {
      RoomGroup group = it.next();
      int before = group.rooms.size();
      group.rooms.removeIf(filter);
      removed += before - group.rooms.size();
      if (group.rooms.isEmpty()) it.remove();
    }
    return removed;
  }

  public void clear() {
    groups.clear();
  }

  /** Clears the index and re-inserts every room of every source from scratch. */
  public void rebuildAll(Collection<? extends RoomSource> sources) {
    groups.clear();
    if (sources == null) return;
    for (RoomSource source : sources) {
      for (Room room : source.rooms()) {
        insertRoomToGroups(room);
      }
    }
  }

  /** Installs a new ordering policy and rebuilds under it. */
  public void rebuildAll(RoomOrder newOrder, Collection<? extends RoomSource> sources) {
    this.order = Objects.requireNonNull(newOrder, "order");
    rebuildAll(sources);
  }

  private void insertRoomToGroups(Room room) {
    for (String caption : order.groups(room)) {
      insertGroupIfAbsent(caption);
      insertRoom(caption, room);
    }
  }

  private int lowerBoundGroup(String caption) {
    Comparator<String> cmp = order.groupComparator();
    return lowerBound(i -> groups.get(i).caption, groups.size(), caption, cmp);
  }

  private int lowerBoundRoom(RoomGroup group, Room room) {
    List<Room> rooms = group.rooms;
    return lowerBound(rooms::get, rooms.size(), room, order.roomComparator(group.caption));
  }

  /** First index in {@code [0, size)} whose element is not less than {@code key}. */
  private static <T> int lowerBound(
      IntFunction<? extends T> elementAt, int size, T key, Comparator<? super T> cmp) {
    int lo = 0;
    int hi = size;
    while (lo < hi) {
      int mid = (lo + hi) >>> 1;
      if (cmp.compare(elementAt.apply(mid), key) < 0) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }

  private static boolean sameRoom(Room a, Room b) {
    return a == b || a.ref().equals(b.ref());
  }

  @Override
  public String toString() {
    return "RoomGroupIndex" + groups;
  }
}
