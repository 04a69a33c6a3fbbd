package cafe.woden.roomlist.order;

import cafe.woden.roomlist.model.Room;
import cafe.woden.roomlist.model.TagOrder;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Grouping and ordering rules for the room list.
 *
 * <p>The three rules (group order, room order within a group, group membership of a room) only
 * make sense together, so they are bundled in one immutable policy. Swapping the policy requires a
 * full rebuild of anything ordered by the previous one.
 */
public final class RoomOrder {
  private static final Logger log = LoggerFactory.getLogger(RoomOrder.class);

  private final Grouping grouping;
  private final Sorting sorting;
  private final TagsOrder tagsOrder;
  private final Comparator<String> groupComparator;

  public RoomOrder(Grouping grouping, Sorting sorting, TagsOrder tagsOrder) {
    this.grouping = Objects.requireNonNull(grouping, "grouping");
    this.sorting = Objects.requireNonNull(sorting, "sorting");
    if (grouping != Grouping.GROUP_BY_TAG || sorting != Sorting.SORT_BY_NAME) {
      throw new IllegalArgumentException(
          "Unsupported room list mode: " + grouping + "/" + sorting);
    }
    this.tagsOrder = tagsOrder == null ? TagsOrder.defaults() : tagsOrder;
    this.groupComparator = this::compareGroups;
  }

  public static RoomOrder byTag(TagsOrder tagsOrder) {
    return new RoomOrder(Grouping.GROUP_BY_TAG, Sorting.SORT_BY_NAME, tagsOrder);
  }

  public Grouping grouping() {
    return grouping;
  }

  public Sorting sorting() {
    return sorting;
  }

  public TagsOrder tagsOrder() {
    return tagsOrder;
  }

  /** Total order over group captions: priority rank first, then the caption itself. */
  public Comparator<String> groupComparator() {
    return groupComparator;
  }

  public boolean groupLessThan(String existingCaption, String candidateCaption) {
    return compareGroups(existingCaption, candidateCaption) < 0;
  }

  /**
   * Order of rooms within the group {@code caption}.
   *
   * <p>The order weight is looked up per tag, hence one comparator per group.
   */
  public Comparator<Room> roomComparator(String caption) {
    return new RoomComparator(Objects.toString(caption, ""));
  }

  public boolean roomLessThan(String caption, Room r1, Room r2) {
    return roomComparator(caption).compare(r1, r2) < 0;
  }

  /**
   * Captions of the groups {@code room} currently belongs to.
   *
   * <p>Tag names verbatim in the room's tag iteration order, then the direct-chat group if
   * applicable, then the untagged group if nothing else applied. Blank tag names form no group.
   * Never empty.
   */
  public List<String> groups(Room room) {
    Objects.requireNonNull(room, "room");
    LinkedHashSet<String> out = new LinkedHashSet<>();
    for (String tag : room.tags().keySet()) {
      if (tag != null && !tag.isBlank()) out.add(tag);
    }
    if (room.isDirectChat()) out.add(RoomGroupCaptions.DIRECT_CHAT);
    if (out.isEmpty()) out.add(RoomGroupCaptions.UNTAGGED);
    return List.copyOf(out);
  }

  private int compareGroups(String left, String right) {
    String l = Objects.toString(left, "");
    String r = Objects.toString(right, "");
    int li = tagsOrder.rankOf(l);
    int ri = tagsOrder.rankOf(r);
    if (li != ri) return Integer.compare(li, ri);
    return l.compareTo(r);
  }

  private static final class RoomComparator implements Comparator<Room> {
    private final String caption;

    private RoomComparator(String caption) {
      this.caption = caption;
    }

    @Override
    public int compare(Room r1, Room r2) {
      if (r1 == r2 || r1.ref().equals(r2.ref())) return 0;

      TagOrder o1 = r1.tag(caption);
      TagOrder o2 = r2.tag(caption);
      // Rooms with an explicit order go before those without one.
      if (o1.isOmitted() != o2.isOmitted()) return o1.isOmitted() ? 1 : -1;

      if (!o1.isOmitted()) {
        int byValue = Double.compare(o1.value(), o2.value());
        if (byValue != 0) return byValue;
        if (!r1.id().equals(r2.id())) {
          log.warn(
              "[roomlist] {} order values aren't strongly ordered: {} with {} vs. {} with {}",
              caption,
              r1.ref(),
              o1.value(),
              r2.ref(),
              o2.value());
        }
      }
      // Tie-break on identity; renames never re-sort rows.
      return r1.ref().compareTo(r2.ref());
    }
  }

  @Override
  public String toString() {
    return "RoomOrder{" + grouping + "/" + sorting + " " + tagsOrder + "}";
  }
}
