package cafe.woden.roomlist.coordinator;

import cafe.woden.roomlist.model.RoomRef;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rows of one room captured between "tags about to change" and "tags changed".
 *
 * <p>Two states: idle, or capturing for exactly one room. Rows are recorded by caption rather than
 * group position since group positions shift when an earlier group disappears during the commit.
 */
final class TagUpdateCapture {

  record CapturedRow(String caption, int roomPosition) {}

  private RoomRef room;
  private final List<CapturedRow> rows = new ArrayList<>();

  boolean isCapturing() {
    return room != null;
  }

  boolean isCapturingFor(RoomRef ref) {
    return room != null && room.equals(ref);
  }

  RoomRef room() {
    return room;
  }

  void begin(RoomRef ref, List<CapturedRow> captured) {
    if (room != null) throw new IllegalStateException("Already capturing rows for " + room);
    this.room = Objects.requireNonNull(ref, "ref");
    rows.clear();
    rows.addAll(captured);
  }

  /** Returns the captured rows and goes back to idle. */
  List<CapturedRow> finish() {
    List<CapturedRow> out = List.copyOf(rows);
    clear();
    return out;
  }

  void clear() {
    room = null;
    rows.clear();
  }
}
