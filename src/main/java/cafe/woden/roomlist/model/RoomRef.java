package cafe.woden.roomlist.model;

import java.util.Comparator;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Identifies a room within a source.
 *
 * <p>The same room id may be visible through several sources (e.g. two accounts joined to the same
 * room). Those are distinct rooms for the list, so identity is the pair of source id and room id.
 *
 * <p>Room ids are compared verbatim; unlike nicks they are not case-folded.
 */
@ValueObject
public final class RoomRef implements Comparable<RoomRef> {

  private static final Comparator<RoomRef> ORDER =
      Comparator.comparing(RoomRef::roomId).thenComparing(RoomRef::sourceId);

  private final String sourceId;
  private final String roomId;

  public RoomRef(String sourceId, String roomId) {
    this.sourceId = norm(sourceId);
    this.roomId = norm(roomId);
    if (this.sourceId.isEmpty()) throw new IllegalArgumentException("sourceId must not be blank");
    if (this.roomId.isEmpty()) throw new IllegalArgumentException("roomId must not be blank");
  }

  public String sourceId() {
    return sourceId;
  }

  public String roomId() {
    return roomId;
  }

  /** True if both refs point at the same room id, regardless of the source. */
  public boolean sameRoomId(RoomRef other) {
    return other != null && roomId.equals(other.roomId);
  }

  /** Room id first, then source id. */
  @Override
  public int compareTo(RoomRef other) {
    return ORDER.compare(this, other);
  }

  private static String norm(String s) {
    return Objects.toString(s, "").trim();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RoomRef other)) return false;
    return sourceId.equals(other.sourceId) && roomId.equals(other.roomId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(sourceId, roomId);
  }

  @Override
  public String toString() {
    return "RoomRef{" + sourceId + ":" + roomId + "}";
  }
}
