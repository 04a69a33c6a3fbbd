package cafe.woden.roomlist.index;

/** Result of {@link RoomGroupIndex#insertRoom(String, cafe.woden.roomlist.model.Room)}. */
public record RoomInsertion(Status status, int groupPosition, int roomPosition) {

  public enum Status {
    INSERTED,
    /** The room was already listed in the group; nothing changed. */
    ALREADY_PRESENT,
    /** The group does not exist; callers must insert it first. */
    GROUP_MISSING
  }

  static RoomInsertion inserted(int groupPosition, int roomPosition) {
    return new RoomInsertion(Status.INSERTED, groupPosition, roomPosition);
  }

  static RoomInsertion alreadyPresent(int groupPosition, int roomPosition) {
    return new RoomInsertion(Status.ALREADY_PRESENT, groupPosition, roomPosition);
  }

  static RoomInsertion groupMissing() {
    return new RoomInsertion(Status.GROUP_MISSING, -1, -1);
  }

  public boolean isInserted() {
    return status == Status.INSERTED;
  }

  public RoomPosition position() {
    return new RoomPosition(groupPosition, roomPosition);
  }
}
