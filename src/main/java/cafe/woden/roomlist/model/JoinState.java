package cafe.woden.roomlist.model;

/** Membership of the local user in a room. */
public enum JoinState {
  JOIN,
  INVITE,
  LEAVE
}
