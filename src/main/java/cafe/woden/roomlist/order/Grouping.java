package cafe.woden.roomlist.order;

/** How rooms are split into groups. */
public enum Grouping {
  GROUP_BY_TAG
}
