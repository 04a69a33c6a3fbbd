package cafe.woden.roomlist.order;

/** How rooms are ordered within a group. */
public enum Sorting {
  SORT_BY_NAME
}
