package cafe.woden.roomlist.index;

import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Row address in the two-level list: group position plus room position within that group.
 *
 * <p>Only valid until the next structural change of the index.
 */
@ValueObject
public record RoomPosition(int groupPosition, int roomPosition) {}
