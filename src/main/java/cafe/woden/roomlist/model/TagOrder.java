package cafe.woden.roomlist.model;

import java.util.NoSuchElementException;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Ordering weight attached to a tag on a room.
 *
 * <p>A tag may carry no explicit order at all; {@link #omitted()} is that sentinel. Rooms without
 * an explicit order sort after rooms that have one within the same group.
 */
@ValueObject
public final class TagOrder {

  private static final TagOrder OMITTED = new TagOrder(false, 0d);

  private final boolean present;
  private final double value;

  private TagOrder(boolean present, double value) {
    this.present = present;
    this.value = value;
  }

  public static TagOrder omitted() {
    return OMITTED;
  }

  public static TagOrder of(double value) {
    if (Double.isNaN(value)) throw new IllegalArgumentException("order must not be NaN");
    return new TagOrder(true, value);
  }

  public boolean isOmitted() {
    return !present;
  }

  /** @throws NoSuchElementException if this order is {@link #omitted()} */
  public double value() {
    if (!present) throw new NoSuchElementException("tag order is omitted");
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TagOrder other)) return false;
    return present == other.present && Double.compare(value, other.value) == 0;
  }

  @Override
  public int hashCode() {
    return present ? Double.hashCode(value) : -1;
  }

  @Override
  public String toString() {
    return present ? "TagOrder{" + value + "}" : "TagOrder{omitted}";
  }
}
