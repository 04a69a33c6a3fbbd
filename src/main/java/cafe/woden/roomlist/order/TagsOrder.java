package cafe.woden.roomlist.order;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Priority list of group caption patterns.
 *
 * <p>Each entry is either an exact caption ({@code m.favourite}) or a namespace wildcard ending in
 * {@code .*} ({@code u.*}). Captions matching no entry rank after all entries.
 */
@ValueObject
public final class TagsOrder {

  private final List<String> patterns;

  public TagsOrder(List<String> patterns) {
    ArrayList<String> cleaned = new ArrayList<>();
    if (patterns != null) {
      for (String p : patterns) {
        String t = Objects.toString(p, "").trim();
        if (!t.isEmpty()) cleaned.add(t);
      }
    }
    this.patterns = List.copyOf(cleaned);
  }

  public static TagsOrder defaults() {
    return new TagsOrder(RoomGroupCaptions.DEFAULT_TAGS_ORDER);
  }

  public List<String> patterns() {
    return patterns;
  }

  public boolean isEmpty() {
    return patterns.isEmpty();
  }

  /**
   * Rank of a caption; lower ranks first.
   *
   * <p>An exact entry wins. Otherwise the caption is cut back one {@code .}-segment at a time from
   * the right and each {@code prefix.*} form is tried, longest first. Unmatched (and blank)
   * captions get {@code patterns().size()}.
   */
  public int rankOf(String caption) {
    int notFound = patterns.size();
    String value = Objects.toString(caption, "");
    if (patterns.isEmpty() || value.isEmpty()) return notFound;

    int idx = patterns.indexOf(value);
    if (idx >= 0) return idx;

    int dotPos = value.length();
    while ((dotPos = value.lastIndexOf('.', dotPos - 1)) != -1) {
      idx = patterns.indexOf(value.substring(0, dotPos + 1) + '*');
      if (idx >= 0) return idx;
    }
    return notFound;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TagsOrder other)) return false;
    return patterns.equals(other.patterns);
  }

  @Override
  public int hashCode() {
    return patterns.hashCode();
  }

  @Override
  public String toString() {
    return "TagsOrder" + patterns;
  }
}
