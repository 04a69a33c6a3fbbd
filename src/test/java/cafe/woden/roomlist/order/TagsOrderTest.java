package cafe.woden.roomlist.order;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class TagsOrderTest {

  @Test
  void defaultOrderRanksReservedCaptions() {
    TagsOrder order = TagsOrder.defaults();

    assertEquals(0, order.rankOf("m.favourite"));
    assertEquals(1, order.rankOf("u.work"));
    assertEquals(2, order.rankOf("roomlist.direct"));
    assertEquals(3, order.rankOf("roomlist.none"));
    assertEquals(4, order.rankOf("m.lowpriority"));
    assertEquals(5, order.rankOf("work"));
  }

  @Test
  void exactEntryBeatsWildcard() {
    TagsOrder order = new TagsOrder(List.of("u.*", "u.special"));

    assertEquals(1, order.rankOf("u.special"));
    assertEquals(0, order.rankOf("u.other"));
  }

  @Test
  void longestWildcardPrefixWins() {
    TagsOrder order = new TagsOrder(List.of("a.*", "a.b.*"));

    assertEquals(1, order.rankOf("a.b.c"));
    assertEquals(0, order.rankOf("a.x"));
    assertEquals(0, order.rankOf("a.x.y"));
  }

  @Test
  void wildcardNeedsTheDot() {
    TagsOrder order = new TagsOrder(List.of("u.*"));

    assertEquals(1, order.rankOf("u"));
    assertEquals(1, order.rankOf("user"));
    assertEquals(0, order.rankOf("u."));
  }

  @Test
  void blankEntriesAreDroppedAndBlankCaptionsRankLast() {
    TagsOrder order = new TagsOrder(Arrays.asList(" ", null, " fav "));

    assertEquals(List.of("fav"), order.patterns());
    assertEquals(0, order.rankOf("fav"));
    assertEquals(1, order.rankOf(""));
    assertEquals(1, order.rankOf(null));
  }

  @Test
  void emptyOrderRanksEverythingEqually() {
    TagsOrder order = new TagsOrder(null);

    assertTrue(order.isEmpty());
    assertEquals(0, order.rankOf("m.favourite"));
    assertEquals(0, order.rankOf("anything"));
  }
}
