package cafe.woden.roomlist.coordinator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.roomlist.model.InMemoryRoom;
import cafe.woden.roomlist.order.RoomOrder;
import cafe.woden.roomlist.order.TagsOrder;
import cafe.woden.roomlist.source.InMemoryRoomSource;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RoomListCoordinatorStrictChecksTest {

  private final RoomListCoordinator coordinator =
      new RoomListCoordinator(RoomOrder.byTag(TagsOrder.defaults()), null, true);
  private final InMemoryRoomSource alice = new InMemoryRoomSource("alice", "@alice:x");

  @Test
  void overlappingTagUpdateThrows() {
    InMemoryRoom a = new InMemoryRoom("alice", "!a:x");
    InMemoryRoom b = new InMemoryRoom("alice", "!b:x");
    alice.seed(List.of(a, b));
    coordinator.addSource(alice);
    coordinator.prepareToUpdateGroups(a);

    IllegalStateException e =
        assertThrows(IllegalStateException.class, () -> coordinator.prepareToUpdateGroups(b));

    assertTrue(e.getMessage().contains("!b:x"));
    assertTrue(coordinator.isTagUpdateInProgress());
  }

  @Test
  void tagChangeWithoutNoticeThrows() {
    InMemoryRoom a = new InMemoryRoom("alice", "!a:x");
    alice.seed(List.of(a));
    coordinator.addSource(alice);

    assertThrows(IllegalStateException.class, () -> coordinator.updateGroups(a));
  }

  @Test
  void deletingAnUnlistedRoomThrowsBeforeTouchingTheIndex() {
    InMemoryRoom listed = new InMemoryRoom("alice", "!a:x").addTag("work");
    alice.seed(List.of(listed));
    coordinator.addSource(alice);
    InMemoryRoom stranger =
        new InMemoryRoom("alice", "!z:x").addTag("work").addTag("u.elsewhere");

    assertThrows(IllegalStateException.class, () -> coordinator.deleteRoom(stranger));

    assertEquals(Map.of("work", List.of(listed.ref())), coordinator.layout());
  }

  @Test
  void detachingAnUnknownSourceThrows() {
    assertThrows(IllegalStateException.class, () -> coordinator.removeSource(alice));
  }

  @Test
  void validOperationsPassSilently() {
    InMemoryRoom a = new InMemoryRoom("alice", "!a:x").addTag("work", 1);
    alice.seed(List.of(a));
    coordinator.addSource(alice);

    a.addTag("work", 3);
    a.setDisplayName("Renamed");
    coordinator.deleteRoom(a);

    assertEquals(0, coordinator.groupCount());
  }
}
