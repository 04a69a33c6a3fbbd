package cafe.woden.roomlist.coordinator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.roomlist.index.RoomGroupIndex;
import cafe.woden.roomlist.model.InMemoryRoom;
import cafe.woden.roomlist.model.Room;
import cafe.woden.roomlist.model.TagOrder;
import cafe.woden.roomlist.order.RoomOrder;
import cafe.woden.roomlist.order.TagsOrder;
import cafe.woden.roomlist.source.InMemoryRoomSource;
import cafe.woden.roomlist.source.RoomSource;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

class RoomListCoordinatorReplayTest {

  private static final List<String> TAGS =
      List.of("m.favourite", "m.lowpriority", "u.a", "u.b", "work");
  private static final int ROOM_IDS = 8;

  @Test
  void incrementalUpdatesMatchAFreshRebuild() {
    for (long seed : new long[] {1L, 42L, 20261019L}) {
      replay(seed);
    }
  }

  private static void replay(long seed) {
    Random random = new Random(seed);
    RoomListCoordinator coordinator =
        new RoomListCoordinator(RoomOrder.byTag(TagsOrder.defaults()), null, true);
    RoomListReplica replica = new RoomListReplica(coordinator);
    coordinator.addListener(replica);

    List<InMemoryRoomSource> sources = new ArrayList<>();
    for (String sourceId : List.of("alice", "bob", "carol")) {
      InMemoryRoomSource source = new InMemoryRoomSource(sourceId, "@" + sourceId + ":x");
      List<InMemoryRoom> seeded = new ArrayList<>();
      for (int i = 0; i < 5; i++) {
        seeded.add(randomRoom(random, sourceId, "!" + i + ":x"));
      }
      source.seed(seeded);
      sources.add(source);
      coordinator.addSource(source);
    }
    assertConsistent(coordinator, replica, sources);

    for (int step = 0; step < 400; step++) {
      InMemoryRoomSource source = sources.get(random.nextInt(sources.size()));
      int action = random.nextInt(10);
      if (action < 6) {
        List<Room> rooms = new ArrayList<>(source.rooms());
        if (rooms.isEmpty()) continue;
        InMemoryRoom room = (InMemoryRoom) rooms.get(random.nextInt(rooms.size()));
        switch (action) {
          case 0 -> room.addTag(randomTag(random), randomOrder(random));
          case 1 -> room.removeTag(randomTag(random));
          case 2 -> room.setDirectChat(!room.isDirectChat());
          case 3 -> room.setTags(randomTags(random));
          case 4 -> room.setDisplayName("room " + step);
          default -> room.setUnread(random.nextInt(5), random.nextBoolean());
        }
      } else if (action == 6) {
        String roomId = "!" + random.nextInt(ROOM_IDS) + ":x";
        source.putRoom(randomRoom(random, source.id(), roomId));
      } else if (action == 7) {
        source.removeRoom("!" + random.nextInt(ROOM_IDS) + ":x");
      } else if (coordinator.sources().contains(source)) {
        if (action == 8) {
          coordinator.removeSource(source);
        } else {
          source.disconnect();
        }
      } else {
        coordinator.addSource(source);
      }
      assertConsistent(coordinator, replica, sources);
    }
  }

  private static void assertConsistent(
      RoomListCoordinator coordinator,
      RoomListReplica replica,
      List<InMemoryRoomSource> allSources) {
    RoomGroupIndex fresh = new RoomGroupIndex(coordinator.order());
    fresh.rebuildAll(coordinator.sources());
    assertEquals(fresh.captions(), coordinator.captions());
    assertEquals(fresh.layout(), coordinator.layout());

    assertEquals(coordinator.captions(), replica.captions());
    assertEquals(coordinator.layout(), replica.layout());
    assertEquals(0, replica.invalidDataChanges());

    for (int g = 0; g < coordinator.groupCount(); g++) {
      assertTrue(coordinator.roomCount(g) > 0);
    }
    for (InMemoryRoomSource source : allSources) {
      boolean attached = coordinator.sources().contains(source);
      for (Room room : source.rooms()) {
        assertEquals(attached, coordinator.isSubscribed(room.ref()), room.toString());
        if (!attached) continue;
        for (String caption : coordinator.order().groups(room)) {
          assertTrue(coordinator.locate(caption, room).isPresent(), room + " in " + caption);
        }
      }
    }
    int total = 0;
    for (RoomSource source : coordinator.sources()) total += source.roomCount();
    assertEquals(total, coordinator.totalRooms());
    assertFalse(coordinator.isTagUpdateInProgress());
  }

  private static InMemoryRoom randomRoom(Random random, String sourceId, String roomId) {
    InMemoryRoom room = new InMemoryRoom(sourceId, roomId);
    if (random.nextBoolean()) room.setTags(randomTags(random));
    if (random.nextInt(4) == 0) room.setDirectChat(true);
    return room;
  }

  private static String randomTag(Random random) {
    return TAGS.get(random.nextInt(TAGS.size()));
  }

  private static TagOrder randomOrder(Random random) {
    int pick = random.nextInt(4);
    return pick == 0 ? TagOrder.omitted() : TagOrder.of(pick);
  }

  private static Map<String, TagOrder> randomTags(Random random) {
    Map<String, TagOrder> tags = new LinkedHashMap<>();
    int count = random.nextInt(3);
    for (int i = 0; i < count; i++) {
      tags.put(randomTag(random), randomOrder(random));
    }
    return tags;
  }
}
