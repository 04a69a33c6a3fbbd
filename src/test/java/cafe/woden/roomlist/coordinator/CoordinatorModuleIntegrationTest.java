package cafe.woden.roomlist.coordinator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.roomlist.api.RoomListChange;
import cafe.woden.roomlist.config.RoomListConfigStore;
import cafe.woden.roomlist.config.RoomListProperties;
import cafe.woden.roomlist.model.InMemoryRoom;
import cafe.woden.roomlist.source.InMemoryRoomSource;
import io.reactivex.rxjava3.subscribers.TestSubscriber;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationContext;
import org.springframework.modulith.test.ApplicationModuleTest;
import org.springframework.test.context.TestPropertySource;

@ApplicationModuleTest(mode = ApplicationModuleTest.BootstrapMode.STANDALONE)
@TestPropertySource(
    properties = {
      "roomlist.runtime-config=target/tmp/modulith-tests/${random.uuid}/roomlist.yml",
      "roomlist.tags-order=u.*,m.favourite",
      "roomlist.strict-integrity-checks=true"
    })
class CoordinatorModuleIntegrationTest {

  @Autowired ApplicationContext applicationContext;
  @Autowired RoomListCoordinator coordinator;
  @Autowired RoomListProperties properties;

  @Test
  void exposesOneCoordinatorBoundToProperties() {
    assertEquals(1, applicationContext.getBeansOfType(RoomListCoordinator.class).size());
    assertEquals(1, applicationContext.getBeansOfType(RoomListConfigStore.class).size());
    assertTrue(properties.strictIntegrityChecksEnabled());
    assertEquals(List.of("u.*", "m.favourite"), coordinator.order().tagsOrder().patterns());
  }

  @Test
  void attachedSourceIsListedInConfiguredOrder() {
    InMemoryRoomSource source =
        new InMemoryRoomSource("context", "@me:x")
            .seed(
                List.of(
                    new InMemoryRoom("context", "!fav:x").addTag("m.favourite"),
                    new InMemoryRoom("context", "!work:x").addTag("u.work")));
    TestSubscriber<RoomListChange> changes = coordinator.changes().test();

    coordinator.addSource(source);
    try {
      assertEquals(List.of("u.work", "m.favourite"), coordinator.captions());
      changes.assertValue(new RoomListChange.FullReset());
    } finally {
      coordinator.removeSource(source);
    }
  }
}
