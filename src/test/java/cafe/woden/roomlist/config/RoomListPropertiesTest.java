package cafe.woden.roomlist.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class RoomListPropertiesTest {

  @Test
  void missingValuesFallBack() {
    RoomListProperties props = new RoomListProperties(null, null);

    assertEquals(List.of(), props.tagsOrder());
    assertFalse(props.strictIntegrityChecksEnabled());
  }

  @Test
  void strictChecksAreOptIn() {
    assertTrue(new RoomListProperties(List.of("u.*"), true).strictIntegrityChecksEnabled());
    assertFalse(new RoomListProperties(List.of("u.*"), false).strictIntegrityChecksEnabled());
  }
}
