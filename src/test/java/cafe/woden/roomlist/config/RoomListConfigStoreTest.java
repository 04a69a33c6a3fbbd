package cafe.woden.roomlist.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.Yaml;

class RoomListConfigStoreTest {

  @TempDir Path tempDir;

  @Test
  void missingFileHasNoSavedOrder() {
    RoomListConfigStore store = new RoomListConfigStore(tempDir.resolve("none.yml").toString());

    assertTrue(store.readTagsOrder().isEmpty());
  }

  @Test
  void rememberedOrderIsReadBack() {
    Path file = tempDir.resolve("nested").resolve("roomlist.yml");
    RoomListConfigStore store = new RoomListConfigStore(file.toString());

    store.rememberTagsOrder(List.of("m.favourite", " u.* ", ""));

    assertTrue(Files.exists(file));
    assertEquals(Optional.of(List.of("m.favourite", "u.*")), store.readTagsOrder());
    assertEquals(
        Optional.of(List.of("m.favourite", "u.*")),
        new RoomListConfigStore(file.toString()).readTagsOrder());
  }

  @Test
  void otherSettingsInTheFileAreKept() throws Exception {
    Path file = tempDir.resolve("shared.yml");
    Files.writeString(
        file,
        "spring:\n  main:\n    banner-mode: off\nroomlist:\n  strict-integrity-checks: true\n",
        StandardCharsets.UTF_8);
    RoomListConfigStore store = new RoomListConfigStore(file.toString());

    store.rememberTagsOrder(List.of("u.*"));

    Map<String, Object> doc = new Yaml().load(Files.readString(file, StandardCharsets.UTF_8));
    assertTrue(doc.containsKey("spring"));
    @SuppressWarnings("unchecked")
    Map<String, Object> roomlist = (Map<String, Object>) doc.get("roomlist");
    assertEquals(true, roomlist.get("strict-integrity-checks"));
    assertEquals(List.of("u.*"), roomlist.get("tagsOrder"));
  }

  @Test
  void emptySavedOrderCountsAsMissing() throws Exception {
    Path file = tempDir.resolve("empty.yml");
    Files.writeString(file, "roomlist:\n  tagsOrder: []\n", StandardCharsets.UTF_8);

    assertTrue(new RoomListConfigStore(file.toString()).readTagsOrder().isEmpty());
  }

  @Test
  void unreadableFileIsIgnored() throws Exception {
    Path file = tempDir.resolve("broken.yml");
    Files.writeString(file, "roomlist: [unclosed\n", StandardCharsets.UTF_8);

    assertTrue(new RoomListConfigStore(file.toString()).readTagsOrder().isEmpty());
  }
}
