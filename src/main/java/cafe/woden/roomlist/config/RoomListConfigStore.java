package cafe.woden.roomlist.config;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jmolecules.architecture.layered.InfrastructureLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads and writes runtime room list settings in a YAML file.
 *
 * <p>The file is shared with other settings, so every write loads the current document, updates
 * only the {@code roomlist} keys it owns and writes the whole document back. I/O failures are
 * logged and otherwise ignored.
 */
@Component
@InfrastructureLayer
public class RoomListConfigStore {

  private static final Logger log = LoggerFactory.getLogger(RoomListConfigStore.class);

  private static final String ROOT_KEY = "roomlist";
  private static final String TAGS_ORDER_KEY = "tagsOrder";

  private final Path file;
  private final Yaml yaml;

  public RoomListConfigStore(
      @Value("${roomlist.runtime-config:${user.home}/.config/roomlist/roomlist.yml}")
          String filePath) {
    this.file = Paths.get(Objects.requireNonNullElse(filePath, "").trim());

    DumperOptions opts = new DumperOptions();
    opts.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    opts.setPrettyFlow(true);
    opts.setIndent(2);
    // SnakeYAML requires indicatorIndent < indent.
    opts.setIndicatorIndent(1);
    opts.setDefaultScalarStyle(DumperOptions.ScalarStyle.PLAIN);
    this.yaml = new Yaml(opts);
  }

  public Path runtimeConfigPath() {
    return file;
  }

  /** Saved tag order, if the runtime file has a non-empty one. */
  public synchronized Optional<List<String>> readTagsOrder() {
    try {
      if (file.toString().isBlank()) return Optional.empty();
      if (!Files.exists(file)) return Optional.empty();

      Map<String, Object> doc = loadFile();
      Object rootObj = doc.get(ROOT_KEY);
      if (!(rootObj instanceof Map<?, ?> root)) return Optional.empty();

      Object v = root.get(TAGS_ORDER_KEY);
      if (!(v instanceof List<?> list)) return Optional.empty();

      List<String> out = new ArrayList<>();
      for (Object o : list) {
        String s = Objects.toString(o, "").trim();
        if (!s.isEmpty()) out.add(s);
      }
      return out.isEmpty() ? Optional.empty() : Optional.of(List.copyOf(out));
    } catch (Exception e) {
      log.warn("[roomlist] Could not read tags order from '{}'", file, e);
      return Optional.empty();
    }
  }

  public synchronized void rememberTagsOrder(List<String> tagsOrder) {
    try {
      if (file.toString().isBlank()) return;

      Map<String, Object> doc = Files.exists(file) ? loadFile() : new LinkedHashMap<>();
      Map<String, Object> root = getOrCreateMap(doc, ROOT_KEY);

      List<String> out = new ArrayList<>();
      if (tagsOrder != null) {
        for (String s : tagsOrder) {
          String t = Objects.toString(s, "").trim();
          if (!t.isEmpty()) out.add(t);
        }
      }
      root.put(TAGS_ORDER_KEY, out);
      writeFile(doc);
    } catch (Exception e) {
      log.warn("[roomlist] Could not persist tags order to '{}'", file, e);
    }
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> loadFile() throws IOException {
    try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      Object o = yaml.load(r);
      if (o instanceof Map<?, ?> m) {
        return (Map<String, Object>) m;
      }
      return new LinkedHashMap<>();
    }
  }

  private void writeFile(Map<String, Object> doc) throws IOException {
    Path parent = file.getParent();
    if (parent != null && !Files.exists(parent)) {
      Files.createDirectories(parent);
    }
    try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      yaml.dump(doc, w);
    }
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> getOrCreateMap(Map<String, Object> parent, String key) {
    Object o = parent.get(key);
    if (o instanceof Map<?, ?> m) return (Map<String, Object>) m;
    Map<String, Object> created = new LinkedHashMap<>();
    parent.put(key, created);
    return created;
  }
}
