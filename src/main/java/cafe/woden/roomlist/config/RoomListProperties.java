package cafe.woden.roomlist.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Room list configuration.
 *
 * <p>Stored under {@code roomlist}. The tag order chosen at runtime is persisted to the runtime
 * YAML via {@link RoomListConfigStore}, which takes precedence over {@code tagsOrder} here.
 *
 * @param tagsOrder group caption priority list; exact captions or namespace wildcards such as
 *     {@code u.*}. Empty means the built-in default order.
 * @param strictIntegrityChecks when true, index integrity violations throw instead of being logged
 *     and skipped. Meant for tests and development builds.
 */
@ConfigurationProperties(prefix = "roomlist")
public record RoomListProperties(List<String> tagsOrder, Boolean strictIntegrityChecks) {

  public RoomListProperties {
    tagsOrder = (tagsOrder == null) ? List.of() : List.copyOf(tagsOrder);
  }

  public boolean strictIntegrityChecksEnabled() {
    return Boolean.TRUE.equals(strictIntegrityChecks);
  }
}
