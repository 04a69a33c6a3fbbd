package cafe.woden.roomlist;

import cafe.woden.roomlist.config.RoomListProperties;
import cafe.woden.roomlist.coordinator.RoomListCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(
    systemName = "Room list",
    sharedModules = {"config", "model"})
@EnableConfigurationProperties({RoomListProperties.class})
public class RoomListApp {
  private static final Logger log = LoggerFactory.getLogger(RoomListApp.class);

  public static void main(String[] args) {
    new SpringApplicationBuilder(RoomListApp.class).headless(true).run(args);
  }

  @Bean
  public ApplicationRunner logRoomListReady(RoomListCoordinator coordinator) {
    return args ->
        log.info(
            "[roomlist] Room list ready: {} ({} source(s) attached)",
            coordinator.order(),
            coordinator.sources().size());
  }
}
