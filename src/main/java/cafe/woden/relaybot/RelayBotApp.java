package cafe.woden.relaybot;

import cafe.woden.relaybot.config.RelayBotProperties;
import cafe.woden.relaybot.routing.RoomResolver;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.modulith.Modulithic;

@SpringBootApplication
@Modulithic(systemName = "RelayBot", sharedModules = {"config"})
@EnableConfigurationProperties(RelayBotProperties.class)
public class RelayBotApp {
  private static final Logger log = LoggerFactory.getLogger(RelayBotApp.class);

  public static void main(String[] args) {
    new SpringApplicationBuilder(RelayBotApp.class).web(WebApplicationType.NONE).run(args);
  }

  @Bean
  public ApplicationRunner announceRouting(RoomResolver rooms, RelayBotProperties props) {
    return args -> {
      List<String> joins = new ArrayList<>(rooms.allRooms());
      Collections.sort(joins);
      log.info("[relaybot] Rooms to join on {}: {}", props.server(), joins);
      log.info("[relaybot] Webhook port: {}", props.port());
      if (props.githubApi().isConfigured()) {
        log.info("[relaybot] GitHub API enabled for user {}", props.githubApi().user());
      } else {
        log.info("[relaybot] GitHub API disabled");
      }
    };
  }
}
