package cafe.woden.relaybot.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import cafe.woden.relaybot.routing.RoomConfiguration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProjectConfigurationCodecTest {

  @Test
  void decodesAllFieldsAndDefaultsMissingLists() {
    Map<String, RoomConfiguration> projects =
        ProjectConfigurationCodec.decode(
            """
            {
              "Proj": {"rooms": ["a", "b"], "secret": "s1"},
              "Simple": {"simple_rooms": ["c"]},
              "Quiet": {"rooms": [], "simple_rooms": [], "secret": "s2"}
            }
            """);

    assertThat(projects).containsOnlyKeys("Proj", "Simple", "Quiet");
    assertThat(projects.get("Proj"))
        .isEqualTo(new RoomConfiguration(List.of("a", "b"), List.of(), "s1"));
    assertThat(projects.get("Simple"))
        .isEqualTo(new RoomConfiguration(List.of(), List.of("c"), null));
    assertThat(projects.get("Quiet").isSilent()).isTrue();
    assertThat(projects.get("Quiet").secretOverride()).contains("s2");
  }

  @Test
  void emptyObjectMeansNoProjects() {
    assertThat(ProjectConfigurationCodec.decode("{}")).isEmpty();
  }

  @Test
  void explicitNullSecretMeansNoOverride() {
    Map<String, RoomConfiguration> projects =
        ProjectConfigurationCodec.decode("{\"P\": {\"rooms\": [\"a\"], \"secret\": null}}");

    assertThat(projects.get("P").secretOverride()).isEmpty();
  }

  @Test
  void unknownFieldsAreRejected() {
    assertThatThrownBy(() -> ProjectConfigurationCodec.decode("{\"P\": {\"room\": [\"a\"]}}"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("relaybot.project-configuration should be valid JSON");
  }

  @Test
  void malformedJsonIsRejected() {
    assertThatThrownBy(() -> ProjectConfigurationCodec.decode("{\"P\": {\"rooms\": [\"a\"]"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("should be valid JSON");
    assertThatThrownBy(() -> ProjectConfigurationCodec.decode("{} {}"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void nonObjectDocumentsAreRejected() {
    assertThatThrownBy(() -> ProjectConfigurationCodec.decode("[]"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ProjectConfigurationCodec.decode("null"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("should be a JSON object");
    assertThatThrownBy(() -> ProjectConfigurationCodec.decode("{\"P\": {\"rooms\": \"a\"}}"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void nonStringSecretsAreRejected() {
    assertThatThrownBy(
            () -> ProjectConfigurationCodec.decode("{\"P\": {\"rooms\": [\"a\"], \"secret\": 5}}"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("should be valid JSON");
    assertThatThrownBy(() -> ProjectConfigurationCodec.decode("{\"P\": {\"secret\": 1.5}}"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ProjectConfigurationCodec.decode("{\"P\": {\"secret\": true}}"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void nonStringRoomsAreRejected() {
    assertThatThrownBy(() -> ProjectConfigurationCodec.decode("{\"P\": {\"rooms\": [1, true]}}"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("should be valid JSON");
    assertThatThrownBy(
            () -> ProjectConfigurationCodec.decode("{\"P\": {\"simple_rooms\": [\"a\", false]}}"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ProjectConfigurationCodec.decode("{\"P\": {\"rooms\": [2.5]}}"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void explicitNullRoomListsAreRejected() {
    assertThatThrownBy(() -> ProjectConfigurationCodec.decode("{\"P\": {\"rooms\": null}}"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("rooms for 'P' is null");
    assertThatThrownBy(
            () -> ProjectConfigurationCodec.decode("{\"P\": {\"rooms\": [\"a\"], \"simple_rooms\": null}}"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("simple_rooms for 'P' is null");
  }

  @Test
  void nullEntriesAndBlankValuesAreRejected() {
    assertThatThrownBy(() -> ProjectConfigurationCodec.decode("{\"P\": null}"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("'P' is null");
    assertThatThrownBy(() -> ProjectConfigurationCodec.decode("{\"P\": {\"rooms\": [null]}}"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("rooms for 'P'");
    assertThatThrownBy(() -> ProjectConfigurationCodec.decode("{\"P\": {\"simple_rooms\": [\" \"]}}"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("simple_rooms for 'P'");
    assertThatThrownBy(() -> ProjectConfigurationCodec.decode("{\"P\": {\"secret\": \"\"}}"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("secret for 'P' is blank");
  }
}
