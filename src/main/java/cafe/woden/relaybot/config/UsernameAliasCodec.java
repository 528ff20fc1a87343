package cafe.woden.relaybot.config;

import cafe.woden.relaybot.alias.UsernameAliases;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Decodes {@code relaybot.username-aliases}: a JSON object of username to display name.
 *
 * <p>Entries are inserted in document order, so when two keys differ only in case (or repeat
 * exactly) the later one wins. The object is read token by token because a tree model would merge
 * a repeated key into its first position.
 */
public final class UsernameAliasCodec {

  private static final String PROPERTY = "relaybot.username-aliases";

  private static final JsonFactory JSON = new JsonFactory();

  private UsernameAliasCodec() {}

  /**
   * @throws IllegalArgumentException if {@code json} is not a JSON object of strings
   */
  public static UsernameAliases decode(String json) {
    try (JsonParser p = JSON.createParser(json)) {
      if (p.nextToken() != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException(PROPERTY + " should be a JSON object");
      }

      UsernameAliases aliases = new UsernameAliases();
      while (p.nextToken() == JsonToken.FIELD_NAME) {
        String name = p.currentName();
        if (p.nextToken() != JsonToken.VALUE_STRING) {
          throw new IllegalArgumentException(
              PROPERTY + ": alias for '" + name + "' should be a string");
        }
        aliases.insert(name, p.getText());
      }

      if (p.nextToken() != null) {
        throw new IllegalArgumentException(PROPERTY + " has trailing content after the object");
      }
      return aliases;
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
          PROPERTY + " should be valid JSON: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new UncheckedIOException("Could not read " + PROPERTY, e);
    }
  }
}
