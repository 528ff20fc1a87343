package cafe.woden.relaybot.alias;

import java.util.Map;
import java.util.Objects;
import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Case-insensitive username to display-name table.
 *
 * <p>Chat servers preserve the case a user typed their name in, but {@code Steve} and {@code
 * steve} are the same person. Keys are compared under {@link CaseFolding}; at most one entry
 * exists per folded key and a later {@link #insert} for the same folded key replaces its value.
 *
 * <p>{@link #get} runs once per inbound message. It hashes the query in place and probes an
 * open-addressing table with that hash and {@link CaseFolding#equalsIgnoreCase}, so a lookup never
 * builds a lowercased key. {@code java.util.HashMap} cannot be probed that way, hence the table
 * here.
 *
 * <p>Not thread-safe for writes. Fill it during startup, then share it read-only.
 */
@ApplicationLayer
public final class UsernameAliases {

  private static final int INITIAL_CAPACITY = 16;

  private String[] keys;
  private String[] values;
  private int[] hashes;
  private int size;

  public UsernameAliases() {
    allocate(INITIAL_CAPACITY);
  }

  /** Build a table from {@code aliases}, inserting in iteration order. */
  public static UsernameAliases copyOf(Map<String, String> aliases) {
    UsernameAliases out = new UsernameAliases();
    if (aliases != null) {
      aliases.forEach(out::insert);
    }
    return out;
  }

  /**
   * Look up the display name for {@code key}.
   *
   * @return the aliased name, or {@code key} itself (same instance) when no alias matches
   */
  public String get(String key) {
    if (key == null || size == 0) return key;
    int slot = slotOf(key, spread(CaseFolding.hash(key)));
    return slot < 0 ? key : values[slot];
  }

  public void insert(String key, String value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");

    int h = spread(CaseFolding.hash(key));
    int mask = keys.length - 1;
    for (int i = h & mask; ; i = (i + 1) & mask) {
      String existing = keys[i];
      if (existing == null) {
        keys[i] = key;
        values[i] = value;
        hashes[i] = h;
        size++;
        if (size > threshold()) {
          resize();
        }
        return;
      }
      if (hashes[i] == h && CaseFolding.equalsIgnoreCase(existing, key)) {
        // The first spelling of the key stays; only the value changes.
        values[i] = value;
        return;
      }
    }
  }

  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  private int slotOf(String key, int h) {
    int mask = keys.length - 1;
    for (int i = h & mask; ; i = (i + 1) & mask) {
      String existing = keys[i];
      if (existing == null) return -1;
      if (hashes[i] == h && CaseFolding.equalsIgnoreCase(existing, key)) return i;
    }
  }

  // Load factor 0.75 keeps at least one empty slot, so probes always terminate.
  private int threshold() {
    return keys.length - (keys.length >>> 2);
  }

  private void resize() {
    String[] oldKeys = keys;
    String[] oldValues = values;
    int[] oldHashes = hashes;
    allocate(oldKeys.length << 1);

    int mask = keys.length - 1;
    for (int j = 0; j < oldKeys.length; j++) {
      if (oldKeys[j] == null) continue;
      int i = oldHashes[j] & mask;
      while (keys[i] != null) {
        i = (i + 1) & mask;
      }
      keys[i] = oldKeys[j];
      values[i] = oldValues[j];
      hashes[i] = oldHashes[j];
    }
  }

  private void allocate(int capacity) {
    keys = new String[capacity];
    values = new String[capacity];
    hashes = new int[capacity];
  }

  private static int spread(int h) {
    return h ^ (h >>> 16);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("UsernameAliases{");
    boolean first = true;
    for (int i = 0; i < keys.length; i++) {
      if (keys[i] == null) continue;
      if (!first) sb.append(", ");
      sb.append(keys[i]).append('=').append(values[i]);
      first = false;
    }
    return sb.append('}').toString();
  }
}
