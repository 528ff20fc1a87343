package cafe.woden.relaybot.alias;

/**
 * Case-insensitive hashing and comparison that work on the borrowed characters, without building
 * a lowercased copy.
 *
 * <p>Both operations fold each code point with {@link #fold(int)}, so {@code equalsIgnoreCase(a,
 * b)} implies {@code hash(a) == hash(b)}.
 */
public final class CaseFolding {

  private CaseFolding() {}

  /** Simple (single code point) case fold. */
  public static int fold(int codePoint) {
    return Character.toLowerCase(Character.toUpperCase(codePoint));
  }

  public static int hash(CharSequence s) {
    int h = 0;
    int len = s.length();
    for (int i = 0; i < len; ) {
      int cp = Character.codePointAt(s, i);
      h = 31 * h + fold(cp);
      i += Character.charCount(cp);
    }
    return h;
  }

  public static boolean equalsIgnoreCase(CharSequence a, CharSequence b) {
    if (a == b) return true;
    if (a == null || b == null) return false;
    int lenA = a.length();
    int lenB = b.length();
    int i = 0;
    int j = 0;
    while (i < lenA && j < lenB) {
      int cpA = Character.codePointAt(a, i);
      int cpB = Character.codePointAt(b, j);
      if (cpA != cpB && fold(cpA) != fold(cpB)) return false;
      i += Character.charCount(cpA);
      j += Character.charCount(cpB);
    }
    return i == lenA && j == lenB;
  }
}
