package dev.bulletin.text;

import java.text.Normalizer;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Static utility for the canonical text forms every other component compares against.
 *
 * <ul>
 *   <li>{@link #normalize(String)} - NFKC, full-width space to half-width, whitespace runs
 *       collapsed to one space, trimmed
 *   <li>{@link #foldKana(String)} - {@code normalize} plus katakana to hiragana, small kana to
 *       base kana, long-vowel mark resolved to the preceding vowel, voicing marks stripped and
 *       ASCII lower-cased
 *   <li>{@link #displayForm(String)} - NFKC with line breaks kept, used for rendering excerpts
 * </ul>
 *
 * <p>All functions are pure, total and idempotent; {@code null} yields the empty string.
 */
public final class TextNormalizer {

  private static final Pattern WHITESPACE_RUN =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern INLINE_SPACE_RUN = Pattern.compile("[ \\t\\u3000\\u00A0]+");
  private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

  private static final char LONG_VOWEL_MARK = 'ー';
  private static final char KATAKANA_FIRST = 'ァ';
  private static final char KATAKANA_LAST = 'ヶ';
  private static final char HIRAGANA_FIRST = 'ぁ';
  private static final char HIRAGANA_LAST = 'ゖ';
  private static final int KANA_OFFSET = 0x60;

  private static final Map<Character, Character> SMALL_TO_BASE =
      Map.ofEntries(
          Map.entry('ぁ', 'あ'),
          Map.entry('ぃ', 'い'),
          Map.entry('ぅ', 'う'),
          Map.entry('ぇ', 'え'),
          Map.entry('ぉ', 'お'),
          Map.entry('っ', 'つ'),
          Map.entry('ゃ', 'や'),
          Map.entry('ゅ', 'ゆ'),
          Map.entry('ょ', 'よ'),
          Map.entry('ゎ', 'わ'),
          Map.entry('ゕ', 'か'),
          Map.entry('ゖ', 'け'));

  private static final Map<Character, Character> VOWEL_OF = buildVowelTable();

  private TextNormalizer() {
    // static utility
  }

  /**
   * Canonical search form: NFKC, whitespace collapsed, trimmed.
   *
   * @param text the raw text (may be null)
   * @return the normalized text, never null
   */
  public static String normalize(@Nullable String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    String nfkc = Normalizer.normalize(text, Normalizer.Form.NFKC).replace('　', ' ');
    return WHITESPACE_RUN.matcher(nfkc).replaceAll(" ").strip();
  }

  /**
   * Kana-folded form of {@link #normalize(String)} so that orthographic variants of the same word
   * compare equal.
   *
   * @param text the raw text (may be null)
   * @return the folded text, never null
   */
  public static String foldKana(@Nullable String text) {
    String normalized = normalize(text);
    if (normalized.isEmpty()) {
      return "";
    }
    StringBuilder out = new StringBuilder(normalized.length());
    for (int i = 0; i < normalized.length(); i++) {
      char c = normalized.charAt(i);
      if (c == '゙' || c == '゚' || c == '゛' || c == '゜') {
        continue;
      }
      if (c == LONG_VOWEL_MARK) {
        Character vowel = out.length() == 0 ? null : VOWEL_OF.get(out.charAt(out.length() - 1));
        out.append(vowel != null ? vowel : c);
        continue;
      }
      char folded = toHiragana(c);
      folded = SMALL_TO_BASE.getOrDefault(folded, folded);
      if (folded >= 'A' && folded <= 'Z') {
        folded = (char) (folded + ('a' - 'A'));
      }
      out.append(folded);
    }
    // a stripped standalone voicing mark can leave a dangling space behind
    return WHITESPACE_RUN.matcher(out).replaceAll(" ").strip();
  }

  /**
   * Hiragana to katakana, leaving every other character untouched.
   *
   * @param text the text to convert (may be null)
   * @return the converted text, never null
   */
  public static String toKatakana(@Nullable String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    StringBuilder out = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      out.append(c >= HIRAGANA_FIRST && c <= HIRAGANA_LAST ? (char) (c + KANA_OFFSET) : c);
    }
    return out.toString();
  }

  /**
   * Display form for excerpts: NFKC, line breaks unified to {@code \n} and kept (at most one blank
   * line in a row), inline whitespace runs collapsed, trimmed.
   *
   * @param text the raw text (may be null)
   * @return the display text, never null
   */
  public static String displayForm(@Nullable String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    String nfkc = Normalizer.normalize(text, Normalizer.Form.NFKC);
    String unified = nfkc.replace("\r\n", "\n").replace('\r', '\n');
    String collapsed = INLINE_SPACE_RUN.matcher(unified).replaceAll(" ");
    return EXCESS_BLANK_LINES.matcher(collapsed).replaceAll("\n\n").strip();
  }

  private static char toHiragana(char c) {
    if (c >= KATAKANA_FIRST && c <= KATAKANA_LAST) {
      return (char) (c - KANA_OFFSET);
    }
    return c;
  }

  private static Map<Character, Character> buildVowelTable() {
    Map<Character, Character> table = new HashMap<>();
    register(table, 'あ', "あかがさざただなはばぱまやらわ");
    register(table, 'い', "いきぎしじちぢにひびぴみりゐ");
    register(table, 'う', "うくぐすずつづぬふぶぷむゆるゔ");
    register(table, 'え', "えけげせぜてでねへべぺめれゑ");
    register(table, 'お', "おこごそぞとどのほぼぽもよろを");
    return Map.copyOf(table);
  }

  private static void register(Map<Character, Character> table, char vowel, String row) {
    for (int i = 0; i < row.length(); i++) {
      table.put(row.charAt(i), vowel);
    }
  }
}
