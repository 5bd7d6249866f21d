package dev.bulletin.date;

import dev.bulletin.text.TextNormalizer;
import java.time.DateTimeException;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Parses a bulletin's primary date field and scans free text for year mentions.
 *
 * <p>{@link #parsePrimaryDate(String)} tries, in order: ISO-like dates with {@code -}, {@code /} or
 * {@code .} separators (and their year-month / year-only truncations), the kanji form {@code
 * YYYY年MM月DD日}, and era dates ({@code 令和}, {@code 平成}, {@code 昭和}). Anything else, including
 * out-of-range components, yields an empty result; no date is ever guessed.
 *
 * <p>{@link #extractYears(String)} is deliberately permissive and is only meant to widen year
 * filtering, never to establish a document's date.
 */
public final class DateExtractor {

  private static final Pattern ISO_LIKE =
      Pattern.compile("^(\\d{4})(?:([-/.])(\\d{1,2})(?:\\2(\\d{1,2}))?)?(?![\\d年])");

  private static final Pattern KANJI =
      Pattern.compile("(\\d{4})\\s*年(?:\\s*(\\d{1,2})\\s*月(?:\\s*(\\d{1,2})\\s*日)?)?");

  private static final Pattern ERA =
      Pattern.compile(
          "(令和|平成|昭和)\\s*(\\d{1,2}|元)\\s*年(?:\\s*(\\d{1,2})\\s*月(?:\\s*(\\d{1,2})\\s*日)?)?");

  private static final Pattern YEAR_TOKEN = Pattern.compile("(?<!\\d)(?:19|20|21)\\d{2}(?!\\d)");

  private DateExtractor() {
    // static utility
  }

  /**
   * Parses the primary date field of a bulletin.
   *
   * @param raw the raw date field (may be null)
   * @return the parsed date, or empty when the input is absent or not recognised
   */
  public static Optional<PrimaryDate> parsePrimaryDate(@Nullable String raw) {
    String text = TextNormalizer.normalize(raw);
    if (text.isEmpty()) {
      return Optional.empty();
    }

    Matcher iso = ISO_LIKE.matcher(text);
    if (iso.find()) {
      int year = Integer.parseInt(iso.group(1));
      if (iso.group(3) == null) {
        return validated(new PrimaryDate.YearOnly(year));
      }
      int month = Integer.parseInt(iso.group(3));
      if (iso.group(4) == null) {
        return validated(new PrimaryDate.YearMonth(year, month));
      }
      return validated(new PrimaryDate.ExactDate(year, month, Integer.parseInt(iso.group(4))));
    }

    Matcher kanji = KANJI.matcher(text);
    if (kanji.find()) {
      int year = Integer.parseInt(kanji.group(1));
      if (kanji.group(2) == null) {
        return validated(new PrimaryDate.YearOnly(year));
      }
      int month = Integer.parseInt(kanji.group(2));
      if (kanji.group(3) == null) {
        return validated(new PrimaryDate.YearMonth(year, month));
      }
      return validated(new PrimaryDate.ExactDate(year, month, Integer.parseInt(kanji.group(3))));
    }

    Matcher era = ERA.matcher(text);
    if (era.find()) {
      Optional<Era> label = Era.fromLabel(era.group(1));
      if (label.isEmpty()) {
        return Optional.empty();
      }
      int eraYear = "元".equals(era.group(2)) ? 1 : Integer.parseInt(era.group(2));
      if (eraYear < 1) {
        return Optional.empty();
      }
      int month = era.group(3) == null ? 1 : Integer.parseInt(era.group(3));
      int day = era.group(4) == null ? 1 : Integer.parseInt(era.group(4));
      return validated(new PrimaryDate.EraBased(label.get(), eraYear, month, day));
    }

    return Optional.empty();
  }

  /**
   * Collects every 4-digit 19xx/20xx/21xx token that is not part of a longer digit run.
   *
   * @param text free text (may be null)
   * @return an unmodifiable, ascending set of years
   */
  public static Set<Integer> extractYears(@Nullable String text) {
    String normalized = TextNormalizer.normalize(text);
    if (normalized.isEmpty()) {
      return Set.of();
    }
    Set<Integer> years = new TreeSet<>();
    Matcher matcher = YEAR_TOKEN.matcher(normalized);
    while (matcher.find()) {
      years.add(Integer.parseInt(matcher.group()));
    }
    return Collections.unmodifiableSet(years);
  }

  private static Optional<PrimaryDate> validated(PrimaryDate date) {
    try {
      date.toLocalDate();
      return Optional.of(date);
    } catch (DateTimeException e) {
      return Optional.empty();
    }
  }
}
