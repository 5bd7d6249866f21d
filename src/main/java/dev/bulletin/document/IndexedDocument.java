package dev.bulletin.document;

import dev.bulletin.date.DateExtractor;
import dev.bulletin.date.PrimaryDate;
import dev.bulletin.text.TextNormalizer;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.jspecify.annotations.Nullable;

/**
 * A {@link Document} plus every field derived from it at load time. Instances are immutable and
 * shared by all queries against the snapshot that holds them.
 *
 * <p>{@code years} is the union of the primary date's year and every 19xx/20xx/21xx token in the
 * title, body and URL. It widens year filtering only and never feeds ranking; {@code datePrimary}
 * comes from the date field alone.
 */
public final class IndexedDocument {

  private final Document document;
  private final String docId;
  private final Map<WeightedField, FieldText> fields;
  private final String displayBody;
  private final @Nullable LocalDate datePrimary;
  private final Set<Integer> years;

  private IndexedDocument(
      Document document,
      String docId,
      Map<WeightedField, FieldText> fields,
      String displayBody,
      @Nullable LocalDate datePrimary,
      Set<Integer> years) {
    this.document = document;
    this.docId = docId;
    this.fields = fields;
    this.displayBody = displayBody;
    this.datePrimary = datePrimary;
    this.years = years;
  }

  /**
   * Derives all comparison forms of a document.
   *
   * @param document the ingested document
   * @param foldBodyLimit maximum number of body characters to kana-fold
   * @return the indexed document
   */
  public static IndexedDocument from(Document document, int foldBodyLimit) {
    Map<WeightedField, FieldText> fields = new EnumMap<>(WeightedField.class);
    fields.put(WeightedField.TITLE, FieldText.of(document.title()));
    fields.put(WeightedField.BODY, FieldText.ofBounded(document.body(), foldBodyLimit));
    fields.put(WeightedField.AUTHOR, FieldText.of(document.author()));
    fields.put(WeightedField.ISSUE, FieldText.of(document.issue()));
    fields.put(WeightedField.CATEGORY, FieldText.of(document.category()));
    fields.put(WeightedField.DATE, FieldText.of(document.dateRaw()));

    LocalDate datePrimary =
        DateExtractor.parsePrimaryDate(document.dateRaw())
            .map(PrimaryDate::toLocalDate)
            .orElse(null);

    Set<Integer> years = new TreeSet<>();
    if (datePrimary != null) {
      years.add(datePrimary.getYear());
    }
    years.addAll(DateExtractor.extractYears(document.title()));
    years.addAll(DateExtractor.extractYears(document.body()));
    years.addAll(DateExtractor.extractYears(document.url()));

    return new IndexedDocument(
        document,
        DocumentIdentity.docId(document),
        Collections.unmodifiableMap(fields),
        TextNormalizer.displayForm(document.body()),
        datePrimary,
        Collections.unmodifiableSet(years));
  }

  public Document document() {
    return document;
  }

  public String docId() {
    return docId;
  }

  public FieldText field(WeightedField field) {
    return fields.get(field);
  }

  public FieldText title() {
    return fields.get(WeightedField.TITLE);
  }

  public FieldText body() {
    return fields.get(WeightedField.BODY);
  }

  /** Body text for excerpts, line breaks kept. */
  public String displayBody() {
    return displayBody;
  }

  public Optional<LocalDate> datePrimary() {
    return Optional.ofNullable(datePrimary);
  }

  public Set<Integer> years() {
    return years;
  }

  @Override
  public String toString() {
    return "IndexedDocument[" + docId + "]";
  }
}
