package dev.bulletin.query;

import static org.assertj.core.api.Assertions.assertThat;

import dev.bulletin.synonym.SynonymTable;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class QueryParserTest {

  private final SynonymTable synonyms =
      SynonymTable.builder().add("苔", "コケ").add("苔", "こけ").build();

  @Test
  void blankQueryIsEmpty() {
    assertThat(QueryParser.parse(null, synonyms).isEmpty()).isTrue();
    assertThat(QueryParser.parse("  　 ", synonyms).isEmpty()).isTrue();
  }

  @Test
  void eachWordBecomesARequiredGroup() {
    StructuredQuery query = QueryParser.parse("盆栽 剪定", SynonymTable.empty());

    assertThat(query.andGroups()).containsExactly(List.of("盆栽"), List.of("剪定"));
    assertThat(query.notGroups()).isEmpty();
  }

  @Test
  void termExpandsToFoldedKatakanaAndSynonymForms() {
    StructuredQuery query = QueryParser.parse("こけ", synonyms);

    assertThat(query.andGroups()).hasSize(1);
    assertThat(query.andGroups().get(0)).contains("こけ", "コケ", "苔");
    assertThat(query.highlightTerms()).contains("こけ", "コケ", "苔");
  }

  @Nested
  class Years {

    @Test
    void trailingYearBecomesSingleYearFilter() {
      StructuredQuery query = QueryParser.parse("総会 2019", synonyms);

      assertThat(query.year()).isEqualTo(2019);
      assertThat(query.yearFilter()).contains(YearFilter.single(2019));
      assertThat(query.andGroups()).hasSize(1);
    }

    @Test
    void trailingRangeBecomesRangeFilter() {
      StructuredQuery query = QueryParser.parse("剪定 1999-2001", synonyms);

      assertThat(query.yearRange()).isEqualTo(new YearFilter(1999, 2001));
      assertThat(query.andGroups()).hasSize(1);
    }

    @Test
    void rangeSeparatorsIncludeWaveDashAndDoubleDot() {
      assertThat(QueryParser.parse("剪定 2001〜1999", synonyms).yearRange())
          .isEqualTo(new YearFilter(1999, 2001));
      assertThat(QueryParser.parse("剪定 1999..2001", synonyms).yearRange())
          .isEqualTo(new YearFilter(1999, 2001));
    }

    @Test
    void yearOnlyQueryHasNothingToMatch() {
      StructuredQuery query = QueryParser.parse("2019", synonyms);

      assertThat(query.isEmpty()).isTrue();
      assertThat(query.year()).isEqualTo(2019);
    }

    @Test
    void yearInTheMiddleIsAnOrdinaryTerm() {
      StructuredQuery query = QueryParser.parse("2019 総会", synonyms);

      assertThat(query.yearFilter()).isEmpty();
      assertThat(query.andGroups()).hasSize(2);
    }

    @Test
    void explicitYearOverridesParsedRange() {
      StructuredQuery query =
          QueryParser.parse("剪定 1999-2001", synonyms).withYearOverride(2010, null, null);

      assertThat(query.yearFilter()).contains(YearFilter.single(2010));
    }

    @Test
    void openBoundOverrideKeepsOtherSideUnbounded() {
      StructuredQuery query =
          QueryParser.parse("剪定", synonyms).withYearOverride(null, 2015, null);

      assertThat(query.yearFilter().orElseThrow().matches(2015)).isTrue();
      assertThat(query.yearFilter().orElseThrow().matches(2099)).isTrue();
      assertThat(query.yearFilter().orElseThrow().matches(2014)).isFalse();
    }
  }

  @Nested
  class Operators {

    @Test
    void minusPrefixExcludesTerm() {
      StructuredQuery query = QueryParser.parse("盆栽 -松", SynonymTable.empty());

      assertThat(query.andGroups()).hasSize(1);
      assertThat(query.notGroups()).hasSize(1);
      assertThat(query.notGroups().get(0)).contains("松");
      assertThat(query.highlightTerms()).doesNotContain("松");
    }

    @Test
    void loneMinusIsIgnored() {
      assertThat(QueryParser.parse("盆栽 -", SynonymTable.empty()).notGroups()).isEmpty();
    }

    @Test
    void quotedTextIsAPhraseAndItsWordsAreRequired() {
      StructuredQuery query = QueryParser.parse("\"春の 例会\"", SynonymTable.empty());

      assertThat(query.phrases()).containsExactly("春の 例会");
      assertThat(query.andGroups()).hasSize(2);
      assertThat(query.highlightTerms()).contains("春の 例会", "春の", "例会");
    }

    @Test
    void curlyQuotesAreRecognised() {
      StructuredQuery query = QueryParser.parse("“苔玉作り”", SynonymTable.empty());

      assertThat(query.phrases()).containsExactly("苔玉作り");
    }

    @Test
    void unterminatedQuoteRunsToEnd() {
      StructuredQuery query = QueryParser.parse("盆栽 \"春の例会", SynonymTable.empty());

      assertThat(query.phrases()).containsExactly("春の例会");
    }

    @Test
    void negatedPhraseIsExcluded() {
      StructuredQuery query = QueryParser.parse("盆栽 -\"松の剪定\"", SynonymTable.empty());

      assertThat(query.phrases()).isEmpty();
      assertThat(query.notGroups()).containsExactly(List.of("松の剪定"));
    }

    @Test
    void pipeSeparatesAlternativesInOneGroup() {
      StructuredQuery query = QueryParser.parse("盆栽|苔", synonyms);

      assertThat(query.andGroups()).hasSize(1);
      assertThat(query.andGroups().get(0)).contains("盆栽", "苔", "コケ");
    }

    @Test
    void resultSuffixSplitsIntoTwoGroups() {
      StructuredQuery query = QueryParser.parse("選挙結果", SynonymTable.empty());

      assertThat(query.andGroups()).hasSize(2);
      assertThat(query.andGroups().get(0)).contains("選挙");
      assertThat(query.andGroups().get(1)).contains("結果");
    }

    @Test
    void bareResultIsAnOrdinaryTerm() {
      assertThat(QueryParser.parse("結果", SynonymTable.empty()).andGroups()).hasSize(1);
    }
  }
}
