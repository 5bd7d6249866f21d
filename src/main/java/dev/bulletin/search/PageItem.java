package dev.bulletin.search;

import java.time.LocalDate;
import org.jspecify.annotations.Nullable;

/**
 * One rendered result on a page.
 *
 * @param rank 1-based position in the full deduplicated, sorted result list
 * @param docId the document identity
 * @param titleHtml escaped, highlighted title
 * @param contentHtml escaped, highlighted excerpt
 * @param url the document URL, if any
 * @param date the primary date field as ingested
 * @param datePrimary the parsed primary date
 */
public record PageItem(
    int rank,
    String docId,
    String titleHtml,
    String contentHtml,
    @Nullable String url,
    @Nullable String date,
    @Nullable LocalDate datePrimary) {}
