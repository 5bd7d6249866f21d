package dev.bulletin.snippet;

/**
 * Display strings for one result. Both are HTML-escaped; matched terms are wrapped in {@code
 * <mark>}.
 *
 * @param titleHtml the highlighted title
 * @param contentHtml the highlighted excerpt, with a leading or trailing ellipsis where cut
 */
public record RenderedSnippet(String titleHtml, String contentHtml) {}
