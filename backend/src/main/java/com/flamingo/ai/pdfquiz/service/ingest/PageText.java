package com.flamingo.ai.pdfquiz.service.ingest;

import com.flamingo.ai.pdfquiz.exception.EmptyPageRangeException;
import com.flamingo.ai.pdfquiz.exception.InvalidPageRangeException;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Extracted plain text of a PDF keyed by 1-based page number.
 *
 * <p>Pages that yielded no text, or whose extraction failed, hold a placeholder so their absence
 * stays visible downstream. Instances are immutable.
 */
public final class PageText {

  private final NavigableMap<Integer, String> pages;

  private PageText(NavigableMap<Integer, String> pages) {
    this.pages = Collections.unmodifiableNavigableMap(pages);
  }

  /** Copies the given page map, rejecting page numbers below 1. */
  public static PageText of(Map<Integer, String> pages) {
    TreeMap<Integer, String> copy = new TreeMap<>();
    for (Map.Entry<Integer, String> entry : pages.entrySet()) {
      if (entry.getKey() == null || entry.getKey() < 1) {
        throw new IllegalArgumentException("Page numbers are 1-based, got " + entry.getKey());
      }
      copy.put(entry.getKey(), entry.getValue() == null ? "" : entry.getValue());
    }
    return new PageText(copy);
  }

  public static String noTextPlaceholder(int page) {
    return "[Page " + page + " - No extractable text]";
  }

  public static String extractionFailedPlaceholder(int page) {
    return "[Page " + page + " - Text extraction failed]";
  }

  public SortedMap<Integer, String> pages() {
    return pages;
  }

  public int pageCount() {
    return pages.size();
  }

  public boolean isEmpty() {
    return pages.isEmpty();
  }

  public boolean contains(int page) {
    return pages.containsKey(page);
  }

  public String page(int page) {
    return pages.get(page);
  }

  /**
   * Restricts this map to {@code [start, end]} inclusive.
   *
   * @throws InvalidPageRangeException if {@code start < 1} or {@code end < start}
   * @throws EmptyPageRangeException if no page falls inside the range
   */
  public PageText range(int start, int end) {
    if (start < 1 || end < start) {
      throw new InvalidPageRangeException(start, end);
    }
    SortedMap<Integer, String> selected = pages.subMap(start, true, end, true);
    if (selected.isEmpty()) {
      throw new EmptyPageRangeException(start, end);
    }
    return new PageText(new TreeMap<>(selected));
  }
}
