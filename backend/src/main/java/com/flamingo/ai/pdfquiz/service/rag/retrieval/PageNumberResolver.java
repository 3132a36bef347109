package com.flamingo.ai.pdfquiz.service.rag.retrieval;

import com.flamingo.ai.pdfquiz.service.rag.retrieval.ResolvedPage.PageSource;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Reads a chunk's page number from stored metadata written under either layout.
 *
 * <p>The current {@code page_number} field wins; otherwise the first parsable entry of the legacy
 * {@code pages} list is used. A chunk for which neither yields a positive integer is unresolvable.
 */
public final class PageNumberResolver {

  static final String CURRENT_FIELD = "page_number";
  static final String LEGACY_FIELD = "pages";

  private PageNumberResolver() {}

  public static Optional<ResolvedPage> resolve(Map<String, Object> metadata) {
    if (metadata == null) {
      return Optional.empty();
    }
    for (PageSource source : PageSource.values()) {
      OptionalInt page = read(source, metadata);
      if (page.isPresent()) {
        return Optional.of(new ResolvedPage(page.getAsInt(), source));
      }
    }
    return Optional.empty();
  }

  private static OptionalInt read(PageSource source, Map<String, Object> metadata) {
    switch (source) {
      case CURRENT:
        return readCurrent(metadata.get(CURRENT_FIELD));
      case LEGACY:
        return readLegacy(metadata.get(LEGACY_FIELD));
      default:
        return OptionalInt.empty();
    }
  }

  private static OptionalInt readCurrent(Object value) {
    if (value instanceof Number n) {
      return positive(n.intValue());
    }
    if (value instanceof String s) {
      return parse(s);
    }
    return OptionalInt.empty();
  }

  private static OptionalInt readLegacy(Object value) {
    if (value == null) {
      return OptionalInt.empty();
    }
    String pages = value.toString();
    if (pages.isBlank()) {
      return OptionalInt.empty();
    }
    if (!pages.contains(",")) {
      return parse(pages);
    }
    for (String part : pages.split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty() && trimmed.chars().allMatch(Character::isDigit)) {
        return parse(trimmed);
      }
    }
    return OptionalInt.empty();
  }

  private static OptionalInt parse(String text) {
    try {
      return positive(Integer.parseInt(text.trim()));
    } catch (NumberFormatException e) {
      return OptionalInt.empty();
    }
  }

  private static OptionalInt positive(int page) {
    return page >= 1 ? OptionalInt.of(page) : OptionalInt.empty();
  }
}
