package dev.bulletin.synonym;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

/**
 * Loads the {@code canonical,variant} synonym list.
 *
 * <p>Reads the configured file when it exists, otherwise the bundled {@code synonyms.csv} classpath
 * resource. A missing or unreadable source never fails the caller: it degrades to {@link
 * SynonymTable#empty()}. Blank lines, {@code #} comments, a {@code canonical,variant} header and
 * rows without exactly two non-blank columns are skipped.
 */
@Component
public class SynonymLoader {

  private static final Logger log = LoggerFactory.getLogger(SynonymLoader.class);

  static final String BUNDLED_RESOURCE = "synonyms.csv";

  private final String bundledResource;

  public SynonymLoader() {
    this(BUNDLED_RESOURCE);
  }

  SynonymLoader(String bundledResource) {
    this.bundledResource = bundledResource;
  }

  /**
   * Loads the synonym table from {@code file}, falling back to the bundled resource.
   *
   * @param file the configured synonym file (may be null or missing)
   * @return the loaded table, or an empty table when nothing could be read
   */
  public SynonymTable load(@Nullable Path file) {
    if (file != null && Files.isRegularFile(file)) {
      try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
        SynonymTable table = parse(reader);
        log.info("Loaded {} synonym pairs from {}", table.size(), file);
        return table;
      } catch (IOException | RuntimeException e) {
        log.warn(
            "Synonym file {} unreadable, continuing without synonyms: {}", file, e.getMessage());
        return SynonymTable.empty();
      }
    }

    ClassPathResource resource = new ClassPathResource(bundledResource);
    if (!resource.exists()) {
      log.warn("No synonym file at {} and no bundled {}; synonyms disabled", file, bundledResource);
      return SynonymTable.empty();
    }
    try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
      SynonymTable table = parse(reader);
      log.info("Loaded {} synonym pairs from classpath:{}", table.size(), bundledResource);
      return table;
    } catch (IOException | RuntimeException e) {
      log.warn("Bundled synonyms unreadable, continuing without synonyms: {}", e.getMessage());
      return SynonymTable.empty();
    }
  }

  static SynonymTable parse(Reader source) throws IOException {
    SynonymTable.Builder builder = SynonymTable.builder();
    BufferedReader reader =
        source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
    String line;
    while ((line = reader.readLine()) != null) {
      String trimmed = line.strip();
      if (trimmed.startsWith("\uFEFF")) {
        trimmed = trimmed.substring(1).strip();
      }
      if (trimmed.isEmpty() || trimmed.startsWith("#")) {
        continue;
      }
      String[] columns = trimmed.split(",", -1);
      if (columns.length != 2) {
        log.debug("Skipping malformed synonym row: {}", trimmed);
        continue;
      }
      String canonical = columns[0].strip();
      String variant = columns[1].strip();
      if (canonical.isEmpty()
          || variant.isEmpty()
          || ("canonical".equalsIgnoreCase(canonical) && "variant".equalsIgnoreCase(variant))) {
        continue;
      }
      builder.add(canonical, variant);
    }
    return builder.build();
  }
}
