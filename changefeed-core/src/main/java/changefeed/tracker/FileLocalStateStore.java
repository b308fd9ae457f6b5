package changefeed.tracker;

import changefeed.spi.LocalStateStore;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Properties;

/**
 * {@link LocalStateStore} keeping the change number in a properties file.
 *
 * <p>Writes go to a sibling temporary file that then replaces the target, so a crash
 * mid-write leaves the previous value intact.
 */
public final class FileLocalStateStore implements LocalStateStore {
  static final String CHANGE_NUMBER_KEY = "changeNumber";

  private final Path file;

  public FileLocalStateStore(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  public Path file() {
    return file;
  }

  @Override
  public synchronized long load() {
    if (!Files.exists(file)) {
      return 0L;
    }
    Properties properties = new Properties();
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      properties.load(reader);
    } catch (IOException e) {
      throw new LocalStateException("Failed to read local state from " + file, e);
    }
    String value = properties.getProperty(CHANGE_NUMBER_KEY);
    if (value == null || value.isBlank()) {
      return 0L;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new LocalStateException("Corrupt change number in " + file + ": " + value, e);
    }
  }

  @Override
  public synchronized void save(long changeNumber) {
    Properties properties = new Properties();
    properties.setProperty(CHANGE_NUMBER_KEY, Long.toString(changeNumber));
    Path temp = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
        properties.store(writer, "changefeed local state");
      }
      try {
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new LocalStateException("Failed to write local state to " + file, e);
    }
  }
}
