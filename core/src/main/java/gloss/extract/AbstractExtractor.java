//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.extract;

import gloss.model.*;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Handles the plumbing of getting from a {@link SourceSet} to a reader per source file, leaving
 * the processing of each file to subclasses.
 */
public abstract class AbstractExtractor implements Extractor {

  /**
   * {@inheritDoc} A file that cannot be read is reported to stderr and skipped; the remaining
   * files are still processed. Failure to open an archive aborts the whole set.
   */
  @Override public void process (SourceSet sources, Writer writer) throws IOException {
    writer.openSession();
    try {
      if (sources instanceof SourceSet.Files) {
        for (Path path : ((SourceSet.Files)sources).paths) {
          Source source = new Source.File(path.toString());
          try (Reader reader = source.reader()) {
            process(source, reader, writer);
          } catch (IOException e) {
            System.err.println("Failed to process " + path + ": " + e);
            e.printStackTrace(System.err);
          }
        }
      } else {
        SourceSet.Archive sa = (SourceSet.Archive)sources;
        String zipPath = sa.archive.toString();
        // one zip file for the whole set, rather than one per entry as ArchiveEntry.reader() does
        try (ZipFile zip = new ZipFile(sa.archive.toFile())) {
          List<ZipEntry> entries = zip.stream().filter(sa.filter).collect(Collectors.toList());
          for (ZipEntry entry : entries) {
            try (Reader reader = new InputStreamReader(
                   zip.getInputStream(entry), StandardCharsets.UTF_8)) {
              process(new Source.ArchiveEntry(zipPath, entry.getName()), reader, writer);
            }
          }
        }
      }
    } finally {
      writer.closeSession();
    }
  }

  /** Combines {@code file} and {@code code} into a test source and processes it.
    * Comments are emitted to {@code writer}. */
  public void process (String file, String code, Writer writer) throws IOException {
    process(new Source.Text(file, code), writer);
  }

  /** Processes the single source {@code source}, reading it via {@link Source#reader}.
    * Comments are emitted to {@code writer}. */
  public void process (Source source, Writer writer) throws IOException {
    writer.openSession();
    try (Reader reader = source.reader()) {
      process(source, reader, writer);
    } finally {
      writer.closeSession();
    }
  }

  /** Processes a single source, whose contents are supplied by {@code reader}. Implementations
    * must not close {@code reader}. */
  protected abstract void process (Source source, Reader reader, Writer writer) throws IOException;
}
