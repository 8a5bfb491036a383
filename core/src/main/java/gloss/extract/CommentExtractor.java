//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.extract;

import com.google.common.io.CharStreams;
import gloss.model.*;
import gloss.scan.Scanner;
import java.io.IOException;
import java.io.Reader;
import java.util.Optional;

/**
 * Extracts the comments from source files. The dialect of each file is chosen from its extension
 * unless the extractor was created for a specific dialect, in which case every file is read as
 * that dialect.
 */
public class CommentExtractor extends AbstractExtractor {

  /** Creates an extractor that picks each file's dialect from its extension. */
  public CommentExtractor () {
    this(Optional.empty());
  }

  /** Creates an extractor that reads every file as {@code dialect}. */
  public CommentExtractor (Dialect dialect) {
    this(Optional.of(dialect));
  }

  /** Returns the dialect that will be used for {@code source}, if one can be determined. */
  public Optional<Dialect> dialectFor (Source source) {
    return _dialect.isPresent() ? _dialect : source.dialect();
  }

  @Override protected void process (Source source, Reader reader, Writer writer)
    throws IOException {
    Optional<Dialect> dialect = dialectFor(source);
    if (!dialect.isPresent()) {
      System.err.println("Skipping source of unknown language [source=" + source + "]");
      return;
    }

    String code = CharStreams.toString(reader);
    writer.openUnit(source, dialect.get());
    try {
      for (Comment comment : Scanner.comments(code, dialect.get())) writer.emitComment(comment);
    } finally {
      writer.closeUnit();
    }
  }

  private CommentExtractor (Optional<Dialect> dialect) {
    _dialect = dialect;
  }

  private final Optional<Dialect> _dialect;
}
