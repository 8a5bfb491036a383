//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.extract;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Provides a basic interface for extraction. Extractors can provide other entry points, but this
 * allows basic abstraction over the various sources of code.
 */
public interface Extractor {

  /** Processes {@code sources}. Comments are emitted to {@code writer}. */
  void process (SourceSet sources, Writer writer) throws IOException;

  /** Processes {@code file}. Comments are emitted to {@code writer}. */
  default void process (Path file, Writer writer) throws IOException {
    process(SourceSet.create(file), writer);
  }
}
