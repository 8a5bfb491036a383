//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.extract;

import com.google.common.collect.ImmutableList;
import gloss.model.Source;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Predicate;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Encapsulates a set of sources which are to be processed by an extractor.
 */
public abstract class SourceSet {

  /** A simple list of paths to process. */
  public static class Files extends SourceSet {
    public final ImmutableList<Path> paths;

    public Files (Iterable<Path> paths) {
      this.paths = ImmutableList.copyOf(paths);
    }

    @Override public int size () { return paths.size(); }
  }

  /** A jar or zip archive of source files to process, potentially with a filter. */
  public static class Archive extends SourceSet {
    public final Path archive;
    public final Predicate<ZipEntry> filter;

    public Archive (Path archive) {
      this(archive, e -> !e.isDirectory());
    }

    public Archive (Path archive, Predicate<ZipEntry> filter) {
      this.archive = archive;
      this.filter = filter;
    }

    @Override public int size () throws IOException {
      try (ZipFile zf = new ZipFile(archive.toFile())) {
        return (int)zf.stream().filter(filter).count();
      }
    }
  }

  public static SourceSet create (Iterable<Path> paths) {
    return new Files(paths);
  }

  public static SourceSet create (Path path) {
    return new Files(ImmutableList.of(path));
  }

  public static SourceSet create (Source source) {
    if (source instanceof Source.ArchiveEntry) {
      Source.ArchiveEntry as = (Source.ArchiveEntry)source;
      return new Archive(Paths.get(as.archivePath), e -> e.getName().equals(as.sourcePath));
    } else if (source instanceof Source.File) {
      return create(Paths.get(((Source.File)source).path));
    } else {
      throw new IllegalArgumentException("Source has no backing file: " + source);
    }
  }

  /** Returns the number of files in this source set. */
  public abstract int size () throws IOException;
}
