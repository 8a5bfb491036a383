//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.model;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Defines the different places from which source text comes.
 */
public abstract class Source {

  /** Models a source file in the file system. */
  public static class File extends Source {

    /** The path to the source file. */
    public final String path;

    public File (String path) {
      this.path = path;
    }

    @Override public Reader reader () throws IOException {
      return Files.newBufferedReader(Paths.get(path), StandardCharsets.UTF_8);
    }

    @Override public boolean equals (Object other) {
      return (other instanceof File) && path.equals(((File)other).path);
    }
    @Override public int hashCode () {
      return path.hashCode();
    }
    @Override public String toString () {
      return path;
    }

    @Override protected String path () {
      return path;
    }
    @Override protected char pathSeparator () {
      return java.io.File.separatorChar;
    }
  }

  /** Models a source file inside an archive file (zip, jar, etc.). */
  public static class ArchiveEntry extends Source {

    /** The path to the archive file. */
    public final String archivePath;

    /** The path to the source file, inside the archive file. */
    public final String sourcePath;

    public ArchiveEntry (String archivePath, String sourcePath) {
      this.archivePath = archivePath;
      this.sourcePath = sourcePath;
    }

    @Override public Reader reader () throws IOException {
      ZipFile file = new ZipFile(archivePath);
      ZipEntry entry = file.getEntry(sourcePath);
      if (entry == null) {
        file.close();
        throw new IOException("No entry " + sourcePath + " in " + archivePath);
      }
      // closing the reader closes the zip file as well
      return new InputStreamReader(file.getInputStream(entry), StandardCharsets.UTF_8) {
        @Override public void close () throws IOException {
          try { super.close(); }
          finally { file.close(); }
        }
      };
    }

    @Override public boolean equals (Object other) {
      return ((other instanceof ArchiveEntry) &&
              archivePath.equals(((ArchiveEntry)other).archivePath) &&
              sourcePath.equals(((ArchiveEntry)other).sourcePath));
    }
    @Override public int hashCode () {
      return archivePath.hashCode() ^ sourcePath.hashCode();
    }
    @Override public String toString () {
      return archivePath + "!" + sourcePath;
    }

    @Override protected String path () {
      return sourcePath;
    }
    @Override protected char pathSeparator () {
      return '/'; // zip path separator always '/'
    }
  }

  /** Models source text held in memory, named as if it came from {@link #name}. */
  public static class Text extends Source {

    /** The name under which this text is reported, e.g. {@code Test.java}. */
    public final String name;

    /** The source text itself. */
    public final String code;

    public Text (String name, String code) {
      this.name = name;
      this.code = code;
    }

    @Override public Reader reader () {
      return new StringReader(code);
    }

    @Override public boolean equals (Object other) {
      return (other instanceof Text) && name.equals(((Text)other).name) &&
        code.equals(((Text)other).code);
    }
    @Override public int hashCode () {
      return name.hashCode();
    }
    @Override public String toString () {
      return name;
    }

    @Override protected String path () {
      return name;
    }
    @Override protected char pathSeparator () {
      return '/';
    }
  }

  /**
   * Creates a source from the supplied string representation. {@code string} should be the result
   * of calling {@link Source#toString} on an existing file or archive entry source.
   */
  public static Source fromString (String string) {
    int eidx = string.indexOf('!');
    if (eidx == -1) return new File(string);
    else return new ArchiveEntry(string.substring(0, eidx), string.substring(eidx+1));
  }

  /** Returns the name of the file represented by this source. */
  public String fileName () {
    String path = path();
    return path.substring(path.lastIndexOf(pathSeparator())+1);
  }

  /** Returns the extension of the file represented by this source, or "" if it has none. */
  public String fileExt () {
    String name = fileName();
    int didx = name.lastIndexOf('.');
    return (didx == -1) ? "" : name.substring(didx+1);
  }

  /** Returns the dialect implied by this source's file extension, if any. */
  public Optional<Dialect> dialect () {
    return Dialect.forExt(fileExt());
  }

  /** Creates a reader that can be used to read the contents of this source. */
  public abstract Reader reader () throws IOException;

  protected abstract String path ();
  protected abstract char pathSeparator ();

  private Source () {} // seal it!
}
