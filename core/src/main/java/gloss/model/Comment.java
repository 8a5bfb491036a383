//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.model;

/**
 * A comment found in a source text.
 */
public final class Comment {

  /** The character offset into the source text at which the comment starts. */
  public final int offset;

  /** The line (1-based) on which the comment starts. */
  public final int line;

  /** The text of the comment, including its delimiters but never a trailing line break. */
  public final String text;

  public Comment (int offset, int line, String text) {
    this.offset = offset;
    this.line = line;
    this.text = text;
  }

  /** Returns the length of this comment in characters. */
  public int length () {
    return text.length();
  }

  @Override public boolean equals (Object other) {
    if (!(other instanceof Comment)) return false;
    Comment oc = (Comment)other;
    return offset == oc.offset && line == oc.line && text.equals(oc.text);
  }

  @Override public int hashCode () {
    return offset ^ text.hashCode();
  }

  @Override public String toString () {
    return String.format("%d:%d %s", line, offset, text);
  }
}
