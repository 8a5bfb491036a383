//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.model;

/**
 * A region of scanned text claimed by one of a dialect's rules. Matches only live for the
 * duration of a scan.
 */
public final class Match {

  /** Whether a match is to be skipped (a literal) or kept (a comment). */
  public static enum Kind { SKIP, KEEP }

  /** The class of the rule that produced this match. */
  public final Kind kind;

  /** The rule that produced this match. */
  public final Rule rule;

  /** The offset of the first character of the match. */
  public final int start;

  /** The offset just past the last character of the match. */
  public final int end;

  /** The matched text, delimiters included. */
  public final String text;

  public Match (Kind kind, Rule rule, int start, int end, String text) {
    this.kind = kind;
    this.rule = rule;
    this.start = start;
    this.end = end;
    this.text = text;
  }

  /** Returns true if this match is a comment. */
  public boolean isKeep () {
    return kind == Kind.KEEP;
  }

  @Override public String toString () {
    return kind + " " + rule + " [" + start + ", " + end + ")";
  }
}
