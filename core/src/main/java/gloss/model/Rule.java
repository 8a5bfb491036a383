//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.model;

import com.google.common.base.Strings;

/**
 * Describes one lexical form a dialect knows about: a literal to be skipped, or a comment to be
 * kept. A rule is anchored: it either matches starting exactly at a given offset or not at all.
 * Rules are immutable and may be shared between threads.
 */
public abstract class Rule {

  /** A string or char literal delimited by a single quote character. A backslash escapes the
    * character that follows it, whatever that is, so an escaped delimiter never ends the literal.
    * The body may span lines. A literal with no closing delimiter does not match; in that case
    * {@link #match} reports {@link #UNCLOSED}, because every later opener of the same delimiter
    * sees a suffix of the same failed scan and cannot close either. */
  public static final class Quoted extends Rule {

    /** The delimiter character: {@code "}, {@code '} or a backtick. */
    public final char delim;

    /** If true, refuses to match a delimiter that is immediately followed by two more of the same
      * character, so that the opening of a triple-quoted block is left for {@link Triple}. */
    public final boolean excludeTriple;

    public Quoted (char delim, boolean excludeTriple) {
      this.delim = delim;
      this.excludeTriple = excludeTriple;
      _triple = Strings.repeat(String.valueOf(delim), 3);
    }

    @Override public int match (CharSequence text, int start) {
      int length = text.length();
      if (start >= length || text.charAt(start) != delim) return -1;
      if (excludeTriple && startsWith(text, start, _triple)) return -1;
      for (int ii = start+1; ii < length; ii++) {
        char c = text.charAt(ii);
        if (c == delim) return ii+1;
        if (c == '\\') ii++; // consume the escaped char, whatever it is
      }
      return UNCLOSED;
    }

    @Override public char lead () { return delim; }

    @Override public String toString () {
      return "quoted(" + delim + (excludeTriple ? ", !triple" : "") + ")";
    }

    private final String _triple;
  }

  /** A block delimited by three repeated quote characters (Python's {@code """} and
    * {@code '''}). The body may contain anything, including line breaks, and ends at the first
    * matching triple delimiter. An unclosed block runs to the end of the text. */
  public static final class Triple extends Rule {

    /** The repeated quote character. */
    public final char quote;

    public Triple (char quote) {
      this.quote = quote;
      _delim = Strings.repeat(String.valueOf(quote), 3);
    }

    @Override public int match (CharSequence text, int start) {
      if (!startsWith(text, start, _delim)) return -1;
      return endOf(text, start + 3, _delim);
    }

    @Override public char lead () { return quote; }
    @Override public String toString () { return "triple(" + _delim + ")"; }

    private final String _delim;
  }

  /** A comment introduced by {@link #start} that runs to the end of the line. The line
    * terminator ({@code \n} or {@code \r}) is never part of the comment. */
  public static final class Line extends Rule {

    /** The token that opens the comment, e.g. {@code //} or {@code #}. */
    public final String start;

    public Line (String start) {
      this.start = start;
    }

    @Override public int match (CharSequence text, int offset) {
      if (!startsWith(text, offset, start)) return -1;
      int length = text.length();
      int ii = offset + start.length();
      while (ii < length) {
        char c = text.charAt(ii);
        if (c == '\n' || c == '\r') break;
        ii++;
      }
      return ii;
    }

    @Override public char lead () { return start.charAt(0); }
    @Override public String toString () { return "line(" + start + ")"; }
  }

  /** A comment between {@link #open} and the first following {@link #close}. The body may span
    * lines; an unclosed comment runs to the end of the text. */
  public static final class Block extends Rule {

    public final String open;
    public final String close;

    public Block (String open, String close) {
      this.open = open;
      this.close = close;
    }

    @Override public int match (CharSequence text, int start) {
      if (!startsWith(text, start, open)) return -1;
      return endOf(text, start + open.length(), close);
    }

    @Override public char lead () { return open.charAt(0); }
    @Override public String toString () { return "block(" + open + " " + close + ")"; }
  }

  /** Returned by {@link #match} when a rule opened at the start offset but can never close, at
    * that offset or at any later one. */
  public static final int UNCLOSED = -2;

  /**
   * Attempts to match this rule starting exactly at {@code start} in {@code text}.
   * @return the offset just past the end of the match, -1 if the rule does not match there, or
   * {@link #UNCLOSED}.
   */
  public abstract int match (CharSequence text, int start);

  /** Returns the character with which every match of this rule begins. */
  public abstract char lead ();

  /** Returns true if {@code text} contains {@code token} at {@code offset}. */
  protected static boolean startsWith (CharSequence text, int offset, String token) {
    int tlen = token.length();
    if (offset < 0 || offset + tlen > text.length()) return false;
    for (int ii = 0; ii < tlen; ii++) {
      if (text.charAt(offset+ii) != token.charAt(ii)) return false;
    }
    return true;
  }

  /** Returns the offset just past the first {@code close} at or after {@code from}, or the
    * length of {@code text} if there is none. */
  protected static int endOf (CharSequence text, int from, String close) {
    for (int ii = from, ll = text.length() - close.length(); ii <= ll; ii++) {
      if (startsWith(text, ii, close)) return ii + close.length();
    }
    return text.length();
  }

  private Rule () {} // seal it!
}
