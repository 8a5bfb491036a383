//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.scan;

import com.google.common.collect.ImmutableList;
import gloss.model.Comment;
import gloss.model.Dialect;
import gloss.model.Match;

/**
 * Extracts comments from source text in a single forward pass. Literals are matched and
 * discarded so that comment-like text inside them (a URL in a string, say) is never reported.
 * Every method is total: malformed input degrades to a best-effort result rather than failing,
 * and unclosed block comments run to the end of the text.
 *
 * <p>Scans are independent of one another; the class holds no state.</p>
 */
public class Scanner {

  /**
   * Returns the comments in {@code text}, delimiters included, in source order.
   * @param dialect the name of the dialect, matched case-insensitively.
   * @throws gloss.model.UnsupportedDialectException if {@code dialect} is not a known dialect.
   */
  public static ImmutableList<String> extract (CharSequence text, String dialect) {
    return extract(text, Dialect.forName(dialect));
  }

  /** Returns the comments in {@code text}, delimiters included, in source order. */
  public static ImmutableList<String> extract (CharSequence text, Dialect dialect) {
    ImmutableList.Builder<String> comments = ImmutableList.builder();
    DialectMatcher matcher = DialectPattern.compile(dialect).matcher(text);
    while (matcher.hasNext()) {
      Match match = matcher.next();
      if (match.isKeep()) comments.add(match.text);
    }
    return comments.build();
  }

  /** Returns the comments in {@code text} along with their positions, in source order. */
  public static ImmutableList<Comment> comments (CharSequence text, Dialect dialect) {
    ImmutableList.Builder<Comment> comments = ImmutableList.builder();
    DialectMatcher matcher = DialectPattern.compile(dialect).matcher(text);
    // lines are counted incrementally, as matches only move forward
    int line = 1, lpos = 0;
    while (matcher.hasNext()) {
      Match match = matcher.next();
      if (!match.isKeep()) continue;
      line += countLines(text, lpos, match.start);
      lpos = match.start;
      comments.add(new Comment(match.start, line, match.text));
    }
    return comments.build();
  }

  /** Returns every region claimed by {@code dialect}'s rules, literals included. */
  public static ImmutableList<Match> matches (CharSequence text, Dialect dialect) {
    return ImmutableList.copyOf(DialectPattern.compile(dialect).matcher(text));
  }

  /** Counts the line breaks in {@code [from, to)}. A {@code \r\n} pair counts once. */
  static int countLines (CharSequence text, int from, int to) {
    int lines = 0;
    for (int ii = from; ii < to; ii++) {
      char c = text.charAt(ii);
      if (c == '\n') lines++;
      else if (c == '\r' && (ii+1 >= text.length() || text.charAt(ii+1) != '\n')) lines++;
    }
    return lines;
  }

  private Scanner () {} // static only
}
