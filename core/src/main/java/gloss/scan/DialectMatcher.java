//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.scan;

import com.google.common.collect.AbstractIterator;
import gloss.model.Match;
import java.util.Arrays;

/**
 * Walks a text once, left to right, yielding every region claimed by a {@link DialectPattern}: the
 * skipped literals as well as the kept comments, in source order. Each match begins at the
 * earliest offset (at or after the end of the previous match) where any rule matches. Text that no
 * rule claims is passed over silently.
 *
 * <p>A matcher holds per-text state and is not thread safe. Obtain one per scan via {@link
 * DialectPattern#matcher}.</p>
 */
public final class DialectMatcher extends AbstractIterator<Match> {

  /** Returns the offset at which the next search will begin. */
  public int position () {
    return _pos;
  }

  /**
   * Returns the first match that starts at or after {@code from}, or null if there is none. This
   * does not move the iteration position.
   */
  Match find (int from) {
    CharSequence text = _text;
    for (int ii = Math.max(from, 0), ll = text.length(); ii < ll; ii++) {
      if (!_pattern.canStart(text.charAt(ii))) continue;
      Match match = _pattern.matchAt(text, ii, _deadFrom);
      if (match != null) return match;
    }
    return null;
  }

  @Override protected Match computeNext () {
    Match match = find(_pos);
    if (match == null) {
      _pos = _text.length();
      return endOfData();
    }
    _pos = match.end;
    return match;
  }

  DialectMatcher (DialectPattern pattern, CharSequence text) {
    _pattern = pattern;
    _text = text;
    _deadFrom = new int[pattern.ruleCount()];
    Arrays.fill(_deadFrom, Integer.MAX_VALUE);
  }

  private final DialectPattern _pattern;
  private final CharSequence _text;
  // for each rule, the offset from which it is known never to match
  private final int[] _deadFrom;
  private int _pos = 0;
}
