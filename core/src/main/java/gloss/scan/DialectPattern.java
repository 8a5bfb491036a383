//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.scan;

import com.google.common.base.Preconditions;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableList;
import gloss.model.Dialect;
import gloss.model.Match;
import gloss.model.Rule;

/**
 * A dialect's skip and keep rules merged into a single prioritized matcher. At any offset the
 * skip rules are tried before the keep rules, and within each class rules are tried in the order
 * the dialect lists them; the first rule to match claims the region.
 *
 * <p>A pattern is immutable and may be shared freely between threads. Per-text scanning state
 * lives in the {@link DialectMatcher} obtained from {@link #matcher}.</p>
 */
public final class DialectPattern {

  /**
   * Returns the pattern for {@code dialect}. Patterns are compiled once per dialect and reused for
   * the life of the process.
   */
  public static DialectPattern compile (Dialect dialect) {
    Preconditions.checkNotNull(dialect, "dialect");
    return CACHE.getUnchecked(dialect);
  }

  /** The dialect from which this pattern was compiled. */
  public final Dialect dialect;

  /** Returns a matcher that will find this pattern's matches in {@code text}. */
  public DialectMatcher matcher (CharSequence text) {
    return new DialectMatcher(this, text);
  }

  @Override public String toString () {
    return dialect + " " + _rules;
  }

  /** Returns the number of rules in this pattern. */
  int ruleCount () {
    return _rules.size();
  }

  /** Returns true if some rule could start at a character {@code c}. */
  boolean canStart (char c) {
    return _leads.indexOf(c) >= 0;
  }

  /**
   * Tries every rule at {@code offset}, in priority order, and returns the match of the first
   * that succeeds, or null if none do. A rule is not tried at or past {@code deadFrom[i]}; a rule
   * that reports {@link Rule#UNCLOSED} has its entry lowered to {@code offset}.
   */
  Match matchAt (CharSequence text, int offset, int[] deadFrom) {
    for (int ii = 0, ll = _rules.size(); ii < ll; ii++) {
      if (offset >= deadFrom[ii]) continue;
      Rule rule = _rules.get(ii);
      int end = rule.match(text, offset);
      if (end == Rule.UNCLOSED) deadFrom[ii] = offset;
      else if (end >= 0) return new Match(
        ii < _skipCount ? Match.Kind.SKIP : Match.Kind.KEEP, rule, offset, end,
        text.subSequence(offset, end).toString());
    }
    return null;
  }

  private DialectPattern (Dialect dialect) {
    this.dialect = dialect;
    _rules = ImmutableList.<Rule>builder().addAll(dialect.skip).addAll(dialect.keep).build();
    _skipCount = dialect.skip.size();
    StringBuilder leads = new StringBuilder();
    for (Rule rule : _rules) {
      if (leads.indexOf(String.valueOf(rule.lead())) < 0) leads.append(rule.lead());
    }
    _leads = leads.toString();
  }

  private final ImmutableList<Rule> _rules; // skip rules first, then keep rules
  private final int _skipCount;
  private final String _leads;

  // compiling is pure, so racing loads would produce equal patterns; the cache just makes sure
  // we only keep one
  private static final LoadingCache<Dialect,DialectPattern> CACHE = CacheBuilder.newBuilder().
    build(CacheLoader.from(DialectPattern::new));
}
