//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.ident;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;

/**
 * Splits a code snippet into words and operators, in a way that is deliberately ignorant of any
 * particular language. Words are runs of letters, digits and underscores. A run of punctuation
 * from {@link #OPERATOR_CHARS} is split into operators by taking, at each step, the longest
 * operator in {@link Features#OPERATORS} that starts there, or a single character if none does;
 * so {@code $a=$b} yields {@code $}, {@code =}, {@code $}. The contents of quoted literals are
 * dropped, as is everything else (whitespace, brackets, separators). A backtick literal yields a
 * single backtick operator.
 *
 * <p>Quoted literals end at their closing delimiter or, except for backtick literals, at the end
 * of the line, so that a stray apostrophe does not swallow the rest of the snippet.</p>
 */
public class Tokenizer {

  /** The characters from which operator tokens are formed. */
  public static final String OPERATOR_CHARS = "+-*/%=<>!&|^~?:.@$";

  /** Returns the tokens in {@code text}, in order. */
  public static ImmutableList<Token> tokenize (CharSequence text) {
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    int ii = 0, ll = text.length();
    while (ii < ll) {
      char c = text.charAt(ii);
      if (WORD.matches(c)) {
        int start = ii;
        while (ii < ll && WORD.matches(text.charAt(ii))) ii++;
        tokens.add(Token.word(text.subSequence(start, ii).toString()));
      } else if (OPERATOR.matches(c)) {
        int end = ii;
        while (end < ll && OPERATOR.matches(text.charAt(end))) end++;
        while (ii < end) {
          int len = operatorLength(text, ii, end);
          tokens.add(Token.operator(text.subSequence(ii, ii+len).toString()));
          ii += len;
        }
      } else if (c == '`') {
        tokens.add(Token.operator("`"));
        ii = skipLiteral(text, ii);
      } else if (c == '"' || c == '\'') {
        ii = skipLiteral(text, ii);
      } else ii++;
    }
    return tokens.build();
  }

  /** Returns the length of the longest known operator at {@code start} that ends at or before
    * {@code end}, or 1 if there is none. */
  static int operatorLength (CharSequence text, int start, int end) {
    for (int len = Math.min(MAX_OPERATOR, end - start); len > 1; len--) {
      if (Features.OPERATORS.contains(text.subSequence(start, start+len).toString())) return len;
    }
    return 1;
  }

  /** Returns the offset just past the literal that opens at {@code start}. */
  static int skipLiteral (CharSequence text, int start) {
    char delim = text.charAt(start);
    boolean multiline = (delim == '`');
    for (int ii = start+1, ll = text.length(); ii < ll; ii++) {
      char c = text.charAt(ii);
      if (c == delim) return ii+1;
      if (c == '\\') ii++;
      else if (c == '\n' && !multiline) return ii;
    }
    return text.length();
  }

  private static final CharMatcher WORD = CharMatcher.inRange('a', 'z').
    or(CharMatcher.inRange('A', 'Z')).or(CharMatcher.inRange('0', '9')).or(CharMatcher.is('_')).
    precomputed();
  private static final CharMatcher OPERATOR = CharMatcher.anyOf(OPERATOR_CHARS).precomputed();
  private static final int MAX_OPERATOR = Features.OPERATORS.stream().
    mapToInt(String::length).max().orElse(1);

  private Tokenizer () {}
}
