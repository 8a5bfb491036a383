//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.ident;

import gloss.model.Dialect;

/**
 * Guesses the language in which a snippet of code is written. Identifiers share no state with
 * the comment scanner; the name they return is simply handed to {@link Dialect#forName}.
 */
public interface LangIdentifier {

  /** Returns the name of the language that {@code text} most likely is, e.g. {@code C++}. */
  String identify (String text);

  /** Identifies {@code text} and resolves the result to a dialect. */
  default Dialect dialect (String text) {
    return Dialect.forName(identify(text));
  }
}
