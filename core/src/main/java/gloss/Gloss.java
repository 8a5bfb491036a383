//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss;

import gloss.model.UnsupportedDialectException;
import gloss.scan.Scanner;
import java.util.List;

/**
 * The main entry point for comment extraction. Callers that want positions, or that process
 * files, should use {@link Scanner} or {@link gloss.extract.CommentExtractor} directly.
 */
public class Gloss {

  /**
   * Returns the comments in {@code code}, in the order in which they appear, each including its
   * delimiters. Comment-like text inside string and char literals is not reported.
   *
   * @param language one of {@code python}, {@code c}, {@code c++}, {@code java}, {@code c#},
   * {@code js}, {@code javascript}, {@code go} or {@code php}, in any case.
   * @throws UnsupportedDialectException if {@code language} is not one of the above.
   */
  public static List<String> extractComments (String code, String language) {
    return Scanner.extract(code, language);
  }

  private Gloss () {}
}
