//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.ident;

import com.google.common.collect.ImmutableMap;
import java.util.Optional;

/**
 * Maps the labels produced by content-type classifiers (which name languages after their file
 * types, e.g. {@code cpp}, {@code cs}) to the language names Gloss uses.
 */
public class Labels {

  /** Classifier labels and the language names they correspond to. */
  public static final ImmutableMap<String,String> TO_LANG = ImmutableMap.<String,String>builder().
    put("python", "Python").
    put("cpp", "C++").
    put("java", "Java").
    put("go", "Go").
    put("php", "PHP").
    put("cs", "C#").
    put("c", "C").
    put("javascript", "JS").
    build();

  /**
   * Returns the language name for {@code label}, if it is one we recognize. Labels that are
   * already language names (as returned by {@link FeatureVoter}) map to themselves.
   */
  public static Optional<String> toLang (String label) {
    if (label == null) return Optional.empty();
    if (TO_LANG.containsValue(label)) return Optional.of(label);
    return Optional.ofNullable(TO_LANG.get(label));
  }

  private Labels () {}
}
