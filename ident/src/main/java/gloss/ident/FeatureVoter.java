//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.ident;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;

/**
 * Identifies a snippet's language by letting the tokens vote: every token that is a keyword or
 * characteristic operator of a language earns that language a vote. The language with the most
 * votes wins. Ties, including the no-votes case, go to whichever language comes first in {@link
 * Features#BY_LANG}.
 */
public class FeatureVoter implements LangIdentifier {

  public FeatureVoter () {
    this(Features.BY_LANG);
  }

  /** Creates a voter over the supplied features, whose iteration order breaks ties. */
  public FeatureVoter (ImmutableMap<String,Features> features) {
    _features = features;
  }

  /** Returns the votes each language receives for {@code text}, in tie-break order. */
  public ImmutableMap<String,Integer> votes (String text) {
    List<Token> tokens = Tokenizer.tokenize(text);
    ImmutableMap.Builder<String,Integer> votes = ImmutableMap.builder();
    for (Map.Entry<String,Features> entry : _features.entrySet()) {
      Features features = entry.getValue();
      int count = 0;
      for (Token token : tokens) if (features.matches(token)) count++;
      votes.put(entry.getKey(), count);
    }
    return votes.build();
  }

  @Override public String identify (String text) {
    String best = null;
    int bestVotes = -1;
    for (Map.Entry<String,Integer> entry : votes(text).entrySet()) {
      // strictly greater, so that earlier languages win ties
      if (entry.getValue() > bestVotes) {
        best = entry.getKey();
        bestVotes = entry.getValue();
      }
    }
    return best;
  }

  private final ImmutableMap<String,Features> _features;
}
