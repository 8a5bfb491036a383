//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.ident;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;
import com.google.common.collect.Multisets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Identifies a snippet's language by sweeping overlapping windows across it and classifying each
 * window on its own. Windows are {@code length / segments} chars long and step forward from the
 * start of the text; see {@link #windowStarts} for exactly where they fall.
 *
 * <p>The most common label among the windows wins; ties go to the label seen first. Labels the
 * classifier produces that are not languages we know are ignored. If no window yields a known
 * language, the whole text is handed to a fallback identifier.</p>
 */
public class SegmentVoter implements LangIdentifier {

  /** The default number of windows to poll. */
  public static final int DEFAULT_SEGMENTS = 5;

  /** The default fraction by which successive windows overlap. */
  public static final double DEFAULT_OVERLAP = 0.5;

  /** Creates a voter that classifies windows with a {@link FeatureVoter}, using defaults. */
  public SegmentVoter () {
    this(new FeatureVoter(), DEFAULT_SEGMENTS, DEFAULT_OVERLAP, new FeatureVoter());
  }

  /**
   * Creates a segment voter.
   * @param classifier classifies individual windows. May return raw classifier labels (see {@link
   * Labels}) or language names.
   * @param segments the number of windows to poll; fewer than two disables windowing.
   * @param overlap the fraction, in {@code [0, 1)}, by which successive windows overlap.
   * @param fallback identifies the whole text when no window yields a known language.
   */
  public SegmentVoter (LangIdentifier classifier, int segments, double overlap,
                       LangIdentifier fallback) {
    Preconditions.checkArgument(segments >= 0, "segments must be non-negative: %s", segments);
    Preconditions.checkArgument(overlap >= 0 && overlap < 1, "overlap must be in [0, 1): %s",
                                overlap);
    _classifier = Preconditions.checkNotNull(classifier, "classifier");
    _fallback = Preconditions.checkNotNull(fallback, "fallback");
    _segments = segments;
    _overlap = overlap;
  }

  @Override public String identify (String text) {
    Multiset<String> labels = LinkedHashMultiset.create();
    int seglen = segmentLength(text.length(), _segments);
    for (int start : windowStarts(text.length(), _segments, _overlap)) {
      String label = _classifier.identify(text.substring(start, start + seglen));
      Optional<String> lang = Labels.toLang(label);
      if (lang.isPresent()) labels.add(lang.get());
    }
    for (String lang : Multisets.copyHighestCountFirst(labels).elementSet()) return lang;
    return _fallback.identify(text);
  }

  /** Returns the length of each window over a text of {@code length} chars. */
  static int segmentLength (int length, int segments) {
    return Math.max(1, length / Math.max(segments, 1));
  }

  /**
   * Returns the offsets at which windows start over a text of {@code length} chars. Windows are
   * spaced by a step of the window length less the overlap. If the regular steps leave the end of
   * the text unvisited (or produce too few windows), a final window flush with the end of the text
   * is added. At most {@code segments} windows are returned.
   */
  static List<Integer> windowStarts (int length, int segments, double overlap) {
    if (segments <= 1 || length == 0) return ImmutableList.of();
    int seglen = segmentLength(length, segments);
    int step = Math.max(1, (int)(seglen * (1 - overlap)));
    List<Integer> starts = new ArrayList<>();
    for (int ii = 0, ll = Math.max(length - seglen + 1, 1); ii < ll; ii += step) starts.add(ii);
    if ((starts.size() < segments && length > seglen) ||
        (!starts.isEmpty() && starts.get(starts.size()-1) + seglen < length)) {
      starts.add(length - seglen);
    }
    return ImmutableList.copyOf(starts.subList(0, Math.min(segments, starts.size())));
  }

  private final LangIdentifier _classifier;
  private final LangIdentifier _fallback;
  private final int _segments;
  private final double _overlap;
}
