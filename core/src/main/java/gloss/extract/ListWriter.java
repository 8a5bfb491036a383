//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.extract;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import gloss.model.*;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A {@code Writer} that collects comments in memory, grouped by source. Sources are remembered
 * in the order in which they were opened, even those that contained no comments.
 */
public class ListWriter extends Writer {

  /** Returns the sources seen so far, in the order they were processed. */
  public Set<Source> sources () {
    return Collections.unmodifiableSet(_seen);
  }

  /** Returns the comments found in {@code source}, in source order. */
  public List<Comment> comments (Source source) {
    return ImmutableList.copyOf(_comments.get(source));
  }

  /** Returns the texts of the comments found in {@code source}, in source order. */
  public List<String> texts (Source source) {
    ImmutableList.Builder<String> texts = ImmutableList.builder();
    for (Comment comment : _comments.get(source)) texts.add(comment.text);
    return texts.build();
  }

  @Override public void openSession () {
    // nada
  }

  @Override public void openUnit (Source source, Dialect dialect) {
    Preconditions.checkState(_unit == null, "openUnit() called inside unit %s", _unit);
    _unit = source;
    _seen.add(source);
  }

  @Override public void emitComment (Comment comment) {
    Preconditions.checkState(_unit != null, "emitComment() called outside of a unit");
    _comments.put(_unit, comment);
  }

  @Override public void closeUnit () {
    _unit = null;
  }

  @Override public void closeSession () {
    // nada
  }

  private final ListMultimap<Source,Comment> _comments = LinkedListMultimap.create();
  private final Set<Source> _seen = new LinkedHashSet<>();
  private Source _unit;
}
