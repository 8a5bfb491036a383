//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.extract;

import gloss.model.*;

/**
 * Receives the comments found by an {@link Extractor}. Calls occur in the following order:
 *
 * <pre>{@code
 * [openSession
 *   [openUnit
 *     emitComment*
 *   closeUnit]*
 * closeSession]
 * }</pre>
 *
 * A * indicates that a method can be called zero or more times. Comments within a unit are
 * emitted in source order.
 */
public abstract class Writer {

  public abstract void openSession ();
  public abstract void openUnit (Source source, Dialect dialect);
  public abstract void emitComment (Comment comment);
  public abstract void closeUnit ();
  public abstract void closeSession ();
}
