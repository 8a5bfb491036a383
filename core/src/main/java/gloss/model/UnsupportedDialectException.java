//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.model;

/**
 * Thrown when a caller names a dialect that Gloss does not support.
 */
public class UnsupportedDialectException extends IllegalArgumentException {

  /** The offending name, as supplied by the caller (possibly null). */
  public final String name;

  public UnsupportedDialectException (String name) {
    super("Unsupported language: " + name);
    this.name = name;
  }

  private static final long serialVersionUID = 1L;
}
