//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.ident;

/**
 * A word or operator pulled out of a code snippet by {@link Tokenizer}.
 */
public final class Token {

  public static enum Type {
    /** A run of identifier characters, which may or may not be a keyword. */
    WORD,
    /** A run of operator characters. */
    OPERATOR
  }

  public final Type type;
  public final String text;

  public static Token word (String text) { return new Token(Type.WORD, text); }
  public static Token operator (String text) { return new Token(Type.OPERATOR, text); }

  public Token (Type type, String text) {
    this.type = type;
    this.text = text;
  }

  @Override public boolean equals (Object other) {
    return (other instanceof Token) && type == ((Token)other).type &&
      text.equals(((Token)other).text);
  }

  @Override public int hashCode () {
    return type.hashCode() ^ text.hashCode();
  }

  @Override public String toString () {
    return type + ":" + text;
  }
}
