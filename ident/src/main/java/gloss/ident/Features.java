//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.ident;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * The keywords and operators that are characteristic of a language, used by {@link FeatureVoter}.
 */
public final class Features {

  /** The features of each language we vote on, keyed by the language's dialect name. Iteration
    * order is the tie-break order for votes. */
  public static final ImmutableMap<String,Features> BY_LANG = ImmutableMap.<String,Features>builder().
    put("Python", new Features(
      ImmutableSet.of("def", "elif", "if", "else", "import", "from", "as", "try", "except",
                      "finally", "raise", "with", "assert", "lambda", "class", "pass",
                      "yield", "global", "nonlocal", "del", "async", "await", "None",
                      "True", "False", "and", "or", "not", "is", "in"),
      // type hints, power, floor division, walrus, decorator
      ImmutableSet.of("->", "**", "//", ":=", "@"))).
    // access labels (public: etc.) are left out, as words never carry the colon
    put("C++", new Features(
      ImmutableSet.of("template", "typename", "class", "struct", "union", "virtual",
                      "override", "final", "friend",
                      "using", "namespace", "inline", "constexpr", "consteval", "nullptr",
                      "this", "new", "delete", "operator", "try", "catch", "throw",
                      "include", "std"),
      ImmutableSet.of("::", "->", "<<", ">>", "&", "*"))).
    put("Java", new Features(
      ImmutableSet.of("public", "private", "protected", "static", "final", "void", "class",
                      "interface", "extends", "implements", "abstract", "native", "synchronized",
                      "transient", "volatile", "throws", "package", "import", "new", "instanceof",
                      "super", "this", "null", "boolean", "byte", "char"),
      // unsigned shift, method reference, annotation
      ImmutableSet.of(">>>", "::", "@"))).
    put("Go", new Features(
      ImmutableSet.of("func", "package", "import", "type", "struct", "interface", "map",
                      "chan", "go", "defer", "range", "select", "case", "fallthrough",
                      "var", "const", "nil"),
      // short declaration, channel receive, variadic, bit clear
      ImmutableSet.of(":=", "<-", "...", "&^"))).
    put("PHP", new Features(
      ImmutableSet.of("function", "echo", "print", "array", "foreach", "as", "use", "namespace",
                      "global", "public", "private", "protected", "static", "final", "trait",
                      "clone", "include", "require", "isset", "empty", "die", "exit",
                      "null", "__construct"),
      ImmutableSet.of("=>", "->", "::", "===", "!==", "<=>", "$"))).
    put("C#", new Features(
      ImmutableSet.of("namespace", "using", "class", "struct", "interface", "enum", "delegate",
                      "event", "public", "private", "internal", "protected", "static", "readonly",
                      "volatile", "virtual", "override", "sealed", "abstract", "async", "await",
                      "var", "get", "set", "value", "out", "ref", "in", "params", "base", "this",
                      "null", "true", "false", "checked", "unchecked", "fixed", "lock"),
      ImmutableSet.of("??", "??=", "?.", "=>"))).
    put("C", new Features(
      ImmutableSet.of("int", "char", "float", "double", "void", "long", "short", "signed",
                      "unsigned", "struct", "union", "enum", "typedef", "sizeof", "static",
                      "extern", "auto", "register", "const", "volatile", "return", "if",
                      "else", "switch", "case", "default", "while", "do", "for", "break",
                      "continue", "goto", "include", "define"),
      ImmutableSet.of("->", ".", "&", "*"))).
    put("JS", new Features(
      ImmutableSet.of("function", "var", "let", "const", "if", "else", "switch", "for",
                      "while", "do", "break", "continue", "return", "try", "catch", "finally",
                      "throw", "new", "this", "delete", "typeof", "instanceof", "void",
                      "in", "of", "class", "extends", "super", "import", "export", "default",
                      "async", "await", "yield", "debugger", "undefined", "null", "NaN",
                      "true", "false", "console", "window", "document"),
      ImmutableSet.of("===", "!==", "=>", "...", "`"))).
    build();

  /** Every operator that some language in {@link #BY_LANG} counts. */
  public static final ImmutableSet<String> OPERATORS = BY_LANG.values().stream().
    flatMap(features -> features.operators.stream()).collect(ImmutableSet.toImmutableSet());

  /** Words that are keywords of this language. */
  public final ImmutableSet<String> keywords;

  /** Operators that are characteristic of this language. */
  public final ImmutableSet<String> operators;

  public Features (ImmutableSet<String> keywords, ImmutableSet<String> operators) {
    this.keywords = keywords;
    this.operators = operators;
  }

  /** Returns true if {@code token} is one of this language's keywords or operators. */
  public boolean matches (Token token) {
    switch (token.type) {
      case WORD:     return keywords.contains(token.text);
      case OPERATOR: return operators.contains(token.text);
      default:       return false;
    }
  }
}
