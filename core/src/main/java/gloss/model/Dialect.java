//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import java.util.Optional;

/**
 * The language dialects whose comments Gloss knows how to find. Each dialect owns an ordered list
 * of skip rules (literal forms whose contents are ignored) and an ordered list of keep rules
 * (comment forms that are reported). Order matters only as priority: when two rules of the same
 * class could match at the same offset, the earlier one wins, and any skip rule beats any keep
 * rule.
 *
 * <p>Like the language tables in most tools of this sort, this is centralized: adding a dialect
 * means adding a constant here and a name in {@link #forName}.</p>
 */
public enum Dialect {

  /** Python: {@code #} comments, and triple-quoted blocks which are treated as comments. */
  PYTHON(ImmutableList.of(Rules.DQUOTE_NO_TRIPLE, Rules.SQUOTE_NO_TRIPLE),
         ImmutableList.of(Rules.HASH, Rules.TRIPLE_DQUOTE, Rules.TRIPLE_SQUOTE)),

  C(Rules.C_SKIP, Rules.C_KEEP),
  CPP(Rules.C_SKIP, Rules.C_KEEP),
  JAVA(Rules.C_SKIP, Rules.C_KEEP),
  CSHARP(Rules.C_SKIP, Rules.C_KEEP),

  /** JavaScript: template literals are skipped along with ordinary strings. */
  JS(Rules.JS_SKIP, Rules.C_KEEP),

  /** Go: raw (backtick) strings are skipped along with ordinary strings and runes. */
  GO(Rules.JS_SKIP, Rules.C_KEEP),

  /** PHP: shell-style {@code #} comments in addition to the C forms. */
  PHP(Rules.C_SKIP,
      ImmutableList.of(Rules.SLASH_SLASH, Rules.HASH, Rules.SLASH_STAR));

  /** Literal forms to skip, in priority order. */
  public final ImmutableList<Rule> skip;

  /** Comment forms to keep, in priority order. */
  public final ImmutableList<Rule> keep;

  /**
   * Returns the dialect named {@code name}, ignoring case. Accepted names are {@code python},
   * {@code c}, {@code c++}, {@code java}, {@code c#}, {@code js}, {@code javascript}, {@code go}
   * and {@code php}.
   * @throws UnsupportedDialectException if {@code name} is none of these.
   */
  public static Dialect forName (String name) {
    Dialect dialect = (name == null) ? null : NAMES.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) throw new UnsupportedDialectException(name);
    return dialect;
  }

  /** Returns the dialect for source files with extension {@code ext} (sans dot), if any. */
  public static Optional<Dialect> forExt (String ext) {
    switch (ext.toLowerCase(Locale.ROOT)) {
      case "py":  return Optional.of(PYTHON);

      case "c":
      case "h":   return Optional.of(C);

      case "cc":
      case "cpp":
      case "cxx":
      case "hh":
      case "hpp": return Optional.of(CPP);

      case "java": return Optional.of(JAVA);
      case "cs":   return Optional.of(CSHARP);

      case "js":
      case "mjs":
      case "cjs": return Optional.of(JS);

      case "go":  return Optional.of(GO);
      case "php": return Optional.of(PHP);

      default:    return Optional.empty();
    }
  }

  /** Returns the canonical (display) name of this dialect, e.g. {@code C++}. */
  public String displayName () {
    switch (this) {
      case PYTHON: return "Python";
      case CPP:    return "C++";
      case JAVA:   return "Java";
      case CSHARP: return "C#";
      case GO:     return "Go";
      default:     return name();
    }
  }

  Dialect (ImmutableList<Rule> skip, ImmutableList<Rule> keep) {
    this.skip = skip;
    this.keep = keep;
  }

  private static final ImmutableMap<String,Dialect> NAMES = ImmutableMap.<String,Dialect>builder().
    put("python", PYTHON).
    put("c", C).
    put("c++", CPP).
    put("java", JAVA).
    put("c#", CSHARP).
    put("js", JS).
    put("javascript", JS).
    put("go", GO).
    put("php", PHP).
    build();

  // enum constants can't reference their own static fields in their constructor args, so the
  // shared rules live in a holder
  private static class Rules {
    static final Rule DQUOTE = new Rule.Quoted('"', false);
    static final Rule SQUOTE = new Rule.Quoted('\'', false);
    static final Rule BACKTICK = new Rule.Quoted('`', false);
    static final Rule DQUOTE_NO_TRIPLE = new Rule.Quoted('"', true);
    static final Rule SQUOTE_NO_TRIPLE = new Rule.Quoted('\'', true);
    static final Rule TRIPLE_DQUOTE = new Rule.Triple('"');
    static final Rule TRIPLE_SQUOTE = new Rule.Triple('\'');

    static final Rule SLASH_SLASH = new Rule.Line("//");
    static final Rule HASH = new Rule.Line("#");
    static final Rule SLASH_STAR = new Rule.Block("/*", "*/");

    static final ImmutableList<Rule> C_SKIP = ImmutableList.of(DQUOTE, SQUOTE);
    static final ImmutableList<Rule> JS_SKIP = ImmutableList.of(DQUOTE, SQUOTE, BACKTICK);
    static final ImmutableList<Rule> C_KEEP = ImmutableList.of(SLASH_SLASH, SLASH_STAR);
  }
}
