//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.scan;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import gloss.model.*;
import java.util.List;
import org.junit.*;
import static org.junit.Assert.*;

public class ScannerTest {

  static List<String> list (String... comments) {
    return ImmutableList.copyOf(comments);
  }

  @Test public void python () {
    String code = Joiner.on("\n").join(
      "# top comment",
      "x = \"has # not a comment\"");
    assertEquals(list("# top comment"), Scanner.extract(code, "python"));
  }

  @Test public void pythonDocstrings () {
    String code = Joiner.on("\n").join(
      "def f():",
      "    '''doc'''",
      "    s = \"\"\"also # kept\"\"\"",
      "    return 'a' # c");
    assertEquals(list("'''doc'''", "\"\"\"also # kept\"\"\"", "# c"),
                 Scanner.extract(code, "Python"));
  }

  @Test public void pythonEmptyStrings () {
    assertEquals(list("# x"), Scanner.extract("s = '' # x", "python"));
    assertEquals(list("# y"), Scanner.extract("s = \"\" + '#' # y", "python"));
  }

  @Test public void pythonMultilineDocstring () {
    String code = Joiner.on("\n").join(
      "'''",
      "Module docs. Quotes ' and \" are fine here.",
      "'''",
      "import os  # os");
    assertEquals(list("'''\nModule docs. Quotes ' and \" are fine here.\n'''", "# os"),
                 Scanner.extract(code, "python"));
  }

  @Test public void cpp () {
    String code = Joiner.on("\n").join(
      "// line",
      "char* s = \"http://x.com\"; // trailing",
      "/* block",
      "   comment */");
    assertEquals(list("// line", "// trailing", "/* block\n   comment */"),
                 Scanner.extract(code, "C++"));
  }

  @Test public void cStyleCharLiterals () {
    assertEquals(list("// x"), Scanner.extract("c = '\"'; // x", "c"));
    assertEquals(list("/* y */"), Scanner.extract("c = '\\''; /* y */", "java"));
  }

  @Test public void escapedDelimiters () {
    assertEquals(list("// c"), Scanner.extract("s = \"a \\\" // b\"; // c", "c#"));
    assertEquals(list("// d"), Scanner.extract("s = \"a\\\\\"; // d", "java"));
  }

  @Test public void js () {
    String code = Joiner.on("\n").join(
      "// JS Comment",
      "const s = `template // not a comment`;",
      "/* Block */");
    assertEquals(list("// JS Comment", "/* Block */"), Scanner.extract(code, "JS"));
    assertEquals(list("// JS Comment", "/* Block */"), Scanner.extract(code, "javascript"));
  }

  @Test public void goRawStrings () {
    String code = Joiner.on("\n").join(
      "s := `a // b",
      "/* still raw */`",
      "// c");
    assertEquals(list("// c"), Scanner.extract(code, "go"));
  }

  @Test public void backticksOnlyInJsAndGo () {
    // java has no backtick literals, so the comment inside them is a comment
    assertEquals(list("// b`"), Scanner.extract("x = `a // b`", "java"));
  }

  @Test public void php () {
    String code = Joiner.on("\n").join(
      "// c-style",
      "# shell-style",
      "$u = \"http://x.com\";",
      "/* block */");
    assertEquals(list("// c-style", "# shell-style", "/* block */"),
                 Scanner.extract(code, "php"));
    assertEquals(list("# y"), Scanner.extract("$a = '#x'; # y", "PHP"));
  }

  @Test public void hashIsNotACommentInC () {
    assertEquals(list(), Scanner.extract("#include <stdio.h>", "c"));
  }

  @Test public void commentsHideQuotes () {
    String code = Joiner.on("\n").join(
      "// don't",
      "x = 1; // ok");
    assertEquals(list("// don't", "// ok"), Scanner.extract(code, "js"));
  }

  @Test public void lineCommentsKeepNoTerminator () {
    assertEquals(list("// a", "// b"), Scanner.extract("// a\r\n// b\r\n", "java"));
    assertEquals(list("# a", "#"), Scanner.extract("# a\n#\n", "python"));
  }

  @Test public void blocksAreNotGreedy () {
    assertEquals(list("/* a */", "/* b */"), Scanner.extract("/* a */ x /* b */", "c"));
    assertEquals(list("/* http://x */"), Scanner.extract("/* http://x */", "c"));
    assertEquals(list("// a /* b"), Scanner.extract("// a /* b\nc */", "java"));
  }

  @Test public void unclosedBlocksRunToEnd () {
    assertEquals(list("/* never closed\nstill"),
                 Scanner.extract("int x; /* never closed\nstill", "c"));
    assertEquals(list("'''open\nmore"), Scanner.extract("'''open\nmore", "python"));
  }

  @Test public void unclosedLiteralsAreSteppedOver () {
    assertEquals(list("// tail"), Scanner.extract("x = \"abc // tail", "c"));
    assertEquals(list("// c"), Scanner.extract("x = 'a; // c", "c"));
  }

  @Test public void emptyAndCommentless () {
    assertEquals(list(), Scanner.extract("", "python"));
    assertEquals(list(), Scanner.extract("int x = 1;", "c"));
    assertEquals(list(), Scanner.extract("s = \"// nope\"", "go"));
  }

  @Test public void idempotent () {
    String code = "a = 1 # one\nb = '#' # two\n";
    assertEquals(Scanner.extract(code, "python"), Scanner.extract(code, "python"));
    assertEquals(Scanner.extract(code, "PYTHON"), Scanner.extract(code, "python"));
  }

  @Test(expected=UnsupportedDialectException.class) public void unsupported () {
    Scanner.extract("IDENTIFICATION DIVISION.", "cobol");
  }

  @Test public void longLiteral () {
    // long enough to blow the stack of a recursive regex engine
    String code = "s = \"" + Strings.repeat("a\\\"", 100000) + "\"; // c";
    assertEquals(list("// c"), Scanner.extract(code, "java"));
  }

  @Test public void manyUnclosedLiterals () {
    String code = Strings.repeat("it's ", 20001) + "// done";
    assertEquals(list("// done"), Scanner.extract(code, "java"));
  }

  @Test public void positions () {
    String code = Joiner.on("\n").join(
      "int a; // one",
      "/* two",
      " */ int b; // three");
    assertEquals(ImmutableList.of(new Comment(7, 1, "// one"),
                                  new Comment(14, 2, "/* two\n */"),
                                  new Comment(32, 3, "// three")),
                 Scanner.comments(code, Dialect.JAVA));
  }

  @Test public void positionsWithCarriageReturns () {
    List<Comment> comments = Scanner.comments("x\r\n# a\ry # b", Dialect.PYTHON);
    assertEquals(2, comments.size());
    assertEquals(2, comments.get(0).line);
    assertEquals(3, comments.get(1).line);
    assertEquals("# b", comments.get(1).text);
  }

  @Test public void matchesIncludeLiterals () {
    List<Match> matches = Scanner.matches("x = \"a\" // b", Dialect.C);
    assertEquals(2, matches.size());
    assertEquals(Match.Kind.SKIP, matches.get(0).kind);
    assertEquals("\"a\"", matches.get(0).text);
    assertEquals(4, matches.get(0).start);
    assertEquals(7, matches.get(0).end);
    assertEquals(Match.Kind.KEEP, matches.get(1).kind);
    assertEquals("// b", matches.get(1).text);
  }

  @Test public void countLines () {
    assertEquals(0, Scanner.countLines("abc", 0, 3));
    assertEquals(2, Scanner.countLines("a\nb\nc", 0, 5));
    assertEquals(1, Scanner.countLines("a\r\nb", 0, 4));
    assertEquals(2, Scanner.countLines("a\r\rb", 0, 4));
  }
}
