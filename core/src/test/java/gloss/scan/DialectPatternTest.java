//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.scan;

import gloss.model.*;
import gloss.model.Rule;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.*;
import static org.junit.Assert.*;

public class DialectPatternTest {

  @Test public void compiledOnce () {
    assertSame(DialectPattern.compile(Dialect.GO), DialectPattern.compile(Dialect.GO));
    assertNotSame(DialectPattern.compile(Dialect.GO), DialectPattern.compile(Dialect.JS));
    assertEquals(Dialect.PHP, DialectPattern.compile(Dialect.PHP).dialect);
  }

  @Test(expected=NullPointerException.class) public void compileNull () {
    DialectPattern.compile(null);
  }

  @Test public void emptyStringBeforeDocstring () {
    // an empty string right before a docstring: the quote rule takes the former but is kept off
    // the latter, which falls to the triple rule
    DialectMatcher m = DialectPattern.compile(Dialect.PYTHON).matcher("'' '''d'''");
    Match first = m.next();
    assertEquals(Match.Kind.SKIP, first.kind);
    assertEquals("''", first.text);
    Match second = m.next();
    assertEquals(Match.Kind.KEEP, second.kind);
    assertEquals("'''d'''", second.text);
    assertFalse(m.hasNext());
  }

  @Test public void earlierRuleWinsWithinClass () {
    // in PHP both // and # are line comments; a # inside a // comment is part of it
    DialectMatcher m = DialectPattern.compile(Dialect.PHP).matcher("// a # b");
    Match match = m.next();
    assertEquals("// a # b", match.text);
    assertTrue(match.rule instanceof Rule.Line);
    assertEquals("//", ((Rule.Line)match.rule).start);
  }

  @Test public void findFrom () {
    DialectMatcher m = DialectPattern.compile(Dialect.C).matcher("a /* b */ c // d");
    assertEquals(2, m.find(0).start);
    assertEquals(12, m.find(3).start);
    assertNull(m.find(13));
    assertEquals(0, m.position());
  }

  @Test public void findAfterUnclosedLiteral () {
    // the unclosed quote at 4 marks the rule dead from there on, but not before it
    DialectMatcher m = DialectPattern.compile(Dialect.C).matcher("\"a\" \"b // c");
    Match late = m.find(4);
    assertEquals("// c", late.text);
    Match early = m.find(0);
    assertEquals(Match.Kind.SKIP, early.kind);
    assertEquals("\"a\"", early.text);
  }

  @Test public void iterationIsOrderedAndExhausts () {
    DialectMatcher m = DialectPattern.compile(Dialect.JAVA).matcher("'x' /*1*/ \"y\" //2");
    List<String> texts = new ArrayList<>();
    int last = -1;
    while (m.hasNext()) {
      Match match = m.next();
      assertTrue(match.start > last);
      last = match.start;
      texts.add(match.text);
    }
    assertEquals(4, texts.size());
    assertEquals("//2", texts.get(3));
    assertEquals(17, m.position());
  }

  @Test public void sharedAcrossThreads () throws Exception {
    final String code = "x = 1 # a\ny = '# b' # c\n";
    ExecutorService exec = Executors.newFixedThreadPool(4);
    try {
      List<Future<List<String>>> results = new ArrayList<>();
      for (int ii = 0; ii < 32; ii++) {
        results.add(exec.submit(new Callable<List<String>>() {
          public List<String> call () { return Scanner.extract(code, "python"); }
        }));
      }
      for (Future<List<String>> result : results) {
        assertEquals(Scanner.extract(code, Dialect.PYTHON), result.get());
      }
    } finally {
      exec.shutdown();
    }
  }
}
