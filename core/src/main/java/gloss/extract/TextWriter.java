//
// Gloss - pulls comments out of source code
// See the LICENSE file for licensing terms

package gloss.extract;

import gloss.model.*;
import java.io.PrintWriter;

/**
 * A {@code Writer} implementation that emits a simple text-based listing of the comments. Line
 * breaks inside comments are written as tabs so that each comment occupies one line.
 */
public class TextWriter extends Writer {

  public TextWriter (PrintWriter out) {
    _out = out;
  }

  @Override public void openSession () {
    // nada
  }

  @Override public void openUnit (Source source, Dialect dialect) {
    emit("unit", source, dialect.displayName());
    _indent += 1;
  }

  @Override public void emitComment (Comment comment) {
    emit("comment", comment.line + ":" + comment.offset,
         comment.text.replace("\r\n", "\t").replace('\n', '\t').replace('\r', '\t'));
  }

  @Override public void closeUnit () {
    _indent -= 1;
  }

  @Override public void closeSession () {
    _out.flush();
  }

  private PrintWriter emit (String key) {
    PrintWriter out = _out;
    for (int ii = 0, ll = _indent; ii < ll; ii++) out.print(" ");
    out.print(key);
    return out;
  }

  private void emit (String key, Object value1, Object value2) {
    PrintWriter out = emit(key);
    out.print(" ");
    out.print(value1);
    out.print(" ");
    out.println(value2);
  }

  private final PrintWriter _out;
  private int _indent = 0;
}
