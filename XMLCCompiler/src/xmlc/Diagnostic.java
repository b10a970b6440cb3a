package xmlc;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/** A parser error or warning, pointing at one or more tokens. */
@AutoValue
public abstract class Diagnostic {
  public enum Severity {
    ERROR,
    WARNING;
  }

  public enum Kind {
    UNEXPECTED_TOKEN_REACHED(Severity.ERROR, "unexpected token"),
    EXPECTED_TOKEN_MISSING(Severity.ERROR, "missing expected token"),
    ENCLOSING_TOKEN_MISSING(Severity.ERROR, "missing enclosing token"),
    ENCLOSING_TOKEN_MISMATCH(Severity.ERROR, "mismatching tokens found"),
    UNEXPECTED_END_OF_FILE(Severity.ERROR, "unexpected end of file"),
    MISSING_RETURN_STATEMENT(Severity.ERROR, "missing return statement"),
    UNEXPECTED_TOKEN_POSITION(Severity.WARNING, "unexpected token position");

    private final Severity severity;
    private final String title;

    private Kind(Severity severity, String title) {
      this.severity = severity;
      this.title = title;
    }

    public Severity severity() {
      return severity;
    }

    public String title() {
      return title;
    }
  }

  @AutoValue
  public abstract static class Issue {
    public abstract Tokenizer.Token token();

    public abstract String message();

    public static Issue create(Tokenizer.Token token, String message) {
      return new AutoValue_Diagnostic_Issue(token, message);
    }
  }

  public abstract Kind kind();

  public abstract ImmutableList<Issue> issues();

  public Severity severity() {
    return kind().severity();
  }

  public boolean isError() {
    return severity() == Severity.ERROR;
  }

  public Tokenizer.Pos pos() {
    return issues().get(0).token().pos();
  }

  public static Diagnostic create(Kind kind, Iterable<Issue> issues) {
    ImmutableList<Issue> list = ImmutableList.copyOf(issues);
    Preconditions.checkArgument(!list.isEmpty(), "a diagnostic needs at least one issue");
    return new AutoValue_Diagnostic(kind, list);
  }

  public static Diagnostic create(Kind kind, Tokenizer.Token token, String message) {
    return create(kind, ImmutableList.of(Issue.create(token, message)));
  }

  /** Single-line summary, e.g. {@code error: missing expected token: 'x' ...}. */
  public String summary() {
    Issue first = issues().get(0);
    return String.format(
        "%s: %s: '%s' %s",
        severity().name().toLowerCase(),
        kind().title(),
        first.token().text(),
        first.message());
  }

  /**
   * Renders the diagnostic with a source excerpt per issue:
   *
   * <pre>
   * [error]: mismatching tokens found
   * at main.xml:1:2
   *
   *    1 | &lt;function name="f" type="none"&gt;
   *      |  ^^^^^^^^ this tag
   * </pre>
   */
  public String render(List<String> sourceLines) {
    StringBuilder sb = new StringBuilder();
    sb.append('[').append(severity().name().toLowerCase()).append("]: ").append(kind().title());
    for (Issue issue : issues()) {
      Tokenizer.Pos pos = issue.token().pos();
      sb.append('\n')
          .append(String.format("at %s:%d:%d", pos.file(), pos.lineNumber() + 1, pos.column() + 1))
          .append("\n\n");

      String line =
          pos.lineNumber() >= 0 && pos.lineNumber() < sourceLines.size()
              ? sourceLines.get(pos.lineNumber())
              : "";
      int column = Math.max(0, Math.min(pos.column(), line.length()));
      int width = Math.max(1, Math.min(issue.token().text().length(), line.length() - column));
      sb.append(Strings.padStart(Integer.toString(pos.lineNumber() + 1), 4, ' '))
          .append(" | ")
          .append(line)
          .append('\n')
          .append("     | ")
          .append(Strings.repeat(" ", column))
          .append(Strings.repeat("^", width))
          .append(' ')
          .append(issue.message());
    }
    return sb.toString();
  }
}
