package xmlc;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Collects the diagnostics of one compilation. Reporting never throws; callers check {@link
 * #hasErrors()} once a stage is done.
 */
public final class Diagnostics {
  private static final Logger logger = LoggerFactory.getLogger(Diagnostics.class);

  private final ImmutableList<String> sourceLines;
  private final List<Diagnostic> reported = new ArrayList<>();

  public Diagnostics(List<String> sourceLines) {
    this.sourceLines = ImmutableList.copyOf(sourceLines);
  }

  public void report(Diagnostic diagnostic) {
    logger.debug("{} at {}", diagnostic.summary(), diagnostic.pos());
    reported.add(diagnostic);
  }

  public void error(Diagnostic.Kind kind, Tokenizer.Token token, String message) {
    Preconditions.checkArgument(kind.severity() == Diagnostic.Severity.ERROR, kind);
    report(Diagnostic.create(kind, token, message));
  }

  public void warning(Diagnostic.Kind kind, Tokenizer.Token token, String message) {
    Preconditions.checkArgument(kind.severity() == Diagnostic.Severity.WARNING, kind);
    report(Diagnostic.create(kind, token, message));
  }

  public ImmutableList<Diagnostic> all() {
    return ImmutableList.copyOf(reported);
  }

  public ImmutableList<Diagnostic> errors() {
    return reported.stream().filter(Diagnostic::isError).collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Diagnostic> warnings() {
    return reported
        .stream()
        .filter(d -> !d.isError())
        .collect(ImmutableList.toImmutableList());
  }

  public boolean hasErrors() {
    return reported.stream().anyMatch(Diagnostic::isError);
  }

  public void print(PrintStream out) {
    for (Diagnostic diagnostic : reported) {
      out.println(diagnostic.render(sourceLines));
      out.println();
    }
  }
}
