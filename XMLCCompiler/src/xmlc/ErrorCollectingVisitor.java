package xmlc;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Base for tree passes that report every problem they find before failing. */
abstract class ErrorCollectingVisitor extends VoidDefaultASTVisitor {
  private static final Logger logger = LoggerFactory.getLogger(ErrorCollectingVisitor.class);

  private final List<CompilerException> errors = new ArrayList<>();

  protected void logError(Tokenizer.Pos pos, String msg) {
    logError(new CompilerException(pos, msg));
  }

  protected void logError(CompilerException ex) {
    errors.add(ex);
  }

  protected void logConflict(Tokenizer.Pos duplicate, Tokenizer.Pos previous, String what) {
    logError(duplicate, String.format("found duplicate %s", what));
    logError(previous, String.format("previous %s is here", what));
  }

  /** Throws the first error logged, if any. */
  public void throwFirstError() throws CompilerException {
    for (CompilerException ex : errors.subList(Math.min(1, errors.size()), errors.size())) {
      logger.debug("Also found: {} {}", ex.pos(), ex.errorMsg());
    }
    if (!errors.isEmpty()) {
      throw errors.get(0);
    }
  }
}
