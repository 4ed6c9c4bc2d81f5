package rtc;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

abstract class ErrorCollectingValidator extends VoidDefaultASTVisitor {
  private final List<CompilerException> errors = new ArrayList<>();

  protected ImmutableList<CompilerException> errors() {
    return ImmutableList.copyOf(errors);
  }

  protected void logError(Tokenizer.Pos pos, String msg) {
    logError(new CompilerException(pos, msg));
  }

  protected void logError(CompilerException ex) {
    errors.add(ex);
  }
}
