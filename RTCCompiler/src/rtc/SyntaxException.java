package rtc;

/**
 * Raised when a trigger clause matches no alternative of the trigger grammar. The position is that
 * of the first token that could not be matched, or the end of the clause if tokens ran out.
 */
public class SyntaxException extends CompilerException {
  private static final long serialVersionUID = 1L;

  public SyntaxException(Tokenizer.Pos pos, String errorMsg) {
    super(pos, errorMsg);
  }
}
