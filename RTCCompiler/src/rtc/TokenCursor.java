package rtc;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/** A forward-only position in the tokens of one clause. */
public final class TokenCursor {
  private final ImmutableList<Token> tokens;
  private final Tokenizer.Pos endPos;
  private int index = 0;

  public TokenCursor(List<Token> tokens) {
    this.tokens = ImmutableList.copyOf(tokens);
    this.endPos =
        this.tokens.isEmpty()
            ? Tokenizer.Pos.internal()
            : this.tokens.get(this.tokens.size() - 1).endPos();
  }

  public boolean atEnd() {
    return index >= tokens.size();
  }

  public int index() {
    return index;
  }

  /** The token {@code ahead} places past the current one; {@code peek(0)} is the current token. */
  public Optional<Token> peek(int ahead) {
    int i = index + ahead;
    return i < tokens.size() ? Optional.of(tokens.get(i)) : Optional.empty();
  }

  public Optional<Token> peek() {
    return peek(0);
  }

  public boolean at(TokenKind kind) {
    return peekIs(0, kind);
  }

  public boolean peekIs(int ahead, TokenKind kind) {
    return peek(ahead).map(t -> t.is(kind)).orElse(false);
  }

  /** Consumes the current token if it has the given kind. */
  public Optional<Token> accept(TokenKind kind) {
    if (!at(kind)) return Optional.empty();
    return Optional.of(advance());
  }

  public Token advance() {
    if (atEnd()) throw new IllegalStateException("advanced past end of clause");
    return tokens.get(index++);
  }

  /** Consumes the current token, which must have one of the given kinds. */
  public Token expect(TokenKind... kinds) throws SyntaxException {
    for (TokenKind kind : kinds) {
      if (at(kind)) return advance();
    }
    throw error("expected " + Joiner.on(" or ").join(kinds).toLowerCase(Locale.ROOT));
  }

  /** Position of the current token, or of the end of the clause once all tokens are consumed. */
  public Tokenizer.Pos pos() {
    return peek().map(Token::pos).orElse(endPos);
  }

  public Tokenizer.Pos endPos() {
    return endPos;
  }

  /** A syntax error at the current token, naming what was found there. */
  public SyntaxException error(String msg) {
    String found = peek().map(t -> "'" + t.text() + "'").orElse("end of clause");
    return new SyntaxException(pos(), String.format("%s, but found %s", msg, found));
  }
}
