package rtc;

import java.util.Optional;

import com.google.auto.value.AutoValue;

/** A classified word of a trigger clause. */
@AutoValue
public abstract class Token {
  public abstract TokenKind kind();

  /** The surface text, lowercased; multi-word tokens keep their single spaces. */
  public abstract String text();

  public abstract Tokenizer.Pos pos();

  /** The column just past the last character, as read; a phrase may span extra whitespace. */
  public abstract Tokenizer.Pos endPos();

  /** Present for numerals: digits, number words, "a"/"an" and "no". */
  public abstract Optional<Integer> value();

  public boolean is(TokenKind kind) {
    return kind() == kind;
  }

  /** A token whose span is exactly its text. */
  public static Token create(TokenKind kind, String text, Tokenizer.Pos pos) {
    return create(kind, text, pos, pos.addColumns(text.length()));
  }

  public static Token create(
      TokenKind kind, String text, Tokenizer.Pos pos, Tokenizer.Pos endPos) {
    return new AutoValue_Token(kind, text, pos, endPos, Optional.empty());
  }

  public static Token numeral(TokenKind kind, String text, Tokenizer.Pos pos, int value) {
    return numeral(kind, text, pos, pos.addColumns(text.length()), value);
  }

  public static Token numeral(
      TokenKind kind, String text, Tokenizer.Pos pos, Tokenizer.Pos endPos, int value) {
    return new AutoValue_Token(kind, text, pos, endPos, Optional.of(value));
  }

  @Override
  public String toString() {
    return text();
  }
}
