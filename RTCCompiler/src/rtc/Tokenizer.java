package rtc;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/** Produces a tokenization of the input: one token list per trigger clause, one clause per line. */
public class Tokenizer {
  public static class Pos implements Comparable<Pos> {
    private static final Pos INTERNAL = new Pos("<internal>", -1, -1);

    public static Pos internal() {
      return INTERNAL;
    }

    private final String file;
    private final int lineNumber;
    private final int column;

    public Pos(String file, int lineNumber, int column) {
      this.file = file;
      this.lineNumber = lineNumber;
      this.column = column;
    }

    public String file() {
      return file;
    }

    public int lineNumber() {
      return lineNumber;
    }

    public int column() {
      return column;
    }

    public boolean isInternal() {
      return this == INTERNAL;
    }

    public Pos addColumns(int columns) {
      if (isInternal()) return this;
      return new Pos(file, lineNumber, column + columns);
    }

    @Override
    public int compareTo(Pos pos) {
      return Comparator.<Pos, String>comparing(Pos::file)
          .thenComparing(Pos::lineNumber)
          .thenComparing(Pos::column)
          .compare(this, pos);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Pos)) return false;
      Pos other = (Pos) obj;
      return file.equals(other.file) && lineNumber == other.lineNumber && column == other.column;
    }

    @Override
    public int hashCode() {
      return (file.hashCode() * 31 + lineNumber) * 31 + column;
    }

    @Override
    public String toString() {
      return String.format("%s@%d:%d", file, lineNumber + 1, column + 1);
    }
  }

  // A whitespace-delimited word before classification.
  private static class RawWord {
    private final String text;
    private final Pos pos;
    private final Pos endPos;

    private RawWord(String text, Pos pos, Pos endPos) {
      this.text = text;
      this.pos = pos;
      this.endPos = endPos;
    }

    private boolean isPunctuation() {
      return text.equals(",") || text.equals(".");
    }
  }

  private static final CharMatcher WORD_CHARS =
      CharMatcher.javaLetterOrDigit().or(CharMatcher.anyOf("~'+-/"));

  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

  private final String file;
  private final ImmutableList<String> lines;
  private final Keywords keywords;

  public Tokenizer(String file, String content) {
    this(file, content, Keywords.instance());
  }

  public Tokenizer(String file, String content, Keywords keywords) {
    this.file = file;
    this.lines = ImmutableList.copyOf(Splitter.on('\n').split(content));
    this.keywords = keywords;
  }

  /** Returns the tokens of every non-blank, non-comment line, in order. */
  public ImmutableList<ImmutableList<Token>> tokenize() throws CompilerException {
    ImmutableList.Builder<ImmutableList<Token>> clauses = ImmutableList.builder();
    for (int line = 0; line < lines.size(); line++) {
      List<RawWord> words = splitWords(line, lines.get(line));
      if (!words.isEmpty()) {
        clauses.add(classify(words));
      }
    }
    return clauses.build();
  }

  private List<RawWord> splitWords(int line, String text) throws CompilerException {
    List<RawWord> words = new ArrayList<>();
    StringBuilder word = new StringBuilder();
    int wordStart = -1;
    for (int col = 0; col < text.length(); col++) {
      char ch = text.charAt(col);
      if (ch == '/' && col + 1 < text.length() && text.charAt(col + 1) == '/') {
        break;
      } else if (WORD_CHARS.matches(ch)) {
        if (word.length() == 0) wordStart = col;
        word.append(ch);
        continue;
      }

      closeWord(words, word, line, wordStart);
      if (ch == ',' || ch == '.') {
        words.add(
            new RawWord(
                Character.toString(ch), new Pos(file, line, col), new Pos(file, line, col + 1)));
      } else if (!Character.isWhitespace(ch)) {
        throw new CompilerException(
            new Pos(file, line, col), String.format("unexpected character '%c'", ch));
      }
    }
    closeWord(words, word, line, wordStart);
    return words;
  }

  private void closeWord(List<RawWord> words, StringBuilder word, int line, int wordStart) {
    if (word.length() == 0) return;

    words.add(
        new RawWord(
            word.toString().toLowerCase(Locale.ROOT),
            new Pos(file, line, wordStart),
            new Pos(file, line, wordStart + word.length())));
    word.setLength(0);
  }

  private ImmutableList<Token> classify(List<RawWord> words) throws CompilerException {
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    int i = 0;
    while (i < words.size()) {
      RawWord first = words.get(i);
      if (first.isPunctuation()) {
        TokenKind kind = first.text.equals(",") ? TokenKind.COMMA : TokenKind.PERIOD;
        tokens.add(Token.create(kind, first.text, first.pos, first.endPos));
        i++;
        continue;
      }

      // Longest phrase first.
      int taken = 1;
      Token token = null;
      for (int n = Math.min(Keywords.MAX_PHRASE_WORDS, words.size() - i); n > 1; n--) {
        Optional<String> phrase = phrase(words, i, n);
        if (phrase.isPresent() && keywords.contains(phrase.get())) {
          token = keywordToken(phrase.get(), first.pos, words.get(i + n - 1).endPos);
          taken = n;
          break;
        }
      }
      if (token == null) {
        token = wordToken(first);
      }

      tokens.add(token);
      i += taken;
    }
    return tokens.build();
  }

  private static Optional<String> phrase(List<RawWord> words, int start, int n) {
    StringBuilder sb = new StringBuilder();
    for (int i = start; i < start + n; i++) {
      RawWord word = words.get(i);
      if (word.isPunctuation()) return Optional.empty();
      if (i > start) sb.append(' ');
      sb.append(word.text);
    }
    return Optional.of(sb.toString());
  }

  private Token wordToken(RawWord word) throws CompilerException {
    if (keywords.contains(word.text)) {
      return keywordToken(word.text, word.pos, word.endPos);
    } else if (DIGITS.matchesAllOf(word.text)) {
      try {
        return Token.numeral(
            TokenKind.NUMBER, word.text, word.pos, word.endPos, Integer.parseInt(word.text));
      } catch (NumberFormatException ex) {
        throw new CompilerException(word.pos, "could not parse as integer");
      }
    }
    return Token.create(TokenKind.WORD, word.text, word.pos, word.endPos);
  }

  private Token keywordToken(String text, Pos pos, Pos endPos) {
    TokenKind kind = keywords.lookup(text).get();
    Optional<Integer> value = keywords.numeralValue(text);
    if (value.isPresent()) {
      return Token.numeral(kind, text, pos, endPos, value.get());
    }
    return Token.create(kind, text, pos, endPos);
  }
}
