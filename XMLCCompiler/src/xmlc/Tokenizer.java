package xmlc;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Objects;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Produces a tokenization of the input.
 *
 * <p>Every line is scanned on its own. A token's depth is the number of four-column indentation
 * units that precede its line's content; tabs count as four columns. The tokenizer never fails:
 * anything malformed is left for the parser to report.
 */
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

    /** Zero-based. */
    public int lineNumber() {
      return lineNumber;
    }

    /** Zero-based. */
    public int column() {
      return column;
    }

    @Override
    public int compareTo(Pos pos) {
      return Comparator.<Pos, String>comparing(p -> p.file())
          .thenComparing(Pos::lineNumber)
          .thenComparing(Pos::column)
          .compare(this, pos);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Pos)) {
        return false;
      }
      Pos that = (Pos) obj;
      return file.equals(that.file) && lineNumber == that.lineNumber && column == that.column;
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(file, lineNumber, column);
    }

    @Override
    public String toString() {
      return String.format("%s@%d:%d", file, lineNumber + 1, column + 1);
    }
  }

  @AutoValue
  public abstract static class Token {
    public enum Kind {
      LEFT_ANGLE,
      RIGHT_ANGLE,
      DOUBLE_QUOTE,
      SINGLE_QUOTE,
      SLASH,
      EQUAL,
      KEYWORD,
      LITERAL,
      PROPERTY,
      END_OF_FILE;

      public boolean isQuote() {
        return this == DOUBLE_QUOTE || this == SINGLE_QUOTE;
      }
    }

    public abstract String text();

    public abstract Kind kind();

    public abstract Pos pos();

    public abstract int depth();

    public boolean is(Kind kind) {
      return kind() == kind;
    }

    public boolean is(Kind kind, String text) {
      return kind() == kind && text().equals(text);
    }

    public static Token create(String text, Kind kind, Pos pos, int depth) {
      return new AutoValue_Tokenizer_Token(text, kind, pos, depth);
    }

    @Override
    public String toString() {
      return String.format("%s '%s' at %s", kind(), text(), pos());
    }
  }

  public static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of("arg", "call", "else", "function", "if", "let", "program", "return");

  public static final int INDENT_WIDTH = 4;

  public static final String END_OF_FILE_TEXT = "EOF";

  private static final CharMatcher WORD_DELIMITERS =
      CharMatcher.whitespace().or(CharMatcher.anyOf("<>/=\"'"));

  private final String file;
  private final ImmutableList<String> lines;

  private final List<Token> tokens = new ArrayList<>();

  // Per-line scanning state.
  private int line;
  private int col;
  private int depth;
  private boolean expectKeyword;

  public Tokenizer(String file, String content) {
    this.file = file;
    this.lines = splitLines(content);
  }

  /** Splits {@code content} into lines without terminators. A final newline ends the last line. */
  public static ImmutableList<String> splitLines(String content) {
    List<String> lines = new ArrayList<>();
    for (String line : Splitter.on('\n').split(content)) {
      lines.add(CharMatcher.is('\r').trimTrailingFrom(line));
    }
    if (lines.size() > 1 && lines.get(lines.size() - 1).isEmpty()) {
      lines.remove(lines.size() - 1);
    }
    return ImmutableList.copyOf(lines);
  }

  public String file() {
    return file;
  }

  public ImmutableList<String> lines() {
    return lines;
  }

  /** Returns every token in source order, terminated by a single {@code END_OF_FILE} token. */
  public ImmutableList<Token> tokenize() {
    tokens.clear();
    for (line = 0; line < lines.size(); line++) {
      tokenizeLine(lines.get(line));
    }
    tokens.add(
        Token.create(
            END_OF_FILE_TEXT,
            Token.Kind.END_OF_FILE,
            new Pos(file, Math.max(0, lines.size() - 1), 0),
            0));
    return ImmutableList.copyOf(tokens);
  }

  private void tokenizeLine(String text) {
    int width = 0;
    col = 0;
    while (col < text.length() && (text.charAt(col) == ' ' || text.charAt(col) == '\t')) {
      width += text.charAt(col) == '\t' ? INDENT_WIDTH : 1;
      col++;
    }
    depth = width / INDENT_WIDTH;
    expectKeyword = false;

    while (col < text.length()) {
      char ch = text.charAt(col);
      switch (ch) {
        case '<':
          emit(Token.Kind.LEFT_ANGLE, "<", col++);
          expectKeyword = true;
          break;
        case '/':
          // Keeps expectKeyword, so '</' reads like '<'.
          emit(Token.Kind.SLASH, "/", col++);
          break;
        case '>':
          emit(Token.Kind.RIGHT_ANGLE, ">", col++);
          expectKeyword = false;
          readText(text);
          break;
        case '=':
          emit(Token.Kind.EQUAL, "=", col++);
          expectKeyword = false;
          break;
        case '"':
          readQuoted(text, Token.Kind.DOUBLE_QUOTE);
          break;
        case '\'':
          readQuoted(text, Token.Kind.SINGLE_QUOTE);
          break;
        default:
          if (CharMatcher.whitespace().matches(ch)) {
            col++;
          } else {
            readWord(text);
          }
          break;
      }
    }
  }

  private void emit(Token.Kind kind, String text, int column) {
    tokens.add(Token.create(text, kind, new Pos(file, line, column), depth));
  }

  // Element content: everything up to the next '<' on this line.
  private void readText(String text) {
    int end = text.indexOf('<', col);
    if (end < 0) {
      end = text.length();
    }
    String raw = text.substring(col, end);
    String trimmed = CharMatcher.whitespace().trimFrom(raw);
    if (!trimmed.isEmpty()) {
      emit(Token.Kind.LITERAL, trimmed, col + raw.indexOf(trimmed));
    }
    col = end;
  }

  private void readQuoted(String text, Token.Kind quoteKind) {
    char quote = text.charAt(col);
    emit(quoteKind, String.valueOf(quote), col);
    expectKeyword = false;

    int start = col + 1;
    int end = text.indexOf(quote, start);
    if (end < 0) {
      end = text.length();
    }
    if (end > start) {
      emit(Token.Kind.LITERAL, text.substring(start, end), start);
    }
    if (end < text.length()) {
      emit(quoteKind, String.valueOf(quote), end);
      col = end + 1;
    } else {
      col = end;
    }
  }

  private void readWord(String text) {
    int start = col;
    while (col < text.length() && !WORD_DELIMITERS.matches(text.charAt(col))) {
      col++;
    }
    String word = text.substring(start, col);
    emit(
        expectKeyword && KEYWORDS.contains(word) ? Token.Kind.KEYWORD : Token.Kind.PROPERTY,
        word,
        start);
    expectKeyword = false;
  }
}
