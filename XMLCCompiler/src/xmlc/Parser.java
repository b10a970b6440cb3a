package xmlc;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import xmlc.Tokenizer.Token;

/**
 * Builds an {@link AST.Program} from tokens.
 *
 * <p>Nesting is decided by depth alone: a tag's body is every following token indented deeper
 * than the tag itself, and each child must start exactly one level deeper. The spelling of the
 * closing tag is only checked against the opening one.
 *
 * <p>Every problem is reported to {@link Diagnostics}. A construct that cannot be parsed throws
 * {@link CompilerException} up to the enclosing body, which skips ahead to the next sibling and
 * carries on, so one run reports as many independent errors as possible. {@link #parse()} fails
 * if any error was reported.
 */
public final class Parser {
  private static final Logger logger = LoggerFactory.getLogger(Parser.class);

  static final String GIVE_UP = "I give up.";

  private static final String PROGRAM = "program";
  private static final String FUNCTION = "function";
  private static final String LET = "let";
  private static final String CALL = "call";
  private static final String ARG = "arg";
  private static final String RETURN = "return";
  private static final String IF = "if";
  private static final String ELSE = "else";

  private static final String MAIN = "main";

  /** Where a body is parsed; decides which children are allowed. */
  private enum Scope {
    PROGRAM,
    FUNCTION,
    CALL,
    BRANCH;
  }

  @AutoValue
  abstract static class Property {
    abstract Token name();

    abstract AST.Expression value();

    String text() {
      return value().value();
    }

    static Property create(Token name, AST.Expression value) {
      return new AutoValue_Parser_Property(name, value);
    }
  }

  @AutoValue
  abstract static class Tag {
    abstract Token keyword();

    abstract ImmutableList<Property> properties();

    String name() {
      return keyword().text();
    }

    int depth() {
      return keyword().depth();
    }

    int indexOf(String property) {
      for (int i = 0; i < properties().size(); i++) {
        if (properties().get(i).name().text().equals(property)) {
          return i;
        }
      }
      return -1;
    }

    Optional<Property> property(String property) {
      int index = indexOf(property);
      return index < 0 ? Optional.empty() : Optional.of(properties().get(index));
    }

    static Tag create(Token keyword, List<Property> properties) {
      return new AutoValue_Parser_Tag(keyword, ImmutableList.copyOf(properties));
    }
  }

  private final ImmutableList<Token> tokens;
  private final Diagnostics diagnostics;
  private int cursor = 0;

  public Parser(List<Token> tokens, Diagnostics diagnostics) {
    Preconditions.checkArgument(
        !tokens.isEmpty() && Iterables.getLast(tokens).is(Token.Kind.END_OF_FILE),
        "the token list must end with END_OF_FILE");
    this.tokens = ImmutableList.copyOf(tokens);
    this.diagnostics = diagnostics;
  }

  public AST.Program parse() throws CompilerException {
    AST.Program program;
    try {
      program = parseProgram();
    } catch (CompilerException ex) {
      CompilerException giveUp = giveUp();
      giveUp.initCause(ex);
      throw giveUp;
    }

    if (diagnostics.hasErrors()) {
      throw giveUp();
    }
    logger.debug("Parsed {} top-level nodes", program.scope().size());
    return program;
  }

  private CompilerException giveUp() {
    ImmutableList<Diagnostic> errors = diagnostics.errors();
    Verify.verify(!errors.isEmpty(), "parsing stopped without reporting an error");
    return new CompilerException(errors.get(0).pos(), GIVE_UP);
  }

  // Cursor.

  private Token peek() {
    return tokens.get(cursor);
  }

  private Token peek(int distance) {
    return tokens.get(Math.min(cursor + distance, tokens.size() - 1));
  }

  private Token advance() {
    Token token = peek();
    if (!token.is(Token.Kind.END_OF_FILE)) {
      cursor++;
    }
    return token;
  }

  private boolean atClosingTag() {
    return peek().is(Token.Kind.LEFT_ANGLE) && peek(1).is(Token.Kind.SLASH);
  }

  private boolean atOpeningTag(String keyword) {
    return peek().is(Token.Kind.LEFT_ANGLE) && peek(1).is(Token.Kind.KEYWORD, keyword);
  }

  // Errors.

  private CompilerException fail(Diagnostic.Kind kind, Token token, String message) {
    diagnostics.error(kind, token, message);
    return new CompilerException(token.pos(), message);
  }

  private CompilerException unexpected(Diagnostic.Kind kind, Token token, String expectation) {
    if (token.is(Token.Kind.END_OF_FILE)) {
      return fail(
          Diagnostic.Kind.UNEXPECTED_END_OF_FILE,
          token,
          "was reached while looking for " + expectation);
    }
    return fail(kind, token, "was found instead of " + expectation);
  }

  private Token expect(Token.Kind kind, String expectation, Diagnostic.Kind onMismatch)
      throws CompilerException {
    if (!peek().is(kind)) {
      throw unexpected(onMismatch, peek(), expectation);
    }
    return advance();
  }

  /**
   * Skips the rest of a construct that failed inside {@code parent}: stops at the next token no
   * deeper than {@code parent}, or at the next tag opening one level deeper.
   */
  private void synchronize(Tag parent, int start) {
    if (cursor == start) {
      advance();
    }
    while (!peek().is(Token.Kind.END_OF_FILE)) {
      Token token = peek();
      if (token.depth() <= parent.depth()) {
        break;
      }
      if (token.is(Token.Kind.LEFT_ANGLE)
          && peek(1).is(Token.Kind.KEYWORD)
          && token.depth() == parent.depth() + 1) {
        break;
      }
      advance();
    }
    logger.debug("Resynchronized at {}", peek());
  }

  // Tags.

  private Tag parseOpeningTag(String keyword) throws CompilerException {
    expect(Token.Kind.LEFT_ANGLE, "a '<'", Diagnostic.Kind.UNEXPECTED_TOKEN_REACHED);
    if (!peek().is(Token.Kind.KEYWORD, keyword)) {
      throw unexpected(Diagnostic.Kind.UNEXPECTED_TOKEN_REACHED, peek(), "a tag");
    }
    Token tag = advance();

    List<Property> properties = new ArrayList<>();
    while (!peek().is(Token.Kind.RIGHT_ANGLE)) {
      Token name =
          expect(Token.Kind.PROPERTY, "a property", Diagnostic.Kind.UNEXPECTED_TOKEN_REACHED);
      expect(Token.Kind.EQUAL, "equals", Diagnostic.Kind.EXPECTED_TOKEN_MISSING);

      Token quote = peek();
      if (!quote.kind().isQuote()) {
        throw unexpected(Diagnostic.Kind.EXPECTED_TOKEN_MISSING, quote, "quotes");
      }
      advance();
      AST.Expression value = parseExpression("a property value");
      if (!peek().is(quote.kind())) {
        throw unexpected(Diagnostic.Kind.EXPECTED_TOKEN_MISSING, peek(), "closing " + quote.text());
      }
      advance();

      properties.add(Property.create(name, value));
    }
    advance();

    return Tag.create(tag, properties);
  }

  private void parseClosingTag(Tag tag) throws CompilerException {
    if (!atClosingTag()) {
      throw fail(
          Diagnostic.Kind.ENCLOSING_TOKEN_MISSING,
          tag.keyword(),
          String.format("is never closed by a </%s> tag", tag.name()));
    }
    Token open = peek();
    Token closing = peek(2);
    if (!closing.is(Token.Kind.KEYWORD)) {
      advance();
      advance();
      throw unexpected(Diagnostic.Kind.UNEXPECTED_TOKEN_REACHED, closing, "a tag");
    }

    if (!closing.text().equals(tag.name())) {
      diagnostics.report(
          Diagnostic.create(
              Diagnostic.Kind.ENCLOSING_TOKEN_MISMATCH,
              ImmutableList.of(
                  Diagnostic.Issue.create(tag.keyword(), "this tag"),
                  Diagnostic.Issue.create(closing, "does not match with this one"))));
      // A shallower closing tag belongs to an enclosing construct; leave it there.
      if (open.depth() >= tag.depth()) {
        skipClosingTag();
      }
      throw new CompilerException(closing.pos(), "mismatched closing tag");
    }
    if (open.depth() != tag.depth()) {
      diagnostics.report(
          Diagnostic.create(
              Diagnostic.Kind.ENCLOSING_TOKEN_MISMATCH,
              ImmutableList.of(
                  Diagnostic.Issue.create(tag.keyword(), "opens at depth " + tag.depth()),
                  Diagnostic.Issue.create(closing, "closes at depth " + open.depth()))));
    }

    advance();
    advance();
    advance();
    expect(Token.Kind.RIGHT_ANGLE, "a '>'", Diagnostic.Kind.UNEXPECTED_TOKEN_REACHED);
  }

  private void skipClosingTag() {
    advance();
    advance();
    advance();
    if (peek().is(Token.Kind.RIGHT_ANGLE)) {
      advance();
    }
  }

  private Property require(Tag tag, String property) throws CompilerException {
    Optional<Property> found = tag.property(property);
    if (!found.isPresent()) {
      throw fail(
          Diagnostic.Kind.EXPECTED_TOKEN_MISSING,
          tag.keyword(),
          String.format("requires property '%s'", property));
    }
    return found.get();
  }

  private void checkType(Property type) {
    if (!AST.TYPES.contains(type.text())) {
      diagnostics.error(
          Diagnostic.Kind.UNEXPECTED_TOKEN_REACHED,
          type.value().token(),
          "is not a type; expected one of " + Joiner.on(", ").join(AST.TYPES));
    }
  }

  private AST.Expression parseExpression(String expectation) throws CompilerException {
    if (!peek().is(Token.Kind.LITERAL)) {
      throw unexpected(Diagnostic.Kind.UNEXPECTED_TOKEN_REACHED, peek(), expectation);
    }
    Token literal = advance();
    return new AST.Literal(literal, literal.text());
  }

  // A value comes from the 'value' property, or else from the text between the tags.
  private Optional<AST.Expression> parseValue(Tag tag) throws CompilerException {
    Optional<Property> property = tag.property("value");
    if (property.isPresent()) {
      return Optional.of(property.get().value());
    } else if (peek().is(Token.Kind.LITERAL)) {
      return Optional.of(parseExpression("a value"));
    }
    return Optional.empty();
  }

  private AST.Expression parseRequiredValue(Tag tag) throws CompilerException {
    Optional<AST.Expression> value = parseValue(tag);
    if (!value.isPresent()) {
      throw unexpected(Diagnostic.Kind.EXPECTED_TOKEN_MISSING, peek(), "property 'value'");
    }
    return value.get();
  }

  // Bodies.

  private List<AST.Node> parseBody(Tag tag, Scope scope, String resultType) {
    List<AST.Node> nodes = new ArrayList<>();
    while (!peek().is(Token.Kind.END_OF_FILE) && peek().depth() > tag.depth()) {
      // Closing tags end a body whatever their indentation.
      if (atClosingTag()) {
        break;
      }

      int start = cursor;
      try {
        Token first = peek();
        if (first.depth() != tag.depth() + 1) {
          throw fail(
              Diagnostic.Kind.UNEXPECTED_TOKEN_REACHED,
              first,
              String.format(
                  "is indented too deeply; children of <%s> start at depth %d",
                  tag.name(), tag.depth() + 1));
        }
        nodes.add(parseChild(tag, scope, resultType));
      } catch (CompilerException ex) {
        logger.debug("Recovering from '{}' in <{}>", ex.errorMsg(), tag.name());
        synchronize(tag, start);
      }
    }
    return nodes;
  }

  private AST.Node parseChild(Tag parent, Scope scope, String resultType)
      throws CompilerException {
    if (!peek().is(Token.Kind.LEFT_ANGLE)) {
      throw unexpected(Diagnostic.Kind.UNEXPECTED_TOKEN_REACHED, peek(), "a '<'");
    }
    Token keyword = peek(1);
    if (!keyword.is(Token.Kind.KEYWORD)) {
      throw unexpected(Diagnostic.Kind.UNEXPECTED_TOKEN_REACHED, keyword, "a tag");
    }

    switch (keyword.text()) {
      case FUNCTION:
        if (scope == Scope.PROGRAM) {
          return parseFunction();
        }
        break;
      case ARG:
        if (scope == Scope.CALL) {
          return parseArg();
        }
        break;
      case CALL:
        if (scope != Scope.CALL) {
          return parseCall();
        }
        break;
      case LET:
        if (scope != Scope.CALL) {
          return parseLet();
        }
        break;
      case RETURN:
        if (scope != Scope.CALL) {
          return parseReturn(resultType);
        }
        break;
      case IF:
        if (scope != Scope.CALL) {
          return parseIf(resultType);
        }
        break;
      default:
        break;
    }
    throw fail(
        Diagnostic.Kind.UNEXPECTED_TOKEN_REACHED,
        keyword,
        String.format("is not allowed inside <%s>", parent.name()));
  }

  // Constructs.

  private AST.Program parseProgram() throws CompilerException {
    Tag tag = parseOpeningTag(PROGRAM);
    List<AST.Node> scope = parseBody(tag, Scope.PROGRAM, AST.NONE);

    Optional<AST.Function> main =
        scope
            .stream()
            .filter(n -> n instanceof AST.Function)
            .map(n -> (AST.Function) n)
            .filter(f -> f.name().equals(MAIN))
            .findFirst();
    if (main.isPresent()) {
      scope.add(new AST.Call(main.get().token(), MAIN, ImmutableList.of()));
    }

    parseClosingTag(tag);
    if (!peek().is(Token.Kind.END_OF_FILE)) {
      diagnostics.error(
          Diagnostic.Kind.UNEXPECTED_TOKEN_REACHED,
          peek(),
          String.format("was found after the closing </%s> tag", PROGRAM));
    }
    return new AST.Program(tag.keyword(), scope);
  }

  private AST.Function parseFunction() throws CompilerException {
    Tag tag = parseOpeningTag(FUNCTION);

    Property name = require(tag, "name");
    if (tag.indexOf("name") != 0) {
      diagnostics.warning(
          Diagnostic.Kind.UNEXPECTED_TOKEN_POSITION, name.name(), "should appear in first");
    }
    Property type = require(tag, "type");
    if (tag.indexOf("type") != 1) {
      diagnostics.warning(
          Diagnostic.Kind.UNEXPECTED_TOKEN_POSITION, type.name(), "should appear in second");
    }
    checkType(type);

    List<AST.Function.Parameter> parameters = new ArrayList<>();
    for (Property property : tag.properties()) {
      if (property == name || property == type) {
        continue;
      }
      checkType(property);
      parameters.add(AST.Function.Parameter.create(property.name().text(), property.text()));
    }

    String resultType = type.text();
    List<AST.Node> scope = parseBody(tag, Scope.FUNCTION, resultType);

    List<AST.Return> returns = new ArrayList<>();
    for (AST.Node node : scope) {
      if (node instanceof AST.Return) {
        returns.add((AST.Return) node);
      }
    }
    if (resultType.equals(AST.NONE)) {
      if (returns.isEmpty()) {
        scope.add(new AST.Return(tag.keyword(), AST.NONE, Optional.empty()));
      }
      for (AST.Return ret : returns) {
        if (ret.value().isPresent()) {
          diagnostics.error(
              Diagnostic.Kind.UNEXPECTED_TOKEN_REACHED,
              ret.value().get().token(),
              "is returned from a function of type none");
        }
      }
    } else if (returns.stream().noneMatch(r -> r.value().isPresent())) {
      throw fail(
          Diagnostic.Kind.MISSING_RETURN_STATEMENT,
          tag.keyword(),
          returns.isEmpty()
              ? "expects a value to be returned, yet no <return> tag was found."
              : "expects a value to be returned, yet no <return> tag carries one.");
    } else {
      for (AST.Return extra : returns.subList(1, returns.size())) {
        diagnostics.error(
            Diagnostic.Kind.UNEXPECTED_TOKEN_REACHED,
            extra.token(),
            "is a second <return> in a function returning a value");
      }
    }

    parseClosingTag(tag);
    return new AST.Function(tag.keyword(), name.text(), resultType, parameters, scope);
  }

  private AST.Call parseCall() throws CompilerException {
    Tag tag = parseOpeningTag(CALL);
    Property who = require(tag, "who");

    ImmutableList<AST.Arg> arguments =
        parseBody(tag, Scope.CALL, AST.NONE)
            .stream()
            .map(n -> (AST.Arg) n)
            .collect(ImmutableList.toImmutableList());

    parseClosingTag(tag);
    return new AST.Call(tag.keyword(), who.text(), arguments);
  }

  private AST.Arg parseArg() throws CompilerException {
    Tag tag = parseOpeningTag(ARG);
    AST.Expression value = parseRequiredValue(tag);
    parseClosingTag(tag);
    return new AST.Arg(tag.keyword(), value);
  }

  private AST.Let parseLet() throws CompilerException {
    Tag tag = parseOpeningTag(LET);
    Property name = require(tag, "name");
    Property type = require(tag, "type");
    checkType(type);

    AST.Expression value = parseRequiredValue(tag);
    parseClosingTag(tag);
    return new AST.Let(tag.keyword(), name.text(), type.text(), value);
  }

  private AST.Return parseReturn(String resultType) throws CompilerException {
    Tag tag = parseOpeningTag(RETURN);
    Optional<AST.Expression> value = parseValue(tag);
    parseClosingTag(tag);
    return new AST.Return(tag.keyword(), resultType, value);
  }

  private AST.If parseIf(String resultType) throws CompilerException {
    Tag tag = parseOpeningTag(IF);
    Property condition = require(tag, "condition");
    List<AST.Node> trueBranch = parseBody(tag, Scope.BRANCH, resultType);
    parseClosingTag(tag);

    List<AST.Node> falseBranch = ImmutableList.of();
    if (atOpeningTag(ELSE) && peek().depth() == tag.depth()) {
      Tag elseTag = parseOpeningTag(ELSE);
      falseBranch = parseBody(elseTag, Scope.BRANCH, resultType);
      parseClosingTag(elseTag);
    }
    return new AST.If(tag.keyword(), condition.value(), trueBranch, falseBranch);
  }
}
