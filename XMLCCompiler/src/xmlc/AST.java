package xmlc;

import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import xmlc.CodeGenerator.Emitter;
import xmlc.CodeGenerator.Registry;
import xmlc.Instructions.Segment;
import xmlc.processor.ASTChild;
import xmlc.processor.ASTNode;

/**
 * The syntax tree produced by {@link Parser}.
 *
 * <p>Nodes fall into three categories, {@link Declaration}, {@link Statement} and {@link
 * Expression}, each with a closed {@code Type} enum. Nodes are immutable and own their children.
 */
public final class AST {
  public static final String NONE = "none";
  public static final String NUMBER = "number";
  public static final String STRING = "string";

  public static final ImmutableSet<String> TYPES = ImmutableSet.of(NONE, NUMBER, STRING);

  private AST() {}

  public abstract static class Node implements ASTNodeInterface {
    public enum Kind {
      DECLARATION,
      STATEMENT,
      EXPRESSION;
    }

    private final Kind kind;
    private final Tokenizer.Token token;

    protected Node(Kind kind, Tokenizer.Token token) {
      this.kind = kind;
      this.token = token;
    }

    public Kind kind() {
      return kind;
    }

    /** The keyword of the opening tag, or the literal itself for expressions. */
    public Tokenizer.Token token() {
      return token;
    }

    public Tokenizer.Pos pos() {
      return token.pos();
    }
  }

  public abstract static class Declaration extends Node {
    public enum Type {
      PROGRAM,
      FUNCTION;
    }

    private final Type type;
    private final ImmutableList<Node> scope;

    protected Declaration(Type type, Tokenizer.Token token, List<? extends Node> scope) {
      super(Kind.DECLARATION, token);
      this.type = type;
      this.scope = ImmutableList.copyOf(scope);
    }

    public Type type() {
      return type;
    }

    @ASTChild
    public ImmutableList<Node> scope() {
      return scope;
    }

    public abstract ImmutableList<Function.Parameter> parameters();

    /**
     * Returns the scope slot of a variable: parameters take the first slots in order, and a
     * {@code let} takes the number of parameters plus its position in {@link #scope()}.
     */
    public Optional<Integer> slotOf(String variable) {
      ImmutableList<Function.Parameter> parameters = parameters();
      for (int i = 0; i < parameters.size(); i++) {
        if (parameters.get(i).name().equals(variable)) {
          return Optional.of(i);
        }
      }
      for (int i = 0; i < scope.size(); i++) {
        Node node = scope.get(i);
        if (node.kind() == Kind.STATEMENT
            && ((Statement) node).type() == Statement.Type.LET
            && ((Let) node).name().equals(variable)) {
          return Optional.of(parameters.size() + i);
        }
      }
      return Optional.empty();
    }

    @SuppressWarnings("unchecked")
    public <T extends Declaration> T cast() {
      return (T) this;
    }
  }

  public abstract static class Statement extends Node {
    public enum Type {
      ARG,
      CALL,
      IF,
      LET,
      RETURN;
    }

    private final Type type;

    protected Statement(Type type, Tokenizer.Token token) {
      super(Kind.STATEMENT, token);
      this.type = type;
    }

    public Type type() {
      return type;
    }

    @SuppressWarnings("unchecked")
    public <T extends Statement> T cast() {
      return (T) this;
    }

    /** Emits the instructions of this statement, inside the block of {@code enclosing}. */
    public abstract void compile(Registry registry, Declaration enclosing, Emitter out)
        throws CompilerException;
  }

  public abstract static class Expression extends Node {
    public enum Type {
      LITERAL,
      LOGICAL,
      ARITHMETIC;
    }

    private final Type type;
    private final String value;

    protected Expression(Type type, Tokenizer.Token token, String value) {
      super(Kind.EXPRESSION, token);
      this.type = type;
      this.value = value;
    }

    public Type type() {
      return type;
    }

    public String value() {
      return value;
    }

    @SuppressWarnings("unchecked")
    public <T extends Expression> T cast() {
      return (T) this;
    }

    /** Emits instructions leaving this expression's value on the stack. */
    public abstract void compile(Registry registry, Declaration enclosing, Emitter out)
        throws CompilerException;
  }

  @ASTNode
  public static final class Program extends Declaration implements AST_Program_ASTNode {
    public Program(Tokenizer.Token token, List<? extends Node> scope) {
      super(Type.PROGRAM, token, scope);
    }

    @Override
    public ImmutableList<Function.Parameter> parameters() {
      return ImmutableList.of();
    }

    public ImmutableList<Function> functions() {
      return scope()
          .stream()
          .filter(n -> n.kind() == Kind.DECLARATION)
          .map(n -> ((Declaration) n).<Function>cast())
          .collect(ImmutableList.toImmutableList());
    }

    public ImmutableList<Statement> statements() {
      return scope()
          .stream()
          .filter(n -> n.kind() == Kind.STATEMENT)
          .map(n -> (Statement) n)
          .collect(ImmutableList.toImmutableList());
    }
  }

  @ASTNode
  public static final class Function extends Declaration implements AST_Function_ASTNode {
    @AutoValue
    public abstract static class Parameter {
      public abstract String name();

      public abstract String type();

      public static Parameter create(String name, String type) {
        return new AutoValue_AST_Function_Parameter(name, type);
      }
    }

    private final String name;
    private final String resultType;
    private final ImmutableList<Parameter> parameters;

    public Function(
        Tokenizer.Token token,
        String name,
        String resultType,
        List<Parameter> parameters,
        List<? extends Node> scope) {
      super(Type.FUNCTION, token, scope);
      this.name = name;
      this.resultType = resultType;
      this.parameters = ImmutableList.copyOf(parameters);
    }

    public String name() {
      return name;
    }

    public String resultType() {
      return resultType;
    }

    @Override
    public ImmutableList<Parameter> parameters() {
      return parameters;
    }
  }

  @ASTNode
  public static final class Let extends Statement implements AST_Let_ASTNode {
    private final String name;
    private final String valueType;
    private final Expression value;

    public Let(Tokenizer.Token token, String name, String valueType, Expression value) {
      super(Type.LET, token);
      this.name = name;
      this.valueType = valueType;
      this.value = value;
    }

    public String name() {
      return name;
    }

    public String valueType() {
      return valueType;
    }

    @ASTChild
    @Override
    public Expression value() {
      return value;
    }

    /** A string constant lives in the data segment under the variable's name. */
    public boolean isStringConstant() {
      return valueType.equals(STRING)
          && value.type() == Expression.Type.LITERAL
          && !value.<Literal>cast().isPlaceholder();
    }

    @Override
    public void compile(Registry registry, Declaration enclosing, Emitter out)
        throws CompilerException {
      if (isStringConstant()) {
        out.load(Segment.DATA, registry.variableOffset(pos(), enclosing, name));
      } else {
        value.compile(registry, enclosing, out);
      }
      out.store(Segment.SCOPE, enclosing.slotOf(name).get());
    }
  }

  @ASTNode
  public static final class Call extends Statement implements AST_Call_ASTNode {
    private final String who;
    private final ImmutableList<Arg> arguments;

    public Call(Tokenizer.Token token, String who, List<Arg> arguments) {
      super(Type.CALL, token);
      this.who = who;
      this.arguments = ImmutableList.copyOf(arguments);
    }

    public String who() {
      return who;
    }

    @ASTChild
    @Override
    public ImmutableList<Arg> arguments() {
      return arguments;
    }

    @Override
    public void compile(Registry registry, Declaration enclosing, Emitter out)
        throws CompilerException {
      String resultType;
      Optional<Instructions.Intrinsic> intrinsic = Instructions.Intrinsic.forName(who);
      if (intrinsic.isPresent()) {
        resultType = intrinsic.get().resultType();
      } else {
        Optional<Function> callee = registry.function(who);
        if (!callee.isPresent()) {
          throw new CompilerException(pos(), String.format("call to undefined function '%s'", who));
        }
        int expected = callee.get().parameters().size();
        if (expected != arguments.size()) {
          throw new CompilerException(
              pos(),
              String.format(
                  "function '%s' expects %d argument(s), but %d were given",
                  who, expected, arguments.size()));
        }
        resultType = callee.get().resultType();
      }

      for (Arg arg : arguments) {
        arg.compile(registry, enclosing, out);
      }
      out.call(who);
      if (!resultType.equals(NONE)) {
        out.pop();
      }
    }
  }

  @ASTNode
  public static final class Arg extends Statement implements AST_Arg_ASTNode {
    private final Expression value;

    public Arg(Tokenizer.Token token, Expression value) {
      super(Type.ARG, token);
      this.value = value;
    }

    @ASTChild
    @Override
    public Expression value() {
      return value;
    }

    @Override
    public void compile(Registry registry, Declaration enclosing, Emitter out)
        throws CompilerException {
      value.compile(registry, enclosing, out);
    }
  }

  @ASTNode
  public static final class Return extends Statement implements AST_Return_ASTNode {
    private final String valueType;
    private final Optional<Expression> value;

    public Return(Tokenizer.Token token, String valueType, Optional<Expression> value) {
      super(Type.RETURN, token);
      this.valueType = valueType;
      this.value = value;
    }

    /** The result type of the enclosing function; {@code none} at program level. */
    public String valueType() {
      return valueType;
    }

    @ASTChild
    @Override
    public Optional<Expression> value() {
      return value;
    }

    @Override
    public void compile(Registry registry, Declaration enclosing, Emitter out)
        throws CompilerException {
      if (value.isPresent()) {
        value.get().compile(registry, enclosing, out);
      }
      out.ret();
    }
  }

  @ASTNode
  public static final class If extends Statement implements AST_If_ASTNode {
    private final Expression condition;
    private final ImmutableList<Node> trueBranch;
    private final ImmutableList<Node> falseBranch;

    public If(
        Tokenizer.Token token,
        Expression condition,
        List<? extends Node> trueBranch,
        List<? extends Node> falseBranch) {
      super(Type.IF, token);
      this.condition = condition;
      this.trueBranch = ImmutableList.copyOf(trueBranch);
      this.falseBranch = ImmutableList.copyOf(falseBranch);
    }

    @ASTChild
    @Override
    public Expression condition() {
      return condition;
    }

    @ASTChild
    @Override
    public ImmutableList<Node> trueBranch() {
      return trueBranch;
    }

    @ASTChild
    @Override
    public ImmutableList<Node> falseBranch() {
      return falseBranch;
    }

    @Override
    public void compile(Registry registry, Declaration enclosing, Emitter out)
        throws CompilerException {
      throw new CompilerException(pos(), "conditional branching is not implemented");
    }
  }

  @ASTNode
  public static final class Literal extends Expression implements AST_Literal_ASTNode {
    private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

    public Literal(Tokenizer.Token token, String value) {
      super(Type.LITERAL, token, value);
    }

    public boolean isNumeric() {
      return !value().isEmpty() && DIGITS.matchesAllOf(value());
    }

    /** A {@code ${name}} reference to a parameter or local variable. */
    public boolean isPlaceholder() {
      return value().length() > 3 && value().startsWith("${") && value().endsWith("}");
    }

    public String placeholderName() {
      return value().substring(2, value().length() - 1);
    }

    /** Values kept in the data segment: neither numbers nor variable references. */
    public boolean isDataConstant() {
      return !isNumeric() && !isPlaceholder();
    }

    public int numericValue() throws CompilerException {
      try {
        return Integer.parseInt(value());
      } catch (NumberFormatException ex) {
        throw new CompilerException(
            pos(), String.format("numeric literal '%s' does not fit in 32 bits", value()));
      }
    }

    @Override
    public void compile(Registry registry, Declaration enclosing, Emitter out)
        throws CompilerException {
      if (isNumeric()) {
        out.push(numericValue());
      } else if (isPlaceholder()) {
        Optional<Integer> slot = enclosing.slotOf(placeholderName());
        if (!slot.isPresent()) {
          throw new CompilerException(
              pos(), String.format("unresolved variable '%s'", placeholderName()));
        }
        out.load(Segment.SCOPE, slot.get());
      } else {
        out.load(Segment.DATA, registry.literalOffset(pos(), value()));
      }
    }
  }

  @ASTNode
  public static final class Logical extends Expression implements AST_Logical_ASTNode {
    public Logical(Tokenizer.Token token, String value) {
      super(Type.LOGICAL, token, value);
    }

    @Override
    public void compile(Registry registry, Declaration enclosing, Emitter out)
        throws CompilerException {
      throw new CompilerException(pos(), "logical expressions are not implemented");
    }
  }

  @ASTNode
  public static final class Arithmetic extends Expression implements AST_Arithmetic_ASTNode {
    public Arithmetic(Tokenizer.Token token, String value) {
      super(Type.ARITHMETIC, token, value);
    }

    @Override
    public void compile(Registry registry, Declaration enclosing, Emitter out)
        throws CompilerException {
      throw new CompilerException(pos(), "arithmetic expressions are not implemented");
    }
  }
}
