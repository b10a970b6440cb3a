package xmlc;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.CharMatcher;

/**
 * First code generation pass. Walks the tree depth first in source order and lays out the data
 * segment: every distinct constant used by an {@code arg} or {@code return} gets one entry, and
 * every {@code string} variable gets an entry of its own, keyed by the declaration binding it. Also
 * registers the functions.
 */
final class DataSegmentLayout extends ErrorCollectingVisitor {
  private static final Logger logger = LoggerFactory.getLogger(DataSegmentLayout.class);

  private final CodeGenerator.Registry.Builder builder = CodeGenerator.Registry.builder();
  private AST.Declaration enclosing = null;

  private DataSegmentLayout() {}

  static CodeGenerator.Registry layout(AST.Program program) throws CompilerException {
    DataSegmentLayout layout = new DataSegmentLayout();
    program.accept(layout, null);
    layout.throwFirstError();

    CodeGenerator.Registry registry = layout.builder.build();
    logger.debug(
        "Laid out {} data entries ({} bytes) and {} functions",
        registry.dataEntries().size(),
        registry.dataSegmentSize(),
        registry.functionCount());
    return registry;
  }

  @Override
  public void visitImpl(AST.Program node) {
    checkVariables(node);
    visitDeclaration(node);
  }

  @Override
  public void visitImpl(AST.Function node) {
    checkName(node);
    Optional<AST.Function> previous = builder.registerFunction(node);
    if (previous.isPresent()) {
      logConflict(node.pos(), previous.get().pos(), String.format("function '%s'", node.name()));
    }
    checkVariables(node);
    visitDeclaration(node);
  }

  private void visitDeclaration(AST.Declaration node) {
    AST.Declaration outer = enclosing;
    enclosing = node;
    node.visitChildren(this, null);
    enclosing = outer;
  }

  // Function names become code labels and call operands.
  private void checkName(AST.Function node) {
    String name = node.name();
    if (name.isEmpty() || CharMatcher.whitespace().matchesAnyOf(name)) {
      logError(node.pos(), String.format("function name '%s' is not a single word", name));
    } else if (name.equals(CodeGenerator.ENTRYPOINT)) {
      logError(node.pos(), String.format("function name '%s' is reserved", name));
    } else if (Instructions.Intrinsic.forName(name).isPresent()) {
      logError(node.pos(), String.format("function name '%s' is taken by an intrinsic", name));
    }
  }

  private void checkVariables(AST.Declaration declaration) {
    Map<String, Tokenizer.Pos> names = new HashMap<>();
    for (AST.Function.Parameter parameter : declaration.parameters()) {
      if (names.put(parameter.name(), declaration.pos()) != null) {
        logError(
            declaration.pos(), String.format("duplicate parameter '%s'", parameter.name()));
      }
    }
    for (AST.Node node : declaration.scope()) {
      if (node.kind() != AST.Node.Kind.STATEMENT
          || ((AST.Statement) node).type() != AST.Statement.Type.LET) {
        continue;
      }
      AST.Let let = ((AST.Statement) node).cast();
      Tokenizer.Pos previous = names.putIfAbsent(let.name(), let.pos());
      if (previous != null) {
        logConflict(let.pos(), previous, String.format("variable '%s'", let.name()));
      }
    }
  }

  @Override
  public void visitImpl(AST.Let node) {
    if (node.valueType().equals(AST.NONE)) {
      logError(node.pos(), String.format("variable '%s' cannot have type none", node.name()));
    } else if (node.isStringConstant()) {
      builder.registerVariable(enclosing, node.name(), node.value().value());
    } else if (node.valueType().equals(AST.NUMBER)
        && node.value().type() == AST.Expression.Type.LITERAL
        && node.value().<AST.Literal>cast().isDataConstant()) {
      logError(
          node.value().pos(),
          String.format(
              "variable '%s' expects a number, not '%s'", node.name(), node.value().value()));
    }
  }

  @Override
  public void visitImpl(AST.Arg node) {
    registerLiteral(node.value());
  }

  @Override
  public void visitImpl(AST.Return node) {
    if (node.value().isPresent()) {
      registerLiteral(node.value().get());
    }
  }

  private void registerLiteral(AST.Expression expression) {
    if (expression.type() == AST.Expression.Type.LITERAL
        && expression.<AST.Literal>cast().isDataConstant()) {
      builder.registerLiteral(expression.value());
    }
  }
}
