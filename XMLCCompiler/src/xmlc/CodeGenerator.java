package xmlc;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;

import xmlc.Instructions.Segment;

/**
 * Lowers a {@link AST.Program} to assembly text.
 *
 * <p>The output has a {@code .data} section of {@code <byte-length> <value>} lines and a {@code
 * .code} section of blocks, one per function in declaration order and a final {@code entrypoint}
 * block holding the top-level statements. Every section and block ends with a blank line:
 *
 * <pre>
 * .data
 * 5 hello
 *
 * .code
 * function main
 * load .data[0]
 * call println
 * ret
 *
 * entrypoint
 * call main
 * ret
 * </pre>
 */
public final class CodeGenerator {
  private static final Logger logger = LoggerFactory.getLogger(CodeGenerator.class);

  public static final String DATA_SECTION = Segment.DATA.label();
  public static final String CODE_SECTION = ".code";
  public static final String FUNCTION_HEADER = "function";
  public static final String ENTRYPOINT = "entrypoint";

  /** A string variable, which is local to the declaration binding it. */
  @AutoValue
  abstract static class VariableKey {
    // Declarations compare by identity.
    abstract AST.Declaration declaration();

    abstract String name();

    static VariableKey create(AST.Declaration declaration, String name) {
      return new AutoValue_CodeGenerator_VariableKey(declaration, name);
    }
  }

  /** Symbols gathered by {@link DataSegmentLayout}. */
  @AutoValue
  public abstract static class Registry {
    abstract ImmutableMap<String, Integer> literalOffsets();

    abstract ImmutableMap<VariableKey, Integer> variableOffsets();

    /** Data segment values, in offset order. */
    public abstract ImmutableList<String> dataEntries();

    abstract ImmutableMap<String, AST.Function> functions();

    public final int dataSegmentSize() {
      return dataEntries().stream().mapToInt(Instructions::dataEntrySize).sum();
    }

    public final int functionCount() {
      return functions().size();
    }

    public final int literalOffset(Tokenizer.Pos pos, String value) throws CompilerException {
      Integer offset = literalOffsets().get(value);
      if (offset == null) {
        throw new CompilerException(
            pos, String.format("'%s' has no entry in the data segment", value));
      }
      return offset;
    }

    public final int variableOffset(Tokenizer.Pos pos, AST.Declaration enclosing, String name)
        throws CompilerException {
      Integer offset = variableOffsets().get(VariableKey.create(enclosing, name));
      if (offset == null) {
        throw new CompilerException(
            pos, String.format("variable '%s' has no entry in the data segment", name));
      }
      return offset;
    }

    public final Optional<AST.Function> function(String name) {
      return Optional.ofNullable(functions().get(name));
    }

    static Builder builder() {
      return new AutoValue_CodeGenerator_Registry.Builder();
    }

    @AutoValue.Builder
    abstract static class Builder {
      private int nextOffset = 0;
      private final Map<String, Integer> literals = new HashMap<>();
      private final Set<VariableKey> variables = new HashSet<>();
      private final Map<String, AST.Function> functionsByName = new HashMap<>();

      abstract ImmutableMap.Builder<String, Integer> literalOffsetsBuilder();

      abstract ImmutableMap.Builder<VariableKey, Integer> variableOffsetsBuilder();

      abstract ImmutableList.Builder<String> dataEntriesBuilder();

      abstract ImmutableMap.Builder<String, AST.Function> functionsBuilder();

      private int addEntry(String value) {
        int offset = nextOffset;
        dataEntriesBuilder().add(value);
        nextOffset += Instructions.dataEntrySize(value);
        return offset;
      }

      /** Returns the offset of {@code value}, adding an entry on first use. */
      final int registerLiteral(String value) {
        Integer offset = literals.get(value);
        if (offset == null) {
          offset = addEntry(value);
          literals.put(value, offset);
          literalOffsetsBuilder().put(value, offset);
        }
        return offset;
      }

      /** Adds an entry for a string variable of {@code declaration}, unless it has one. */
      final void registerVariable(AST.Declaration declaration, String name, String value) {
        VariableKey key = VariableKey.create(declaration, name);
        if (variables.add(key)) {
          variableOffsetsBuilder().put(key, addEntry(value));
        }
      }

      /** Returns the function already registered under the same name, if any. */
      final Optional<AST.Function> registerFunction(AST.Function function) {
        AST.Function previous = functionsByName.putIfAbsent(function.name(), function);
        if (previous == null) {
          functionsBuilder().put(function.name(), function);
        }
        return Optional.ofNullable(previous);
      }

      abstract Registry build();
    }
  }

  /** Collects the instructions of one block. */
  public static final class Emitter {
    private final List<String> lines = new ArrayList<>();

    public void push(int value) {
      lines.add(String.format("%s %d", Instructions.Opcode.PUSH.mnemonic(), value));
    }

    public void load(Segment segment, int offset) {
      lines.add(addressed(Instructions.Opcode.LOAD, segment, offset));
    }

    public void store(Segment segment, int offset) {
      lines.add(addressed(Instructions.Opcode.STORE, segment, offset));
    }

    private static String addressed(Instructions.Opcode opcode, Segment segment, int offset) {
      return String.format("%s %s[%d]", opcode.mnemonic(), segment.label(), offset);
    }

    public void call(String who) {
      lines.add(String.format("%s %s", Instructions.Opcode.CALL.mnemonic(), who));
    }

    public void pop() {
      lines.add(Instructions.Opcode.POP.mnemonic());
    }

    public void ret() {
      lines.add(Instructions.Opcode.RET.mnemonic());
    }

    public boolean endsWithRet() {
      return !lines.isEmpty()
          && Iterables.getLast(lines).equals(Instructions.Opcode.RET.mnemonic());
    }

    public ImmutableList<String> lines() {
      return ImmutableList.copyOf(lines);
    }
  }

  private final AST.Program program;

  public CodeGenerator(AST.Program program) {
    this.program = program;
  }

  public String generate() throws CompilerException {
    Registry registry = DataSegmentLayout.layout(program);

    StringBuilder sb = new StringBuilder();
    sb.append(DATA_SECTION).append('\n');
    for (String entry : registry.dataEntries()) {
      sb.append(Instructions.dataEntrySize(entry) - 4).append(' ').append(entry).append('\n');
    }
    sb.append('\n').append(CODE_SECTION).append('\n');

    for (AST.Function function : program.functions()) {
      appendBlock(
          sb,
          FUNCTION_HEADER + " " + function.name(),
          compileBlock(registry, function, function.scope()));
    }
    appendBlock(sb, ENTRYPOINT, compileBlock(registry, program, program.statements()));

    logger.debug("Generated {} functions and the entrypoint", program.functions().size());
    return sb.toString();
  }

  private static void appendBlock(StringBuilder sb, String header, List<String> instructions) {
    sb.append(header).append('\n');
    instructions.forEach(i -> sb.append(i).append('\n'));
    sb.append('\n');
  }

  private static ImmutableList<String> compileBlock(
      Registry registry, AST.Declaration enclosing, Iterable<? extends AST.Node> nodes)
      throws CompilerException {
    Emitter out = new Emitter();
    for (AST.Node node : nodes) {
      switch (node.kind()) {
        case STATEMENT:
          ((AST.Statement) node).compile(registry, enclosing, out);
          break;
        case DECLARATION:
          throw new CompilerException(node.pos(), "nested declarations cannot be compiled");
        case EXPRESSION:
          throw new CompilerException(node.pos(), "a bare expression cannot be compiled");
      }
    }
    if (!out.endsWithRet()) {
      out.ret();
    }
    return out.lines();
  }
}
