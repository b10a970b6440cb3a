package xmlc;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;

import xmlc.Instructions.Intrinsic;
import xmlc.Instructions.Opcode;
import xmlc.Instructions.Segment;

/**
 * Encodes the text produced by {@link CodeGenerator} into a {@link BinaryImage}.
 *
 * <p>Block headers are scanned before encoding, so calls may name functions defined further down.
 * Any malformed line fails the whole assembly.
 */
public final class Assembler {
  private static final Logger logger = LoggerFactory.getLogger(Assembler.class);

  private static final Pattern ADDRESS = Pattern.compile("([^\\[\\]\\s]+)\\[(\\d+)\\]");
  private static final Splitter OPERANDS =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private enum State {
    START,
    DATA,
    CODE;
  }

  private final String file;
  private final ImmutableList<String> lines;

  public Assembler(String text) {
    this("<assembly>", text);
  }

  public Assembler(String file, String text) {
    this.file = file;
    this.lines = Tokenizer.splitLines(text);
  }

  public BinaryImage assemble() throws CompilerException {
    ByteArrayDataOutput data = ByteStreams.newDataOutput();
    List<Integer> codeLines = new ArrayList<>();

    State state = State.START;
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      String trimmed = line.trim();
      switch (state) {
        case START:
          if (trimmed.isEmpty()) {
            break;
          } else if (!trimmed.equals(CodeGenerator.DATA_SECTION)) {
            throw error(i, "expected the " + CodeGenerator.DATA_SECTION + " section first");
          }
          state = State.DATA;
          break;
        case DATA:
          if (trimmed.isEmpty()) {
            break;
          } else if (trimmed.equals(CodeGenerator.CODE_SECTION)) {
            state = State.CODE;
          } else if (trimmed.startsWith(".")) {
            throw error(i, String.format("unexpected section '%s'", trimmed));
          } else {
            assembleDataEntry(i, line, data);
          }
          break;
        case CODE:
          if (trimmed.startsWith(".")) {
            throw error(i, String.format("unexpected section '%s'", trimmed));
          }
          codeLines.add(i);
          break;
      }
    }
    if (state != State.CODE) {
      throw error(
          Math.max(0, lines.size() - 1), "missing the " + CodeGenerator.CODE_SECTION + " section");
    }

    ImmutableMap<String, Integer> labels = scanLabels(codeLines);
    Integer entrypoint = labels.get(CodeGenerator.ENTRYPOINT);
    if (entrypoint == null) {
      throw error(Math.max(0, lines.size() - 1), "missing the entrypoint block");
    }

    byte[] code = assembleCode(codeLines, labels);
    if (entrypoint >= code.length) {
      throw error(Math.max(0, lines.size() - 1), "the entrypoint block has no instructions");
    }

    byte[] dataBytes = data.toByteArray();
    logger.debug(
        "Assembled {} data bytes and {} code bytes, entrypoint at {}",
        dataBytes.length,
        code.length,
        entrypoint);
    return BinaryImage.create(dataBytes, code, entrypoint);
  }

  private CompilerException error(int line, String msg) {
    return new CompilerException(new Tokenizer.Pos(file, line, 0), msg);
  }

  private void assembleDataEntry(int i, String line, ByteArrayDataOutput out)
      throws CompilerException {
    int space = line.indexOf(' ');
    String length = space < 0 ? line : line.substring(0, space);
    String value = space < 0 ? "" : line.substring(space + 1);

    int declared = parseInt(i, length);
    int actual = value.getBytes(StandardCharsets.UTF_8).length;
    if (declared != actual) {
      throw error(
          i,
          String.format(
              "declared length %d does not match the %d bytes of '%s'", declared, actual, value));
    }
    Instructions.writeDataEntry(value, out);
  }

  private Optional<String> blockHeader(int i, String line) throws CompilerException {
    if (line.equals(CodeGenerator.ENTRYPOINT)) {
      return Optional.of(CodeGenerator.ENTRYPOINT);
    }
    List<String> parts = OPERANDS.splitToList(line);
    if (!parts.get(0).equals(CodeGenerator.FUNCTION_HEADER)) {
      return Optional.empty();
    }
    if (parts.size() != 2) {
      throw error(i, "expected 'function <name>'");
    }
    return Optional.of(parts.get(1));
  }

  // Assigns every block its offset in the code segment.
  private ImmutableMap<String, Integer> scanLabels(List<Integer> codeLines)
      throws CompilerException {
    Map<String, Integer> labels = new LinkedHashMap<>();
    int offset = 0;
    boolean inBlock = false;
    for (int i : codeLines) {
      String line = lines.get(i).trim();
      if (line.isEmpty()) {
        inBlock = false;
        continue;
      }

      Optional<String> header = blockHeader(i, line);
      if (header.isPresent()) {
        if (labels.putIfAbsent(header.get(), offset) != null) {
          throw error(i, String.format("duplicate label '%s'", header.get()));
        }
        inBlock = true;
        continue;
      }
      if (!inBlock) {
        throw error(i, "instruction outside of a function or entrypoint block");
      }
      offset += parseOpcode(i, OPERANDS.splitToList(line).get(0)).size();
    }
    return ImmutableMap.copyOf(labels);
  }

  private byte[] assembleCode(List<Integer> codeLines, ImmutableMap<String, Integer> labels)
      throws CompilerException {
    ByteArrayDataOutput out = ByteStreams.newDataOutput();
    for (int i : codeLines) {
      String line = lines.get(i).trim();
      if (line.isEmpty() || blockHeader(i, line).isPresent()) {
        continue;
      }

      List<String> parts = OPERANDS.splitToList(line);
      Opcode opcode = parseOpcode(i, parts.get(0));
      byte[] encoded = encode(i, opcode, parts.subList(1, parts.size()), labels);
      Verify.verify(
          encoded.length == opcode.size(),
          "%s encoded to %s bytes",
          opcode.mnemonic(),
          encoded.length);
      out.write(encoded);
    }
    return out.toByteArray();
  }

  private byte[] encode(
      int i, Opcode opcode, List<String> operands, ImmutableMap<String, Integer> labels)
      throws CompilerException {
    ByteArrayDataOutput out = ByteStreams.newDataOutput();
    switch (opcode) {
      case PUSH:
        Instructions.writePush(parseInt(i, operand(i, opcode, operands)), out);
        break;
      case LOAD:
        {
          Matcher address = parseAddress(i, operand(i, opcode, operands));
          Instructions.writeLoad(
              parseSegment(i, address.group(1)), parseInt(i, address.group(2)), out);
          break;
        }
      case STORE:
        {
          Matcher address = parseAddress(i, operand(i, opcode, operands));
          Instructions.writeStore(
              parseSegment(i, address.group(1)), parseInt(i, address.group(2)), out);
          break;
        }
      case CALL:
        writeCall(i, operand(i, opcode, operands), labels, out);
        break;
      case POP:
        noOperands(i, opcode, operands);
        Instructions.writePop(out);
        break;
      case RET:
        noOperands(i, opcode, operands);
        Instructions.writeRet(out);
        break;
    }
    return out.toByteArray();
  }

  private void writeCall(
      int i, String target, ImmutableMap<String, Integer> labels, ByteArrayDataOutput out)
      throws CompilerException {
    Optional<Intrinsic> intrinsic = Intrinsic.forName(target);
    if (intrinsic.isPresent()) {
      Instructions.writeIntrinsicCall(intrinsic.get(), out);
      return;
    }

    Integer offset = labels.get(target);
    if (offset == null) {
      throw error(i, String.format("call to undefined label '%s'", target));
    } else if (offset > Instructions.MAX_CALL_OFFSET) {
      throw error(
          i,
          String.format(
              "'%s' starts at code offset %d, beyond the call range of %d",
              target, offset, Instructions.MAX_CALL_OFFSET));
    }
    Instructions.writeCall(offset, out);
  }

  private Opcode parseOpcode(int i, String mnemonic) throws CompilerException {
    Optional<Opcode> opcode = Opcode.forMnemonic(mnemonic);
    if (!opcode.isPresent()) {
      throw error(i, String.format("unknown mnemonic '%s'", mnemonic));
    }
    return opcode.get();
  }

  private String operand(int i, Opcode opcode, List<String> operands) throws CompilerException {
    if (operands.size() != 1) {
      throw error(i, String.format("'%s' takes exactly one operand", opcode.mnemonic()));
    }
    return operands.get(0);
  }

  private void noOperands(int i, Opcode opcode, List<String> operands) throws CompilerException {
    if (!operands.isEmpty()) {
      throw error(i, String.format("'%s' takes no operands", opcode.mnemonic()));
    }
  }

  private Matcher parseAddress(int i, String operand) throws CompilerException {
    Matcher matcher = ADDRESS.matcher(operand);
    if (!matcher.matches()) {
      throw error(i, String.format("malformed address '%s'", operand));
    }
    return matcher;
  }

  private Segment parseSegment(int i, String label) throws CompilerException {
    Optional<Segment> segment = Segment.forLabel(label);
    if (!segment.isPresent()) {
      throw error(i, String.format("unknown segment '%s'", label));
    }
    return segment.get();
  }

  private int parseInt(int i, String operand) throws CompilerException {
    try {
      return Integer.parseInt(operand);
    } catch (NumberFormatException ex) {
      throw error(i, String.format("malformed number '%s'", operand));
    }
  }
}
