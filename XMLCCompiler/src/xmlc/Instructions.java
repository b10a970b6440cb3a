package xmlc;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

import com.google.common.io.ByteArrayDataOutput;

/**
 * The stack machine's instruction set, shared by the code generator (mnemonics) and the assembler
 * (encodings). Every instruction starts with a one byte opcode; multi-byte operands are
 * big-endian.
 */
public final class Instructions {
  private Instructions() {}

  public enum Opcode {
    PUSH("push", 0x00, 5), // i32 value
    LOAD("load", 0x01, 6), // segment tag, i32 offset
    STORE("store", 0x02, 6), // segment tag, i32 offset
    POP("pop", 0x03, 1),
    CALL("call", 0x04, 2), // target byte
    RET("ret", 0x05, 1);

    private final String mnemonic;
    private final int code;
    private final int size;

    private Opcode(String mnemonic, int code, int size) {
      this.mnemonic = mnemonic;
      this.code = code;
      this.size = size;
    }

    public String mnemonic() {
      return mnemonic;
    }

    public int code() {
      return code;
    }

    /** Encoded size in bytes, operands included. */
    public int size() {
      return size;
    }

    public static Optional<Opcode> forMnemonic(String mnemonic) {
      return Arrays.stream(values()).filter(o -> o.mnemonic.equals(mnemonic)).findFirst();
    }
  }

  public enum Segment {
    DATA(".data", 0),
    SCOPE("scope", 1),
    GLOBAL("global", 2);

    private final String label;
    private final int tag;

    private Segment(String label, int tag) {
      this.label = label;
      this.tag = tag;
    }

    public String label() {
      return label;
    }

    public int tag() {
      return tag;
    }

    public static Optional<Segment> forLabel(String label) {
      return Arrays.stream(values()).filter(s -> s.label.equals(label)).findFirst();
    }
  }

  /** Built-in callables, addressed by ordinal rather than code offset. */
  public enum Intrinsic {
    PRINT("print"),
    PRINTLN("println");

    private final String functionName;

    private Intrinsic(String functionName) {
      this.functionName = functionName;
    }

    public String functionName() {
      return functionName;
    }

    public String resultType() {
      return AST.NONE;
    }

    public static Optional<Intrinsic> forName(String name) {
      return Arrays.stream(values()).filter(i -> i.functionName.equals(name)).findFirst();
    }
  }

  // Set in a call's target byte when it names an intrinsic.
  public static final int INTRINSIC_CALL_BIT = 0x80;

  public static final int MAX_CALL_OFFSET = INTRINSIC_CALL_BIT - 1;

  public static void writePush(int value, ByteArrayDataOutput out) {
    out.writeByte(Opcode.PUSH.code());
    out.writeInt(value);
  }

  public static void writeLoad(Segment segment, int offset, ByteArrayDataOutput out) {
    writeAddressed(Opcode.LOAD, segment, offset, out);
  }

  public static void writeStore(Segment segment, int offset, ByteArrayDataOutput out) {
    writeAddressed(Opcode.STORE, segment, offset, out);
  }

  private static void writeAddressed(
      Opcode opcode, Segment segment, int offset, ByteArrayDataOutput out) {
    out.writeByte(opcode.code());
    out.writeByte(segment.tag());
    out.writeInt(offset);
  }

  public static void writePop(ByteArrayDataOutput out) {
    out.writeByte(Opcode.POP.code());
  }

  public static void writeIntrinsicCall(Intrinsic intrinsic, ByteArrayDataOutput out) {
    out.writeByte(Opcode.CALL.code());
    out.writeByte(INTRINSIC_CALL_BIT | intrinsic.ordinal());
  }

  public static void writeCall(int codeOffset, ByteArrayDataOutput out) {
    out.writeByte(Opcode.CALL.code());
    out.writeByte(codeOffset);
  }

  public static void writeRet(ByteArrayDataOutput out) {
    out.writeByte(Opcode.RET.code());
  }

  /** A data segment entry: i32 byte length, then the UTF-8 bytes. */
  public static void writeDataEntry(String value, ByteArrayDataOutput out) {
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    out.writeInt(bytes.length);
    out.write(bytes);
  }

  public static int dataEntrySize(String value) {
    return 4 + value.getBytes(StandardCharsets.UTF_8).length;
  }
}
