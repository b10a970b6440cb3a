package xmlc;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;

/**
 * The assembled program, in the layout the virtual machine loads:
 *
 * <pre>
 * magic              23 bytes, "This is a kubo program" and a NUL
 * dataSegmentOffset  u32, always 0
 * codeSegmentOffset  u32, the size of the data segment
 * entrypointOffset   u32, relative to the code segment
 * data segment bytes
 * code segment bytes
 * </pre>
 *
 * All integers are big-endian.
 */
@AutoValue
public abstract class BinaryImage {
  private static final byte[] MAGIC =
      "This is a kubo program\0".getBytes(StandardCharsets.US_ASCII);

  public static final int MAGIC_SIZE = MAGIC.length;

  public static final int HEADER_SIZE = MAGIC_SIZE + 3 * 4;

  public abstract int dataSegmentOffset();

  public abstract int codeSegmentOffset();

  public abstract int entrypointOffset();

  @SuppressWarnings("mutable")
  abstract byte[] dataSegmentBytes();

  @SuppressWarnings("mutable")
  abstract byte[] codeSegmentBytes();

  public byte[] dataSegment() {
    return dataSegmentBytes().clone();
  }

  public byte[] codeSegment() {
    return codeSegmentBytes().clone();
  }

  public static BinaryImage create(byte[] dataSegment, byte[] codeSegment, int entrypointOffset) {
    Preconditions.checkArgument(
        entrypointOffset >= 0 && entrypointOffset < codeSegment.length,
        "entrypoint offset %s is outside the code segment",
        entrypointOffset);
    return new AutoValue_BinaryImage(
        0, dataSegment.length, entrypointOffset, dataSegment.clone(), codeSegment.clone());
  }

  public byte[] toByteArray() {
    ByteArrayDataOutput out = ByteStreams.newDataOutput();
    out.write(MAGIC);
    out.writeInt(dataSegmentOffset());
    out.writeInt(codeSegmentOffset());
    out.writeInt(entrypointOffset());
    out.write(dataSegmentBytes());
    out.write(codeSegmentBytes());
    return out.toByteArray();
  }

  /** Reads an image back from {@link #toByteArray()}'s format. */
  public static BinaryImage decode(byte[] bytes) {
    Preconditions.checkArgument(bytes.length >= HEADER_SIZE, "image is shorter than its header");
    Preconditions.checkArgument(
        Arrays.equals(Arrays.copyOf(bytes, MAGIC_SIZE), MAGIC), "bad magic number");

    ByteArrayDataInput in = ByteStreams.newDataInput(bytes, MAGIC_SIZE);
    int dataSegmentOffset = in.readInt();
    int codeSegmentOffset = in.readInt();
    int entrypointOffset = in.readInt();
    Preconditions.checkArgument(dataSegmentOffset == 0, "data segment must start at 0");
    Preconditions.checkArgument(
        codeSegmentOffset >= 0 && codeSegmentOffset <= bytes.length - HEADER_SIZE,
        "code segment offset %s is out of range",
        codeSegmentOffset);

    int codeStart = HEADER_SIZE + codeSegmentOffset;
    return create(
        Arrays.copyOfRange(bytes, HEADER_SIZE, codeStart),
        Arrays.copyOfRange(bytes, codeStart, bytes.length),
        entrypointOffset);
  }
}
