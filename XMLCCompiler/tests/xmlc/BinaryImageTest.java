package xmlc;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

public class BinaryImageTest {

  private static final byte[] DATA = {0, 0, 0, 2, 'h', 'i'};
  private static final byte[] CODE = {0x05, 0x04, 0x00, 0x05};

  @Test
  public void header() {
    byte[] bytes = BinaryImage.create(DATA, CODE, 1).toByteArray();

    assertThat(bytes).hasLength(BinaryImage.HEADER_SIZE + DATA.length + CODE.length);
    assertThat(new String(bytes, 0, BinaryImage.MAGIC_SIZE, StandardCharsets.US_ASCII))
        .isEqualTo("This is a kubo program\0");
    assertThat(Arrays.copyOfRange(bytes, BinaryImage.MAGIC_SIZE, BinaryImage.HEADER_SIZE))
        .isEqualTo(new byte[] {0, 0, 0, 0, 0, 0, 0, 6, 0, 0, 0, 1});
    assertThat(Arrays.copyOfRange(bytes, BinaryImage.HEADER_SIZE, bytes.length))
        .isEqualTo(new byte[] {0, 0, 0, 2, 'h', 'i', 0x05, 0x04, 0x00, 0x05});
  }

  @Test
  public void decode() {
    BinaryImage image = BinaryImage.decode(BinaryImage.create(DATA, CODE, 1).toByteArray());

    assertThat(image.dataSegmentOffset()).isEqualTo(0);
    assertThat(image.codeSegmentOffset()).isEqualTo(DATA.length);
    assertThat(image.entrypointOffset()).isEqualTo(1);
    assertThat(image.dataSegment()).isEqualTo(DATA);
    assertThat(image.codeSegment()).isEqualTo(CODE);
  }

  @Test
  public void segmentsAreCopied() {
    byte[] code = CODE.clone();
    BinaryImage image = BinaryImage.create(DATA, code, 0);
    code[0] = 0x7f;
    image.codeSegment()[1] = 0x7f;

    assertThat(image.codeSegment()).isEqualTo(CODE);
  }

  @Test
  public void rejectsBadImages() {
    assertThrows(IllegalArgumentException.class, () -> BinaryImage.create(DATA, CODE, 4));
    assertThrows(IllegalArgumentException.class, () -> BinaryImage.decode(new byte[10]));

    byte[] bytes = BinaryImage.create(DATA, CODE, 0).toByteArray();
    bytes[0] = 't';
    assertThrows(IllegalArgumentException.class, () -> BinaryImage.decode(bytes));
  }
}
