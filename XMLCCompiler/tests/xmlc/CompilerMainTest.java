package xmlc;

import static com.google.common.truth.Truth.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.common.base.Joiner;
import com.google.common.io.Files;

public class CompilerMainTest {

  private static final String HELLO =
      Joiner.on('\n')
          .join(
              "<program>",
              "    <function name=\"main\" type=\"none\">",
              "        <call who=\"println\">",
              "            <arg>hello</arg>",
              "        </call>",
              "    </function>",
              "</program>",
              "");

  private static final String MISMATCH =
      Joiner.on('\n')
          .join("<program>", "    <function name=\"f\" type=\"none\">", "</program>", "");

  @TempDir Path dir;

  private ByteArrayOutputStream output;

  @BeforeEach
  public void setUp() {
    output = new ByteArrayOutputStream();
  }

  private int run(String... args) {
    return CompilerMain.run(args, new PrintStream(output, true, StandardCharsets.UTF_8));
  }

  private String output() {
    return new String(output.toByteArray(), StandardCharsets.UTF_8);
  }

  private String write(String name, String content) throws IOException {
    File file = dir.resolve(name).toFile();
    Files.asCharSink(file, StandardCharsets.UTF_8).write(content);
    return file.getPath();
  }

  private String stem(String name) {
    return dir.resolve(name).toString();
  }

  @Test
  public void compiles() throws IOException, CompilerException {
    String source = write("hello.xml", HELLO);

    assertThat(run("-f", source, "-o", stem("hello"))).isEqualTo(0);

    assertThat(output()).contains("Compilation succeeded!");
    File image = new File(stem("hello") + CompilerMain.IMAGE_EXTENSION);
    assertThat(Files.asByteSource(image).read())
        .isEqualTo(new XmlcCompiler(source, HELLO).assemble().toByteArray());
    assertThat(new File(stem("hello") + CompilerMain.ASSEMBLY_EXTENSION).exists()).isFalse();
  }

  @Test
  public void writesAssembly() throws IOException, CompilerException {
    String source = write("hello.xml", HELLO);

    assertThat(run("--file", source, "--output", stem("hello"), "--assembly")).isEqualTo(0);

    File assembly = new File(stem("hello") + CompilerMain.ASSEMBLY_EXTENSION);
    assertThat(Files.asCharSource(assembly, StandardCharsets.UTF_8).read())
        .isEqualTo(new XmlcCompiler(source, HELLO).generate());
  }

  @Test
  public void failedWriteLeavesNoOutput() throws IOException {
    String source = write("hello.xml", HELLO);
    File assembly = new File(stem("hello") + CompilerMain.ASSEMBLY_EXTENSION);
    assertThat(assembly.mkdir()).isTrue();

    assertThat(run("-f", source, "-o", stem("hello"), "-S")).isEqualTo(1);

    assertThat(output()).contains("could not write output");
    assertThat(new File(stem("hello") + CompilerMain.IMAGE_EXTENSION).exists()).isFalse();
  }

  @Test
  public void reportsDiagnostics() throws IOException {
    String source = write("bad.xml", MISMATCH);

    assertThat(run("-f", source, "-o", stem("bad"))).isEqualTo(1);

    assertThat(output()).contains("[error]: mismatching tokens found");
    assertThat(output()).contains("I give up.");
    assertThat(output()).endsWith("Compilation failed.  See errors above.\n");
    assertThat(new File(stem("bad") + CompilerMain.IMAGE_EXTENSION).exists()).isFalse();
  }

  @Test
  public void reportsCodeGenerationErrors() throws IOException {
    String source =
        write(
            "undefined.xml",
            Joiner.on('\n').join("<program>", "    <call who=\"nothing\"></call>", "</program>"));

    assertThat(run("-f", source, "-o", stem("undefined"))).isEqualTo(1);

    assertThat(output()).contains("call to undefined function 'nothing'");
    assertThat(output()).contains("Compilation failed.  See errors above.");
    assertThat(new File(stem("undefined") + CompilerMain.IMAGE_EXTENSION).exists()).isFalse();
  }

  @Test
  public void dumpsTokens() throws IOException {
    String source = write("hello.xml", HELLO);

    assertThat(run("-f", source, "-d", "tokens")).isEqualTo(0);

    assertThat(output()).startsWith("[");
    assertThat(output()).contains("\"type\" : \"KEYWORD\"");
  }

  @Test
  public void dumpsAst() throws IOException {
    String source = write("hello.xml", HELLO);

    assertThat(run("-f", source, "--dump", "ast", "-o", stem("hello"))).isEqualTo(0);

    assertThat(output()).contains("\"FUNCTION\"");
    assertThat(new File(stem("hello") + CompilerMain.IMAGE_EXTENSION).exists()).isFalse();
  }

  @Test
  public void missingFile() {
    assertThat(run("-f", stem("nowhere.xml"))).isEqualTo(1);

    assertThat(output()).contains("no such file");
  }

  @Test
  public void usage() throws IOException {
    assertThat(run()).isEqualTo(1);
    assertThat(output()).startsWith("Usage: xmlc");

    String source = write("hello.xml", HELLO);
    assertThat(run("-f", source, "-d", "bytes")).isEqualTo(1);
  }

  @Test
  public void help() {
    assertThat(run("-h")).isEqualTo(0);

    assertThat(output()).contains("--assembly");
  }
}
