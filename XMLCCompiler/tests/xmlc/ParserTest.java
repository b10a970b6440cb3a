package xmlc;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class ParserTest {

  private Diagnostics diagnostics;

  private AST.Program parse(String... lines) throws CompilerException {
    Tokenizer tokenizer =
        new Tokenizer("test.xml", Arrays.asList(lines).stream().collect(Collectors.joining("\n")));
    diagnostics = new Diagnostics(tokenizer.lines());
    return new Parser(tokenizer.tokenize(), diagnostics).parse();
  }

  private ImmutableList<Diagnostic> assertErrors(String... lines) {
    CompilerException ex = assertThrows(CompilerException.class, () -> parse(lines));
    assertThat(ex).hasMessageThat().isEqualTo(Parser.GIVE_UP);
    assertThat(diagnostics.hasErrors()).isTrue();
    return diagnostics.errors();
  }

  private static void assertDiagnostic(
      Diagnostic diagnostic, Diagnostic.Kind kind, String text, String messageSubstr) {
    assertThat(diagnostic.kind()).isEqualTo(kind);
    assertThat(diagnostic.issues().get(0).token().text()).isEqualTo(text);
    assertThat(diagnostic.issues().get(0).message()).contains(messageSubstr);
  }

  @Test
  public void emptyProgram() throws CompilerException {
    AST.Program program = parse("<program>", "</program>");

    assertThat(program.scope()).isEmpty();
    assertThat(diagnostics.all()).isEmpty();
  }

  @Test
  public void helloWorld() throws CompilerException {
    AST.Program program =
        parse(
            "<program>",
            "    <function name=\"main\" type=\"none\">",
            "        <call who=\"println\">",
            "            <arg>hello</arg>",
            "        </call>",
            "    </function>",
            "</program>");

    assertThat(diagnostics.all()).isEmpty();
    assertThat(program.scope()).hasSize(2);

    AST.Function main = program.functions().get(0);
    assertThat(main.name()).isEqualTo("main");
    assertThat(main.resultType()).isEqualTo(AST.NONE);
    assertThat(main.parameters()).isEmpty();
    assertThat(main.scope()).hasSize(2);

    AST.Call println = ((AST.Statement) main.scope().get(0)).cast();
    assertThat(println.who()).isEqualTo("println");
    assertThat(println.arguments()).hasSize(1);
    assertThat(println.arguments().get(0).value().value()).isEqualTo("hello");

    // A function of type none gets an empty return when it has none.
    AST.Return ret = ((AST.Statement) main.scope().get(1)).cast();
    assertThat(ret.value().isPresent()).isFalse();

    // Top-level code ends with a call to main.
    AST.Call callMain = program.statements().get(0).cast();
    assertThat(callMain.who()).isEqualTo("main");
    assertThat(callMain.arguments()).isEmpty();
  }

  @Test
  public void noImplicitCallWithoutMain() throws CompilerException {
    AST.Program program =
        parse(
            "<program>",
            "    <function name=\"helper\" type=\"none\">",
            "    </function>",
            "</program>");

    assertThat(program.functions()).hasSize(1);
    assertThat(program.statements()).isEmpty();
  }

  @Test
  public void valuesFromPropertiesOrText() throws CompilerException {
    AST.Program program =
        parse(
            "<program>",
            "    <function name=\"greet\" type=\"none\" who=\"string\" times=\"number\">",
            "        <let name=\"greeting\" type=\"string\" value=\"hi\"></let>",
            "        <call who=\"println\">",
            "            <arg value=\"${who}\"></arg>",
            "        </call>",
            "    </function>",
            "</program>");

    AST.Function greet = program.functions().get(0);
    assertThat(greet.parameters())
        .containsExactly(
            AST.Function.Parameter.create("who", AST.STRING),
            AST.Function.Parameter.create("times", AST.NUMBER))
        .inOrder();

    AST.Let let = ((AST.Statement) greet.scope().get(0)).cast();
    assertThat(let.name()).isEqualTo("greeting");
    assertThat(let.valueType()).isEqualTo(AST.STRING);
    assertThat(let.value().value()).isEqualTo("hi");

    AST.Call call = ((AST.Statement) greet.scope().get(1)).cast();
    AST.Literal arg = call.arguments().get(0).value().cast();
    assertThat(arg.isPlaceholder()).isTrue();
    assertThat(arg.placeholderName()).isEqualTo("who");
  }

  @Test
  public void returnValue() throws CompilerException {
    AST.Program program =
        parse(
            "<program>",
            "    <function name=\"answer\" type=\"number\">",
            "        <return>42</return>",
            "    </function>",
            "</program>");

    AST.Return ret = ((AST.Statement) program.functions().get(0).scope().get(0)).cast();
    assertThat(ret.valueType()).isEqualTo(AST.NUMBER);
    assertThat(ret.value().get().value()).isEqualTo("42");
  }

  @Test
  public void ifElse() throws CompilerException {
    AST.Program program =
        parse(
            "<program>",
            "    <if condition=\"1\">",
            "        <call who=\"println\">",
            "            <arg>yes</arg>",
            "        </call>",
            "    </if>",
            "    <else>",
            "        <call who=\"println\">",
            "            <arg>no</arg>",
            "        </call>",
            "    </else>",
            "</program>");

    assertThat(program.scope()).hasSize(1);
    AST.If ifNode = program.statements().get(0).cast();
    assertThat(ifNode.condition().value()).isEqualTo("1");
    assertThat(ifNode.trueBranch()).hasSize(1);
    assertThat(ifNode.falseBranch()).hasSize(1);
  }

  @Test
  public void propertyPositionWarnings() throws CompilerException {
    AST.Program program =
        parse(
            "<program>",
            "    <function type=\"none\" name=\"main\">",
            "    </function>",
            "</program>");

    assertThat(program.functions().get(0).name()).isEqualTo("main");
    assertThat(diagnostics.errors()).isEmpty();
    ImmutableList<Diagnostic> warnings = diagnostics.warnings();
    assertThat(warnings).hasSize(2);
    assertDiagnostic(
        warnings.get(0), Diagnostic.Kind.UNEXPECTED_TOKEN_POSITION, "name", "first");
    assertDiagnostic(
        warnings.get(1), Diagnostic.Kind.UNEXPECTED_TOKEN_POSITION, "type", "second");
  }

  @Test
  public void mismatchedClosingTag() {
    ImmutableList<Diagnostic> errors =
        assertErrors("<program>", "    <function name=\"f\" type=\"none\">", "</program>");

    assertThat(errors).hasSize(1);
    Diagnostic mismatch = errors.get(0);
    assertThat(mismatch.kind()).isEqualTo(Diagnostic.Kind.ENCLOSING_TOKEN_MISMATCH);
    assertThat(mismatch.issues()).hasSize(2);
    assertThat(mismatch.issues().get(0).token().text()).isEqualTo("function");
    assertThat(mismatch.issues().get(0).token().pos().lineNumber()).isEqualTo(1);
    assertThat(mismatch.issues().get(1).token().text()).isEqualTo("program");
    assertThat(mismatch.issues().get(1).token().pos().lineNumber()).isEqualTo(2);
  }

  @Test
  public void closingTagAtWrongDepth() {
    ImmutableList<Diagnostic> errors =
        assertErrors(
            "<program>",
            "    <call who=\"println\">",
            "        <arg>x</arg>",
            "        </call>",
            "</program>");

    assertThat(errors).hasSize(1);
    assertThat(errors.get(0).kind()).isEqualTo(Diagnostic.Kind.ENCLOSING_TOKEN_MISMATCH);
    assertThat(errors.get(0).issues().get(0).message()).isEqualTo("opens at depth 1");
    assertThat(errors.get(0).issues().get(1).message()).isEqualTo("closes at depth 2");
  }

  @Test
  public void missingClosingTag() {
    ImmutableList<Diagnostic> errors =
        assertErrors(
            "<program>",
            "    <call who=\"println\">",
            "        <arg>x</arg>",
            "    <call who=\"print\"></call>",
            "</program>");

    assertThat(errors).hasSize(1);
    assertDiagnostic(
        errors.get(0), Diagnostic.Kind.ENCLOSING_TOKEN_MISSING, "call", "</call>");
    assertThat(errors.get(0).pos().lineNumber()).isEqualTo(1);
  }

  @Test
  public void reportsEveryIndependentError() {
    ImmutableList<Diagnostic> errors =
        assertErrors(
            "<program>",
            "    <let name=\"x\" type=\"string\"></let>",
            "    <call>",
            "    </call>",
            "    <call who=\"println\">",
            "        <arg>ok</arg>",
            "    </call>",
            "</program>");

    assertThat(errors).hasSize(2);
    assertDiagnostic(errors.get(0), Diagnostic.Kind.EXPECTED_TOKEN_MISSING, "<", "'value'");
    assertDiagnostic(errors.get(1), Diagnostic.Kind.EXPECTED_TOKEN_MISSING, "call", "'who'");
  }

  @Test
  public void indentedTooDeeply() {
    ImmutableList<Diagnostic> errors =
        assertErrors(
            "<program>",
            "            <call who=\"println\"></call>",
            "    <call who=\"print\"></call>",
            "</program>");

    assertThat(errors).hasSize(1);
    assertDiagnostic(
        errors.get(0), Diagnostic.Kind.UNEXPECTED_TOKEN_REACHED, "<", "indented too deeply");
  }

  @Test
  public void missingReturn() {
    ImmutableList<Diagnostic> errors =
        assertErrors(
            "<program>",
            "    <function name=\"f\" type=\"number\">",
            "        <call who=\"println\">",
            "            <arg>x</arg>",
            "        </call>",
            "    </function>",
            "</program>");

    assertThat(errors).hasSize(1);
    assertDiagnostic(
        errors.get(0), Diagnostic.Kind.MISSING_RETURN_STATEMENT, "function", "no <return> tag");
  }

  @Test
  public void secondReturn() {
    ImmutableList<Diagnostic> errors =
        assertErrors(
            "<program>",
            "    <function name=\"f\" type=\"number\">",
            "        <return>1</return>",
            "        <return>2</return>",
            "    </function>",
            "</program>");

    assertThat(errors).hasSize(1);
    assertDiagnostic(
        errors.get(0), Diagnostic.Kind.UNEXPECTED_TOKEN_REACHED, "return", "second <return>");
    assertThat(errors.get(0).pos().lineNumber()).isEqualTo(3);
  }

  @Test
  public void unknownType() {
    ImmutableList<Diagnostic> errors =
        assertErrors(
            "<program>",
            "    <let name=\"x\" type=\"bool\">1</let>",
            "</program>");

    assertThat(errors).hasSize(1);
    assertDiagnostic(errors.get(0), Diagnostic.Kind.UNEXPECTED_TOKEN_REACHED, "bool", "not a type");
  }

  @Test
  public void argOutsideCall() {
    ImmutableList<Diagnostic> errors = assertErrors("<program>", "    <arg>x</arg>", "</program>");

    assertThat(errors).hasSize(1);
    assertDiagnostic(
        errors.get(0), Diagnostic.Kind.UNEXPECTED_TOKEN_REACHED, "arg", "inside <program>");
  }

  @Test
  public void onlyArgsInsideCall() {
    ImmutableList<Diagnostic> errors =
        assertErrors(
            "<program>",
            "    <call who=\"println\">",
            "        <let name=\"x\" type=\"number\">1</let>",
            "    </call>",
            "</program>");

    assertThat(errors).hasSize(1);
    assertDiagnostic(
        errors.get(0), Diagnostic.Kind.UNEXPECTED_TOKEN_REACHED, "let", "inside <call>");
  }

  @Test
  public void contentAfterProgram() {
    ImmutableList<Diagnostic> errors =
        assertErrors("<program>", "</program>", "<program>", "</program>");

    assertThat(errors).hasSize(1);
    assertDiagnostic(
        errors.get(0), Diagnostic.Kind.UNEXPECTED_TOKEN_REACHED, "<", "after the closing");
    assertThat(errors.get(0).pos().lineNumber()).isEqualTo(2);
  }

  @Test
  public void unexpectedEndOfFile() {
    ImmutableList<Diagnostic> errors = assertErrors("<program>", "    <call who=\"println\"");

    assertDiagnostic(
        errors.get(0),
        Diagnostic.Kind.UNEXPECTED_END_OF_FILE,
        Tokenizer.END_OF_FILE_TEXT,
        "a property");
  }

  @Test
  public void missingEquals() {
    ImmutableList<Diagnostic> errors =
        assertErrors("<program>", "    <call who \"println\"></call>", "</program>");

    assertThat(errors).hasSize(1);
    assertDiagnostic(errors.get(0), Diagnostic.Kind.EXPECTED_TOKEN_MISSING, "\"", "equals");
  }

  @Test
  public void notAProgram() {
    ImmutableList<Diagnostic> errors = assertErrors("<call who=\"println\">", "</call>");

    assertDiagnostic(errors.get(0), Diagnostic.Kind.UNEXPECTED_TOKEN_REACHED, "call", "a tag");
  }

  @Test
  public void deterministicDiagnostics() {
    String[] lines = {
      "<program>",
      "    <let name=\"x\" type=\"string\"></let>",
      "    <function name=\"f\" type=\"none\">",
      "</program>"
    };

    ImmutableList<Diagnostic> first = assertErrors(lines);
    ImmutableList<Diagnostic> second = assertErrors(lines);

    assertThat(second).isEqualTo(first);
  }
}
