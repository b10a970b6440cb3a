package xmlc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/**
 * One compilation of one source file. Each stage runs at most once, on first request, and its
 * result is kept; a failed stage throws again on every request.
 */
public final class XmlcCompiler {
  private static final Logger logger = LoggerFactory.getLogger(XmlcCompiler.class);

  private final Tokenizer tokenizer;
  private final Diagnostics diagnostics;

  private ImmutableList<Tokenizer.Token> tokens = null;
  private AST.Program program = null;
  private CompilerException parseFailure = null;
  private String assembly = null;
  private BinaryImage image = null;

  public XmlcCompiler(String file, String content) {
    this.tokenizer = new Tokenizer(file, content);
    this.diagnostics = new Diagnostics(tokenizer.lines());
  }

  public String file() {
    return tokenizer.file();
  }

  public ImmutableList<String> lines() {
    return tokenizer.lines();
  }

  public Diagnostics diagnostics() {
    return diagnostics;
  }

  public ImmutableList<Tokenizer.Token> tokens() {
    if (tokens == null) {
      tokens = tokenizer.tokenize();
      logger.debug("{}: {} tokens", file(), tokens.size());
    }
    return tokens;
  }

  public AST.Program parse() throws CompilerException {
    if (parseFailure != null) {
      throw parseFailure;
    }
    if (program == null) {
      try {
        program = new Parser(tokens(), diagnostics).parse();
      } catch (CompilerException ex) {
        parseFailure = ex;
        throw ex;
      }
    }
    return program;
  }

  public String generate() throws CompilerException {
    if (assembly == null) {
      assembly = new CodeGenerator(parse()).generate();
    }
    return assembly;
  }

  public BinaryImage assemble() throws CompilerException {
    if (image == null) {
      image = new Assembler(file(), generate()).assemble();
      logger.info(
          "{}: {} data bytes, {} code bytes",
          file(),
          image.dataSegment().length,
          image.codeSegment().length);
    }
    return image;
  }
}
