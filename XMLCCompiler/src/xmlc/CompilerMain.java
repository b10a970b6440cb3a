package xmlc;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.io.Files;

import gnu.getopt.Getopt;
import gnu.getopt.LongOpt;

public class CompilerMain {
  private static final Logger logger = LoggerFactory.getLogger(CompilerMain.class);

  private static final String PROGRAM = "xmlc";

  private static final String USAGE =
      "Usage: xmlc -f <file> [options]\n\n"
          + "Options:\n"
          + "  -f, --file FILE        Source file to compile\n"
          + "  -d, --dump ast|tokens  Print the tree or the tokens as JSON and stop\n"
          + "  -o, --output STEM      Output file stem (default: out); writes STEM.kubo\n"
          + "  -S, --assembly         Also write the assembly text to STEM.asm\n"
          + "  -h, --help             Print this message\n";

  private static final LongOpt[] LONG_OPTIONS = {
    new LongOpt("file", LongOpt.REQUIRED_ARGUMENT, null, 'f'),
    new LongOpt("dump", LongOpt.REQUIRED_ARGUMENT, null, 'd'),
    new LongOpt("output", LongOpt.REQUIRED_ARGUMENT, null, 'o'),
    new LongOpt("assembly", LongOpt.NO_ARGUMENT, null, 'S'),
    new LongOpt("help", LongOpt.NO_ARGUMENT, null, 'h'),
  };

  static final String DUMP_AST = "ast";
  static final String DUMP_TOKENS = "tokens";

  static final String IMAGE_EXTENSION = ".kubo";
  static final String ASSEMBLY_EXTENSION = ".asm";

  public static void main(String[] args) {
    System.exit(run(args, System.out));
  }

  /** Runs the compiler and returns the process exit code. */
  static int run(String[] args, PrintStream out) {
    String file = null;
    String dump = null;
    String stem = "out";
    boolean writeAssembly = false;

    Getopt opts = new Getopt(PROGRAM, args, "f:d:o:Sh", LONG_OPTIONS);
    int opt;
    while ((opt = opts.getopt()) >= 0) {
      switch (opt) {
        case 'f':
          file = opts.getOptarg();
          break;
        case 'd':
          dump = opts.getOptarg();
          break;
        case 'o':
          stem = opts.getOptarg();
          break;
        case 'S':
          writeAssembly = true;
          break;
        case 'h':
          out.print(USAGE);
          return 0;
        default:
          out.print(USAGE);
          return 1;
      }
    }
    if (file == null
        || opts.getOptind() < args.length
        || (dump != null && !dump.equals(DUMP_AST) && !dump.equals(DUMP_TOKENS))) {
      out.print(USAGE);
      return 1;
    }

    File input = new File(file);
    if (!input.isFile()) {
      out.println("ERROR: no such file: " + file);
      return 1;
    }
    String content;
    try {
      content = Files.asCharSource(input, StandardCharsets.UTF_8).read();
    } catch (IOException ex) {
      logger.error("Could not read {}", input, ex);
      out.println("ERROR: could not read " + file);
      return 1;
    }

    XmlcCompiler compiler = new XmlcCompiler(file, content);
    if (DUMP_TOKENS.equals(dump)) {
      out.println(JsonDumper.render(JsonDumper.dumpTokens(compiler.tokens())));
      return 0;
    }

    AST.Program program;
    try {
      program = compiler.parse();
    } catch (CompilerException ex) {
      compiler.diagnostics().print(out);
      ex.print(out);
      return failed(out);
    }
    compiler.diagnostics().print(out);

    if (DUMP_AST.equals(dump)) {
      out.println(JsonDumper.render(JsonDumper.dumpAst(program)));
      return 0;
    }

    BinaryImage image;
    try {
      image = compiler.assemble();
    } catch (CompilerException ex) {
      ex.print(out);
      return failed(out);
    }

    List<File> written = new ArrayList<>();
    try {
      File imageFile = new File(stem + IMAGE_EXTENSION);
      Files.asByteSink(imageFile).write(image.toByteArray());
      written.add(imageFile);
      if (writeAssembly) {
        File assemblyFile = new File(stem + ASSEMBLY_EXTENSION);
        Files.asCharSink(assemblyFile, StandardCharsets.UTF_8).write(compiler.generate());
        written.add(assemblyFile);
      }
    } catch (CompilerException | IOException ex) {
      logger.error("Could not write output for {}", stem, ex);
      // Either every output is written or none is.
      for (File partial : written) {
        if (!partial.delete()) {
          logger.warn("Could not remove {}", partial);
        }
      }
      out.println("ERROR: could not write output for " + stem);
      return 1;
    }
    logger.info("Wrote {}", written);

    out.println("Compilation succeeded!");
    return 0;
  }

  private static int failed(PrintStream out) {
    out.println("Compilation failed.  See errors above.");
    return 1;
  }
}
