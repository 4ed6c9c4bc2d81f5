package rtc;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

public class CompilerMain {

  public static void main(String[] args) throws IOException {
    if (args.length != 1) {
      System.err.println("Usage: $COMPILER trigger_file");
      System.exit(1);
    }

    File file = new File(args[0]);
    ImmutableList<ImmutableList<Token>> clauses;
    try {
      clauses = new Tokenizer(file.toString(), read(file)).tokenize();
    } catch (CompilerException ex) {
      ex.print();
      System.out.println("Compilation failed.  See errors above.");
      System.exit(1);
      return;
    }

    TriggerParser parser = new TriggerParser(new BasicSelectors());
    List<CompilerException> errors = new ArrayList<>();
    for (ImmutableList<Token> clause : clauses) {
      try {
        Node.Trigger trigger = parser.parseClause(clause);
        ImmutableList<CompilerException> shapeErrors = TreeShapeValidator.validate(trigger);
        if (shapeErrors.isEmpty()) {
          System.out.println(trigger);
        } else {
          errors.addAll(shapeErrors);
        }
      } catch (CompilerException ex) {
        errors.add(ex);
      }
    }

    if (!errors.isEmpty()) {
      errors.forEach(CompilerException::print);
      System.out.println("Compilation failed.  See errors above.");
      System.exit(1);
    }

    System.out.println(String.format("Compiled %d trigger(s).", clauses.size()));
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }
}
