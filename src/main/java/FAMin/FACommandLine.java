package FAMin;

import FAMin.Model.FAException;
import FAMin.Model.FiniteAutomaton;
import FAMin.Model.WellSpecifiedAutomaton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.SortedSet;

public class FACommandLine {
  private static final Logger LOG = LoggerFactory.getLogger(FACommandLine.class);

  static final String PROGRAM = "fa-min";

  static final int SUCCESS = 0;
  static final int ERR_ARGS = 1;
  static final int ERR_INPUT = 2;
  static final int ERR_OUTPUT = 3;
  static final int ERR_MINIMIZE = 4;

  private static final Set<String> LONG_OPTIONS = Set.of(
      "help", "input", "output", "find-non-finishing", "minimize", "case-insensitive", "debug");

  enum Mode { NORMALIZE, MINIMIZE, FIND_NON_FINISHING }

  record Options(boolean help, String input, String output, Mode mode, boolean caseInsensitive, boolean debug) { }

  static class ArgumentException extends Exception {
    ArgumentException(String message) {
      super(message);
    }
  }

  public static void main(String[] args) {
    System.exit(run(args, System.in, System.out, System.err));
  }

  /**
   * Whole command-line run with explicit streams.
   * @return exit status
   */
  static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
    final Options options;
    try {
      options = parseArgs(args);
    } catch (ArgumentException e) {
      err.println(PROGRAM + ": " + e.getMessage());
      return ERR_ARGS;
    }
    if (options.help()) {
      printUsage(out);
      return SUCCESS;
    }
    FAMinimizer.DEBUG = options.debug();

    String content;
    try {
      content = options.input() == null ? FAFormat.read(in) : FAFormat.readFAFile(options.input());
    } catch (IOException e) {
      if (FAMinimizer.DEBUG) {
        LOG.info("Reading input failed", e);
      }
      err.println(PROGRAM + ": cannot open file for reading '" + options.input() + "'");
      return ERR_INPUT;
    }

    String result;
    try {
      result = process(content, options.mode(), options.caseInsensitive());
    } catch (FAException e) {
      err.println(e.format());
      return e.getCode();
    } catch (IllegalStateException e) {
      // minimizer invariant, e.g. a merged name that is already taken
      err.println(PROGRAM + ": cannot minimize: " + e.getMessage());
      return ERR_MINIMIZE;
    }

    if (options.output() == null) {
      out.print(result);
      out.flush();
      return SUCCESS;
    }
    try {
      FAFormat.writeFAFile(options.output(), result);
    } catch (IOException e) {
      if (FAMinimizer.DEBUG) {
        LOG.info("Writing output failed", e);
      }
      err.println(PROGRAM + ": cannot open file for writing '" + options.output() + "'");
      return ERR_OUTPUT;
    }
    return SUCCESS;
  }

  /**
   * Parse, check and transform the automaton according to mode.
   * @param content - automaton in the textual format
   * @param mode - requested output
   * @param caseInsensitive - lower-case the whole input first
   * @return text to write: the automaton followed by a newline, or a single state name (or "0") without one
   */
  static String process(String content, Mode mode, boolean caseInsensitive) throws FAException {
    if (caseInsensitive) {
      content = content.toLowerCase(Locale.ROOT);
    }
    final FiniteAutomaton fa = FAFormat.parse(content);
    final WellSpecifiedAutomaton wsa = WellSpecifiedAutomaton.of(fa);
    if (FAMinimizer.DEBUG) {
      LOG.info("Read well-specified automaton: {} states, {} symbols, {} rules",
          wsa.getStates().size(), wsa.getAlphabet().size(), wsa.getRules().size());
    }

    return switch (mode) {
      case FIND_NON_FINISHING -> {
        SortedSet<String> nonTerminating = wsa.nonTerminatingStates();
        yield nonTerminating.isEmpty() ? "0" : nonTerminating.first();
      }
      case MINIMIZE -> FAFormat.serialize(FAMinimizer.minimize(wsa)) + "\n";
      case NORMALIZE -> FAFormat.serialize(wsa) + "\n";
    };
  }

  static Options parseArgs(String[] args) throws ArgumentException {
    boolean help = false;
    boolean minimize = false;
    boolean find = false;
    boolean caseInsensitive = false;
    boolean debug = false;
    String input = null;
    String output = null;
    Set<String> seen = new HashSet<>();

    for (String arg : args) {
      if (arg.startsWith("--")) {
        String name = arg.substring(2);
        String value = null;
        int eq = name.indexOf('=');
        if (eq >= 0) {
          value = name.substring(eq + 1);
          name = name.substring(0, eq);
        }
        if (!LONG_OPTIONS.contains(name)) {
          throw new ArgumentException("option '--" + name + "' not recognized");
        }
        if ("input".equals(name) || "output".equals(name)) {
          if (value == null || value.isEmpty()) {
            throw new ArgumentException("option '--" + name + "' requires argument");
          }
        } else if (value != null) {
          throw new ArgumentException("option '--" + name + "' must not have an argument");
        }
        markSeen(seen, name);
        switch (name) {
          case "help" -> help = true;
          case "input" -> input = value;
          case "output" -> output = value;
          case "find-non-finishing" -> find = true;
          case "minimize" -> minimize = true;
          case "case-insensitive" -> caseInsensitive = true;
          case "debug" -> debug = true;
        }
      } else if (arg.startsWith("-") && arg.length() > 1) {
        // bundled short flags, e.g. -mi
        for (char c : arg.substring(1).toCharArray()) {
          switch (c) {
            case 'm' -> {
              markSeen(seen, "minimize");
              minimize = true;
            }
            case 'f' -> {
              markSeen(seen, "find-non-finishing");
              find = true;
            }
            case 'i' -> {
              markSeen(seen, "case-insensitive");
              caseInsensitive = true;
            }
            default -> throw new ArgumentException("option '-" + c + "' not recognized");
          }
        }
      } else {
        throw new ArgumentException("invalid program argument '" + arg + "'");
      }
    }

    if (minimize && find) {
      throw new ArgumentException("cannot combine 'minimize' and 'find-non-finishing' options");
    }
    Mode mode = minimize ? Mode.MINIMIZE : find ? Mode.FIND_NON_FINISHING : Mode.NORMALIZE;
    return new Options(help, input, output, mode, caseInsensitive, debug);
  }

  private static void markSeen(Set<String> seen, String name) throws ArgumentException {
    if (!seen.add(name)) {
      throw new ArgumentException("cannot combine two or more same options");
    }
  }

  private static void printUsage(PrintStream out) {
    out.println(PROGRAM + " [options]");
    out.println("Checks that a finite automaton is well specified and prints it in normalized form.");
    out.println();
    out.println("  --help                     : Print this message.");
    out.println("  --input=<file>             : Read the automaton from <file> instead of standard input.");
    out.println("  --output=<file>            : Write the result to <file> instead of standard output.");
    out.println("  -f, --find-non-finishing   : Output the only non-terminating state, or 0 if there is none.");
    out.println("  -m, --minimize             : Output the minimal equivalent automaton.");
    out.println("  -i, --case-insensitive     : Ignore letter case in states and symbols.");
    out.println("  --debug                    : Cross-check minimization with AutomataLib.");
    out.println();
    out.println("Automaton format:");
    out.println("  ({states}, {alphabet}, {rules}, start, {final states})");
    out.println("  e.g. ({a, b}, {'0'}, {a '0' -> b, b '0' -> b}, a, {b})");
  }
}
