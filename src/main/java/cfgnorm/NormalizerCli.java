package cfgnorm;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

import guru.nidi.graphviz.engine.Format;
import guru.nidi.graphviz.engine.GraphvizException;

import cfgnorm.dot.LeftCornerGraph;
import cfgnorm.examples.Examples;
import cfgnorm.grammar.Grammar;
import cfgnorm.grammar.GrammarReader;
import cfgnorm.grammar.InvalidGrammarException;
import cfgnorm.grammar.NonTerminal;
import cfgnorm.grammar.sentences.SentenceEnumerator;
import cfgnorm.transform.LeftRecursionElimination;
import cfgnorm.transform.Normalizer;

import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;
import static picocli.CommandLine.Parameters;

@Command(name = "cfgnorm", mixinStandardHelpOptions = true,
		description = "Removes the epsilon productions and the left recursion of a context free grammar")
public class NormalizerCli implements Callable<Integer> {

	/** Exit code if the normalized grammar derives different sentences */
	public static final int LANGUAGE_MISMATCH = 1;
	/** Exit code for unreadable or invalid grammars */
	public static final int INVALID_GRAMMAR = 2;

	private static final Logger LOG = Logger.getLogger(NormalizerCli.class.getName());

	/** Parent logger of all cfgnorm loggers, kept here so that its level isn't garbage collected */
	private static final Logger PROJECT_LOG = Logger.getLogger("cfgnorm");

	@Parameters(index = "0", arity = "0..1", description = "The grammar file, the built-in expression grammar is used if omitted")
	private Path grammarPath;

	@Option(names = {"--check-length"}, description = "Compare the sentences of at most <length> terminals of the input and the normalized grammar")
	private int checkLength = -1;

	@Option(names = {"--dot"}, description = "Render the left corner graphs of the input and the normalized grammar to <prefix>-input.svg and <prefix>-output.svg")
	private String dotPrefix = null;

	@Option(names = {"--quiet"}, description = "Only print the normalized grammar")
	private boolean quiet = false;

	@Option(names = {"--verbose"}, description = "Log the transformation steps")
	private boolean verbose = false;

	private final PrintStream out;
	private final PrintStream err;

	public NormalizerCli() {
		this(new PrintStream(System.out, true, StandardCharsets.UTF_8),
				new PrintStream(System.err, true, StandardCharsets.UTF_8));
	}

	public NormalizerCli(PrintStream out, PrintStream err) {
		this.out = out;
		this.err = err;
	}

	@Override
	public Integer call() {
		if (verbose){
			PROJECT_LOG.setLevel(Level.FINE);
		}
		Grammar grammar;
		try {
			grammar = grammarPath == null ? Examples.expressionGrammar() : GrammarReader.read(grammarPath);
		} catch (InvalidGrammarException e) {
			err.println("Invalid grammar: " + e.getMessage());
			return INVALID_GRAMMAR;
		} catch (IOException e) {
			LOG.log(Level.SEVERE, "Cannot read " + grammarPath, e);
			err.println("Cannot read " + grammarPath + ": " + e.getMessage());
			return INVALID_GRAMMAR;
		}

		Set<NonTerminal> nullable = grammar.calculateNullable();
		Grammar withoutEpsilon = Normalizer.removeEpsilonRules(grammar);
		Grammar result = Normalizer.eliminateLeftRecursion(withoutEpsilon);

		if (!quiet){
			section("Input grammar", grammar.longDescription());
			section("Nullable non terminals", nullable.toString());
			section("Left recursive non terminals", LeftRecursionElimination.findLeftRecursive(grammar).toString());
			section("Without epsilon productions", withoutEpsilon.longDescription());
			section("Without left recursion", result.longDescription());
		} else {
			out.println(result.longDescription());
		}

		if (dotPrefix != null){
			try {
				LeftCornerGraph.render(grammar, "input", Format.SVG, new File(dotPrefix + "-input.svg"));
				LeftCornerGraph.render(result, "output", Format.SVG, new File(dotPrefix + "-output.svg"));
			} catch (IOException | GraphvizException e) {
				LOG.log(Level.SEVERE, "Cannot render the left corner graphs", e);
				err.println("Cannot render the left corner graphs: " + e.getMessage());
				return ExitCode.SOFTWARE;
			}
		}

		if (checkLength >= 0){
			// the start non terminal loses its epsilon production if it occurs on a right hand side
			boolean equal = SentenceEnumerator.languagesEqual(grammar, result, checkLength, true);
			out.println(String.format("Non empty sentences up to length %d %s", checkLength, equal ? "are equal" : "differ"));
			boolean inputEpsilon = new SentenceEnumerator(grammar, 0).derivesEpsilon();
			boolean resultEpsilon = new SentenceEnumerator(result, 0).derivesEpsilon();
			if (inputEpsilon != resultEpsilon){
				out.println(String.format("The empty word is %s", resultEpsilon ? "added" : "dropped"));
			}
			if (!equal){
				return LANGUAGE_MISMATCH;
			}
		}
		return ExitCode.OK;
	}

	private void section(String title, String content){
		out.println("=".repeat(50));
		out.println(title + ":");
		out.println(content);
	}
}
