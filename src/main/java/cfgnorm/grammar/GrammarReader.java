package cfgnorm.grammar;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads grammars from a simple line based description.
 *
 * <pre>
 * # comment
 * start: E
 * terminals: + * ( ) id
 * E -> E + T | T | ε
 * T -> T * F
 *    | F
 * F → ( E ) | id
 * </pre>
 *
 * Symbols are separated by whitespace, <code>ε</code>, <code>eps</code> or an empty alternative denote
 * an epsilon production. Lines starting with <code>|</code> continue the previous rule.
 * Without a <code>terminals:</code> line every symbol that isn't the left hand side of a rule is a terminal,
 * without a <code>start:</code> line the first left hand side is the start non terminal.
 * A <code>nonterminals:</code> line declares non terminals (and their order) up front.
 */
public class GrammarReader {

	private static final List<String> arrows = Arrays.asList("->", "→");
	private static final Set<String> epsilons = new HashSet<>(Arrays.asList("ε", "eps"));

	private String start = null;
	private Set<String> terminals = null;
	private final List<String> declaredNonTerminals = new ArrayList<>();
	private final Set<String> heads = new LinkedHashSet<>();
	private final List<List<String>> rules = new ArrayList<>();
	private final Set<String> usedSymbols = new LinkedHashSet<>();
	private String currentHead = null;

	private GrammarReader() {
	}

	public static Grammar read(Path file) throws IOException {
		try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			return read(reader);
		}
	}

	public static Grammar read(Reader reader) throws IOException {
		GrammarReader grammarReader = new GrammarReader();
		BufferedReader input = new BufferedReader(reader);
		String line;
		int lineNumber = 0;
		while ((line = input.readLine()) != null){
			lineNumber++;
			grammarReader.processLine(line.trim(), lineNumber);
		}
		return grammarReader.toGrammar(lineNumber);
	}

	public static Grammar parse(String description) {
		try {
			return read(new StringReader(description));
		} catch (IOException e) {
			throw new AssertionError(e);
		}
	}

	private void processLine(String line, int lineNumber){
		if (line.isEmpty() || line.startsWith("#")){
			return;
		}
		if (line.startsWith("start:")){
			List<String> names = tokenize(line.substring("start:".length()));
			if (names.size() != 1){
				throw new GrammarSyntaxException(lineNumber, "Expected exactly one start non terminal");
			}
			start = names.get(0);
			return;
		}
		if (line.startsWith("terminals:")){
			if (terminals == null){
				terminals = new LinkedHashSet<>();
			}
			terminals.addAll(tokenize(line.substring("terminals:".length())));
			return;
		}
		if (line.startsWith("nonterminals:")){
			declaredNonTerminals.addAll(tokenize(line.substring("nonterminals:".length())));
			return;
		}
		if (line.startsWith("|")){
			if (currentHead == null){
				throw new GrammarSyntaxException(lineNumber, "Alternative without a preceding rule");
			}
			addAlternatives(currentHead, tokenize(line.substring(1)));
			return;
		}
		List<String> tokens = tokenize(line);
		if (tokens.size() < 2 || !arrows.contains(tokens.get(1))){
			throw new GrammarSyntaxException(lineNumber, "Expected a rule of the form 'Head -> symbols | ...'");
		}
		if (arrows.contains(tokens.get(0)) || tokens.get(0).equals("|")){
			throw new GrammarSyntaxException(lineNumber, "Invalid left hand side " + tokens.get(0));
		}
		currentHead = tokens.get(0);
		heads.add(currentHead);
		addAlternatives(currentHead, tokens.subList(2, tokens.size()));
	}

	/**
	 * Splits the tokens at "|" into alternatives, an empty alternative stands for ε.
	 */
	private void addAlternatives(String head, List<String> tokens){
		List<String> current = new ArrayList<>();
		current.add(head);
		for (String token : tokens){
			if (token.equals("|")){
				rules.add(current);
				current = new ArrayList<>();
				current.add(head);
			} else if (!epsilons.contains(token)){
				current.add(token);
				usedSymbols.add(token);
			}
		}
		rules.add(current);
	}

	private List<String> tokenize(String str){
		List<String> ret = new ArrayList<>();
		for (String token : str.trim().split("\\s+")){
			if (!token.isEmpty()){
				ret.add(token);
			}
		}
		return ret;
	}

	private Grammar toGrammar(int lineCount){
		if (heads.isEmpty() && declaredNonTerminals.isEmpty()){
			throw new GrammarSyntaxException(lineCount, "The grammar has no rules");
		}
		GrammarBuilder builder = new GrammarBuilder();
		Set<String> terminalNames = terminals;
		if (terminalNames == null){
			terminalNames = new LinkedHashSet<>(usedSymbols);
			terminalNames.removeAll(heads);
			terminalNames.removeAll(declaredNonTerminals);
		}
		builder.terminals(terminalNames.toArray(new String[0]));
		builder.nonTerminals(declaredNonTerminals.toArray(new String[0]));
		for (List<String> rule : rules){
			builder.add(rule.get(0), rule.subList(1, rule.size()).toArray());
		}
		String startName = start;
		if (startName == null){
			startName = declaredNonTerminals.isEmpty() ? heads.iterator().next() : declaredNonTerminals.get(0);
		}
		return builder.toGrammar(startName);
	}
}
