package cfgnorm.examples;

import cfgnorm.grammar.Grammar;
import cfgnorm.grammar.GrammarBuilder;

/**
 * Sample grammars
 */
public class Examples {

	private Examples() {
	}

	/**
	 * Arithmetic expressions with both epsilon productions and left recursion:
	 * <pre>
	 * E → E + T | T | ε
	 * T → T * F | F
	 * F → ( E ) | id
	 * </pre>
	 */
	public static Grammar expressionGrammar(){
		return new GrammarBuilder().terminals("+", "*", "(", ")", "id")
				.add("E", "E", "+", "T")
				.add("E", "T")
				.add("E")
				.add("T", "T", "*", "F")
				.add("T", "F")
				.add("F", "(", "E", ")")
				.add("F", "id")
				.toGrammar("E");
	}

	/**
	 * Indirect left recursion over two non terminals:
	 * <pre>
	 * S → A a | b
	 * A → A c | S d | ε
	 * </pre>
	 */
	public static Grammar indirectLeftRecursion(){
		return new GrammarBuilder().terminals("a", "b", "c", "d")
				.add("S", "A", "a")
				.add("S", "b")
				.add("A", "A", "c")
				.add("A", "S", "d")
				.add("A")
				.toGrammar("S");
	}
}
