package cfgnorm.transform;

import java.util.Set;

import cfgnorm.grammar.Grammar;
import cfgnorm.grammar.NonTerminal;

/**
 * Calculates the non terminals that can derive the empty word.
 */
public class NullableAnalysis {

	private NullableAnalysis() {
	}

	/**
	 * @see Grammar#calculateNullable()
	 */
	public static Set<NonTerminal> nullable(Grammar grammar){
		return grammar.calculateNullable();
	}
}
