package cfgnorm.transform;

import java.util.Set;

import cfgnorm.grammar.Grammar;
import cfgnorm.grammar.NonTerminal;

/**
 * Entry points of the normalization pipeline. All methods are pure: the passed grammar is never modified.
 */
public class Normalizer {

	private Normalizer() {
	}

	/**
	 * @see NullableAnalysis#nullable(Grammar)
	 */
	public static Set<NonTerminal> nullable(Grammar grammar){
		return NullableAnalysis.nullable(grammar);
	}

	/**
	 * @see EpsilonElimination#removeEpsilonRules(Grammar)
	 */
	public static Grammar removeEpsilonRules(Grammar grammar){
		return EpsilonElimination.removeEpsilonRules(grammar);
	}

	/**
	 * @see LeftRecursionElimination#eliminateLeftRecursion(Grammar)
	 */
	public static Grammar eliminateLeftRecursion(Grammar grammar){
		return LeftRecursionElimination.eliminateLeftRecursion(grammar);
	}

	/**
	 * Removes the epsilon productions and then the left recursion.
	 */
	public static Grammar normalize(Grammar grammar){
		return eliminateLeftRecursion(removeEpsilonRules(grammar));
	}
}
