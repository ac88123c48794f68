package cfgnorm.transform;

import java.util.*;
import java.util.logging.Logger;

import cfgnorm.CFGException;
import cfgnorm.grammar.Grammar;
import cfgnorm.grammar.NonTerminal;
import cfgnorm.grammar.Production;
import cfgnorm.grammar.Symbol;

/**
 * Removes the epsilon productions of a grammar without changing its language.
 *
 * Every production is replaced by all the variants that omit some of its nullable symbols. Only the start
 * non terminal may keep an epsilon production and only if it doesn't occur on any right hand side.
 */
public class EpsilonElimination {

	private static final Logger LOG = Logger.getLogger(EpsilonElimination.class.getName());

	/**
	 * Maximum number of nullable symbols in a single right hand side, each one doubles the number of variants
	 */
	public static final int MAX_NULLABLE_POSITIONS = 24;

	private EpsilonElimination() {
	}

	/**
	 * Creates an equivalent grammar without epsilon productions, except possibly <code>S → ε</code>
	 * for the start non terminal <code>S</code> if <code>S</code> is nullable and doesn't appear on any right
	 * hand side.
	 *
	 * The productions of each non terminal are ordered by their first appearance: right hand sides in their
	 * original order, the variants of each right hand side by ascending bit mask of omitted positions.
	 */
	public static Grammar removeEpsilonRules(Grammar grammar){
		Set<NonTerminal> nullable = grammar.calculateNullable();
		NonTerminal start = grammar.getStart();
		Map<NonTerminal, List<List<Symbol>>> rightSides = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			Set<List<Symbol>> variants = new LinkedHashSet<>();
			for (Production production : grammar.getProductionsOfNonTerminal(nonTerminal)){
				for (List<Symbol> variant : variants(production.right, nullable)){
					if (!variant.isEmpty() || nonTerminal.equals(start)){
						variants.add(variant);
					}
				}
			}
			rightSides.put(nonTerminal, new ArrayList<>(variants));
		}
		List<Symbol> epsilon = Collections.emptyList();
		List<List<Symbol>> startRightSides = rightSides.get(start);
		if (occursOnRightSide(rightSides, start)){
			startRightSides.remove(epsilon);
		} else if (nullable.contains(start) && !startRightSides.contains(epsilon)){
			startRightSides.add(epsilon);
		}
		List<Production> productions = new ArrayList<>();
		for (Map.Entry<NonTerminal, List<List<Symbol>>> entry : rightSides.entrySet()){
			for (List<Symbol> right : entry.getValue()){
				productions.add(new Production(entry.getKey(), right));
			}
		}
		LOG.fine(() -> String.format("Removed epsilon productions: nullable %s, %d → %d productions",
				nullable, grammar.getProductions().size(), productions.size()));
		return new Grammar(grammar.getTerminals(), grammar.getNonTerminals(), start, productions);
	}

	/**
	 * All right hand sides that result from omitting any subset of the nullable positions of the passed one.
	 *
	 * The i-th bit of the mask selects the i-th nullable position, mask 0 yields the unchanged right hand side.
	 */
	static List<List<Symbol>> variants(List<Symbol> right, Set<NonTerminal> nullable){
		List<Integer> positions = new ArrayList<>();
		for (int i = 0; i < right.size(); i++){
			if (nullable.contains(right.get(i))){
				positions.add(i);
			}
		}
		if (positions.size() > MAX_NULLABLE_POSITIONS){
			throw new CFGException(String.format("Right hand side %s has %d nullable symbols, at most %d are supported",
					right, positions.size(), MAX_NULLABLE_POSITIONS));
		}
		List<List<Symbol>> ret = new ArrayList<>();
		for (int mask = 0; mask < (1 << positions.size()); mask++){
			boolean[] omitted = new boolean[right.size()];
			for (int j = 0; j < positions.size(); j++){
				if (((mask >> j) & 1) == 1){
					omitted[positions.get(j)] = true;
				}
			}
			List<Symbol> variant = new ArrayList<>();
			for (int i = 0; i < right.size(); i++){
				if (!omitted[i]){
					variant.add(right.get(i));
				}
			}
			ret.add(variant);
		}
		return ret;
	}

	private static boolean occursOnRightSide(Map<NonTerminal, List<List<Symbol>>> rightSides, NonTerminal nonTerminal){
		for (List<List<Symbol>> sides : rightSides.values()){
			for (List<Symbol> right : sides){
				if (right.contains(nonTerminal)){
					return true;
				}
			}
		}
		return false;
	}
}
