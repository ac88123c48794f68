package cfgnorm.transform;

import java.util.*;
import java.util.logging.Logger;

import cfgnorm.grammar.Grammar;
import cfgnorm.grammar.NonTerminal;
import cfgnorm.grammar.NonTerminalAllocator;
import cfgnorm.grammar.Production;
import cfgnorm.grammar.Symbol;

import static cfgnorm.util.Utils.concat;
import static cfgnorm.util.Utils.makeArrayList;

/**
 * Removes direct and indirect left recursion.
 *
 * The non terminals A<sub>1</sub> … A<sub>n</sub> are processed in the order of the grammar. For every
 * A<sub>i</sub>, the right hand sides starting with an earlier A<sub>j</sub> are expanded with the already
 * rewritten productions of A<sub>j</sub>, then the direct left recursion
 * <pre>A → A α<sub>1</sub> | … | A α<sub>m</sub> | β<sub>1</sub> | … | β<sub>k</sub></pre>
 * is replaced by
 * <pre>
 *  A  → β<sub>1</sub> A' | … | β<sub>k</sub> A'
 *  A' → α<sub>1</sub> A' | … | α<sub>m</sub> A' | ε
 * </pre>
 * The input should be free of epsilon productions (apart from <code>S → ε</code>), see {@link EpsilonElimination}.
 */
public class LeftRecursionElimination {

	private static final Logger LOG = Logger.getLogger(LeftRecursionElimination.class.getName());

	private LeftRecursionElimination() {
	}

	/**
	 * Creates a grammar without left recursion. The new non terminals are appended to the non terminal list
	 * in the order of their creation, the terminals and the start non terminal are kept.
	 */
	public static Grammar eliminateLeftRecursion(Grammar grammar){
		NonTerminalAllocator allocator = new NonTerminalAllocator(grammar);
		List<NonTerminal> order = grammar.getNonTerminals();
		List<NonTerminal> nonTerminals = new ArrayList<>(order);
		Map<NonTerminal, List<List<Symbol>>> rewritten = new HashMap<>();
		for (int i = 0; i < order.size(); i++){
			NonTerminal nonTerminal = order.get(i);
			List<List<Symbol>> current = new ArrayList<>();
			for (Production production : grammar.getProductionsOfNonTerminal(nonTerminal)){
				current.add(production.right);
			}
			for (int j = 0; j < i; j++){
				current = substituteLeading(current, order.get(j), rewritten.get(order.get(j)));
			}
			List<List<Symbol>> alphas = new ArrayList<>();
			List<List<Symbol>> betas = new ArrayList<>();
			for (List<Symbol> right : current){
				if (!right.isEmpty() && right.get(0).equals(nonTerminal)){
					alphas.add(right.subList(1, right.size()));
				} else {
					betas.add(right);
				}
			}
			if (alphas.isEmpty()){
				rewritten.put(nonTerminal, current);
				continue;
			}
			NonTerminal primed = allocator.prime(nonTerminal);
			nonTerminals.add(primed);
			List<List<Symbol>> newRights = new ArrayList<>();
			for (List<Symbol> beta : betas){
				newRights.add(concat(beta, makeArrayList(primed)));
			}
			List<List<Symbol>> primedRights = new ArrayList<>();
			for (List<Symbol> alpha : alphas){
				primedRights.add(concat(alpha, makeArrayList(primed)));
			}
			primedRights.add(Collections.emptyList());
			rewritten.put(nonTerminal, newRights);
			rewritten.put(primed, primedRights);
			LOG.fine(() -> String.format("Removed left recursion of %s via %s", nonTerminal, primed));
		}
		List<Production> productions = new ArrayList<>();
		for (NonTerminal nonTerminal : nonTerminals){
			for (List<Symbol> right : rewritten.get(nonTerminal)){
				productions.add(new Production(nonTerminal, right));
			}
		}
		return new Grammar(grammar.getTerminals(), nonTerminals, grammar.getStart(), productions);
	}

	/**
	 * Replaces every right hand side <code>B γ</code> with <code>δ γ</code> for every passed replacement
	 * <code>δ</code> of <code>B</code>, keeping the order.
	 */
	private static List<List<Symbol>> substituteLeading(List<List<Symbol>> rights, NonTerminal leading,
	                                                    List<List<Symbol>> replacements){
		List<List<Symbol>> ret = new ArrayList<>();
		for (List<Symbol> right : rights){
			if (!right.isEmpty() && right.get(0).equals(leading)){
				for (List<Symbol> replacement : replacements){
					ret.add(concat(replacement, right.subList(1, right.size())));
				}
			} else {
				ret.add(right);
			}
		}
		return ret;
	}

	/**
	 * For each non terminal the non terminals that some of its right hand sides start with.
	 */
	public static Map<NonTerminal, Set<NonTerminal>> calculateLeftCorners(Grammar grammar){
		Map<NonTerminal, Set<NonTerminal>> ret = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			Set<NonTerminal> corners = new LinkedHashSet<>();
			for (Production production : grammar.getProductionsOfNonTerminal(nonTerminal)){
				if (!production.right.isEmpty() && production.right.get(0) instanceof NonTerminal){
					corners.add((NonTerminal)production.right.get(0));
				}
			}
			ret.put(nonTerminal, corners);
		}
		return ret;
	}

	/**
	 * Non terminals that can derive a sentential form starting with themselves by repeatedly expanding
	 * the first symbol, i.e. that are directly or indirectly left recursive.
	 */
	public static Set<NonTerminal> findLeftRecursive(Grammar grammar){
		Map<NonTerminal, Set<NonTerminal>> corners = calculateLeftCorners(grammar);
		Set<NonTerminal> ret = new LinkedHashSet<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			Set<NonTerminal> visited = new HashSet<>();
			Deque<NonTerminal> depthFirstStack = new ArrayDeque<>(corners.get(nonTerminal));
			while (!depthFirstStack.isEmpty()){
				NonTerminal current = depthFirstStack.pop();
				if (current.equals(nonTerminal)){
					ret.add(nonTerminal);
					break;
				}
				if (visited.add(current)){
					depthFirstStack.addAll(corners.get(current));
				}
			}
		}
		return ret;
	}
}
