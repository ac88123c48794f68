package cfgnorm.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import cfgnorm.CFGException;

import static cfgnorm.util.Utils.join;

/**
 * Grammar consisting of terminals, an ordered list of non terminals, productions and a start non terminal.
 *
 * Instances are immutable, transformations create new grammars. Use the {@link GrammarBuilder} or the
 * {@link GrammarReader} to build a grammar from names.
 *
 * The order of the non terminals matters: the left recursion elimination processes them in this order.
 */
public class Grammar implements Serializable {

	/**
	 * Non terminals in the grammar, without duplicates
	 */
	private final List<NonTerminal> nonTerminals;

	private final Set<Terminal> terminals;

	/**
	 * Productions per non terminal, in the order of {@link #nonTerminals}. Non terminals without
	 * productions map to an empty list.
	 */
	private final Map<NonTerminal, List<Production>> productions;

	private final NonTerminal start;

	private transient Set<NonTerminal> nullable = null;

	/**
	 * Create a new Grammar object
	 *
	 * Removes duplicate productions (the first occurrence is kept).
	 *
	 * @param terminals terminals of the grammar
	 * @param nonTerminals non terminals in processing order
	 * @param start start non terminal
	 * @param productions productions of all non terminals
	 * @throws InvalidGrammarException if the start, a left hand side or a used symbol isn't declared
	 */
	public Grammar(Set<Terminal> terminals, List<NonTerminal> nonTerminals, NonTerminal start,
	               List<Production> productions) {
		this.terminals = Collections.unmodifiableSet(new LinkedHashSet<>(terminals));
		this.nonTerminals = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(nonTerminals)));
		this.start = start;
		if (start == null || !this.nonTerminals.contains(start)){
			throw new InvalidGrammarException(String.format("Start non terminal %s isn't a non terminal of the grammar", start));
		}
		Map<NonTerminal, List<Production>> prods = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : this.nonTerminals) {
			prods.put(nonTerminal, new ArrayList<>());
		}
		for (Production production : productions) {
			if (!prods.containsKey(production.left)){
				throw new InvalidGrammarException(String.format("Production %s has an undeclared left hand side", production));
			}
			for (Symbol symbol : production.right) {
				if (!contains(symbol)){
					throw new InvalidGrammarException(String.format("Production %s uses the undeclared symbol %s", production, symbol));
				}
			}
			List<Production> list = prods.get(production.left);
			if (!list.contains(production)){
				list.add(production);
			}
		}
		for (Map.Entry<NonTerminal, List<Production>> entry : prods.entrySet()) {
			entry.setValue(Collections.unmodifiableList(entry.getValue()));
		}
		this.productions = Collections.unmodifiableMap(prods);
	}

	/**
	 * Calculate the non terminals that can produce an epsilon.
	 *
	 * A non terminal is nullable if it has an epsilon production or a production whose right hand side consists
	 * only of nullable non terminals. Iterates over all productions until nothing changes. The result is
	 * cached.
	 *
	 * @return nullable non terminals in the order they were found
	 */
	public Set<NonTerminal> calculateNullable(){
		if (nullable != null){
			return nullable;
		}
		Set<NonTerminal> epsSet = new LinkedHashSet<>();
		List<Production> prods = getProductions();
		boolean somethingChanged;
		do {
			somethingChanged = false;
			for (Production prod : prods) {
				if (epsSet.contains(prod.left) || !prod.terminals.isEmpty()){
					continue;
				}
				if (epsSet.containsAll(prod.right)){
					epsSet.add(prod.left);
					somethingChanged = true;
				}
			}
		} while (somethingChanged);
		nullable = Collections.unmodifiableSet(epsSet);
		return nullable;
	}

	/**
	 * Is the passed symbol a terminal or non terminal of this grammar?
	 */
	public boolean contains(Symbol symbol){
		if (symbol instanceof NonTerminal){
			return nonTerminals.contains(symbol);
		}
		return terminals.contains(symbol);
	}

	public NonTerminal getStart(){
		return start;
	}

	public List<NonTerminal> getNonTerminals() {
		return nonTerminals;
	}

	public Set<Terminal> getTerminals() {
		return terminals;
	}

	/**
	 * All productions, grouped by their left hand side in the order of the non terminals.
	 */
	public List<Production> getProductions(){
		List<Production> ret = new ArrayList<>();
		for (List<Production> prods : productions.values()) {
			ret.addAll(prods);
		}
		return Collections.unmodifiableList(ret);
	}

	/**
	 * Productions with the passed non terminal on their left hand side, might be empty.
	 */
	public List<Production> getProductionsOfNonTerminal(NonTerminal nonTerminal) {
		List<Production> prods = productions.get(nonTerminal);
		if (prods == null){
			throw new CFGException("No such non terminal " + nonTerminal);
		}
		return prods;
	}

	public boolean hasNonTerminal(String name){
		return nonTerminals.contains(new NonTerminal(name));
	}

	public NonTerminal getNonTerminal(String name){
		if (!hasNonTerminal(name)){
			throw new CFGException("No such non terminal " + name);
		}
		return new NonTerminal(name);
	}

	/**
	 * Names of all terminals and non terminals
	 */
	public Set<String> getSymbolNames(){
		Set<String> names = new HashSet<>();
		for (NonTerminal nonTerminal : nonTerminals) {
			names.add(nonTerminal.name);
		}
		for (Terminal terminal : terminals) {
			names.add(terminal.name);
		}
		return names;
	}

	/**
	 * Does the passed symbol occur on the right hand side of any production?
	 */
	public boolean occursOnRightSide(Symbol symbol){
		for (List<Production> prods : productions.values()) {
			for (Production production : prods) {
				if (production.right.contains(symbol)){
					return true;
				}
			}
		}
		return false;
	}

	public String longDescription(){
		return "Start non terminal: " + start + "\n" +
				"NonTerminals: " + nonTerminals + "\n" +
				"Terminals: " + terminals + "\n" +
				"Productions: \n" + join(getProductions(), "\n");
	}

	@Override
	public String toString() {
		return longDescription();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Grammar)){
			return false;
		}
		Grammar other = (Grammar)obj;
		return start.equals(other.start) && nonTerminals.equals(other.nonTerminals)
				&& terminals.equals(other.terminals) && productions.equals(other.productions);
	}

	@Override
	public int hashCode() {
		return nonTerminals.hashCode() ^ productions.hashCode();
	}
}
