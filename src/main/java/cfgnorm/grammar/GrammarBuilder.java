package cfgnorm.grammar;

import java.util.*;

/**
 * Allows the simple creation of grammars.
 *
 * Symbols are referred to by their names. Every left hand side of a production and every explicitly
 * declared non terminal is a non terminal, terminals have to be declared via {@link #terminals(String...)}.
 * The non terminal order of the resulting grammar is: declared non terminals first, then the left hand sides
 * in the order of their first production.
 *
 * <pre>
 *     new GrammarBuilder().terminals("+", "id")
 *         .add("E", "E", "+", "E")
 *         .add("E", "id")
 *         .add("E")              // E → ε
 *         .toGrammar("E");
 * </pre>
 */
public class GrammarBuilder {

	private final Set<String> usedNonTerminals = new LinkedHashSet<>();
	private final Set<String> usedTerminals = new LinkedHashSet<>();
	private final List<String[]> productions = new ArrayList<>();

	/**
	 * Declares terminals
	 */
	public GrammarBuilder terminals(String... names){
		for (String name : names){
			checkName(name);
			usedTerminals.add(name);
		}
		return this;
	}

	/**
	 * Declares non terminals, possibly without any production
	 */
	public GrammarBuilder nonTerminals(String... names){
		for (String name : names){
			checkName(name);
			usedNonTerminals.add(name);
		}
		return this;
	}

	/**
	 * Adds a new production.
	 *
	 * The entries of the right hand side are
	 *  - strings: names of terminals or non terminals
	 *  - characters: names of terminals or non terminals with a single character
	 *  - arrays of these: flattened
	 *  - "": equivalent to ε
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right right hand side of the production, no entries for an epsilon production
	 */
	public GrammarBuilder add(String left, Object... right){
		checkName(left);
		usedNonTerminals.add(left);
		List<String> prod = new ArrayList<>();
		prod.add(left);
		for (Object obj : flatten(right)){
			String str = obj.toString();
			if (!str.isEmpty()){
				prod.add(str);
			}
		}
		productions.add(prod.toArray(new String[0]));
		return this;
	}

	private List<Object> flatten(Object[] arr){
		List<Object> ret = new ArrayList<>();
		for (Object sub : arr){
			if (sub instanceof String || sub instanceof Character){
				ret.add(sub);
			} else if (sub instanceof Object[]){
				ret.addAll(flatten((Object[])sub));
			} else {
				throw new InvalidGrammarException("Right part of production object list has unsupported type: " + sub);
			}
		}
		return ret;
	}

	private void checkName(String name){
		if (name == null || name.isEmpty() || !name.trim().equals(name)){
			throw new InvalidGrammarException(String.format("Invalid symbol name '%s'", name));
		}
	}

	/**
	 * Creates the grammar
	 *
	 * @param startNonTerminal name of the start non terminal
	 * @throws InvalidGrammarException if the start isn't a non terminal, a name is used both as a terminal and
	 * a non terminal, or a used name is neither
	 */
	public Grammar toGrammar(String startNonTerminal) {
		for (String name : usedNonTerminals){
			if (usedTerminals.contains(name)){
				throw new InvalidGrammarException(String.format("Ambiguity while building the grammar: '%s' is the name of a terminal and therefore " +
						"can't be used as a non terminal name", name));
			}
		}
		if (!usedNonTerminals.contains(startNonTerminal)){
			throw new InvalidGrammarException(String.format("Start non terminal '%s' isn't a non terminal", startNonTerminal));
		}
		List<NonTerminal> nonTerminals = new ArrayList<>();
		for (String name : usedNonTerminals){
			nonTerminals.add(new NonTerminal(name));
		}
		Set<Terminal> terminals = new LinkedHashSet<>();
		for (String name : usedTerminals){
			terminals.add(new Terminal(name));
		}
		List<Production> prods = new ArrayList<>();
		for (String[] prod : productions){
			List<Symbol> right = new ArrayList<>();
			for (int i = 1; i < prod.length; i++){
				right.add(toSymbol(prod[i], prod[0]));
			}
			prods.add(new Production(new NonTerminal(prod[0]), right));
		}
		return new Grammar(terminals, nonTerminals, new NonTerminal(startNonTerminal), prods);
	}

	private Symbol toSymbol(String name, String left){
		if (usedNonTerminals.contains(name)){
			return new NonTerminal(name);
		}
		if (usedTerminals.contains(name)){
			return new Terminal(name);
		}
		throw new InvalidGrammarException(String.format("Symbol '%s' in a production of %s is neither a terminal nor a non terminal",
				name, left));
	}
}
