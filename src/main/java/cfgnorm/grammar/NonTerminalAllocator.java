package cfgnorm.grammar;

import java.util.HashSet;
import java.util.Set;

import cfgnorm.Config;

/**
 * Creates fresh non terminals whose names don't clash with any symbol used so far.
 *
 * Assumes that every name that the allocator hands out is added to the grammar under construction.
 */
public class NonTerminalAllocator {

	private final Set<String> usedNames;
	private final String primeMarker;

	public NonTerminalAllocator(Set<String> usedNames, String primeMarker) {
		if (primeMarker.isEmpty()){
			throw new IllegalArgumentException("Empty prime marker");
		}
		this.usedNames = new HashSet<>(usedNames);
		this.primeMarker = primeMarker;
	}

	/**
	 * Allocator for the symbols of the passed grammar that uses the configured prime marker
	 */
	public NonTerminalAllocator(Grammar grammar) {
		this(grammar.getSymbolNames(), Config.primeMarker());
	}

	/**
	 * Creates a new non terminal. It's name is the passed non terminals name followed by
	 * one or more prime markers.
	 *
	 * @param nonTerminal base non terminal
	 * @return new non terminal
	 */
	public NonTerminal prime(NonTerminal nonTerminal){
		String name = nonTerminal.name + primeMarker;
		while (usedNames.contains(name)){
			name += primeMarker;
		}
		usedNames.add(name);
		return new NonTerminal(name);
	}

	public boolean isUsed(String name){
		return usedNames.contains(name);
	}
}
