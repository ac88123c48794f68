package cfgnorm.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import cfgnorm.Config;

/**
 * A grammar production with a left and a right hand side.
 *
 * Productions are values: two productions are equal if their left and right hand sides are.
 */
public class Production implements Serializable {

	/**
	 * Left hand side of the production (the associated non terminal)
	 */
	public final NonTerminal left;
	/**
	 * Right hand side of the production, empty for an epsilon production
	 */
	public final List<Symbol> right;

	/**
	 * Terminals used in the right hand side
	 */
	public final List<Terminal> terminals;

	public Production(NonTerminal left, List<? extends Symbol> right) {
		this.left = Objects.requireNonNull(left);
		this.right = Collections.unmodifiableList(new ArrayList<>(right));
		List<Terminal> terminals = new ArrayList<>();
		for (Symbol symbol : this.right) {
			if (symbol instanceof Terminal){
				terminals.add((Terminal) symbol);
			} else if (!(symbol instanceof NonTerminal)){
				throw new InvalidGrammarException("Unsupported symbol in production of " + left + ": " + symbol);
			}
		}
		this.terminals = Collections.unmodifiableList(terminals);
	}

	public String formatRightSide(){
		if (isEpsilonProduction()){
			return Config.epsilonMarker();
		}
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < right.size(); i++) {
			builder.append(right.get(i));
			if (i < right.size() - 1) {
				builder.append(" ");
			}
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return left.toString() + " " + Config.arrow() + " " + formatRightSide();
	}

	/**
	 * Does this production have an empty right hand side?
	 */
	public boolean isEpsilonProduction(){
		return right.isEmpty();
	}

	/**
	 * Is the passed symbol the first symbol of the right hand side?
	 */
	public boolean startsWith(Symbol symbol){
		return !right.isEmpty() && right.get(0).equals(symbol);
	}

	/**
	 * Is this production directly left recursive (A → A …)?
	 */
	public boolean isLeftRecursive(){
		return startsWith(left);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Production && ((Production)obj).left.equals(left) && ((Production)obj).right.equals(right);
	}

	@Override
	public int hashCode() {
		return left.hashCode() ^ right.hashCode();
	}
}
