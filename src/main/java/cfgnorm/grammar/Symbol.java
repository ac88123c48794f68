package cfgnorm.grammar;

import java.io.Serializable;
import java.util.Objects;

/**
 * Base class for terminal symbols and non terminal symbols.
 *
 * Two symbols are equal if they are of the same kind and have the same name.
 */
public abstract class Symbol implements Serializable, Comparable<Symbol> {

	public final String name;

	protected Symbol(String name) {
		this.name = Objects.requireNonNull(name);
	}

	public boolean isTerminal(){
		return this instanceof Terminal;
	}

	@Override
	public int hashCode() {
		return name.hashCode() * 31 + getClass().hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && obj.getClass() == this.getClass() && ((Symbol)obj).name.equals(name);
	}

	@Override
	public String toString() {
		return name;
	}

	/**
	 * Non terminals come before terminals, symbols of the same kind are ordered by name.
	 */
	@Override
	public int compareTo(Symbol o) {
		if (isTerminal() != o.isTerminal()){
			return isTerminal() ? 1 : -1;
		}
		return name.compareTo(o.name);
	}
}
