package cfgnorm.grammar;

/**
 * A non terminal symbol.
 *
 * The productions of a non terminal are owned by the {@link Grammar}, so that the same
 * non terminal can appear in several (immutable) grammars.
 */
public class NonTerminal extends Symbol {

	/**
	 * @param name name of the non terminal, typically uppercase
	 */
	public NonTerminal(String name) {
		super(name);
	}
}
