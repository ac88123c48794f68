package cfgnorm.grammar;

/**
 * A terminal symbol
 */
public class Terminal extends Symbol {

	public Terminal(String name) {
		super(name);
	}
}
