package cfgnorm.grammar;

/**
 * An error in the textual grammar description read by the {@link GrammarReader}.
 */
public class GrammarSyntaxException extends InvalidGrammarException {

	/**
	 * 1-based line of the offending rule
	 */
	public final int line;

	public GrammarSyntaxException(int line, String message) {
		super(String.format("Error at line %d: %s", line, message));
		this.line = line;
	}
}
