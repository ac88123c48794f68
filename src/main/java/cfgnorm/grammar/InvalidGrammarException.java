package cfgnorm.grammar;

import cfgnorm.CFGException;

/**
 * Thrown if a grammar violates one of its structural invariants, e.g. uses a symbol
 * that is neither a declared terminal nor a declared non terminal.
 */
public class InvalidGrammarException extends CFGException {

	public InvalidGrammarException(String message) {
		super(message);
	}
}
