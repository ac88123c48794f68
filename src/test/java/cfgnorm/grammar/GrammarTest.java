package cfgnorm.grammar;

import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import cfgnorm.CFGException;
import cfgnorm.examples.Examples;

import static cfgnorm.SampleGrammars.names;
import static cfgnorm.util.Utils.makeArrayList;
import static cfgnorm.util.Utils.makeLinkedHashSet;
import static org.junit.jupiter.api.Assertions.*;

public class GrammarTest {

	private final NonTerminal s = new NonTerminal("S");
	private final NonTerminal a = new NonTerminal("A");
	private final Terminal x = new Terminal("x");

	@Test
	public void testStartMustBeANonTerminal(){
		assertThrows(InvalidGrammarException.class, () ->
				new Grammar(makeLinkedHashSet(x), makeArrayList(s), a, Collections.emptyList()));
	}

	@Test
	public void testUndeclaredLeftHandSide(){
		List<Production> productions = makeArrayList(new Production(a, makeArrayList(x)));
		assertThrows(InvalidGrammarException.class, () ->
				new Grammar(makeLinkedHashSet(x), makeArrayList(s), s, productions));
	}

	@Test
	public void testUndeclaredRightHandSideSymbols(){
		List<Production> withNonTerminal = makeArrayList(new Production(s, makeArrayList(a)));
		assertThrows(InvalidGrammarException.class, () ->
				new Grammar(makeLinkedHashSet(x), makeArrayList(s), s, withNonTerminal));
		List<Production> withTerminal = makeArrayList(new Production(s, makeArrayList(new Terminal("y"))));
		assertThrows(InvalidGrammarException.class, () ->
				new Grammar(makeLinkedHashSet(x), makeArrayList(s), s, withTerminal));
	}

	@Test
	public void testCalculateNullableIsCached(){
		Grammar g = Examples.expressionGrammar();
		assertEquals(makeArrayList("E"), names(g.calculateNullable()));
		assertSame(g.calculateNullable(), g.calculateNullable());
		assertThrows(UnsupportedOperationException.class, () -> g.calculateNullable().add(s));
	}

	@Test
	public void testDuplicateNonTerminalsAreMerged(){
		Grammar g = new Grammar(makeLinkedHashSet(x), makeArrayList(s, a, s), s,
				makeArrayList(new Production(s, makeArrayList(a)), new Production(a, makeArrayList(x))));
		assertEquals(makeArrayList(s, a), g.getNonTerminals());
	}

	@Test
	public void testImmutable(){
		Grammar g = Examples.expressionGrammar();
		assertThrows(UnsupportedOperationException.class, () -> g.getNonTerminals().add(new NonTerminal("X")));
		assertThrows(UnsupportedOperationException.class, () -> g.getProductions().clear());
		assertThrows(UnsupportedOperationException.class, () -> g.getProductionsOfNonTerminal(g.getStart()).clear());
		assertThrows(UnsupportedOperationException.class, () -> g.getProductions().get(0).right.clear());
	}

	@Test
	public void testOccursOnRightSide(){
		Grammar g = Examples.expressionGrammar();
		assertTrue(g.occursOnRightSide(new NonTerminal("E")));
		assertTrue(g.occursOnRightSide(new Terminal("id")));
		assertFalse(g.occursOnRightSide(new Terminal("E")));
	}

	@Test
	public void testGetNonTerminal(){
		Grammar g = Examples.expressionGrammar();
		assertEquals(new NonTerminal("T"), g.getNonTerminal("T"));
		assertThrows(CFGException.class, () -> g.getNonTerminal("id"));
		assertThrows(CFGException.class, () -> g.getProductionsOfNonTerminal(new NonTerminal("X")));
	}

	@Test
	public void testLongDescription(){
		String description = Examples.expressionGrammar().longDescription();
		assertTrue(description.startsWith("Start non terminal: E\n"));
		assertTrue(description.contains("NonTerminals: [E, T, F]"));
		assertTrue(description.contains("E → E + T\nE → T\nE → ε\nT → T * F"));
	}

	@Test
	public void testEquality(){
		assertEquals(Examples.expressionGrammar(), Examples.expressionGrammar());
		assertNotEquals(Examples.expressionGrammar(), Examples.indirectLeftRecursion());
	}
}
