package cfgnorm.transform;

import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import cfgnorm.examples.Examples;
import cfgnorm.grammar.Grammar;
import cfgnorm.grammar.NonTerminal;
import cfgnorm.grammar.Production;
import cfgnorm.grammar.sentences.SentenceEnumerator;

import static cfgnorm.SampleGrammars.*;
import static cfgnorm.util.Utils.makeArrayList;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties that have to hold for every (cycle free) grammar
 */
public class NormalizerTest {

	private static final int MAX_LENGTH = 5;

	@ParameterizedTest
	@MethodSource("cfgnorm.SampleGrammars#grammars")
	public void testOnlyStartHasEpsilonProduction(Grammar grammar){
		Grammar g = Normalizer.removeEpsilonRules(grammar);
		for (Production production : g.getProductions()){
			if (!production.left.equals(g.getStart())){
				assertFalse(production.isEpsilonProduction(), production.toString());
			}
		}
	}

	@ParameterizedTest
	@MethodSource("cfgnorm.SampleGrammars#grammars")
	public void testStartEpsilonRule(Grammar grammar){
		Grammar g = Normalizer.removeEpsilonRules(grammar);
		NonTerminal start = g.getStart();
		boolean expected = Normalizer.nullable(grammar).contains(start) && !g.occursOnRightSide(start);
		long epsilonCount = g.getProductionsOfNonTerminal(start).stream().filter(Production::isEpsilonProduction).count();
		assertEquals(expected ? 1 : 0, epsilonCount);
		assertEquals(expected, new SentenceEnumerator(g, 0).derivesEpsilon());
	}

	@ParameterizedTest
	@MethodSource("cfgnorm.SampleGrammars#grammars")
	public void testEpsilonRemovalKeepsNonEmptySentences(Grammar grammar){
		assertTrue(SentenceEnumerator.languagesEqual(grammar, Normalizer.removeEpsilonRules(grammar), MAX_LENGTH, true));
	}

	@ParameterizedTest
	@MethodSource("cfgnorm.SampleGrammars#grammars")
	public void testEpsilonRemovalIsIdempotent(Grammar grammar){
		Grammar once = Normalizer.removeEpsilonRules(grammar);
		assertEquals(once, Normalizer.removeEpsilonRules(once));
	}

	@ParameterizedTest
	@MethodSource("cfgnorm.SampleGrammars#grammars")
	public void testNoLeftRecursion(Grammar grammar){
		Grammar g = Normalizer.normalize(grammar);
		for (Production production : g.getProductions()){
			assertFalse(production.isLeftRecursive(), production.toString());
		}
		assertEquals(Set.of(), LeftRecursionElimination.findLeftRecursive(g));
	}

	@ParameterizedTest
	@MethodSource("cfgnorm.SampleGrammars#grammars")
	public void testLeftRecursionRemovalKeepsLanguage(Grammar grammar){
		Grammar withoutEpsilon = Normalizer.removeEpsilonRules(grammar);
		assertTrue(SentenceEnumerator.languagesEqual(withoutEpsilon, Normalizer.eliminateLeftRecursion(withoutEpsilon), MAX_LENGTH));
	}

	@ParameterizedTest
	@MethodSource("cfgnorm.SampleGrammars#grammars")
	public void testStartAndTerminalsAreKept(Grammar grammar){
		Grammar g = Normalizer.normalize(grammar);
		assertEquals(grammar.getStart(), g.getStart());
		assertEquals(grammar.getTerminals(), g.getTerminals());
		assertEquals(grammar.getNonTerminals(), g.getNonTerminals().subList(0, grammar.getNonTerminals().size()));
	}

	@Test
	public void testExpressionGrammar(){
		Grammar original = Examples.expressionGrammar();
		assertEquals(makeArrayList("E"), names(Normalizer.nullable(original)));
		Grammar g = Normalizer.normalize(original);
		assertEquals(makeArrayList("E", "T", "F", "E'", "T'"), names(g.getNonTerminals()));
		assertFalse(rights(g, "E").contains("ε"));
		assertEquals(makeArrayList("( E )", "( )", "id"), rights(g, "F"));
		assertEquals(makeArrayList("", "id", "( )", "+ id"),
				new SentenceEnumerator(original, 2).sentenceStrings());
		assertEquals(makeArrayList("id", "( )", "+ id"),
				new SentenceEnumerator(g, 2).sentenceStrings());
	}

	@Test
	public void testDeadNonTerminal(){
		Grammar g = Normalizer.normalize(parse(DEAD_NON_TERMINAL));
		assertTrue(g.getProductionsOfNonTerminal(g.getNonTerminal("D")).isEmpty());
	}
}
