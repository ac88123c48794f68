package cfgnorm.grammar;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import cfgnorm.examples.Examples;

import static cfgnorm.SampleGrammars.names;
import static cfgnorm.SampleGrammars.parse;
import static cfgnorm.SampleGrammars.rights;
import static cfgnorm.util.Utils.makeArrayList;
import static org.junit.jupiter.api.Assertions.*;

public class GrammarReaderTest {

	@Test
	public void testExpressionGrammar(){
		Grammar g = parse("# arithmetic expressions\n" +
				"start: E\n" +
				"terminals: + * ( ) id\n" +
				"E -> E + T | T | ε\n" +
				"T -> T * F\n" +
				"   | F\n" +
				"\n" +
				"F → ( E ) | id\n");
		assertEquals(Examples.expressionGrammar(), g);
	}

	@Test
	public void testContinuationLines(){
		Grammar g = parse("T -> T x\n   | y\n   | z w");
		assertEquals(makeArrayList("T x", "y", "z w"), rights(g, "T"));
		assertTrue(g.calculateNullable().isEmpty());
	}

	@Test
	public void testContinuationLineWithEpsilon(){
		Grammar g = parse("A -> a\n  |\n  | b");
		assertEquals(makeArrayList("a", "ε", "b"), rights(g, "A"));
	}

	@Test
	public void testInferredTerminalsAndStart(){
		Grammar g = parse("S -> a A | b\nA -> c S |");
		assertEquals("S", g.getStart().name);
		assertEquals(makeArrayList("S", "A"), names(g.getNonTerminals()));
		assertEquals(makeArrayList("a", "b", "c"), names(g.getTerminals()));
		assertEquals(makeArrayList("c S", "ε"), rights(g, "A"));
	}

	@Test
	public void testEpsilonSpellings(){
		Grammar g = parse("S -> eps | a\nS -> ε\nS ->");
		assertEquals(makeArrayList("ε", "a"), rights(g, "S"));
	}

	@Test
	public void testRulesForTheSameNonTerminalAreMerged(){
		Grammar g = parse("S -> a\nT -> b\nS -> T");
		assertEquals(makeArrayList("a", "T"), rights(g, "S"));
		assertEquals(makeArrayList("S", "T"), names(g.getNonTerminals()));
	}

	@Test
	public void testDeclaredNonTerminals(){
		Grammar g = parse("nonterminals: S D\nS -> a | D b");
		assertEquals(makeArrayList("S", "D"), names(g.getNonTerminals()));
		assertEquals(makeArrayList("a", "b"), names(g.getTerminals()));
		assertTrue(rights(g, "D").isEmpty());
	}

	@Test
	public void testStartDirective(){
		assertEquals("T", parse("start: T\nS -> T\nT -> a").getStart().name);
	}

	@ParameterizedTest
	@ValueSource(strings = {"S a", "S", "-> a", "| a", "start: A B\nA -> a", "S -> a\n  what is this"})
	public void testSyntaxErrors(String description){
		assertThrows(GrammarSyntaxException.class, () -> parse(description));
	}

	@Test
	public void testErrorLine(){
		GrammarSyntaxException ex = assertThrows(GrammarSyntaxException.class, () -> parse("S -> a\n\nS = b"));
		assertEquals(3, ex.line);
		assertTrue(ex.getMessage().startsWith("Error at line 3"));
	}

	@Test
	public void testEmptyDescription(){
		assertThrows(GrammarSyntaxException.class, () -> parse("# nothing\n"));
	}

	@Test
	public void testInvalidGrammars(){
		assertThrows(InvalidGrammarException.class, () -> parse("start: X\nS -> a"));
		assertThrows(InvalidGrammarException.class, () -> parse("terminals: a\nS -> a b"));
		assertThrows(InvalidGrammarException.class, () -> parse("terminals: a S\nS -> a"));
	}

	@Test
	public void testReadFile(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("grammar.txt");
		Files.write(file, "S → S a | b\n".getBytes(StandardCharsets.UTF_8));
		Grammar g = GrammarReader.read(file);
		assertEquals(makeArrayList("S a", "b"), rights(g, "S"));
	}
}
