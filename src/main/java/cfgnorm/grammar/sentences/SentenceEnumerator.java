package cfgnorm.grammar.sentences;

import java.util.*;
import java.util.stream.Collectors;

import cfgnorm.grammar.Grammar;
import cfgnorm.grammar.NonTerminal;
import cfgnorm.grammar.Production;
import cfgnorm.grammar.Symbol;
import cfgnorm.grammar.Terminal;

/**
 * Enumerates all sentences up to a given length that a grammar derives.
 *
 * The bounded languages of all non terminals are computed as a fixed point: starting with empty languages,
 * every production adds the concatenations of the languages of its right hand side symbols (dropping words
 * longer than the bound) until nothing changes. This terminates for every grammar, including left recursive
 * ones and ones with cycles of epsilon productions.
 */
public class SentenceEnumerator {

	/**
	 * Orders sentences by length, then lexicographically by the names of their terminals
	 */
	public static final Comparator<List<Terminal>> SENTENCE_ORDER = (first, second) -> {
		if (first.size() != second.size()){
			return Integer.compare(first.size(), second.size());
		}
		for (int i = 0; i < first.size(); i++){
			int cmp = first.get(i).compareTo(second.get(i));
			if (cmp != 0){
				return cmp;
			}
		}
		return 0;
	};

	private final Grammar grammar;
	public final int maxLength;
	private final Map<NonTerminal, Set<List<Terminal>>> languages = new HashMap<>();

	public SentenceEnumerator(Grammar grammar, int maxLength) {
		if (maxLength < 0){
			throw new IllegalArgumentException("Negative maximum length " + maxLength);
		}
		this.grammar = grammar;
		this.maxLength = maxLength;
		calculateLanguages();
	}

	private void calculateLanguages(){
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			languages.put(nonTerminal, new HashSet<>());
		}
		boolean somethingChanged;
		do {
			somethingChanged = false;
			for (Production production : grammar.getProductions()){
				Set<List<Terminal>> words = concatenate(production.right);
				somethingChanged = languages.get(production.left).addAll(words) || somethingChanged;
			}
		} while (somethingChanged);
	}

	private Set<List<Terminal>> concatenate(List<Symbol> right){
		Set<List<Terminal>> partial = new HashSet<>();
		partial.add(Collections.emptyList());
		for (Symbol symbol : right){
			Set<List<Terminal>> symbolWords;
			if (symbol instanceof Terminal){
				symbolWords = Collections.singleton(Collections.singletonList((Terminal)symbol));
			} else {
				symbolWords = languages.get(symbol);
			}
			Set<List<Terminal>> next = new HashSet<>();
			for (List<Terminal> prefix : partial){
				for (List<Terminal> word : symbolWords){
					if (prefix.size() + word.size() <= maxLength){
						List<Terminal> combined = new ArrayList<>(prefix);
						combined.addAll(word);
						next.add(combined);
					}
				}
			}
			if (next.isEmpty()){
				return next;
			}
			partial = next;
		}
		return partial;
	}

	/**
	 * Sentences of the start non terminal
	 */
	public SortedSet<List<Terminal>> sentences(){
		return sentences(grammar.getStart());
	}

	/**
	 * Sentences of the passed non terminal, ordered by {@link #SENTENCE_ORDER}
	 */
	public SortedSet<List<Terminal>> sentences(NonTerminal nonTerminal){
		SortedSet<List<Terminal>> ret = new TreeSet<>(SENTENCE_ORDER);
		ret.addAll(languages.get(nonTerminal));
		return Collections.unmodifiableSortedSet(ret);
	}

	/**
	 * Sentences of the start non terminal, terminals separated by a space
	 */
	public List<String> sentenceStrings(){
		return sentences().stream()
				.map(s -> s.stream().map(Terminal::toString).collect(Collectors.joining(" ")))
				.collect(Collectors.toList());
	}

	/**
	 * Can the passed non terminal derive the empty word?
	 */
	public boolean derivesEpsilon(NonTerminal nonTerminal){
		return languages.get(nonTerminal).contains(Collections.<Terminal>emptyList());
	}

	/**
	 * Can the start non terminal derive the empty word?
	 */
	public boolean derivesEpsilon(){
		return derivesEpsilon(grammar.getStart());
	}

	/**
	 * Do both grammars derive the same sentences of at most the passed length from their start non terminals?
	 */
	public static boolean languagesEqual(Grammar first, Grammar second, int maxLength){
		return languagesEqual(first, second, maxLength, false);
	}

	/**
	 * Do both grammars derive the same sentences of at most the passed length from their start non terminals?
	 *
	 * @param ignoreEmptyWord ignore whether the grammars derive the empty word
	 */
	public static boolean languagesEqual(Grammar first, Grammar second, int maxLength, boolean ignoreEmptyWord){
		SortedSet<List<Terminal>> firstSentences = new TreeSet<>(new SentenceEnumerator(first, maxLength).sentences());
		SortedSet<List<Terminal>> secondSentences = new TreeSet<>(new SentenceEnumerator(second, maxLength).sentences());
		if (ignoreEmptyWord){
			firstSentences.remove(Collections.<Terminal>emptyList());
			secondSentences.remove(Collections.<Terminal>emptyList());
		}
		return firstSentences.equals(secondSentences);
	}
}
