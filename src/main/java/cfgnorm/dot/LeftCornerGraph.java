package cfgnorm.dot;

import java.io.File;
import java.io.IOException;
import java.util.*;

import guru.nidi.graphviz.attribute.*;
import guru.nidi.graphviz.engine.*;
import guru.nidi.graphviz.model.*;

import cfgnorm.grammar.Grammar;
import cfgnorm.grammar.NonTerminal;
import cfgnorm.transform.LeftRecursionElimination;

import static guru.nidi.graphviz.attribute.Attributes.attr;
import static guru.nidi.graphviz.model.Factory.*;

/**
 * Graphviz graph of the left corner relation of a grammar: there is an edge from A to B if a right hand side
 * of A starts with B. Left recursive non terminals lie on cycles and are colored red, the start
 * non terminal is drawn with a double border.
 */
public class LeftCornerGraph {

	private LeftCornerGraph() {
	}

	public static Graph createDotGraph(Grammar grammar, String name){
		Map<NonTerminal, Set<NonTerminal>> corners = LeftRecursionElimination.calculateLeftCorners(grammar);
		Set<NonTerminal> leftRecursive = LeftRecursionElimination.findLeftRecursive(grammar);
		Map<NonTerminal, MutableNode> nodes = new LinkedHashMap<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			MutableNode node = mutNode(nonTerminal.name);
			if (leftRecursive.contains(nonTerminal)){
				node.add(Color.RED, Color.RED.font());
			}
			if (nonTerminal.equals(grammar.getStart())){
				node.add(Shape.DOUBLE_CIRCLE);
			}
			node.add(attr("fontname", "Helvetica"));
			nodes.put(nonTerminal, node);
		}
		for (Map.Entry<NonTerminal, Set<NonTerminal>> entry : corners.entrySet()){
			MutableNode node = nodes.get(entry.getKey());
			for (NonTerminal corner : entry.getValue()){
				node.addLink(nodes.get(corner));
			}
		}
		return graph(name).directed().with(nodes.values().toArray(new MutableNode[0]));
	}

	/**
	 * Renders the left corner graph of the passed grammar into the passed file
	 *
	 * @throws IOException if the file can't be written
	 */
	public static void render(Grammar grammar, String name, Format format, File file) throws IOException {
		Graphviz.fromGraph(createDotGraph(grammar, name)).engine(Engine.DOT).render(format).toFile(file);
	}
}
