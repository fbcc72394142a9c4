// KebnfToolkit - Convert KEBNF language specifications to ANTLR4 grammars
// Copyright (C) 2013,2017,2026 David H. Hovemeyer <david.hovemeyer@gmail.com>
//
// Permission is hereby granted, free of charge, to any person obtaining
// a copy of this software and associated documentation files (the
// "Software"), to deal in the Software without restriction, including
// without limitation the rights to use, copy, modify, merge, publish,
// distribute, sublicense, and/or sell copies of the Software, and to
// permit persons to whom the Software is furnished to do so, subject to
// the following conditions:
// 
// The above copyright notice and this permission notice shall be included
// in all copies or substantial portions of the Software.
// 
// THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
// EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF
// MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT.
// IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY
// CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT,
// TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE
// SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.

package io.github.daveho.kebnftk;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Find short cycles in a rule reference graph.
 * The graph can be built from the text of a generated parser grammar,
 * or supplied directly (see {@link FindLeftRecursion}).
 */
public class FindCycles {
	/** Maximum number of rules in a reported cycle. */
	public static final int MAX_CYCLE_LENGTH = 7;

	/** Maximum number of cycles printed by {@link #report(PrintStream)}. */
	public static final int MAX_REPORTED_CYCLES = 30;

	private static final Pattern RULE_HEADER = Pattern.compile("^([a-zA-Z]\\w+)$");
	private static final Pattern ONE_LINE_RULE = Pattern.compile("^([a-zA-Z]\\w+)\\s*:(.*);$");
	private static final Pattern REFERENCE = Pattern.compile("\\b([a-z][a-zA-Z]+)\\b");
	private static final Pattern COMMENT = Pattern.compile("/\\*.*?\\*/|//.*$");
	private static final Pattern QUOTED = Pattern.compile("'(\\\\.|[^'\\\\])*'");

	/** Identifiers in rule bodies which are not rule references. */
	static final Set<String> NON_REFERENCES = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
			"assoc", "right", "left", "empty")));

	private SortedMap<String, SortedSet<String>> graph;

	/**
	 * Constructor.
	 * 
	 * @param graph map of rule names to the names of the rules they refer to
	 */
	public FindCycles(Map<String, ? extends Set<String>> graph) {
		this.graph = new TreeMap<String, SortedSet<String>>();
		for (Map.Entry<String, ? extends Set<String>> entry : graph.entrySet())
			this.graph.put(entry.getKey(), new TreeSet<String>(entry.getValue()));
	}

	/**
	 * Build the rule reference graph of a parser grammar.
	 * 
	 * @param grammarText the text of an ANTLR parser grammar in the layout
	 *                    produced by {@link GenerateParserGrammar}
	 * @return the graph
	 */
	public static Map<String, Set<String>> parseGrammar(String grammarText) {
		Map<String, Set<String>> graph = new LinkedHashMap<String, Set<String>>();
		String current = null;
		for (String line : grammarText.split("\n")) {
			String stripped = strip(line);
			Matcher oneLine = ONE_LINE_RULE.matcher(stripped);
			if (oneLine.matches()) {
				Set<String> refs = new HashSet<String>();
				addReferences(oneLine.group(2), oneLine.group(1), refs);
				graph.put(oneLine.group(1), refs);
				current = null;
				continue;
			}
			Matcher header = RULE_HEADER.matcher(stripped);
			if (header.matches()) {
				current = header.group(1);
				graph.put(current, new HashSet<String>());
				continue;
			}
			if (stripped.equals(";")) {
				current = null;
				continue;
			}
			if (current != null)
				addReferences(stripped, current, graph.get(current));
		}
		return graph;
	}

	private static String strip(String line) {
		String s = QUOTED.matcher(line).replaceAll("");
		s = COMMENT.matcher(s).replaceAll("");
		return s.trim();
	}

	private static void addReferences(String text, String ruleName, Set<String> refs) {
		Matcher m = REFERENCE.matcher(text);
		while (m.find()) {
			String ref = m.group(1);
			if (!ref.equals(ruleName) && !NON_REFERENCES.contains(ref))
				refs.add(ref);
		}
	}

	/**
	 * @return the number of rules in the graph
	 */
	public int getRuleCount() {
		return graph.size();
	}

	/**
	 * Find the cycles with at most {@link #MAX_CYCLE_LENGTH} rules.
	 * Cycles with the same set of rules are reported once (the shortest one).
	 * Each cycle is returned as a path which starts and ends with the same rule.
	 * Self-references are not reported.
	 * 
	 * @return the cycles, shortest first
	 */
	public List<List<String>> findCycles() {
		Map<Set<String>, List<String>> unique = new LinkedHashMap<Set<String>, List<String>>();
		for (String start : graph.keySet()) {
			Deque<List<String>> stack = new ArrayDeque<List<String>>();
			stack.push(Collections.singletonList(start));
			while (!stack.isEmpty()) {
				List<String> path = stack.pop();
				String node = path.get(path.size() - 1);
				for (String neighbor : graph.get(node)) {
					if (neighbor.equals(start) && path.size() > 1) {
						List<String> cycle = new ArrayList<String>(path);
						cycle.add(start);
						Set<String> key = new TreeSet<String>(path);
						List<String> prev = unique.get(key);
						if (prev == null || cycle.size() < prev.size())
							unique.put(key, cycle);
					} else if (!path.contains(neighbor) && graph.containsKey(neighbor)
							&& path.size() < MAX_CYCLE_LENGTH) {
						List<String> extended = new ArrayList<String>(path);
						extended.add(neighbor);
						stack.push(extended);
					}
				}
			}
		}
		List<List<String>> result = new ArrayList<List<String>>(unique.values());
		Collections.sort(result, new Comparator<List<String>>() {
			@Override
			public int compare(List<String> a, List<String> b) {
				return Integer.compare(a.size(), b.size());
			}
		});
		return result;
	}

	/**
	 * @return names of the rules which don't refer to any rule
	 */
	public List<String> findLeafRules() {
		List<String> result = new ArrayList<String>();
		for (Map.Entry<String, SortedSet<String>> entry : graph.entrySet()) {
			if (entry.getValue().isEmpty())
				result.add(entry.getKey());
		}
		return result;
	}

	/**
	 * Print a report of the cycles and leaf rules.
	 * 
	 * @param out the PrintStream to print to
	 */
	public void report(PrintStream out) {
		out.println("Total rules: " + graph.size());
		List<List<String>> cycles = findCycles();
		out.println();
		out.println("Found " + cycles.size() + " unique cycles (depth <= " + MAX_CYCLE_LENGTH + "):");
		for (int i = 0; i < cycles.size() && i < MAX_REPORTED_CYCLES; i++) {
			List<String> c = cycles.get(i);
			out.println("  len=" + (c.size() - 1) + ": " + String.join(" -> ", c));
		}
		out.println();
		out.println("Leaf rules (no dependencies):");
		for (String name : findLeafRules())
			out.println("  " + name);
	}
}
