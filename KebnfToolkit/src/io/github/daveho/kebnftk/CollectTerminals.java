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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Collect the keywords and operators used by the parser rules
 * of a {@link RuleTable}. The notation has no lexical section
 * listing them, so they are inferred from the terminals that
 * appear in rule bodies. Lexical rules are not examined:
 * their bodies enumerate characters (e.g., <code>'a'</code>,
 * <code>'0'</code>) which are not keywords.
 */
public class CollectTerminals {
	/**
	 * Classification of a terminal value.
	 */
	public enum TerminalClass {
		/** not a usable keyword or operator */
		FILTERED,
		/** a keyword, e.g., <code>package</code> */
		KEYWORD,
		/** an operator or punctuation symbol, e.g., <code>::</code> */
		OPERATOR,
	}

	/** Rule enumerating reserved keywords, if present. */
	public static final String RESERVED_KEYWORD = "RESERVED_KEYWORD";

	/** Rule enumerating reserved symbols, if present. */
	public static final String RESERVED_SYMBOL = "RESERVED_SYMBOL";

	// Longer letter-initial terminals are descriptive text, not keywords
	private static final int MAX_KEYWORD_LENGTH = 30;

	private static final Pattern LETTER_INITIAL = Pattern.compile("^[a-zA-Z].*", Pattern.DOTALL);
	private static final Pattern LOWERCASE_INITIAL = Pattern.compile("^[a-z].*", Pattern.DOTALL);
	private static final Pattern KEYWORD = Pattern.compile("^[a-z][a-zA-Z]*$");
	private static final Pattern WHITESPACE = Pattern.compile(".*\\s.*", Pattern.DOTALL);

	private final RuleTable table;
	private SortedSet<String> keywords;
	private SortedSet<String> operators;

	/**
	 * Constructor.
	 * 
	 * @param table the rule table to examine
	 */
	public CollectTerminals(RuleTable table) {
		this.table = table;
		this.keywords = new TreeSet<String>();
		this.operators = new TreeSet<String>();
	}

	/**
	 * Collect the keywords and operators.
	 */
	public void execute() {
		RuleElementVisitor<Void> collector = new RuleElementVisitor<Void>() {
			@Override
			public Void visitTerminal(Terminal terminal) {
				String value = terminal.getValue();
				switch (classify(value)) {
				case KEYWORD:
					keywords.add(value);
					break;
				case OPERATOR:
					operators.add(value);
					break;
				case FILTERED:
					break;
				}
				return null;
			}

			@Override
			public Void visitNonTerminal(NonTerminal nonTerminal) {
				return null;
			}

			@Override
			public Void visitQualifiedNameRef(QualifiedNameRef ref) {
				return null;
			}

			@Override
			public Void visitRepetition(Repetition repetition) {
				return repetition.getChild().accept(this);
			}

			@Override
			public Void visitGroup(Group group) {
				for (List<RuleElement> alt : group.getAlternatives()) {
					for (RuleElement elem : alt)
						elem.accept(this);
				}
				return null;
			}
		};

		for (GrammarRule rule : table.getRules()) {
			if (rule.isLexical())
				continue;
			for (List<RuleElement> alt : rule.getAlternatives()) {
				for (RuleElement elem : alt)
					elem.accept(collector);
			}
		}

		// The reserved keyword and symbol enumerations are lexical rules,
		// so they were skipped above. Their top-level terminals are
		// taken as-is, partitioned only by their first character.
		GrammarRule reservedKeyword = table.get(RESERVED_KEYWORD);
		if (reservedKeyword != null) {
			for (Terminal terminal : topLevelTerminals(reservedKeyword)) {
				if (LOWERCASE_INITIAL.matcher(terminal.getValue()).matches())
					keywords.add(terminal.getValue());
			}
		}
		GrammarRule reservedSymbol = table.get(RESERVED_SYMBOL);
		if (reservedSymbol != null) {
			for (Terminal terminal : topLevelTerminals(reservedSymbol)) {
				String value = terminal.getValue();
				if (!LETTER_INITIAL.matcher(value).matches() && classify(value) == TerminalClass.OPERATOR)
					operators.add(value);
			}
		}
	}

	/**
	 * Classify a terminal value found in a parser rule body.
	 * Every value is exactly one of {@link TerminalClass#FILTERED},
	 * {@link TerminalClass#KEYWORD}, or {@link TerminalClass#OPERATOR}.
	 * 
	 * @param value a terminal value
	 * @return the classification
	 */
	public static TerminalClass classify(String value) {
		if (value.isEmpty() || WHITESPACE.matcher(value).matches())
			return TerminalClass.FILTERED;
		if (!LETTER_INITIAL.matcher(value).matches())
			return TerminalClass.OPERATOR;
		if (value.length() <= 1 || value.length() > MAX_KEYWORD_LENGTH)
			return TerminalClass.FILTERED;
		return KEYWORD.matcher(value).matches() ? TerminalClass.KEYWORD : TerminalClass.FILTERED;
	}

	private static List<Terminal> topLevelTerminals(GrammarRule rule) {
		List<Terminal> result = new ArrayList<Terminal>();
		for (List<RuleElement> alt : rule.getAlternatives()) {
			for (RuleElement elem : alt) {
				if (elem instanceof Terminal)
					result.add((Terminal) elem);
			}
		}
		return result;
	}

	/**
	 * @return the keywords, sorted
	 */
	public SortedSet<String> getKeywords() {
		return Collections.unmodifiableSortedSet(keywords);
	}

	/**
	 * @return the operators, sorted
	 */
	public SortedSet<String> getOperators() {
		return Collections.unmodifiableSortedSet(operators);
	}
}
