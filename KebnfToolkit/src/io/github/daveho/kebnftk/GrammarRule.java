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
import java.util.List;
import java.util.regex.Pattern;

/**
 * A named rule parsed from a KEBNF document, or synthesized
 * while rewriting the rule graph.
 */
public class GrammarRule {
	/**
	 * Source tag for rules which were created by rewriting
	 * rather than parsed from a document.
	 */
	public static final String GENERATED = "generated";

	private static final Pattern LEXICAL_NAME = Pattern.compile("^[A-Z][A-Z_]+$");

	private final String name;
	private final String parentType;
	private List<List<RuleElement>> alternatives;
	private final boolean lexical;
	private final String source;

	/**
	 * Constructor.
	 * 
	 * @param name         the rule name
	 * @param parentType   the declared supertype, or null if there is none
	 * @param alternatives the alternatives (each a sequence of elements)
	 * @param source       key of the document the rule came from, or {@link #GENERATED}
	 */
	public GrammarRule(String name, String parentType, List<List<RuleElement>> alternatives, String source) {
		this.name = name;
		this.parentType = parentType;
		this.alternatives = new ArrayList<List<RuleElement>>(alternatives);
		this.lexical = isLexicalName(name);
		this.source = source;
	}

	/**
	 * Check whether a rule name denotes a lexical rule
	 * (entirely uppercase letters and underscores).
	 * 
	 * @param name a rule name
	 * @return true if the name is a lexical rule name
	 */
	public static boolean isLexicalName(String name) {
		return LEXICAL_NAME.matcher(name).matches();
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the declared supertype (advisory only), or null
	 */
	public String getParentType() {
		return parentType;
	}

	/**
	 * Get the alternatives. The returned list is the rule's own
	 * list, so rewriting passes may modify it in place.
	 * 
	 * @return the alternatives
	 */
	public List<List<RuleElement>> getAlternatives() {
		return alternatives;
	}

	/**
	 * Replace all of the rule's alternatives.
	 * 
	 * @param alternatives the new alternatives
	 */
	public void setAlternatives(List<List<RuleElement>> alternatives) {
		this.alternatives = new ArrayList<List<RuleElement>>(alternatives);
	}

	public boolean isLexical() {
		return lexical;
	}

	public String getSource() {
		return source;
	}

	@Override
	public String toString() {
		return name + " = " + alternatives;
	}
}
