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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parse KEBNF documents into {@link GrammarRule}s.
 * Rules from all parsed documents are added to one {@link RuleTable};
 * a rule defined by more than one document gets the alternatives
 * of all of its definitions.
 */
public class ParseKebnf {
	/*
	Document shape:

	Name = body
	Name : ParentType = body
	LEXICAL_NAME = body

	The body extends to the next line starting with an uppercase letter,
	the next "//" comment line, or the end of the document. Lines starting
	with whitespace continue the previous line.

	Body notation:

	body    := seq ( '|' seq )*
	seq     := item*
	item    := prop ( '=' | '+=' | '?=' ) value    property assignment; prop is dropped
	         | '{' ... '}'                          non-parsing block; dropped
	         | '(' body ')' suffix?
	         | element suffix?
	value   := '(' body ')' suffix? | element suffix?
	element := 'terminal' | [QualifiedName] | ~[QualifiedName] | RuleName | true | false
	suffix  := '?' | '+' | '*'

	Fragments which don't fit this shape are skipped (and counted).
	 */

	private static final Pattern RULE_HEADER = Pattern.compile(
			"^([A-Z][A-Za-z_]+)\\s*(?::\\s*([A-Z][A-Za-z]+)\\s*)?=[ \\t]*(.*?)(?=\\n[A-Z]|\\n//|\\z)",
			Pattern.MULTILINE | Pattern.DOTALL);

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private final RuleTable table;
	private int skippedFragmentCount;

	/**
	 * Constructor.
	 * 
	 * @param table the table to which parsed rules are added
	 */
	public ParseKebnf(RuleTable table) {
		this.table = table;
		this.skippedFragmentCount = 0;
	}

	/**
	 * Parse one document.
	 * A document in which no rule header is found contributes no rules.
	 * 
	 * @param content the document text
	 * @param source  key identifying the document (e.g., "kerml")
	 */
	public void parseDocument(String content, String source) {
		String fullText = joinContinuationLines(content);

		Matcher m = RULE_HEADER.matcher(fullText);
		while (m.find()) {
			String name = m.group(1);
			String parentType = m.group(2);
			String body = m.group(3).strip();

			// Semantic-only rules (e.g., "EmptyUsage = { }") consume no
			// input; keeping them would produce epsilon alternatives.
			String compact = WHITESPACE.matcher(body).replaceAll("");
			if (body.isEmpty() || compact.equals("{}"))
				continue;

			List<List<RuleElement>> alternatives = parseAlternatives(body);
			if (alternatives.isEmpty()) {
				++skippedFragmentCount;
				continue;
			}

			table.add(new GrammarRule(name, parentType, alternatives, source));
		}
	}

	/**
	 * Get the number of fragments which were skipped because
	 * they were not recognized, including skipped characters
	 * found by the tokenizer.
	 * 
	 * @return number of skipped fragments
	 */
	public int getSkippedFragmentCount() {
		return skippedFragmentCount;
	}

	static String joinContinuationLines(String content) {
		String normalized = content.replace("\r\n", "\n").replace("\r", "\n");
		List<String> joined = new ArrayList<String>();
		for (String line : normalized.split("\n", -1)) {
			if (!line.isEmpty() && (line.charAt(0) == ' ' || line.charAt(0) == '\t')) {
				if (joined.isEmpty()) {
					joined.add(line.strip());
				} else {
					int last = joined.size() - 1;
					joined.set(last, joined.get(last) + " " + line.strip());
				}
			} else {
				joined.add(line);
			}
		}
		return String.join("\n", joined);
	}

	/**
	 * Parse a rule body into alternatives.
	 * 
	 * @param body the body text
	 * @return the alternatives; empty alternatives are omitted
	 */
	List<List<RuleElement>> parseAlternatives(String body) {
		List<List<RuleElement>> result = new ArrayList<List<RuleElement>>();
		for (String alt : splitAlternatives(body)) {
			List<RuleElement> elements = parseSequence(alt.strip());
			if (!elements.isEmpty())
				result.add(elements);
		}
		return result;
	}

	/**
	 * Split text at each <code>|</code> which is neither quoted
	 * nor inside parentheses.
	 * 
	 * @param text the text to split
	 * @return the pieces
	 */
	static List<String> splitAlternatives(String text) {
		List<String> parts = new ArrayList<String>();
		StringBuilder current = new StringBuilder();
		int depth = 0;
		int i = 0;
		while (i < text.length()) {
			char ch = text.charAt(i);
			if (ch == '\'') {
				// copy the quoted string, including escapes, verbatim
				current.append(ch);
				++i;
				while (i < text.length() && text.charAt(i) != '\'') {
					if (text.charAt(i) == '\\' && i + 1 < text.length()) {
						current.append(text.charAt(i));
						++i;
					}
					current.append(text.charAt(i));
					++i;
				}
				if (i < text.length()) {
					current.append(text.charAt(i));
					++i;
				}
				continue;
			} else if (ch == '(') {
				++depth;
			} else if (ch == ')') {
				--depth;
			} else if (ch == '|' && depth == 0) {
				parts.add(current.toString());
				current.setLength(0);
				++i;
				continue;
			}
			current.append(ch);
			++i;
		}
		if (current.length() > 0)
			parts.add(current.toString());
		return parts;
	}

	private List<RuleElement> parseSequence(String text) {
		TokenizeRuleBody tokenizer = new TokenizeRuleBody(text);
		List<String> tokens = tokenizer.tokenize();
		skippedFragmentCount += tokenizer.getSkippedCharCount();

		List<RuleElement> elements = new ArrayList<RuleElement>();
		int i = 0;
		while (i < tokens.size()) {
			String tok = tokens.get(i);

			if (isAssignment(tokens, i)) {
				// prop = value, prop += value, prop ?= value:
				// the property is semantic, but the value is grammar
				String value = tokens.get(i + 2);
				if (value.equals("(")) {
					int end = findGroupEnd(tokens, i + 2);
					Group group = parseGroup(tokens.subList(i + 3, Math.max(i + 3, end - 1)));
					if (group.getAlternatives().isEmpty()) {
						i = end;
						continue;
					}
					i = parseSuffix(tokens, end, group, elements);
				} else {
					RuleElement elem = makeElement(value);
					if (elem == null) {
						++skippedFragmentCount;
						i += 3;
					} else {
						i = parseSuffix(tokens, i + 3, elem, elements);
					}
				}
				continue;
			}

			if (tok.equals("{")) {
				i = skipBlock(tokens, i);
				continue;
			}

			if (tok.equals("(")) {
				int end = findGroupEnd(tokens, i);
				Group group = parseGroup(tokens.subList(i + 1, Math.max(i + 1, end - 1)));
				i = parseSuffix(tokens, end, group, elements);
				continue;
			}

			RuleElement elem = makeElement(tok);
			if (elem == null) {
				++skippedFragmentCount;
				++i;
			} else {
				i = parseSuffix(tokens, i + 1, elem, elements);
			}
		}

		return elements;
	}

	private static boolean isAssignment(List<String> tokens, int i) {
		if (i + 2 >= tokens.size())
			return false;
		String op = tokens.get(i + 1);
		if (!op.equals("=") && !op.equals("+=") && !op.equals("?="))
			return false;
		return Character.isLowerCase(tokens.get(i).charAt(0));
	}

	/**
	 * Add an element to the sequence, wrapped in a {@link Repetition}
	 * if a repetition suffix follows it.
	 * 
	 * @return index of the first token after the element and its suffix
	 */
	private static int parseSuffix(List<String> tokens, int i, RuleElement elem, List<RuleElement> elements) {
		if (i < tokens.size()) {
			RepetitionModifier modifier = RepetitionModifier.fromToken(tokens.get(i));
			if (modifier != null) {
				elements.add(new Repetition(elem, modifier));
				return i + 1;
			}
		}
		elements.add(elem);
		return i;
	}

	/**
	 * Find the end of a parenthesized group.
	 * 
	 * @param tokens the tokens
	 * @param open   index of the opening parenthesis
	 * @return index just past the matching closing parenthesis
	 *         (or the number of tokens, if the group is not closed)
	 */
	private static int findGroupEnd(List<String> tokens, int open) {
		int depth = 1;
		int i = open + 1;
		while (i < tokens.size()) {
			String tok = tokens.get(i);
			++i;
			if (tok.equals("(")) {
				++depth;
			} else if (tok.equals(")")) {
				--depth;
				if (depth == 0)
					return i;
			}
		}
		// Unclosed group: everything up to the end is the group's content.
		// Callers take content up to end - 1, so compensate here.
		return tokens.size() + 1;
	}

	private static int skipBlock(List<String> tokens, int open) {
		int depth = 1;
		int i = open + 1;
		while (i < tokens.size() && depth > 0) {
			String tok = tokens.get(i);
			if (tok.equals("{"))
				++depth;
			else if (tok.equals("}"))
				--depth;
			++i;
		}
		return i;
	}

	private Group parseGroup(List<String> innerTokens) {
		String groupText = String.join(" ", innerTokens);
		return new Group(parseAlternatives(groupText));
	}

	/**
	 * Create a {@link RuleElement} from a single token.
	 * 
	 * @param tok the token
	 * @return the element, or null if the token isn't an element
	 */
	static RuleElement makeElement(String tok) {
		if (tok.length() >= 2 && tok.startsWith("'") && tok.endsWith("'"))
			return new Terminal(tok.substring(1, tok.length() - 1).replace("\\'", "'"));
		if (tok.equals("[QualifiedName]"))
			return new QualifiedNameRef(false);
		if (tok.startsWith("~["))
			return new QualifiedNameRef(true);
		if (Character.isUpperCase(tok.charAt(0)))
			return new NonTerminal(tok);
		if (tok.equals("true") || tok.equals("false"))
			return new Terminal(tok);
		return null;
	}
}
