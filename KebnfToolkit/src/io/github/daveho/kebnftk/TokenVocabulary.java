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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * The token names of the generated lexer grammar.
 * Each keyword and operator literal is assigned exactly one token name,
 * and no two literals share a token name.
 */
public class TokenVocabulary {
	/**
	 * Token names for operators and punctuation.
	 */
	static final Map<String, String> SYMBOL_NAMES = new LinkedHashMap<String, String>();
	static {
		SYMBOL_NAMES.put(":", "COLON");
		SYMBOL_NAMES.put("::", "COLON_COLON");
		SYMBOL_NAMES.put(":>", "COLON_GT");
		SYMBOL_NAMES.put(":>>", "COLON_GT_GT");
		SYMBOL_NAMES.put("::>", "COLON_COLON_GT");
		SYMBOL_NAMES.put(":=", "COLON_EQ");
		SYMBOL_NAMES.put(";", "SEMI");
		SYMBOL_NAMES.put(",", "COMMA");
		SYMBOL_NAMES.put(".", "DOT");
		SYMBOL_NAMES.put("..", "DOT_DOT");
		SYMBOL_NAMES.put(".?", "DOT_QUESTION");
		SYMBOL_NAMES.put("(", "LPAREN");
		SYMBOL_NAMES.put(")", "RPAREN");
		SYMBOL_NAMES.put("{", "LBRACE");
		SYMBOL_NAMES.put("}", "RBRACE");
		SYMBOL_NAMES.put("[", "LBRACK");
		SYMBOL_NAMES.put("]", "RBRACK");
		SYMBOL_NAMES.put("<", "LT");
		SYMBOL_NAMES.put(">", "GT");
		SYMBOL_NAMES.put("<=", "LE");
		SYMBOL_NAMES.put(">=", "GE");
		SYMBOL_NAMES.put("=", "EQ");
		SYMBOL_NAMES.put("==", "EQ_EQ");
		SYMBOL_NAMES.put("!=", "BANG_EQ");
		SYMBOL_NAMES.put("===", "EQ_EQ_EQ");
		SYMBOL_NAMES.put("!==", "BANG_EQ_EQ");
		SYMBOL_NAMES.put("+", "PLUS");
		SYMBOL_NAMES.put("-", "MINUS");
		SYMBOL_NAMES.put("*", "STAR");
		SYMBOL_NAMES.put("/", "SLASH");
		SYMBOL_NAMES.put("%", "PERCENT");
		SYMBOL_NAMES.put("^", "CARET");
		SYMBOL_NAMES.put("**", "STAR_STAR");
		SYMBOL_NAMES.put("~", "TILDE");
		SYMBOL_NAMES.put("#", "HASH");
		SYMBOL_NAMES.put("$", "DOLLAR");
		SYMBOL_NAMES.put("|", "PIPE");
		SYMBOL_NAMES.put("&", "AMP");
		SYMBOL_NAMES.put("->", "ARROW");
		SYMBOL_NAMES.put("=>", "FAT_ARROW");
		SYMBOL_NAMES.put("?", "QUESTION");
		SYMBOL_NAMES.put("??", "QUESTION_QUESTION");
		SYMBOL_NAMES.put("@", "AT_SIGN");
		SYMBOL_NAMES.put("@@", "AT_AT");
	}

	/**
	 * Names of single characters, used to compose token names for
	 * operators which don't have an entry in {@link #SYMBOL_NAMES}.
	 */
	private static final Map<Character, String> CHAR_NAMES = new HashMap<Character, String>();
	static {
		for (Map.Entry<String, String> entry : SYMBOL_NAMES.entrySet()) {
			if (entry.getKey().length() == 1)
				CHAR_NAMES.put(entry.getKey().charAt(0), entry.getValue());
		}
		CHAR_NAMES.put('!', "BANG");
		CHAR_NAMES.put('\\', "BACKSLASH");
		CHAR_NAMES.put('\'', "QUOTE");
		CHAR_NAMES.put('"', "DQUOTE");
		CHAR_NAMES.put('`', "BACKTICK");
	}

	/**
	 * Tokens defined by the lexer grammar in addition to the
	 * keyword and operator tokens.
	 */
	public static final List<String> FIXED_TOKENS = Collections.unmodifiableList(Arrays.asList(
			"IDENTIFIER", "STRING", "DOUBLE_STRING", "INTEGER", "REAL",
			"REGULAR_COMMENT", "SINGLE_LINE_NOTE", "WS"));

	/**
	 * Keywords which the generated expression rules and the lexical
	 * rule aliases refer to, whether or not the KEBNF rules use them.
	 */
	static final List<String> REQUIRED_KEYWORDS = Collections.unmodifiableList(Arrays.asList(
			"all", "and", "as", "by", "conjugates", "crosses", "defined", "else", "false",
			"hastype", "if", "implies", "istype", "meta", "metadata", "new", "not", "null",
			"or", "redefines", "references", "specializes", "subsets", "true", "typed", "xor"));

	private static final Pattern LETTER_INITIAL = Pattern.compile("^[a-zA-Z].*", Pattern.DOTALL);

	private SortedMap<String, String> keywordTokens;
	private Map<String, String> operatorTokens;

	/**
	 * Constructor.
	 * 
	 * @param keywords  the collected keywords
	 * @param operators the collected operators
	 * @throws IllegalStateException if two literals would get the same token name
	 */
	public TokenVocabulary(Collection<String> keywords, Collection<String> operators) {
		this.operatorTokens = new HashMap<String, String>();
		this.keywordTokens = new TreeMap<String, String>();

		Set<String> usedNames = new HashSet<String>(FIXED_TOKENS);

		// Operators in the symbol table always get their own names
		for (Map.Entry<String, String> entry : SYMBOL_NAMES.entrySet()) {
			operatorTokens.put(entry.getKey(), entry.getValue());
			usedNames.add(entry.getValue());
		}
		for (String op : new TreeSet<String>(operators)) {
			if (operatorTokens.containsKey(op))
				continue;
			String name = uniqueName(composeOperatorName(op), "_", usedNames);
			operatorTokens.put(op, name);
			usedNames.add(name);
		}

		SortedSet<String> allKeywords = new TreeSet<String>(keywords);
		allKeywords.addAll(REQUIRED_KEYWORDS);
		for (String kw : allKeywords) {
			String name = toTokenName(kw);
			if (usedNames.contains(name))
				name = uniqueName(name + "_KW", "", usedNames);
			keywordTokens.put(kw, name);
			usedNames.add(name);
		}

		checkInjective();
	}

	/**
	 * Convert a keyword to the uppercase-with-underscores form used
	 * as its token name, e.g., <code>fooBar</code> becomes <code>FOO_BAR</code>.
	 * 
	 * @param keyword a keyword (or other letter-initial terminal)
	 * @return the token name
	 */
	public static String toTokenName(String keyword) {
		StringBuilder buf = new StringBuilder();
		for (int i = 0; i < keyword.length(); ++i) {
			char c = keyword.charAt(i);
			if (c == ' ') {
				buf.append('_');
			} else {
				if (i > 0 && Character.isUpperCase(c))
					buf.append('_');
				buf.append(Character.toUpperCase(c));
			}
		}
		return buf.toString();
	}

	/**
	 * Get the token which matches a terminal.
	 * Letter-initial terminals which are not keywords (e.g., single letters)
	 * map to their {@link #toTokenName(String) token name form}.
	 * Symbols which aren't operators in this vocabulary are rendered as
	 * quoted literals.
	 * 
	 * @param value the terminal value
	 * @return the token name (or quoted literal)
	 */
	public String terminalToken(String value) {
		if (LETTER_INITIAL.matcher(value).matches()) {
			String name = keywordTokens.get(value);
			return name != null ? name : toTokenName(value);
		}
		String name = operatorTokens.get(value);
		return name != null ? name : "'" + escapeLiteral(value) + "'";
	}

	/**
	 * @param keyword a keyword
	 * @return true if the keyword is part of this vocabulary
	 */
	public boolean isKeyword(String keyword) {
		return keywordTokens.containsKey(keyword);
	}

	/**
	 * @return map of keywords to token names, sorted by keyword
	 */
	public SortedMap<String, String> getKeywordTokens() {
		return Collections.unmodifiableSortedMap(keywordTokens);
	}

	/**
	 * @return the operator tokens, longest literal first
	 */
	public List<OperatorToken> getOperatorTokens() {
		List<OperatorToken> result = new ArrayList<OperatorToken>();
		for (Map.Entry<String, String> entry : operatorTokens.entrySet())
			result.add(new OperatorToken(entry.getKey(), entry.getValue()));
		Collections.sort(result);
		return result;
	}

	/**
	 * Escape a literal for use in single quotes in an ANTLR grammar.
	 * 
	 * @param s the literal
	 * @return the escaped literal
	 */
	public static String escapeLiteral(String s) {
		return s.replace("\\", "\\\\").replace("'", "\\'");
	}

	private static String composeOperatorName(String op) {
		StringBuilder buf = new StringBuilder();
		for (int i = 0; i < op.length(); ++i) {
			char c = op.charAt(i);
			String part = CHAR_NAMES.get(c);
			if (part == null) {
				if (c < 128 && Character.isLetterOrDigit(c))
					part = String.valueOf(Character.toUpperCase(c));
				else
					part = String.format("U%04X", (int) c);
			}
			if (buf.length() > 0)
				buf.append('_');
			buf.append(part);
		}
		// token names must start with an uppercase letter
		if (!Character.isUpperCase(buf.charAt(0)))
			buf.insert(0, "OP_");
		return buf.toString();
	}

	private static String uniqueName(String base, String separator, Set<String> usedNames) {
		if (!usedNames.contains(base))
			return base;
		int n = 2;
		while (usedNames.contains(base + separator + n))
			++n;
		return base + separator + n;
	}

	private void checkInjective() {
		Map<String, String> nameToLiteral = new HashMap<String, String>();
		List<Map<String, String>> maps = new ArrayList<Map<String, String>>();
		maps.add(operatorTokens);
		maps.add(keywordTokens);
		for (Map<String, String> map : maps) {
			for (Map.Entry<String, String> entry : map.entrySet()) {
				String prev = nameToLiteral.put(entry.getValue(), entry.getKey());
				if (prev != null)
					throw new IllegalStateException("Token name " + entry.getValue()
							+ " assigned to both '" + prev + "' and '" + entry.getKey() + "'");
				if (FIXED_TOKENS.contains(entry.getValue()))
					throw new IllegalStateException("Token name " + entry.getValue() + " is reserved");
			}
		}
	}
}
