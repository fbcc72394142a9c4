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
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Render rule elements as ANTLR4 parser rule text.
 */
public class RuleRenderer implements RuleElementVisitor<String> {
	/** Text emitted for an alternative which is empty in the KEBNF source. */
	public static final String EMPTY_ALTERNATIVE = "/* empty */";

	/** Separator between alternatives of a rendered rule body. */
	public static final String ALTERNATIVE_SEPARATOR = "\n    | ";

	private static final Pattern LEXICAL_REFERENCE = Pattern.compile("^[A-Z][A-Z_0-9]+$");
	private static final Pattern LETTER_INITIAL = Pattern.compile("^[a-zA-Z].*", Pattern.DOTALL);

	/**
	 * Lexical rules which have a direct equivalent in the generated grammars.
	 * The compound ones accept either a symbol or a keyword.
	 */
	static final Map<String, String> LEXICAL_ALIASES = new HashMap<String, String>();
	static {
		LEXICAL_ALIASES.put("NAME", GenerateExpressionRules.NAME_RULE);
		LEXICAL_ALIASES.put("STRING_VALUE", "DOUBLE_STRING");
		LEXICAL_ALIASES.put("DECIMAL_VALUE", "INTEGER");
		LEXICAL_ALIASES.put("EXPONENTIAL_VALUE", "REAL");
		LEXICAL_ALIASES.put("REGULAR_COMMENT", "REGULAR_COMMENT");
		LEXICAL_ALIASES.put("TYPED_BY", "( COLON | TYPED BY )");
		LEXICAL_ALIASES.put("DEFINED_BY", "( COLON | DEFINED BY )");
		LEXICAL_ALIASES.put("SPECIALIZES", "( COLON_GT | SPECIALIZES )");
		LEXICAL_ALIASES.put("SUBSETS", "( COLON_GT | SUBSETS )");
		LEXICAL_ALIASES.put("REFERENCES", "( COLON_COLON_GT | REFERENCES )");
		LEXICAL_ALIASES.put("CROSSES", "( FAT_ARROW | CROSSES )");
		LEXICAL_ALIASES.put("REDEFINES", "( COLON_GT_GT | REDEFINES )");
		LEXICAL_ALIASES.put("CONJUGATES", "( TILDE | CONJUGATES )");
	}

	/** Words which ANTLR does not accept as rule names. */
	static final Set<String> RESERVED_WORDS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
			"import", "fragment", "lexer", "parser", "grammar", "returns", "locals", "throws",
			"catch", "finally", "mode", "options", "tokens", "channels")));

	private static final String QUALIFIED_NAME = "qualifiedName";

	private RuleTable table;
	private TokenVocabulary vocab;

	/**
	 * Constructor.
	 * 
	 * @param table the rule table (consulted to tell lexical references apart)
	 * @param vocab the token vocabulary
	 */
	public RuleRenderer(RuleTable table, TokenVocabulary vocab) {
		this.table = table;
		this.vocab = vocab;
	}

	/**
	 * Convert a KEBNF rule name to an ANTLR parser rule name:
	 * the initial letter is lowercased, and a reserved word gets
	 * the suffix <code>Rule</code>.
	 * 
	 * @param name the KEBNF rule name
	 * @return the parser rule name
	 */
	public static String toParserRuleName(String name) {
		if (name.isEmpty())
			return name;
		String result = Character.toLowerCase(name.charAt(0)) + name.substring(1);
		if (RESERVED_WORDS.contains(result))
			result = result + "Rule";
		return result;
	}

	/**
	 * Render a sequence of elements. Elements which render as
	 * nothing are omitted.
	 * 
	 * @param sequence the elements
	 * @return the rendered text (empty if nothing is rendered)
	 */
	public String renderSequence(List<RuleElement> sequence) {
		StringBuilder buf = new StringBuilder();
		for (RuleElement elem : sequence) {
			String text = elem.accept(this);
			if (text.isEmpty())
				continue;
			if (buf.length() > 0)
				buf.append(' ');
			buf.append(text);
		}
		return buf.toString();
	}

	/**
	 * Render each alternative of a rule. Alternatives which render
	 * to the same text appear once. An alternative which is empty in the
	 * source is kept as {@link #EMPTY_ALTERNATIVE}; one which merely
	 * renders as nothing is dropped.
	 * 
	 * @param rule the rule
	 * @return the distinct rendered alternatives, in source order
	 */
	public List<String> renderAlternatives(GrammarRule rule) {
		Set<String> seen = new LinkedHashSet<String>();
		for (List<RuleElement> alt : rule.getAlternatives()) {
			String text = renderSequence(alt);
			if (!text.isEmpty())
				seen.add(text);
			else if (alt.isEmpty())
				seen.add(EMPTY_ALTERNATIVE);
		}
		return new ArrayList<String>(seen);
	}

	/**
	 * Render the body of a rule.
	 * 
	 * @param rule the rule
	 * @return the alternatives joined by {@link #ALTERNATIVE_SEPARATOR},
	 *         or the empty string if the rule renders as nothing
	 */
	public String renderBody(GrammarRule rule) {
		return String.join(ALTERNATIVE_SEPARATOR, renderAlternatives(rule));
	}

	/**
	 * Check whether a rule reference denotes a lexical rule.
	 * 
	 * @param name the referenced name
	 * @return true if the reference is lexical
	 */
	public boolean isLexicalReference(String name) {
		GrammarRule rule = table.get(name);
		if (rule != null && rule.isLexical())
			return true;
		return LEXICAL_REFERENCE.matcher(name).matches();
	}

	@Override
	public String visitTerminal(Terminal terminal) {
		String value = terminal.getValue();
		// empty and whitespace-containing symbols have no lexer token
		if (!LETTER_INITIAL.matcher(value).matches()
				&& CollectTerminals.classify(value) == CollectTerminals.TerminalClass.FILTERED)
			return "";
		return vocab.terminalToken(value);
	}

	@Override
	public String visitNonTerminal(NonTerminal nonTerminal) {
		String name = nonTerminal.getName();
		if (isLexicalReference(name)) {
			String alias = LEXICAL_ALIASES.get(name);
			return alias != null ? alias : name;
		}
		return toParserRuleName(name);
	}

	@Override
	public String visitQualifiedNameRef(QualifiedNameRef ref) {
		return QUALIFIED_NAME;
	}

	@Override
	public String visitRepetition(Repetition repetition) {
		String inner = repetition.getChild().accept(this);
		if (inner.isEmpty())
			return "";
		return inner + repetition.getModifier().getSymbol();
	}

	@Override
	public String visitGroup(Group group) {
		List<String> texts = new ArrayList<String>();
		for (List<RuleElement> alt : group.getAlternatives()) {
			String text = renderSequence(alt);
			if (!text.isEmpty())
				texts.add(text);
		}
		if (texts.isEmpty())
			return "";
		return "( " + String.join(" | ", texts) + " )";
	}
}
