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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

/**
 * Generate an ANTLR4 parser grammar from the rewritten rule table.
 */
public class GenerateParserGrammar {
	private RuleTable table;
	private RuleRenderer renderer;
	private GenerateExpressionRules expressionRules;
	private ResolveUndefinedReferences resolver;
	private String grammarTitle;
	private String grammarName;
	private String lexerName;
	private int renderedRuleCount;
	private int stubRuleCount;

	/**
	 * Constructor.
	 * 
	 * @param table           the rule table
	 * @param renderer        the rule renderer
	 * @param expressionRules the expression rule generator
	 * @param resolver        the undefined reference resolver (should be fresh)
	 * @param grammarTitle    title used in the header comment
	 * @param grammarName     name of the parser grammar
	 * @param lexerName       name of the lexer grammar providing the tokens
	 */
	public GenerateParserGrammar(RuleTable table, RuleRenderer renderer, GenerateExpressionRules expressionRules,
			ResolveUndefinedReferences resolver, String grammarTitle, String grammarName, String lexerName) {
		this.table = table;
		this.renderer = renderer;
		this.expressionRules = expressionRules;
		this.resolver = resolver;
		this.grammarTitle = grammarTitle;
		this.grammarName = grammarName;
		this.lexerName = lexerName;
	}

	/**
	 * Check whether a rule is rendered into the parser grammar.
	 * 
	 * @param rule the rule
	 * @return true if the rule is rendered (provided its body is not empty)
	 */
	public static boolean isRenderable(GrammarRule rule) {
		if (rule.isLexical())
			return false;
		if (GenerateExpressionRules.EXCLUDED_RULE_NAMES.contains(rule.getName()))
			return false;
		return !GenerateExpressionRules.SYNTHESIZED_RULE_NAMES.contains(RuleRenderer.toParserRuleName(rule.getName()));
	}

	/**
	 * Write the parser grammar.
	 * 
	 * @param out the PrintWriter to write the parser grammar to
	 */
	public void generateParserGrammar(PrintWriter out) {
		out.printf(GenerateLexerGrammar.HEADER, grammarTitle, "Parser");
		out.write("parser grammar " + grammarName + ";\n");
		out.write("\n");
		out.write("options {\n");
		out.write("    tokenVocab = " + lexerName + ";\n");
		out.write("}\n");
		out.write("\n");

		StringWriter expressionText = new StringWriter();
		PrintWriter expressionOut = new PrintWriter(expressionText);
		expressionRules.generateExpressionRules(expressionOut);
		out.write("// ===== Expression rules (precedence-climbing) =====\n");
		out.write("\n");
		out.write(expressionText.toString());
		out.write("\n");

		out.write("// ===== Name rule (identifier or unrestricted name) =====\n");
		out.write("\n");
		expressionRules.generateNameRule(out);

		resolver.addDefined(GenerateExpressionRules.SYNTHESIZED_RULE_NAMES);
		resolver.scan(expressionText.toString());

		out.write("// ===== Parser rules =====\n");
		out.write("\n");
		renderedRuleCount = 0;
		for (GrammarRule rule : table.getRules()) {
			if (!isRenderable(rule))
				continue;
			List<String> alts = renderer.renderAlternatives(rule);
			if (alts.isEmpty())
				continue;
			String name = RuleRenderer.toParserRuleName(rule.getName());
			GenerateExpressionRules.writeRule(out, name, alts);
			resolver.addRule(name, String.join(RuleRenderer.ALTERNATIVE_SEPARATOR, alts));
			++renderedRuleCount;
		}

		stubRuleCount = resolver.generateStubRules(out);
		out.flush();
	}

	/**
	 * @return the number of parser rules rendered from the rule table
	 */
	public int getRenderedRuleCount() {
		return renderedRuleCount;
	}

	/**
	 * @return the number of stub rules generated
	 */
	public int getStubRuleCount() {
		return stubRuleCount;
	}
}
