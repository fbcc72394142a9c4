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

import java.util.Collections;
import java.util.List;

/**
 * Result of converting KEBNF documents: the text of the lexer and parser
 * grammars, plus statistics about the conversion.
 */
public class GeneratedGrammar {
	private final String lexerGrammar;
	private final String parserGrammar;
	private final int ruleCount;
	private final int lexicalRuleCount;
	private final int keywordCount;
	private final int operatorCount;
	private final int renderedRuleCount;
	private final int stubRuleCount;
	private final int skippedFragmentCount;
	private final List<List<String>> leftRecursionCycles;

	GeneratedGrammar(String lexerGrammar, String parserGrammar, int ruleCount, int lexicalRuleCount,
			int keywordCount, int operatorCount, int renderedRuleCount, int stubRuleCount,
			int skippedFragmentCount, List<List<String>> leftRecursionCycles) {
		this.lexerGrammar = lexerGrammar;
		this.parserGrammar = parserGrammar;
		this.ruleCount = ruleCount;
		this.lexicalRuleCount = lexicalRuleCount;
		this.keywordCount = keywordCount;
		this.operatorCount = operatorCount;
		this.renderedRuleCount = renderedRuleCount;
		this.stubRuleCount = stubRuleCount;
		this.skippedFragmentCount = skippedFragmentCount;
		this.leftRecursionCycles = Collections.unmodifiableList(leftRecursionCycles);
	}

	public String getLexerGrammar() {
		return lexerGrammar;
	}

	public String getParserGrammar() {
		return parserGrammar;
	}

	/**
	 * @return number of rules in the rule table, including generated rules
	 */
	public int getRuleCount() {
		return ruleCount;
	}

	public int getLexicalRuleCount() {
		return lexicalRuleCount;
	}

	/**
	 * @return number of keywords collected from the KEBNF rules
	 */
	public int getKeywordCount() {
		return keywordCount;
	}

	/**
	 * @return number of operators collected from the KEBNF rules
	 */
	public int getOperatorCount() {
		return operatorCount;
	}

	public int getRenderedRuleCount() {
		return renderedRuleCount;
	}

	public int getStubRuleCount() {
		return stubRuleCount;
	}

	public int getSkippedFragmentCount() {
		return skippedFragmentCount;
	}

	/**
	 * @return mutual left recursion cycles remaining in the rewritten rules
	 */
	public List<List<String>> getLeftRecursionCycles() {
		return leftRecursionCycles;
	}
}
