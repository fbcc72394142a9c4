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
import java.util.Map;

/**
 * Generate an ANTLR4 lexer grammar from a {@link TokenVocabulary}.
 */
public class GenerateLexerGrammar {
	// Values to substitute:
	//   - grammar title
	//   - grammar kind (Lexer or Parser)
	static final String HEADER =
			"/*\n" +
			" * %s ANTLR4 %s Grammar\n" +
			" * AUTO-GENERATED from the official KEBNF specification\n" +
			" * Do not edit manually; run: kebnftk generate\n" +
			" */\n" +
			"\n";

	private static final String FIXED_TOKEN_DEFINITIONS =
			"// Identifiers\n" +
			"IDENTIFIER : [a-zA-Z_] [a-zA-Z0-9_]* ;\n" +
			"\n" +
			"// String literals\n" +
			"STRING : '\\'' ( '\\\\' . | ~['\\\\] )* '\\'' ;\n" +
			"DOUBLE_STRING : '\"' ( '\\\\' . | ~[\"\\\\] )* '\"' ;\n" +
			"\n" +
			"// Numeric literals\n" +
			"INTEGER : [0-9]+ ;\n" +
			"REAL : [0-9]* '.' [0-9]+ ( [eE] [+-]? [0-9]+ )? | [0-9]+ [eE] [+-]? [0-9]+ ;\n" +
			"\n" +
			"// Comments\n" +
			"REGULAR_COMMENT : '/*' .*? '*/' ;\n" +
			"SINGLE_LINE_NOTE : '//' ~[\\r\\n]* -> skip ;\n" +
			"\n" +
			"// Whitespace\n" +
			"WS : [ \\t\\r\\n]+ -> skip ;\n";

	private TokenVocabulary vocab;
	private String grammarTitle;
	private String lexerName;

	/**
	 * Constructor.
	 * 
	 * @param vocab        the token vocabulary
	 * @param grammarTitle title used in the header comment
	 * @param lexerName    name of the lexer grammar
	 */
	public GenerateLexerGrammar(TokenVocabulary vocab, String grammarTitle, String lexerName) {
		this.vocab = vocab;
		this.grammarTitle = grammarTitle;
		this.lexerName = lexerName;
	}

	/**
	 * Write the lexer grammar.
	 * Keywords come before operators, and operators are ordered
	 * longest literal first, so that ANTLR's first-defined-wins rule
	 * resolves ties between equal-length matches correctly.
	 * 
	 * @param out the PrintWriter to write the lexer grammar to
	 */
	public void generateLexerGrammar(PrintWriter out) {
		out.printf(HEADER, grammarTitle, "Lexer");
		out.write("lexer grammar " + lexerName + ";\n");
		out.write("\n");

		out.write("// Keywords\n");
		for (Map.Entry<String, String> entry : vocab.getKeywordTokens().entrySet()) {
			out.write(entry.getValue() + " : '" + TokenVocabulary.escapeLiteral(entry.getKey()) + "' ;\n");
		}
		out.write("\n");

		out.write("// Operators and punctuation\n");
		for (OperatorToken op : vocab.getOperatorTokens()) {
			out.write(op.getTokenName() + " : '" + TokenVocabulary.escapeLiteral(op.getLiteral()) + "' ;\n");
		}
		out.write("\n");

		out.write(FIXED_TOKEN_DEFINITIONS);
		out.flush();
	}
}
