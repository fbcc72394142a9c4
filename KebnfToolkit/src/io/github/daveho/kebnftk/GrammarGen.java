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

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generate ANTLR4 grammars from KEBNF documents, either downloaded
 * from a release (<code>generate</code>) or read from local files
 * (<code>translate</code>).
 */
public class GrammarGen {
	/** Cache directory used by <code>generate --cache</code>. */
	public static final String CACHE_DIR = ".grammar-cache";

	private Slog log;
	private String configFile;
	private String tag;
	private String outputDir;
	private boolean cache;
	private List<String> positional;

	/**
	 * Constructor.
	 * 
	 * @param log logger
	 */
	public GrammarGen(Slog log) {
		this.log = log;
		this.positional = new ArrayList<String>();
	}

	/**
	 * Download the configured documents and generate the grammars.
	 * 
	 * @param args command line arguments (after the command name)
	 * @return the generated grammars
	 * @throws IOException if a document cannot be retrieved or an output file cannot be written
	 * @throws IllegalArgumentException for usage errors, invalid configuration, or an invalid release tag
	 */
	public GeneratedGrammar executeGenerate(String[] args) throws IOException {
		parseOptions(args, true);
		if (!positional.isEmpty())
			throw new IllegalArgumentException("Unexpected argument: " + positional.get(0));

		GeneratorConfig config = loadConfig();
		if (tag != null)
			config.releaseTag = tag;
		ReleaseTags.validate(config.releaseTag);

		log.log("%s ANTLR4 grammar generator", config.grammarTitle);
		log.log("  Release tag: %s", config.releaseTag);
		Path outDir = getOutputDir(config);
		log.log("  Output dir:  %s", outDir);

		DocumentSource source = new HttpDocumentSource(config.releaseRepo, log.child("download"));
		if (cache)
			source = new CachingDocumentSource(source, Paths.get(CACHE_DIR), log.child("cache"));

		Map<String, String> documents = new LinkedHashMap<String, String>();
		for (Map.Entry<String, String> entry : config.bnfFiles.entrySet()) {
			String content = source.fetch(entry.getKey(), entry.getValue(), config.releaseTag);
			log.log("  %s: %d bytes", entry.getKey(), content.length());
			documents.put(entry.getKey(), content);
		}

		return convertAndWrite(config, documents, outDir);
	}

	/**
	 * Generate the grammars from local KEBNF files.
	 * 
	 * @param args command line arguments (after the command name): the KEBNF
	 *             files in parsing order, followed by the output directory
	 * @return the generated grammars
	 * @throws IOException if a file cannot be read or written
	 * @throws IllegalArgumentException for usage errors or invalid configuration
	 */
	public GeneratedGrammar executeTranslate(String[] args) throws IOException {
		parseOptions(args, false);
		if (positional.size() < 2)
			throw new IllegalArgumentException("Expected at least one KEBNF file and an output directory");

		GeneratorConfig config = loadConfig();
		Map<String, String> documents = new LinkedHashMap<String, String>();
		for (String file : positional.subList(0, positional.size() - 1)) {
			Path path = Paths.get(file);
			String key = path.getFileName().toString().replaceFirst("\\.kebnf$", "");
			documents.put(key, new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
		}
		return convertAndWrite(config, documents, Paths.get(positional.get(positional.size() - 1)));
	}

	private GeneratedGrammar convertAndWrite(GeneratorConfig config, Map<String, String> documents, Path outDir)
			throws IOException {
		Slog convertLog = log.child("convert").start();
		GeneratedGrammar grammar = new ConvertKebnfToAntlr(config, convertLog).convert(documents);

		Files.createDirectories(outDir);
		Path lexerPath = outDir.resolve(GeneratorConfig.fileName(config.output.lexerGrammar));
		Path parserPath = outDir.resolve(GeneratorConfig.fileName(config.output.parserGrammar));
		writeFile(lexerPath, grammar.getLexerGrammar());
		writeFile(parserPath, grammar.getParserGrammar());

		log.log("Lexer:  %s (%d bytes)", lexerPath, grammar.getLexerGrammar().length());
		log.log("Parser: %s (%d bytes)", parserPath, grammar.getParserGrammar().length());
		log.log("Done in %.3f s", convertLog.elapsed());
		return grammar;
	}

	private static void writeFile(Path path, String text) throws IOException {
		try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(path, StandardCharsets.UTF_8))) {
			writer.write(text);
		}
	}

	private GeneratorConfig loadConfig() throws IOException {
		if (configFile != null)
			return GeneratorConfig.loadFile(Paths.get(configFile));
		return GeneratorConfig.loadDefault();
	}

	private Path getOutputDir(GeneratorConfig config) {
		if (outputDir != null)
			return Paths.get(outputDir);
		Path parent = Paths.get(config.output.lexerGrammar).getParent();
		return parent != null ? parent : Paths.get(".");
	}

	private void parseOptions(String[] args, boolean allowGenerateOptions) {
		positional.clear();
		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			if (arg.equals("--config")) {
				configFile = optionValue(args, ++i, arg);
			} else if (allowGenerateOptions && arg.equals("--tag")) {
				tag = optionValue(args, ++i, arg);
			} else if (allowGenerateOptions && arg.equals("--output-dir")) {
				outputDir = optionValue(args, ++i, arg);
			} else if (allowGenerateOptions && arg.equals("--cache")) {
				cache = true;
			} else if (arg.startsWith("--")) {
				throw new IllegalArgumentException("Unknown option: " + arg);
			} else {
				positional.add(arg);
			}
		}
	}

	private static String optionValue(String[] args, int i, String option) {
		if (i >= args.length)
			throw new IllegalArgumentException("Option " + option + " requires a value");
		return args[i];
	}
}
