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
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

/**
 * Configuration of a grammar generation run, read from JSON.
 */
public class GeneratorConfig {
	/** Name of the classpath resource holding the default configuration. */
	public static final String DEFAULT_RESOURCE = "kebnftk-config.json";

	public static final Gson GSON = new GsonBuilder()
			.setPrettyPrinting()
			.create();

	/**
	 * Paths of the generated grammar files.
	 */
	public static class Output {
		@SerializedName("lexer_grammar")
		public String lexerGrammar;

		@SerializedName("parser_grammar")
		public String parserGrammar;
	}

	@SerializedName("release_tag")
	public String releaseTag;

	@SerializedName("release_repo")
	public String releaseRepo;

	/** Document key to repository path; documents are parsed in this order. */
	@SerializedName("bnf_files")
	public Map<String, String> bnfFiles = new LinkedHashMap<String, String>();

	@SerializedName("output")
	public Output output;

	@SerializedName("grammar_name")
	public String grammarName;

	@SerializedName("lexer_name")
	public String lexerName;

	@SerializedName("grammar_title")
	public String grammarTitle;

	@SerializedName("grammar_version")
	public String grammarVersion;

	/** Cycles of mutually left-recursive rules to break, each starting with its head rule. */
	@SerializedName("cycles")
	public List<List<String>> cycles = new ArrayList<List<String>>();

	/**
	 * Read a configuration.
	 * 
	 * @param reader the Reader to read the JSON text from
	 * @return the validated configuration
	 * @throws IllegalArgumentException if the JSON is malformed or a required field is missing
	 */
	public static GeneratorConfig load(Reader reader) {
		GeneratorConfig config;
		try {
			config = GSON.fromJson(reader, GeneratorConfig.class);
		} catch (JsonParseException e) {
			throw new IllegalArgumentException("Malformed configuration: " + e.getMessage(), e);
		}
		if (config == null)
			throw new IllegalArgumentException("Configuration is empty");
		config.validate();
		return config;
	}

	/**
	 * Read a configuration file.
	 * 
	 * @param path the configuration file
	 * @return the validated configuration
	 * @throws IOException if the file cannot be read
	 */
	public static GeneratorConfig loadFile(Path path) throws IOException {
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return load(reader);
		}
	}

	/**
	 * Read the default configuration from the classpath.
	 * 
	 * @return the default configuration
	 * @throws IOException if the resource cannot be read
	 */
	public static GeneratorConfig loadDefault() throws IOException {
		InputStream in = GeneratorConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
		if (in == null)
			throw new IOException("Missing resource " + DEFAULT_RESOURCE);
		try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
			return load(reader);
		}
	}

	/**
	 * Check that all required fields are present.
	 * 
	 * @throws IllegalArgumentException if a required field is missing
	 */
	public void validate() {
		require(releaseTag, "release_tag");
		require(releaseRepo, "release_repo");
		require(grammarName, "grammar_name");
		require(lexerName, "lexer_name");
		if (output == null)
			throw new IllegalArgumentException("Missing configuration field: output");
		require(output.lexerGrammar, "output.lexer_grammar");
		require(output.parserGrammar, "output.parser_grammar");
		if (bnfFiles == null || bnfFiles.isEmpty())
			throw new IllegalArgumentException("Missing configuration field: bnf_files");
		if (grammarTitle == null)
			grammarTitle = grammarName;
		if (cycles == null)
			cycles = new ArrayList<List<String>>();
		for (List<String> cycle : cycles) {
			if (cycle == null || cycle.size() < 2)
				throw new IllegalArgumentException("A cycle needs at least two rules: " + cycle);
		}
	}

	private static void require(String value, String field) {
		if (value == null || value.isEmpty())
			throw new IllegalArgumentException("Missing configuration field: " + field);
	}

	/**
	 * Get the file name (last path component) of a configured output path.
	 * 
	 * @param path a configured output path such as <code>grammar/Foo.g4</code>
	 * @return the file name
	 */
	public static String fileName(String path) {
		int slash = path.lastIndexOf('/');
		return slash >= 0 ? path.substring(slash + 1) : path;
	}
}
