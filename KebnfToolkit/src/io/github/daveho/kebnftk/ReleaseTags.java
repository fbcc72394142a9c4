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

import java.util.regex.Pattern;

/**
 * Validation of release tags. A tag becomes part of a URL and of a
 * cache file name, so only a restricted set of characters is allowed.
 */
public class ReleaseTags {
	private static final Pattern VALID_TAG = Pattern.compile("^[a-zA-Z0-9._-]+$");

	/**
	 * @param tag a release tag
	 * @return true if the tag is valid
	 */
	public static boolean isValid(String tag) {
		return tag != null && VALID_TAG.matcher(tag).matches();
	}

	/**
	 * Check a release tag.
	 * 
	 * @param tag a release tag
	 * @return the tag
	 * @throws IllegalArgumentException if the tag is not valid
	 */
	public static String validate(String tag) {
		if (!isValid(tag))
			throw new IllegalArgumentException("Invalid release tag: '" + tag + "'. Tags must contain only "
					+ "alphanumeric characters, dots, hyphens, and underscores.");
		return tag;
	}
}
