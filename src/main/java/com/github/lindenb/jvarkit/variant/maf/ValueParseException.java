/*
The MIT License (MIT)

Copyright (c) 2025 Pierre Lindenbaum

Permission is hereby granted, free of charge, to any person obtaining a copy
of this software and associated documentation files (the "Software"), to deal
in the Software without restriction, including without limitation the rights
to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
copies of the Software, and to permit persons to whom the Software is
furnished to do so, subject to the following conditions:

The above copyright notice and this permission notice shall be included in all
copies or substantial portions of the Software.

THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
SOFTWARE.


*/
package com.github.lindenb.jvarkit.variant.maf;

/**
 * A token cannot be converted to a value of its column type.
 * Fatal under {@link htsjdk.samtools.ValidationStringency#STRICT}, collected as a warning otherwise.
 */
public class ValueParseException extends MafException {
private static final long serialVersionUID = 1L;
private final String columnName;
private final long lineNumber;

public ValueParseException(final String message) {
	this(message, null, -1L, null);
	}

public ValueParseException(final String message, final Throwable cause) {
	this(message, null, -1L, cause);
	}

public ValueParseException(final String message, final String columnName, final long lineNumber, final Throwable cause) {
	super(message, cause);
	this.columnName = columnName;
	this.lineNumber = lineNumber;
	}

/** @return the name of the column, or null if unknown */
public String getColumnName() {
	return this.columnName;
	}

/** @return the 1-based line number, or -1 if unknown */
public long getLineNumber() {
	return this.lineNumber;
	}

/** @return a copy of this exception carrying the column and the line */
ValueParseException locate(final String columnName, final long lineNumber) {
	final StringBuilder sb = new StringBuilder();
	if(lineNumber > 0L) sb.append("line ").append(lineNumber).append(": ");
	sb.append("column '").append(columnName).append("': ").append(getMessage());
	return new ValueParseException(sb.toString(), columnName, lineNumber, getCause());
	}
}
