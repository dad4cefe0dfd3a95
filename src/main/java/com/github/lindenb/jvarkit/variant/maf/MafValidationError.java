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
 * A validation problem found while decoding a MAF line. Under a lenient
 * stringency, problems are kept on the record instead of being thrown.
 */
public final class MafValidationError {
public static enum Type {
	RECORD_MISMATCH_NUMBER_OF_COLUMNS("The record has an unexpected number of columns"),
	RECORD_INVALID_COLUMN_VALUE("The record's column has an invalid value"),
	HEADER_UNSUPPORTED_ANNOTATION_SPEC("The header has an unsupported annotation specification"),
	HEADER_UNSUPPORTED_SORT_ORDER("The header has an unsupported sort order");
	
	private final String description;
	Type(final String description) {
		this.description = description;
		}
	public String getDescription() {
		return this.description;
		}
	}

private final Type type;
private final String message;
private final long lineNumber;
private final String columnName;

public MafValidationError(final Type type,final String message,final long lineNumber,final String columnName) {
	this.type = type;
	this.message = message;
	this.lineNumber = lineNumber;
	this.columnName = columnName;
	}

public Type getType() {
	return this.type;
	}

public String getMessage() {
	return this.message;
	}

/** @return the 1-based line number or -1 */
public long getLineNumber() {
	return this.lineNumber;
	}

/** @return the column name or null */
public String getColumnName() {
	return this.columnName;
	}

@Override
public String toString() {
	if(this.lineNumber>0L) {
		return this.type.name()+": On line number "+this.lineNumber+": "+this.message;
		}
	return this.type.name()+": "+this.message;
	}
}
