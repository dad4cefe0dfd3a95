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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import htsjdk.samtools.ValidationStringency;
import htsjdk.samtools.util.Locatable;
import htsjdk.samtools.util.Log;
import htsjdk.tribble.annotation.Strand;

/**
 * A MAF record: one typed value per column of its {@link MafScheme}.
 * 
 * A record is immutable. When its scheme is locatable (it has the columns
 * <code>Chromosome</code>, <code>Start_Position</code>, <code>End_Position</code>
 * and <code>Strand</code>), the record is a htsjdk {@link Locatable} with a
 * 1-based inclusive span.
 * @author Pierre Lindenbaum
 *
 */
public final class MafRecord implements Locatable {
private static final Log LOG=Log.getInstance(MafRecord.class);
/** the delimiter between two columns */
public static final String COLUMN_SEPARATOR = "\t";

private final MafScheme scheme;
private final List<ColumnValue> values;
private final long lineNumber;
private final List<MafValidationError> warnings;

MafRecord(final MafScheme scheme,final List<ColumnValue> values,final long lineNumber,final List<MafValidationError> warnings) {
	this.scheme = scheme;
	this.values = Collections.unmodifiableList(new ArrayList<>(values));
	this.lineNumber = lineNumber;
	this.warnings = warnings==null || warnings.isEmpty()?
			Collections.emptyList():
			Collections.unmodifiableList(new ArrayList<>(warnings));
	if(this.values.size()!=scheme.size()) {
		throw new IllegalArgumentException("expected "+scheme.size()+" values but got "+this.values.size());
		}
	}

/**
 * create a record from its values
 * @param scheme the scheme
 * @param values one value per column, in the scheme order
 * @return the new record
 * @throws IllegalArgumentException if a value is not legal for its column
 */
public static MafRecord of(final MafScheme scheme,final List<ColumnValue> values) {
	Objects.requireNonNull(scheme, "scheme");
	Objects.requireNonNull(values, "values");
	if(values.size()!=scheme.size()) {
		throw new IllegalArgumentException("expected "+scheme.size()+" values for scheme "+scheme+" but got "+values.size());
		}
	for(int i=0;i< values.size();i++) {
		checkValue(scheme.getColumn(i), values.get(i));
		}
	return new MafRecord(scheme, values, -1L, null);
	}

private static void checkValue(final MafColumn column,final ColumnValue value) {
	final String msg = column.getType().validate(value);
	if(msg!=null) throw new IllegalArgumentException("column '"+column.getName()+"': "+msg);
	}

public static MafRecord decode(final MafScheme scheme,final List<String> tokens,final ValidationStringency stringency) {
	return decode(scheme, tokens, stringency, -1L);
	}

/**
 * decode the tokens of a line
 * @param scheme the scheme
 * @param tokens the raw tokens, in the scheme order
 * @param stringency STRICT throws the first problem, LENIENT and SILENT keep the problems as warnings and use null placeholders
 * @param lineNumber the 1-based line number or -1
 * @return the record
 * @throws ValueParseException under STRICT stringency, if a token cannot be decoded or if the number of tokens is wrong
 */
public static MafRecord decode(final MafScheme scheme,final List<String> tokens,final ValidationStringency stringency,final long lineNumber) {
	Objects.requireNonNull(scheme, "scheme");
	Objects.requireNonNull(tokens, "tokens");
	Objects.requireNonNull(stringency, "stringency");
	final List<MafValidationError> warnings = new ArrayList<>();
	final int n = scheme.size();
	if(tokens.size()!=n) {
		final String msg = "Found "+tokens.size()+" columns but expected "+n+" with scheme '"+scheme.getAnnotationSpec()+"'";
		if(stringency.equals(ValidationStringency.STRICT)) {
			throw new ValueParseException((lineNumber>0L?"line "+lineNumber+": ":"")+msg, null, lineNumber, null);
			}
		warnings.add(new MafValidationError(MafValidationError.Type.RECORD_MISMATCH_NUMBER_OF_COLUMNS, msg, lineNumber, null));
		}
	final List<ColumnValue> values = new ArrayList<>(n);
	for(int i=0;i< n;i++) {
		final MafColumn column = scheme.getColumn(i);
		final ColumnType type = column.getType();
		if(i>=tokens.size()) {
			values.add(ColumnValue.nullOf(type.getKind()));
			continue;
			}
		try {
			values.add(type.decode(tokens.get(i)));
			}
		catch(final ValueParseException err) {
			final ValueParseException located = err.locate(column.getName(), lineNumber);
			if(stringency.equals(ValidationStringency.STRICT)) throw located;
			warnings.add(new MafValidationError(MafValidationError.Type.RECORD_INVALID_COLUMN_VALUE, located.getMessage(), lineNumber, column.getName()));
			values.add(ColumnValue.nullOf(type.getKind()));
			}
		}
	if(stringency.equals(ValidationStringency.LENIENT)) {
		for(final MafValidationError w:warnings) {
			LOG.warn("Ignoring MAF validation error: "+w);
			}
		}
	return new MafRecord(scheme, values, lineNumber, warnings);
	}

public MafScheme getScheme() {
	return this.scheme;
	}

/** @return the 1-based line number in the source, or -1 */
public long getLineNumber() {
	return this.lineNumber;
	}

/** @return the problems collected while decoding under a lenient stringency */
public List<MafValidationError> getWarnings() {
	return this.warnings;
	}

public boolean hasWarnings() {
	return !this.warnings.isEmpty();
	}

/** @return the number of columns */
public int size() {
	return this.values.size();
	}

/**
 * @param columnName the column name
 * @return the value of the column
 * @throws UnknownColumnException if the scheme has no such column
 */
public ColumnValue get(final String columnName) {
	return this.values.get(this.scheme.getColumn(columnName).getIndex());
	}

public ColumnValue get(final int index) {
	return this.values.get(index);
	}

/** @return the raw value of the column, may be null */
public Object getValue(final String columnName) {
	return get(columnName).getValue();
	}

public List<ColumnValue> getColumnValues() {
	return this.values;
	}

/** @return the tokens of this record */
public List<String> encode() {
	final List<String> tokens = new ArrayList<>(this.values.size());
	for(int i=0;i< this.values.size();i++) {
		tokens.add(this.scheme.getColumn(i).getType().encode(this.values.get(i)));
		}
	return tokens;
	}

/**
 * @param columnName the column name
 * @param value the new value
 * @return a copy of this record where the column has the new value
 */
public MafRecord with(final String columnName,final ColumnValue value) {
	final MafColumn column = this.scheme.getColumn(columnName);
	checkValue(column, value);
	final List<ColumnValue> L = new ArrayList<>(this.values);
	L.set(column.getIndex(), value);
	return new MafRecord(this.scheme, L, this.lineNumber, this.warnings);
	}

/** @return true if the scheme of this record has the span columns */
public boolean isLocatable() {
	return this.scheme.isLocatable();
	}

private ColumnValue getSpanValue(final String columnName) {
	if(!isLocatable()) {
		throw new NotLocatableException("scheme '"+this.scheme.getAnnotationSpec()+"' has no genomic span (missing '"+columnName+"')");
		}
	final ColumnValue v = get(columnName);
	if(v.isNull()) {
		throw new NotLocatableException("column '"+columnName+"' is null"+(this.lineNumber>0L?" on line "+this.lineNumber:""));
		}
	return v;
	}

private int getPosition(final String columnName) {
	final ColumnValue v = getSpanValue(columnName);
	switch(v.getKind()) {
		case INTEGER: return v.intValue();
		case STRING:
			try {
				return Integer.parseInt(v.stringValue());
				}
			catch(final NumberFormatException err) {
				throw new NotLocatableException("column '"+columnName+"' is not an integer: "+v.stringValue(), err);
				}
		default: throw new NotLocatableException("column '"+columnName+"' is not an integer: "+v);
		}
	}

@Override
public String getContig() {
	final ColumnValue v = getSpanValue(MafScheme.CHROMOSOME_COLUMN);
	return String.valueOf(v.getValue());
	}

/** @return the 1-based start position */
@Override
public int getStart() {
	return getPosition(MafScheme.START_COLUMN);
	}

/** @return the 1-based inclusive end position */
@Override
public int getEnd() {
	return getPosition(MafScheme.END_COLUMN);
	}

public Strand getStrand() {
	final String s = String.valueOf(getSpanValue(MafScheme.STRAND_COLUMN).getValue());
	if(s.equals("+")) return Strand.POSITIVE;
	if(s.equals("-")) return Strand.NEGATIVE;
	throw new NotLocatableException("unknown strand '"+s+"'");
	}

@Override
public int hashCode() {
	return System.identityHashCode(this.scheme)*31 + this.values.hashCode();
	}

@Override
public boolean equals(final Object obj) {
	if(obj==this) return true;
	if(obj==null || !(obj instanceof MafRecord)) return false;
	final MafRecord other = MafRecord.class.cast(obj);
	return this.scheme==other.scheme && this.values.equals(other.values);
	}

/** @return the line, without the end of line */
@Override
public String toString() {
	return String.join(COLUMN_SEPARATOR, encode());
	}
}
