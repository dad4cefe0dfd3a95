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
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A sort order of {@link MafRecord}: an ordered list of {@link SortKey}.
 * 
 * Null values always sort after the non-null values, whatever the direction.
 * Comparing two records fails with a {@link SortOrderException} if a key
 * refers to a column absent from the scheme of a record.
 * 
 * The named orders are the one found in the <code>#sort.order</code> header pragma:
 * <code>Coordinate</code>, <code>BarcodesAndCoordinate</code>, <code>Unsorted</code>
 * and <code>Unknown</code>. The two last ones cannot compare records.
 * @author Pierre Lindenbaum
 *
 */
public class SortOrder implements Comparator<MafRecord> {
public static final String COORDINATE = "Coordinate";
public static final String BARCODES_AND_COORDINATE = "BarcodesAndCoordinate";
public static final String UNSORTED = "Unsorted";
public static final String UNKNOWN = "Unknown";

public static enum Direction { ASC, DESC }

public static enum ComparatorKind { LEXICAL, NUMERIC, CHROMOSOME }

/** one column of a sort order */
public static class SortKey {
	private final String column;
	private final Direction direction;
	private final ComparatorKind comparatorKind;
	
	public SortKey(final String column,final Direction direction,final ComparatorKind comparatorKind) {
		this.column = Objects.requireNonNull(column, "column");
		this.direction = Objects.requireNonNull(direction, "direction");
		this.comparatorKind = Objects.requireNonNull(comparatorKind, "kind");
		}
	
	public SortKey(final String column,final ComparatorKind comparatorKind) {
		this(column, Direction.ASC, comparatorKind);
		}
	
	public String getColumn() {
		return this.column;
		}
	
	public Direction getDirection() {
		return this.direction;
		}
	
	public ComparatorKind getComparatorKind() {
		return this.comparatorKind;
		}
	
	@Override
	public String toString() {
		return this.column+":"+this.comparatorKind.name()+":"+this.direction.name();
		}
	}

private final String name;
private final List<SortKey> keys;
private final boolean sortable;
private final Comparator<String> chromosomeComparator;

/**
 * @param name name of this order
 * @param keys the keys, compared in order
 * @param chromosomeComparator used by the {@link ComparatorKind#CHROMOSOME} keys
 */
public SortOrder(final String name,final List<SortKey> keys,final Comparator<String> chromosomeComparator) {
	this(name, keys, chromosomeComparator, true);
	}

public SortOrder(final String name,final List<SortKey> keys) {
	this(name, keys, ChromosomeComparator.canonical());
	}

private SortOrder(final String name,final List<SortKey> keys,final Comparator<String> chromosomeComparator,boolean sortable) {
	this.name = Objects.requireNonNull(name, "name");
	this.keys = Collections.unmodifiableList(new ArrayList<>(keys));
	this.chromosomeComparator = Objects.requireNonNull(chromosomeComparator, "chromosome comparator");
	this.sortable = sortable;
	if(sortable && this.keys.isEmpty()) throw new IllegalArgumentException("no sort key in "+name);
	}

private static List<SortKey> coordinateKeys() {
	return Arrays.asList(
		new SortKey(MafScheme.CHROMOSOME_COLUMN, ComparatorKind.CHROMOSOME),
		new SortKey(MafScheme.START_COLUMN, ComparatorKind.NUMERIC),
		new SortKey(MafScheme.END_COLUMN, ComparatorKind.NUMERIC)
		);
	}

/** @return chromosome, start, end using the canonical chromosome order */
public static SortOrder coordinate() {
	return coordinate(ChromosomeComparator.canonical());
	}

public static SortOrder coordinate(final Comparator<String> chromosomeComparator) {
	return new SortOrder(COORDINATE, coordinateKeys(), chromosomeComparator);
	}

/** @return tumor barcode, normal barcode, chromosome, start, end */
public static SortOrder barcodesAndCoordinate() {
	return barcodesAndCoordinate(ChromosomeComparator.canonical());
	}

public static SortOrder barcodesAndCoordinate(final Comparator<String> chromosomeComparator) {
	final List<SortKey> L = new ArrayList<>();
	L.add(new SortKey(MafScheme.TUMOR_BARCODE_COLUMN, ComparatorKind.LEXICAL));
	L.add(new SortKey(MafScheme.NORMAL_BARCODE_COLUMN, ComparatorKind.LEXICAL));
	L.addAll(coordinateKeys());
	return new SortOrder(BARCODES_AND_COORDINATE, L, chromosomeComparator);
	}

public static SortOrder unsorted() {
	return new SortOrder(UNSORTED, Collections.emptyList(), ChromosomeComparator.canonical(), false);
	}

public static SortOrder unknown() {
	return new SortOrder(UNKNOWN, Collections.emptyList(), ChromosomeComparator.canonical(), false);
	}

/** @return the names of the named orders */
public static List<String> getNames() {
	return Arrays.asList(UNKNOWN, UNSORTED, BARCODES_AND_COORDINATE, COORDINATE);
	}

public static SortOrder find(final String name) {
	return find(name, ChromosomeComparator.canonical());
	}

/**
 * @param name the name of a named order
 * @param chromosomeComparator used by the coordinate keys
 * @return the sort order
 * @throws SortOrderException if there is no such order
 */
public static SortOrder find(final String name,final Comparator<String> chromosomeComparator) {
	switch(name) {
		case COORDINATE: return coordinate(chromosomeComparator);
		case BARCODES_AND_COORDINATE: return barcodesAndCoordinate(chromosomeComparator);
		case UNSORTED: return unsorted();
		case UNKNOWN: return unknown();
		default: throw new SortOrderException("Could not find sort order '"+name+"', options: "+String.join(", ", getNames()));
		}
	}

public String getName() {
	return this.name;
	}

public List<SortKey> getSortKeys() {
	return this.keys;
	}

/** @return false for the <code>Unsorted</code> and <code>Unknown</code> orders */
public boolean isSortable() {
	return this.sortable;
	}

public Comparator<String> getChromosomeComparator() {
	return this.chromosomeComparator;
	}

/**
 * check that this order can compare the records of a scheme
 * @param scheme the scheme
 * @throws SortOrderException if this order cannot sort, or if a column is missing
 */
public void validate(final MafScheme scheme) {
	if(!isSortable()) throw new SortOrderException("Sorting not supported for "+getName()+" order.");
	for(final SortKey key:this.keys) {
		if(!scheme.hasColumn(key.getColumn())) {
			throw new SortOrderException("sort order '"+getName()+"' requires column '"+key.getColumn()+"' that is not in scheme '"+scheme.getAnnotationSpec()+"'");
			}
		}
	}

private ColumnValue getValue(final MafRecord rec,final SortKey key) {
	final MafScheme scheme = rec.getScheme();
	final int idx = scheme.getColumnIndex(key.getColumn());
	if(idx<0) {
		throw new SortOrderException("sort order '"+getName()+"' requires column '"+key.getColumn()+"' that is not in scheme '"+scheme.getAnnotationSpec()+"'"+
			(rec.getLineNumber()>0L?" (line "+rec.getLineNumber()+")":""));
		}
	return rec.get(idx);
	}

private static String asString(final MafRecord rec,final int idx,final ColumnValue v) {
	if(v.getKind().equals(ColumnValue.Kind.STRING) || v.getKind().equals(ColumnValue.Kind.ENUM)) return v.stringValue();
	return rec.getScheme().getColumn(idx).getType().encode(v);
	}

private static double asDouble(final SortKey key,final ColumnValue v) {
	switch(v.getKind()) {
		case INTEGER:
		case FLOAT: return v.numberValue().doubleValue();
		case STRING:
			try {
				return Double.parseDouble(v.stringValue());
				}
			catch(final NumberFormatException err) {
				throw new SortOrderException("column '"+key.getColumn()+"': cannot compare '"+v.stringValue()+"' as a number", err);
				}
		default: throw new SortOrderException("column '"+key.getColumn()+"': cannot compare a "+v.getKind().name()+" as a number");
		}
	}

private int compareValues(final SortKey key,final MafRecord r1,final ColumnValue v1,final MafRecord r2,final ColumnValue v2) {
	final int idx1 = r1.getScheme().getColumnIndex(key.getColumn());
	final int idx2 = r2.getScheme().getColumnIndex(key.getColumn());
	switch(key.getComparatorKind()) {
		case NUMERIC:
			if(v1.getKind().equals(ColumnValue.Kind.INTEGER) && v2.getKind().equals(ColumnValue.Kind.INTEGER)) {
				return Integer.compare(v1.intValue(), v2.intValue());
				}
			return Double.compare(asDouble(key,v1), asDouble(key,v2));
		case CHROMOSOME:
			return this.chromosomeComparator.compare(asString(r1,idx1,v1), asString(r2,idx2,v2));
		case LEXICAL:
		default:
			return asString(r1,idx1,v1).compareTo(asString(r2,idx2,v2));
		}
	}

/**
 * compare two records
 * @throws SortOrderException if this order cannot sort, or if a column is missing
 */
@Override
public int compare(final MafRecord r1,final MafRecord r2) {
	if(!isSortable()) throw new SortOrderException("Sorting not supported for "+getName()+" order.");
	for(final SortKey key:this.keys) {
		final ColumnValue v1 = getValue(r1, key);
		final ColumnValue v2 = getValue(r2, key);
		final boolean null1 = v1.isNull();
		final boolean null2 = v2.isNull();
		if(null1 || null2) {
			if(null1 && null2) continue;
			return null1 ? 1 : -1;
			}
		int i = compareValues(key, r1, v1, r2, v2);
		if(i!=0) {
			return key.getDirection().equals(Direction.DESC)? -i : i;
			}
		}
	return 0;
	}

@Override
public String toString() {
	if(!isSortable()) return getName();
	return getName()+"("+this.keys.stream().map(K->K.toString()).collect(Collectors.joining(", "))+")";
	}
}
