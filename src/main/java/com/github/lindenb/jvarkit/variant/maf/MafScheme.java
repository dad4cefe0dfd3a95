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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A resolved scheme: the effective, ordered list of typed columns of a MAF file
 * after inheritance and filtering. A scheme is immutable and is compared by identity.
 * 
 * Schemes are obtained from a {@link SchemeResolver}.
 * @author Pierre Lindenbaum
 *
 */
public final class MafScheme {
public static final String CHROMOSOME_COLUMN = "Chromosome";
public static final String START_COLUMN = "Start_Position";
public static final String END_COLUMN = "End_Position";
public static final String STRAND_COLUMN = "Strand";
public static final String TUMOR_BARCODE_COLUMN = "Tumor_Sample_Barcode";
public static final String NORMAL_BARCODE_COLUMN = "Matched_Norm_Sample_Barcode";
public static final String REFERENCE_ALLELE_COLUMN = "Reference_Allele";
public static final String TUMOR_ALLELE2_COLUMN = "Tumor_Seq_Allele2";

public static final String NO_RESTRICTIONS_VERSION = "no-version";
public static final String NO_RESTRICTIONS_ANNOTATION = "no-annotation-specification";

private final String version;
private final String annotationSpec;
private final String parentId;
private final List<MafColumn> columns;
private final Map<String,MafColumn> name2column;
private final boolean locatable;

MafScheme(final String version,final String annotationSpec,final String parentId,final List<MafColumn> columns) {
	this.version = version;
	this.annotationSpec = annotationSpec;
	this.parentId = parentId;
	this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
	this.name2column = new HashMap<>(columns.size());
	for(int i=0;i< this.columns.size();i++) {
		final MafColumn c = this.columns.get(i);
		if(c.getIndex()!=i) throw new IllegalStateException("bad index for "+c);
		if(this.name2column.put(c.getName(), c)!=null) {
			throw new SchemeResolutionException("duplicate column "+c.getName()+" in scheme "+annotationSpec);
			}
		}
	this.locatable = this.name2column.containsKey(CHROMOSOME_COLUMN) &&
			this.name2column.containsKey(START_COLUMN) &&
			this.name2column.containsKey(END_COLUMN) &&
			this.name2column.containsKey(STRAND_COLUMN);
	}

/**
 * create a scheme with no restriction on the values: every column is a <code>NullableStringColumn</code>
 * @param columnNames the names of the columns
 * @return the new scheme
 */
public static MafScheme noRestrictions(final List<String> columnNames) {
	final ColumnType type = ColumnTypeRegistry.getDefault().getColumnType("NullableStringColumn");
	final List<MafColumn> L = new ArrayList<>(columnNames.size());
	for(int i=0;i< columnNames.size();i++) {
		L.add(new MafColumn(i, columnNames.get(i), type, ""));
		}
	return new MafScheme(NO_RESTRICTIONS_VERSION, NO_RESTRICTIONS_ANNOTATION, null, L);
	}

public String getVersion() {
	return this.version;
	}

public String getAnnotationSpec() {
	return this.annotationSpec;
	}

/** @return the annotation-spec of the parent scheme or null */
public String getParentId() {
	return this.parentId;
	}

/** @return true if the version is the annotation specification */
public boolean isBasic() {
	return this.version.equals(this.annotationSpec);
	}

/** @return true if the scheme declares the chromosome, start, end and strand columns */
public boolean isLocatable() {
	return this.locatable;
	}

public List<MafColumn> getColumns() {
	return this.columns;
	}

public List<String> getColumnNames() {
	return this.columns.stream().map(C->C.getName()).collect(Collectors.toList());
	}

public int size() {
	return this.columns.size();
	}

public boolean hasColumn(final String name) {
	return this.name2column.containsKey(name);
	}

/** @return the 0-based index of the column or -1 */
public int getColumnIndex(final String name) {
	final MafColumn c = this.name2column.get(name);
	return c==null?-1:c.getIndex();
	}

/**
 * @param name the column name
 * @return the column
 * @throws UnknownColumnException if the scheme has no such column
 */
public MafColumn getColumn(final String name) {
	final MafColumn c = this.name2column.get(name);
	if(c==null) throw new UnknownColumnException("no column '"+name+"' in scheme "+this.annotationSpec);
	return c;
	}

public MafColumn getColumn(int index) {
	return this.columns.get(index);
	}

@Override
public String toString() {
	return this.annotationSpec;
	}
}
