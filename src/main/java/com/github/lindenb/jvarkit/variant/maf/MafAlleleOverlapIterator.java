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

import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * A {@link MafOverlapIterator} that only emits the groups containing a record of the
 * <b>first</b> stream. The records of the other streams are kept in the group if they have
 * the same <code>Reference_Allele</code> as the record of the first stream and if their
 * alternate alleles match according to an {@link AlleleOverlapType}.
 * 
 * The window of a group covers the records that were kept.
 * @author Pierre Lindenbaum
 *
 */
public class MafAlleleOverlapIterator extends MafOverlapIterator {
private final AlleleOverlapType overlapType;

public MafAlleleOverlapIterator(final List<? extends Iterator<MafRecord>> streams,final AlleleOverlapType overlapType) {
	this(streams, ChromosomeComparator.canonical(), overlapType);
	}

public MafAlleleOverlapIterator(final List<? extends Iterator<MafRecord>> streams,final Comparator<String> chromosomeComparator,final AlleleOverlapType overlapType) {
	this(streams, chromosomeComparator, false, overlapType);
	}

/**
 * @param streams the input streams. The records must have the allele columns.
 * @param chromosomeComparator order of the chromosomes in the streams
 * @param byBarcodes only group the records having the same tumor and normal barcodes
 * @param overlapType how the alternate alleles are compared
 */
public MafAlleleOverlapIterator(final List<? extends Iterator<MafRecord>> streams,final Comparator<String> chromosomeComparator,boolean byBarcodes,final AlleleOverlapType overlapType) {
	super(streams, chromosomeComparator, byBarcodes);
	this.overlapType = Objects.requireNonNull(overlapType, "overlap type");
	}

public AlleleOverlapType getAlleleOverlapType() {
	return this.overlapType;
	}

/** @return the reference allele of a record or null */
protected String getReferenceAllele(final MafRecord rec) {
	final ColumnValue v = rec.get(MafScheme.REFERENCE_ALLELE_COLUMN);
	return v.isNull()?null:String.valueOf(v.getValue());
	}

/** @return the alternate alleles of a record: the second tumor allele */
protected List<String> getAlternateAlleles(final MafRecord rec) {
	final ColumnValue v = rec.get(MafScheme.TUMOR_ALLELE2_COLUMN);
	if(v.isNull()) return Collections.emptyList();
	return Collections.singletonList(String.valueOf(v.getValue()));
	}

/** @return true if <code>other</code> has the alleles of <code>base</code> */
public boolean isAlleleMatch(final MafRecord base,final MafRecord other) {
	return Objects.equals(getReferenceAllele(base), getReferenceAllele(other)) &&
		this.overlapType.test(getAlternateAlleles(base), getAlternateAlleles(other));
	}

@Override
protected OverlapGroup advance() {
	for(;;) {
		final OverlapGroup group = super.advance();
		if(group==null) return null;
		final MafRecord base = group.get(0);
		if(base==null) continue;
		final MafRecord[] records = new MafRecord[group.getNumberOfStreams()];
		records[0] = base;
		int start = base.getStart();
		int end = Math.max(start, base.getEnd());
		for(int i=1;i< records.length;i++) {
			final MafRecord rec = group.get(i);
			if(rec==null || !isAlleleMatch(base, rec)) continue;
			records[i] = rec;
			start = Math.min(start, rec.getStart());
			end = Math.max(end, Math.max(rec.getStart(), rec.getEnd()));
			}
		return new OverlapGroup(group.getContig(), start, end, records);
		}
	}
}
