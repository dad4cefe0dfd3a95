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
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;

import htsjdk.samtools.util.AbstractIterator;
import htsjdk.samtools.util.CloseableIterator;
import htsjdk.samtools.util.CloserUtil;
import htsjdk.samtools.util.Log;

/**
 * Iterates jointly over several streams of records sorted by coordinate, and
 * emits the groups of overlapping records.
 * 
 * Two records overlap if they are on the same chromosome and their inclusive
 * intervals intersect: <code>[10,20]</code> and <code>[20,30]</code> overlap.
 * A group contains at most one record per stream; the window of a group grows
 * with each record added, so a record may join a group because it overlaps
 * another member, not the first one. For example, with
 * <pre>
 * stream#0: chr1:10-20
 * stream#1: chr1:15-25 chr1:30-40
 * </pre>
 * the groups are <code>{0:chr1:10-20, 1:chr1:15-25}</code> then <code>{1:chr1:30-40}</code>.
 * 
 * Each stream must be sorted on the chromosome (see {@link ChromosomeComparator}) and
 * the start position; an {@link OverlapOrderException} is thrown otherwise.
 * With <code>byBarcodes</code>, streams must be sorted on the tumor and
 * normal barcodes first and only records of the same samples can overlap.
 * @author Pierre Lindenbaum
 *
 */
public class MafOverlapIterator extends AbstractIterator<OverlapGroup> implements CloseableIterator<OverlapGroup> {
private static final Log LOG=Log.getInstance(MafOverlapIterator.class);
private final List<Iterator<MafRecord>> streams;
private final Comparator<String> chromosomeComparator;
private final boolean byBarcodes;
private final Head[] previous;
private final PriorityQueue<Head> queue;
private long groupCount = 0L;

/** the current record of a stream */
private static class Head {
	final int streamIndex;
	final MafRecord record;
	final String contig;
	final int start;
	final int end;
	final String tumorBarcode;
	final String normalBarcode;
	Head(int streamIndex,final MafRecord record,boolean byBarcodes) {
		this.streamIndex = streamIndex;
		this.record = record;
		this.contig = record.getContig();
		this.start = record.getStart();
		this.end = Math.max(this.start, record.getEnd());
		this.tumorBarcode = byBarcodes ? barcode(record, MafScheme.TUMOR_BARCODE_COLUMN) : null;
		this.normalBarcode = byBarcodes ? barcode(record, MafScheme.NORMAL_BARCODE_COLUMN) : null;
		}
	private static String barcode(final MafRecord rec,final String column) {
		final ColumnValue v = rec.get(column);
		return v.isNull()?"":String.valueOf(v.getValue());
		}
	@Override
	public String toString() {
		return (this.tumorBarcode==null?"":this.tumorBarcode+"/"+this.normalBarcode+" ")+
				this.contig+":"+this.start+"-"+this.end;
		}
	}

public MafOverlapIterator(final List<? extends Iterator<MafRecord>> streams) {
	this(streams, ChromosomeComparator.canonical());
	}

public MafOverlapIterator(final List<? extends Iterator<MafRecord>> streams,final Comparator<String> chromosomeComparator) {
	this(streams, chromosomeComparator, false);
	}

/**
 * @param streams the input streams, closed by {@link #close()} if they are closeable
 * @param chromosomeComparator order of the chromosomes in the streams
 * @param byBarcodes only group the records having the same tumor and normal barcodes
 */
public MafOverlapIterator(final List<? extends Iterator<MafRecord>> streams,final Comparator<String> chromosomeComparator,boolean byBarcodes) {
	Objects.requireNonNull(streams, "streams");
	if(streams.isEmpty()) throw new IllegalArgumentException("no input stream");
	this.streams = new ArrayList<>(streams);
	this.chromosomeComparator = Objects.requireNonNull(chromosomeComparator, "chromosome comparator");
	this.byBarcodes = byBarcodes;
	this.previous = new Head[streams.size()];
	this.queue = new PriorityQueue<>(streams.size(), this::compareHeads);
	for(int i=0;i< this.streams.size();i++) {
		fetch(i);
		}
	}

public int getNumberOfStreams() {
	return this.streams.size();
	}

public boolean isByBarcodes() {
	return this.byBarcodes;
	}

private int comparePartition(final Head h1,final Head h2) {
	if(this.byBarcodes) {
		int i = h1.tumorBarcode.compareTo(h2.tumorBarcode);
		if(i!=0) return i;
		i = h1.normalBarcode.compareTo(h2.normalBarcode);
		if(i!=0) return i;
		}
	return this.chromosomeComparator.compare(h1.contig, h2.contig);
	}

private int compareHeads(final Head h1,final Head h2) {
	int i = comparePartition(h1, h2);
	if(i!=0) return i;
	i = Integer.compare(h1.start, h2.start);
	if(i!=0) return i;
	i = Integer.compare(h1.end, h2.end);
	if(i!=0) return i;
	return Integer.compare(h1.streamIndex, h2.streamIndex);
	}

/** read the next record of a stream and check its order */
private void fetch(int streamIndex) {
	final Iterator<MafRecord> iter = this.streams.get(streamIndex);
	if(!iter.hasNext()) {
		this.previous[streamIndex] = null;
		return;
		}
	final Head head = new Head(streamIndex, iter.next(), this.byBarcodes);
	final Head prev = this.previous[streamIndex];
	if(prev!=null) {
		final int i = comparePartition(prev, head);
		if(i>0 || (i==0 && prev.start > head.start)) {
			final long line = head.record.getLineNumber();
			throw new OverlapOrderException("Stream #"+streamIndex+" is not sorted: record "+
				(line>0L?"on line "+line+" ":"")+"("+head+") comes after ("+prev+")");
			}
		}
	this.previous[streamIndex] = head;
	this.queue.add(head);
	}

@Override
protected OverlapGroup advance() {
	final Head first = this.queue.poll();
	if(first==null) return null;
	final List<Head> members = new ArrayList<>(this.streams.size());
	members.add(first);
	int windowEnd = first.end;
	// heads are sorted on start: stop at the first one after the window
	while(!this.queue.isEmpty()) {
		final Head h = this.queue.peek();
		if(comparePartition(first, h)!=0 || h.start > windowEnd) break;
		this.queue.poll();
		members.add(h);
		windowEnd = Math.max(windowEnd, h.end);
		}
	final MafRecord[] records = new MafRecord[this.streams.size()];
	for(final Head h:members) {
		records[h.streamIndex] = h.record;
		}
	for(final Head h:members) {
		fetch(h.streamIndex);
		}
	this.groupCount++;
	return new OverlapGroup(first.contig, first.start, windowEnd, records);
	}

@Override
public void close() {
	LOG.debug("closing after "+this.groupCount+" group(s)");
	for(final Iterator<MafRecord> iter:this.streams) {
		CloserUtil.close(iter);
		}
	}
}
