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

import htsjdk.samtools.util.Locatable;

/**
 * A group of overlapping records emitted by {@link MafOverlapIterator}: at most one
 * record per input stream. A stream with no overlapping record is absent from the group.
 * 
 * The group itself is located on the window covering all its records.
 */
public final class OverlapGroup implements Locatable {
private final String contig;
private final int start;
private final int end;
private final MafRecord[] records;

OverlapGroup(final String contig,int start,int end,final MafRecord[] records) {
	this.contig = contig;
	this.start = start;
	this.end = end;
	this.records = records;
	}

@Override
public String getContig() {
	return this.contig;
	}

@Override
public int getStart() {
	return this.start;
	}

@Override
public int getEnd() {
	return this.end;
	}

/** @return the number of input streams of the iterator */
public int getNumberOfStreams() {
	return this.records.length;
	}

/**
 * @param streamIndex 0-based index of the input stream
 * @return the record of this stream, or null if the stream is absent from this group
 */
public MafRecord get(int streamIndex) {
	return this.records[streamIndex];
	}

public boolean contains(int streamIndex) {
	return streamIndex>=0 && streamIndex< this.records.length && this.records[streamIndex]!=null;
	}

/** @return the indexes of the streams present in this group */
public List<Integer> getStreamIndexes() {
	final List<Integer> L = new ArrayList<>(this.records.length);
	for(int i=0;i< this.records.length;i++) {
		if(this.records[i]!=null) L.add(i);
		}
	return Collections.unmodifiableList(L);
	}

/** @return the records of this group, in stream order */
public List<MafRecord> getRecords() {
	final List<MafRecord> L = new ArrayList<>(this.records.length);
	for(int i=0;i< this.records.length;i++) {
		if(this.records[i]!=null) L.add(this.records[i]);
		}
	return Collections.unmodifiableList(L);
	}

/** @return the number of streams present in this group */
public int size() {
	int n=0;
	for(int i=0;i< this.records.length;i++) {
		if(this.records[i]!=null) n++;
		}
	return n;
	}

@Override
public String toString() {
	return getContig()+":"+getStart()+"-"+getEnd()+" streams:"+getStreamIndexes();
	}
}
