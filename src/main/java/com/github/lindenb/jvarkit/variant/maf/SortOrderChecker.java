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

import java.util.Iterator;
import java.util.Objects;

import htsjdk.samtools.util.AbstractIterator;
import htsjdk.samtools.util.CloseableIterator;
import htsjdk.samtools.util.CloserUtil;

/**
 * Wraps an iterator of records and checks that the records are emitted in a given sort order.
 * Fails with a {@link MafFormatException} at the first record out of order.
 */
public class SortOrderChecker extends AbstractIterator<MafRecord> implements CloseableIterator<MafRecord> {
private final Iterator<MafRecord> delegate;
private final SortOrder sortOrder;
private MafRecord previous = null;
private long count = 0L;

public SortOrderChecker(final Iterator<MafRecord> delegate,final SortOrder sortOrder) {
	this.delegate = Objects.requireNonNull(delegate, "delegate");
	this.sortOrder = Objects.requireNonNull(sortOrder, "sort order");
	if(!sortOrder.isSortable()) throw new SortOrderException("Cannot check sort order "+sortOrder.getName());
	}

public SortOrder getSortOrder() {
	return this.sortOrder;
	}

@Override
protected MafRecord advance() {
	if(!this.delegate.hasNext()) return null;
	final MafRecord rec = this.delegate.next();
	this.count++;
	if(this.previous!=null && this.sortOrder.compare(this.previous, rec) > 0) {
		final long line = rec.getLineNumber();
		throw new MafFormatException("Record "+(line>0L?"on line "+line:"#"+this.count)+" is out of order for sort order '"+
			this.sortOrder.getName()+"': got\n  "+rec+"\nafter\n  "+this.previous);
		}
	this.previous = rec;
	return rec;
	}

@Override
public void close() {
	CloserUtil.close(this.delegate);
	}
}
