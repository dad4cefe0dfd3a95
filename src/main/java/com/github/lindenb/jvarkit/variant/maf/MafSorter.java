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

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;

import htsjdk.samtools.util.AbstractIterator;
import htsjdk.samtools.util.BinaryCodec;
import htsjdk.samtools.util.BlockCompressedInputStream;
import htsjdk.samtools.util.BlockCompressedOutputStream;
import htsjdk.samtools.util.CloseableIterator;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.RuntimeEOFException;
import htsjdk.samtools.util.RuntimeIOException;

/**
 * Sorts a stream of {@link MafRecord} that does not fit in memory.
 * 
 * The records are read by batches of <code>batchCapacity</code> records. Each full
 * batch is sorted and written as a temporary run; the runs are then merged.
 * The sort is stable: records that compare equal keep their input order.
 * 
 * The temporary files are removed when the returned iterator is closed, whether it was
 * exhausted or not. Use it in a <i>try-with-resources</i>:
 * <pre>
 * try(CloseableIterator&lt;MafRecord&gt; iter = new MafSorter().sort(records, SortOrder.coordinate())) {
 *    while(iter.hasNext()) {
 *       (...)
 *       }
 *    }
 * </pre>
 * @author Pierre Lindenbaum
 *
 */
public class MafSorter {
private static final Log LOG=Log.getInstance(MafSorter.class);
private Path tmpDirectory = MafDefaults.TMP_DIR;
private boolean compressRuns = MafDefaults.COMPRESS_SORT_RUNS;
private int batchCapacity = MafDefaults.SORT_BATCH_CAPACITY;

public MafSorter() {
	}

/** set the directory where a per-invocation temporary directory is created */
public MafSorter setTmpDirectory(final Path tmpDirectory) {
	this.tmpDirectory = Objects.requireNonNull(tmpDirectory, "tmp directory");
	return this;
	}

public Path getTmpDirectory() {
	return this.tmpDirectory;
	}

public MafSorter setCompressRuns(boolean compressRuns) {
	this.compressRuns = compressRuns;
	return this;
	}

public boolean isCompressRuns() {
	return this.compressRuns;
	}

public MafSorter setBatchCapacity(int batchCapacity) {
	if(batchCapacity<1) throw new IllegalArgumentException("batch capacity must be greater than 0 but got "+batchCapacity);
	this.batchCapacity = batchCapacity;
	return this;
	}

public int getBatchCapacity() {
	return this.batchCapacity;
	}

/** sort using the batch capacity of this sorter */
public CloseableIterator<MafRecord> sort(final Iterator<MafRecord> input,final SortOrder order) {
	return sort(input, order, this.batchCapacity);
	}

/**
 * sort the records. The input is fully consumed before this method returns.
 * @param input the records
 * @param order the sort order
 * @param batchCapacity maximum number of records kept in memory while reading
 * @return an iterator over the sorted records. Must be closed.
 * @throws IllegalArgumentException if batchCapacity &lt; 1
 * @throws SortOrderException if the order cannot compare the records
 * @throws SortIOException if the temporary runs cannot be written
 */
public CloseableIterator<MafRecord> sort(final Iterator<MafRecord> input,final SortOrder order,int batchCapacity) {
	if(batchCapacity<1) throw new IllegalArgumentException("batch capacity must be greater than 0 but got "+batchCapacity);
	Objects.requireNonNull(input, "input");
	Objects.requireNonNull(order, "order");
	if(!order.isSortable()) throw new SortOrderException("Sorting not supported for "+order.getName()+" order.");
	
	final Session session = new Session(order);
	try {
		final Set<MafScheme> seenSchemes = Collections.newSetFromMap(new IdentityHashMap<>());
		final List<SortEntry> batch = new ArrayList<>(Math.min(batchCapacity, 10_000));
		long seq = 0L;
		while(input.hasNext()) {
			final MafRecord rec = input.next();
			if(seenSchemes.add(rec.getScheme())) {
				order.validate(rec.getScheme());
				}
			batch.add(new SortEntry(seq++, rec));
			if(batch.size()>=batchCapacity) {
				session.spill(batch);
				batch.clear();
				}
			}
		session.addVirtualRun(batch);
		LOG.debug("sorting "+seq+" records with "+session.runs.size()+" run(s)");
		return session.merge();
		}
	catch(final RuntimeException err) {
		session.close();
		throw err;
		}
	}

/** a record and its input rank */
private static class SortEntry {
	final long seq;
	final MafRecord record;
	SortEntry(final long seq,final MafRecord record) {
		this.seq = seq;
		this.record = record;
		}
	}

private static abstract class Run implements Closeable {
	SortEntry head = null;
	/** @return the next entry or null */
	protected abstract SortEntry read();
	boolean advance() {
		this.head = read();
		return this.head!=null;
		}
	@Override
	public abstract void close();
	}

/** the last batch, never written */
private static class InMemoryRun extends Run {
	private final Iterator<SortEntry> iter;
	InMemoryRun(final List<SortEntry> entries) {
		this.iter = entries.iterator();
		}
	@Override
	protected SortEntry read() {
		return this.iter.hasNext()?this.iter.next():null;
		}
	@Override
	public void close() {
		}
	}

/** a batch written in a temporary file */
private class FileRun extends Run {
	private final Path path;
	private final MafRecordCodec codec;
	private final boolean compressed;
	private InputStream in = null;
	private BinaryCodec binaryCodec = null;
	private int remaining = -1;
	private boolean closed = false;
	
	FileRun(final Path path,final MafRecordCodec codec,boolean compressed) {
		this.path = path;
		this.codec = codec;
		this.compressed = compressed;
		}
	
	@Override
	protected SortEntry read() {
		if(this.closed) return null;
		try {
			if(this.in==null) {
				final InputStream is = new BufferedInputStream(Files.newInputStream(this.path));
				this.in = this.compressed ? new BlockCompressedInputStream(is) : is;
				this.binaryCodec = new BinaryCodec(this.in);
				this.remaining = this.codec.readHeader(this.binaryCodec, this.path.getFileName().toString());
				}
			if(this.remaining<=0) {
				if(this.in.read()!=-1) throw new CorruptRunException("trailing data at the end of run "+this.path.getFileName());
				close();
				return null;
				}
			this.remaining--;
			final long seq = this.binaryCodec.readLong();
			return new SortEntry(seq, this.codec.decode(this.binaryCodec));
			}
		catch(final RuntimeEOFException err) {
			throw new CorruptRunException("unexpected end of run "+this.path.getFileName(), err);
			}
		catch(final RuntimeIOException err) {
			throw new SortIOException("cannot read run "+this.path, err);
			}
		catch(final IOException err) {
			throw new SortIOException("cannot read run "+this.path, err);
			}
		}
	
	@Override
	public void close() {
		if(this.closed) return;
		this.closed = true;
		if(this.in!=null) {
			try {
				this.in.close();
				}
			catch(final IOException err) {
				LOG.warn(err, "cannot close "+this.path);
				}
			}
		try {
			Files.deleteIfExists(this.path);
			LOG.debug("deleted "+this.path);
			}
		catch(final IOException err) {
			LOG.warn(err, "cannot delete "+this.path);
			}
		}
	}

/** the state of one invocation of sort */
private class Session {
	final SortOrder order;
	final Comparator<SortEntry> entryComparator;
	final MafRecordCodec codec = new MafRecordCodec();
	final List<Run> runs = new ArrayList<>();
	Path directory = null;
	
	Session(final SortOrder order) {
		this.order = order;
		this.entryComparator = (A,B)->{
			final int i = order.compare(A.record, B.record);
			if(i!=0) return i;
			return Long.compare(A.seq, B.seq);
			};
		}
	
	void spill(final List<SortEntry> batch) {
		batch.sort(this.entryComparator);
		final boolean compress = MafSorter.this.compressRuns;
		try {
			if(this.directory==null) {
				this.directory = Files.createTempDirectory(MafSorter.this.tmpDirectory, "mafsort.");
				LOG.debug("created temporary directory "+this.directory);
				}
			final Path path = this.directory.resolve(String.format("run-%06d%s", this.runs.size()+1, compress?".bgz":".bin"));
			final FileRun run = new FileRun(path, this.codec, compress);
			// register before writing, so a partial file is deleted on failure
			this.runs.add(run);
			final OutputStream os = new BufferedOutputStream(Files.newOutputStream(path));
			try(BinaryCodec bc = new BinaryCodec(compress?new BlockCompressedOutputStream(os, path):os)) {
				this.codec.writeHeader(bc, batch.size());
				for(final SortEntry e:batch) {
					bc.writeLong(e.seq);
					this.codec.encode(bc, e.record);
					}
				}
			LOG.debug("spilled "+batch.size()+" records to "+path);
			}
		catch(final IOException err) {
			throw new SortIOException("cannot write temporary run in "+MafSorter.this.tmpDirectory, err);
			}
		catch(final RuntimeIOException err) {
			throw new SortIOException("cannot write temporary run in "+MafSorter.this.tmpDirectory, err);
			}
		}
	
	void addVirtualRun(final List<SortEntry> batch) {
		if(batch.isEmpty()) return;
		final List<SortEntry> copy = new ArrayList<>(batch);
		copy.sort(this.entryComparator);
		this.runs.add(new InMemoryRun(copy));
		}
	
	CloseableIterator<MafRecord> merge() {
		if(this.runs.size()>1) LOG.info("merging "+this.runs.size()+" runs");
		return new MergingIterator(this);
		}
	
	void close() {
		for(final Run r:this.runs) {
			r.close();
			}
		if(this.directory!=null) {
			try {
				Files.deleteIfExists(this.directory);
				}
			catch(final IOException err) {
				LOG.warn(err, "cannot delete "+this.directory);
				}
			this.directory = null;
			}
		}
	}

private static class MergingIterator extends AbstractIterator<MafRecord> implements CloseableIterator<MafRecord> {
	private final Session session;
	private final PriorityQueue<Run> queue;
	private boolean closed = false;
	
	MergingIterator(final Session session) {
		this.session = session;
		this.queue = new PriorityQueue<>(Math.max(1, session.runs.size()),
			(R1,R2)->session.entryComparator.compare(R1.head, R2.head)
			);
		for(final Run r:session.runs) {
			if(r.advance()) {
				this.queue.add(r);
				}
			else
				{
				r.close();
				}
			}
		}
	
	@Override
	protected MafRecord advance() {
		if(this.closed) return null;
		try {
			final Run run = this.queue.poll();
			if(run==null) {
				close();
				return null;
				}
			final SortEntry entry = run.head;
			if(run.advance()) {
				this.queue.add(run);
				}
			else
				{
				run.close();
				}
			return entry.record;
			}
		catch(final RuntimeException err) {
			close();
			throw err;
			}
		}
	
	@Override
	public void close() {
		if(this.closed) return;
		this.closed = true;
		this.queue.clear();
		this.session.close();
		}
	}
}
