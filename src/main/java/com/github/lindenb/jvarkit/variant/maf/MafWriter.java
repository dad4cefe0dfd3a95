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

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import htsjdk.samtools.util.BlockCompressedOutputStream;
import htsjdk.samtools.util.CloserUtil;
import htsjdk.samtools.util.RuntimeIOException;

/**
 * Writes a MAF file: the header pragmas, the column names and the records.
 * A path ending with '.gz' is compressed with BGZF.
 */
public class MafWriter implements Closeable {
private final Writer out;
private final MafScheme scheme;
private final MafHeader header;
private long count = 0L;

/**
 * @param os the output stream, closed by {@link #close()}
 * @param header the header
 * @param scheme the scheme of the records
 * @throws IOException on I/O error. The stream is closed if the header cannot be written.
 */
public MafWriter(final OutputStream os,final MafHeader header,final MafScheme scheme) throws IOException {
	this.out = new BufferedWriter(new OutputStreamWriter(Objects.requireNonNull(os, "output"), StandardCharsets.UTF_8));
	this.header = Objects.requireNonNull(header, "header");
	this.scheme = Objects.requireNonNull(scheme, "scheme");
	boolean ok = false;
	try {
		for(final String line: header.toLines()) {
			this.out.write(line);
			this.out.write('\n');
			}
		this.out.write(String.join(MafRecord.COLUMN_SEPARATOR, scheme.getColumnNames()));
		this.out.write('\n');
		// report a broken output now rather than on the first record
		this.out.flush();
		ok = true;
		}
	finally {
		if(!ok) CloserUtil.close(os);
		}
	}

public MafWriter(final Path path,final MafHeader header,final MafScheme scheme) throws IOException {
	this(openStream(path), header, scheme);
	}

/** write to a path with a header declaring the version and the annotation of the scheme */
public MafWriter(final Path path,final MafScheme scheme) throws IOException {
	this(path, MafHeader.of(scheme), scheme);
	}

private static OutputStream openStream(final Path path) throws IOException {
	final OutputStream os = Files.newOutputStream(path);
	if(path.getFileName().toString().endsWith(".gz")) {
		return new BlockCompressedOutputStream(os, path);
		}
	return os;
	}

public MafHeader getHeader() {
	return this.header;
	}

public MafScheme getScheme() {
	return this.scheme;
	}

/** @return the number of records written so far */
public long getCount() {
	return this.count;
	}

/**
 * write a record
 * @param rec the record
 * @throws IllegalArgumentException if the record has not the columns of the scheme of this writer
 */
public void write(final MafRecord rec) {
	if(rec.getScheme()!=this.scheme && !rec.getScheme().getColumnNames().equals(this.scheme.getColumnNames())) {
		throw new IllegalArgumentException("record with scheme "+rec.getScheme()+" cannot be written with scheme "+this.scheme);
		}
	try {
		this.out.write(rec.toString());
		this.out.write('\n');
		this.count++;
		}
	catch(final IOException err) {
		throw new RuntimeIOException(err);
		}
	}

@Override
public void close() {
	try {
		this.out.close();
		}
	catch (final IOException e) {
		throw new RuntimeIOException(e);
		}
	}
}
