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
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.zip.GZIPInputStream;

import htsjdk.samtools.ValidationStringency;
import htsjdk.samtools.util.AbstractIterator;
import htsjdk.samtools.util.CloseableIterator;
import htsjdk.samtools.util.CloserUtil;
import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.RuntimeIOException;

/**
 * Reads a MAF file: the header pragmas, the column names and the records.
 * 
 * The scheme is selected from the <code>#annotation.spec</code> and <code>#version</code>
 * pragmas. If no known scheme matches, the file is read with the 'no restrictions'
 * scheme where all the columns are nullable strings.
 * 
 * If the header declares a <code>#sort.order</code>, the order of the records is checked.
 * <pre>
 * try(MafIterator iter = MafIterator.open(Paths.get("input.maf.gz"))) {
 *    while(iter.hasNext()) {
 *       final MafRecord rec = iter.next();
 *       }
 *    }
 * </pre>
 * @author Pierre Lindenbaum
 *
 */
public class MafIterator extends AbstractIterator<MafRecord> implements CloseableIterator<MafRecord> {
private static final Log LOG=Log.getInstance(MafIterator.class);
private final BufferedReader reader;
private final MafHeader header;
private final MafScheme scheme;
private final List<String> columnNames;
private final ValidationStringency stringency;
private final Iterator<MafRecord> delegate;
private final List<MafValidationError> headerWarnings = new ArrayList<>();
private long lineNumber = 0L;

MafIterator(final BufferedReader reader,final SchemeResolver resolver,final ValidationStringency stringency) throws IOException {
	this.reader = Objects.requireNonNull(reader, "reader");
	this.stringency = Objects.requireNonNull(stringency, "stringency");
	final List<String> headerLines = new ArrayList<>();
	String line;
	for(;;) {
		line = this.reader.readLine();
		if(line==null || !line.startsWith(MafHeader.START_SYMBOL)) break;
		this.lineNumber++;
		headerLines.add(line);
		}
	this.header = MafHeader.parse(headerLines);
	if(line==null) throw new MafFormatException("Found no column names after line "+this.lineNumber);
	this.lineNumber++;
	this.columnNames = Collections.unmodifiableList(Arrays.asList(line.split(MafRecord.COLUMN_SEPARATOR, -1)));
	this.scheme = selectScheme(Objects.requireNonNull(resolver, "resolver"));
	checkColumnNames();
	
	final Iterator<MafRecord> decoder = new LineDecoder();
	final String sortOrderName = this.header.getSortOrderName();
	if(sortOrderName!=null && !SortOrder.getNames().contains(sortOrderName)) {
		addHeaderWarning(MafValidationError.Type.HEADER_UNSUPPORTED_SORT_ORDER,
			"Unsupported sort order '"+sortOrderName+"', the order of the records is not checked. Options: "+String.join(", ", SortOrder.getNames()));
		}
	final SortOrder sortOrder = this.header.getSortOrder();
	if(sortOrder.isSortable()) {
		sortOrder.validate(this.scheme);
		this.delegate = new SortOrderChecker(decoder, sortOrder);
		}
	else
		{
		this.delegate = decoder;
		}
	}

/** 
 * open a MafIterator from an InputStream, plain or gzipped
 * @param in the input stream
 * @return the new MafIterator
 * @throws IOException on I/O error
 */
public static MafIterator open(final InputStream in) throws IOException {
	return open(in, SchemeResolver.builtIn(), MafDefaults.VALIDATION_STRINGENCY);
	}

public static MafIterator open(final InputStream in,final SchemeResolver resolver,final ValidationStringency stringency) throws IOException {
	InputStream is = new BufferedInputStream(in);
	if(IOUtil.isGZIPInputStream(is)) {
		is = new GZIPInputStream(is);
		}
	return create(new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8)), resolver, stringency);
	}

/** close the reader if the header cannot be read */
private static MafIterator create(final BufferedReader reader,final SchemeResolver resolver,final ValidationStringency stringency) throws IOException {
	try {
		return new MafIterator(reader, resolver, stringency);
		}
	catch(final IOException|RuntimeException err) {
		CloserUtil.close(reader);
		throw err;
		}
	}

/** open a MafIterator from a path. Files ending with '.gz' are uncompressed.
 * 
 * @param path the path
 * @throws IOException on I/O error
 * @return the new MafIterator
 */
public static MafIterator open(final Path path) throws IOException {
	return open(path, SchemeResolver.builtIn(), MafDefaults.VALIDATION_STRINGENCY);
	}

public static MafIterator open(final Path path,final SchemeResolver resolver,final ValidationStringency stringency) throws IOException {
	IOUtil.assertFileIsReadable(path);
	return create(IOUtil.openFileForBufferedReading(path), resolver, stringency);
	}

private MafScheme selectScheme(final SchemeResolver resolver) {
	final String version = this.header.getVersion();
	final String annotation = this.header.getAnnotationSpec();
	MafScheme s = null;
	if(version!=null || annotation!=null) {
		s = resolver.find(version, annotation);
		}
	if(s==null) {
		addHeaderWarning(MafValidationError.Type.HEADER_UNSUPPORTED_ANNOTATION_SPEC,
			"No matching scheme was found in the header (version: "+version+", annotation: "+annotation+
			"), defaulting to the least restrictive scheme.");
		s = MafScheme.noRestrictions(this.columnNames);
		}
	else
		{
		LOG.debug("using scheme "+s);
		}
	return s;
	}

private void addHeaderWarning(final MafValidationError.Type type,final String message) {
	if(!this.stringency.equals(ValidationStringency.SILENT)) {
		LOG.warn(message);
		}
	this.headerWarnings.add(new MafValidationError(type, message, -1L, null));
	}

private void checkColumnNames() {
	final List<String> expect = this.scheme.getColumnNames();
	if(expect.size()!=this.columnNames.size()) {
		throw new MafFormatException("line "+this.lineNumber+": Found "+this.columnNames.size()+
			" columns but expected "+expect.size()+" for scheme "+this.scheme);
		}
	for(int i=0;i< expect.size();i++) {
		if(!expect.get(i).equals(this.columnNames.get(i))) {
			throw new MafFormatException("line "+this.lineNumber+": Found column with name '"+this.columnNames.get(i)+
				"' but expected '"+expect.get(i)+"' for the "+(i+1)+"th column");
			}
		}
	}

public MafHeader getHeader() {
	return this.header;
	}

/** @return the problems found in the header that did not stop the reading */
public List<MafValidationError> getHeaderWarnings() {
	return Collections.unmodifiableList(this.headerWarnings);
	}

/** @return the scheme used to decode the records */
public MafScheme getScheme() {
	return this.scheme;
	}

/** @return the column names as found in the file */
public List<String> getColumnNames() {
	return this.columnNames;
	}

public ValidationStringency getValidationStringency() {
	return this.stringency;
	}

/** decodes the remaining lines */
private class LineDecoder extends AbstractIterator<MafRecord> {
	@Override
	protected MafRecord advance() {
		try {
			for(;;) {
				final String line = MafIterator.this.reader.readLine();
				if(line==null) return null;
				MafIterator.this.lineNumber++;
				if(line.isEmpty()) continue;
				return MafRecord.decode(
					MafIterator.this.scheme,
					Arrays.asList(line.split(MafRecord.COLUMN_SEPARATOR, -1)),
					MafIterator.this.stringency,
					MafIterator.this.lineNumber
					);
				}
			}
		catch (final IOException e) {
			LOG.error(e, "Cannot advance");
			throw new RuntimeIOException(e);
			}
		}
	}

@Override
protected MafRecord advance() {
	return this.delegate.hasNext() ? this.delegate.next() : null;
	}

@Override
public void close() {
	CloserUtil.close(this.reader);
	}
}
