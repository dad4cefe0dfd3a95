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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import htsjdk.samtools.util.BinaryCodec;

/**
 * Binary serialization of {@link MafRecord} in the temporary runs of {@link MafSorter}.
 * 
 * Schemes are not serialized: a codec keeps a table of the schemes it has seen
 * and records refer to the index of their scheme. A codec must only decode what
 * the same instance has encoded.
 * 
 * For each column a flag tells whether the value is null, so the placeholders
 * of a leniently decoded record survive the round trip.
 */
class MafRecordCodec {
static final byte[] MAGIC = new byte[] {'M','A','F','R','U','N',1};
private final List<MafScheme> schemes = new ArrayList<>();
private final Map<MafScheme,Integer> scheme2index = new IdentityHashMap<>();

private int schemeIndex(final MafScheme scheme) {
	Integer idx = this.scheme2index.get(scheme);
	if(idx==null) {
		idx = this.schemes.size();
		this.schemes.add(scheme);
		this.scheme2index.put(scheme, idx);
		}
	return idx.intValue();
	}

void writeHeader(final BinaryCodec bc,final int count) {
	bc.writeBytes(MAGIC);
	bc.writeInt(count);
	}

/** @return the number of records in the run */
int readHeader(final BinaryCodec bc,final String runName) {
	final byte[] magic = new byte[MAGIC.length];
	bc.readBytes(magic);
	if(!Arrays.equals(magic, MAGIC)) throw new CorruptRunException("bad magic in run "+runName);
	final int count = bc.readInt();
	if(count<0) throw new CorruptRunException("negative number of records ("+count+") in run "+runName);
	return count;
	}

private static void writeString(final BinaryCodec bc,final String s) {
	final byte[] array = s.getBytes(StandardCharsets.UTF_8);
	bc.writeInt(array.length);
	bc.writeBytes(array);
	}

private static String readString(final BinaryCodec bc) {
	final int len = bc.readInt();
	if(len<0) throw new CorruptRunException("negative string length "+len);
	final byte[] array = new byte[len];
	bc.readBytes(array);
	return new String(array, StandardCharsets.UTF_8);
	}

void encode(final BinaryCodec bc,final MafRecord rec) {
	final MafScheme scheme = rec.getScheme();
	bc.writeInt(schemeIndex(scheme));
	bc.writeLong(rec.getLineNumber());
	bc.writeInt(rec.size());
	for(int i=0;i< rec.size();i++) {
		final ColumnValue v = rec.get(i);
		if(v.isNull()) {
			bc.writeByte(0);
			}
		else
			{
			bc.writeByte(1);
			writeString(bc, scheme.getColumn(i).getType().encode(v));
			}
		}
	final List<MafValidationError> warnings = rec.getWarnings();
	bc.writeInt(warnings.size());
	for(final MafValidationError w:warnings) {
		bc.writeByte(w.getType().ordinal());
		bc.writeLong(w.getLineNumber());
		writeString(bc, w.getColumnName()==null?"":w.getColumnName());
		writeString(bc, w.getMessage());
		}
	}

MafRecord decode(final BinaryCodec bc) {
	final int schemeIdx = bc.readInt();
	if(schemeIdx<0 || schemeIdx>=this.schemes.size()) throw new CorruptRunException("bad scheme index "+schemeIdx);
	final MafScheme scheme = this.schemes.get(schemeIdx);
	final long lineNumber = bc.readLong();
	final int n = bc.readInt();
	if(n!=scheme.size()) throw new CorruptRunException("expected "+scheme.size()+" columns for scheme "+scheme+" but got "+n);
	final List<ColumnValue> values = new ArrayList<>(n);
	for(int i=0;i< n;i++) {
		final ColumnType type = scheme.getColumn(i).getType();
		final byte flag = bc.readByte();
		if(flag==0) {
			values.add(ColumnValue.nullOf(type.getKind()));
			}
		else if(flag==1) {
			final String token = readString(bc);
			try {
				values.add(type.decode(token));
				}
			catch(final ValueParseException err) {
				throw new CorruptRunException("cannot decode column '"+scheme.getColumn(i).getName()+"' from run: "+err.getMessage(), err);
				}
			}
		else
			{
			throw new CorruptRunException("bad null flag "+flag);
			}
		}
	final int nWarnings = bc.readInt();
	if(nWarnings<0) throw new CorruptRunException("negative number of warnings");
	final List<MafValidationError> warnings = new ArrayList<>(nWarnings);
	final MafValidationError.Type[] types = MafValidationError.Type.values();
	for(int i=0;i< nWarnings;i++) {
		final int t = bc.readByte();
		if(t<0 || t>=types.length) throw new CorruptRunException("bad warning type "+t);
		final long line = bc.readLong();
		final String col = readString(bc);
		final String msg = readString(bc);
		warnings.add(new MafValidationError(types[t], msg, line, col.isEmpty()?null:col));
		}
	return new MafRecord(scheme, values, lineNumber, warnings);
	}
}
