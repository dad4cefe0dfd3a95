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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.Test;

import htsjdk.samtools.ValidationStringency;
import htsjdk.samtools.util.BinaryCodec;
import htsjdk.samtools.util.RuntimeEOFException;

public class MafRecordCodecTest {
	
	private static byte[] write(final MafRecordCodec codec,final List<MafRecord> records) {
		final ByteArrayOutputStream baos = new ByteArrayOutputStream();
		final BinaryCodec bc = new BinaryCodec(baos);
		codec.writeHeader(bc, records.size());
		for(final MafRecord rec:records) codec.encode(bc, rec);
		bc.close();
		return baos.toByteArray();
		}
	
	@Test
	public void testRoundTrip() {
		final List<String> tokens = MafTestUtils.tokens("TP53", "chr17", 100, 101, "TUMOR");
		tokens.set(5, "XXX");
		final MafRecord lenient = MafRecord.decode(MafTestUtils.scheme(), tokens, ValidationStringency.SILENT, 7L);
		final MafRecord ext = MafRecord.decode(
				MafTestUtils.resolver().resolve(MafTestUtils.TEST_SCHEME_ID+"-ext"),
				Arrays.asList("BRCA2","13","10","10","-","SNP","T1","N1","a;b"),
				ValidationStringency.STRICT);
		final List<MafRecord> records = Arrays.asList(MafTestUtils.record("TP53", "chr17", 100, 101), lenient, ext);
		
		final MafRecordCodec codec = new MafRecordCodec();
		final BinaryCodec bc = new BinaryCodec(new ByteArrayInputStream(write(codec, records)));
		Assert.assertEquals(codec.readHeader(bc, "test"), 3);
		for(final MafRecord expect:records) {
			final MafRecord rec = codec.decode(bc);
			Assert.assertEquals(rec, expect);
			Assert.assertEquals(rec.getLineNumber(), expect.getLineNumber());
			Assert.assertEquals(rec.getWarnings().size(), expect.getWarnings().size());
			}
		Assert.assertTrue(lenient.get("Variant_Type").isNull());
		}
	
	@Test(expectedExceptions=CorruptRunException.class)
	public void testBadMagic() {
		final byte[] array = write(new MafRecordCodec(), Arrays.asList(MafTestUtils.record("TP53", "chr17", 100, 101)));
		array[0] = 'X';
		new MafRecordCodec().readHeader(new BinaryCodec(new ByteArrayInputStream(array)), "test");
		}
	
	@Test(expectedExceptions=CorruptRunException.class)
	public void testUnknownScheme() {
		final byte[] array = write(new MafRecordCodec(), Arrays.asList(MafTestUtils.record("TP53", "chr17", 100, 101)));
		// this codec has never seen the scheme
		final MafRecordCodec codec = new MafRecordCodec();
		final BinaryCodec bc = new BinaryCodec(new ByteArrayInputStream(array));
		codec.readHeader(bc, "test");
		codec.decode(bc);
		}
	
	@Test(expectedExceptions=CorruptRunException.class)
	public void testBadNullFlag() {
		final MafRecordCodec codec = new MafRecordCodec();
		final byte[] array = write(codec, Arrays.asList(MafTestUtils.record("TP53", "chr17", 100, 101)));
		// magic + count + scheme index + line number + number of columns
		final int offset = MafRecordCodec.MAGIC.length + 4 + 4 + 8 + 4;
		Assert.assertEquals(array[offset], (byte)1);
		array[offset] = 5;
		final BinaryCodec bc = new BinaryCodec(new ByteArrayInputStream(array));
		codec.readHeader(bc, "test");
		codec.decode(bc);
		}
	
	@Test(expectedExceptions=RuntimeEOFException.class)
	public void testTruncated() {
		final MafRecordCodec codec = new MafRecordCodec();
		final byte[] array = write(codec, Arrays.asList(MafTestUtils.record("TP53", "chr17", 100, 101)));
		final BinaryCodec bc = new BinaryCodec(new ByteArrayInputStream(Arrays.copyOf(array, array.length-3)));
		codec.readHeader(bc, "test");
		codec.decode(bc);
		}
}
