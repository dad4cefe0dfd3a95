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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import htsjdk.samtools.SAMSequenceDictionary;
import htsjdk.samtools.SAMSequenceRecord;

public class ChromosomeComparatorTest {
	
	@DataProvider(name = "ordered")
	public Object[][] createOrdered() {
		return new Object[][] {
			{"1","2"},
			{"2","10"},
			{"chr2","chr10"},
			{"22","X"},
			{"X","Y"},
			{"Y","M"},
			{"chrY","chrM"},
			{"chrX","MT"},
			{"MT","GL000192.1"},
			{"GL000192.1","HLA-A"},
			{"1","chr1"},
			{"9","chr10"},
			{"X","chr"}
			};
		}
	
	@Test(dataProvider="ordered")
	public void testCanonical(final String c1,final String c2) {
		final ChromosomeComparator cmp = ChromosomeComparator.canonical();
		Assert.assertTrue(cmp.compare(c1, c2) < 0, c1+" "+c2);
		Assert.assertTrue(cmp.compare(c2, c1) > 0, c2+" "+c1);
		Assert.assertEquals(cmp.compare(c1, c1), 0);
		}
	
	@Test
	public void testSortList() {
		final List<String> L = new ArrayList<>(Arrays.asList("chrUn_1","10","X","2","M","1","Y","chr3"));
		Collections.shuffle(L);
		L.sort(ChromosomeComparator.canonical());
		Assert.assertEquals(L, Arrays.asList("1","2","chr3","10","X","Y","M","chrUn_1"));
		Assert.assertNull(ChromosomeComparator.canonical().getContigs());
		}
	
	@Test
	public void testLongNumbers() {
		final ChromosomeComparator cmp = ChromosomeComparator.canonical();
		Assert.assertTrue(cmp.compare("99", "123456789012") < 0);
		// too long to be a number: lexical
		Assert.assertTrue(cmp.compare("1234567890123456789", "X") > 0);
		}
	
	@Test
	public void testFromContigs() {
		final ChromosomeComparator cmp = ChromosomeComparator.fromContigs(Arrays.asList("chrM","chr1","chr10","chr2"));
		Assert.assertTrue(cmp.compare("chrM", "chr1") < 0);
		Assert.assertTrue(cmp.compare("chr10", "chr2") < 0);
		Assert.assertEquals(cmp.compare("chr2", "chr2"), 0);
		Assert.assertEquals(cmp.getContigs(), Arrays.asList("chrM","chr1","chr10","chr2"));
		}
	
	@Test(expectedExceptions=SortOrderException.class)
	public void testUnknownContig() {
		ChromosomeComparator.fromContigs(Arrays.asList("chr1","chr2")).compare("chr1", "chr3");
		}
	
	@Test(expectedExceptions=IllegalArgumentException.class)
	public void testDuplicateContig() {
		ChromosomeComparator.fromContigs(Arrays.asList("chr1","chr2","chr1"));
		}
	
	@Test
	public void testFromDictionary() {
		final SAMSequenceDictionary dict = new SAMSequenceDictionary(Arrays.asList(
			new SAMSequenceRecord("Y", 100),
			new SAMSequenceRecord("1", 1000)
			));
		final ChromosomeComparator cmp = ChromosomeComparator.fromDictionary(dict);
		Assert.assertTrue(cmp.compare("Y", "1") < 0);
		Assert.assertEquals(cmp.getContigs(), Arrays.asList("Y","1"));
		}
	
	@Test
	public void testFromFastaIndex() throws IOException {
		final Path fai = Files.createTempFile("test.", ".fa.fai");
		try {
			Files.write(fai, Arrays.asList(
				"chrB\t100\t6\t60\t61",
				"chrA\t200\t115\t60\t61"
				));
			final ChromosomeComparator cmp = ChromosomeComparator.fromFastaIndex(fai);
			Assert.assertTrue(cmp.compare("chrB", "chrA") < 0);
			Assert.assertEquals(cmp.getContigs(), Arrays.asList("chrB","chrA"));
			}
		finally {
			Files.deleteIfExists(fai);
			}
		}
}
