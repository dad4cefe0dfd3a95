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
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import htsjdk.samtools.ValidationStringency;
import htsjdk.samtools.util.CloseableIterator;
import htsjdk.samtools.util.IOUtil;

public class MafSorterTest {
	private Path tmpDir = null;
	
	@BeforeMethod
	public void createTmpDir() throws IOException {
		this.tmpDir = Files.createTempDirectory("mafsortertest.");
		}
	
	@AfterMethod
	public void deleteTmpDir() {
		IOUtil.recursiveDelete(this.tmpDir);
		}
	
	private long countTmpFiles() throws IOException {
		try(Stream<Path> st = Files.walk(this.tmpDir)) {
			return st.filter(P->!P.equals(this.tmpDir)).count();
			}
		}
	
	private static List<MafRecord> randomRecords(final int n,long seed) {
		final Random rnd = new Random(seed);
		final String[] contigs = new String[] {"1","2","10","X","chrY","M"};
		final List<MafRecord> L = new ArrayList<>(n);
		for(int i=0;i< n;i++) {
			final int start = 1 + rnd.nextInt(50);
			L.add(MafTestUtils.record("G"+i, contigs[rnd.nextInt(contigs.length)], start, start + rnd.nextInt(3), "T"+rnd.nextInt(3)));
			}
		return L;
		}
	
	private static List<MafRecord> toList(final CloseableIterator<MafRecord> iter) {
		final List<MafRecord> L = new ArrayList<>();
		try {
			while(iter.hasNext()) L.add(iter.next());
			}
		finally {
			iter.close();
			}
		return L;
		}
	
	@DataProvider(name = "params")
	public Object[][] createParams() {
		return new Object[][] {
			{1000, 100000, true},
			{1000, 7, true},
			{1000, 7, false},
			{100, 1, false},
			{10, 10, true},
			{0, 3, true}
			};
		}
	
	@Test(dataProvider="params")
	public void testSortIsStable(final int n,final int capacity,boolean compress) throws IOException {
		final List<MafRecord> input = randomRecords(n, n * 31L + capacity);
		// reference: java's sort is stable
		final List<MafRecord> expect = new ArrayList<>(input);
		expect.sort(SortOrder.coordinate());
		
		final MafSorter sorter = new MafSorter().
				setTmpDirectory(this.tmpDir).
				setCompressRuns(compress).
				setBatchCapacity(capacity);
		final List<MafRecord> sorted = toList(sorter.sort(input.iterator(), SortOrder.coordinate()));
		Assert.assertEquals(sorted.size(), input.size());
		for(int i=0;i< sorted.size();i++) {
			Assert.assertSame(sorted.get(i).getScheme(), expect.get(i).getScheme());
			Assert.assertEquals(sorted.get(i), expect.get(i), "index "+i);
			}
		Assert.assertEquals(countTmpFiles(), 0L);
		}
	
	@Test
	public void testBarcodesAndCoordinate() {
		final List<MafRecord> input = randomRecords(200, 5L);
		final List<MafRecord> expect = new ArrayList<>(input);
		expect.sort(SortOrder.barcodesAndCoordinate());
		final List<MafRecord> sorted = toList(new MafSorter().setTmpDirectory(this.tmpDir).sort(input.iterator(), SortOrder.barcodesAndCoordinate(), 13));
		Assert.assertEquals(sorted, expect);
		}
	
	@Test
	public void testKeepsWarnings() {
		final List<String> tokens = MafTestUtils.tokens("TP53", "1", 100, 101, "TUMOR");
		tokens.set(5, "XXX");
		final List<MafRecord> input = new ArrayList<>(Arrays.asList(
			MafTestUtils.record("A", "2", 1, 1),
			MafTestUtils.record("B", "3", 1, 1),
			MafRecord.decode(MafTestUtils.scheme(), tokens, ValidationStringency.SILENT, 2L)
			));
		final List<MafRecord> sorted = toList(new MafSorter().setTmpDirectory(this.tmpDir).sort(input.iterator(), SortOrder.coordinate(), 1));
		Assert.assertEquals(sorted.get(0).get("Hugo_Symbol").stringValue(), "TP53");
		Assert.assertEquals(sorted.get(0).getWarnings().size(), 1);
		Assert.assertEquals(sorted.get(0).getLineNumber(), 2L);
		Assert.assertTrue(sorted.get(0).get("Variant_Type").isNull());
		}
	
	@Test
	public void testCleanupOnEarlyClose() throws IOException {
		final List<MafRecord> input = randomRecords(100, 11L);
		try(CloseableIterator<MafRecord> iter = new MafSorter().setTmpDirectory(this.tmpDir).sort(input.iterator(), SortOrder.coordinate(), 2)) {
			Assert.assertTrue(iter.hasNext());
			iter.next();
			Assert.assertTrue(countTmpFiles() > 0L);
			}
		Assert.assertEquals(countTmpFiles(), 0L);
		}
	
	@Test
	public void testSchemes() {
		final MafScheme ext = MafTestUtils.resolver().resolve(MafTestUtils.TEST_SCHEME_ID+"-ext");
		final List<MafRecord> input = Arrays.asList(
			MafTestUtils.record("A", "2", 1, 1),
			MafRecord.decode(ext, Arrays.asList("B","1","10","10","-","SNP","T1","N1","x;y"), ValidationStringency.STRICT)
			);
		final List<MafRecord> sorted = toList(new MafSorter().setTmpDirectory(this.tmpDir).sort(input.iterator(), SortOrder.coordinate(), 1));
		Assert.assertSame(sorted.get(0).getScheme(), ext);
		Assert.assertEquals(sorted.get(0).get("all_effects").listValue(), Arrays.asList("x","y"));
		Assert.assertSame(sorted.get(1).getScheme(), MafTestUtils.scheme());
		}
	
	@Test(expectedExceptions=IllegalArgumentException.class)
	public void testBadCapacity() {
		new MafSorter().sort(Collections.<MafRecord>emptyIterator(), SortOrder.coordinate(), 0);
		}
	
	@Test(expectedExceptions=IllegalArgumentException.class)
	public void testBadDefaultCapacity() {
		new MafSorter().setBatchCapacity(-1);
		}
	
	@Test(expectedExceptions=SortOrderException.class)
	public void testUnsortable() {
		new MafSorter().sort(randomRecords(10, 1L).iterator(), SortOrder.unknown());
		}
	
	@Test
	public void testMissingColumn() throws IOException {
		final MafScheme scheme = MafScheme.noRestrictions(Arrays.asList("Chromosome","Start_Position"));
		final Iterator<MafRecord> input = Arrays.asList(
				MafTestUtils.record("A", "1", 1, 1),
				MafTestUtils.record("B", "1", 1, 1),
				MafRecord.decode(scheme, Arrays.asList("1","10"), ValidationStringency.STRICT)
				).iterator();
		try {
			new MafSorter().setTmpDirectory(this.tmpDir).sort(input, SortOrder.coordinate(), 2);
			Assert.fail("missing column was not detected");
			}
		catch(final SortOrderException err) {
			Assert.assertTrue(err.getMessage().contains("End_Position"), err.getMessage());
			}
		// the run of the two first records was removed
		Assert.assertEquals(countTmpFiles(), 0L);
		}
	
	@Test
	public void testEmpty() {
		final List<MafRecord> sorted = toList(new MafSorter().sort(Collections.<MafRecord>emptyIterator(), SortOrder.coordinate()));
		Assert.assertTrue(sorted.isEmpty());
		Assert.assertEquals(new MafSorter().getBatchCapacity(), MafDefaults.SORT_BATCH_CAPACITY);
		Assert.assertEquals(MafDefaults.allDefaults().get("SORT_BATCH_CAPACITY"), MafDefaults.SORT_BATCH_CAPACITY);
		Assert.assertEquals(new MafSorter().getTmpDirectory(), MafDefaults.TMP_DIR);
		}
	
	@Test
	public void testSortedGenes() {
		final List<MafRecord> input = Arrays.asList(
			MafTestUtils.record("C", "X", 1, 1),
			MafTestUtils.record("A", "1", 5, 5),
			MafTestUtils.record("B", "1", 5, 5),
			MafTestUtils.record("D", "1", 2, 2)
			);
		final List<String> genes = toList(new MafSorter().setTmpDirectory(this.tmpDir).sort(input.iterator(), SortOrder.coordinate(), 1)).
				stream().
				map(R->R.get("Hugo_Symbol").stringValue()).
				collect(Collectors.toList());
		Assert.assertEquals(genes, Arrays.asList("D","A","B","C"));
		}
	
	@Test
	public void testCannotCreateTmpDirectory() throws IOException {
		final Path missing = this.tmpDir.resolve("no").resolve("such").resolve("dir");
		try {
			new MafSorter().setTmpDirectory(missing).sort(randomRecords(10, 3L).iterator(), SortOrder.coordinate(), 2);
			Assert.fail("missing directory was not detected");
			}
		catch(final SortIOException err) {
			Assert.assertTrue(err.getMessage().contains("cannot write temporary run"), err.getMessage());
			}
		Assert.assertFalse(Files.exists(missing));
		Assert.assertEquals(countTmpFiles(), 0L);
		}
	
	@Test
	public void testCorruptRunDuringMerge() throws IOException {
		final List<MafRecord> input = randomRecords(2000, 17L);
		final CloseableIterator<MafRecord> iter = new MafSorter().
				setTmpDirectory(this.tmpDir).
				setCompressRuns(false).
				sort(input.iterator(), SortOrder.coordinate(), 500);
		final List<Path> runs;
		try(Stream<Path> st = Files.walk(this.tmpDir)) {
			runs = st.filter(P->P.getFileName().toString().startsWith("run-")).collect(Collectors.toList());
			}
		Assert.assertEquals(runs.size(), 4);
		// the head of each run is already buffered: cut the files beyond the read buffer
		for(final Path run:runs) {
			Assert.assertTrue(Files.size(run) > 3 * 8192L, run.toString());
			try(FileChannel channel = FileChannel.open(run, StandardOpenOption.WRITE)) {
				channel.truncate(2 * 8192L + 10L);
				}
			}
		int count = 0;
		try {
			while(iter.hasNext()) {
				iter.next();
				count++;
				}
			Assert.fail("truncated run was not detected");
			}
		catch(final CorruptRunException err) {
			Assert.assertTrue(err.getMessage().contains("run-"), err.getMessage());
			}
		finally {
			iter.close();
			}
		Assert.assertTrue(count < input.size());
		for(final Path run:runs) {
			Assert.assertFalse(Files.exists(run), run.toString());
			}
		Assert.assertEquals(countTmpFiles(), 0L);
		}
}
