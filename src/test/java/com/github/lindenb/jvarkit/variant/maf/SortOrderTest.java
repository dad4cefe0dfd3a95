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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.Test;

import htsjdk.samtools.ValidationStringency;

public class SortOrderTest {
	
	private static MafRecord depth(final String gene,final Integer depth) {
		final MafRecord rec = MafTestUtils.record(gene, "1", 1, 1);
		return rec.with("t_depth", depth==null?ColumnValue.nullOf(ColumnValue.Kind.INTEGER):ColumnValue.ofInteger(depth));
		}
	
	private static List<String> genes(final List<MafRecord> L) {
		final List<String> genes = new ArrayList<>(L.size());
		for(final MafRecord rec:L) genes.add(rec.get("Hugo_Symbol").stringValue());
		return genes;
		}
	
	@Test
	public void testCoordinate() {
		final List<MafRecord> L = new ArrayList<>(Arrays.asList(
			MafTestUtils.record("G5", "X", 10, 10),
			MafTestUtils.record("G3", "2", 100, 101),
			MafTestUtils.record("G4", "10", 5, 5),
			MafTestUtils.record("G2", "2", 50, 60),
			MafTestUtils.record("G1", "1", 1000, 1000),
			MafTestUtils.record("G2b", "2", 50, 70)
			));
		Collections.shuffle(L);
		L.sort(SortOrder.coordinate());
		Assert.assertEquals(genes(L), Arrays.asList("G1","G2","G2b","G3","G4","G5"));
		}
	
	@Test
	public void testBarcodesAndCoordinate() {
		final List<MafRecord> L = new ArrayList<>(Arrays.asList(
			MafTestUtils.record("G1", "1", 10, 10, "TB"),
			MafTestUtils.record("G2", "2", 10, 10, "TA"),
			MafTestUtils.record("G3", "1", 10, 10, "TA")
			));
		L.sort(SortOrder.barcodesAndCoordinate());
		Assert.assertEquals(genes(L), Arrays.asList("G3","G2","G1"));
		}
	
	@Test
	public void testCustomChromosomeOrder() {
		final SortOrder order = SortOrder.coordinate(ChromosomeComparator.fromContigs(Arrays.asList("2","1")));
		Assert.assertTrue(order.compare(MafTestUtils.record("A", "2", 100, 100), MafTestUtils.record("B", "1", 1, 1)) < 0);
		}
	
	@Test
	public void testNullsLast() {
		final SortOrder asc = new SortOrder("depth", Arrays.asList(new SortOrder.SortKey("t_depth", SortOrder.ComparatorKind.NUMERIC)));
		final SortOrder desc = new SortOrder("depth", Arrays.asList(new SortOrder.SortKey("t_depth", SortOrder.Direction.DESC, SortOrder.ComparatorKind.NUMERIC)));
		final List<MafRecord> L = new ArrayList<>(Arrays.asList(depth("N", null), depth("A", 5), depth("B", 20), depth("C", 10)));
		L.sort(asc);
		Assert.assertEquals(genes(L), Arrays.asList("A","C","B","N"));
		L.sort(desc);
		Assert.assertEquals(genes(L), Arrays.asList("B","C","A","N"));
		Assert.assertEquals(asc.compare(depth("N", null), depth("M", null)), 0);
		}
	
	@Test
	public void testNumericOnStrings() {
		final MafScheme scheme = MafScheme.noRestrictions(Arrays.asList("Name","Score"));
		final SortOrder order = new SortOrder("score", Arrays.asList(new SortOrder.SortKey("Score", SortOrder.ComparatorKind.NUMERIC)));
		final MafRecord r1 = MafRecord.decode(scheme, Arrays.asList("a","9"), ValidationStringency.STRICT);
		final MafRecord r2 = MafRecord.decode(scheme, Arrays.asList("b","10.5"), ValidationStringency.STRICT);
		Assert.assertTrue(order.compare(r1, r2) < 0);
		final SortOrder lexical = new SortOrder("score", Arrays.asList(new SortOrder.SortKey("Score", SortOrder.ComparatorKind.LEXICAL)));
		Assert.assertTrue(lexical.compare(r1, r2) > 0);
		}
	
	@Test(expectedExceptions=SortOrderException.class)
	public void testNumericNotANumber() {
		final MafScheme scheme = MafScheme.noRestrictions(Arrays.asList("Name","Score"));
		final SortOrder order = new SortOrder("score", Arrays.asList(new SortOrder.SortKey("Score", SortOrder.ComparatorKind.NUMERIC)));
		order.compare(
			MafRecord.decode(scheme, Arrays.asList("a","9"), ValidationStringency.STRICT),
			MafRecord.decode(scheme, Arrays.asList("b","abc"), ValidationStringency.STRICT)
			);
		}
	
	@Test
	public void testFind() {
		for(final String name:SortOrder.getNames()) {
			Assert.assertEquals(SortOrder.find(name).getName(), name);
			}
		Assert.assertTrue(SortOrder.find(SortOrder.COORDINATE).isSortable());
		Assert.assertTrue(SortOrder.find(SortOrder.BARCODES_AND_COORDINATE).isSortable());
		Assert.assertFalse(SortOrder.find(SortOrder.UNSORTED).isSortable());
		Assert.assertFalse(SortOrder.find(SortOrder.UNKNOWN).isSortable());
		Assert.assertEquals(SortOrder.barcodesAndCoordinate().getSortKeys().size(), 5);
		}
	
	@Test(expectedExceptions=SortOrderException.class)
	public void testFindUnknownName() {
		SortOrder.find("Shuffled");
		}
	
	@Test(expectedExceptions=SortOrderException.class)
	public void testUnsortable() {
		SortOrder.unsorted().compare(MafTestUtils.record("A", "1", 1, 1), MafTestUtils.record("B", "1", 1, 1));
		}
	
	@Test(expectedExceptions=SortOrderException.class)
	public void testMissingColumn() {
		final MafScheme scheme = MafScheme.noRestrictions(Arrays.asList("Chromosome","Start_Position"));
		final MafRecord rec = MafRecord.decode(scheme, Arrays.asList("1","10"), ValidationStringency.STRICT);
		SortOrder.coordinate().compare(rec, rec);
		}
	
	@Test
	public void testValidate() {
		SortOrder.coordinate().validate(MafTestUtils.scheme());
		SortOrder.barcodesAndCoordinate().validate(MafTestUtils.scheme());
		Assert.assertThrows(SortOrderException.class, ()->SortOrder.coordinate().validate(MafScheme.noRestrictions(Arrays.asList("Chromosome"))));
		Assert.assertThrows(SortOrderException.class, ()->SortOrder.unknown().validate(MafTestUtils.scheme()));
		}
	
	@Test
	public void testChecker() {
		final List<MafRecord> sorted = Arrays.asList(
			MafTestUtils.record("A", "1", 1, 1),
			MafTestUtils.record("B", "1", 1, 5),
			MafTestUtils.record("C", "2", 1, 1)
			);
		final List<MafRecord> L = new ArrayList<>();
		try(SortOrderChecker iter = new SortOrderChecker(sorted.iterator(), SortOrder.coordinate())) {
			while(iter.hasNext()) L.add(iter.next());
			}
		Assert.assertEquals(L, sorted);
		}
	
	@Test
	public void testCheckerFailure() {
		final List<MafRecord> unsorted = Arrays.asList(
			MafTestUtils.record("A", "1", 1, 1),
			MafTestUtils.record("C", "2", 1, 1),
			MafTestUtils.record("B", "1", 1, 5)
			);
		final List<MafRecord> L = new ArrayList<>();
		try(SortOrderChecker iter = new SortOrderChecker(unsorted.iterator(), SortOrder.coordinate())) {
			while(iter.hasNext()) L.add(iter.next());
			Assert.fail("out of order record was not detected");
			}
		catch(final MafFormatException err) {
			Assert.assertTrue(L.size() < 3);
			Assert.assertTrue(err.getMessage().contains("out of order"), err.getMessage());
			}
		}
	
	@Test(expectedExceptions=SortOrderException.class)
	public void testCheckerUnsortable() {
		new SortOrderChecker(Collections.<MafRecord>emptyIterator(), SortOrder.unsorted());
		}
}
