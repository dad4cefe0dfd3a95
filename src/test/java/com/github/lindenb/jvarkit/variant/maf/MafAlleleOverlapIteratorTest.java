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
import java.util.Iterator;
import java.util.List;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import htsjdk.samtools.ValidationStringency;

public class MafAlleleOverlapIteratorTest {
	private static final MafScheme SCHEME = MafScheme.noRestrictions(Arrays.asList(
			"Hugo_Symbol",
			MafScheme.CHROMOSOME_COLUMN,
			MafScheme.START_COLUMN,
			MafScheme.END_COLUMN,
			MafScheme.STRAND_COLUMN,
			MafScheme.REFERENCE_ALLELE_COLUMN,
			MafScheme.TUMOR_ALLELE2_COLUMN
			));
	
	private static MafRecord record(final String name,int pos,final String ref,final String alt) {
		return MafRecord.decode(SCHEME, Arrays.asList(name, "chr1", String.valueOf(pos), String.valueOf(pos + Math.max(0, ref.length() - 1)), "+", ref, alt), ValidationStringency.STRICT);
		}
	
	private static String gene(final MafRecord rec) {
		return rec.get("Hugo_Symbol").stringValue();
		}
	
	private static List<OverlapGroup> collect(final MafOverlapIterator iter) {
		final List<OverlapGroup> L = new ArrayList<>();
		try {
			while(iter.hasNext()) L.add(iter.next());
			}
		finally {
			iter.close();
			}
		return L;
		}
	
	@DataProvider(name = "types")
	public Object[][] createTypes() {
		return new Object[][] {
			{AlleleOverlapType.EQUALITY, Arrays.asList("A"), Arrays.asList("A"), true},
			{AlleleOverlapType.EQUALITY, Arrays.asList("A","C"), Arrays.asList("C","A"), false},
			{AlleleOverlapType.EQUALITY, Arrays.asList("A"), Arrays.asList("A","C"), false},
			{AlleleOverlapType.INTERSECTS, Arrays.asList("A","C"), Arrays.asList("C","T"), true},
			{AlleleOverlapType.INTERSECTS, Arrays.asList("A"), Arrays.asList("T"), false},
			{AlleleOverlapType.INTERSECTS, Collections.emptyList(), Collections.emptyList(), true},
			{AlleleOverlapType.SUBSET, Arrays.asList("A","C"), Arrays.asList("C"), true},
			{AlleleOverlapType.SUBSET, Arrays.asList("A"), Arrays.asList("A","C"), false},
			{AlleleOverlapType.SUBSET, Arrays.asList("A"), Collections.emptyList(), true}
			};
		}
	
	@Test(dataProvider="types")
	public void testAlleleOverlapType(final AlleleOverlapType type,final List<String> base,final List<String> other,boolean expect) {
		Assert.assertEquals(type.test(base, other), expect);
		}
	
	@Test
	public void testEquality() {
		final List<Iterator<MafRecord>> streams = Arrays.asList(
			Arrays.asList(record("A0", 10, "C", "T"), record("A1", 50, "G", "A")).iterator(),
			Arrays.asList(record("B0", 10, "C", "T"), record("B1", 50, "G", "C")).iterator(),
			Arrays.asList(record("C0", 10, "C", "G"), record("C1", 50, "G", "A")).iterator()
			);
		final List<OverlapGroup> groups = collect(new MafAlleleOverlapIterator(streams, AlleleOverlapType.EQUALITY));
		Assert.assertEquals(groups.size(), 2);
		Assert.assertEquals(groups.get(0).getStreamIndexes(), Arrays.asList(0, 1));
		Assert.assertEquals(gene(groups.get(0).get(1)), "B0");
		Assert.assertEquals(groups.get(1).getStreamIndexes(), Arrays.asList(0, 2));
		Assert.assertEquals(gene(groups.get(1).get(2)), "C1");
		}
	
	@Test
	public void testReferenceMustMatch() {
		final List<Iterator<MafRecord>> streams = Arrays.asList(
			Arrays.asList(record("A0", 10, "CA", "T")).iterator(),
			Arrays.asList(record("B0", 10, "C", "T")).iterator()
			);
		final List<OverlapGroup> groups = collect(new MafAlleleOverlapIterator(streams, AlleleOverlapType.SUBSET));
		Assert.assertEquals(groups.size(), 1);
		Assert.assertEquals(groups.get(0).getStreamIndexes(), Arrays.asList(0));
		Assert.assertEquals(groups.get(0).getStart(), 10);
		Assert.assertEquals(groups.get(0).getEnd(), 11);
		}
	
	/** with a single alternate allele per record, intersection and subset mean equality */
	@Test
	public void testIntersectsAndSubset() {
		for(final AlleleOverlapType type: new AlleleOverlapType[] {AlleleOverlapType.INTERSECTS, AlleleOverlapType.SUBSET}) {
			final List<Iterator<MafRecord>> streams = Arrays.asList(
				Arrays.asList(record("A0", 10, "C", "T")).iterator(),
				Arrays.asList(record("B0", 10, "C", "T")).iterator(),
				Arrays.asList(record("C0", 10, "C", "A")).iterator()
				);
			final List<OverlapGroup> groups = collect(new MafAlleleOverlapIterator(streams, type));
			Assert.assertEquals(groups.size(), 1, type.name());
			Assert.assertEquals(groups.get(0).getStreamIndexes(), Arrays.asList(0, 1), type.name());
			}
		}
	
	@Test
	public void testCustomAlleles() {
		// both tumor alleles, minus the reference
		final MafAlleleOverlapIterator iter = new MafAlleleOverlapIterator(Arrays.asList(
				Arrays.asList(record("A0", 10, "C", "T")).iterator(),
				Arrays.asList(record("B0", 10, "C", "G")).iterator()
				),
				ChromosomeComparator.canonical(),
				AlleleOverlapType.INTERSECTS) {
			@Override
			protected List<String> getAlternateAlleles(final MafRecord rec) {
				return gene(rec).equals("A0") ? Arrays.asList("T","G") : super.getAlternateAlleles(rec);
				}
			};
		Assert.assertEquals(iter.getAlleleOverlapType(), AlleleOverlapType.INTERSECTS);
		final List<OverlapGroup> groups = collect(iter);
		Assert.assertEquals(groups.size(), 1);
		Assert.assertEquals(groups.get(0).size(), 2);
		}
	
	@Test
	public void testGroupsWithoutFirstStreamAreSkipped() {
		final List<Iterator<MafRecord>> streams = Arrays.asList(
			Arrays.asList(record("A0", 100, "C", "T")).iterator(),
			Arrays.asList(record("B0", 10, "C", "T"), record("B1", 100, "C", "T")).iterator()
			);
		final List<OverlapGroup> groups = collect(new MafAlleleOverlapIterator(streams, AlleleOverlapType.EQUALITY));
		Assert.assertEquals(groups.size(), 1);
		Assert.assertEquals(gene(groups.get(0).get(0)), "A0");
		Assert.assertEquals(gene(groups.get(0).get(1)), "B1");
		}
	
	@Test
	public void testNullAlleles() {
		final MafRecord a = MafRecord.decode(SCHEME, Arrays.asList("A0","chr1","10","10","+","",""), ValidationStringency.STRICT);
		final MafRecord b = MafRecord.decode(SCHEME, Arrays.asList("B0","chr1","10","10","+","",""), ValidationStringency.STRICT);
		final MafAlleleOverlapIterator iter = new MafAlleleOverlapIterator(Arrays.asList(
				Collections.singletonList(a).iterator(),
				Collections.singletonList(b).iterator()), AlleleOverlapType.EQUALITY);
		Assert.assertTrue(iter.isAlleleMatch(a, b));
		Assert.assertEquals(collect(iter).get(0).size(), 2);
		}
}
