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
import java.util.List;

import htsjdk.samtools.ValidationStringency;

/** fixtures shared by the tests */
class MafTestUtils {
static final String TEST_SCHEME_ID = "test-1.0";
private static SchemeResolver RESOLVER = null;

private MafTestUtils() {
	}

/** a small resolver with a locatable scheme 'test-1.0' and an extension 'test-1.0-ext' */
static synchronized SchemeResolver resolver() {
	if(RESOLVER==null) {
		RESOLVER = SchemeResolver.builder().
			add(new SchemeDescriptor(TEST_SCHEME_ID, TEST_SCHEME_ID, null, Arrays.asList(
				new ColumnDefinition("Hugo_Symbol", "StringColumn", "gene"),
				new ColumnDefinition("Chromosome", "StringColumn"),
				new ColumnDefinition("Start_Position", "OneBasedIntegerColumn"),
				new ColumnDefinition("End_Position", "OneBasedIntegerColumn"),
				new ColumnDefinition("Strand", "Strand"),
				new ColumnDefinition("Variant_Type", "VariantType"),
				new ColumnDefinition("Tumor_Sample_Barcode", "StringColumn"),
				new ColumnDefinition("Matched_Norm_Sample_Barcode", "StringColumn"),
				new ColumnDefinition("t_depth", "NullableZeroBasedIntegerColumn")
				), null)).
			add(new SchemeDescriptor(TEST_SCHEME_ID, TEST_SCHEME_ID+"-ext", TEST_SCHEME_ID, Arrays.asList(
				new ColumnDefinition("all_effects", "SequenceOfStrings")
				), Arrays.asList("t_depth"))).
			build();
		}
	return RESOLVER;
	}

static MafScheme scheme() {
	return resolver().resolve(TEST_SCHEME_ID);
	}

static List<String> tokens(final String gene,final String contig,int start,int end,final String tumor) {
	return new ArrayList<>(Arrays.asList(gene, contig, String.valueOf(start), String.valueOf(end), "+", "SNP", tumor, "NORMAL", ""));
	}

static MafRecord record(final String gene,final String contig,int start,int end) {
	return record(gene, contig, start, end, "TUMOR");
	}

static MafRecord record(final String gene,final String contig,int start,int end,final String tumor) {
	return MafRecord.decode(scheme(), tokens(gene, contig, start, end, tumor), ValidationStringency.STRICT);
	}
}
