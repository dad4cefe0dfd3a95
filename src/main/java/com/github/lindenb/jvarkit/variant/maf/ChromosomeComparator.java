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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import htsjdk.samtools.SAMSequenceDictionary;
import htsjdk.samtools.SAMSequenceRecord;
import htsjdk.samtools.reference.FastaSequenceIndex;
import htsjdk.samtools.reference.FastaSequenceIndexEntry;

/**
 * Orders chromosome names.
 * 
 * The canonical order ignores an optional <code>chr</code> prefix and sorts
 * numeric names ascending, then <code>X</code>, <code>Y</code>, <code>M</code>
 * (or <code>MT</code>), then all other names lexically:
 * <code>1 &lt; 2 &lt; 10 &lt; X &lt; Y &lt; M &lt; GL000192.1</code>.
 * 
 * A comparator can also be built from the contigs of a sequence dictionary or
 * of a FASTA index. Such a comparator rejects the unknown contigs.
 * @author Pierre Lindenbaum
 *
 */
public class ChromosomeComparator implements Comparator<String> {
private static final ChromosomeComparator CANONICAL = new ChromosomeComparator(null);
private static final int NUMERIC_CLASS = 0;
private static final int SEX_AND_MITO_CLASS = 1;
private static final int OTHER_CLASS = 2;

/** contig to index, null for the canonical order */
private final Map<String,Integer> contig2index;

private ChromosomeComparator(final Map<String,Integer> contig2index) {
	this.contig2index = contig2index;
	}

/** @return the canonical chromosome order */
public static ChromosomeComparator canonical() {
	return CANONICAL;
	}

/** @return a comparator using the order of the given contigs */
public static ChromosomeComparator fromContigs(final List<String> contigs) {
	final Map<String,Integer> map = new HashMap<>(contigs.size());
	for(final String contig:contigs) {
		if(map.containsKey(contig)) throw new IllegalArgumentException("duplicate contig "+contig);
		map.put(contig, map.size());
		}
	return new ChromosomeComparator(Collections.unmodifiableMap(map));
	}

public static ChromosomeComparator fromDictionary(final SAMSequenceDictionary dict) {
	Objects.requireNonNull(dict, "dictionary");
	final List<String> L = new ArrayList<>(dict.size());
	for(final SAMSequenceRecord ssr:dict.getSequences()) {
		L.add(ssr.getSequenceName());
		}
	return fromContigs(L);
	}

/** @param faidx path to a FASTA index (<code>.fai</code>) */
public static ChromosomeComparator fromFastaIndex(final Path faidx) {
	final FastaSequenceIndex index = new FastaSequenceIndex(faidx);
	final List<String> L = new ArrayList<>(index.size());
	for(final FastaSequenceIndexEntry entry:index) {
		L.add(entry.getContig());
		}
	return fromContigs(L);
	}

/** @return the contigs of this comparator, or null for the canonical order */
public List<String> getContigs() {
	if(this.contig2index==null) return null;
	final String[] array = new String[this.contig2index.size()];
	for(final Map.Entry<String,Integer> kv:this.contig2index.entrySet()) {
		array[kv.getValue()] = kv.getKey();
		}
	return Collections.unmodifiableList(Arrays.asList(array));
	}

private static String stripChr(final String s) {
	if(s.length()>3 && s.regionMatches(true, 0, "chr", 0, 3)) return s.substring(3);
	return s;
	}

private static boolean isNumeric(final String s) {
	if(s.isEmpty() || s.length()>18) return false;
	for(int i=0;i< s.length();i++) {
		if(!Character.isDigit(s.charAt(i))) return false;
		}
	return true;
	}

private static int sexAndMitoRank(final String s) {
	if(s.equalsIgnoreCase("X")) return 0;
	if(s.equalsIgnoreCase("Y")) return 1;
	if(s.equalsIgnoreCase("M") || s.equalsIgnoreCase("MT")) return 2;
	return -1;
	}

private static int classOf(final String s) {
	if(isNumeric(s)) return NUMERIC_CLASS;
	if(sexAndMitoRank(s)!=-1) return SEX_AND_MITO_CLASS;
	return OTHER_CLASS;
	}

private int indexOf(final String contig) {
	final Integer idx = this.contig2index.get(contig);
	if(idx==null) {
		throw new SortOrderException("Could not find contig '"+contig+"' in the list of "+this.contig2index.size()+" contigs");
		}
	return idx.intValue();
	}

@Override
public int compare(final String c1,final String c2) {
	if(this.contig2index!=null) {
		return Integer.compare(indexOf(c1), indexOf(c2));
		}
	final String s1 = stripChr(c1);
	final String s2 = stripChr(c2);
	final int k1 = classOf(s1);
	final int k2 = classOf(s2);
	int i = Integer.compare(k1, k2);
	if(i!=0) return i;
	switch(k1) {
		case NUMERIC_CLASS: i = Long.compare(Long.parseLong(s1), Long.parseLong(s2)); break;
		case SEX_AND_MITO_CLASS: i = Integer.compare(sexAndMitoRank(s1), sexAndMitoRank(s2)); break;
		default: i = s1.compareTo(s2); break;
		}
	if(i!=0) return i;
	// 'chr1' and '1' are two distinct contigs
	return c1.compareTo(c2);
	}

@Override
public String toString() {
	return this.contig2index==null?"canonical":"contigs("+this.contig2index.size()+")";
	}
}
