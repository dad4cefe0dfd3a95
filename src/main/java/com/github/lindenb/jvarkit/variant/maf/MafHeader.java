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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The header of a MAF file: the ordered pragma lines <code>#key value</code>
 * found before the column names.
 * 
 * <pre>
 * #version gdc-1.0.0
 * #annotation.spec gdc-1.0.0-public
 * #sort.order Coordinate
 * #contigs chr1,chr2,chrX
 * </pre>
 * @author Pierre Lindenbaum
 *
 */
public class MafHeader {
public static final String START_SYMBOL = "#";
public static final String VERSION_KEY = "version";
public static final String ANNOTATION_SPEC_KEY = "annotation.spec";
public static final String SORT_ORDER_KEY = "sort.order";
/** comma-separated contigs, in the order used for sorting */
public static final String CONTIGS_KEY = "contigs";

private final Map<String,String> pragmas = new LinkedHashMap<>();

public MafHeader() {
	}

/** @return a header declaring the version and the annotation-spec of a scheme */
public static MafHeader of(final MafScheme scheme) {
	final MafHeader h = new MafHeader();
	if(!scheme.getVersion().equals(MafScheme.NO_RESTRICTIONS_VERSION)) {
		h.put(VERSION_KEY, scheme.getVersion());
		h.put(ANNOTATION_SPEC_KEY, scheme.getAnnotationSpec());
		}
	return h;
	}

/**
 * parse the pragma lines
 * @param lines the lines, starting with '#'
 * @return the header
 * @throws MafFormatException if a line is not a valid pragma or if a key is defined twice
 */
public static MafHeader parse(final List<String> lines) {
	final MafHeader h = new MafHeader();
	for(int i=0;i< lines.size();i++) {
		final String line = lines.get(i);
		final long lineNumber = i+1;
		if(!line.startsWith(START_SYMBOL)) {
			throw new MafFormatException("line "+lineNumber+": Header line did not start with a '"+START_SYMBOL+"'");
			}
		final int space = line.indexOf(' ');
		if(space==-1) {
			throw new MafFormatException("line "+lineNumber+": Header line did not have a key and value separated by a space: "+line);
			}
		final String key = line.substring(1, space);
		final String value = line.substring(space+1).trim();
		if(key.isEmpty()) throw new MafFormatException("line "+lineNumber+": Header line had an empty key");
		if(value.isEmpty()) throw new MafFormatException("line "+lineNumber+": Header line had an empty value");
		if(h.containsKey(key)) throw new MafFormatException("line "+lineNumber+": Multiple header lines with key '"+key+"' found");
		h.pragmas.put(key, value);
		}
	return h;
	}

/**
 * set a pragma
 * @param key the key, without space
 * @param value the value, not empty
 * @return this header
 */
public MafHeader put(final String key,final String value) {
	if(key==null || key.isEmpty() || key.contains(" ") || key.startsWith(START_SYMBOL)) throw new IllegalArgumentException("bad header key '"+key+"'");
	if(value==null || value.trim().isEmpty() || value.contains("\n")) throw new IllegalArgumentException("bad header value for "+key);
	this.pragmas.put(key, value);
	return this;
	}

public String get(final String key) {
	return this.pragmas.get(key);
	}

public boolean containsKey(final String key) {
	return this.pragmas.containsKey(key);
	}

public MafHeader remove(final String key) {
	this.pragmas.remove(key);
	return this;
	}

public Set<String> getKeys() {
	return Collections.unmodifiableSet(this.pragmas.keySet());
	}

/** @return the version or null */
public String getVersion() {
	return get(VERSION_KEY);
	}

/** @return the annotation specification or null */
public String getAnnotationSpec() {
	return get(ANNOTATION_SPEC_KEY);
	}

/** @return the name of the sort order or null */
public String getSortOrderName() {
	return get(SORT_ORDER_KEY);
	}

/** @return the contigs, empty if there is no contig pragma */
public List<String> getContigs() {
	final String s = get(CONTIGS_KEY);
	if(s==null) return Collections.emptyList();
	return Collections.unmodifiableList(Arrays.asList(s.split(",")));
	}

/** @return the chromosome order of this header: the contigs if declared, the canonical order otherwise */
public Comparator<String> getChromosomeComparator() {
	final List<String> contigs = getContigs();
	return contigs.isEmpty() ? ChromosomeComparator.canonical() : ChromosomeComparator.fromContigs(contigs);
	}

/**
 * @return the declared sort order, using the contigs if any.
 * <code>Unknown</code> if there is no such pragma or if the name is not a known order.
 */
public SortOrder getSortOrder() {
	final String name = getSortOrderName();
	if(name==null || !SortOrder.getNames().contains(name)) return SortOrder.unknown();
	return SortOrder.find(name, getChromosomeComparator());
	}

public MafHeader setSortOrder(final SortOrder sortOrder) {
	return put(SORT_ORDER_KEY, sortOrder.getName());
	}

public MafHeader setContigs(final List<String> contigs) {
	if(contigs==null || contigs.isEmpty()) return remove(CONTIGS_KEY);
	return put(CONTIGS_KEY, String.join(",", contigs));
	}

/** @return the pragma lines */
public List<String> toLines() {
	final List<String> L = new ArrayList<>(this.pragmas.size());
	for(final Map.Entry<String,String> kv: this.pragmas.entrySet()) {
		L.add(START_SYMBOL+kv.getKey()+" "+kv.getValue());
		}
	return L;
	}

@Override
public String toString() {
	return String.join("\n", toLines());
	}
}
