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
import java.nio.file.Paths;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

import htsjdk.samtools.ValidationStringency;
import htsjdk.samtools.util.Log;

/**
 * Default settings of the library, read once from the system properties
 * prefixed with <code>mafjdk.</code>, e.g. <code>-Dmafjdk.sort_batch_capacity=10000</code>.
 */
public class MafDefaults {
private static final Log LOG=Log.getInstance(MafDefaults.class);
private static final String PREFIX = "mafjdk.";

/** number of records held in memory by {@link MafSorter} before spilling a run */
public static final int SORT_BATCH_CAPACITY;
/** compress the temporary runs of {@link MafSorter} with BGZF */
public static final boolean COMPRESS_SORT_RUNS;
/** directory where the temporary runs are written */
public static final Path TMP_DIR;
/** stringency used by {@link MafIterator} */
public static final ValidationStringency VALIDATION_STRINGENCY;

static {
	SORT_BATCH_CAPACITY = getIntProperty("sort_batch_capacity", 500_000);
	COMPRESS_SORT_RUNS = getBooleanProperty("compress_sort_runs", true);
	TMP_DIR = Paths.get(getStringProperty("tmp_dir", System.getProperty("java.io.tmpdir")));
	VALIDATION_STRINGENCY = getStringencyProperty("validation_stringency", ValidationStringency.STRICT);
	}

private MafDefaults() {
	}

/** @return all the settings and their values */
public static SortedMap<String,Object> allDefaults() {
	final SortedMap<String,Object> result = new TreeMap<>();
	result.put("SORT_BATCH_CAPACITY", SORT_BATCH_CAPACITY);
	result.put("COMPRESS_SORT_RUNS", COMPRESS_SORT_RUNS);
	result.put("TMP_DIR", TMP_DIR);
	result.put("VALIDATION_STRINGENCY", VALIDATION_STRINGENCY);
	return Collections.unmodifiableSortedMap(result);
	}

private static String getStringProperty(final String name,final String def) {
	return System.getProperty(PREFIX+name, def);
	}

private static boolean getBooleanProperty(final String name,final boolean def) {
	return Boolean.parseBoolean(getStringProperty(name, String.valueOf(def)));
	}

private static int getIntProperty(final String name,final int def) {
	final String s = getStringProperty(name, String.valueOf(def));
	try {
		final int n = Integer.parseInt(s);
		if(n<1) throw new NumberFormatException("must be greater than 0");
		return n;
		}
	catch(final NumberFormatException err) {
		LOG.warn("Bad value for "+PREFIX+name+" : '"+s+"'. Using "+def);
		return def;
		}
	}

private static ValidationStringency getStringencyProperty(final String name,final ValidationStringency def) {
	return parseStringency(PREFIX+name, getStringProperty(name, def.name()), def);
	}

/** parse a stringency ignoring case, or return <code>def</code> if the value is not a stringency */
static ValidationStringency parseStringency(final String propertyName,final String s,final ValidationStringency def) {
	try {
		return ValidationStringency.valueOf(s.trim().toUpperCase());
		}
	catch(final IllegalArgumentException err) {
		LOG.warn("Bad value for "+propertyName+" : '"+s+"'. Using "+def);
		return def;
		}
	}
}
