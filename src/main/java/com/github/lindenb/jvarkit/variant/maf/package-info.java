/**

This package reads, validates, sorts and intersects MAF (Mutation Annotation Format) files.

A MAF file is governed by a scheme: a named, inheritable list of typed columns.
Schemes are resolved with a {@link com.github.lindenb.jvarkit.variant.maf.SchemeResolver}.

Usage:

<pre>
try(MafIterator iter = MafIterator.open(path)) {
	MafScheme scheme = iter.getScheme();
	while(iter.hasNext()) {
		MafRecord rec = iter.next();
		}
	}
</pre>

Sorting:

<pre>
try(MafIterator in = MafIterator.open(path)) {
	try(CloseableIterator&lt;MafRecord&gt; iter = new MafSorter().sort(in, SortOrder.coordinate())) {
		while(iter.hasNext()) {
			MafRecord rec = iter.next();
			}
		}
	}
</pre>

Overlapping records of several sorted files:

<pre>
try(MafOverlapIterator iter = new MafOverlapIterator(Arrays.asList(MafIterator.open(path1), MafIterator.open(path2)))) {
	while(iter.hasNext()) {
		OverlapGroup group = iter.next();
		MafRecord rec1 = group.get(0);// may be null
		}
	}
</pre>

@author Pierre Lindenbaum

*/
package com.github.lindenb.jvarkit.variant.maf;
