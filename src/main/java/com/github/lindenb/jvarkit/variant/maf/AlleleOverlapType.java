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

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * How the alternate alleles of two records are compared by {@link MafAlleleOverlapIterator}.
 * The first list is the alleles of the record of the first stream.
 */
public enum AlleleOverlapType {
	/** both lists have the same alleles, in the same order */
	EQUALITY {
		@Override
		public boolean test(final List<String> base,final List<String> other) {
			return base.equals(other);
			}
		},
	/** the lists share at least one allele, or are both empty */
	INTERSECTS {
		@Override
		public boolean test(final List<String> base,final List<String> other) {
			final Set<String> set = new HashSet<>(base);
			return other.stream().anyMatch(set::contains) || base.equals(other);
			}
		},
	/** all the alleles of the second list are in the first one */
	SUBSET {
		@Override
		public boolean test(final List<String> base,final List<String> other) {
			return new HashSet<>(base).containsAll(other);
			}
		};
	
	public abstract boolean test(final List<String> base,final List<String> other);
}
