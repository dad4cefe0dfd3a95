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

import org.testng.Assert;
import org.testng.annotations.Test;

import htsjdk.samtools.ValidationStringency;

public class MafDefaultsTest {
	@Test
	public void testParseStringency() {
		Assert.assertEquals(MafDefaults.parseStringency("x", "lenient", ValidationStringency.STRICT), ValidationStringency.LENIENT);
		Assert.assertEquals(MafDefaults.parseStringency("x", " SILENT ", ValidationStringency.STRICT), ValidationStringency.SILENT);
		}
	
	@Test
	public void testBadStringencyFallsBack() {
		Assert.assertEquals(MafDefaults.parseStringency("x", "bogus", ValidationStringency.STRICT), ValidationStringency.STRICT);
		Assert.assertEquals(MafDefaults.parseStringency("x", "", ValidationStringency.STRICT), ValidationStringency.STRICT);
		}
	
	@Test
	public void testAllDefaults() {
		Assert.assertNotNull(MafDefaults.VALIDATION_STRINGENCY);
		Assert.assertTrue(MafDefaults.SORT_BATCH_CAPACITY > 0);
		Assert.assertTrue(MafDefaults.allDefaults().containsKey("VALIDATION_STRINGENCY"));
		}
}
