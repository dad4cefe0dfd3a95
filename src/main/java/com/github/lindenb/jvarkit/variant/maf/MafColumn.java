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

import java.util.Objects;

/**
 * A column of a resolved {@link MafScheme}
 */
public final class MafColumn {
private final int index;
private final String name;
private final ColumnType type;
private final String description;

MafColumn(int index,final String name,final ColumnType type,final String description) {
	this.index = index;
	this.name = Objects.requireNonNull(name);
	this.type = Objects.requireNonNull(type);
	this.description = description==null?"":description;
	}

/** @return the 0-based index of this column in the scheme */
public int getIndex() {
	return this.index;
	}

public String getName() {
	return this.name;
	}

public ColumnType getType() {
	return this.type;
	}

public String getDescription() {
	return this.description;
	}

@Override
public String toString() {
	return this.name+"("+this.type.getTag()+")";
	}
}
