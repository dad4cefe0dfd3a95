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
 * A column as declared in a scheme: name, type tag, description.
 * The type tag is only checked when the scheme is resolved.
 */
public final class ColumnDefinition {
private final String name;
private final String typeTag;
private final String description;

public ColumnDefinition(final String name,final String typeTag,final String description) {
	if(name==null || name.isEmpty()) throw new IllegalArgumentException("empty column name");
	this.name = name;
	this.typeTag = Objects.requireNonNull(typeTag, "type tag");
	this.description = description==null?"":description;
	}

public ColumnDefinition(final String name,final String typeTag) {
	this(name,typeTag,"");
	}

public String getName() {
	return this.name;
	}

public String getTypeTag() {
	return this.typeTag;
	}

public String getDescription() {
	return this.description;
	}

@Override
public int hashCode() {
	return Objects.hash(this.name,this.typeTag,this.description);
	}

@Override
public boolean equals(final Object obj) {
	if(obj==this) return true;
	if(obj==null || !(obj instanceof ColumnDefinition)) return false;
	final ColumnDefinition o = ColumnDefinition.class.cast(obj);
	return this.name.equals(o.name) && this.typeTag.equals(o.typeTag) && this.description.equals(o.description);
	}

@Override
public String toString() {
	return "["+this.name+","+this.typeTag+","+this.description+"]";
	}
}
