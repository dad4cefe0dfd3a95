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
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * The typed value of one column in a {@link MafRecord}.
 * A value is tagged with its {@link Kind}; a null value is a
 * first-class value (it keeps its kind), not the absence of a value.
 * Instances are immutable.
 * @author Pierre Lindenbaum
 *
 */
public final class ColumnValue {

public static enum Kind {
	INTEGER(Integer.class,false),
	FLOAT(Double.class,false),
	STRING(String.class,false),
	ENUM(String.class,false),
	FLAG(Boolean.class,false),
	UUID(java.util.UUID.class,false),
	STRING_LIST(String.class,true),
	INTEGER_LIST(Integer.class,true),
	ENUM_LIST(String.class,true),
	FLAG_LIST(Boolean.class,true);
	
	private final Class<?> atomicClass;
	private final boolean list;
	Kind(final Class<?> atomicClass,boolean list) {
		this.atomicClass = atomicClass;
		this.list = list;
		}
	/** @return the class of the value, or of the items if this is a list */
	public Class<?> getAtomicClass() { return this.atomicClass;}
	public boolean isList() { return this.list;}
	}

private final Kind kind;
private final Object value;

private ColumnValue(final Kind kind,final Object value) {
	this.kind = Objects.requireNonNull(kind, "kind");
	this.value = value;
	}

private static ColumnValue of(final Kind kind,final Object o) {
	if(o!=null && !kind.isList() && !kind.getAtomicClass().isInstance(o)) {
		throw new IllegalArgumentException("not a "+kind.getAtomicClass().getSimpleName()+" : "+o);
		}
	return new ColumnValue(kind, o);
	}

/** items of a list may be null when the items of the sequence are nullable */
private static ColumnValue ofList(final Kind kind,final List<?> L) {
	if(L==null) return new ColumnValue(kind, null);
	final List<Object> copy = new ArrayList<>(L.size());
	for(final Object o: L) {
		if(o!=null && !kind.getAtomicClass().isInstance(o)) {
			throw new IllegalArgumentException("illegal item in "+kind.name()+" : "+o);
			}
		copy.add(o);
		}
	return new ColumnValue(kind, Collections.unmodifiableList(copy));
	}

/** @return a null value of the given kind */
public static ColumnValue nullOf(final Kind kind) {
	return new ColumnValue(kind, null);
	}
public static ColumnValue ofInteger(final Integer v) {
	return of(Kind.INTEGER, v);
	}
public static ColumnValue ofFloat(final Double v) {
	return of(Kind.FLOAT, v);
	}
public static ColumnValue ofString(final String v) {
	return of(Kind.STRING, v);
	}
public static ColumnValue ofEnum(final String v) {
	return of(Kind.ENUM, v);
	}
public static ColumnValue ofFlag(final Boolean v) {
	return of(Kind.FLAG, v);
	}
public static ColumnValue ofUUID(final UUID v) {
	return of(Kind.UUID, v);
	}
public static ColumnValue ofStringList(final List<String> L) {
	return ofList(Kind.STRING_LIST, L);
	}
public static ColumnValue ofIntegerList(final List<Integer> L) {
	return ofList(Kind.INTEGER_LIST, L);
	}
public static ColumnValue ofEnumList(final List<String> L) {
	return ofList(Kind.ENUM_LIST, L);
	}
public static ColumnValue ofFlagList(final List<Boolean> L) {
	return ofList(Kind.FLAG_LIST, L);
	}

public Kind getKind() {
	return this.kind;
	}

/** @return the raw value (Integer, Double, String, Boolean, UUID or an unmodifiable List) or null */
public Object getValue() {
	return this.value;
	}

public boolean isNull() {
	return this.value==null;
	}

public boolean isList() {
	return this.kind.isList();
	}

private void checkKind(final Kind expect) {
	if(this.kind!=expect) throw new IllegalStateException("expected "+expect.name()+" but got "+this.kind.name());
	if(this.value==null) throw new IllegalStateException("value of kind "+this.kind.name()+" is null");
	}

public int intValue() {
	checkKind(Kind.INTEGER);
	return Integer.class.cast(this.value).intValue();
	}

public double doubleValue() {
	checkKind(Kind.FLOAT);
	return Double.class.cast(this.value).doubleValue();
	}

public boolean booleanValue() {
	checkKind(Kind.FLAG);
	return Boolean.class.cast(this.value).booleanValue();
	}

public UUID uuidValue() {
	checkKind(Kind.UUID);
	return UUID.class.cast(this.value);
	}

/** @return the string for STRING and ENUM values, or null if this value is null */
public String stringValue() {
	if(this.kind!=Kind.STRING && this.kind!=Kind.ENUM) throw new IllegalStateException("not a string "+this.kind.name());
	return this.value==null?null:String.class.cast(this.value);
	}

/** @return the items of a list value, or null if this value is null */
public List<?> listValue() {
	if(!isList()) throw new IllegalStateException("not a list "+this.kind.name());
	return this.value==null?null:List.class.cast(this.value);
	}

/** @return the value as a number for INTEGER and FLOAT kinds, null if the value is null */
public Number numberValue() {
	switch(this.kind) {
		case INTEGER: case FLOAT: return Number.class.cast(this.value);
		default: throw new IllegalStateException("not a number "+this.kind.name());
		}
	}

@Override
public int hashCode() {
	return this.kind.hashCode()*31 + Objects.hashCode(this.value);
	}

@Override
public boolean equals(final Object obj) {
	if(obj==this) return true;
	if(obj==null || !(obj instanceof ColumnValue)) return false;
	final ColumnValue other = ColumnValue.class.cast(obj);
	return this.kind.equals(other.kind) && Objects.equals(this.value, other.value);
	}

@Override
public String toString() {
	String s= "{kind="+kind.name()+",value=";
	if(value==null)
		{
		s+="null";
		}
	else if(isList())
		{
		s+="[";
		s+= listValue().stream().map(O->String.valueOf(O)).collect(Collectors.joining(","));
		s+="]";
		}
	else
		{
		s+=String.valueOf(value);
		}
	s+="}";
	return s;
	}
}
