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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * A column type: converts a raw MAF token to a {@link ColumnValue} and back.
 * For every legal value <code>v</code>, <code>decode(encode(v)).equals(v)</code>.
 * 
 * A nullable type maps its null token (the empty string unless stated otherwise)
 * to a null value. A non nullable type rejects the empty token, except for the sequence types
 * where the empty token is the empty sequence.
 * @author Pierre Lindenbaum
 *
 */
public abstract class ColumnType {
/** separator of the items of a sequence */
public static final String SEQUENCE_DELIMITER = ";";
private final String tag;
private final ColumnValue.Kind kind;
private final boolean nullable;

protected ColumnType(final String tag,final ColumnValue.Kind kind,boolean nullable) {
	if(tag==null || tag.trim().isEmpty()) throw new IllegalArgumentException("empty type tag");
	this.tag = tag;
	this.kind = Objects.requireNonNull(kind,"kind");
	this.nullable = nullable;
	}

/** @return the name of this type, as used in the schemes */
public String getTag() {
	return this.tag;
	}

public ColumnValue.Kind getKind() {
	return this.kind;
	}

public boolean isNullable() {
	return this.nullable;
	}

/** @return the token used for a null value */
public String getNullToken() {
	return "";
	}

/** @return the closed vocabulary of an enumerated type, or an empty list */
public List<String> getVocabulary() {
	return Collections.emptyList();
	}

protected boolean isEmptyTokenAllowed() {
	return this.kind.isList();
	}

/** convert a non-null token to a value */
protected abstract ColumnValue parse(final String token);

/** convert a non-null value to a token */
protected abstract String format(final ColumnValue value);

/**
 * decode a token
 * @param token the raw token
 * @return the value
 * @throws ValueParseException if the token is not a legal value for this type
 */
public final ColumnValue decode(final String token) {
	if(token==null) throw new ValueParseException("null token for type "+getTag());
	if(isNullable() && token.equals(getNullToken())) {
		return ColumnValue.nullOf(getKind());
		}
	if(token.isEmpty() && !isEmptyTokenAllowed()) {
		throw new ValueParseException("empty value is not allowed for type "+getTag());
		}
	try {
		return parse(token);
		}
	catch(final IllegalArgumentException err) {
		throw new ValueParseException("'"+token+"' is not a valid "+getTag()+": "+err.getMessage(), err);
		}
	}

/**
 * encode a value. The null value of a non-nullable type (a placeholder produced by
 * lenient decoding) is written as an empty token.
 * @param value the value
 * @return the token
 */
public final String encode(final ColumnValue value) {
	Objects.requireNonNull(value, "value");
	if(value.getKind()!=getKind()) {
		throw new IllegalArgumentException("cannot encode "+value+" with type "+getTag());
		}
	if(value.isNull()) {
		return isNullable()?getNullToken():"";
		}
	return format(value);
	}

/**
 * validate a value for this type
 * @param value the value
 * @return null if the value is legal, or a message describing the problem
 */
public String validate(final ColumnValue value) {
	if(value==null) return "no value";
	if(value.getKind()!=getKind()) return "expected a value of kind "+getKind().name()+" but got "+value.getKind().name();
	if(value.isNull()) {
		return isNullable()?null:"null is not allowed for type "+getTag();
		}
	try {
		if(!decode(encode(value)).equals(value)) {
			return "value "+value+" cannot be written with type "+getTag();
			}
		}
	catch(final ValueParseException err) {
		return err.getMessage();
		}
	return null;
	}

@Override
public String toString() {
	return getTag();
	}

/** integer, optionally bounded */
public static class IntegerType extends ColumnType {
	private final Integer minValue;
	private final Integer maxValue;
	private final String nullToken;
	public IntegerType(final String tag,boolean nullable,final Integer minValue,final Integer maxValue) {
		this(tag,nullable,minValue,maxValue,"");
		}
	public IntegerType(final String tag,boolean nullable,final Integer minValue,final Integer maxValue,final String nullToken) {
		super(tag, ColumnValue.Kind.INTEGER, nullable);
		this.minValue = minValue;
		this.maxValue = maxValue;
		this.nullToken = Objects.requireNonNull(nullToken);
		}
	@Override
	public String getNullToken() {
		return this.nullToken;
		}
	/** @return null if the value is in range, or an error message */
	protected String check(int v) {
		if(this.minValue!=null && v < this.minValue.intValue()) return "'"+v+"' was out of range (<"+this.minValue+")";
		if(this.maxValue!=null && v > this.maxValue.intValue()) return "'"+v+"' was out of range (>"+this.maxValue+")";
		return null;
		}
	@Override
	protected ColumnValue parse(final String token) {
		final int v;
		try {
			v = Integer.parseInt(token.trim());
			}
		catch(final NumberFormatException err) {
			throw new ValueParseException("'"+token+"' was not an integer ("+getTag()+")", err);
			}
		final String msg = check(v);
		if(msg!=null) throw new ValueParseException(msg);
		return ColumnValue.ofInteger(v);
		}
	@Override
	protected String format(final ColumnValue value) {
		return String.valueOf(value.intValue());
		}
	}

/** floating point number */
public static class FloatType extends ColumnType {
	public FloatType(final String tag,boolean nullable) {
		super(tag, ColumnValue.Kind.FLOAT, nullable);
		}
	@Override
	protected ColumnValue parse(final String token) {
		try {
			return ColumnValue.ofFloat(Double.valueOf(token.trim()));
			}
		catch(final NumberFormatException err) {
			throw new ValueParseException("'"+token+"' was not a float ("+getTag()+")", err);
			}
		}
	@Override
	protected String format(final ColumnValue value) {
		return String.valueOf(value.doubleValue());
		}
	}

/** free text */
public static class StringType extends ColumnType {
	public StringType(final String tag,boolean nullable) {
		super(tag, ColumnValue.Kind.STRING, nullable);
		}
	@Override
	protected ColumnValue parse(final String token) {
		return ColumnValue.ofString(token);
		}
	@Override
	protected String format(final ColumnValue value) {
		return value.stringValue();
		}
	}

/** a string of bases ACGT or '-' */
public static class DnaStringType extends StringType {
	public DnaStringType(final String tag,boolean nullable) {
		super(tag, nullable);
		}
	@Override
	protected ColumnValue parse(final String token) {
		if(!token.equals("-")) {
			for(int i=0;i< token.length();i++) {
				switch(token.charAt(i)) {
					case 'A': case 'C': case 'G': case 'T': break;
					default: throw new ValueParseException("The "+(i+1)+"th base in '"+token+"' was not in [ACGT]");
					}
				}
			}
		return super.parse(token);
		}
	}

/** a closed vocabulary, matched ignoring case. Values keep the spelling of the vocabulary. */
public static class EnumType extends ColumnType {
	private final List<String> vocabulary;
	private final Map<String,String> lower2word;
	public EnumType(final String tag,boolean nullable,final List<String> vocabulary) {
		super(tag, ColumnValue.Kind.ENUM, nullable);
		if(vocabulary==null || vocabulary.isEmpty()) throw new IllegalArgumentException("empty vocabulary for "+tag);
		this.vocabulary = Collections.unmodifiableList(new ArrayList<>(vocabulary));
		this.lower2word = new LinkedHashMap<>(vocabulary.size());
		for(final String w:vocabulary) {
			if(w.isEmpty()) throw new IllegalArgumentException("empty word in vocabulary of "+tag);
			if(this.lower2word.put(w.toLowerCase(Locale.ROOT), w)!=null) {
				throw new IllegalArgumentException("duplicate word "+w+" in vocabulary of "+tag);
				}
			}
		}
	public EnumType(final String tag,boolean nullable,final String...vocabulary) {
		this(tag,nullable,Arrays.asList(vocabulary));
		}
	@Override
	public List<String> getVocabulary() {
		return this.vocabulary;
		}
	@Override
	protected ColumnValue parse(final String token) {
		final String w = this.lower2word.get(token.toLowerCase(Locale.ROOT));
		if(w==null) {
			throw new ValueParseException("'"+token+"' is not a valid "+getTag()+". Expected one of: "+String.join(", ", this.vocabulary));
			}
		return ColumnValue.ofEnum(w);
		}
	@Override
	protected String format(final ColumnValue value) {
		return value.stringValue();
		}
	}

/** a yes/no flag */
public static class FlagType extends ColumnType {
	private final List<String> trueTokens;
	private final List<String> falseTokens;
	public FlagType(final String tag,boolean nullable,final List<String> trueTokens,final List<String> falseTokens) {
		super(tag, ColumnValue.Kind.FLAG, nullable);
		this.trueTokens = Collections.unmodifiableList(new ArrayList<>(trueTokens));
		this.falseTokens = Collections.unmodifiableList(new ArrayList<>(falseTokens));
		}
	@Override
	protected boolean isEmptyTokenAllowed() {
		return this.falseTokens.contains("") || this.trueTokens.contains("");
		}
	@Override
	public List<String> getVocabulary() {
		final List<String> L = new ArrayList<>(this.trueTokens);
		L.addAll(this.falseTokens);
		return L;
		}
	@Override
	protected ColumnValue parse(final String token) {
		for(final String s: this.trueTokens) {
			if(s.equalsIgnoreCase(token)) return ColumnValue.ofFlag(Boolean.TRUE);
			}
		for(final String s: this.falseTokens) {
			if(s.equalsIgnoreCase(token)) return ColumnValue.ofFlag(Boolean.FALSE);
			}
		throw new ValueParseException("'"+token+"' is not a valid "+getTag()+". Expected one of: "+
			getVocabulary().stream().map(S->"'"+S+"'").collect(Collectors.joining(", ")));
		}
	/** the first token of each list is used for writing */
	@Override
	protected String format(final ColumnValue value) {
		return value.booleanValue()?this.trueTokens.get(0):this.falseTokens.get(0);
		}
	}

/** an UUID like <code>c30c4b6d-3e50-4b1b-8d0a-0c3b4b8e3c5e</code> */
public static class UUIDType extends ColumnType {
	public UUIDType(final String tag,boolean nullable) {
		super(tag, ColumnValue.Kind.UUID, nullable);
		}
	@Override
	protected ColumnValue parse(final String token) {
		if(token.length()!=36) throw new ValueParseException("'"+token+"' was not a UUID");
		return ColumnValue.ofUUID(UUID.fromString(token));
		}
	@Override
	protected String format(final ColumnValue value) {
		return value.uuidValue().toString();
		}
	}

/**
 * a token that may hold a number or a free text. The value keeps the token
 * as a string so it is written back unchanged; use {@link #interpret(ColumnValue)}
 * to get the number.
 */
public static class StringOrNumberType extends StringType {
	private final boolean acceptFloat;
	public StringOrNumberType(final String tag,boolean acceptFloat) {
		super(tag, false);
		this.acceptFloat = acceptFloat;
		}
	public boolean isFloatAccepted() {
		return this.acceptFloat;
		}
	@Override
	protected boolean isEmptyTokenAllowed() {
		return true;
		}
	/**
	 * @param value a value of this type
	 * @return an Integer, a Double (if floats are accepted) or the String itself. Null if the value is null.
	 */
	public Object interpret(final ColumnValue value) {
		final String s = value.stringValue();
		if(s==null) return null;
		try {
			return Integer.valueOf(s.trim());
			}
		catch(final NumberFormatException err) {
			// not an integer
			}
		if(this.acceptFloat) {
			try {
				return Double.valueOf(s.trim());
				}
			catch(final NumberFormatException err) {
				// not a float
				}
			}
		return s;
		}
	}

/** a column that must be empty */
public static class RequireNullType extends ColumnType {
	public RequireNullType(final String tag) {
		super(tag, ColumnValue.Kind.STRING, true);
		}
	@Override
	protected ColumnValue parse(final String token) {
		throw new ValueParseException("'"+token+"' was not a null value");
		}
	@Override
	protected String format(final ColumnValue value) {
		throw new ValueParseException("'"+value.stringValue()+"' was not a null value");
		}
	}

/**
 * zero or more items of an other type, separated with {@link ColumnType#SEQUENCE_DELIMITER}.
 * If the item type is nullable, the null items are kept as <code>null</code> in the list.
 */
public static class SequenceType extends ColumnType {
	private final ColumnType itemType;
	public SequenceType(final String tag,final ColumnType itemType) {
		super(tag, listKind(itemType), false);
		this.itemType = itemType;
		}
	private static ColumnValue.Kind listKind(final ColumnType itemType) {
		switch(itemType.getKind()) {
			case STRING: return ColumnValue.Kind.STRING_LIST;
			case INTEGER: return ColumnValue.Kind.INTEGER_LIST;
			case ENUM: return ColumnValue.Kind.ENUM_LIST;
			case FLAG: return ColumnValue.Kind.FLAG_LIST;
			default: throw new IllegalArgumentException("cannot build a sequence of "+itemType.getKind());
			}
		}
	public ColumnType getItemType() {
		return this.itemType;
		}
	@Override
	public List<String> getVocabulary() {
		return this.itemType.getVocabulary();
		}
	@Override
	protected ColumnValue parse(final String token) {
		if(token.isEmpty()) return listOf(Collections.emptyList());
		final String[] tokens = token.split(SEQUENCE_DELIMITER, -1);
		final List<Object> L = new ArrayList<>(tokens.length);
		for(int i=0;i< tokens.length;i++) {
			try {
				L.add(this.itemType.decode(tokens[i]).getValue());
				}
			catch(final ValueParseException err) {
				throw new ValueParseException("For the "+(i+1)+"th value in '"+token+"': "+err.getMessage(), err);
				}
			}
		return listOf(L);
		}
	private static <T> List<T> castAll(final List<?> L,final Class<T> clazz) {
		return L.stream().map(O->O==null?null:clazz.cast(O)).collect(Collectors.toList());
		}
	private ColumnValue listOf(final List<?> L) {
		switch(getKind()) {
			case STRING_LIST: return ColumnValue.ofStringList(castAll(L, String.class));
			case INTEGER_LIST: return ColumnValue.ofIntegerList(castAll(L, Integer.class));
			case ENUM_LIST: return ColumnValue.ofEnumList(castAll(L, String.class));
			case FLAG_LIST: return ColumnValue.ofFlagList(castAll(L, Boolean.class));
			default: throw new IllegalStateException(getKind().name());
			}
		}
	@Override
	protected String format(final ColumnValue value) {
		final List<?> L = value.listValue();
		final List<String> tokens = new ArrayList<>(L.size());
		for(final Object o: L) {
			final ColumnValue item;
			if(o==null) {
				item = ColumnValue.nullOf(this.itemType.getKind());
				}
			else
				{
				switch(this.itemType.getKind()) {
					case STRING: item = ColumnValue.ofString(String.class.cast(o)); break;
					case INTEGER: item = ColumnValue.ofInteger(Integer.class.cast(o)); break;
					case FLAG: item = ColumnValue.ofFlag(Boolean.class.cast(o)); break;
					default: item = ColumnValue.ofEnum(String.class.cast(o)); break;
					}
				}
			tokens.add(this.itemType.encode(item));
			}
		return String.join(SEQUENCE_DELIMITER, tokens);
		}
	}
}
