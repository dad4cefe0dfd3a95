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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import htsjdk.samtools.util.Log;

/**
 * Maps a type tag (as found in the <code>columns</code> of a scheme) to a {@link ColumnType}.
 * A registry is immutable once built.
 * 
 * <pre>
 * ColumnTypeRegistry reg = ColumnTypeRegistry.builder().
 *     addBuiltIns().
 *     register(new ColumnType.EnumType("Color", false, "Red","Green")).
 *     build();
 * </pre>
 * @author Pierre Lindenbaum
 *
 */
public class ColumnTypeRegistry {
private static final Log LOG=Log.getInstance(ColumnTypeRegistry.class);
private static ColumnTypeRegistry DEFAULT_INSTANCE = null;

static final List<String> STRAND = Arrays.asList("+","-");
static final List<String> VARIANT_CLASSIFICATION = Arrays.asList(
	"Frame_Shift_Del","Frame_Shift_Ins","In_Frame_Ins","In_Frame_Del",
	"Missense_Mutation","Nonsense_Mutation","Silent","Splice_Site",
	"Translation_Start_Site","Nonstop_Mutation","3'UTR","3'Flank",
	"5'UTR","5'Flank","IGR","Intron","RNA","Targeted_Region","Splice_Region"
	);
static final List<String> VARIANT_TYPE = Arrays.asList("SNP","DNP","TNP","ONP","INS","DEL","Consolidated");
static final List<String> VERIFICATION_STATUS = Arrays.asList("Verified","Unknown");
static final List<String> VALIDATION_STATUS = Arrays.asList("Untested","Inconclusive","Valid","Invalid");
static final List<String> MUTATION_STATUS = Arrays.asList("None","Germline","Somatic","LOH","Post - transcriptional","modification","Unknown");
static final List<String> SEQUENCER = Arrays.asList(
	"ABI 3730xl","AB SOLiD 4 System","AB SOLiD 2 System","AB SOLiD 3 System",
	"Complete Genomics","454","454 GS FLX Titanium","Illumina Genome Analyzer II",
	"Illumina GAIIx","Illumina Genome Analyzer IIx","Illumina HiSeq","Illumina HiSeq 2000",
	"Illumina HiSeq 2500","Illumina HiSeq 4000","Illumina HiSeq X Ten","Illumina HiSeq X Five",
	"Illumina MiSeq","Illumina NextSeq","Ion Torrent PGM","Ion Torrent Proton",
	"PacBio RS","SOLID","Other"
	);
static final List<String> FEATURE_TYPE = Arrays.asList("Transcript","RegulatoryFeature","MotifFeature");
static final List<String> IMPACT = Arrays.asList("MODIFIER","LOW","MODERATE","HIGH");
static final List<String> MC3_OVERLAP = Arrays.asList("Unknown","True","False");
static final List<String> GDC_VALIDATION_STATUS = Arrays.asList("Unknown","Valid","Invalid","Inconclusive");

private final Map<String,ColumnType> tag2type;

private ColumnTypeRegistry(final Map<String,ColumnType> tag2type) {
	this.tag2type = Collections.unmodifiableMap(new LinkedHashMap<>(tag2type));
	}

/** @return the shared registry containing the built-in types */
public static synchronized ColumnTypeRegistry getDefault() {
	if(DEFAULT_INSTANCE==null) {
		DEFAULT_INSTANCE = builder().addBuiltIns().build();
		LOG.debug("loaded "+DEFAULT_INSTANCE.getTags().size()+" built-in column types");
		}
	return DEFAULT_INSTANCE;
	}

public static Builder builder() {
	return new Builder();
	}

public Set<String> getTags() {
	return this.tag2type.keySet();
	}

public boolean hasColumnType(final String tag) {
	return this.tag2type.containsKey(tag);
	}

/**
 * @param tag the type tag
 * @return the column type
 * @throws UnknownColumnTypeException if there is no such type
 */
public ColumnType getColumnType(final String tag) {
	final ColumnType t = this.tag2type.get(tag);
	if(t==null) throw new UnknownColumnTypeException("Could not find a column type with name '"+tag+"'");
	return t;
	}

public ColumnValue decode(final String tag,final String token) {
	return getColumnType(tag).decode(token);
	}

public String encode(final String tag,final ColumnValue value) {
	return getColumnType(tag).encode(value);
	}

/** @return the vocabulary of an enumerated type, empty for the other types */
public List<String> getVocabulary(final String tag) {
	return getColumnType(tag).getVocabulary();
	}

public static class Builder {
	private final Map<String,ColumnType> tag2type = new LinkedHashMap<>();
	
	Builder() {
		}
	
	public Builder register(final ColumnType type) {
		if(this.tag2type.containsKey(type.getTag())) throw new IllegalArgumentException("duplicate column type "+type.getTag());
		this.tag2type.put(type.getTag(), type);
		return this;
		}
	
	public Builder addBuiltIns() {
		final ColumnType stringColumn = new ColumnType.StringType("StringColumn",false);
		final ColumnType integerColumn = new ColumnType.IntegerType("IntegerColumn",false,null,null);
		final ColumnType sequencer = new ColumnType.EnumType("Sequencer",false,SEQUENCER);
		final ColumnType nullableYesOrNo = new ColumnType.FlagType("NullableYesOrNo",true,Arrays.asList("Yes","1"),Arrays.asList("No","0"));
		register(stringColumn);
		register(new ColumnType.StringType("NullableStringColumn",true));
		register(integerColumn);
		register(new ColumnType.IntegerType("NullableIntegerColumn",true,null,null));
		register(new ColumnType.IntegerType("ZeroBasedIntegerColumn",false,0,null));
		register(new ColumnType.IntegerType("OneBasedIntegerColumn",false,1,null));
		register(new ColumnType.IntegerType("NullableZeroBasedIntegerColumn",true,0,null));
		register(new ColumnType.IntegerType("NullableOneBasedIntegerColumn",true,1,null));
		// zero means 'no gene'
		register(new ColumnType.IntegerType("EntrezGeneId",true,0,null,"0"));
		register(new ColumnType.IntegerType("TranscriptStrand",true,-1,1) {
			@Override
			protected String check(int v) {
				return v==-1 || v==1 ? null : "'"+v+"' was neither -1 nor 1";
				}
			});
		register(new ColumnType.FloatType("FloatColumn",false));
		register(new ColumnType.FloatType("NullableFloatColumn",true));
		register(new ColumnType.StringOrNumberType("StringOrIntegerColumn",false));
		register(new ColumnType.StringOrNumberType("StringIntegerOrFloatColumn",true));
		register(new ColumnType.RequireNullType("RequireNullValue"));
		register(new ColumnType.DnaStringType("DnaString",false));
		register(new ColumnType.DnaStringType("NullableDnaString",true));
		register(new ColumnType.UUIDType("UUIDColumn",false));
		register(new ColumnType.UUIDType("NullableUUIDColumn",true));
		register(new ColumnType.FlagType("BooleanColumn",false,Arrays.asList("True"),Arrays.asList("False")));
		register(new ColumnType.FlagType("Canonical",false,Arrays.asList("YES"),Arrays.asList("")));
		register(nullableYesOrNo);
		register(new ColumnType.FlagType("NullableYOrN",true,Arrays.asList("Y"),Arrays.asList("N")));
		register(new ColumnType.EnumType("Strand",false,STRAND));
		register(new ColumnType.EnumType("VariantClassification",false,VARIANT_CLASSIFICATION));
		register(new ColumnType.EnumType("VariantType",false,VARIANT_TYPE));
		register(new ColumnType.EnumType("VerificationStatus",true,VERIFICATION_STATUS));
		register(new ColumnType.EnumType("ValidationStatus",true,VALIDATION_STATUS));
		register(new ColumnType.EnumType("MutationStatus",false,MUTATION_STATUS));
		register(sequencer);
		register(new ColumnType.EnumType("FeatureType",true,FEATURE_TYPE));
		register(new ColumnType.EnumType("Impact",false,IMPACT));
		register(new ColumnType.EnumType("MC3Overlap",false,MC3_OVERLAP));
		register(new ColumnType.EnumType("GdcValidationStatus",false,GDC_VALIDATION_STATUS));
		register(new ColumnType.EnumType("PickColumn",true,"1"));
		register(new ColumnType.SequenceType("SequenceOfStrings",stringColumn));
		register(new ColumnType.SequenceType("SequenceOfIntegers",integerColumn));
		register(new ColumnType.SequenceType("SequenceOfSequencers",sequencer));
		register(new ColumnType.SequenceType("SequenceOfNullableYesOrNo",nullableYesOrNo));
		return this;
		}
	
	public ColumnTypeRegistry build() {
		return new ColumnTypeRegistry(this.tag2type);
		}
	}
}
