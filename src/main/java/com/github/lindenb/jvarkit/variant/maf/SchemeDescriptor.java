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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * The unresolved definition of a scheme, as found in a JSON scheme file:
 * 
 * <pre>
 * {
 * "version": "gdc-1.0.0",
 * "annotation-spec": "gdc-1.0.0-public",
 * "extends": "gdc-1.0.0-protected",
 * "columns": [ ["Hugo_Symbol","StringColumn","HUGO symbol"] ],
 * "filtered": ["Match_Norm_Seq_Allele1"]
 * }
 * </pre>
 * 
 * <code>extends</code> and <code>filtered</code> may be missing, <code>null</code> or <code>"None"</code>.
 * @author Pierre Lindenbaum
 *
 */
public final class SchemeDescriptor {
private static final String NONE = "None";
private static final ObjectMapper MAPPER = new ObjectMapper();
private final String version;
private final String annotationSpec;
private final String extendsId;
private final List<ColumnDefinition> columns;
private final List<String> filtered;

/**
 * @param version scheme format version
 * @param annotationSpec unique id of this scheme
 * @param extendsId id of the parent scheme or null
 * @param columns the columns declared by this scheme
 * @param filtered names of the inherited columns to remove, or null
 */
public SchemeDescriptor(
		final String version,
		final String annotationSpec,
		final String extendsId,
		final List<ColumnDefinition> columns,
		final List<String> filtered
		) {
	this.version = Objects.requireNonNull(version, "version");
	this.annotationSpec = Objects.requireNonNull(annotationSpec, "annotation-spec");
	this.extendsId = (extendsId==null || extendsId.equals(NONE) || extendsId.isEmpty() ? null : extendsId);
	this.columns = columns==null?Collections.emptyList():Collections.unmodifiableList(new ArrayList<>(columns));
	this.filtered = filtered==null?Collections.emptyList():Collections.unmodifiableList(new ArrayList<>(filtered));
	}

public String getVersion() {
	return this.version;
	}

/** @return the unique id of this scheme */
public String getAnnotationSpec() {
	return this.annotationSpec;
	}

/** @return the id of the parent, or null */
public String getExtends() {
	return this.extendsId;
	}

public List<ColumnDefinition> getColumns() {
	return this.columns;
	}

/** @return the inherited columns to remove. Never null */
public List<String> getFiltered() {
	return this.filtered;
	}

/** read a JSON scheme
 * @param in the input stream, not closed
 * @return the descriptor
 * @throws IOException on I/O error
 * @throws SchemeResolutionException if the JSON is not a valid scheme
 */
public static SchemeDescriptor read(final InputStream in) throws IOException {
	final JsonNode root = MAPPER.readTree(in);
	return fromJson(root);
	}

public static SchemeDescriptor read(final Path path) throws IOException {
	try(InputStream in = Files.newInputStream(path)) {
		return read(in);
		}
	catch(final SchemeResolutionException err) {
		throw new SchemeResolutionException("Could not read from file '"+path+"': "+err.getMessage(), err);
		}
	}

private static String requireText(final JsonNode root,final String key) {
	final JsonNode n = root.get(key);
	if(n==null || !n.isTextual()) throw new SchemeResolutionException("missing or non-text '"+key+"' in scheme");
	return n.asText();
	}

static SchemeDescriptor fromJson(final JsonNode root) {
	if(root==null || !root.isObject()) throw new SchemeResolutionException("scheme is not a JSON object");
	final String version = requireText(root,"version");
	final String annot = requireText(root,"annotation-spec");
	
	String ext = null;
	final JsonNode extNode = root.get("extends");
	if(extNode!=null && !extNode.isNull()) {
		if(!extNode.isTextual()) throw new SchemeResolutionException("'extends' is not a string in "+annot);
		ext = extNode.asText();
		}
	
	final List<ColumnDefinition> columns = new ArrayList<>();
	final JsonNode colsNode = root.get("columns");
	if(colsNode!=null && !colsNode.isNull()) {
		if(!colsNode.isArray()) throw new SchemeResolutionException("'columns' is not an array in "+annot);
		for(final JsonNode c: colsNode) {
			if(!c.isArray() || c.size()<2 || c.size()>3) {
				throw new SchemeResolutionException("Column did not have two or three elements: '"+c+"' in "+annot);
				}
			columns.add(new ColumnDefinition(c.get(0).asText(), c.get(1).asText(), c.size()>2?c.get(2).asText():""));
			}
		}
	
	List<String> filtered = null;
	final JsonNode filtNode = root.get("filtered");
	if(filtNode!=null && !filtNode.isNull()) {
		if(filtNode.isTextual() && filtNode.asText().equals(NONE)) {
			filtered = null;
			}
		else if(filtNode.isArray()) {
			filtered = new ArrayList<>(filtNode.size());
			for(final JsonNode f: filtNode) filtered.add(f.asText());
			}
		else
			{
			throw new SchemeResolutionException("'filtered' is neither a list nor \"None\" in "+annot);
			}
		}
	return new SchemeDescriptor(version, annot, ext, columns, filtered);
	}

@Override
public String toString() {
	return this.annotationSpec+" (version "+this.version+")";
	}
}
