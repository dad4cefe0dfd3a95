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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.RuntimeIOException;

/**
 * Resolves a scheme id (its annotation-spec) to an immutable {@link MafScheme},
 * following the single-parent <code>extends</code> chain.
 * 
 * The effective columns of a scheme are the columns of its resolved parent, where
 * a column declared again by the child replaces the inherited one in place,
 * followed by the new columns of the child; the <code>filtered</code> columns
 * are then removed.
 * 
 * Resolved schemes are cached: a resolver returns the same instance for the same id.
 * 
 * <pre>
 * SchemeResolver resolver = SchemeResolver.builtIn();
 * MafScheme scheme = resolver.resolve("gdc-1.0.0-public");
 * </pre>
 * @author Pierre Lindenbaum
 *
 */
public class SchemeResolver {
private static final Log LOG=Log.getInstance(SchemeResolver.class);
private static final String BUILT_IN_LIST = "schemes/schemes.list";
private static SchemeResolver BUILT_IN = null;

private final ColumnTypeRegistry registry;
private final Map<String,SchemeDescriptor> id2descriptor;
private final ConcurrentMap<String,MafScheme> cache = new ConcurrentHashMap<>();

private SchemeResolver(final ColumnTypeRegistry registry,final Map<String,SchemeDescriptor> id2descriptor) {
	this.registry = registry;
	this.id2descriptor = Collections.unmodifiableMap(new LinkedHashMap<>(id2descriptor));
	}

/** @return a shared resolver knowing the schemes bundled with this library */
public static synchronized SchemeResolver builtIn() {
	if(BUILT_IN==null) {
		BUILT_IN = builder().addBuiltIns().build();
		}
	return BUILT_IN;
	}

public static Builder builder() {
	return new Builder();
	}

public ColumnTypeRegistry getColumnTypeRegistry() {
	return this.registry;
	}

/** @return the ids of all the known schemes */
public Set<String> getSchemeIds() {
	return this.id2descriptor.keySet();
	}

/**
 * @param id the annotation-spec
 * @return the descriptor or null
 */
public SchemeDescriptor getDescriptor(final String id) {
	return this.id2descriptor.get(id);
	}

/**
 * resolve a scheme
 * @param id the annotation-spec of the scheme
 * @return the resolved scheme
 * @throws SchemeResolutionException if the scheme or one of its ancestors is unknown, cyclic or inconsistent
 * @throws UnknownColumnTypeException if a column uses an unknown type tag
 */
public MafScheme resolve(final String id) {
	Objects.requireNonNull(id, "scheme id");
	final MafScheme cached = this.cache.get(id);
	if(cached!=null) return cached;
	
	// walk up to the root
	final List<SchemeDescriptor> chain = new ArrayList<>();
	final Set<String> seen = new LinkedHashSet<>();
	String current = id;
	while(current!=null) {
		if(!seen.add(current)) {
			throw new SchemeResolutionException("cyclic inheritance for scheme '"+id+"': "+
				String.join(" -> ", seen)+" -> "+current);
			}
		final SchemeDescriptor desc = this.id2descriptor.get(current);
		if(desc==null) {
			if(chain.isEmpty()) throw new SchemeResolutionException("unknown scheme '"+id+"'. Available: "+String.join(", ", getSchemeIds()));
			throw new SchemeResolutionException("scheme '"+chain.get(chain.size()-1).getAnnotationSpec()+"' extends unknown scheme '"+current+"'");
			}
		chain.add(desc);
		current = desc.getExtends();
		}
	
	// fold root first
	MafScheme parent = null;
	for(int i=chain.size()-1;i>=0;i--) {
		final SchemeDescriptor desc = chain.get(i);
		MafScheme scheme = this.cache.get(desc.getAnnotationSpec());
		if(scheme==null) {
			scheme = build(desc, parent);
			final MafScheme previous = this.cache.putIfAbsent(desc.getAnnotationSpec(), scheme);
			if(previous!=null) scheme = previous;
			LOG.debug("resolved scheme "+scheme+" with "+scheme.size()+" columns");
			}
		parent = scheme;
		}
	return parent;
	}

/**
 * Finds a scheme by version and annotation. If no version is given, return the
 * scheme with the given annotation. If no annotation is given, return the basic scheme of this version.
 * @param version the version or null
 * @param annotation the annotation specification or null
 * @return the scheme or null if no such scheme exists
 */
public MafScheme find(final String version,final String annotation) {
	if(version==null && annotation==null) throw new IllegalArgumentException("Either version or annotation must be given");
	for(final SchemeDescriptor desc: this.id2descriptor.values()) {
		final boolean ok;
		if(annotation==null) {
			ok = desc.getVersion().equals(version) && desc.getAnnotationSpec().equals(version);
			}
		else if(version==null) {
			ok = desc.getAnnotationSpec().equals(annotation);
			}
		else
			{
			ok = desc.getVersion().equals(version) && desc.getAnnotationSpec().equals(annotation);
			}
		if(ok) return resolve(desc.getAnnotationSpec());
		}
	return null;
	}

private static class PendingColumn {
	final String name;
	final ColumnType type;
	final String description;
	PendingColumn(final String name,final ColumnType type,final String description) {
		this.name = name;
		this.type = type;
		this.description = description;
		}
	}

private MafScheme build(final SchemeDescriptor desc,final MafScheme parent) {
	final String id = desc.getAnnotationSpec();
	final Set<String> declared = new HashSet<>();
	for(final ColumnDefinition def: desc.getColumns()) {
		if(!declared.add(def.getName())) {
			throw new SchemeResolutionException("duplicate column '"+def.getName()+"' in scheme '"+id+"'");
			}
		}
	for(final String f: desc.getFiltered()) {
		if(parent==null || !parent.hasColumn(f)) {
			throw new SchemeResolutionException("Filtered column '"+f+"' of scheme '"+id+"' was not found in the scheme it extends");
			}
		if(declared.contains(f)) {
			throw new SchemeResolutionException("column '"+f+"' is both redefined and filtered in scheme '"+id+"'");
			}
		}
	
	final Map<String,PendingColumn> columns = new LinkedHashMap<>();
	if(parent!=null) {
		for(final MafColumn c: parent.getColumns()) {
			columns.put(c.getName(), new PendingColumn(c.getName(), c.getType(), c.getDescription()));
			}
		}
	for(final ColumnDefinition def: desc.getColumns()) {
		final ColumnType type;
		try {
			type = this.registry.getColumnType(def.getTypeTag());
			}
		catch(final UnknownColumnTypeException err) {
			throw new UnknownColumnTypeException("scheme '"+id+"', column '"+def.getName()+"': "+err.getMessage(), err);
			}
		// replaces in place when inherited
		columns.put(def.getName(), new PendingColumn(def.getName(), type, def.getDescription()));
		}
	for(final String f: desc.getFiltered()) {
		columns.remove(f);
		}
	
	final List<MafColumn> L = new ArrayList<>(columns.size());
	for(final PendingColumn pc: columns.values()) {
		L.add(new MafColumn(L.size(), pc.name, pc.type, pc.description));
		}
	return new MafScheme(desc.getVersion(), id, desc.getExtends(), L);
	}

@Override
public String toString() {
	return "SchemeResolver("+this.id2descriptor.keySet().stream().collect(Collectors.joining(", "))+")";
	}

public static class Builder {
	private ColumnTypeRegistry registry = null;
	private final Map<String,SchemeDescriptor> id2descriptor = new LinkedHashMap<>();
	
	Builder() {
		}
	
	/** set the types used to resolve the columns. Default is {@link ColumnTypeRegistry#getDefault()} */
	public Builder setColumnTypeRegistry(final ColumnTypeRegistry registry) {
		this.registry = registry;
		return this;
		}
	
	public Builder add(final SchemeDescriptor desc) {
		if(this.id2descriptor.containsKey(desc.getAnnotationSpec())) {
			throw new SchemeResolutionException("Two schemes found with annotation specification '"+desc.getAnnotationSpec()+"'");
			}
		this.id2descriptor.put(desc.getAnnotationSpec(), desc);
		return this;
		}
	
	public Builder addJson(final InputStream in) throws IOException {
		return add(SchemeDescriptor.read(in));
		}
	
	public Builder addJson(final Path path) throws IOException {
		return add(SchemeDescriptor.read(path));
		}
	
	/** add the schemes bundled with this library */
	public Builder addBuiltIns() {
		try(InputStream in = SchemeResolver.class.getResourceAsStream(BUILT_IN_LIST)) {
			if(in==null) throw new IOException("cannot find resource "+BUILT_IN_LIST);
			final List<String> names;
			try(BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
				names = br.lines().
					map(S->S.trim()).
					filter(S->!S.isEmpty() && !S.startsWith("#")).
					collect(Collectors.toList());
				}
			for(final String name: names) {
				try(InputStream in2 = SchemeResolver.class.getResourceAsStream("schemes/"+name)) {
					if(in2==null) throw new IOException("cannot find resource schemes/"+name);
					add(SchemeDescriptor.read(in2));
					}
				}
			}
		catch(final IOException err) {
			throw new RuntimeIOException("cannot load built-in schemes", err);
			}
		return this;
		}
	
	public SchemeResolver build() {
		return new SchemeResolver(
			this.registry==null?ColumnTypeRegistry.getDefault():this.registry,
			this.id2descriptor
			);
		}
	}
}
