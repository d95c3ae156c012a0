/*
 * Copyright 2024 Spring AI Community
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.springaicommunity.apihub;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered multi-map of request parameters.
 *
 * <p>
 * Insertion order is preserved and a name may appear more than once. Instances are
 * mutable and not thread-safe; {@link ApiRequest} only ever exposes copies.
 * </p>
 *
 * @since 0.1.0
 */
public final class Params {

	private final List<Map.Entry<String, String>> entries = new ArrayList<>();

	public Params() {
	}

	public Params(Params other) {
		this.entries.addAll(other.entries);
	}

	public Params add(String name, String value) {
		Objects.requireNonNull(name, "name cannot be null");
		Objects.requireNonNull(value, "value cannot be null");
		entries.add(Map.entry(name, value));
		return this;
	}

	public Params addAll(Params other) {
		entries.addAll(other.entries);
		return this;
	}

	/**
	 * Replaces every value of {@code name} with a single value, keeping the position of
	 * the first occurrence.
	 * @param name the parameter name
	 * @param value the new value
	 * @return this instance
	 */
	public Params set(String name, String value) {
		Objects.requireNonNull(value, "value cannot be null");
		int index = indexOf(name);
		if (index < 0) {
			return add(name, value);
		}
		entries.set(index, Map.entry(name, value));
		for (int i = entries.size() - 1; i > index; i--) {
			if (entries.get(i).getKey().equals(name)) {
				entries.remove(i);
			}
		}
		return this;
	}

	public Optional<String> first(String name) {
		int index = indexOf(name);
		return index < 0 ? Optional.empty() : Optional.of(entries.get(index).getValue());
	}

	public List<String> all(String name) {
		return entries.stream().filter(e -> e.getKey().equals(name)).map(Map.Entry::getValue).toList();
	}

	public boolean contains(String name) {
		return indexOf(name) >= 0;
	}

	public Params remove(Collection<String> names) {
		entries.removeIf(e -> names.contains(e.getKey()));
		return this;
	}

	public List<String> names() {
		return entries.stream().map(Map.Entry::getKey).distinct().toList();
	}

	public List<Map.Entry<String, String>> entries() {
		return Collections.unmodifiableList(entries);
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	public int size() {
		return entries.size();
	}

	/**
	 * Renders the parameters as a form-encoded query string without the leading
	 * {@code ?}.
	 * @return the query string, empty when there are no parameters
	 */
	public String toQueryString() {
		return entries.stream()
			.map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
			.collect(Collectors.joining("&"));
	}

	private int indexOf(String name) {
		for (int i = 0; i < entries.size(); i++) {
			if (entries.get(i).getKey().equals(name)) {
				return i;
			}
		}
		return -1;
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		return o instanceof Params other && entries.equals(other.entries);
	}

	@Override
	public int hashCode() {
		return entries.hashCode();
	}

	@Override
	public String toString() {
		return entries.toString();
	}

}
