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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;

/**
 * Describes one REST operation of an API.
 *
 * <p>
 * A method is immutable and shared: calls are created from it with
 * {@link ApiHub#newCall(ApiMethod)}. Path parameter names are derived from the path
 * template, in order of appearance.
 * </p>
 *
 * @param <T> the response type
 * @since 0.1.0
 */
public final class ApiMethod<T> {

	/** Parameter always added to the query string, so never usable as an extra one. */
	public static final String ALT = "alt";

	private final String id;

	private final String httpMethod;

	private final String pathTemplate;

	private final List<String> pathParameters;

	private final List<String> queryParameters;

	private final Set<String> scopes;

	private final JavaType responseType;

	private final boolean acceptsBody;

	private final long maxUploadSize;

	private ApiMethod(Builder<T> builder) {
		this.id = Objects.requireNonNull(builder.id, "id cannot be null");
		this.httpMethod = Objects.requireNonNull(builder.httpMethod, "httpMethod cannot be null");
		this.pathTemplate = Objects.requireNonNull(builder.pathTemplate, "pathTemplate cannot be null");
		this.pathParameters = List.copyOf(UrlTemplate.variableNames(builder.pathTemplate));
		this.queryParameters = List.copyOf(builder.queryParameters);
		this.scopes = Set.copyOf(builder.scopes);
		this.responseType = builder.responseType;
		this.acceptsBody = builder.acceptsBody;
		this.maxUploadSize = builder.maxUploadSize;
		for (String name : queryParameters) {
			if (pathParameters.contains(name) || ALT.equals(name)) {
				throw new IllegalArgumentException("Query parameter '" + name + "' of " + id + " is already a known field");
			}
		}
	}

	public String id() {
		return id;
	}

	public String httpMethod() {
		return httpMethod;
	}

	public String pathTemplate() {
		return pathTemplate;
	}

	public List<String> pathParameters() {
		return pathParameters;
	}

	public List<String> queryParameters() {
		return queryParameters;
	}

	/**
	 * Gets the scopes a call of this method requests unless it overrides them.
	 * @return the scopes, possibly empty
	 */
	public Set<String> scopes() {
		return scopes;
	}

	public JavaType responseType() {
		return responseType;
	}

	public boolean acceptsBody() {
		return acceptsBody;
	}

	/**
	 * Gets the largest request body accepted, or {@code 0} when unlimited.
	 * @return the limit in bytes
	 */
	public long maxUploadSize() {
		return maxUploadSize;
	}

	/**
	 * Gets the names additional parameters may not use: {@code alt}, the path
	 * parameters and the declared query parameters.
	 * @return the statically known field names
	 */
	public Set<String> knownFields() {
		Set<String> fields = new LinkedHashSet<>();
		fields.add(ALT);
		fields.addAll(pathParameters);
		fields.addAll(queryParameters);
		return fields;
	}

	public MethodInfo info() {
		return new MethodInfo(id, httpMethod);
	}

	@Override
	public String toString() {
		return id + " (" + httpMethod + " " + pathTemplate + ")";
	}

	public static <T> Builder<T> builder(Class<T> responseType) {
		return new Builder<>(TypeFactory.defaultInstance().constructType(responseType));
	}

	public static <T> Builder<T> builder(JavaType responseType) {
		return new Builder<>(responseType);
	}

	public static final class Builder<T> {

		private final JavaType responseType;

		private String id;

		private String httpMethod = "GET";

		private String pathTemplate;

		private final List<String> queryParameters = new ArrayList<>();

		private final Set<String> scopes = new LinkedHashSet<>();

		private boolean acceptsBody;

		private long maxUploadSize;

		private Builder(JavaType responseType) {
			this.responseType = Objects.requireNonNull(responseType, "responseType cannot be null");
		}

		public Builder<T> id(String id) {
			this.id = id;
			return this;
		}

		public Builder<T> httpMethod(String httpMethod) {
			this.httpMethod = httpMethod;
			return this;
		}

		public Builder<T> path(String pathTemplate) {
			this.pathTemplate = pathTemplate;
			return this;
		}

		public Builder<T> queryParameters(String... names) {
			this.queryParameters.addAll(Arrays.asList(names));
			return this;
		}

		public Builder<T> scopes(String... scopes) {
			this.scopes.addAll(Arrays.asList(scopes));
			return this;
		}

		public Builder<T> acceptsBody(boolean acceptsBody) {
			this.acceptsBody = acceptsBody;
			return this;
		}

		public Builder<T> maxUploadSize(long maxUploadSize) {
			this.maxUploadSize = maxUploadSize;
			return this;
		}

		public ApiMethod<T> build() {
			return new ApiMethod<>(this);
		}

	}

}
