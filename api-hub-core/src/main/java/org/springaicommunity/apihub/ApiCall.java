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

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * Builder and executor of a single call of an {@link ApiMethod}.
 *
 * <p>
 * A call collects parameters, scopes, an optional body and a {@link Delegate}, and is
 * consumed by {@link #execute()}. It is not thread-safe and can be executed only once.
 * </p>
 *
 * <pre>{@code
 * ApiResponse<AppDetails> response = hub.newCall(method)
 *     .path("name", "customers/my_customer/apps/android/com.example")
 *     .param("quotaUser", "me")
 *     .execute();
 * }</pre>
 *
 * @param <T> the response type
 * @since 0.1.0
 */
public final class ApiCall<T> {

	private final ApiHub hub;

	private final ApiMethod<T> method;

	private final Params pathParams = new Params();

	private final Params queryParams = new Params();

	private final Params additionalParams = new Params();

	private final Set<String> scopes = new LinkedHashSet<>();

	private boolean scopesOverridden;

	private Object body;

	private Delegate delegate = Delegate.defaults();

	private boolean executed;

	ApiCall(ApiHub hub, ApiMethod<T> method) {
		this.hub = hub;
		this.method = method;
	}

	public ApiMethod<T> method() {
		return method;
	}

	/**
	 * Sets a path parameter, replacing any previous value.
	 * @param name a path parameter of the method
	 * @param value the raw, unencoded value
	 * @return this call
	 * @throws IllegalArgumentException if the method has no such path parameter
	 */
	public ApiCall<T> path(String name, String value) {
		if (!method.pathParameters().contains(name)) {
			throw new IllegalArgumentException("Method " + method.id() + " has no path parameter '" + name
					+ "', expected one of " + method.pathParameters());
		}
		pathParams.set(name, value);
		return this;
	}

	/**
	 * Adds a value for a declared query parameter. Repeating a name sends it several
	 * times.
	 * @param name a query parameter of the method
	 * @param value the value
	 * @return this call
	 * @throws IllegalArgumentException if the method has no such query parameter
	 */
	public ApiCall<T> query(String name, Object value) {
		if (!method.queryParameters().contains(name)) {
			throw new IllegalArgumentException("Method " + method.id() + " has no query parameter '" + name
					+ "', expected one of " + method.queryParameters());
		}
		queryParams.add(name, String.valueOf(value));
		return this;
	}

	/**
	 * Adds an additional parameter such as {@code key}, {@code quotaUser} or
	 * {@code fields}. Names that clash with the method's own fields are rejected with a
	 * {@link FieldClashException} when the call is executed.
	 * @param name the parameter name
	 * @param value the value
	 * @return this call
	 */
	public ApiCall<T> param(String name, String value) {
		additionalParams.add(name, value);
		return this;
	}

	/**
	 * Sets the request body, serialized as JSON.
	 * @param body the body
	 * @return this call
	 */
	public ApiCall<T> body(Object body) {
		if (!method.acceptsBody()) {
			throw new IllegalArgumentException("Method " + method.id() + " does not accept a request body");
		}
		this.body = body;
		return this;
	}

	/**
	 * Adds a scope. The first explicit scope replaces the method's declared scopes.
	 * @param scope the scope URL
	 * @return this call
	 */
	public ApiCall<T> addScope(String scope) {
		Objects.requireNonNull(scope, "scope cannot be null");
		scopesOverridden = true;
		scopes.add(scope);
		return this;
	}

	public ApiCall<T> addScopes(Collection<String> scopeUrls) {
		scopeUrls.forEach(this::addScope);
		return this;
	}

	/**
	 * Removes all scopes, so the call is authenticated with an API key ({@code key}
	 * parameter) instead of a token.
	 * @return this call
	 */
	public ApiCall<T> clearScopes() {
		scopesOverridden = true;
		scopes.clear();
		return this;
	}

	public ApiCall<T> delegate(Delegate delegate) {
		this.delegate = Objects.requireNonNull(delegate, "delegate cannot be null");
		return this;
	}

	/**
	 * Validates the call and freezes it into a request. Nothing is sent.
	 * @return the request
	 * @throws FieldClashException if an additional parameter uses a known field name
	 * @throws IllegalArgumentException if a path parameter is missing
	 * @throws UploadSizeLimitExceededException if the body is larger than the method
	 * allows
	 */
	public ApiRequest toRequest() {
		Set<String> knownFields = method.knownFields();
		for (String name : additionalParams.names()) {
			if (knownFields.contains(name)) {
				throw new FieldClashException(name);
			}
		}
		for (String name : method.pathParameters()) {
			if (!pathParams.contains(name)) {
				throw new IllegalArgumentException("Missing path parameter '" + name + "' for " + method.id());
			}
		}
		byte[] bytes = serializeBody();
		if (bytes != null && method.maxUploadSize() > 0 && bytes.length > method.maxUploadSize()) {
			throw new UploadSizeLimitExceededException(bytes.length, method.maxUploadSize());
		}
		Params orderedPath = new Params();
		for (String name : method.pathParameters()) {
			orderedPath.add(name, pathParams.first(name).orElseThrow());
		}
		return new ApiRequest(method.info(), method.pathTemplate(), orderedPath, queryParams, additionalParams,
				scopesOverridden ? scopes : method.scopes(), bytes);
	}

	/**
	 * Executes the call.
	 * @return the decoded response
	 * @throws ApiException if the call failed
	 * @throws IllegalStateException if the call was already executed
	 */
	public ApiResponse<T> execute() {
		if (executed) {
			throw new IllegalStateException("Call of " + method.id() + " was already executed");
		}
		executed = true;
		return hub.execute(method, toRequest(), delegate);
	}

	private byte[] serializeBody() {
		if (body == null) {
			return null;
		}
		try {
			return hub.objectMapper().writeValueAsBytes(body);
		}
		catch (JsonProcessingException e) {
			throw new ApiException("Failed to serialize request body for " + method.id(), e);
		}
	}

}
