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

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, validated description of one call, produced by {@link ApiCall}.
 *
 * <p>
 * Parameters are serialized in a fixed order: path parameters, declared query
 * parameters, additional parameters, then {@code alt=json}.
 * </p>
 *
 * @since 0.1.0
 */
public final class ApiRequest {

	private final MethodInfo methodInfo;

	private final String pathTemplate;

	private final Params pathParams;

	private final Params queryParams;

	private final Params additionalParams;

	private final Set<String> scopes;

	private final byte[] body;

	ApiRequest(MethodInfo methodInfo, String pathTemplate, Params pathParams, Params queryParams,
			Params additionalParams, Set<String> scopes, byte[] body) {
		this.methodInfo = methodInfo;
		this.pathTemplate = pathTemplate;
		this.pathParams = new Params(pathParams);
		this.queryParams = new Params(queryParams);
		this.additionalParams = new Params(additionalParams);
		this.scopes = Set.copyOf(new LinkedHashSet<>(scopes));
		this.body = body != null ? body.clone() : null;
	}

	public MethodInfo methodInfo() {
		return methodInfo;
	}

	public String pathTemplate() {
		return pathTemplate;
	}

	public Set<String> scopes() {
		return scopes;
	}

	public Optional<byte[]> body() {
		return Optional.ofNullable(body).map(byte[]::clone);
	}

	/**
	 * Gets every parameter of the call in serialization order, {@code alt=json} last.
	 * @return a fresh copy of the parameters
	 */
	public Params params() {
		return new Params(pathParams).addAll(queryParams).addAll(additionalParams).add(ApiMethod.ALT, "json");
	}

	public boolean hasParam(String name) {
		return pathParams.contains(name) || queryParams.contains(name) || additionalParams.contains(name);
	}

	/**
	 * Builds the request URL.
	 * @param baseUrl the API base URL, ending with {@code /}
	 * @return the expanded URL with its query string
	 */
	public String url(String baseUrl) {
		Params params = params();
		String path = UrlTemplate.expand(pathTemplate, params);
		return baseUrl + path + "?" + params.toQueryString();
	}

	@Override
	public String toString() {
		return methodInfo.httpMethod() + " " + methodInfo.id() + " " + params().names();
	}

}
