package me.golemcore.analyst.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.analyst.domain.model.SearchRequest;
import me.golemcore.analyst.domain.model.SearchResult;

/**
 * Port for the event search backend queried by the {@code es_search} tool.
 */
public interface SearchPort {

    /**
     * Runs a query and returns up to {@code request.size} matches.
     *
     * @throws SearchBackendException
     *             when the backend is unreachable or rejects the query
     */
    SearchResult search(SearchRequest request);

    /**
     * Checks if a backend endpoint is configured.
     */
    boolean isAvailable();

    /**
     * Failure talking to the search backend. {@code unreachable} separates
     * connectivity problems from queries the backend rejected.
     */
    class SearchBackendException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private final boolean unreachable;

        public SearchBackendException(String message, boolean unreachable, Throwable cause) {
            super(message, cause);
            this.unreachable = unreachable;
        }

        public boolean isUnreachable() {
            return unreachable;
        }
    }
}
