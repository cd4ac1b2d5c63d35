package com.entity.linking.kb;

import org.eclipse.rdf4j.query.Binding;
import org.eclipse.rdf4j.query.BindingSet;
import org.eclipse.rdf4j.query.MalformedQueryException;
import org.eclipse.rdf4j.query.QueryEvaluationException;
import org.eclipse.rdf4j.query.QueryLanguage;
import org.eclipse.rdf4j.query.TupleQuery;
import org.eclipse.rdf4j.query.TupleQueryResult;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.repository.RepositoryConnection;
import org.eclipse.rdf4j.repository.RepositoryException;
import org.eclipse.rdf4j.repository.sparql.SPARQLRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs SPARQL SELECT queries against a remote endpoint through an rdf4j {@link SPARQLRepository}.
 * Each result row is a map of variable name to value; unbound variables are absent.
 *
 * <p>Values supplied in the bindings map are bound with {@link TupleQuery#setBinding}, so labels
 * and identifiers never have to be spliced into the query text by hand.</p>
 */
public class SparqlEndpoint implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SparqlEndpoint.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String endpointUrl;
    private final int maxExecutionSeconds;
    private final SPARQLRepository repository;

    public SparqlEndpoint(String endpointUrl) {
        this(endpointUrl, DEFAULT_TIMEOUT);
    }

    public SparqlEndpoint(String endpointUrl, Duration timeout) {
        this.endpointUrl = Objects.requireNonNull(endpointUrl, "endpointUrl is required");
        this.maxExecutionSeconds = (int) Math.max(1, (timeout != null ? timeout : DEFAULT_TIMEOUT).toSeconds());
        this.repository = new SPARQLRepository(endpointUrl);
        this.repository.init();
        log.info("SPARQL endpoint set up: url={} maxExecutionSeconds={}", endpointUrl, maxExecutionSeconds);
    }

    public List<Map<String, String>> select(String query) {
        return select(query, Map.of());
    }

    /**
     * Runs a SELECT query with the given variable bindings.
     *
     * @throws KnowledgeBaseException on transport failure, rejected query or unreadable results
     */
    public List<Map<String, String>> select(String query, Map<String, Value> bindings) {
        log.debug("SPARQL query against {} bindings={}:\n{}", endpointUrl, bindings, query);

        try (RepositoryConnection connection = repository.getConnection()) {
            TupleQuery tupleQuery = connection.prepareTupleQuery(QueryLanguage.SPARQL, query);
            tupleQuery.setMaxExecutionTime(maxExecutionSeconds);
            bindings.forEach(tupleQuery::setBinding);

            List<Map<String, String>> rows = new ArrayList<>();
            try (TupleQueryResult result = tupleQuery.evaluate()) {
                while (result.hasNext()) {
                    rows.add(toRow(result.next()));
                }
            }
            return rows;
        } catch (QueryEvaluationException e) {
            throw new KnowledgeBaseException("SPARQL query against " + endpointUrl + " failed: " + e.getMessage(), e);
        } catch (MalformedQueryException e) {
            throw new KnowledgeBaseException("SPARQL query rejected by " + endpointUrl + ": " + e.getMessage(), e);
        } catch (RepositoryException e) {
            throw new KnowledgeBaseException("SPARQL endpoint " + endpointUrl + " unavailable: " + e.getMessage(), e);
        }
    }

    static Map<String, String> toRow(BindingSet bindingSet) {
        Map<String, String> row = new LinkedHashMap<>();
        for (Binding binding : bindingSet) {
            if (binding.getValue() != null) {
                row.put(binding.getName(), binding.getValue().stringValue());
            }
        }
        return row;
    }

    public String getEndpointUrl() {
        return endpointUrl;
    }

    @Override
    public void close() {
        repository.shutDown();
    }
}
