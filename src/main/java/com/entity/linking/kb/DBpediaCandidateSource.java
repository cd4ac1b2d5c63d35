package com.entity.linking.kb;

import com.entity.linking.core.model.CandidateEntity;
import com.entity.linking.core.model.ContextSignal;
import org.eclipse.rdf4j.common.net.ParsedIRI;
import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.util.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * DBpedia knowledge base, queried through its public SPARQL endpoint.
 *
 * <p>Candidates are resources whose English {@code rdfs:label} equals the label exactly.
 * Every {@code rdf:type} of a resource is collected into its raw type, and the English
 * {@code dbo:abstract} becomes its raw description, so the scorer can use both.</p>
 *
 * <p>Labels and identifiers are passed to the endpoint as query bindings, never spliced into
 * the query text.</p>
 */
public class DBpediaCandidateSource implements CandidateSource {
    private static final Logger log = LoggerFactory.getLogger(DBpediaCandidateSource.class);

    public static final String NAME = "DBpedia";
    public static final String DEFAULT_ENDPOINT = "https://dbpedia.org/sparql";

    // rdf:type produces one row per type, so rows are fetched generously and grouped per resource
    private static final int ROWS_PER_CANDIDATE = 50;
    private static final int ENTITY_INFO_LIMIT = 200;

    private static final String PREFIXES = """
            PREFIX rdfs: <http://www.w3.org/2000/01/rdf-schema#>
            PREFIX rdf: <http://www.w3.org/1999/02/22-rdf-syntax-ns#>
            PREFIX dbo: <http://dbpedia.org/ontology/>
            """;

    private final SparqlEndpoint endpoint;

    public DBpediaCandidateSource() {
        this(new SparqlEndpoint(DEFAULT_ENDPOINT));
    }

    public DBpediaCandidateSource(SparqlEndpoint endpoint) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint is required");
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<CandidateEntity> search(String label, ContextSignal contextSignal, int limit) {
        try {
            List<Map<String, String>> rows = endpoint.select(buildSearchQuery(limit), searchBindings(label));
            List<CandidateEntity> candidates = groupCandidates(rows, label);
            log.debug("DBpedia search '{}' returned {} candidates", label, candidates.size());
            return candidates.size() > limit ? candidates.subList(0, limit) : candidates;
        } catch (KnowledgeBaseException e) {
            log.warn("kb.search.failed knowledgeBase={} label='{}' error={}", NAME, label, e.getMessage());
            return List.of();
        }
    }

    @Override
    public Map<String, List<CandidateEntity>> lookup(List<String> labels, int limitPerLabel) {
        if (labels.isEmpty()) {
            return Map.of();
        }
        List<Map<String, String>> rows = endpoint.select(buildLookupQuery(labels.size()), lookupBindings(labels));

        Map<String, List<Map<String, String>>> rowsByLabel = new LinkedHashMap<>();
        for (Map<String, String> row : rows) {
            String label = row.get("canonical_name");
            if (label != null) {
                rowsByLabel.computeIfAbsent(label, k -> new ArrayList<>()).add(row);
            }
        }

        Map<String, List<CandidateEntity>> results = new LinkedHashMap<>();
        for (Map.Entry<String, List<Map<String, String>>> entry : rowsByLabel.entrySet()) {
            List<CandidateEntity> candidates = groupCandidates(entry.getValue(), entry.getKey());
            results.put(entry.getKey(), candidates.size() > limitPerLabel
                    ? candidates.subList(0, limitPerLabel) : candidates);
        }
        log.debug("DBpedia lookup of {} labels matched {}", labels.size(), results.size());
        return results;
    }

    @Override
    public Optional<Map<String, List<String>>> getEntityInfo(String identifier) {
        IRI entity = toIri(identifier);
        String query = "SELECT ?p ?o WHERE {\n  ?entity ?p ?o .\n} LIMIT " + ENTITY_INFO_LIMIT;
        try {
            List<Map<String, String>> rows = endpoint.select(query, Map.of("entity", entity));
            if (rows.isEmpty()) {
                return Optional.empty();
            }
            Map<String, List<String>> info = new LinkedHashMap<>();
            for (Map<String, String> row : rows) {
                if (row.containsKey("p") && row.containsKey("o")) {
                    info.computeIfAbsent(row.get("p"), k -> new ArrayList<>()).add(row.get("o"));
                }
            }
            return Optional.of(info);
        } catch (KnowledgeBaseException e) {
            log.warn("kb.info.failed knowledgeBase={} identifier={} error={}", NAME, identifier, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Parses an identifier as an absolute IRI.
     *
     * @throws IllegalArgumentException if it is blank, relative, or not a valid IRI
     */
    static IRI toIri(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("IRI must not be null or blank");
        }
        ParsedIRI parsed = ParsedIRI.create(identifier);
        if (!parsed.isAbsolute()) {
            throw new IllegalArgumentException("IRI must be absolute: '" + identifier + "'");
        }
        return Values.iri(identifier);
    }

    static Map<String, Value> searchBindings(String label) {
        return Map.of("name", Values.literal(label, "en"));
    }

    static Map<String, Value> lookupBindings(List<String> labels) {
        Map<String, Value> bindings = new LinkedHashMap<>();
        for (int i = 0; i < labels.size(); i++) {
            bindings.put("label" + i, Values.literal(labels.get(i), "en"));
        }
        return bindings;
    }

    String buildSearchQuery(int limit) {
        return PREFIXES + """
                SELECT DISTINCT ?uri ?type ?abstract WHERE {
                  ?uri rdfs:label ?name .
                  OPTIONAL { ?uri rdf:type ?type . }
                  OPTIONAL {
                    ?uri dbo:abstract ?abstract .
                    FILTER (lang(?abstract) = 'en')
                  }
                } LIMIT %d
                """.formatted(limit * ROWS_PER_CANDIDATE);
    }

    // one UNION branch per label; ?labelN is bound by lookupBindings
    String buildLookupQuery(int labelCount) {
        String branches = IntStream.range(0, labelCount)
                .mapToObj(i -> "  { ?uri rdfs:label ?label%d . BIND (?label%d AS ?canonical_name) }".formatted(i, i))
                .collect(Collectors.joining("\n  UNION\n"));
        return PREFIXES + """
                SELECT ?canonical_name ?uri ?type ?abstract WHERE {
                %s
                  OPTIONAL { ?uri rdf:type ?type . }
                  OPTIONAL {
                    ?uri dbo:abstract ?abstract .
                    FILTER (lang(?abstract) = 'en')
                  }
                }
                """.formatted(branches);
    }

    /**
     * Groups result rows by resource URI in first-arrival order, joining all types of a resource.
     */
    List<CandidateEntity> groupCandidates(List<Map<String, String>> rows, String label) {
        Map<String, CandidateAccumulator> byUri = new LinkedHashMap<>();
        for (Map<String, String> row : rows) {
            String uri = row.get("uri");
            if (uri == null) {
                continue;
            }
            CandidateAccumulator acc = byUri.computeIfAbsent(uri, key -> new CandidateAccumulator(key, label));
            acc.add(row);
        }
        List<CandidateEntity> candidates = new ArrayList<>(byUri.size());
        for (CandidateAccumulator acc : byUri.values()) {
            candidates.add(acc.build());
        }
        return candidates;
    }

    private static final class CandidateAccumulator {
        private final String uri;
        private final Set<String> types = new LinkedHashSet<>();
        private final String label;
        private String description;

        CandidateAccumulator(String uri, String label) {
            this.uri = uri;
            this.label = label;
        }

        void add(Map<String, String> row) {
            if (description == null) {
                description = row.get("abstract");
            }
            String type = row.get("type");
            if (type != null) {
                types.add(type);
            }
        }

        CandidateEntity build() {
            return CandidateEntity.builder()
                    .identifier(uri)
                    .label(label)
                    .rawType(types.isEmpty() ? null : String.join(" ", types))
                    .rawDescription(description)
                    .knowledgeBase(NAME)
                    .build();
        }
    }
}
