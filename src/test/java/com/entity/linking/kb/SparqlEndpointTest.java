package com.entity.linking.kb;

import org.eclipse.rdf4j.model.util.Values;
import org.eclipse.rdf4j.query.impl.MapBindingSet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SparqlEndpoint Tests")
class SparqlEndpointTest {

    private final SparqlEndpoint endpoint = new SparqlEndpoint("http://localhost:1/sparql", Duration.ofSeconds(2));

    @AfterEach
    void tearDown() {
        endpoint.close();
    }

    @Test
    @DisplayName("Binding sets become maps of variable to string value")
    void rowFromBindingSet() {
        MapBindingSet bindingSet = new MapBindingSet();
        bindingSet.addBinding("uri", Values.iri("http://dbpedia.org/resource/Apple"));
        bindingSet.addBinding("abstract", Values.literal("The apple is a fruit", "en"));

        Map<String, String> row = SparqlEndpoint.toRow(bindingSet);

        assertEquals("http://dbpedia.org/resource/Apple", row.get("uri"));
        assertEquals("The apple is a fruit", row.get("abstract"));
        assertFalse(row.containsKey("type"));
    }

    @Test
    @DisplayName("Connection failure raises KnowledgeBaseException")
    void connectionFailure() {
        assertThrows(KnowledgeBaseException.class, () -> endpoint.select("SELECT * WHERE { ?s ?p ?o } LIMIT 1"));
    }

    @Test
    @DisplayName("Connection failure with bindings raises KnowledgeBaseException")
    void connectionFailureWithBindings() {
        assertThrows(KnowledgeBaseException.class, () -> endpoint.select(
                "SELECT ?uri WHERE { ?uri ?p ?name } LIMIT 1",
                Map.of("name", Values.literal("Say \"hi\"", "en"))));
    }

    @Test
    @DisplayName("Endpoint URL is exposed")
    void endpointUrl() {
        assertEquals("http://localhost:1/sparql", endpoint.getEndpointUrl());
    }
}
