package org.camunda.bpm.getstarted.bpmnlayout.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.camunda.bpm.getstarted.bpmnlayout.models.BpmnNode;

/**
 * Reads and writes the layout tree as JSON.
 */
public class GraphJson {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true);

    /**
     * @throws IllegalArgumentException if the text is not a valid graph document
     */
    public static BpmnNode read(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Graph JSON is empty");
        }
        try {
            BpmnNode graph = MAPPER.readValue(json, BpmnNode.class);
            if (graph == null) {
                throw new IllegalArgumentException("Graph JSON does not contain an object");
            }
            return graph;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid graph JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static String write(BpmnNode graph) {
        try {
            return MAPPER.writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(String.format("Could not serialize graph '%s'", graph.id), e);
        }
    }

    /**
     * Full copy through the JSON tree model. Engine hints are not copied.
     */
    public static BpmnNode deepCopy(BpmnNode graph) {
        try {
            return MAPPER.treeToValue(MAPPER.valueToTree(graph), BpmnNode.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalStateException(String.format("Could not copy graph '%s'", graph.id), e);
        }
    }
}
