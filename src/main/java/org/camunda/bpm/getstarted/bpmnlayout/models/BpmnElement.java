package org.camunda.bpm.getstarted.bpmnlayout.models;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * BPMN metadata attached to a node or an edge (the {@code bpmn} block of the input JSON).
 * <p>
 * Example:
 * {
 * "type": "userTask",
 * "name": "Review order"
 * }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BpmnElement {

    /**
     * Element type in BPMN camel case.
     * Example: "startEvent", "exclusiveGateway", "participant", "sequenceFlow"
     */
    public String type;

    public String name;

    /**
     * Sub-processes only. Expanded sub-processes are laid out as containers.
     */
    public Boolean isExpanded;

    /**
     * Participants only. A black-box pool has no process content.
     */
    public Boolean isBlackBox;

    /**
     * Groups only. Ids of the elements the group surrounds.
     */
    public List<String> groupedElements;

    /**
     * Groups only. Distance between the grouped elements and the group border.
     */
    public Double padding;

    /**
     * Boundary events only. Id of the activity the event is attached to.
     */
    public String attachedToRef;

    // event definitions, conditions and other metadata the layout does not read
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    public BpmnElement() {
    }

    public BpmnElement(String type, String name) {
        this.type = type;
        this.name = name;
    }

    @JsonAnySetter
    public void setAttribute(String key, Object value) {
        attributes.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> attributes() {
        return attributes;
    }
}
