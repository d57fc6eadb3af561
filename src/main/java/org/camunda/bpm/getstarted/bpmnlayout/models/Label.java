package org.camunda.bpm.getstarted.bpmnlayout.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Label {
    public String text;
    public Double x;
    public Double y;
    public Double width;
    public Double height;

    public Label() {
    }

    public Label(String text) {
        this.text = text;
    }
}
