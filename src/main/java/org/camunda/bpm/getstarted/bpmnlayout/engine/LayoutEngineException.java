package org.camunda.bpm.getstarted.bpmnlayout.engine;

public class LayoutEngineException extends RuntimeException {

    public LayoutEngineException(String message) {
        super(message);
    }

    public LayoutEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
