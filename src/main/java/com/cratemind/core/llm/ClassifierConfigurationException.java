package com.cratemind.core.llm;

/**
 * Thrown when the classifier cannot be constructed: unsupported provider,
 * missing credential, or an invalid batch size or retry budget.
 */
public class ClassifierConfigurationException extends RuntimeException {

    public ClassifierConfigurationException(String message) {
        super(message);
    }
}
