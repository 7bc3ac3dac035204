package io.netnotes.textarea;

/**
 * Options that cannot be applied: missing dimensions for editing, scrolling
 * or focus, and out-of-range values.
 */
public class ConfigurationException extends TextAreaException {
    public ConfigurationException(String msg) { super(msg); }
    public ConfigurationException(String msg, Throwable cause) { super(msg, cause); }
}
