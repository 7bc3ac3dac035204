package io.netnotes.textarea;

public class TextAreaException extends RuntimeException {
    public TextAreaException(String msg) { super(msg); }
    public TextAreaException(String msg, Throwable cause) { super(msg, cause); }
}
