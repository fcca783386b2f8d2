package com.logicsynth.grammar;

/**
 * Rule text that the tokenizer or parser cannot read.
 */
public class ParseException extends RuntimeException {

    private final int position;

    public ParseException(String message, int position) {
        super(message + " at offset " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
