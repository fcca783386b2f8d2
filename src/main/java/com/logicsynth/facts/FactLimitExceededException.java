package com.logicsynth.facts;

public class FactLimitExceededException extends RuntimeException {

    public FactLimitExceededException(int limit) {
        super("fact store is full (limit " + limit + ")");
    }
}
