package com.manning.macaroons;

public class CaveatNotSatisfiedException extends MacaroonException {
    private final String condition;

    public CaveatNotSatisfiedException(String condition) {
        super("condition \"" + condition + "\" not met");
        this.condition = condition;
    }

    public String getCondition() {
        return condition;
    }
}
