package com.tidypipe.backend.parser.statement;

public final class Ungroup implements Transform {
    static final Ungroup INSTANCE = new Ungroup();

    private Ungroup() {
    }

    @Override
    public String name() {
        return "ungroup";
    }
}
