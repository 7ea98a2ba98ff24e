package com.tidypipe.backend.parser.statement;

import com.google.common.base.Preconditions;

/**
 * 把当前表以 name 发布到 PipelineManager，表本身原样传给下一个操作。
 */
public final class Notify implements Transform {
    public final String target;

    public Notify(String target) {
        Preconditions.checkArgument(target != null && !target.isEmpty(), "notify name must not be empty");
        this.target = target;
    }

    @Override
    public String name() {
        return "notify";
    }
}
