package com.tidypipe.backend.parser.statement;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * 一组相互依赖的 pipeline，通过 notify / join 交换中间结果。
 */
public final class Program {
    public static final String TAG = "@program";

    private final ImmutableList<Pipeline> pipelines;

    public Program(List<Pipeline> pipelines) {
        this.pipelines = ImmutableList.copyOf(pipelines);
    }

    public static Program of(Pipeline... pipelines) {
        return new Program(ImmutableList.copyOf(pipelines));
    }

    public List<Pipeline> getPipelines() {
        return pipelines;
    }
}
