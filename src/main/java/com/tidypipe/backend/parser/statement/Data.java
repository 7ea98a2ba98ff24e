package com.tidypipe.backend.parser.statement;

import com.google.common.base.Preconditions;

/**
 * 数据源：按名字从 DataSource 读取表，找不到时再查 PipelineManager 中已发布的表。
 */
public final class Data implements Transform {
    public final String dataset;

    public Data(String dataset) {
        Preconditions.checkArgument(dataset != null && !dataset.isEmpty(), "dataset name must not be empty");
        this.dataset = dataset;
    }

    @Override
    public String name() {
        return "data";
    }

    @Override
    public boolean isSource() {
        return true;
    }
}
