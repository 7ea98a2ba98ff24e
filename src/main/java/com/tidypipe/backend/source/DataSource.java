package com.tidypipe.backend.source;

import java.util.Set;

import com.tidypipe.backend.value.Table;
import com.tidypipe.common.PipelineException;

/**
 * 外部数据获取的协作接口。加载是阻塞调用，必须在 pipeline 第一个操作之前完成。
 */
public interface DataSource {

    boolean contains(String name);

    /**
     * 按名字加载一张完整的表。
     *
     * @throws PipelineException 名字未知时为 UNKNOWN_DATASET
     */
    Table load(String name) throws PipelineException;

    Set<String> names();
}
