package com.tidypipe.backend.parser.statement;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;

/**
 * 有序的表级操作序列，构造后不可变。
 */
public final class Pipeline {
    private final ImmutableList<Transform> transforms;

    public Pipeline(List<? extends Transform> transforms) {
        this.transforms = ImmutableList.copyOf(transforms);
    }

    public static Pipeline of(Transform... transforms) {
        return new Pipeline(ImmutableList.copyOf(transforms));
    }

    public List<Transform> getTransforms() {
        return transforms;
    }

    public int size() {
        return transforms.size();
    }

    /**
     * 该 pipeline 在运行前必须已经发布的表名（join 的两个输入）。
     */
    public Set<String> requires() {
        Set<String> names = new LinkedHashSet<>();
        Set<String> published = new LinkedHashSet<>();
        for (Transform t : transforms) {
            if(t instanceof Join) {
                Join join = (Join) t;
                if(!published.contains(join.leftName)) {
                    names.add(join.leftName);
                }
                if(!published.contains(join.rightName)) {
                    names.add(join.rightName);
                }
            } else if(t instanceof Notify) {
                published.add(((Notify) t).target);
            }
        }
        return names;
    }

    /**
     * 该 pipeline 通过 notify 发布的表名。
     */
    public Set<String> produces() {
        Set<String> names = new LinkedHashSet<>();
        for (Transform t : transforms) {
            if(t instanceof Notify) {
                names.add(((Notify) t).target);
            }
        }
        return names;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Transform t : transforms) {
            if(sb.length() > 0) {
                sb.append(" -> ");
            }
            sb.append(t.name());
        }
        return sb.toString();
    }
}
