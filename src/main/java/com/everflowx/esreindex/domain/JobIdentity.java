package com.everflowx.esreindex.domain;

import lombok.Data;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * 任务标识：排序后的源索引集合 + 目标索引。
 * 标识相同的两次运行视为同一个任务。
 * 
 * @author everflowx
 */
@Data
public final class JobIdentity {
    
    private final List<String> sourceSegments;
    
    private final String destination;
    
    public static JobIdentity of(Collection<String> sourceSegments, String destination) {
        return new JobIdentity(Collections.unmodifiableList(sorted(sourceSegments)), destination);
    }
    
    /**
     * 去重并按字典序排序
     */
    static List<String> sorted(Collection<String> segments) {
        if (segments == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>(new TreeSet<>(segments));
    }
}
