package com.everflowx.esreindex.checkpoint;

import com.everflowx.esreindex.domain.ReindexCheckpoint;
import com.everflowx.esreindex.exception.CheckpointCorruptedException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;

/**
 * 根据断点计算下一个要迁移的源索引。
 * 处理顺序固定为源索引名称的字典序，与ES返回索引列表的顺序无关。
 * 
 * @author everflowx
 */
@Component
public class SegmentPlanner {
    
    /**
     * 所有源索引都已迁移、任务进入收尾阶段时写入current_segment的标记
     */
    public static final String EXHAUSTED = "<all-segments-done>";
    
    /**
     * 下一个要迁移的源索引，全部迁移完成时返回空
     *
     * @throws CheckpointCorruptedException 当前索引不在源索引列表中
     */
    public Optional<String> nextSegment(ReindexCheckpoint checkpoint) {
        List<String> segments = checkpoint.getJobIdentity().getSourceSegments();
        String current = checkpoint.getCurrentSegment();
        
        if (!StringUtils.hasLength(current)) {
            return segments.isEmpty() ? Optional.empty() : Optional.of(segments.get(0));
        }
        if (EXHAUSTED.equals(current)) {
            return Optional.empty();
        }
        
        int index = segments.indexOf(current);
        if (index < 0) {
            throw new CheckpointCorruptedException(checkpoint.getId(), current);
        }
        if (index + 1 >= segments.size()) {
            return Optional.empty();
        }
        return Optional.of(segments.get(index + 1));
    }
    
    /**
     * 当前没有运行中的任务且没有下一个源索引时，整个任务完成
     */
    public boolean isJobComplete(ReindexCheckpoint checkpoint, boolean currentTaskRunning) {
        return !currentTaskRunning && !nextSegment(checkpoint).isPresent();
    }
    
    /**
     * 当前索引在排序列表中的位置（从1开始），未开始时为0
     */
    public int position(ReindexCheckpoint checkpoint) {
        List<String> segments = checkpoint.getJobIdentity().getSourceSegments();
        String current = checkpoint.getCurrentSegment();
        if (!StringUtils.hasLength(current)) {
            return 0;
        }
        if (EXHAUSTED.equals(current)) {
            return segments.size();
        }
        int index = segments.indexOf(current);
        if (index < 0) {
            throw new CheckpointCorruptedException(checkpoint.getId(), current);
        }
        return index + 1;
    }
}
