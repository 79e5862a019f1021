package com.everflowx.esreindex.exception;

/**
 * 断点数据损坏：当前索引不在源索引集合中。不可恢复，不做任何猜测性修复。
 * 
 * @author everflowx
 */
public class CheckpointCorruptedException extends EsReindexException {
    
    public CheckpointCorruptedException(String checkpointId, String currentSegment) {
        super("CHECKPOINT_CORRUPTED",
              String.format("断点 %s 已损坏: 当前索引 %s 不在源索引列表中", checkpointId, currentSegment),
              currentSegment);
    }
}
