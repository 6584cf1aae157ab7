package com.secops.threatintel.model;

/**
 * 结果缓存级别，决定 TTL 以及写入哪一层
 */
public enum CachingTier {
    NORMAL,
    EXTENDED,
    AGGRESSIVE
}
