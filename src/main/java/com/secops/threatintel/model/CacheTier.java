package com.secops.threatintel.model;

/**
 * 结果缓存的物理层
 */
public enum CacheTier {
    /** 进程内 Caffeine */
    LOCAL,
    /** Redis */
    SHARED
}
