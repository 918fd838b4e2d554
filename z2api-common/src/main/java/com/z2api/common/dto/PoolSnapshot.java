package com.z2api.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 凭据池在某一时刻的状态，供管理接口展示。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolSnapshot {

    /** 池中全部凭据，按轮询顺序 */
    private List<String> entries;

    /** 当前被标记为失败的凭据，按池中顺序 */
    private List<String> failedEntries;

    private int count;

    private int failedCount;
}
