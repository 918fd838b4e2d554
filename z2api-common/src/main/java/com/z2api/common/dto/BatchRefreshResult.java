package com.z2api.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 批量刷新的聚合结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchRefreshResult {

    /** 刷新成功并已写回池中的数量 */
    private int refreshedCount;

    /** 刷新失败（登录失败、任务异常、写回时凭据已不在池中）的数量 */
    private int failedCount;

    /** 参与本次刷新的凭据总数 */
    private int totalCount;

    /** 写回池中的新凭据 */
    @Builder.Default
    private List<String> updatedEntries = new ArrayList<>();

    private String message;

    public static BatchRefreshResult empty() {
        return BatchRefreshResult.builder()
                .message("没有需要刷新的令牌")
                .build();
    }
}
