package com.z2api.pool.service;

import lombok.Value;

/**
 * 一轮恢复检查的结果。
 */
@Value
public class RecoveryReport {

    public static final RecoveryReport NOTHING_TO_CHECK = new RecoveryReport(0, 0, 0, 0);

    /** 本轮检查的失败凭据数 */
    int checked;

    /** 恢复可用的数量（直接探测通过或刷新后探测通过） */
    int recovered;

    /** 重新登录成功的数量 */
    int refreshed;

    /** 永久淘汰的数量 */
    int evicted;
}
