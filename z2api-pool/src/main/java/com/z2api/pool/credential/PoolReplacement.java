package com.z2api.pool.credential;

import lombok.Value;

/**
 * 一次原地替换：把快照中 {@code position} 位置的 {@code oldRaw} 换成刷新后的条目。
 */
@Value
public class PoolReplacement {

    int position;

    String oldRaw;

    CredentialEntry replacement;
}
