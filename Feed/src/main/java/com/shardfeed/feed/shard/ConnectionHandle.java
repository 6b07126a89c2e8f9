package com.shardfeed.feed.shard;

/**
 * 파티션 커넥션 핸들 (opaque)
 *
 * - 풀 초기화 시 고정 개수로 생성, 재사용만 함
 * - poolGeneration: 같은 id로 다시 추가된 풀의 핸들과 구분
 */
public record ConnectionHandle(String partitionId, int slot, long poolGeneration) {

    @Override
    public String toString() {
        return partitionId + "#" + slot + "@g" + poolGeneration;
    }
}
